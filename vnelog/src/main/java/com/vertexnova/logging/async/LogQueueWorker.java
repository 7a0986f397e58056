/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.logging.async;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import com.vertexnova.base.ExceptionUtils;
import com.vertexnova.logging.Logger;

/**
 * Owns the single background thread which drains a LogQueue.
 * <p>
 * Tasks are only ever removed from the queue while holding the execution lock, and they run to completion before it is
 * released. That is what allows flush() to act as a barrier: once the caller of flush() holds the lock and sees an empty
 * queue, no previously queued task can still be in flight on the worker thread.
 * <br>
 * The worker can be stopped and started again any number of times. Stopping does not drain the queue.
 */
public class LogQueueWorker
{
	private final LogQueue queue;
	private final String name;
	private final int batchSize;
	private final ReentrantLock execLock = new ReentrantLock();

	private volatile boolean running;
	private volatile Thread workerThread;

	public LogQueueWorker(LogQueue queue) {
		this(queue, "vnelog-worker", LogQueue.DFLT_DRAIN_MAX);
	}

	public LogQueueWorker(LogQueue queue, String name, int batchSize) {
		if (queue == null) throw new IllegalArgumentException("LogQueueWorker requires a queue");
		this.queue = queue;
		this.name = name;
		this.batchSize = Math.max(batchSize, 1);
	}

	public LogQueue getQueue() {return queue;}
	public boolean isRunning() {return running;}

	/**
	 * Spawns the worker thread. Returns false, and does nothing, if the worker is already running.
	 */
	public synchronized boolean start()
	{
		if (running) return false;
		running = true;
		Thread thrd = new Thread(this::runWorker, name);
		thrd.setDaemon(true);
		workerThread = thrd;
		thrd.start();
		return true;
	}

	/**
	 * Signals the worker thread to exit and waits for it to do so.
	 * Tasks still in the queue are left there. It is safe to call this if the worker was never started, or has already stopped.
	 */
	public synchronized void stop()
	{
		running = false;
		Thread thrd = workerThread;
		if (thrd == null || !thrd.isAlive()) return;
		queue.pushUnbounded(() -> {}); //wake up the worker, if it is waiting for tasks
		workerThread = null;
		if (thrd == Thread.currentThread()) return; //can't join ourself, the loop exits once this task returns
		waitStopped(thrd);
	}

	/**
	 * Executes queued tasks on the calling thread until the queue is empty.
	 * On return, every task queued before this call has finished executing.
	 */
	public void flush()
	{
		execLock.lock();
		try {
			Runnable task;
			while ((task = queue.poll()) != null) {
				execute(task);
			}
		} finally {
			execLock.unlock();
		}
	}

	private void runWorker()
	{
		Thread thrd = Thread.currentThread();
		try {
			// a thread which has been superseded by a stop/start cycle exits even though running is true again
			while (running && workerThread == thrd) {
				try {
					queue.awaitNotEmpty();
				} catch (InterruptedException ex) {
					continue; //loop condition decides whether we are still wanted
				}
				execLock.lock();
				try {
					List<Runnable> batch = queue.poll(batchSize);
					for (int idx = 0; idx != batch.size(); idx++) {
						execute(batch.get(idx));
					}
				} finally {
					execLock.unlock();
				}
			}
		} finally {
			// must not synchronize, as stop() holds the monitor while joining us. running is cleared last.
			if (workerThread == thrd) {
				workerThread = null;
				running = false;
			}
		}
	}

	// Nothing a task throws is allowed past this point, whether we are on the worker thread or a flushing caller
	private void execute(Runnable task)
	{
		try {
			task.run();
		} catch (Throwable ex) {
			String sev = (ExceptionUtils.isFatal(ex) ? " with fatal error" : "");
			System.err.println(Logger.DIAGMARK+"Worker="+name+" task failed"+sev+" - "+ExceptionUtils.summary(ex, true));
		}
	}

	private static void waitStopped(Thread thrd)
	{
		boolean interrupted = false;
		boolean done = false;
		do {
			try {
				thrd.join();
				done = true;
			} catch (InterruptedException ex) {
				interrupted = true;
			}
		} while (!done);
		if (interrupted) Thread.currentThread().interrupt();
	}

	@Override
	public String toString() {
		return getClass().getSimpleName()+"/"+name+"[running="+running+", "+queue+"]";
	}
}

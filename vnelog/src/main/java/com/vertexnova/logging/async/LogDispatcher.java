/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.logging.async;

import java.util.List;

import com.vertexnova.base.ExceptionUtils;
import com.vertexnova.logging.LogEvent;
import com.vertexnova.logging.Logger;
import com.vertexnova.logging.sinks.LogSink;

/**
 * Delivers log events to sinks on a background thread.
 * <br>
 * The worker thread is started when the dispatcher is constructed and stopped by close(). Callers are expected to
 * flush before closing, as close() does not drain pending events.
 */
public class LogDispatcher
	implements java.io.Closeable
{
	private final LogQueue queue;
	private final LogQueueWorker worker;

	public LogDispatcher(String name) {
		this(name, new LogQueue());
	}

	public LogDispatcher(String name, LogQueue queue) {
		this.queue = queue;
		worker = new LogQueueWorker(queue, "vnelog-"+name, LogQueue.DFLT_DRAIN_MAX);
		worker.start();
	}

	public LogQueue getQueue() {return queue;}
	public LogQueueWorker getWorker() {return worker;}

	/**
	 * Queues the writing of the event to each sink in turn, and returns without waiting.
	 * The sink list is captured by reference, so it must be safe to iterate while other threads add to it.
	 */
	public void dispatch(List<LogSink> sinks, LogEvent evt)
	{
		queue.push(() -> {
			for (int idx = 0; idx != sinks.size(); idx++) {
				LogSink sink = sinks.get(idx);
				try {
					sink.write(evt);
				} catch (Throwable ex) {
					if (ExceptionUtils.isFatal(ex)) throw (Error)ex;
					System.err.println(Logger.DIAGMARK+"Sink="+sink+" failed to write "+evt+" - "+ExceptionUtils.summary(ex));
				}
			}
		});
	}

	/**
	 * Runs every pending task, then flushes each sink, all on the calling thread.
	 */
	public void flush(List<LogSink> sinks)
	{
		worker.flush();
		for (int idx = 0; idx != sinks.size(); idx++) {
			LogSink sink = sinks.get(idx);
			try {
				sink.flush();
			} catch (Throwable ex) {
				if (ExceptionUtils.isFatal(ex)) throw (Error)ex;
				System.err.println(Logger.DIAGMARK+"Sink="+sink+" failed to flush - "+ExceptionUtils.summary(ex));
			}
		}
	}

	/**
	 * Schedules an arbitrary task on the worker thread, behind any events already queued.
	 */
	public void submit(Runnable task)
	{
		queue.push(task);
	}

	@Override
	public void close()
	{
		worker.stop();
	}

	@Override
	public String toString() {
		return getClass().getSimpleName()+"["+worker+"]";
	}
}

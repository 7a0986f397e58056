/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.logging.async;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FIFO queue of pending tasks, shared by any number of producers and a single consumer.
 * <br>
 * Producers never block. The queue is unbounded by default, but it can be given a capacity, in which case the overflow
 * policy decides which task is discarded when a producer pushes onto a full queue.
 * <p>
 * This class is MT-safe.
 */
public class LogQueue
{
	public enum OverflowPolicy {DISCARD_OLDEST, DISCARD_NEWEST}

	public static final int DFLT_DRAIN_MAX = 32;

	private final ArrayDeque<Runnable> tasks = new ArrayDeque<>();
	private final ReentrantLock lock = new ReentrantLock();
	private final Condition notEmpty = lock.newCondition();
	private final int capacity;
	private final OverflowPolicy overflowPolicy;
	private long droppedCount; //guarded by lock

	public LogQueue() {
		this(0, OverflowPolicy.DISCARD_OLDEST);
	}

	/**
	 * @param capacity Zero means unbounded
	 * @param policy Which task to discard when a push finds the queue at capacity
	 */
	public LogQueue(int capacity, OverflowPolicy policy) {
		if (capacity < 0) throw new IllegalArgumentException("LogQueue capacity cannot be negative - "+capacity);
		this.capacity = capacity;
		this.overflowPolicy = (policy == null ? OverflowPolicy.DISCARD_OLDEST : policy);
	}

	public int getCapacity() {return capacity;}
	public OverflowPolicy getOverflowPolicy() {return overflowPolicy;}

	/**
	 * Appends a task and wakes the consumer.
	 * Returns false if the task was discarded because the queue is full and the policy is DISCARD_NEWEST.
	 */
	public boolean push(Runnable task)
	{
		return push(task, true);
	}

	// Wake-up tasks must never be lost, so they bypass the capacity check
	boolean pushUnbounded(Runnable task)
	{
		return push(task, false);
	}

	private boolean push(Runnable task, boolean bounded)
	{
		if (task == null) throw new IllegalArgumentException("Cannot queue null task");
		lock.lock();
		try {
			if (bounded && capacity != 0 && tasks.size() >= capacity) {
				droppedCount++;
				if (overflowPolicy == OverflowPolicy.DISCARD_NEWEST) return false;
				tasks.pollFirst();
			}
			tasks.addLast(task);
			notEmpty.signal();
			return true;
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Removes and returns the oldest task, waiting for one to arrive if necessary.
	 */
	public Runnable pop() throws InterruptedException
	{
		lock.lock();
		try {
			while (tasks.isEmpty()) {
				notEmpty.await();
			}
			return tasks.pollFirst();
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Waits until at least one task is present, then removes up to maxItems tasks in FIFO order.
	 */
	public List<Runnable> drain(int maxItems) throws InterruptedException
	{
		lock.lock();
		try {
			while (tasks.isEmpty()) {
				notEmpty.await();
			}
			return take(maxItems);
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Non-blocking variant of pop(). Returns null if the queue is empty.
	 */
	public Runnable poll()
	{
		lock.lock();
		try {
			return tasks.pollFirst();
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Non-blocking variant of drain(). Returns an empty list if the queue is empty.
	 */
	public List<Runnable> poll(int maxItems)
	{
		lock.lock();
		try {
			return take(maxItems);
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Waits until the queue is non-empty, without removing anything.
	 */
	public void awaitNotEmpty() throws InterruptedException
	{
		lock.lock();
		try {
			while (tasks.isEmpty()) {
				notEmpty.await();
			}
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Point-in-time snapshot, which may be stale by the time the caller acts on it.
	 */
	public boolean empty()
	{
		lock.lock();
		try {
			return tasks.isEmpty();
		} finally {
			lock.unlock();
		}
	}

	public int size()
	{
		lock.lock();
		try {
			return tasks.size();
		} finally {
			lock.unlock();
		}
	}

	public long getDroppedCount()
	{
		lock.lock();
		try {
			return droppedCount;
		} finally {
			lock.unlock();
		}
	}

	// caller holds lock
	private List<Runnable> take(int maxItems)
	{
		int cnt = Math.min(Math.max(maxItems, 1), tasks.size());
		List<Runnable> batch = new ArrayList<>(cnt);
		for (int idx = 0; idx != cnt; idx++) {
			batch.add(tasks.pollFirst());
		}
		return batch;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName()+"[size="+size()+", capacity="+(capacity == 0 ? "unbounded" : capacity)
				+"/"+overflowPolicy+", dropped="+getDroppedCount()+"]";
	}
}

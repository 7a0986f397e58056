/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.logging;

import com.vertexnova.logging.async.LogDispatcher;
import com.vertexnova.logging.async.LogQueue;

/**
 * Hands events to a background thread, so log() normally returns without waiting for any I/O.
 * <br>
 * An event at or above the flush level is the exception: log() then blocks until the queue has been drained and the sinks
 * flushed, so that the event has reached its destination by the time the caller proceeds.
 * <br>
 * Events from any one thread are written in the order they were logged.
 */
public class AsyncLogger
	extends Logger
{
	private final LogDispatcher dispatcher;

	public AsyncLogger(String name) {
		this(name, new LogQueue());
	}

	public AsyncLogger(String name, LogQueue queue) {
		super(name);
		dispatcher = new LogDispatcher(name, queue);
	}

	public LogDispatcher getDispatcher() {return dispatcher;}

	@Override
	public boolean isAsync() {return true;}

	@Override
	public void log(LogEvent evt)
	{
		if (!isActive(evt.getLevel()) || isClosed()) return;
		dispatcher.dispatch(sinks(), evt);
		if (evt.getLevel().isAtLeast(getFlushLevel())) dispatcher.flush(sinks());
	}

	@Override
	public void flush()
	{
		dispatcher.flush(sinks());
	}

	// stop the worker before the sinks get closed, so that it cannot write to a closed sink
	@Override
	protected void shutdown()
	{
		dispatcher.close();
		dispatcher.flush(sinks()); //anything which slipped in between the final flush and the worker stopping
	}

	@Override
	public AsyncLogger clone(String newName)
	{
		LogQueue q = dispatcher.getQueue();
		AsyncLogger log = new AsyncLogger(newName, new LogQueue(q.getCapacity(), q.getOverflowPolicy()));
		log.setCurrentLogLevel(getCurrentLogLevel());
		log.setFlushLevel(getFlushLevel());
		return log;
	}
}

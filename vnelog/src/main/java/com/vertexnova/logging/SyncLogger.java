/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.logging;

/**
 * Writes each event to its sinks on the calling thread, before log() returns.
 * <br>
 * Callers are serialised on this logger's monitor, so the lines written by concurrent threads never interleave.
 */
public class SyncLogger
	extends Logger
{
	public SyncLogger(String name) {
		super(name);
	}

	@Override
	public boolean isAsync() {return false;}

	@Override
	public void log(LogEvent evt)
	{
		if (!isActive(evt.getLevel()) || isClosed()) return;
		synchronized (this) {
			writeSinks(evt);
			if (evt.getLevel().isAtLeast(getFlushLevel())) flushSinks();
		}
	}

	@Override
	public synchronized void flush()
	{
		flushSinks();
	}

	@Override
	public SyncLogger clone(String newName)
	{
		SyncLogger log = new SyncLogger(newName);
		log.setCurrentLogLevel(getCurrentLogLevel());
		log.setFlushLevel(getFlushLevel());
		return log;
	}
}

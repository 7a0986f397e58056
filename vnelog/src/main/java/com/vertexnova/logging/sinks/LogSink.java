/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.logging.sinks;

import com.vertexnova.logging.LogEvent;

/**
 * Output destination for log events. Each sink formats events according to its own pattern.
 * <br>
 * Sinks owned by an AsyncLogger are only ever invoked by one thread at a time, but sinks owned by a SyncLogger may be shared
 * with other loggers, so implementations should not assume single-threaded access.
 */
public interface LogSink
	extends java.io.Closeable, java.io.Flushable
{
	void write(LogEvent evt) throws java.io.IOException;
	String getPattern();
	void setPattern(String pattern);

	/**
	 * Returns a new sink for the same destination, with the same pattern. A copy never truncates an existing file.
	 */
	LogSink copy();

	@Override
	default void flush() throws java.io.IOException {}

	@Override
	default void close() throws java.io.IOException {}
}

/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.logging.sinks;

import com.vertexnova.base.config.SysProps;
import com.vertexnova.logging.LogEvent;

/**
 * Accumulates formatted log lines as an in-memory string.
 */
public class MemLogSink
	extends AbstractLogSink
{
	public static final String DFLT_PATTERN = "[%l] %v";
	private static final String eolstr = SysProps.EOL;

	private final StringBuilder logbuf = new StringBuilder();
	private int lineCount;

	public MemLogSink() {
		this(DFLT_PATTERN);
	}

	public MemLogSink(String pattern) {
		super(pattern);
	}

	public synchronized String get() {return logbuf.toString();}
	public synchronized int length() {return logbuf.length();}
	public synchronized int lineCount() {return lineCount;}

	public synchronized void reset() {
		logbuf.setLength(0);
		lineCount = 0;
	}

	@Override
	public void write(LogEvent evt)
	{
		String line = format(evt);
		synchronized (this) {
			logbuf.append(line).append(eolstr);
			lineCount++;
		}
	}

	// Doesn't actually close, just discards contents and capacity.
	@Override
	public synchronized void close()
	{
		reset();
		logbuf.trimToSize();
	}

	@Override
	public LogSink copy() {
		return new MemLogSink(getPattern());
	}
}

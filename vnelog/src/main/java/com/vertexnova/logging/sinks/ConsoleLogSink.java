/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.logging.sinks;

import com.vertexnova.logging.LogEvent;

/**
 * Writes each event as one line on a console stream, coloured by level when the terminal supports it.
 */
public class ConsoleLogSink
	extends AbstractLogSink
{
	public static final String DFLT_PATTERN = "%x [%l] %v";

	private final java.io.PrintStream strm;

	public ConsoleLogSink() {
		this(System.out);
	}

	public ConsoleLogSink(java.io.PrintStream strm) {
		this(strm, DFLT_PATTERN);
	}

	public ConsoleLogSink(java.io.PrintStream strm, String pattern) {
		super(pattern);
		this.strm = strm;
	}

	public java.io.PrintStream getStream() {return strm;}

	@Override
	public void write(LogEvent evt)
	{
		String line = format(evt);
		if (TextColor.isColorEnabled()) {
			line = TextColor.forLevel(evt.getLevel()).toAnsi() + line + TextColor.RESET;
		}
		strm.println(line);
	}

	@Override
	public void flush()
	{
		strm.flush();
	}

	// The stream belongs to the JVM or to our creator, so we merely flush it
	@Override
	public void close()
	{
		strm.flush();
	}

	@Override
	public LogSink copy() {
		return new ConsoleLogSink(strm, getPattern());
	}
}

/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.logging.sinks;

import com.vertexnova.logging.LogEvent;
import com.vertexnova.logging.format.LogFormatter;

abstract public class AbstractLogSink
	implements LogSink
{
	private volatile String pattern;

	protected AbstractLogSink(String pattern) {
		this.pattern = pattern;
	}

	@Override
	public String getPattern() {return pattern;}

	@Override
	public void setPattern(String pattern) {this.pattern = pattern;}

	protected String format(LogEvent evt) {
		return LogFormatter.format(evt, pattern);
	}

	@Override
	public String toString() {
		return getClass().getSimpleName()+"[pattern="+pattern+"]";
	}
}

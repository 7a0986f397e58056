/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.logging.sinks;

import com.vertexnova.logging.LogEvent;

/**
 * Forwards events to an external SLF4J logger, for applications which have standardised on some other logging framework.
 */
public class Slf4jLogSink
	extends AbstractLogSink
{
	public static final String DFLT_PATTERN = "%v";

	private final String extName;
	private final org.slf4j.Logger extlog;  //the external logger we're bridging to

	public Slf4jLogSink(String extName) {
		this(extName, DFLT_PATTERN);
	}

	public Slf4jLogSink(String extName, String pattern) {
		this(org.slf4j.LoggerFactory.getLogger(extName), pattern);
	}

	public Slf4jLogSink(org.slf4j.Logger extlog, String pattern) {
		super(pattern);
		this.extlog = extlog;
		this.extName = extlog.getName();
	}

	public org.slf4j.Logger getExternalLogger() {return extlog;}

	@Override
	public void write(LogEvent evt)
	{
		String msg = format(evt);
		switch (evt.getLevel())
		{
			case FATAL:
			case ERROR:
				extlog.error(msg);
				break;
			case WARN:
				extlog.warn(msg);
				break;
			case INFO:
				extlog.info(msg);
				break;
			case DEBUG:
				extlog.debug(msg);
				break;
			default:
				extlog.trace(msg);
				break;
		}
	}

	@Override
	public LogSink copy() {
		return new Slf4jLogSink(extlog, getPattern());
	}

	@Override
	public String toString() {
		return getClass().getSimpleName()+"[SLF4J="+extName+", pattern="+getPattern()+"]";
	}
}

/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.vnelog_slf4j;

import com.vertexnova.base.config.SysProps;
import com.vertexnova.logging.Interop;
import com.vertexnova.logging.LogLevel;
import com.vertexnova.logging.Logging;

/**
 * Presents one of our loggers as an SLF4J logger. The SLF4J logger name becomes the category of each event.
 * <br>
 * If the calling thread has a current logger (see LoggerRegistry.setCurrentLogger()) events go to that, else to the delegate.
 */
public class LoggerAdapter
	extends org.slf4j.helpers.LegacyAbstractLogger
	implements java.io.Flushable
{
	private static final long serialVersionUID = 1L;
	private static final boolean dumpStack = SysProps.get("vne.logger.slf4j.dumpstack", true);

	private final transient com.vertexnova.logging.Logger defaultLogger;

	public com.vertexnova.logging.Logger getDelegate() {return defaultLogger;}

	protected LoggerAdapter(String lname, com.vertexnova.logging.Logger logger) {
		if (logger == null) throw new IllegalArgumentException(getClass().getName()+" has null delegate");
		this.name = lname;
		this.defaultLogger = logger;
	}

	@Override
	protected String getFullyQualifiedCallerName() {return null;}

	@Override
	public void flush() {
		getLogger().flush();
	}

	@Override
	public boolean isTraceEnabled() {
		return isActive(LogLevel.TRACE);
	}

	@Override
	public boolean isDebugEnabled() {
		return isActive(LogLevel.DEBUG);
	}

	@Override
	public boolean isInfoEnabled() {
		return isActive(LogLevel.INFO);
	}

	@Override
	public boolean isWarnEnabled() {
		return isActive(LogLevel.WARN);
	}

	@Override
	public boolean isErrorEnabled() {
		return isActive(LogLevel.ERROR);
	}

	private boolean isActive(LogLevel lvl) {
		return getLogger().isActive(lvl);
	}

	@Override
	protected void handleNormalizedLoggingCall(org.slf4j.event.Level slf4jLevel, org.slf4j.Marker marker, String fmt, Object[] args, Throwable ex) {
		LogLevel lvl = Interop.mapLevel(slf4jLevel);
		com.vertexnova.logging.Logger logger = getLogger();
		if (!logger.isActive(lvl)) return;
		org.slf4j.helpers.FormattingTuple tp = org.slf4j.helpers.MessageFormatter.arrayFormat(fmt, args);
		logger.log(getName(), lvl, ex, dumpStack, tp.getMessage());
	}

	private com.vertexnova.logging.Logger getLogger() {
		com.vertexnova.logging.Logger logger = Logging.getRegistry().getCurrentLogger();
		if (logger == null || logger.isClosed()) logger = defaultLogger;
		return logger;
	}

	@Override
	public String toString() {
		return super.toString()+" with delegate="+defaultLogger+" - current="+getLogger();
	}
}

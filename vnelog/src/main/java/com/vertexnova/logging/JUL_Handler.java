/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.logging;

import com.vertexnova.base.ExceptionUtils;

/**
 * This class routes a JUL logger's records into one of our loggers.
 * <br>
 * The JUL logger name becomes the event category, and the record's source class and method become the event's source location.
 */
public class JUL_Handler
	extends java.util.logging.Handler
{
	private final Logger log;

	/**
	 * Installs a handler for the given logger as the only handler of the named JUL logger, with no recourse to parent handlers.
	 * The JUL logger's level is set to match the logger's current level.
	 * The blank name denotes the JUL root logger.
	 */
	public static java.util.logging.Logger install(Logger log, String julName)
	{
		java.util.logging.Logger jul = java.util.logging.Logger.getLogger(julName == null ? "" : julName);
		java.util.logging.Handler[] handlers = jul.getHandlers();
		for (int idx = 0; idx != handlers.length; idx++) {
			handlers[idx].flush();
			jul.removeHandler(handlers[idx]);
		}
		jul.addHandler(new JUL_Handler(log));
		jul.setUseParentHandlers(false);
		jul.setLevel(Interop.mapLevel(log.getCurrentLogLevel()));
		return jul;
	}

	public JUL_Handler(Logger log)
	{
		this.log = log;
	}

	public Logger getLogger() {return log;}

	@Override
	public void close()
	{
		log.flush();
	}

	@Override
	public void flush()
	{
		log.flush();
	}

	@Override
	public void publish(java.util.logging.LogRecord rec)
	{
		if (rec == null) return;
		LogLevel lvl = Interop.mapLevel(rec.getLevel());
		if (!log.isActive(lvl)) return;
		String msg = rec.getMessage();
		Object[] params = rec.getParameters();
		if (msg != null && params != null && params.length != 0) {
			try {
				msg = java.text.MessageFormat.format(msg, params);
			} catch (IllegalArgumentException ex) {
				msg = msg+" - PARAMS="+java.util.Arrays.toString(params);
			}
		}
		Throwable ex = rec.getThrown();
		if (ex != null) msg = msg+" - "+ExceptionUtils.summary(ex, true);
		log.log(rec.getLoggerName(), lvl, TimeStampType.LOCAL, msg, rec.getSourceClassName(), rec.getSourceMethodName(), 0);
	}
}

/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.logging;

/**
 * Level comparisons, and mappings between our levels and those of JUL and SLF4J.
 */
public class Interop
{
	/**
	 * Returns true if an event at level msg passes a logger whose threshold is at the given level.
	 */
	public static boolean isActive(LogLevel threshold, LogLevel msg)
	{
		if (threshold == null || msg == null) return false;
		return msg.isAtLeast(threshold);
	}

	public static LogLevel getLevel(java.util.logging.Logger log)
	{
		java.util.logging.Level lvl = getEffectiveLevel(log);
		return (lvl == null ? Logger.DFLT_LEVEL : mapLevel(lvl));
	}

	public static LogLevel getLevel(org.slf4j.Logger log)
	{
		if (log.isTraceEnabled()) return LogLevel.TRACE;
		if (log.isDebugEnabled()) return LogLevel.DEBUG;
		if (log.isInfoEnabled()) return LogLevel.INFO;
		if (log.isWarnEnabled()) return LogLevel.WARN;
		if (log.isErrorEnabled()) return LogLevel.ERROR;
		return LogLevel.FATAL;
	}

	// JUL has no FATAL, and OFF maps to FATAL as the closest we have to disabling a logger
	public static LogLevel mapLevel(java.util.logging.Level jul_lvl)
	{
		int lvl = jul_lvl.intValue();
		if (lvl == java.util.logging.Level.OFF.intValue()) return LogLevel.FATAL;
		if (lvl >= java.util.logging.Level.SEVERE.intValue()) return LogLevel.ERROR;
		if (lvl >= java.util.logging.Level.WARNING.intValue()) return LogLevel.WARN;
		if (lvl >= java.util.logging.Level.INFO.intValue()) return LogLevel.INFO;
		if (lvl >= java.util.logging.Level.FINE.intValue()) return LogLevel.DEBUG;
		return LogLevel.TRACE;
	}

	public static java.util.logging.Level mapLevel(LogLevel lvl)
	{
		switch (lvl)
		{
			case FATAL:
			case ERROR: return java.util.logging.Level.SEVERE;
			case WARN: return java.util.logging.Level.WARNING;
			case INFO: return java.util.logging.Level.INFO;
			case DEBUG: return java.util.logging.Level.FINE;
			default: return java.util.logging.Level.FINEST;
		}
	}

	public static LogLevel mapLevel(org.slf4j.event.Level slf4j_lvl)
	{
		switch (slf4j_lvl)
		{
			case ERROR: return LogLevel.ERROR;
			case WARN: return LogLevel.WARN;
			case INFO: return LogLevel.INFO;
			case DEBUG: return LogLevel.DEBUG;
			default: return LogLevel.TRACE;
		}
	}

	public static org.slf4j.event.Level mapSlf4jLevel(LogLevel lvl)
	{
		switch (lvl)
		{
			case FATAL:
			case ERROR: return org.slf4j.event.Level.ERROR;
			case WARN: return org.slf4j.event.Level.WARN;
			case INFO: return org.slf4j.event.Level.INFO;
			case DEBUG: return org.slf4j.event.Level.DEBUG;
			default: return org.slf4j.event.Level.TRACE;
		}
	}

	// there will be a Level set somewhere up the Logger hierarchy
	public static java.util.logging.Level getEffectiveLevel(java.util.logging.Logger log)
	{
		java.util.logging.Level lvl = null;
		do {
			if ((lvl = log.getLevel()) != null) break;
			log = log.getParent();
		} while (log != null);
		return lvl;
	}
}

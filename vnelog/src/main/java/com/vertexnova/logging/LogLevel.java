/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.logging;

/**
 * Severity of a log event, in ascending order.
 * <br>
 * An event is emitted when its level is at or above the logger's current level, and it triggers a flush when its level
 * is at or above the logger's flush level.
 */
public enum LogLevel
{
	TRACE, DEBUG, INFO, WARN, ERROR, FATAL;

	public String getLabel() {return name();}

	public boolean isAtLeast(LogLevel threshold) {
		return ordinal() >= threshold.ordinal();
	}

	/**
	 * Parses a level name as it appears in config files and system properties. Matching is case-insensitive and the common
	 * abbreviations are accepted.
	 */
	public static LogLevel parse(String str)
	{
		if (str == null) throw new IllegalArgumentException("Missing log level");
		String lvl = str.trim().toUpperCase();
		switch (lvl) {
		case "TRC":
			return TRACE;
		case "DBG":
			return DEBUG;
		case "WARNING":
			return WARN;
		case "ERR":
			return ERROR;
		case "CRITICAL":
			return FATAL;
		default:
			break;
		}
		try {
			return valueOf(lvl);
		} catch (IllegalArgumentException ex) {
			throw new IllegalArgumentException("Invalid log level="+str, ex);
		}
	}
}

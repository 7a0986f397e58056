/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.logging;

/**
 * Selects which sinks a configured logger gets.
 * SLF4J routes the logger's output to an external SLF4J logger instead of writing it directly.
 */
public enum LogSinkType
{
	NONE, CONSOLE, FILE, BOTH, SLF4J;

	public boolean hasConsole() {return this == CONSOLE || this == BOTH;}
	public boolean hasFile() {return this == FILE || this == BOTH;}

	public static LogSinkType parse(String str)
	{
		try {
			return valueOf(str.trim().toUpperCase());
		} catch (RuntimeException ex) {
			throw new IllegalArgumentException("Invalid sink type="+str, ex);
		}
	}
}

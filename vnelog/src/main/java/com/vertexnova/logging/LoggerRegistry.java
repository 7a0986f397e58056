/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.logging;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps logger names to loggers, and tracks a current logger for each thread.
 * <br>
 * The registry does not own the loggers, so removing one does not close it.
 * <p>
 * This class is MT-safe.
 */
public class LoggerRegistry
{
	private final Map<String, Logger> loggers = new ConcurrentHashMap<>();
	private final ThreadLocal<Logger> currentLogger = new ThreadLocal<>();

	/**
	 * Registers the logger under the given name, replacing any previous entry, and makes it the calling thread's current logger.
	 * A null logger is ignored.
	 */
	public void registerLogger(String name, Logger logger)
	{
		if (logger == null) return;
		loggers.put(name, logger);
		currentLogger.set(logger);
	}

	public Logger unregisterLogger(String name)
	{
		Logger logger = loggers.remove(name);
		if (logger != null && currentLogger.get() == logger) currentLogger.remove();
		return logger;
	}

	/**
	 * Removes every logger. The calling thread's current logger is also cleared, but other threads' current loggers can only
	 * be cleared by those threads.
	 */
	public void unregisterAll()
	{
		loggers.clear();
		currentLogger.remove();
	}

	public Logger getLogger(String name)
	{
		return (name == null ? null : loggers.get(name));
	}

	public List<String> getLoggerNames()
	{
		return new ArrayList<>(loggers.keySet());
	}

	public List<Logger> getLoggers()
	{
		return new ArrayList<>(loggers.values());
	}

	public int size() {return loggers.size();}

	/**
	 * Makes the named logger the calling thread's current logger. An unknown name clears it.
	 */
	public Logger setCurrentLogger(String name)
	{
		Logger logger = getLogger(name);
		if (logger == null) {
			currentLogger.remove();
		} else {
			currentLogger.set(logger);
		}
		return logger;
	}

	public Logger getCurrentLogger()
	{
		return currentLogger.get();
	}
}

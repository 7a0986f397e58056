/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.logging;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.vertexnova.logging.async.LogQueue;
import com.vertexnova.logging.sinks.ConsoleLogSink;
import com.vertexnova.logging.sinks.FileLogSink;
import com.vertexnova.logging.sinks.LogSink;

/**
 * Creates loggers by name, configures their sinks and levels, and tears them all down on shutdown.
 * <br>
 * There is at most one logger per name. The operations which take a logger name do nothing if there is no such logger.
 * <p>
 * This class is MT-safe.
 */
public class LogManager
{
	private final LoggerRegistry registry;
	private final Map<String, Logger> loggers = new LinkedHashMap<>(); //guarded by this

	public LogManager() {
		this(new LoggerRegistry());
	}

	public LogManager(LoggerRegistry registry) {
		this.registry = registry;
	}

	public LoggerRegistry getRegistry() {return registry;}

	/**
	 * Returns the existing logger of this name if there is one, regardless of the async flag. Otherwise creates and registers one.
	 */
	public Logger createLogger(String name, boolean async)
	{
		return createLogger(name, async, 0, null);
	}

	public synchronized Logger createLogger(String name, boolean async, int queueCapacity, LogQueue.OverflowPolicy overflow)
	{
		Logger logger = loggers.get(name);
		if (logger != null) return logger;
		if (async) {
			logger = new AsyncLogger(name, new LogQueue(queueCapacity, overflow));
		} else {
			logger = new SyncLogger(name);
		}
		loggers.put(name, logger);
		registry.registerLogger(name, logger);
		if (Logger.DIAGNOSTICS) System.out.println(Logger.DIAGMARK+"Created logger - "+logger);
		return logger;
	}

	public synchronized Logger getLogger(String name)
	{
		return loggers.get(name);
	}

	public synchronized List<String> getLoggerNames()
	{
		return new ArrayList<>(loggers.keySet());
	}

	public boolean isLoggerAsync(String name)
	{
		Logger logger = getLogger(name);
		return (logger != null && logger.isAsync());
	}

	public void addConsoleSink(String name)
	{
		addLogSink(name, new ConsoleLogSink());
	}

	public void addFileSink(String name, String path)
	{
		addFileSink(name, path, true);
	}

	public void addFileSink(String name, String path, boolean append)
	{
		if (getLogger(name) == null) return;
		addLogSink(name, new FileLogSink(path, append));
	}

	public void addLogSink(String name, LogSink sink)
	{
		Logger logger = getLogger(name);
		if (logger != null) logger.addLogSink(sink);
	}

	public void setConsolePattern(String name, String pattern)
	{
		setPattern(name, ConsoleLogSink.class, pattern);
	}

	public void setFilePattern(String name, String pattern)
	{
		setPattern(name, FileLogSink.class, pattern);
	}

	public void setLogLevel(String name, LogLevel lvl)
	{
		Logger logger = getLogger(name);
		if (logger != null) logger.setCurrentLogLevel(lvl);
	}

	public void setFlushLevel(String name, LogLevel lvl)
	{
		Logger logger = getLogger(name);
		if (logger != null) logger.setFlushLevel(lvl);
	}

	public void flushAll()
	{
		List<Logger> lst;
		synchronized (this) {
			lst = new ArrayList<>(loggers.values());
		}
		for (int idx = 0; idx != lst.size(); idx++) {
			lst.get(idx).flush();
		}
	}

	/**
	 * Flushes every logger, then unregisters and closes it. The manager can be reused afterwards.
	 */
	public synchronized void shutdown()
	{
		if (Logger.DIAGNOSTICS) System.out.println(Logger.DIAGMARK+"Shutting down loggers="+loggers.size());
		List<Logger> lst = new ArrayList<>(loggers.values());
		for (int idx = 0; idx != lst.size(); idx++) {
			lst.get(idx).flush();
		}
		for (int idx = 0; idx != lst.size(); idx++) {
			Logger logger = lst.get(idx);
			registry.unregisterLogger(logger.getName());
			logger.close();
		}
		loggers.clear();
		registry.unregisterAll();
	}

	private void setPattern(String name, Class<? extends LogSink> clss, String pattern)
	{
		Logger logger = getLogger(name);
		if (logger == null) return;
		List<LogSink> sinks = logger.getLogSinks();
		for (int idx = 0; idx != sinks.size(); idx++) {
			LogSink sink = sinks.get(idx);
			if (clss.isInstance(sink)) sink.setPattern(pattern);
		}
	}
}

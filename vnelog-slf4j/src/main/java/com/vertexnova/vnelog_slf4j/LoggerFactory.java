/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.vnelog_slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.vertexnova.base.config.SysProps;
import com.vertexnova.logging.Factory;
import com.vertexnova.logging.LogSinkType;
import com.vertexnova.logging.LoggerConfig;

/**
 * Maps every SLF4J logger onto a single VNELog logger, which is named by the vne.slf4j.logger setting and configured from
 * logging.xml in the usual way (or from the vne.logger.* defaults alone, if vne.slf4j.nocfg is set).
 */
public class LoggerFactory
	implements org.slf4j.ILoggerFactory
{
	public static final String SYSPROP_LOGNAME = "vne.slf4j.logger";
	public static final String SYSPROP_NOCFG = "vne.slf4j.nocfg";

	static {
		System.setProperty("slf4j.detectLoggerNameMismatch", "true");
	}
	private static final boolean NOCFG = SysProps.get(SYSPROP_NOCFG, false);
	private static final String LOGNAME = SysProps.get(SYSPROP_LOGNAME, Factory.DFLT_LOGNAME);

	private final Map<String,LoggerAdapter> loggers = new ConcurrentHashMap<>();

	@Override
	public org.slf4j.Logger getLogger(String name)
	{
		String sink = SysProps.get(LoggerConfig.SYSPROP_SINK);
		if (sink != null && LogSinkType.parse(sink) == LogSinkType.SLF4J) {
			String msg = "You cannot set "+LoggerConfig.SYSPROP_SINK+"="+sink+" when vnelog-slf4j is on your classpath"
					+"\n\tThat setting directs VNELog loggers to SLF4J while vnelog-slf4j performs the opposite mapping";
			throw new IllegalStateException(msg);
		}
		return loggers.computeIfAbsent(name, s -> createLogger(s));
	}

	private static LoggerAdapter createLogger(String name) {
		com.vertexnova.logging.Logger logger;
		try {
			if (NOCFG) {
				logger = Factory.getLogger(new LoggerConfig.Builder().withName(LOGNAME).build());
			} else {
				logger = Factory.getLogger(LOGNAME);
			}
		} catch (Exception ex) {
			throw new IllegalStateException("VNELog-SLF4J factory failed to create logger="+name+" - "+ex, ex);
		}
		if (logger.getLogSinks().isEmpty() || hasSlf4jSink(logger)) {
			throw new IllegalStateException("VNELog-SLF4J logger="+LOGNAME+" must have at least one sink, and none of type "+LogSinkType.SLF4J);
		}
		return new LoggerAdapter(name, logger);
	}

	private static boolean hasSlf4jSink(com.vertexnova.logging.Logger logger) {
		java.util.List<com.vertexnova.logging.sinks.LogSink> sinks = logger.getLogSinks();
		for (int idx = 0; idx != sinks.size(); idx++) {
			if (sinks.get(idx) instanceof com.vertexnova.logging.sinks.Slf4jLogSink) return true;
		}
		return false;
	}
}

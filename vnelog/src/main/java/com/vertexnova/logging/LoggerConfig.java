/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.logging;

import java.lang.management.ManagementFactory;

import com.vertexnova.base.config.SysProps;
import com.vertexnova.base.config.XmlConfig;
import com.vertexnova.logging.async.LogQueue;

/**
 * Immutable description of a logger, applied by Logging.configureLogger().
 * <br>
 * The Builder's defaults are taken from the vne.logger.* settings (see SysProps), so a deployment can reconfigure the default
 * logger without touching code or config files.
 * <p>
 * The file path may contain the tokens %DIRLOG% (the log directory), %DIRTMP% (the temp directory) and %PID%.
 */
public class LoggerConfig
{
	public static final String SYSPROP_LOGLEVEL = "vne.logger.level";
	public static final String SYSPROP_FLUSHLEVEL = "vne.logger.flushlevel";
	public static final String SYSPROP_ASYNC = "vne.logger.async";
	public static final String SYSPROP_SINK = "vne.logger.sink";
	public static final String SYSPROP_LOGFILE = "vne.logger.file";
	public static final String SYSPROP_APPEND = "vne.logger.append";
	public static final String SYSPROP_LOGSDIR = "vne.logger.dir";
	public static final String SYSPROP_FORCE_STDOUT = "vne.logger.stdout";
	public static final String SYSPROP_QUEUESIZE = "vne.logger.queuesize";
	public static final String SYSPROP_OVERFLOW = "vne.logger.overflow";

	public static final String TOKEN_LOGSDIR = "%DIRLOG%";
	public static final String TOKEN_PID = "%PID%";
	public static final int CURRENT_PID = Integer.parseInt(ManagementFactory.getRuntimeMXBean().getName().split("@")[0]);

	public static final String DFLT_CONSOLE_PATTERN = "%x [%l] %v";
	public static final String DFLT_FILE_PATTERN = "%x [%n] [%l] [%!] %v";
	public static final String DFLT_LOGFILE = TOKEN_LOGSDIR+"/vne.log";

	private final String name;
	private final LogSinkType sinkType;
	private final String consolePattern;
	private final String filePattern;
	private final String filePath;
	private final boolean append;
	private final LogLevel logLevel;
	private final LogLevel flushLevel;
	private final boolean async;
	private final int queueCapacity;
	private final LogQueue.OverflowPolicy overflowPolicy;

	private LoggerConfig(Builder bldr) {
		name = bldr.name;
		sinkType = bldr.sinkType;
		consolePattern = bldr.consolePattern;
		filePattern = bldr.filePattern;
		filePath = bldr.filePath;
		append = bldr.append;
		logLevel = bldr.logLevel;
		flushLevel = bldr.flushLevel;
		async = bldr.async;
		queueCapacity = bldr.queueCapacity;
		overflowPolicy = bldr.overflowPolicy;
	}

	public LoggerConfig(XmlConfig cfg) {
		this(Builder.fromConfig(cfg));
	}

	public String getName() {
		return name;
	}

	public LogSinkType getSinkType() {
		return sinkType;
	}

	public String getConsolePattern() {
		return consolePattern;
	}

	public String getFilePattern() {
		return filePattern;
	}

	public String getFilePath() {
		return filePath;
	}

	public boolean isAppend() {
		return append;
	}

	public LogLevel getLogLevel() {
		return logLevel;
	}

	public LogLevel getFlushLevel() {
		return flushLevel;
	}

	public boolean isAsync() {
		return async;
	}

	public int getQueueCapacity() {
		return queueCapacity;
	}

	public LogQueue.OverflowPolicy getOverflowPolicy() {
		return overflowPolicy;
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder(getClass().getSimpleName());
		sb.append("[Name=").append(name);
		sb.append(", Sink=").append(sinkType);
		if (sinkType.hasFile()) sb.append('/').append(filePath).append(append ? "/append" : "/truncate");
		sb.append(", Level=").append(logLevel).append('/').append(flushLevel);
		sb.append(", Async=").append(async);
		if (async) sb.append("/queue=").append(queueCapacity == 0 ? "unbounded" : queueCapacity+"/"+overflowPolicy);
		sb.append("]");
		return sb.toString();
	}


	public static class Builder {
		private String name = Logging.DEFAULT_LOGGER_NAME;
		private LogSinkType sinkType = LogSinkType.parse(SysProps.get(SYSPROP_SINK, LogSinkType.CONSOLE.name()));
		private String consolePattern = DFLT_CONSOLE_PATTERN;
		private String filePattern = DFLT_FILE_PATTERN;
		private String filePath = SysProps.get(SYSPROP_LOGFILE);
		private boolean append = SysProps.get(SYSPROP_APPEND, true);
		private LogLevel logLevel = LogLevel.parse(SysProps.get(SYSPROP_LOGLEVEL, Logger.DFLT_LEVEL.name()));
		private LogLevel flushLevel = LogLevel.parse(SysProps.get(SYSPROP_FLUSHLEVEL, Logger.DFLT_FLUSH_LEVEL.name()));
		private boolean async = SysProps.get(SYSPROP_ASYNC, false);
		private int queueCapacity = SysProps.get(SYSPROP_QUEUESIZE, 0);
		private LogQueue.OverflowPolicy overflowPolicy = parseOverflow(SysProps.get(SYSPROP_OVERFLOW, LogQueue.OverflowPolicy.DISCARD_OLDEST.name()));

		public Builder() {}

		public Builder(LoggerConfig cfg) {
			name = cfg.getName();
			sinkType = cfg.getSinkType();
			consolePattern = cfg.getConsolePattern();
			filePattern = cfg.getFilePattern();
			filePath = cfg.getFilePath();
			append = cfg.isAppend();
			logLevel = cfg.getLogLevel();
			flushLevel = cfg.getFlushLevel();
			async = cfg.isAsync();
			queueCapacity = cfg.getQueueCapacity();
			overflowPolicy = cfg.getOverflowPolicy();
		}

		public Builder withName(String v) {
			name = v;
			return this;
		}

		public Builder withSinkType(LogSinkType v) {
			sinkType = v;
			return this;
		}

		public Builder withConsolePattern(String v) {
			consolePattern = v;
			return this;
		}

		public Builder withFilePattern(String v) {
			filePattern = v;
			return this;
		}

		public Builder withFilePath(String v) {
			filePath = v;
			return this;
		}

		public Builder withAppend(boolean v) {
			append = v;
			return this;
		}

		public Builder withLogLevel(LogLevel v) {
			logLevel = v;
			return this;
		}

		public Builder withFlushLevel(LogLevel v) {
			flushLevel = v;
			return this;
		}

		public Builder withAsync(boolean v) {
			async = v;
			return this;
		}

		public Builder withQueueCapacity(int v) {
			queueCapacity = v;
			return this;
		}

		public Builder withOverflowPolicy(LogQueue.OverflowPolicy v) {
			overflowPolicy = v;
			return this;
		}

		private Builder reconcile()
		{
			if (name == null || name.isEmpty()) name = Logging.DEFAULT_LOGGER_NAME;
			if (sinkType == null) sinkType = LogSinkType.NONE;
			if (logLevel == null) logLevel = Logger.DFLT_LEVEL;
			if (flushLevel == null) flushLevel = Logger.DFLT_FLUSH_LEVEL;
			if (overflowPolicy == null) overflowPolicy = LogQueue.OverflowPolicy.DISCARD_OLDEST;
			if (queueCapacity < 0) throw new IllegalArgumentException("Logger="+name+" has negative queue size="+queueCapacity);

			if (SysProps.get(SYSPROP_FORCE_STDOUT, false)) {
				sinkType = LogSinkType.CONSOLE;
			}

			if (filePath == null || filePath.isEmpty()) filePath = DFLT_LOGFILE;
			filePath = expandPath(filePath);
			return this;
		}

		public LoggerConfig build() {
			reconcile();
			return new LoggerConfig(this);
		}

		static Builder fromConfig(XmlConfig cfg) {
			Builder bldr = new Builder();
			if (cfg == null || cfg == XmlConfig.BLANKCFG || cfg == XmlConfig.NULLCFG || !cfg.exists()) {
				return bldr.reconcile();
			}
			bldr.name = cfg.getValue("@name", false, bldr.name);
			bldr.logLevel = LogLevel.parse(cfg.getValue("@level", false, bldr.logLevel.name()));
			bldr.flushLevel = LogLevel.parse(cfg.getValue("@flushlevel", false, bldr.flushLevel.name()));
			bldr.async = cfg.getBool("@async", bldr.async);
			bldr.sinkType = LogSinkType.parse(cfg.getValue("@sink", false, bldr.sinkType.name()));
			bldr.queueCapacity = cfg.getInt("@queuesize", false, bldr.queueCapacity);
			bldr.overflowPolicy = parseOverflow(cfg.getValue("@overflow", false, bldr.overflowPolicy.name()));
			bldr.consolePattern = cfg.getValue("console/@pattern", false, bldr.consolePattern);
			bldr.filePattern = cfg.getValue("file/@pattern", false, bldr.filePattern);
			bldr.append = cfg.getBool("file/@append", bldr.append);
			bldr.filePath = cfg.getValue("file", false, bldr.filePath);
			return bldr.reconcile();
		}

		private static String expandPath(String pthnam)
		{
			if (pthnam.contains(TOKEN_LOGSDIR)) {
				pthnam = pthnam.replace(TOKEN_LOGSDIR, SysProps.get(SYSPROP_LOGSDIR, Logging.getLogDirectory()));
			}
			pthnam = pthnam.replace(SysProps.DIRTOKEN_TMP, SysProps.TMPDIR);
			pthnam = pthnam.replace(TOKEN_PID, String.valueOf(CURRENT_PID));
			try {
				return new java.io.File(pthnam).getCanonicalPath();
			} catch (Exception ex) {
				throw new IllegalArgumentException("Failed to canonise log file="+pthnam, ex);
			}
		}

		private static LogQueue.OverflowPolicy parseOverflow(String str)
		{
			try {
				return LogQueue.OverflowPolicy.valueOf(str.trim().toUpperCase());
			} catch (RuntimeException ex) {
				throw new IllegalArgumentException("Invalid queue overflow policy="+str, ex);
			}
		}
	}
}

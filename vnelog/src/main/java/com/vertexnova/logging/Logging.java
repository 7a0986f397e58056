/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.logging;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

import com.vertexnova.base.ExceptionUtils;
import com.vertexnova.base.config.SysProps;
import com.vertexnova.base.utils.FileOps;
import com.vertexnova.logging.sinks.ConsoleLogSink;
import com.vertexnova.logging.sinks.FileLogSink;
import com.vertexnova.logging.sinks.Slf4jLogSink;

/**
 * Process-wide entry point to the logging system.
 * <br>
 * This wraps a single LogManager, which is created on first use. A JVM shutdown hook flushes its loggers, so that events
 * still queued by asynchronous loggers are not lost if the application exits without calling shutdown().
 * <p>
 * The level methods return a LogStream bound to the default logger, eg.
 * <pre>
 * try (LogStream ls = Logging.warn("net")) {ls.append("retrying in ").append(secs).append('s');}
 * </pre>
 */
public final class Logging
{
	public static final String DEFAULT_LOGGER_NAME = "vertexnova";
	public static final String APP_DIRNAME = "VertexNova";
	public static final String DFLT_LOGDIR = "logs";

	private static final DateTimeFormatter FOLDER_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");
	private static final String[] BUILD_DIR_MARKERS = new String[]{"build", "out", "bin", "target"};

	private static LogManager manager;
	private static Thread shutdown_hook;

	private Logging() {}

	public static synchronized LogManager getLogManager()
	{
		if (manager == null) {
			manager = new LogManager();
			final LogManager mgr = manager;
			shutdown_hook = new Thread("vnelog-shutdown") {
				@Override
				public void run() {
					if (Logger.DIAGNOSTICS) System.out.println(Logger.DIAGMARK+"Shutdown hook flushing loggers="+mgr.getLoggerNames());
					mgr.flushAll();
				}
			};
			Runtime.getRuntime().addShutdownHook(shutdown_hook);
		}
		return manager;
	}

	public static LoggerRegistry getRegistry() {
		return getLogManager().getRegistry();
	}

	public static Logger initialize(String name) {
		return initialize(name, false);
	}

	public static Logger initialize(String name, boolean async) {
		return getLogManager().createLogger(name, async);
	}

	/**
	 * Flushes, unregisters and closes every logger. Logging can be initialised again afterwards.
	 */
	public static void shutdown() {
		getLogManager().shutdown();
	}

	public static Logger getLogger(String name) {return getLogManager().getLogger(name);}
	public static boolean isLoggerAsync(String name) {return getLogManager().isLoggerAsync(name);}
	public static void addConsoleSink(String name) {getLogManager().addConsoleSink(name);}
	public static void addFileSink(String name, String path) {getLogManager().addFileSink(name, path);}
	public static void setConsolePattern(String name, String pattern) {getLogManager().setConsolePattern(name, pattern);}
	public static void setFilePattern(String name, String pattern) {getLogManager().setFilePattern(name, pattern);}
	public static void setLogLevel(String name, LogLevel lvl) {getLogManager().setLogLevel(name, lvl);}
	public static void setFlushLevel(String name, LogLevel lvl) {getLogManager().setFlushLevel(name, lvl);}

	/**
	 * The configuration of the default logger: console output at INFO, flushing at ERROR, with the file path set to vne.log
	 * in the platform log directory (which is created) for callers that switch the sink type to include a file.
	 */
	public static LoggerConfig defaultLoggerConfig()
	{
		String logdir = getPlatformSpecificLogDirectory();
		ensureLogDirectoryExists(logdir);
		return new LoggerConfig.Builder()
				.withName(DEFAULT_LOGGER_NAME)
				.withSinkType(LogSinkType.CONSOLE)
				.withConsolePattern(LoggerConfig.DFLT_CONSOLE_PATTERN)
				.withFilePattern(LoggerConfig.DFLT_FILE_PATTERN)
				.withFilePath(logdir+SysProps.DirSep+"vne.log")
				.withLogLevel(LogLevel.INFO)
				.withFlushLevel(LogLevel.ERROR)
				.withAsync(false)
				.build();
	}

	/**
	 * Creates the logger described by the config, unless it already exists, then applies the config's sinks and levels.
	 * Sinks are only added to a newly created logger, so reapplying a config to an existing logger just updates its
	 * patterns and levels.
	 */
	public static Logger configureLogger(LoggerConfig cfg)
	{
		LogManager mgr = getLogManager();
		String name = cfg.getName();
		boolean isNew;
		Logger logger;
		synchronized (mgr) {
			isNew = (mgr.getLogger(name) == null);
			logger = mgr.createLogger(name, cfg.isAsync(), cfg.getQueueCapacity(), cfg.getOverflowPolicy());
		}
		if (Logger.DIAGNOSTICS) System.out.println(Logger.DIAGMARK+(isNew ? "Configuring" : "Reconfiguring")+" logger - "+cfg);

		if (cfg.getSinkType().hasConsole()) {
			if (isNew) mgr.addLogSink(name, new ConsoleLogSink());
			if (cfg.getConsolePattern() != null && !cfg.getConsolePattern().isEmpty()) mgr.setConsolePattern(name, cfg.getConsolePattern());
		}
		if (cfg.getSinkType().hasFile() && cfg.getFilePath() != null && !cfg.getFilePath().isEmpty()) {
			if (isNew) mgr.addLogSink(name, new FileLogSink(cfg.getFilePath(), cfg.isAppend()));
			if (cfg.getFilePattern() != null && !cfg.getFilePattern().isEmpty()) mgr.setFilePattern(name, cfg.getFilePattern());
		}
		if (cfg.getSinkType() == LogSinkType.SLF4J && isNew) {
			mgr.addLogSink(name, new Slf4jLogSink("vnelog."+name));
		}
		mgr.setLogLevel(name, cfg.getLogLevel());
		mgr.setFlushLevel(name, cfg.getFlushLevel());
		return logger;
	}

	public static LogStream trace(String category) {return stream(DEFAULT_LOGGER_NAME, category, LogLevel.TRACE);}
	public static LogStream debug(String category) {return stream(DEFAULT_LOGGER_NAME, category, LogLevel.DEBUG);}
	public static LogStream info(String category) {return stream(DEFAULT_LOGGER_NAME, category, LogLevel.INFO);}
	public static LogStream warn(String category) {return stream(DEFAULT_LOGGER_NAME, category, LogLevel.WARN);}
	public static LogStream error(String category) {return stream(DEFAULT_LOGGER_NAME, category, LogLevel.ERROR);}
	public static LogStream fatal(String category) {return stream(DEFAULT_LOGGER_NAME, category, LogLevel.FATAL);}

	public static LogStream stream(String loggerName, String category, LogLevel lvl) {
		return stream(loggerName, category, lvl, TimeStampType.LOCAL);
	}

	public static LogStream stream(String loggerName, String category, LogLevel lvl, TimeStampType tstype) {
		return new LogStream(getRegistry(), loggerName, category, lvl, tstype);
	}

	public static String getLogDirectory() {
		return getPlatformSpecificLogDirectory();
	}

	/**
	 * Returns the conventional per-user log directory for this platform.
	 * If that can't be determined, it falls back to a logs directory under the current directory when running from a build
	 * tree, else a relative logs path.
	 */
	public static String getPlatformSpecificLogDirectory()
	{
		String sep = SysProps.DirSep;
		String home = System.getProperty("user.home");
		if (home != null && home.isEmpty()) home = null;

		if (SysProps.isWindows) {
			String appdata = SysProps.getEnv("LOCALAPPDATA");
			if (appdata != null) return appdata+sep+APP_DIRNAME+sep+"logs";
			if (home != null) return home+sep+"AppData"+sep+"Local"+sep+APP_DIRNAME+sep+"logs";
		} else if (SysProps.isMacOS) {
			if (home != null) return home+"/Library/Logs/"+APP_DIRNAME;
		} else {
			String xdg = SysProps.getEnv("XDG_DATA_HOME");
			if (xdg != null) return xdg+"/"+APP_DIRNAME+"/logs";
			if (home != null) return home+"/.local/share/"+APP_DIRNAME+"/logs";
		}

		String cwd = System.getProperty("user.dir", "");
		for (int idx = 0; idx != BUILD_DIR_MARKERS.length; idx++) {
			if (cwd.contains(BUILD_DIR_MARKERS[idx])) return cwd+sep+DFLT_LOGDIR;
		}
		return DFLT_LOGDIR;
	}

	/**
	 * Creates the directory if necessary. Returns false if the path is blank or the directory could not be created.
	 */
	public static boolean ensureLogDirectoryExists(String logdir)
	{
		if (logdir == null || logdir.isEmpty()) return false;
		try {
			FileOps.ensureDirExists(logdir);
			return true;
		} catch (Exception ex) {
			if (Logger.DIAGNOSTICS) System.out.println(Logger.DIAGMARK+"Failed to create log directory="+logdir+" - "+ExceptionUtils.summary(ex));
			return false;
		}
	}

	/**
	 * Returns a path for the given file within a new timestamped subdirectory of baseDir, eg. baseDir/2024-05-01_13-45-00/app.log
	 * <br>
	 * If the subdirectory can't be created, the file is placed directly in baseDir, and if that can't be created either,
	 * the bare filename is returned.
	 */
	public static String createLoggingFolder(String baseDir, String filename)
	{
		String sep = SysProps.DirSep;
		String stampedDir = baseDir+sep+FOLDER_FORMAT.format(LocalDateTime.now());
		if (ensureLogDirectoryExists(stampedDir)) return stampedDir+sep+filename;
		if (ensureLogDirectoryExists(baseDir)) return baseDir+sep+filename;
		return filename;
	}
}

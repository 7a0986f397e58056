/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.logging;

import java.util.Optional;

import com.vertexnova.base.ExceptionUtils;

/**
 * Accumulates a message piece by piece, and logs it when closed.
 * <br>
 * Meant to be used with try-with-resources, or as a one-off chained expression ending in close():
 * <pre>
 * try (LogStream ls = Logging.info("render")) {
 *     ls.append("frame ").append(frameNo).append(" took ").append(millis).append("ms");
 * }
 * </pre>
 * The target logger is looked up by name when the stream is closed. If there is no such logger, or the stream's level is
 * below the logger's current level, the message is silently dropped.
 * <br>
 * Instances are not MT-safe, and are meant to be confined to the thread that created them.
 */
public class LogStream
	implements AutoCloseable
{
	private static final StackWalker walker = StackWalker.getInstance();

	private final LoggerRegistry registry;
	private final String loggerName;
	private final String category;
	private final LogLevel level;
	private final TimeStampType timeStampType;
	private final String file;
	private final String function;
	private final int line;
	private final StringBuilder buf = new StringBuilder();
	private boolean closed;

	/**
	 * Captures the source location from the caller's stack frame.
	 */
	public LogStream(LoggerRegistry registry, String loggerName, String category, LogLevel level, TimeStampType tstype)
	{
		this(registry, loggerName, category, level, tstype, callerFrame());
	}

	public LogStream(LoggerRegistry registry, String loggerName, String category, LogLevel level, TimeStampType tstype,
			String file, String function, int line)
	{
		if (level == null) throw new IllegalArgumentException("LogStream requires a level");
		this.registry = registry;
		this.loggerName = loggerName;
		this.category = category;
		this.level = level;
		this.timeStampType = (tstype == null ? TimeStampType.LOCAL : tstype);
		this.file = file;
		this.function = function;
		this.line = line;
	}

	private LogStream(LoggerRegistry registry, String loggerName, String category, LogLevel level, TimeStampType tstype,
			Optional<StackWalker.StackFrame> frame)
	{
		this(registry, loggerName, category, level, tstype,
				frame.map(StackWalker.StackFrame::getFileName).orElse(null),
				frame.map(StackWalker.StackFrame::getMethodName).orElse(null),
				frame.map(StackWalker.StackFrame::getLineNumber).orElse(0));
	}

	public String getLoggerName() {return loggerName;}
	public String getCategory() {return category;}
	public LogLevel getLevel() {return level;}
	public String getFile() {return file;}
	public String getFunction() {return function;}
	public int getLine() {return line;}
	public String getMessage() {return buf.toString();}

	public LogStream append(Object obj) {buf.append(obj); return this;}
	public LogStream append(String str) {buf.append(str); return this;}
	public LogStream append(char ch) {buf.append(ch); return this;}
	public LogStream append(int val) {buf.append(val); return this;}
	public LogStream append(long val) {buf.append(val); return this;}
	public LogStream append(double val) {buf.append(val); return this;}
	public LogStream append(boolean val) {buf.append(val); return this;}

	/**
	 * Emits the accumulated message. Only the first call has any effect, and this never throws, short of a fatal JVM error.
	 */
	@Override
	public void close()
	{
		if (closed) return;
		closed = true;
		try {
			Logger logger = (registry == null ? null : registry.getLogger(loggerName));
			if (logger == null || !logger.isActive(level)) return;
			logger.log(category, level, timeStampType, buf.toString(), file, function, line);
		} catch (Throwable ex) {
			if (ExceptionUtils.isFatal(ex)) throw (Error)ex;
			System.err.println(Logger.DIAGMARK+"LogStream failed to emit to logger="+loggerName+" - "+ExceptionUtils.summary(ex));
		}
	}

	private static Optional<StackWalker.StackFrame> callerFrame()
	{
		return walker.walk(frames -> frames.filter(f -> !isLoggingFrame(f.getClassName())).findFirst());
	}

	private static boolean isLoggingFrame(String clsnam)
	{
		return clsnam.equals(LogStream.class.getName()) || clsnam.equals(Logging.class.getName());
	}
}

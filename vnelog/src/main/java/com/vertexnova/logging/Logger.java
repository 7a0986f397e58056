/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.logging;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import com.vertexnova.base.ExceptionUtils;
import com.vertexnova.base.config.SysProps;
import com.vertexnova.logging.sinks.LogSink;

/**
 * Base class for the synchronous and asynchronous loggers, holding the level policy and the sinks which are common to both.
 * <br>
 * An event is accepted if its level is at or above the current log level, and an accepted event whose level is at or above
 * the flush level causes the sinks to be flushed before log() returns.
 * <p>
 * Loggers never throw on the logging path. Sink failures are reported on stderr, since routing them back into the logging
 * system could recurse.
 * <br>
 * This class is MT-safe. The levels may be changed while other threads are logging, and sinks may be added at any time.
 */
abstract public class Logger
	implements java.io.Closeable, java.io.Flushable
{
	public static final String SYSPROP_DIAG = "vne.logger.diagnostics";
	public static final String DIAGMARK = "VNELog: ";
	public static final boolean DIAGNOSTICS = SysProps.get(SYSPROP_DIAG, false);

	public static final LogLevel DFLT_LEVEL = LogLevel.INFO;
	public static final LogLevel DFLT_FLUSH_LEVEL = LogLevel.ERROR;

	private final String name;
	private final List<LogSink> sinks = new CopyOnWriteArrayList<>();
	private final List<LogSink> sinksView = Collections.unmodifiableList(sinks);
	private volatile LogLevel currentLevel = DFLT_LEVEL;
	private volatile LogLevel flushLevel = DFLT_FLUSH_LEVEL;
	private volatile boolean closed;

	abstract public void log(LogEvent evt);
	abstract public boolean isAsync();

	/**
	 * Creates a new logger of the same type and levels as this one, with no sinks.
	 */
	abstract public Logger clone(String newName);

	protected Logger(String name) {
		if (name == null || name.isEmpty()) throw new IllegalArgumentException("Logger name is required");
		this.name = name;
	}

	public String getName() {return name;}
	public LogLevel getCurrentLogLevel() {return currentLevel;}
	public LogLevel getFlushLevel() {return flushLevel;}
	public boolean isActive(LogLevel lvl) {return Interop.isActive(currentLevel, lvl);}
	public boolean isClosed() {return closed;}

	/**
	 * Returns a read-only live view of the sinks, in the order they were added.
	 */
	public List<LogSink> getLogSinks() {return sinksView;}

	// The mutable list, for the benefit of the asynchronous dispatcher which captures it
	protected List<LogSink> sinks() {return sinks;}

	public LogLevel setCurrentLogLevel(LogLevel lvl)
	{
		if (lvl == null) throw new IllegalArgumentException("Logger="+name+" cannot have null log level");
		LogLevel oldlvl = currentLevel;
		currentLevel = lvl;
		if (DIAGNOSTICS && lvl != oldlvl) {
			String action = (lvl.ordinal() < oldlvl.ordinal()) ? "Reduced" : "Increased";
			System.out.println(DIAGMARK+"Logger="+name+" "+action+" log level from "+oldlvl+" to "+lvl);
		}
		return oldlvl;
	}

	public LogLevel setFlushLevel(LogLevel lvl)
	{
		if (lvl == null) throw new IllegalArgumentException("Logger="+name+" cannot have null flush level");
		LogLevel oldlvl = flushLevel;
		flushLevel = lvl;
		return oldlvl;
	}

	public void addLogSink(LogSink sink)
	{
		if (sink == null) throw new IllegalArgumentException("Logger="+name+" cannot add null sink");
		sinks.add(sink);
	}

	public void log(String category, LogLevel lvl, TimeStampType tstype, String msg, String file, String function, int line)
	{
		if (!isActive(lvl)) return;
		log(new LogEvent(category, lvl, tstype, msg, file, function, line));
	}

	public void log(String category, LogLevel lvl, String msg)
	{
		log(category, lvl, TimeStampType.LOCAL, msg, null, null, 0);
	}

	public void log(String category, LogLevel lvl, Throwable ex, boolean dumpStack, String msg)
	{
		if (!isActive(lvl)) return;
		if (ex == null) {log(category, lvl, msg); return;}
		if (ex instanceof NullPointerException || ex instanceof ArrayIndexOutOfBoundsException) dumpStack = true;
		String conj = (dumpStack ? SysProps.EOL+"\t" : " - ");
		log(category, lvl, "EXCEPTION: "+msg+conj+ExceptionUtils.summary(ex, dumpStack));
	}

	// Convenience methods for code which doesn't want the stream interface
	public void trace(String category, String msg) {log(category, LogLevel.TRACE, msg);}
	public void debug(String category, String msg) {log(category, LogLevel.DEBUG, msg);}
	public void info(String category, String msg) {log(category, LogLevel.INFO, msg);}
	public void warn(String category, String msg) {log(category, LogLevel.WARN, msg);}
	public void error(String category, String msg) {log(category, LogLevel.ERROR, msg);}
	public void fatal(String category, String msg) {log(category, LogLevel.FATAL, msg);}

	/**
	 * Flushes every sink. Sink failures are reported rather than thrown, unless fatal to the JVM.
	 */
	@Override
	abstract public void flush();

	/**
	 * Flushes, then releases the resources held by this logger, including its sinks. Closing twice is harmless.
	 * The logger discards any further events.
	 */
	@Override
	public void close()
	{
		synchronized (this) {
			if (closed) return;
			closed = true;
		}
		flush();
		shutdown();
		for (int idx = 0; idx != sinks.size(); idx++) {
			LogSink sink = sinks.get(idx);
			try {
				sink.close();
			} catch (Throwable ex) {
				if (ExceptionUtils.isFatal(ex)) throw (Error)ex;
				reportSinkError(sink, "close", ex);
			}
		}
	}

	// hook for subclasses to release their own resources, after the final flush but before the sinks are closed
	protected void shutdown() {}

	protected void writeSinks(LogEvent evt)
	{
		for (int idx = 0; idx != sinks.size(); idx++) {
			LogSink sink = sinks.get(idx);
			try {
				sink.write(evt);
			} catch (Throwable ex) {
				if (ExceptionUtils.isFatal(ex)) throw (Error)ex;
				reportSinkError(sink, "write", ex);
			}
		}
	}

	protected void flushSinks()
	{
		for (int idx = 0; idx != sinks.size(); idx++) {
			LogSink sink = sinks.get(idx);
			try {
				sink.flush();
			} catch (Throwable ex) {
				if (ExceptionUtils.isFatal(ex)) throw (Error)ex;
				reportSinkError(sink, "flush", ex);
			}
		}
	}

	protected void reportSinkError(LogSink sink, String action, Throwable ex)
	{
		System.err.println(DIAGMARK+"Logger="+name+" failed to "+action+" sink="+sink+" - "+ExceptionUtils.summary(ex));
	}

	@Override
	public String toString() {
		return getClass().getSimpleName()+"[name="+name+", level="+currentLevel+", flush="+flushLevel+", sinks="+sinks.size()+"]";
	}
}

/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.logging.sinks;

import java.nio.charset.StandardCharsets;

import com.vertexnova.base.ExceptionUtils;
import com.vertexnova.base.utils.FileOps;
import com.vertexnova.logging.LogEvent;

/**
 * Appends each event as one line to a file.
 * <br>
 * Output is buffered, so it only reaches the file when the buffer fills or the sink is flushed.
 * If the file cannot be opened, the failure is reported on stderr and the sink silently discards whatever it is given.
 * <p>
 * This class is MT-safe.
 */
public class FileLogSink
	extends AbstractLogSink
{
	public static final String DFLT_PATTERN = "%x [%l] [%!] %v";
	private static final int BUFSIZ = 8 * 1024;

	private final String fileName;
	private final boolean append;
	private java.io.Writer writer; //null if not open

	public FileLogSink(String fileName) {
		this(fileName, true);
	}

	public FileLogSink(String fileName, boolean append) {
		this(fileName, append, DFLT_PATTERN);
	}

	public FileLogSink(String fileName, boolean append, String pattern) {
		super(pattern);
		this.fileName = fileName;
		this.append = append;
		writer = open(fileName, append);
	}

	public String getFileName() {return fileName;}
	public boolean isAppend() {return append;}
	public synchronized boolean isOpen() {return writer != null;}

	@Override
	public synchronized void write(LogEvent evt) throws java.io.IOException
	{
		if (writer == null) return;
		writer.write(format(evt));
		writer.write('\n');
	}

	@Override
	public synchronized void flush() throws java.io.IOException
	{
		if (writer != null) writer.flush();
	}

	@Override
	public synchronized void close() throws java.io.IOException
	{
		if (writer == null) return;
		java.io.Writer w = writer;
		writer = null;
		w.close();
	}

	@Override
	public LogSink copy() {
		return new FileLogSink(fileName, true, getPattern());
	}

	private static java.io.Writer open(String pthnam, boolean append)
	{
		try {
			if (pthnam == null || pthnam.isEmpty()) throw new java.io.IOException("No log file name specified");
			java.io.File fh = new java.io.File(pthnam);
			java.io.File dirh = fh.getAbsoluteFile().getParentFile();
			if (dirh != null) FileOps.ensureDirExists(dirh);
			java.io.OutputStream strm = new java.io.FileOutputStream(fh, append);
			return new java.io.BufferedWriter(new java.io.OutputStreamWriter(strm, StandardCharsets.UTF_8), BUFSIZ);
		} catch (Exception ex) {
			System.err.println("[ERROR] : Failed to open log file="+pthnam+" - "+ExceptionUtils.summary(ex));
			return null;
		}
	}

	@Override
	public String toString() {
		return getClass().getSimpleName()+"[file="+fileName+", append="+append+", pattern="+getPattern()+"]";
	}
}

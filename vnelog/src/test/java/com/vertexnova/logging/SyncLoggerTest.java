/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.logging;

import java.io.File;
import java.io.IOException;

import com.vertexnova.base.config.SysProps;
import com.vertexnova.base.utils.FileOps;
import com.vertexnova.logging.sinks.FileLogSink;
import com.vertexnova.logging.sinks.LogSink;
import com.vertexnova.logging.sinks.MemLogSink;

public class SyncLoggerTest
{
	private final String rootpath = SysProps.TMPDIR+"/utest/vnelog/"+getClass().getName();
	static {
		SysProps.set(Logger.SYSPROP_DIAG, true);
	}

	public SyncLoggerTest() throws IOException {
		FileOps.deleteDirectory(rootpath);
	}

	@org.junit.Test
	public void testLevels()
	{
		SyncLogger log = new SyncLogger("sync-levels");
		MemLogSink sink = new MemLogSink("%l:%v");
		log.addLogSink(sink);
		org.junit.Assert.assertFalse(log.isAsync());
		org.junit.Assert.assertEquals("sync-levels", log.getName());
		org.junit.Assert.assertEquals(Logger.DFLT_LEVEL, log.getCurrentLogLevel());
		org.junit.Assert.assertEquals(Logger.DFLT_FLUSH_LEVEL, log.getFlushLevel());

		log.debug("cat", "not logged");
		log.info("cat", "logged");
		org.junit.Assert.assertEquals(1, sink.lineCount());

		org.junit.Assert.assertEquals(LogLevel.INFO, log.setCurrentLogLevel(LogLevel.TRACE));
		org.junit.Assert.assertEquals(LogLevel.TRACE, log.getCurrentLogLevel());
		log.trace("cat", "now logged");
		org.junit.Assert.assertEquals(2, sink.lineCount());

		log.setCurrentLogLevel(LogLevel.FATAL);
		log.error("cat", "not logged");
		log.fatal("cat", "logged");
		org.junit.Assert.assertEquals(3, sink.lineCount());
		org.junit.Assert.assertTrue(sink.get().endsWith("FATAL:logged"+SysProps.EOL));
		org.junit.Assert.assertTrue(log.isActive(LogLevel.FATAL));
		org.junit.Assert.assertFalse(log.isActive(LogLevel.ERROR));

		try {
			log.setCurrentLogLevel(null);
			org.junit.Assert.fail("Null level was accepted");
		} catch (IllegalArgumentException ex) {}
		log.close();
	}

	@org.junit.Test
	public void testFlushLevel() throws IOException
	{
		File fh = new File(rootpath+"/flushlevel.log");
		SyncLogger log = new SyncLogger("sync-flush");
		log.addLogSink(new FileLogSink(fh.getPath(), false, "[%l] %v"));
		log.setCurrentLogLevel(LogLevel.TRACE);
		org.junit.Assert.assertEquals(LogLevel.ERROR, log.setFlushLevel(LogLevel.WARN));

		log.info("cat", "buffered");
		org.junit.Assert.assertEquals(0, fh.length());
		log.warn("cat", "flushed");
		org.junit.Assert.assertEquals("[INFO] buffered\n[WARN] flushed\n", FileOps.readAsText(fh, null));
		log.debug("cat", "buffered again");
		org.junit.Assert.assertEquals("[INFO] buffered\n[WARN] flushed\n", FileOps.readAsText(fh, null));
		log.flush();
		org.junit.Assert.assertEquals("[INFO] buffered\n[WARN] flushed\n[DEBUG] buffered again\n", FileOps.readAsText(fh, null));
		log.close();
	}

	@org.junit.Test
	public void testSourceLocation()
	{
		SyncLogger log = new SyncLogger("sync-source");
		MemLogSink sink = new MemLogSink("%n|%l|%$|%!|%#|%v");
		log.addLogSink(sink);
		log.log("render", LogLevel.WARN, TimeStampType.UTC, "slow frame", "Renderer.java", "draw", 123);
		org.junit.Assert.assertEquals("render|WARN|Renderer.java|draw|123|slow frame"+SysProps.EOL, sink.get());
		log.close();
	}

	@org.junit.Test
	public void testException()
	{
		SyncLogger log = new SyncLogger("sync-exception");
		MemLogSink sink = new MemLogSink("%v");
		log.addLogSink(sink);
		log.log("cat", LogLevel.ERROR, new java.io.IOException("Dummy failure"), false, "Operation failed");
		String txt = sink.get();
		org.junit.Assert.assertTrue(txt, txt.startsWith("EXCEPTION: Operation failed - "));
		org.junit.Assert.assertTrue(txt, txt.contains("Dummy failure"));
		sink.reset();
		log.log("cat", LogLevel.ERROR, null, true, "No exception");
		org.junit.Assert.assertEquals("No exception"+SysProps.EOL, sink.get());
		sink.reset();
		log.log("cat", LogLevel.DEBUG, new java.io.IOException("Dummy failure"), true, "Below threshold");
		org.junit.Assert.assertEquals(0, sink.length());
		log.close();
	}

	@org.junit.Test
	public void testSinkFailure()
	{
		SyncLogger log = new SyncLogger("sync-badsink");
		LogSink badsink = new MemLogSink() {
			@Override
			public void write(LogEvent evt) {throw new IllegalStateException("Dummy sink failure");}
			@Override
			public void flush() throws IOException {throw new IOException("Dummy flush failure");}
		};
		MemLogSink goodsink = new MemLogSink("%v");
		log.addLogSink(badsink);
		log.addLogSink(goodsink);
		log.error("cat", "still delivered");
		org.junit.Assert.assertEquals("still delivered"+SysProps.EOL, goodsink.get());
		log.flush();
		log.close();
	}

	@org.junit.Test
	public void testClone()
	{
		SyncLogger log = new SyncLogger("sync-orig");
		log.addLogSink(new MemLogSink());
		log.setCurrentLogLevel(LogLevel.DEBUG);
		log.setFlushLevel(LogLevel.WARN);
		Logger log2 = log.clone("sync-clone");
		org.junit.Assert.assertNotNull(log2);
		org.junit.Assert.assertSame(SyncLogger.class, log2.getClass());
		org.junit.Assert.assertEquals("sync-clone", log2.getName());
		org.junit.Assert.assertEquals(LogLevel.DEBUG, log2.getCurrentLogLevel());
		org.junit.Assert.assertEquals(LogLevel.WARN, log2.getFlushLevel());
		org.junit.Assert.assertEquals(1, log.getLogSinks().size());
		org.junit.Assert.assertTrue(log2.getLogSinks().isEmpty());
		log.close();
		log2.close();
	}

	@org.junit.Test
	public void testClose()
	{
		SyncLogger log = new SyncLogger("sync-close");
		MemLogSink sink = new MemLogSink("%v");
		log.addLogSink(sink);
		log.info("cat", "before");
		org.junit.Assert.assertFalse(log.isClosed());
		log.close();
		org.junit.Assert.assertTrue(log.isClosed());
		org.junit.Assert.assertEquals(0, sink.length()); //MemLogSink discards its contents on close
		log.info("cat", "after");
		org.junit.Assert.assertEquals(0, sink.length());
		log.close();

		try {
			log.addLogSink(null);
			org.junit.Assert.fail("Null sink was accepted");
		} catch (IllegalArgumentException ex) {}
		try {
			new SyncLogger("");
			org.junit.Assert.fail("Blank name was accepted");
		} catch (IllegalArgumentException ex) {}
		try {
			log.getLogSinks().clear();
			org.junit.Assert.fail("Sink list is modifiable");
		} catch (UnsupportedOperationException ex) {}
	}

	@org.junit.Test
	public void testSinkError()
	{
		SyncLogger log = new SyncLogger("sync-errorsink");
		LogSink badsink = new MemLogSink() {
			@Override
			public void write(LogEvent evt) {throw new AssertionError("Dummy sink error");}
			@Override
			public void flush() {throw new AssertionError("Dummy flush error");}
			@Override
			public synchronized void close() {throw new AssertionError("Dummy close error");}
		};
		MemLogSink goodsink = new MemLogSink("%v");
		log.addLogSink(badsink);
		log.addLogSink(goodsink);
		log.info("cat", "delivered despite error");
		log.error("cat", "flushed despite error");
		org.junit.Assert.assertEquals("delivered despite error"+SysProps.EOL+"flushed despite error"+SysProps.EOL, goodsink.get());
		log.flush();
		log.close();
		org.junit.Assert.assertTrue(log.isClosed());
	}

	@org.junit.Test
	public void testLevelMatrix()
	{
		SyncLogger log = new SyncLogger("sync-matrix");
		MemLogSink sink = new MemLogSink("%l");
		log.addLogSink(sink);
		for (LogLevel threshold : LogLevel.values()) {
			log.setCurrentLogLevel(threshold);
			for (LogLevel lvl : LogLevel.values()) {
				sink.reset();
				log.log("cat", lvl, "msg");
				if (lvl.ordinal() >= threshold.ordinal()) {
					org.junit.Assert.assertEquals(threshold+"/"+lvl, lvl.name()+SysProps.EOL, sink.get());
				} else {
					org.junit.Assert.assertEquals(threshold+"/"+lvl, 0, sink.length());
				}
			}
		}
		log.close();
	}

	@org.junit.Test
	public void testConcurrentWriters() throws InterruptedException, IOException
	{
		File fh = new File(rootpath+"/concurrent.log");
		SyncLogger log = new SyncLogger("sync-mt");
		MemLogSink sink = new MemLogSink("%n %v");
		log.addLogSink(sink);
		log.addLogSink(new FileLogSink(fh.getPath(), false, "%n %v"));
		Thread[] thrds = new Thread[4];
		for (int tid = 0; tid != thrds.length; tid++) {
			final String cat = "T"+tid;
			thrds[tid] = new Thread(() -> {
				for (int idx = 0; idx != 250; idx++) log.info(cat, "msg"+idx);
			});
			thrds[tid].start();
		}
		for (Thread thrd : thrds) thrd.join();
		org.junit.Assert.assertEquals(1000, sink.lineCount());
		verifyLines(sink.get(), SysProps.EOL, thrds.length, 250);
		log.flush();
		verifyLines(FileOps.readAsText(fh, null), "\n", thrds.length, 250);
		log.close();
	}

	// every line must be one whole "T<n> msg<i>" and each thread's lines must appear in the order it logged them
	static void verifyLines(String txt, String eol, int threads, int perThread)
	{
		org.junit.Assert.assertTrue(txt.endsWith(eol));
		String[] lines = txt.substring(0, txt.length() - eol.length()).split(java.util.regex.Pattern.quote(eol), -1);
		org.junit.Assert.assertEquals(threads * perThread, lines.length);
		int[] next = new int[threads];
		for (int idx = 0; idx != lines.length; idx++) {
			String line = lines[idx];
			int pos = line.indexOf(" msg");
			org.junit.Assert.assertTrue("Malformed line="+line, line.startsWith("T") && pos > 1);
			int tid = Integer.parseInt(line.substring(1, pos));
			int seq = Integer.parseInt(line.substring(pos + 4));
			org.junit.Assert.assertEquals("Out of order line="+line, next[tid], seq);
			next[tid]++;
		}
		for (int tid = 0; tid != threads; tid++) {
			org.junit.Assert.assertEquals(perThread, next[tid]);
		}
	}
}

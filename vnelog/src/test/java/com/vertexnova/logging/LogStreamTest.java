/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.logging;

import com.vertexnova.base.config.SysProps;
import com.vertexnova.logging.sinks.MemLogSink;

public class LogStreamTest
{
	private final LoggerRegistry registry = new LoggerRegistry();
	private final SyncLogger logger = new SyncLogger("stream-logger");
	private final MemLogSink sink = new MemLogSink("%n|%l|%$|%!|%v");

	public LogStreamTest() {
		logger.addLogSink(sink);
		registry.registerLogger(logger.getName(), logger);
	}

	@org.junit.Test
	public void testAppend()
	{
		try (LogStream ls = new LogStream(registry, "stream-logger", "net", LogLevel.WARN, TimeStampType.UTC)) {
			ls.append("retry ").append(3).append('/').append(5L).append(" after ").append(1.5).append("s ").append(true).append(' ').append((Object)null);
			org.junit.Assert.assertEquals("retry 3/5 after 1.5s true null", ls.getMessage());
			org.junit.Assert.assertEquals(0, sink.lineCount());
		}
		org.junit.Assert.assertEquals("net|WARN|LogStreamTest.java|testAppend|retry 3/5 after 1.5s true null"+SysProps.EOL, sink.get());
	}

	@org.junit.Test
	public void testCaptureSource()
	{
		LogStream ls = new LogStream(registry, "stream-logger", "cat", LogLevel.INFO, null);
		org.junit.Assert.assertEquals("LogStreamTest.java", ls.getFile());
		org.junit.Assert.assertEquals("testCaptureSource", ls.getFunction());
		org.junit.Assert.assertTrue(ls.getLine() > 0);
		org.junit.Assert.assertEquals("stream-logger", ls.getLoggerName());
		org.junit.Assert.assertEquals("cat", ls.getCategory());
		org.junit.Assert.assertEquals(LogLevel.INFO, ls.getLevel());

		LogStream ls2 = new LogStream(registry, "stream-logger", "cat", LogLevel.INFO, TimeStampType.LOCAL, "Explicit.java", "run", 7);
		ls2.append("explicit").close();
		org.junit.Assert.assertEquals("cat|INFO|Explicit.java|run|explicit"+SysProps.EOL, sink.get());
	}

	@org.junit.Test
	public void testCloseOnce()
	{
		LogStream ls = new LogStream(registry, "stream-logger", "cat", LogLevel.ERROR, TimeStampType.LOCAL);
		ls.append("once");
		ls.close();
		ls.close();
		org.junit.Assert.assertEquals(1, sink.lineCount());
	}

	@org.junit.Test
	public void testDropped()
	{
		new LogStream(registry, "stream-logger", "cat", LogLevel.DEBUG, TimeStampType.LOCAL).append("below level").close();
		new LogStream(registry, "no-such-logger", "cat", LogLevel.FATAL, TimeStampType.LOCAL).append("no logger").close();
		new LogStream(null, "stream-logger", "cat", LogLevel.FATAL, TimeStampType.LOCAL).append("no registry").close();
		org.junit.Assert.assertEquals(0, sink.lineCount());

		try {
			new LogStream(registry, "stream-logger", "cat", null, TimeStampType.LOCAL);
			org.junit.Assert.fail("Null level was accepted");
		} catch (IllegalArgumentException ex) {}
	}

	@org.junit.Test
	public void testLateBinding()
	{
		LogStream ls = new LogStream(registry, "late-logger", "cat", LogLevel.INFO, TimeStampType.LOCAL);
		ls.append("bound at close");
		SyncLogger late = new SyncLogger("late-logger");
		MemLogSink latesink = new MemLogSink("%v");
		late.addLogSink(latesink);
		registry.registerLogger(late.getName(), late);
		ls.close();
		org.junit.Assert.assertEquals("bound at close"+SysProps.EOL, latesink.get());
	}
}

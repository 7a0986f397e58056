/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.logging;

import com.vertexnova.base.config.SysProps;
import com.vertexnova.logging.sinks.MemLogSink;

public class JUL_HandlerTest
{
	@org.junit.Test
	public void testRouting()
	{
		SyncLogger log = new SyncLogger("jul-target");
		MemLogSink sink = new MemLogSink("%n|%l|%$|%!|%v");
		log.addLogSink(sink);
		log.setCurrentLogLevel(LogLevel.DEBUG);

		java.util.logging.Logger jul = JUL_Handler.install(log, "vnelog.jultest");
		org.junit.Assert.assertFalse(jul.getUseParentHandlers());
		org.junit.Assert.assertEquals(1, jul.getHandlers().length);
		org.junit.Assert.assertSame(log, ((JUL_Handler)jul.getHandlers()[0]).getLogger());
		org.junit.Assert.assertEquals(java.util.logging.Level.FINE, jul.getLevel());

		jul.logp(java.util.logging.Level.WARNING, "com.example.Conn", "connect", "Retry {0} of {1}", new Object[]{2, 5});
		jul.finest("not logged");
		String expect = "vnelog.jultest|WARN|com.example.Conn|connect|Retry 2 of 5"+SysProps.EOL;
		org.junit.Assert.assertEquals(expect, sink.get());

		sink.reset();
		jul.log(java.util.logging.Level.SEVERE, "Failed", new IllegalStateException("Dummy JUL exception"));
		org.junit.Assert.assertTrue(sink.get(), sink.get().contains("|ERROR|"));
		org.junit.Assert.assertTrue(sink.get(), sink.get().contains("Failed - "));
		org.junit.Assert.assertTrue(sink.get(), sink.get().contains("Dummy JUL exception"));

		// reinstalling replaces the previous handler
		JUL_Handler.install(log, "vnelog.jultest");
		org.junit.Assert.assertEquals(1, jul.getHandlers().length);
		jul.getHandlers()[0].close();
		log.close();
	}
}

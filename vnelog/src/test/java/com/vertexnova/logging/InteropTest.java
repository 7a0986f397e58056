/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.logging;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class InteropTest
{
	@org.junit.Test
	public void testActive()
	{
		LogLevel logger = LogLevel.TRACE;
		for (LogLevel lvl : LogLevel.values()) {
			org.junit.Assert.assertTrue(Interop.isActive(logger, lvl));
		}

		logger = LogLevel.FATAL;
		org.junit.Assert.assertTrue(Interop.isActive(logger, LogLevel.FATAL));
		org.junit.Assert.assertFalse(Interop.isActive(logger, LogLevel.ERROR));
		org.junit.Assert.assertFalse(Interop.isActive(logger, LogLevel.TRACE));

		logger = LogLevel.INFO;
		org.junit.Assert.assertTrue(Interop.isActive(logger, LogLevel.INFO));
		org.junit.Assert.assertTrue(Interop.isActive(logger, LogLevel.WARN));
		org.junit.Assert.assertTrue(Interop.isActive(logger, LogLevel.ERROR));
		org.junit.Assert.assertTrue(Interop.isActive(logger, LogLevel.FATAL));
		org.junit.Assert.assertFalse(Interop.isActive(logger, LogLevel.DEBUG));
		org.junit.Assert.assertFalse(Interop.isActive(logger, LogLevel.TRACE));

		org.junit.Assert.assertFalse(Interop.isActive(null, LogLevel.FATAL));
		org.junit.Assert.assertFalse(Interop.isActive(LogLevel.TRACE, null));
	}

	@org.junit.Test
	public void testLevels_JUL()
	{
		org.junit.Assert.assertEquals(LogLevel.ERROR, Interop.mapLevel(java.util.logging.Level.SEVERE));
		org.junit.Assert.assertEquals(LogLevel.WARN, Interop.mapLevel(java.util.logging.Level.WARNING));
		org.junit.Assert.assertEquals(LogLevel.INFO, Interop.mapLevel(java.util.logging.Level.INFO));
		org.junit.Assert.assertEquals(LogLevel.DEBUG, Interop.mapLevel(java.util.logging.Level.CONFIG));
		org.junit.Assert.assertEquals(LogLevel.DEBUG, Interop.mapLevel(java.util.logging.Level.FINE));
		org.junit.Assert.assertEquals(LogLevel.TRACE, Interop.mapLevel(java.util.logging.Level.FINER));
		org.junit.Assert.assertEquals(LogLevel.TRACE, Interop.mapLevel(java.util.logging.Level.FINEST));
		org.junit.Assert.assertEquals(LogLevel.TRACE, Interop.mapLevel(java.util.logging.Level.ALL));
		org.junit.Assert.assertEquals(LogLevel.FATAL, Interop.mapLevel(java.util.logging.Level.OFF));

		// round trip is exact, apart from FATAL which JUL has no equivalent for
		for (LogLevel lvl : LogLevel.values()) {
			LogLevel expect = (lvl == LogLevel.FATAL ? LogLevel.ERROR : lvl);
			org.junit.Assert.assertEquals(expect, Interop.mapLevel(Interop.mapLevel(lvl)));
		}

		java.util.logging.Logger parent = java.util.logging.Logger.getLogger("vnelog.interop");
		java.util.logging.Logger jul = java.util.logging.Logger.getLogger("vnelog.interop.child");
		parent.setLevel(java.util.logging.Level.WARNING);
		org.junit.Assert.assertEquals(java.util.logging.Level.WARNING, Interop.getEffectiveLevel(jul));
		org.junit.Assert.assertEquals(LogLevel.WARN, Interop.getLevel(jul));
	}

	@org.junit.Test
	public void testLevels_SLF4J()
	{
		org.junit.Assert.assertEquals(LogLevel.ERROR, Interop.mapLevel(org.slf4j.event.Level.ERROR));
		org.junit.Assert.assertEquals(LogLevel.WARN, Interop.mapLevel(org.slf4j.event.Level.WARN));
		org.junit.Assert.assertEquals(LogLevel.INFO, Interop.mapLevel(org.slf4j.event.Level.INFO));
		org.junit.Assert.assertEquals(LogLevel.DEBUG, Interop.mapLevel(org.slf4j.event.Level.DEBUG));
		org.junit.Assert.assertEquals(LogLevel.TRACE, Interop.mapLevel(org.slf4j.event.Level.TRACE));
		org.junit.Assert.assertEquals(org.slf4j.event.Level.ERROR, Interop.mapSlf4jLevel(LogLevel.FATAL));
		org.junit.Assert.assertEquals(org.slf4j.event.Level.DEBUG, Interop.mapSlf4jLevel(LogLevel.DEBUG));

		org.slf4j.Logger extlog = mock(org.slf4j.Logger.class);
		when(extlog.isInfoEnabled()).thenReturn(true);
		org.junit.Assert.assertEquals(LogLevel.INFO, Interop.getLevel(extlog));
		when(extlog.isTraceEnabled()).thenReturn(true);
		org.junit.Assert.assertEquals(LogLevel.TRACE, Interop.getLevel(extlog));
	}
}

/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.logging.format;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

import com.vertexnova.logging.TimeStampType;

public class TimeStampTest
{
	@org.junit.Test
	public void testUTC()
	{
		Clock clock = Clock.fixed(Instant.parse("2024-02-29T23:59:58Z"), ZoneOffset.UTC);
		TimeStamp ts = new TimeStamp(TimeStampType.UTC, clock);
		org.junit.Assert.assertEquals(TimeStampType.UTC, ts.getType());
		org.junit.Assert.assertEquals("2024-02-29 23:59:58", ts.getTimeStamp());
		org.junit.Assert.assertEquals("1970-01-01 00:00:00", ts.format(0));
		org.junit.Assert.assertEquals("1970-01-01 00:00:01", TimeStamp.format(TimeStampType.UTC, 1999));
	}

	@org.junit.Test
	public void testLocal()
	{
		Instant now = Instant.parse("2024-06-15T12:30:45Z");
		TimeStamp ts = new TimeStamp(null, Clock.fixed(now, ZoneOffset.UTC));
		org.junit.Assert.assertEquals(TimeStampType.LOCAL, ts.getType());
		String expect = DateTimeFormatter.ofPattern(TimeStamp.PATTERN).format(LocalDateTime.ofInstant(now, ZoneId.systemDefault()));
		org.junit.Assert.assertEquals(expect, ts.getTimeStamp());
		org.junit.Assert.assertEquals(TimeStamp.PATTERN.length(), ts.getTimeStamp().length());
	}
}

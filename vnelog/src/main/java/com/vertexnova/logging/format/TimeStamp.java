/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.logging.format;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

import com.vertexnova.base.config.SysProps;
import com.vertexnova.logging.TimeStampType;

/**
 * Renders wall-clock time as yyyy-MM-dd HH:mm:ss, in either the local timezone or UTC.
 * <br>
 * The local timezone is the JVM default unless overridden by the vne.timezone setting.
 */
public class TimeStamp
{
	public static final String SYSPROP_TIMEZONE = "vne.timezone";
	public static final String PATTERN = "yyyy-MM-dd HH:mm:ss";

	private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern(PATTERN);
	private static final ZoneId LOCAL_ZONE = getLocalZone();

	private final TimeStampType type;
	private final Clock clock;

	public TimeStamp(TimeStampType type) {
		this(type, Clock.systemUTC());
	}

	public TimeStamp(TimeStampType type, Clock clock) {
		this.type = (type == null ? TimeStampType.LOCAL : type);
		this.clock = clock;
	}

	public TimeStampType getType() {return type;}

	public String getTimeStamp() {
		return format(type, clock.millis());
	}

	public String format(long systime) {
		return format(type, systime);
	}

	public static String format(TimeStampType type, long systime) {
		ZoneId zone = (type == TimeStampType.UTC ? ZoneOffset.UTC : LOCAL_ZONE);
		return FORMATTER.format(Instant.ofEpochMilli(systime).atZone(zone));
	}

	private static ZoneId getLocalZone() {
		String tz = SysProps.get(SYSPROP_TIMEZONE);
		return (tz == null ? ZoneId.systemDefault() : ZoneId.of(tz));
	}
}

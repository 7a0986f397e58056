/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.logging;

import com.vertexnova.logging.format.LogFormatter;

/**
 * A single rendered log message plus its metadata.
 * <br>
 * Instances are immutable, so the same event can be handed to a background thread and to several sinks without copying.
 * The event time and the originating thread's label are captured when the event is created, so they reflect the caller
 * rather than the thread which eventually writes the event.
 */
public final class LogEvent
{
	private final String category;
	private final LogLevel level;
	private final TimeStampType timeStampType;
	private final String message;
	private final String file;
	private final String function;
	private final int line;
	private final long timeMillis;
	private final String threadLabel;

	public LogEvent(String category, LogLevel level, TimeStampType tstype, String message, String file, String function, int line)
	{
		this(category, level, tstype, message, file, function, line, System.currentTimeMillis(), LogFormatter.threadLabel());
	}

	public LogEvent(String category, LogLevel level, TimeStampType tstype, String message, String file, String function, int line,
			long timeMillis, String threadLabel)
	{
		if (level == null) throw new IllegalArgumentException("LogEvent requires a level");
		this.category = (category == null ? "" : category);
		this.level = level;
		this.timeStampType = (tstype == null ? TimeStampType.LOCAL : tstype);
		this.message = (message == null ? "" : message);
		this.file = (file == null ? "" : file);
		this.function = (function == null ? "" : function);
		this.line = line;
		this.timeMillis = timeMillis;
		this.threadLabel = threadLabel;
	}

	public String getCategory() {return category;}
	public LogLevel getLevel() {return level;}
	public TimeStampType getTimeStampType() {return timeStampType;}
	public String getMessage() {return message;}
	public String getFile() {return file;}
	public String getFunction() {return function;}
	public int getLine() {return line;}
	public long getTimeMillis() {return timeMillis;}
	public String getThreadLabel() {return threadLabel;}

	@Override
	public String toString() {
		return "LogEvent[category="+category+", level="+level+", msg="+message+"]";
	}
}

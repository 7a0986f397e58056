/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.logging.format;

import java.util.concurrent.atomic.AtomicInteger;

import com.vertexnova.logging.LogEvent;

/**
 * Expands a log pattern against a log event.
 * <p>
 * Recognised tokens are:
 * <ul>
 * <li>%x - timestamp, local or UTC as dictated by the event</li>
 * <li>%n - category</li>
 * <li>%l - level</li>
 * <li>%t - label of the thread which created the event, eg. Thread-3</li>
 * <li>%$ - source file</li>
 * <li>%! - function</li>
 * <li>%# - line number</li>
 * <li>%v - message</li>
 * </ul>
 * Any other character following a % is emitted as-is, along with the %, as is a trailing %.
 * <br>
 * This class is stateless apart from the thread labels and is MT-safe.
 */
public class LogFormatter
{
	private static final String THREAD_PREFIX = "Thread-";
	private static final AtomicInteger nextThreadId = new AtomicInteger(1);
	private static final ThreadLocal<String> threadLabel = ThreadLocal.withInitial(() -> THREAD_PREFIX+nextThreadId.getAndIncrement());

	/**
	 * Returns the short label of the calling thread. Labels are allocated in order of first use and never change.
	 */
	public static String threadLabel() {
		return threadLabel.get();
	}

	public static String format(LogEvent evt, String pattern)
	{
		if (pattern == null) return evt.getMessage();
		StringBuilder sb = new StringBuilder(pattern.length() + evt.getMessage().length() + 32);
		int len = pattern.length();

		for (int idx = 0; idx != len; idx++) {
			char ch = pattern.charAt(idx);
			if (ch != '%' || idx == len - 1) {
				sb.append(ch);
				continue;
			}
			char token = pattern.charAt(++idx);
			switch (token) {
			case 'x':
				sb.append(TimeStamp.format(evt.getTimeStampType(), evt.getTimeMillis()));
				break;
			case 'n':
				sb.append(evt.getCategory());
				break;
			case 'l':
				sb.append(evt.getLevel().getLabel());
				break;
			case 't':
				sb.append(evt.getThreadLabel());
				break;
			case '$':
				sb.append(evt.getFile());
				break;
			case '!':
				sb.append(evt.getFunction());
				break;
			case '#':
				sb.append(evt.getLine());
				break;
			case 'v':
				sb.append(evt.getMessage());
				break;
			default:
				sb.append('%').append(token);
				break;
			}
		}
		return sb.toString();
	}
}

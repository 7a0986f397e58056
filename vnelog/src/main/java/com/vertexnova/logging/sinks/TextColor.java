/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.logging.sinks;

import com.vertexnova.base.config.SysProps;
import com.vertexnova.logging.LogLevel;

/**
 * ANSI display attributes for console output.
 * <p>
 * Colour is emitted only if it is enabled. Unless setColorEnabled() has been called, that is decided by the environment:
 * FORCE_COLOR (any value except 0) enables it, NO_COLOR disables it, as does a missing or dumb TERM. Otherwise colour is
 * enabled if the JVM has a console.
 */
public class TextColor
{
	public static final String ESC = "\033[";
	public static final String RESET = ESC+"0m";

	public enum Attribute {
		NORMAL(0), BOLD(1), FAINT(2), ITALIC(3), UNDERLINE(4), BLINK(5), REVERSE(7), HIDDEN(8);
		public final int code;
		Attribute(int code) {this.code = code;}
	}

	public enum Foreground {
		BLACK(30), RED(31), GREEN(32), YELLOW(33), BLUE(34), MAGENTA(35), CYAN(36), LIGHT_GRAY(37), DEFAULT(39),
		DARK_GRAY(90), LIGHT_RED(91), LIGHT_GREEN(92), LIGHT_YELLOW(93), LIGHT_BLUE(94), LIGHT_MAGENTA(95), LIGHT_CYAN(96), WHITE(97);
		public final int code;
		Foreground(int code) {this.code = code;}
	}

	public enum Background {
		BLACK(40), RED(41), GREEN(42), YELLOW(43), BLUE(44), MAGENTA(45), CYAN(46), LIGHT_GRAY(47), DEFAULT(49),
		DARK_GRAY(100), LIGHT_RED(101), LIGHT_GREEN(102), LIGHT_YELLOW(103), LIGHT_BLUE(104), LIGHT_MAGENTA(105), LIGHT_CYAN(106), WHITE(107);
		public final int code;
		Background(int code) {this.code = code;}
	}

	private static volatile Boolean colorOverride;

	private final Attribute attribute;
	private final Foreground foreground;
	private final Background background;

	public TextColor() {
		this(Attribute.NORMAL, Foreground.DEFAULT, Background.DEFAULT);
	}

	public TextColor(Attribute attr, Foreground fg, Background bg) {
		attribute = attr;
		foreground = fg;
		background = bg;
	}

	public Attribute getAttribute() {return attribute;}
	public Foreground getForeground() {return foreground;}
	public Background getBackground() {return background;}

	public String toAnsi() {
		return ESC+attribute.code+";"+foreground.code+";"+background.code+"m";
	}

	/**
	 * Returns the escape sequence for this colour, or an empty string if colour is disabled.
	 */
	@Override
	public String toString() {
		return (isColorEnabled() ? toAnsi() : "");
	}

	public static TextColor forLevel(LogLevel lvl)
	{
		switch (lvl) {
		case TRACE:
			return new TextColor(Attribute.NORMAL, Foreground.LIGHT_GRAY, Background.DEFAULT);
		case DEBUG:
			return new TextColor(Attribute.NORMAL, Foreground.BLUE, Background.DEFAULT);
		case INFO:
			return new TextColor(Attribute.NORMAL, Foreground.GREEN, Background.DEFAULT);
		case WARN:
			return new TextColor(Attribute.BOLD, Foreground.YELLOW, Background.DEFAULT);
		case ERROR:
			return new TextColor(Attribute.BOLD, Foreground.RED, Background.DEFAULT);
		case FATAL:
			return new TextColor(Attribute.BOLD, Foreground.MAGENTA, Background.DEFAULT);
		default:
			return new TextColor();
		}
	}

	public static void setColorEnabled(boolean enabled) {
		colorOverride = enabled;
	}

	/**
	 * Discards any setColorEnabled() override, so that the environment decides again.
	 */
	public static void resetColorEnabled() {
		colorOverride = null;
	}

	public static boolean isColorEnabled() {
		Boolean override = colorOverride;
		return (override == null ? isColorSupported() : override);
	}

	public static String getResetSequence() {
		return (isColorEnabled() ? RESET : "");
	}

	public static boolean isColorSupported()
	{
		String force = SysProps.getEnv("FORCE_COLOR");
		if (force != null) return !force.equals("0");
		if (SysProps.getEnv("NO_COLOR") != null) return false;
		String term = SysProps.getEnv("TERM");
		if (term == null || term.equals("dumb")) return SysProps.isWindows && System.console() != null;
		return System.console() != null;
	}
}

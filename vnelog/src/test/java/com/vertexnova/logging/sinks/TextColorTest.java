/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.logging.sinks;

import com.vertexnova.base.config.SysProps;
import com.vertexnova.logging.LogLevel;

public class TextColorTest
{
	@org.junit.After
	public void reset() {
		TextColor.resetColorEnabled();
		SysProps.clearAppEnv();
	}

	@org.junit.Test
	public void testSequences()
	{
		TextColor tc = new TextColor(TextColor.Attribute.BOLD, TextColor.Foreground.RED, TextColor.Background.DEFAULT);
		org.junit.Assert.assertEquals("\033[1;31;49m", tc.toAnsi());
		org.junit.Assert.assertEquals("\033[0;39;49m", new TextColor().toAnsi());
		org.junit.Assert.assertEquals("\033[0m", TextColor.RESET);
		org.junit.Assert.assertEquals(TextColor.Foreground.GREEN, TextColor.forLevel(LogLevel.INFO).getForeground());
		org.junit.Assert.assertEquals(TextColor.Foreground.RED, TextColor.forLevel(LogLevel.ERROR).getForeground());

		TextColor.setColorEnabled(true);
		org.junit.Assert.assertTrue(TextColor.isColorEnabled());
		org.junit.Assert.assertEquals(tc.toAnsi(), tc.toString());
		org.junit.Assert.assertEquals(TextColor.RESET, TextColor.getResetSequence());

		TextColor.setColorEnabled(false);
		org.junit.Assert.assertFalse(TextColor.isColorEnabled());
		org.junit.Assert.assertEquals("", tc.toString());
		org.junit.Assert.assertEquals("", TextColor.getResetSequence());
	}

	@org.junit.Test
	public void testEnvironment()
	{
		SysProps.setAppEnv("FORCE_COLOR", "1");
		SysProps.setAppEnv("NO_COLOR", "1");
		org.junit.Assert.assertTrue(TextColor.isColorSupported());
		org.junit.Assert.assertTrue(TextColor.isColorEnabled());

		SysProps.setAppEnv("FORCE_COLOR", "0");
		org.junit.Assert.assertFalse(TextColor.isColorSupported());

		// the real environment may force colour, in which case NO_COLOR cannot be tested
		org.junit.Assume.assumeTrue(System.getenv("FORCE_COLOR") == null);
		SysProps.setAppEnv("FORCE_COLOR", null);
		org.junit.Assert.assertFalse(TextColor.isColorSupported());
	}
}

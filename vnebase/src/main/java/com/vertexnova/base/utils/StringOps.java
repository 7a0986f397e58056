/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.base.utils;

public class StringOps
{
	public static boolean stringAsBool(String strval)
	{
		if (strval == null) return false;
		return (strval.equalsIgnoreCase("YES") || strval.equalsIgnoreCase("Y")
				|| strval.equalsIgnoreCase("TRUE") || strval.equalsIgnoreCase("T")
				|| strval.equalsIgnoreCase("ON")
				|| strval.equals("1"));
	}

	public static String boolAsString(boolean bval)
	{
		return (bval ? "Y" : "N");
	}
}

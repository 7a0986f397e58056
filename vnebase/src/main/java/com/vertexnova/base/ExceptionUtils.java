/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.base;

import com.vertexnova.base.config.SysProps;

public class ExceptionUtils
{
	public static String summary(Throwable ex)
	{
		return summary(ex, false);
	}

	public static String summary(Throwable ex, boolean withstack)
	{
		StringBuilder strbuf = new StringBuilder(128);

		if (withstack) {
			java.io.StringWriter sw = new java.io.StringWriter();
			java.io.PrintWriter pw = new java.io.PrintWriter(sw, false);
			ex.printStackTrace(pw);
			pw.close();
			strbuf.append(sw);
		} else {
			int level = 1;
			while (ex != null) {
				if (level != 1) strbuf.append(SysProps.EOL).append("\tCaused by: ");
				strbuf.append("Exception-").append(level++).append('=').append(ex.toString());
				ex = ex.getCause();
			}
		}
		return strbuf.toString();
	}

	// Errors from which the JVM cannot meaningfully continue. Only the background worker contains them, as it has no caller to hand them to.
	public static boolean isFatal(Throwable ex)
	{
		return (ex instanceof VirtualMachineError || ex instanceof LinkageError);
	}
}

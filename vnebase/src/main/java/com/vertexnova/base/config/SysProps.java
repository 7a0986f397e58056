/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.base.config;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.vertexnova.base.utils.StringOps;

/**
 * Single point of access for runtime settings.
 * <br>
 * A setting named a.b.c is looked up as the application-environment entry A_B_C, then the environment variable A_B_C, then the
 * system property a.b.c, and finally the supplied default.
 * The optional vne.properties file is merged into the system properties when this class loads.
 */
public class SysProps
{
	private static final Map<String,String> AppEnv = new ConcurrentHashMap<>(); //primarily intended for the benefit of tests

	public static final String NULLMARKER = "-";  // placeholder value that translates to null
	public static final String EOL = System.getProperty("line.separator", "\n");
	public static final String DirSep = System.getProperty("file.separator", "/");

	public static final String SYSPROP_PROPSFILE = "vne.properties";
	public static final String SYSPROP_DIRPATH_TMP = "vne.paths.tmp";
	public static final String DIRTOKEN_TMP = "%DIRTMP%";
	public static final String TMPDIR = getTempDir();

	public static final String OS_NAME = System.getProperty("os.name", "");
	public static final boolean isWindows = OS_NAME.startsWith("Windows");
	public static final boolean isMacOS = OS_NAME.startsWith("Mac") || OS_NAME.startsWith("Darwin");

	static {
		loadProperties();
	}

	public static String get(String name)
	{
		return get(name, null);
	}

	public static String get(String name, String dflt)
	{
		String envName = name.replace('.', '_').toUpperCase();
		String val = AppEnv.get(envName);
		if (val == null || val.isEmpty()) val = System.getenv(envName);
		if (val == null || val.isEmpty()) val = System.getProperty(name);
		if (val == null || val.isEmpty()) val = dflt;
		if (val == null || val.isEmpty() || NULLMARKER.equals(val)) val = null;
		return val;
	}

	public static boolean get(String name, boolean dflt)
	{
		return StringOps.stringAsBool(get(name, StringOps.boolAsString(dflt)));
	}

	public static int get(String name, int dflt)
	{
		return Integer.parseInt(get(name, Integer.toString(dflt)));
	}

	public static String set(String name, String newval)
	{
		java.util.Properties props = System.getProperties();
		String oldval = (newval == null || newval.isEmpty() ? (String)props.remove(name) : (String)props.setProperty(name, newval));
		if (oldval != null && oldval.isEmpty()) oldval = null;
		return oldval;
	}

	public static boolean set(String name, boolean val)
	{
		String oldval = set(name, StringOps.boolAsString(val));
		return StringOps.stringAsBool(oldval);
	}

	public static int set(String name, int val)
	{
		String oldval = set(name, Integer.toString(val));
		return (oldval == null ? 0 : Integer.parseInt(oldval));
	}

	/**
	 * Application-level override of an environment variable. A null or blank value removes the override.
	 */
	public static void setAppEnv(String name, String val) {
		name = name.toUpperCase();
		if (val == null || val.isEmpty()) {
			AppEnv.remove(name);
		} else {
			AppEnv.put(name, val);
		}
	}

	public static void clearAppEnv() {
		AppEnv.clear();
	}

	/**
	 * Returns the environment variable of the given name, honouring any application-level override.
	 */
	public static String getEnv(String name)
	{
		String val = AppEnv.get(name.toUpperCase());
		if (val == null || val.isEmpty()) val = System.getenv(name);
		return (val == null || val.isEmpty() ? null : val);
	}

	public static java.util.Properties load(String pthnam) throws java.io.IOException
	{
		java.io.File fh = new java.io.File(pthnam);
		if (!fh.exists()) return null;
		java.util.Properties props = new java.util.Properties();
		try (java.io.FileInputStream strm = new java.io.FileInputStream(fh)) {
			props.load(strm);
		}
		return props;
	}

	private static void loadProperties()
	{
		String pthnam = get(SYSPROP_PROPSFILE);
		if (pthnam == null) {
			String[] huntpath = new String[]{"./vne.properties", "./conf/vne.properties",
					System.getProperty("user.home", ".")+"/vne.properties"};
			for (int idx = 0; idx != huntpath.length; idx++) {
				java.io.File fh = new java.io.File(huntpath[idx]);
				if (fh.exists()) {
					pthnam = fh.getAbsolutePath();
					break;
				}
			}
		}
		if (pthnam == null) return;
		java.util.Properties props = null;
		try {
			props = load(pthnam);
		} catch (Exception ex) {
			throw new RuntimeException("Failed to load VNE properties from "+pthnam, ex);
		}
		if (props == null) return;
		System.getProperties().putAll(props);
		System.out.println("Loaded vnebase: Properties="+props.size()+" from "+pthnam);
	}

	private static String getTempDir()
	{
		String dflt = System.getProperty("java.io.tmpdir", System.getProperty("user.home", "/")+"/tmp");
		return System.getProperty(SYSPROP_DIRPATH_TMP, dflt);
	}
}

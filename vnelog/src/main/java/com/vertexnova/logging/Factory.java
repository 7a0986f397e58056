/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.logging;

import com.vertexnova.base.ExceptionUtils;
import com.vertexnova.base.config.SysProps;
import com.vertexnova.base.config.XmlConfig;
import com.vertexnova.base.config.XmlConfig.XmlConfigException;
import com.vertexnova.base.utils.FileOps;

/**
 * Creates loggers from the named entries of a logging.xml config file.
 * <br>
 * The config file is located via the vne.logger.configfile setting, or else by searching the current directory, its conf
 * subdirectory and the home directory, and finally the classpath. Loggers are created through Logging.configureLogger(), so
 * repeated requests for the same name return the same logger.
 * <p>
 * A config file looks like this:
 * <pre>
 * &lt;loggers&gt;
 *   &lt;defaults level="info"/&gt;
 *   &lt;logger name="default" level="debug" sink="both" async="y"&gt;
 *     &lt;console pattern="%x [%l] %v"/&gt;
 *     &lt;file append="n" pattern="%x [%l] [%!] %v"&gt;%DIRLOG%/app.log&lt;/file&gt;
 *   &lt;/logger&gt;
 *   &lt;logger name="other" alias="default"/&gt;
 * &lt;/loggers&gt;
 * </pre>
 */
public class Factory
{
	public static final String SYSPROP_CFGFILE = "vne.logger.configfile";
	public static final String CFGFILE_NAME = "logging.xml";
	public static final String DFLT_CFGFILE = getConfigFile();
	public static final String DFLT_LOGNAME = "default";

	static {
		if (Logger.DIAGNOSTICS) {
			java.io.File fh = new java.io.File(DFLT_CFGFILE);
			if (!fh.exists()) {
				System.out.println(Logger.DIAGMARK+"Default config file not found - "+DFLT_CFGFILE);
			} else {
				System.out.println(Logger.DIAGMARK+"Default config file is "+DFLT_CFGFILE);
			}
		}
	}

	/*
	 * Creates a logger based on the default entry in the default logging.xml config file.
	 */
	public static Logger getLogger() throws java.io.IOException
	{
		return getLogger(DFLT_LOGNAME);
	}

	/*
	 * Creates a logger based on the named entry in the default logging.xml config file.
	 */
	public static Logger getLogger(String name) throws java.io.IOException
	{
		return getLogger(DFLT_CFGFILE, name);
	}

	/*
	 * Creates a logger based on the named entry in the specified logging.xml config file.
	 * If there is no such entry (or no such file) the logger takes its settings from the vne.logger.* defaults.
	 */
	public static Logger getLogger(String cfgpath, String name) throws java.io.IOException
	{
		if (name == null || name.isEmpty()) name = DFLT_LOGNAME;
		if (Logger.DIAGNOSTICS) System.out.println(Logger.DIAGMARK+"Parsing logging config="+cfgpath+" - PWD="+new java.io.File(".").getAbsolutePath());
		XmlConfig cfg = parseConfig(cfgpath, name);
		return getLogger(cfg, name);
	}

	public static Logger getLogger(XmlConfig cfg, String name)
	{
		LoggerConfig lcfg = new LoggerConfig(cfg);
		if (name != null && !name.isEmpty()) lcfg = new LoggerConfig.Builder(lcfg).withName(name).build();
		return getLogger(lcfg);
	}

	public static Logger getLogger(LoggerConfig cfg)
	{
		if (cfg == null) cfg = new LoggerConfig.Builder().build();
		Logger log = Logging.configureLogger(cfg);
		if (Logger.DIAGNOSTICS) System.out.println(Logger.DIAGMARK+"Configured Logger - "+log);
		return log;
	}

	public static Logger getLoggerNoEx(String name)
	{
		try {
			return getLogger(name);
		} catch (Exception ex) {
			throw new IllegalStateException("VNELog-Factory failed to create logger="+name, ex);
		}
	}

	private static XmlConfig parseConfig(String cfgpath, String name) throws java.io.IOException
	{
		java.io.File fh = new java.io.File(cfgpath);
		String xmltxt = null;

		if (fh.exists()) {
			xmltxt = FileOps.readAsText(fh, null);
		} else {
			String rsrc = (cfgpath.equals(DFLT_CFGFILE) ? CFGFILE_NAME : cfgpath);
			java.net.URL url = Factory.class.getClassLoader().getResource(rsrc);
			if (url != null) {
				cfgpath = url.toString();
				xmltxt = FileOps.readAsText(url, null);
			}
		}
		if (xmltxt == null) return null;
		if (Logger.DIAGNOSTICS) System.out.println(Logger.DIAGMARK+"Loaded logging config="+cfgpath);
		return parseSection(xmltxt, cfgpath, name, new java.util.HashSet<>());
	}

	private static XmlConfig parseSection(String xmltxt, String cfgpath, String name, java.util.Set<String> visited)
	{
		String xpath = "/loggers/logger[@name='"+name+"']"+XmlConfig.XPATH_ENABLED;
		XmlConfig cfg = XmlConfig.makeSection(xmltxt, xpath);
		if (!cfg.exists()) return null;

		visited.add(name);
		String alias = cfg.getValue("@alias", false, null);
		if (alias != null && !alias.isEmpty()) {
			if (visited.contains(alias)) throw new XmlConfigException("VNELog: Infinite loop between "+name+" and "+alias+" - "+cfgpath);
			return parseSection(xmltxt, cfgpath, alias, visited);
		}
		XmlConfig dflts = XmlConfig.makeSection(xmltxt, "/loggers/defaults");
		if (dflts.exists()) cfg.setDefaults(dflts);
		return cfg;
	}

	private static String getConfigFile()
	{
		String pthnam = SysProps.get(SYSPROP_CFGFILE);
		java.io.File fh = null;

		if (pthnam == null) {
			String[] huntpath = new String[]{"./"+CFGFILE_NAME,
					"./conf/"+CFGFILE_NAME,
					System.getProperty("user.home", ".")+"/"+CFGFILE_NAME};
			for (int idx = 0; idx != huntpath.length; idx++) {
				fh = new java.io.File(huntpath[idx]);
				if (fh.exists()) {
					pthnam = huntpath[idx];
					break;
				}
			}
			if (pthnam == null) return huntpath[0];  //doesn't exist, but gives us a filename to refer to
		}
		if (fh == null) fh = new java.io.File(pthnam);

		try {
			return fh.getCanonicalPath();
		} catch (Exception ex) {
			String msg = Logger.DIAGMARK+"Failed to get full pathname of config="+pthnam;
			System.out.println(msg+" - "+ExceptionUtils.summary(ex));
			throw new IllegalArgumentException(msg, ex);
		}
	}
}

/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.base.config;

import com.vertexnova.base.utils.StringOps;
import com.vertexnova.base.utils.XML;

/**This class treats an XML file as a structured config file.
 * <br>
 * Calling applications just see this as a config structure, so to spare them from the underlying XML intricacies, we
 * map all exceptions to XmlConfigException.
 * Note that we can retrieve attributes and values at the top-level node of an XmlConfig element using XPath dot notation
 * Eg. "./@attrname" or "." for Text
 */
public class XmlConfig
{
	public static final String XPATH_ENABLED = "[@enabled='Y' or not(@enabled)]";
	public static final String NULLMARKER = "-";  // gets translated to null, and prevents us traversing the chain of defaults

	private static final boolean trace_stdout = SysProps.get("vne.config.trace", false);
	private static final String XPATH_SEP = "/";
	private static final String ELEM_SEP = "##";

	public static final XmlConfig NULLCFG = new XmlConfig();  // exists() returns False
	public static final XmlConfig BLANKCFG = makeSection("<x/>", XPATH_SEP+"x");  // exists() returns True

	private final javax.xml.xpath.XPath xpathproc;
	private org.w3c.dom.Node cfgsect;
	private XmlConfig cfgDefaults;
	private String label;

	public boolean exists() {return (cfgsect != null);}

	public static XmlConfig makeSection(CharSequence xmltxt, String node_xpath)
	{
		org.w3c.dom.Document xmldoc;
		try {
			xmldoc = XML.makeDOM(xmltxt);
		} catch (Exception ex) {
			throw new XmlConfigException("Failed to build DOM for config-section ["+xmltxt+"]", ex);
		}
		return new XmlConfig(XML.getXpathProcessor(), xmldoc, node_xpath);
	}

	private XmlConfig(javax.xml.xpath.XPath xpathproc_p, Object parentNode, String node_xpath)
	{
		xpathproc = xpathproc_p;
		setup(parentNode, node_xpath);
	}

	// Only used for NULLCFG
	private XmlConfig()
	{
		xpathproc = XML.getXpathProcessor();
		setup(null, "");
	}

	// Null parentNode means cfgsect has already been looked up (or else not required)
	private void setup(Object parentNode, String node_xpath)
	{
		if (parentNode != null) {
			// evaluate() returns null if the node does not exist, and only throws on invalid XPath syntax
			try {
				cfgsect = (org.w3c.dom.Node)xpathproc.evaluate(node_xpath, parentNode, javax.xml.xpath.XPathConstants.NODE);
			} catch (Exception ex) {
				throw new XmlConfigException("XML-Config: evaluate() failed on XPath="+node_xpath, ex);
			}
		}

		label = node_xpath;
		if (trace_stdout) System.out.println("Config section [" + label + "] " + (cfgsect==null?"absent":"present"));
	}

	/**
	 * Values absent from this section are looked up in dflts before falling back to the caller's default.
	 */
	public void setDefaults(XmlConfig dflts)
	{
		cfgDefaults = dflts;
	}

	public String getValue(String xpath, boolean mdty, String dflt)
	{
		if (cfgDefaults != null) dflt = cfgDefaults.getValue(xpath, false, dflt);
		String cfgval = getValue(cfgsect, xpath, mdty, dflt);
		if (trace_stdout) System.out.println("Config item [" + label + ELEM_SEP + xpath + " = " + cfgval + "]");
		return cfgval;
	}

	// if mdty is true, then dflt=0 indicates the absence of a default
	public int getInt(String xpath, boolean mdty, int dflt)
	{
		String str = getValue(xpath, mdty, (mdty && dflt == 0) ? null : String.valueOf(dflt));
		try {
			return Integer.parseInt(str);
		} catch (NumberFormatException ex) {
			throw new XmlConfigException("CONFIG ERROR: Invalid integer="+str+" - "+label+ELEM_SEP+xpath, ex);
		}
	}

	public boolean getBool(String xpath, boolean dflt)
	{
		String str = getValue(xpath, false, StringOps.boolAsString(dflt));
		return StringOps.stringAsBool(str);
	}

	private String getValue(Object cfg, String xpath, boolean mdty, String dflt)
	{
		org.w3c.dom.Node elem = null;
		String cfgval = null;

		if (cfg != null) {
			try {
				elem = (org.w3c.dom.Node)xpathproc.evaluate(xpath, cfg, javax.xml.xpath.XPathConstants.NODE);
			} catch (Exception ex) {
				throw new XmlConfigException("XML-Config: evaluate() failed on XPath="+xpath, ex);
			}
		}

		if (elem != null) {
			cfgval = elem.getTextContent();
			if (cfgval != null) cfgval = cfgval.trim();
		}

		if (cfgval == null || cfgval.isEmpty()) {
			cfgval = dflt;
		} else if (cfgval.equals(NULLMARKER)) {
			cfgval = null;
		}
		if (mdty && (cfgval == null || cfgval.isEmpty())) configError(xpath, "Missing mandatory item");
		return cfgval;
	}

	private void configError(String xpath, String msg)
	{
		String str = "CONFIG ERROR: "+msg+" - "+label+ELEM_SEP+xpath;
		throw new XmlConfigException(str);
	}

	@Override
	public String toString() {
		return "label="+label+"::"+XML.toString(cfgsect);
	}


	public static class XmlConfigException extends RuntimeException {
		private static final long serialVersionUID = 1L;

		public XmlConfigException(String msg) {
			super(msg);
		}

		public XmlConfigException(String msg, Throwable ex) {
			super(msg, ex);
		}
	}
}

/*
 * Copyright 2024 VertexNova - All rights reserved.
 * VNE Logging is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.vertexnova.vnelog_slf4j;

import org.slf4j.ILoggerFactory;
import org.slf4j.IMarkerFactory;
import org.slf4j.helpers.BasicMarkerFactory;
import org.slf4j.helpers.NOPMDCAdapter;
import org.slf4j.spi.MDCAdapter;
import org.slf4j.spi.SLF4JServiceProvider;

/**
 * Registers VNELog as an SLF4J 2.x backend, via META-INF/services.
 * <br>
 * Every SLF4J logger obtained through this provider writes to the single VNELog logger named by the vne.slf4j.logger
 * property, which is configured from logging.xml unless vne.slf4j.nocfg is set (see {@link LoggerFactory}).
 * Markers are accepted but ignored when formatting, and MDC is not supported, so the MDC calls are no-ops.
 */
public class LoggerProvider implements SLF4JServiceProvider {
	private static final String API_VERSION = "2.0.0";

	private final ILoggerFactory loggerFactory;
	private final IMarkerFactory markerFactory;
	private final MDCAdapter mdcAdapter;

	public LoggerProvider() {
		loggerFactory = new LoggerFactory();
		markerFactory = new BasicMarkerFactory();
		mdcAdapter = new NOPMDCAdapter();
	}

	// nothing to do, as the loggers are created on demand
	@Override
	public void initialize() {
	}

	@Override
	public ILoggerFactory getLoggerFactory() {
		return loggerFactory;
	}

	@Override
	public IMarkerFactory getMarkerFactory() {
		return markerFactory;
	}

	@Override
	public MDCAdapter getMDCAdapter() {
		return mdcAdapter;
	}

	@Override
	public String getRequestedApiVersion() {
		return API_VERSION;
	}
}

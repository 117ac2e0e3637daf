/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes audit events to a dedicated SLF4J logger. Successes are logged at INFO,
 * failures and warnings at WARN.
 */
public class Slf4jAuditLogger implements AuditLogger {

	public static final String DEFAULT_LOGGER_NAME = "io.simplymcp.audit";

	private final Logger delegate;

	public Slf4jAuditLogger() {
		this(LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	public Slf4jAuditLogger(Logger delegate) {
		this.delegate = delegate;
	}

	@Override
	public void log(AuditEvent event) {
		if (event.getResult() == AuditEvent.Result.SUCCESS) {
			delegate.info("[OAuth Audit] {} - {} clientId={} {}", event.getTimestamp(),
					event.getType().getEventName(), event.getClientId(), event.getDetails());
		}
		else {
			delegate.warn("[OAuth Audit] {} - {} ({}) clientId={} {}", event.getTimestamp(),
					event.getType().getEventName(), event.getResult(), event.getClientId(), event.getDetails());
		}
	}

}

/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.audit;

/**
 * Receives the audit trail of the authorization server.
 */
public interface AuditLogger {

	void log(AuditEvent event);

	static AuditLogger noop() {
		return event -> {
		};
	}

}

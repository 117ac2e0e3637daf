/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.audit;

public enum AuditEventType {

	AUTHORIZATION_REQUESTED("oauth.authorization.requested"),

	AUTHORIZATION_GRANTED("oauth.authorization.granted"),

	AUTHORIZATION_DENIED("oauth.authorization.denied"),

	TOKEN_ISSUED("oauth.token.issued"),

	TOKEN_REFRESHED("oauth.token.refreshed"),

	TOKEN_REVOKED("oauth.token.revoked"),

	TOKEN_VALIDATION_SUCCESS("oauth.token.validation.success"),

	TOKEN_VALIDATION_FAILED("oauth.token.validation.failed"),

	CLIENT_REGISTERED("oauth.client.registered"),

	CLIENT_AUTHENTICATION_FAILED("oauth.client.authentication.failed");

	private final String eventName;

	AuditEventType(String eventName) {
		this.eventName = eventName;
	}

	public String getEventName() {
		return eventName;
	}

}

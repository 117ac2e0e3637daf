/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.auth.exception;

public class DuplicateClientIdException extends RegistrationException {

	private final String clientId;

	public DuplicateClientIdException(String clientId) {
		super(OAuthErrorCode.INVALID_CLIENT_METADATA, "Client already registered: " + clientId);
		this.clientId = clientId;
	}

	public String getClientId() {
		return clientId;
	}

}

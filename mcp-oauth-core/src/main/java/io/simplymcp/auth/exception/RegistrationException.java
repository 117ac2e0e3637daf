/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.auth.exception;

/**
 * Failure while registering a client.
 */
public class RegistrationException extends OAuthException {

	public RegistrationException(OAuthErrorCode error, String errorDescription) {
		super(error, errorDescription);
	}

}

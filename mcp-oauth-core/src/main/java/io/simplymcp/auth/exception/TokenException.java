/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.auth.exception;

/**
 * Failure at the token endpoint: code exchange, refresh, or client authentication.
 */
public class TokenException extends OAuthException {

	public TokenException(OAuthErrorCode error, String errorDescription) {
		super(error, errorDescription);
	}

	public static TokenException invalidGrant(String errorDescription) {
		return new TokenException(OAuthErrorCode.INVALID_GRANT, errorDescription);
	}

	public static TokenException invalidClient() {
		return new TokenException(OAuthErrorCode.INVALID_CLIENT, "Client authentication failed");
	}

}

/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.middleware;

import java.util.ArrayList;
import java.util.List;

import io.simplymcp.auth.exception.OAuthErrorCode;

/**
 * Exception thrown when bearer authentication fails. Carries the RFC 6750 error code
 * (absent when the request had no usable credentials at all) and the HTTP status.
 */
public class AuthenticationException extends Exception {

	private final OAuthErrorCode error;

	private final int status;

	private final String requiredScope;

	private AuthenticationException(String message, OAuthErrorCode error, int status, String requiredScope) {
		super(message);
		this.error = error;
		this.status = status;
		this.requiredScope = requiredScope;
	}

	public static AuthenticationException missingCredentials(String message) {
		return new AuthenticationException(message, null, 401, null);
	}

	public static AuthenticationException invalidToken(String message) {
		return new AuthenticationException(message, OAuthErrorCode.INVALID_TOKEN, 401, null);
	}

	public static AuthenticationException insufficientScope(String requiredScope) {
		return new AuthenticationException("Insufficient scope", OAuthErrorCode.INSUFFICIENT_SCOPE, 403,
				requiredScope);
	}

	/**
	 * @return the RFC 6750 error code, or null for a request without credentials
	 */
	public OAuthErrorCode getError() {
		return error;
	}

	public int getStatus() {
		return status;
	}

	/**
	 * Builds the {@code WWW-Authenticate} challenge for this failure.
	 * @param resourceMetadataUrl URL of the protected resource metadata document, may
	 * be null
	 * @return the header value
	 */
	public String toWwwAuthenticateHeader(String resourceMetadataUrl) {
		List<String> params = new ArrayList<>();
		if (error != null) {
			params.add("error=\"" + error.getValue() + "\"");
			params.add("error_description=\"" + getMessage().replace("\"", "'") + "\"");
		}
		if (requiredScope != null) {
			params.add("scope=\"" + requiredScope + "\"");
		}
		if (resourceMetadataUrl != null) {
			params.add("resource_metadata=\"" + resourceMetadataUrl + "\"");
		}
		return params.isEmpty() ? "Bearer" : "Bearer " + String.join(", ", params);
	}

}

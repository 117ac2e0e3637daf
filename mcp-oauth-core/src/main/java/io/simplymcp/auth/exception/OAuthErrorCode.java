/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.auth.exception;

/**
 * Error codes from RFC 6749 section 4.1.2.1 and 5.2, RFC 7591 section 3.2.2 and RFC
 * 6750 section 3.1, with the HTTP status each one is reported with.
 */
public enum OAuthErrorCode {

	INVALID_REQUEST("invalid_request", 400),

	INVALID_CLIENT("invalid_client", 401),

	UNAUTHORIZED_CLIENT("unauthorized_client", 400),

	INVALID_GRANT("invalid_grant", 400),

	INVALID_SCOPE("invalid_scope", 400),

	UNSUPPORTED_GRANT_TYPE("unsupported_grant_type", 400),

	UNSUPPORTED_RESPONSE_TYPE("unsupported_response_type", 400),

	INVALID_REDIRECT_URI("invalid_redirect_uri", 400),

	INVALID_CLIENT_METADATA("invalid_client_metadata", 400),

	INVALID_TOKEN("invalid_token", 401),

	INSUFFICIENT_SCOPE("insufficient_scope", 403),

	SERVER_ERROR("server_error", 500);

	private final String value;

	private final int httpStatus;

	OAuthErrorCode(String value, int httpStatus) {
		this.value = value;
		this.httpStatus = httpStatus;
	}

	public String getValue() {
		return value;
	}

	public int getHttpStatus() {
		return httpStatus;
	}

}

/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.auth.exception;

import java.util.Objects;

/**
 * Base class for protocol-level OAuth failures. These are expected outcomes reported
 * to the caller in RFC-shaped bodies, never internal faults.
 */
public class OAuthException extends Exception {

	private final OAuthErrorCode error;

	private final String errorDescription;

	public OAuthException(OAuthErrorCode error, String errorDescription) {
		super(error.getValue() + ": " + errorDescription);
		this.error = Objects.requireNonNull(error, "error must not be null");
		this.errorDescription = errorDescription;
	}

	public OAuthErrorCode getError() {
		return error;
	}

	public String getErrorDescription() {
		return errorDescription;
	}

}

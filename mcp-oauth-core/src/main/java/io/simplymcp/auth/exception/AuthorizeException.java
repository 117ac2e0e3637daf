/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.auth.exception;

/**
 * Failure of an authorization request. A redirectable failure is reported to the
 * client's redirect URI; a non-redirectable one (unknown client, unregistered
 * redirect URI) must be answered directly.
 */
public class AuthorizeException extends OAuthException {

	private final boolean redirectable;

	public AuthorizeException(OAuthErrorCode error, String errorDescription, boolean redirectable) {
		super(error, errorDescription);
		this.redirectable = redirectable;
	}

	public static AuthorizeException redirect(OAuthErrorCode error, String errorDescription) {
		return new AuthorizeException(error, errorDescription, true);
	}

	public static AuthorizeException direct(OAuthErrorCode error, String errorDescription) {
		return new AuthorizeException(error, errorDescription, false);
	}

	public boolean isRedirectable() {
		return redirectable;
	}

}

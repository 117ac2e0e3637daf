/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.handlers;

/**
 * Outcome of an authorization request: the URL the user agent is redirected to. It
 * carries either {@code code} and {@code state} or an error and {@code state}.
 */
public class AuthorizationResponse {

	private final String redirectUrl;

	private final boolean error;

	private AuthorizationResponse(String redirectUrl, boolean error) {
		this.redirectUrl = redirectUrl;
		this.error = error;
	}

	public static AuthorizationResponse success(String redirectUrl) {
		return new AuthorizationResponse(redirectUrl, false);
	}

	public static AuthorizationResponse error(String redirectUrl) {
		return new AuthorizationResponse(redirectUrl, true);
	}

	public String getRedirectUrl() {
		return redirectUrl;
	}

	public boolean isError() {
		return error;
	}

}

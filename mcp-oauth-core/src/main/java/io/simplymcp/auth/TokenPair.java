/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.auth;

/**
 * An access token and the refresh token issued alongside it.
 */
public final class TokenPair {

	private final AccessToken accessToken;

	private final RefreshToken refreshToken;

	public TokenPair(AccessToken accessToken, RefreshToken refreshToken) {
		this.accessToken = accessToken;
		this.refreshToken = refreshToken;
	}

	public AccessToken getAccessToken() {
		return accessToken;
	}

	public RefreshToken getRefreshToken() {
		return refreshToken;
	}

	public String getClientId() {
		return accessToken.getClientId();
	}

}

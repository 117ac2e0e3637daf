/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.auth;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Represents an OAuth access token.
 */
public final class AccessToken {

	private final String token;

	private final String clientId;

	private final Set<String> scopes;

	private final Instant issuedAt;

	private final Instant expiresAt;

	private final String refreshToken;

	public AccessToken(String token, String clientId, Set<String> scopes, Instant issuedAt, Instant expiresAt,
			String refreshToken) {
		this.token = token;
		this.clientId = clientId;
		this.scopes = Collections.unmodifiableSet(new LinkedHashSet<>(scopes));
		this.issuedAt = issuedAt;
		this.expiresAt = expiresAt;
		this.refreshToken = refreshToken;
	}

	public boolean isExpired(Instant now) {
		return now.isAfter(expiresAt);
	}

	public AuthInfo toAuthInfo() {
		return new AuthInfo(token, clientId, scopes, expiresAt.getEpochSecond());
	}

	public String getToken() {
		return token;
	}

	public String getClientId() {
		return clientId;
	}

	public Set<String> getScopes() {
		return scopes;
	}

	public Instant getIssuedAt() {
		return issuedAt;
	}

	public Instant getExpiresAt() {
		return expiresAt;
	}

	/**
	 * The refresh token issued together with this access token, or {@code null}.
	 */
	public String getRefreshToken() {
		return refreshToken;
	}

}

/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.auth;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Information about a verified access token, handed to protected resource handlers.
 */
public final class AuthInfo {

	private final String token;

	private final String clientId;

	private final Set<String> scopes;

	private final long expiresAt;

	/**
	 * @param token the access token
	 * @param clientId the client the token was issued to
	 * @param scopes the scopes carried by the token
	 * @param expiresAt expiry in seconds since the epoch
	 */
	public AuthInfo(String token, String clientId, Set<String> scopes, long expiresAt) {
		this.token = token;
		this.clientId = clientId;
		this.scopes = Collections.unmodifiableSet(new LinkedHashSet<>(scopes));
		this.expiresAt = expiresAt;
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

	public long getExpiresAt() {
		return expiresAt;
	}

	public boolean hasScope(String scope) {
		return scopes.contains(scope);
	}

}

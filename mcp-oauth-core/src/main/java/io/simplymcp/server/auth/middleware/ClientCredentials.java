/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.middleware;

/**
 * Client id and secret presented at the token or revocation endpoint.
 */
public final class ClientCredentials {

	private final String clientId;

	private final String clientSecret;

	public ClientCredentials(String clientId, String clientSecret) {
		this.clientId = clientId;
		this.clientSecret = clientSecret;
	}

	public String getClientId() {
		return clientId;
	}

	public String getClientSecret() {
		return clientSecret;
	}

}

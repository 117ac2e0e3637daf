/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.settings;

import java.util.List;
import java.util.Objects;

/**
 * A statically configured client, registered when the provider is built. The raw
 * secret is hashed on registration and not retained.
 */
public class ClientSettings {

	private final String clientId;

	private final String clientSecret;

	private final List<String> redirectUris;

	private final List<String> scopes;

	public ClientSettings(String clientId, String clientSecret, List<String> redirectUris, List<String> scopes) {
		this.clientId = Objects.requireNonNull(clientId, "clientId must not be null");
		this.clientSecret = Objects.requireNonNull(clientSecret, "clientSecret must not be null");
		this.redirectUris = List.copyOf(redirectUris);
		this.scopes = List.copyOf(scopes);
	}

	public String getClientId() {
		return clientId;
	}

	public String getClientSecret() {
		return clientSecret;
	}

	public List<String> getRedirectUris() {
		return redirectUris;
	}

	public List<String> getScopes() {
		return scopes;
	}

}

/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.auth;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.List;
import java.util.Set;

/**
 * A client known to the authorization server. Only the bcrypt hash of the client
 * secret is retained; the raw secret never leaves the registration call.
 */
public final class RegisteredClient {

	public static final String GRANT_TYPE_AUTHORIZATION_CODE = "authorization_code";

	public static final String GRANT_TYPE_REFRESH_TOKEN = "refresh_token";

	/**
	 * Grant types of statically configured clients and of registrations that do not
	 * name any.
	 */
	public static final List<String> DEFAULT_GRANT_TYPES = List.of(GRANT_TYPE_AUTHORIZATION_CODE,
			GRANT_TYPE_REFRESH_TOKEN);

	private final String clientId;

	private final String hashedSecret;

	private final Set<String> redirectUris;

	private final Set<String> allowedScopes;

	private final Set<String> grantTypes;

	private final Instant clientIdIssuedAt;

	public RegisteredClient(String clientId, String hashedSecret, Set<String> redirectUris, Set<String> allowedScopes,
			Instant clientIdIssuedAt) {
		this(clientId, hashedSecret, redirectUris, allowedScopes, new LinkedHashSet<>(DEFAULT_GRANT_TYPES),
				clientIdIssuedAt);
	}

	public RegisteredClient(String clientId, String hashedSecret, Set<String> redirectUris, Set<String> allowedScopes,
			Set<String> grantTypes, Instant clientIdIssuedAt) {
		this.clientId = Objects.requireNonNull(clientId, "clientId must not be null");
		this.hashedSecret = Objects.requireNonNull(hashedSecret, "hashedSecret must not be null");
		this.redirectUris = Collections.unmodifiableSet(new LinkedHashSet<>(redirectUris));
		this.allowedScopes = Collections.unmodifiableSet(new LinkedHashSet<>(allowedScopes));
		this.grantTypes = Collections.unmodifiableSet(new LinkedHashSet<>(grantTypes));
		this.clientIdIssuedAt = clientIdIssuedAt;
	}

	public String getClientId() {
		return clientId;
	}

	public String getHashedSecret() {
		return hashedSecret;
	}

	public Set<String> getRedirectUris() {
		return redirectUris;
	}

	public Set<String> getAllowedScopes() {
		return allowedScopes;
	}

	public Set<String> getGrantTypes() {
		return grantTypes;
	}

	public boolean isGrantTypeAllowed(String grantType) {
		return grantTypes.contains(grantType);
	}

	public Instant getClientIdIssuedAt() {
		return clientIdIssuedAt;
	}

	@Override
	public String toString() {
		return "RegisteredClient[clientId=" + clientId + ", redirectUris=" + redirectUris + ", allowedScopes="
				+ allowedScopes + ", grantTypes=" + grantTypes + "]";
	}

}

/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.auth;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * An authorization code bound to a client, a redirect URI and a PKCE challenge.
 * Instances are immutable; {@link #markConsumed()} yields a consumed copy.
 */
public final class AuthorizationCode {

	public static final String CODE_CHALLENGE_METHOD_S256 = "S256";

	private final String code;

	private final String clientId;

	private final String redirectUri;

	private final String codeChallenge;

	private final String codeChallengeMethod;

	private final Set<String> scopes;

	private final Instant issuedAt;

	private final Instant expiresAt;

	private final boolean consumed;

	public AuthorizationCode(String code, String clientId, String redirectUri, String codeChallenge,
			Set<String> scopes, Instant issuedAt, Instant expiresAt) {
		this(code, clientId, redirectUri, codeChallenge, scopes, issuedAt, expiresAt, false);
	}

	private AuthorizationCode(String code, String clientId, String redirectUri, String codeChallenge,
			Set<String> scopes, Instant issuedAt, Instant expiresAt, boolean consumed) {
		this.code = code;
		this.clientId = clientId;
		this.redirectUri = redirectUri;
		this.codeChallenge = codeChallenge;
		this.codeChallengeMethod = CODE_CHALLENGE_METHOD_S256;
		this.scopes = Collections.unmodifiableSet(new LinkedHashSet<>(scopes));
		this.issuedAt = issuedAt;
		this.expiresAt = expiresAt;
		this.consumed = consumed;
	}

	public AuthorizationCode markConsumed() {
		return new AuthorizationCode(code, clientId, redirectUri, codeChallenge, scopes, issuedAt, expiresAt, true);
	}

	public boolean isExpired(Instant now) {
		return now.isAfter(expiresAt);
	}

	public String getCode() {
		return code;
	}

	public String getClientId() {
		return clientId;
	}

	public String getRedirectUri() {
		return redirectUri;
	}

	public String getCodeChallenge() {
		return codeChallenge;
	}

	public String getCodeChallengeMethod() {
		return codeChallengeMethod;
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

	public boolean isConsumed() {
		return consumed;
	}

}

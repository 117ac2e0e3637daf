/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.middleware;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import io.simplymcp.auth.AuthInfo;
import io.simplymcp.server.auth.OAuthProvider;

/**
 * Authenticator for OAuth bearer tokens. Framework-agnostic: adapters pass in the
 * {@code Authorization} header and map failures to HTTP responses.
 */
public class BearerAuthenticator {

	private static final String BEARER_PREFIX = "Bearer ";

	private final OAuthProvider provider;

	private final Set<String> requiredScopes;

	public BearerAuthenticator(OAuthProvider provider) {
		this(provider, Set.of());
	}

	/**
	 * @param provider the provider verifying tokens
	 * @param requiredScopes scopes every accepted token must carry
	 */
	public BearerAuthenticator(OAuthProvider provider, Collection<String> requiredScopes) {
		this.provider = provider;
		this.requiredScopes = new LinkedHashSet<>(requiredScopes);
	}

	/**
	 * Authenticate a request using a bearer token.
	 * @param authHeader The Authorization header value
	 * @return A CompletableFuture that resolves to the verified token information, or
	 * fails with an {@link AuthenticationException}
	 */
	public CompletableFuture<AuthInfo> authenticate(String authHeader) {
		if (authHeader == null || !authHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
			return CompletableFuture
				.failedFuture(AuthenticationException.missingCredentials("Missing or invalid Authorization header"));
		}

		String token = authHeader.substring(BEARER_PREFIX.length()).trim();
		if (token.isEmpty()) {
			return CompletableFuture.failedFuture(AuthenticationException.missingCredentials("Empty bearer token"));
		}

		AuthInfo authInfo = provider.verifyAccessToken(token);
		if (authInfo == null) {
			return CompletableFuture
				.failedFuture(AuthenticationException.invalidToken("Invalid or expired access token"));
		}

		for (String scope : requiredScopes) {
			if (!authInfo.hasScope(scope)) {
				return CompletableFuture.failedFuture(AuthenticationException.insufficientScope(scope));
			}
		}

		return CompletableFuture.completedFuture(authInfo);
	}

}

/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.handlers;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.simplymcp.auth.exception.OAuthErrorCode;
import io.simplymcp.auth.exception.TokenException;
import io.simplymcp.server.auth.OAuthProvider;
import io.simplymcp.server.auth.middleware.ClientAuthenticator;
import io.simplymcp.server.auth.middleware.ClientCredentials;
import io.simplymcp.server.auth.store.TokenTypeHint;
import io.simplymcp.util.Utils;

/**
 * Handler for RFC 7009 token revocation requests. Any request carrying a token
 * completes normally, whether or not something was revoked.
 */
public class RevocationHandler {

	private static final Logger logger = LoggerFactory.getLogger(RevocationHandler.class);

	private final OAuthProvider provider;

	private final ClientAuthenticator clientAuthenticator;

	public RevocationHandler(OAuthProvider provider, ClientAuthenticator clientAuthenticator) {
		this.provider = provider;
		this.clientAuthenticator = clientAuthenticator;
	}

	/**
	 * Handle a revocation request.
	 * @param params The request parameters
	 * @param authorizationHeader The Authorization header, may be null
	 * @return A CompletableFuture that completes once the request is processed, or
	 * fails with {@code invalid_request} when no token is given
	 */
	public CompletableFuture<Void> handle(Map<String, String> params, String authorizationHeader) {
		String token = params.get("token");
		if (!Utils.hasText(token)) {
			return CompletableFuture
				.failedFuture(new TokenException(OAuthErrorCode.INVALID_REQUEST, "Missing token"));
		}

		ClientCredentials credentials;
		try {
			credentials = clientAuthenticator.extractCredentials(params, authorizationHeader);
		}
		catch (TokenException ex) {
			logger.debug("Ignoring revocation request without usable client credentials: {}",
					ex.getErrorDescription());
			return CompletableFuture.completedFuture(null);
		}

		provider.revoke(credentials.getClientId(), credentials.getClientSecret(), token,
				TokenTypeHint.fromValue(params.get("token_type_hint")));
		return CompletableFuture.completedFuture(null);
	}

}

/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.handlers;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import io.simplymcp.auth.OAuthToken;
import io.simplymcp.auth.TokenPair;
import io.simplymcp.auth.exception.OAuthErrorCode;
import io.simplymcp.auth.exception.TokenException;
import io.simplymcp.server.auth.OAuthProvider;
import io.simplymcp.server.auth.middleware.ClientAuthenticator;
import io.simplymcp.server.auth.middleware.ClientCredentials;
import io.simplymcp.server.auth.util.ScopeUtils;
import io.simplymcp.util.Utils;

/**
 * Handler for token requests.
 */
public class TokenHandler {

	private final OAuthProvider provider;

	private final ClientAuthenticator clientAuthenticator;

	public TokenHandler(OAuthProvider provider, ClientAuthenticator clientAuthenticator) {
		this.provider = provider;
		this.clientAuthenticator = clientAuthenticator;
	}

	/**
	 * Handle a token request.
	 * @param params The request parameters
	 * @param authorizationHeader The Authorization header, may be null
	 * @return A CompletableFuture that resolves to the token response, or fails with a
	 * {@link TokenException}
	 */
	public CompletableFuture<OAuthToken> handle(Map<String, String> params, String authorizationHeader) {
		try {
			String grantType = params.get("grant_type");
			if (!Utils.hasText(grantType)) {
				throw new TokenException(OAuthErrorCode.INVALID_REQUEST, "Missing grant_type");
			}
			if (!OAuthProvider.GRANT_TYPE_AUTHORIZATION_CODE.equals(grantType)
					&& !OAuthProvider.GRANT_TYPE_REFRESH_TOKEN.equals(grantType)) {
				throw new TokenException(OAuthErrorCode.UNSUPPORTED_GRANT_TYPE,
						"Unsupported grant_type: " + grantType);
			}

			ClientCredentials credentials = clientAuthenticator.extractCredentials(params, authorizationHeader);
			TokenPair pair;
			if (OAuthProvider.GRANT_TYPE_AUTHORIZATION_CODE.equals(grantType)) {
				pair = provider.exchangeCode(credentials.getClientId(), credentials.getClientSecret(),
						required(params, "code"), required(params, "code_verifier"),
						required(params, "redirect_uri"));
			}
			else {
				pair = provider.refreshToken(credentials.getClientId(), credentials.getClientSecret(),
						required(params, "refresh_token"), ScopeUtils.parse(params.get("scope")));
			}
			return CompletableFuture.completedFuture(OAuthToken.from(pair));
		}
		catch (TokenException ex) {
			return CompletableFuture.failedFuture(ex);
		}
	}

	private static String required(Map<String, String> params, String name) throws TokenException {
		String value = params.get(name);
		if (!Utils.hasText(value)) {
			throw new TokenException(OAuthErrorCode.INVALID_REQUEST, "Missing " + name);
		}
		return value;
	}

}

/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.handlers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import io.simplymcp.auth.AuthorizationCode;
import io.simplymcp.auth.AuthorizationParams;
import io.simplymcp.auth.exception.AuthorizeException;
import io.simplymcp.server.auth.OAuthProvider;
import io.simplymcp.server.auth.util.ScopeUtils;
import io.simplymcp.server.auth.util.UriUtils;

/**
 * Handler for OAuth authorization requests. No consent screen is shown: a valid
 * request is approved right away.
 */
public class AuthorizationHandler {

	private final OAuthProvider provider;

	public AuthorizationHandler(OAuthProvider provider) {
		this.provider = provider;
	}

	/**
	 * Handle an authorization request.
	 * @param params The request parameters
	 * @return A CompletableFuture that resolves to the redirect to send, or fails with
	 * a non-redirectable {@link AuthorizeException} when the client or redirect URI
	 * cannot be trusted
	 */
	public CompletableFuture<AuthorizationResponse> handle(Map<String, String> params) {
		AuthorizationParams authParams = new AuthorizationParams();
		authParams.setClientId(params.get("client_id"));
		authParams.setRedirectUri(params.get("redirect_uri"));
		authParams.setResponseType(params.get("response_type"));
		authParams.setState(params.get("state"));
		authParams.setCodeChallenge(params.get("code_challenge"));
		authParams.setCodeChallengeMethod(params.get("code_challenge_method"));
		authParams.setScopes(new ArrayList<>(ScopeUtils.parse(params.get("scope"))));

		try {
			AuthorizationCode code = provider.handleAuthorize(authParams);
			Map<String, String> query = new LinkedHashMap<>();
			query.put("code", code.getCode());
			query.put("state", authParams.getState());
			return CompletableFuture
				.completedFuture(AuthorizationResponse.success(UriUtils.appendQueryParams(code.getRedirectUri(), query)));
		}
		catch (AuthorizeException ex) {
			if (!ex.isRedirectable()) {
				return CompletableFuture.failedFuture(ex);
			}
			Map<String, String> query = new LinkedHashMap<>();
			query.put("error", ex.getError().getValue());
			query.put("error_description", ex.getErrorDescription());
			query.put("state", authParams.getState());
			return CompletableFuture.completedFuture(
					AuthorizationResponse.error(UriUtils.appendQueryParams(authParams.getRedirectUri(), query)));
		}
	}

}

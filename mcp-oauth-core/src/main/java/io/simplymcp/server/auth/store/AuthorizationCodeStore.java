/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.store;

import java.util.Collection;

import io.simplymcp.auth.AuthorizationCode;
import io.simplymcp.auth.exception.TokenException;

/**
 * Issues authorization codes and consumes them exactly once.
 */
public interface AuthorizationCodeStore {

	AuthorizationCode issue(String clientId, String redirectUri, String codeChallenge, Collection<String> scopes);

	/**
	 * Consumes a code after checking the PKCE verifier. Among concurrent callers
	 * presenting the same code at most one succeeds; a consumed code is never
	 * exchangeable again.
	 * @param code the authorization code
	 * @param codeVerifier the PKCE code verifier
	 * @return the consumed code record
	 * @throws TokenException {@code invalid_grant} if the code is unknown, expired,
	 * already consumed, or the verifier does not match
	 */
	AuthorizationCode consume(String code, String codeVerifier) throws TokenException;

	/**
	 * Removes expired codes.
	 * @return the number of codes removed
	 */
	int purgeExpired();

	int size();

}

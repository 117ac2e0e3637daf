/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.store;

import java.util.Collection;
import java.util.Optional;

import io.simplymcp.auth.AccessToken;
import io.simplymcp.auth.AuthInfo;
import io.simplymcp.auth.RefreshToken;
import io.simplymcp.auth.TokenPair;
import io.simplymcp.auth.exception.TokenException;

/**
 * Issues, validates, rotates and revokes access and refresh tokens.
 */
public interface TokenStore {

	AccessToken issueAccessToken(String clientId, Collection<String> scopes);

	RefreshToken issueRefreshToken(String clientId, Collection<String> scopes);

	/**
	 * Issues an access token and a refresh token that reference each other.
	 */
	TokenPair issueTokenPair(String clientId, Collection<String> scopes);

	/**
	 * Looks up an access token. Unknown and expired tokens are indistinguishable to
	 * the caller.
	 * @param token the access token
	 * @return the token information, or null if the token is unknown or expired
	 */
	AuthInfo verifyAccessToken(String token);

	/**
	 * Exchanges a refresh token for a new token pair bound to the same client. The old
	 * refresh token is invalidated; concurrent rotations of one token yield exactly
	 * one success.
	 * @param oldToken the refresh token being used
	 * @param requestedScopes scopes for the new pair, null or empty to keep the
	 * original scopes
	 * @return the new token pair
	 * @throws TokenException {@code invalid_grant} if the token is unknown, expired or
	 * already rotated, {@code invalid_scope} if the requested scopes exceed the
	 * original ones (the old token then stays valid)
	 */
	TokenPair rotateRefreshToken(String oldToken, Collection<String> requestedScopes) throws TokenException;

	default TokenPair rotateRefreshToken(String oldToken) throws TokenException {
		return rotateRefreshToken(oldToken, null);
	}

	/**
	 * Revokes an access or refresh token together with the token issued alongside
	 * it. Unknown or already revoked tokens are ignored.
	 * @param token the token to revoke
	 * @param hint which kind of token to look up first, may be null
	 * @return true if something was removed
	 */
	boolean revoke(String token, TokenTypeHint hint);

	default boolean revoke(String token) {
		return revoke(token, null);
	}

	/**
	 * @param token an access or refresh token
	 * @return the client the token was issued to, if the token is known
	 */
	Optional<String> findClientId(String token);

	/**
	 * Removes expired access and refresh tokens.
	 * @return the number of tokens removed
	 */
	int purgeExpired();

	int accessTokenCount();

	int refreshTokenCount();

}

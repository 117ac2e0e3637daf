/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.simplymcp.auth.AccessToken;
import io.simplymcp.auth.AuthInfo;
import io.simplymcp.auth.RefreshToken;
import io.simplymcp.auth.TokenPair;
import io.simplymcp.auth.exception.OAuthErrorCode;
import io.simplymcp.auth.exception.TokenException;
import io.simplymcp.server.auth.util.TokenGenerator;

/**
 * {@link TokenStore} backed by two concurrent maps. Refresh token rotation removes the
 * old token inside a single {@link ConcurrentMap#computeIfPresent} call, so only one
 * rotation of a given token can take it.
 */
public class InMemoryTokenStore implements TokenStore {

	private static final Logger logger = LoggerFactory.getLogger(InMemoryTokenStore.class);

	private final ConcurrentMap<String, AccessToken> accessTokens = new ConcurrentHashMap<>();

	private final ConcurrentMap<String, RefreshToken> refreshTokens = new ConcurrentHashMap<>();

	private final Duration accessTokenTtl;

	private final Duration refreshTokenTtl;

	private final Clock clock;

	public InMemoryTokenStore(Duration accessTokenTtl, Duration refreshTokenTtl, Clock clock) {
		this.accessTokenTtl = Objects.requireNonNull(accessTokenTtl, "accessTokenTtl must not be null");
		this.refreshTokenTtl = Objects.requireNonNull(refreshTokenTtl, "refreshTokenTtl must not be null");
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
	}

	@Override
	public AccessToken issueAccessToken(String clientId, Collection<String> scopes) {
		Instant now = clock.instant();
		AccessToken token = new AccessToken(uniqueAccessTokenValue(), clientId, new LinkedHashSet<>(scopes), now,
				now.plus(accessTokenTtl), null);
		accessTokens.put(token.getToken(), token);
		return token;
	}

	@Override
	public RefreshToken issueRefreshToken(String clientId, Collection<String> scopes) {
		Instant now = clock.instant();
		RefreshToken token = new RefreshToken(uniqueRefreshTokenValue(), clientId, new LinkedHashSet<>(scopes), now,
				now.plus(refreshTokenTtl), null);
		refreshTokens.put(token.getToken(), token);
		return token;
	}

	@Override
	public TokenPair issueTokenPair(String clientId, Collection<String> scopes) {
		Instant now = clock.instant();
		Set<String> grantedScopes = new LinkedHashSet<>(scopes);
		String accessValue = uniqueAccessTokenValue();
		String refreshValue = uniqueRefreshTokenValue();

		RefreshToken refreshToken = new RefreshToken(refreshValue, clientId, grantedScopes, now,
				now.plus(refreshTokenTtl), accessValue);
		AccessToken accessToken = new AccessToken(accessValue, clientId, grantedScopes, now,
				now.plus(accessTokenTtl), refreshValue);

		refreshTokens.put(refreshValue, refreshToken);
		accessTokens.put(accessValue, accessToken);
		return new TokenPair(accessToken, refreshToken);
	}

	@Override
	public AuthInfo verifyAccessToken(String token) {
		if (token == null) {
			return null;
		}
		AccessToken accessToken = accessTokens.get(token);
		if (accessToken == null) {
			return null;
		}
		if (accessToken.isExpired(clock.instant())) {
			accessTokens.remove(token, accessToken);
			return null;
		}
		return accessToken.toAuthInfo();
	}

	@Override
	public TokenPair rotateRefreshToken(String oldToken, Collection<String> requestedScopes) throws TokenException {
		if (oldToken == null) {
			throw TokenException.invalidGrant("Invalid refresh token");
		}
		Instant now = clock.instant();
		boolean narrowing = requestedScopes != null && !requestedScopes.isEmpty();
		AtomicReference<RefreshToken> taken = new AtomicReference<>();
		AtomicBoolean scopeExceeded = new AtomicBoolean();

		refreshTokens.computeIfPresent(oldToken, (key, record) -> {
			if (record.isExpired(now)) {
				return null;
			}
			if (narrowing && !record.getScopes().containsAll(requestedScopes)) {
				scopeExceeded.set(true);
				return record;
			}
			taken.set(record);
			return null;
		});

		if (scopeExceeded.get()) {
			throw new TokenException(OAuthErrorCode.INVALID_SCOPE, "Requested scopes exceed original authorization");
		}
		RefreshToken previous = taken.get();
		if (previous == null) {
			logger.debug("Rejected refresh token {}", TokenGenerator.safeId(oldToken));
			throw TokenException.invalidGrant("Invalid refresh token");
		}

		Set<String> scopes = narrowing ? new LinkedHashSet<>(requestedScopes) : previous.getScopes();
		return issueTokenPair(previous.getClientId(), scopes);
	}

	@Override
	public boolean revoke(String token, TokenTypeHint hint) {
		if (token == null) {
			return false;
		}
		if (hint == TokenTypeHint.REFRESH_TOKEN) {
			return revokeRefreshToken(token) || revokeAccessToken(token);
		}
		return revokeAccessToken(token) || revokeRefreshToken(token);
	}

	private boolean revokeAccessToken(String token) {
		AccessToken removed = accessTokens.remove(token);
		if (removed == null) {
			return false;
		}
		if (removed.getRefreshToken() != null) {
			refreshTokens.remove(removed.getRefreshToken());
		}
		return true;
	}

	private boolean revokeRefreshToken(String token) {
		RefreshToken removed = refreshTokens.remove(token);
		if (removed == null) {
			return false;
		}
		if (removed.getAccessToken() != null) {
			accessTokens.remove(removed.getAccessToken());
		}
		return true;
	}

	@Override
	public Optional<String> findClientId(String token) {
		if (token == null) {
			return Optional.empty();
		}
		AccessToken accessToken = accessTokens.get(token);
		if (accessToken != null) {
			return Optional.of(accessToken.getClientId());
		}
		RefreshToken refreshToken = refreshTokens.get(token);
		return refreshToken != null ? Optional.of(refreshToken.getClientId()) : Optional.empty();
	}

	@Override
	public int purgeExpired() {
		Instant now = clock.instant();
		AtomicInteger removed = new AtomicInteger();
		accessTokens.forEach((key, token) -> {
			if (token.isExpired(now) && accessTokens.remove(key, token)) {
				removed.incrementAndGet();
			}
		});
		refreshTokens.forEach((key, token) -> {
			if (token.isExpired(now) && refreshTokens.remove(key, token)) {
				removed.incrementAndGet();
			}
		});
		return removed.get();
	}

	@Override
	public int accessTokenCount() {
		return accessTokens.size();
	}

	@Override
	public int refreshTokenCount() {
		return refreshTokens.size();
	}

	private String uniqueAccessTokenValue() {
		String value;
		do {
			value = TokenGenerator.generate();
		}
		while (accessTokens.containsKey(value));
		return value;
	}

	private String uniqueRefreshTokenValue() {
		String value;
		do {
			value = TokenGenerator.generate();
		}
		while (refreshTokens.containsKey(value));
		return value;
	}

}

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
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.simplymcp.auth.AuthorizationCode;
import io.simplymcp.auth.exception.TokenException;
import io.simplymcp.server.auth.util.PkceVerifier;
import io.simplymcp.server.auth.util.TokenGenerator;

/**
 * {@link AuthorizationCodeStore} backed by a concurrent map. Consumption is a single
 * {@link ConcurrentMap#computeIfPresent} on the code, so checking and marking the
 * {@code consumed} flag cannot interleave between callers.
 * <p>
 * Consumed codes stay in the map until they expire so that a replay is answered
 * like any other invalid code.
 */
public class InMemoryAuthorizationCodeStore implements AuthorizationCodeStore {

	private static final Logger logger = LoggerFactory.getLogger(InMemoryAuthorizationCodeStore.class);

	static final String INVALID_CODE_DESCRIPTION = "Invalid authorization code";

	private final ConcurrentMap<String, AuthorizationCode> codes = new ConcurrentHashMap<>();

	private final Duration codeTtl;

	private final Clock clock;

	public InMemoryAuthorizationCodeStore(Duration codeTtl, Clock clock) {
		this.codeTtl = Objects.requireNonNull(codeTtl, "codeTtl must not be null");
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
	}

	@Override
	public AuthorizationCode issue(String clientId, String redirectUri, String codeChallenge,
			Collection<String> scopes) {
		Instant now = clock.instant();
		while (true) {
			AuthorizationCode code = new AuthorizationCode(TokenGenerator.generate(), clientId, redirectUri,
					codeChallenge, new LinkedHashSet<>(scopes), now, now.plus(codeTtl));
			if (codes.putIfAbsent(code.getCode(), code) == null) {
				return code;
			}
		}
	}

	@Override
	public AuthorizationCode consume(String code, String codeVerifier) throws TokenException {
		if (code == null) {
			throw TokenException.invalidGrant(INVALID_CODE_DESCRIPTION);
		}
		Instant now = clock.instant();
		AtomicReference<AuthorizationCode> consumed = new AtomicReference<>();
		AtomicReference<String> failure = new AtomicReference<>("unknown code");

		codes.computeIfPresent(code, (key, record) -> {
			if (record.isExpired(now)) {
				failure.set("expired code");
				return null;
			}
			if (record.isConsumed()) {
				failure.set("code already consumed");
				return record;
			}
			if (!PkceVerifier.verify(codeVerifier, record.getCodeChallenge())) {
				failure.set("PKCE verification failed");
				return record;
			}
			AuthorizationCode marked = record.markConsumed();
			consumed.set(marked);
			return marked;
		});

		AuthorizationCode result = consumed.get();
		if (result == null) {
			logger.debug("Rejected authorization code {}: {}", TokenGenerator.safeId(code), failure.get());
			throw TokenException.invalidGrant(INVALID_CODE_DESCRIPTION);
		}
		return result;
	}

	@Override
	public int purgeExpired() {
		Instant now = clock.instant();
		AtomicInteger removed = new AtomicInteger();
		codes.forEach((key, record) -> {
			if (record.isExpired(now) && codes.remove(key, record)) {
				removed.incrementAndGet();
			}
		});
		return removed.get();
	}

	@Override
	public int size() {
		return codes.size();
	}

}

/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.store;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import io.simplymcp.auth.RegisteredClient;
import io.simplymcp.auth.exception.DuplicateClientIdException;
import io.simplymcp.server.auth.util.TokenGenerator;

/**
 * {@link ClientRegistry} backed by a concurrent map. Secrets are stored as bcrypt
 * hashes.
 */
public class InMemoryClientRegistry implements ClientRegistry {

	private static final Logger logger = LoggerFactory.getLogger(InMemoryClientRegistry.class);

	private static final int CLIENT_ID_BYTES = 16;

	private final ConcurrentMap<String, RegisteredClient> clients = new ConcurrentHashMap<>();

	private final PasswordEncoder passwordEncoder;

	private final Clock clock;

	// compared against when the client is unknown so that both paths cost one bcrypt
	private final String dummyHash;

	public InMemoryClientRegistry(int bcryptStrength, Clock clock) {
		this(new BCryptPasswordEncoder(bcryptStrength), clock);
	}

	public InMemoryClientRegistry(PasswordEncoder passwordEncoder, Clock clock) {
		this.passwordEncoder = Objects.requireNonNull(passwordEncoder, "passwordEncoder must not be null");
		this.clock = Objects.requireNonNull(clock, "clock must not be null");
		this.dummyHash = passwordEncoder.encode(TokenGenerator.generate());
	}

	@Override
	public boolean authenticate(String clientId, String clientSecret) {
		if (clientId == null || clientSecret == null) {
			return false;
		}
		if (exceedsMaxLength(clientSecret)) {
			logger.debug("Rejecting client {}: secret longer than {} bytes", clientId, MAX_CLIENT_SECRET_BYTES);
			return false;
		}
		try {
			RegisteredClient client = clients.get(clientId);
			String hash = client != null ? client.getHashedSecret() : dummyHash;
			boolean matches = passwordEncoder.matches(clientSecret, hash);
			return client != null && matches;
		}
		catch (RuntimeException ex) {
			logger.warn("Rejecting client {} after secret verification error", clientId, ex);
			return false;
		}
	}

	@Override
	public boolean validateRedirectUri(String clientId, String redirectUri) {
		if (clientId == null || redirectUri == null) {
			return false;
		}
		RegisteredClient client = clients.get(clientId);
		return client != null && client.getRedirectUris().contains(redirectUri);
	}

	@Override
	public boolean validateScopes(String clientId, Collection<String> requestedScopes) {
		if (clientId == null) {
			return false;
		}
		RegisteredClient client = clients.get(clientId);
		if (client == null) {
			return false;
		}
		return requestedScopes == null || client.getAllowedScopes().containsAll(requestedScopes);
	}

	@Override
	public Set<String> resolveScopes(String clientId, Collection<String> requestedScopes) {
		if (requestedScopes != null && !requestedScopes.isEmpty()) {
			return new LinkedHashSet<>(requestedScopes);
		}
		RegisteredClient client = clientId != null ? clients.get(clientId) : null;
		return client != null ? new LinkedHashSet<>(client.getAllowedScopes()) : new LinkedHashSet<>();
	}

	@Override
	public Optional<RegisteredClient> getClient(String clientId) {
		return clientId == null ? Optional.empty() : Optional.ofNullable(clients.get(clientId));
	}

	@Override
	public RegisteredClient register(String clientSecret, Collection<String> redirectUris,
			Collection<String> allowedScopes, Collection<String> grantTypes) throws DuplicateClientIdException {
		return add(TokenGenerator.generate(CLIENT_ID_BYTES), clientSecret, redirectUris, allowedScopes, grantTypes);
	}

	@Override
	public RegisteredClient add(String clientId, String clientSecret, Collection<String> redirectUris,
			Collection<String> allowedScopes, Collection<String> grantTypes) throws DuplicateClientIdException {
		Objects.requireNonNull(clientSecret, "clientSecret must not be null");
		Objects.requireNonNull(grantTypes, "grantTypes must not be null");
		if (exceedsMaxLength(clientSecret)) {
			throw new IllegalArgumentException(
					"clientSecret must not be longer than " + MAX_CLIENT_SECRET_BYTES + " bytes");
		}
		RegisteredClient client = new RegisteredClient(clientId, passwordEncoder.encode(clientSecret),
				new LinkedHashSet<>(redirectUris), new LinkedHashSet<>(allowedScopes), new LinkedHashSet<>(grantTypes),
				clock.instant());
		if (clients.putIfAbsent(clientId, client) != null) {
			throw new DuplicateClientIdException(clientId);
		}
		logger.debug("Registered client {} with redirect URIs {}", clientId, client.getRedirectUris());
		return client;
	}

	@Override
	public boolean remove(String clientId) {
		return clientId != null && clients.remove(clientId) != null;
	}

	@Override
	public int size() {
		return clients.size();
	}

	private static boolean exceedsMaxLength(String clientSecret) {
		return clientSecret.getBytes(StandardCharsets.UTF_8).length > MAX_CLIENT_SECRET_BYTES;
	}

}

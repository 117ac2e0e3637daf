/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.store;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

import io.simplymcp.auth.RegisteredClient;
import io.simplymcp.auth.exception.DuplicateClientIdException;

/**
 * Holds the registered OAuth clients and validates their credentials, redirect URIs
 * and scopes.
 */
public interface ClientRegistry {

	/**
	 * Longest accepted client secret in UTF-8 bytes. bcrypt ignores everything past
	 * this length.
	 */
	int MAX_CLIENT_SECRET_BYTES = 72;

	/**
	 * Verifies a client secret. Unknown clients and internal hashing failures yield
	 * false, and an unknown client takes as long to reject as a wrong secret.
	 * @param clientId the client id
	 * @param clientSecret the raw secret presented by the client
	 * @return true only if the client exists and the secret matches
	 */
	boolean authenticate(String clientId, String clientSecret);

	/**
	 * Exact string comparison against the registered redirect URIs. No prefix or
	 * wildcard matching.
	 * @param clientId the client id
	 * @param redirectUri the redirect URI of the request
	 * @return true if the URI is registered for the client
	 */
	boolean validateRedirectUri(String clientId, String redirectUri);

	/**
	 * Checks that every requested scope is allowed for the client. An empty request is
	 * valid; see {@link #resolveScopes(String, Collection)}.
	 * @param clientId the client id
	 * @param requestedScopes the requested scopes, may be null
	 * @return true if the client exists and all requested scopes are allowed
	 */
	boolean validateScopes(String clientId, Collection<String> requestedScopes);

	/**
	 * Resolves the scopes to grant. An empty or null request resolves to the client's
	 * full allowed set; otherwise the requested scopes are returned unchanged. Callers
	 * validate with {@link #validateScopes(String, Collection)} first.
	 * @param clientId the client id
	 * @param requestedScopes the requested scopes, may be null
	 * @return the scopes to grant
	 */
	Set<String> resolveScopes(String clientId, Collection<String> requestedScopes);

	Optional<RegisteredClient> getClient(String clientId);

	/**
	 * Registers a new client under a generated client id.
	 * @param clientSecret the raw secret, hashed before storage
	 * @param redirectUris the exact redirect URIs the client may use
	 * @param allowedScopes the scopes the client may request
	 * @return the stored client
	 * @throws DuplicateClientIdException if the generated id is already taken
	 */
	default RegisteredClient register(String clientSecret, Collection<String> redirectUris,
			Collection<String> allowedScopes) throws DuplicateClientIdException {
		return register(clientSecret, redirectUris, allowedScopes, RegisteredClient.DEFAULT_GRANT_TYPES);
	}

	/**
	 * Registers a new client limited to the given grant types.
	 * @throws DuplicateClientIdException if the generated id is already taken
	 */
	RegisteredClient register(String clientSecret, Collection<String> redirectUris, Collection<String> allowedScopes,
			Collection<String> grantTypes) throws DuplicateClientIdException;

	/**
	 * Registers a client under a caller-chosen id, as done for statically configured
	 * clients.
	 * @throws DuplicateClientIdException if the id is already taken
	 */
	default RegisteredClient add(String clientId, String clientSecret, Collection<String> redirectUris,
			Collection<String> allowedScopes) throws DuplicateClientIdException {
		return add(clientId, clientSecret, redirectUris, allowedScopes, RegisteredClient.DEFAULT_GRANT_TYPES);
	}

	RegisteredClient add(String clientId, String clientSecret, Collection<String> redirectUris,
			Collection<String> allowedScopes, Collection<String> grantTypes) throws DuplicateClientIdException;

	boolean remove(String clientId);

	int size();

}

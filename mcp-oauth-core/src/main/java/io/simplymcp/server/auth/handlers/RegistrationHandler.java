/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.handlers;

import java.util.concurrent.CompletableFuture;

import io.simplymcp.auth.OAuthClientInformation;
import io.simplymcp.auth.OAuthClientMetadata;
import io.simplymcp.auth.exception.OAuthErrorCode;
import io.simplymcp.auth.exception.RegistrationException;
import io.simplymcp.server.auth.OAuthProvider;
import io.simplymcp.server.auth.settings.ClientRegistrationOptions;

/**
 * Handler for RFC 7591 dynamic client registration requests.
 */
public class RegistrationHandler {

	private final OAuthProvider provider;

	private final ClientRegistrationOptions options;

	public RegistrationHandler(OAuthProvider provider, ClientRegistrationOptions options) {
		this.provider = provider;
		this.options = options;
	}

	/**
	 * Handle a client registration request.
	 * @param metadata The client metadata
	 * @return A CompletableFuture that resolves to the client information, or fails
	 * with a {@link RegistrationException}
	 */
	public CompletableFuture<OAuthClientInformation> handle(OAuthClientMetadata metadata) {
		if (!options.isEnabled()) {
			return CompletableFuture.failedFuture(new RegistrationException(OAuthErrorCode.INVALID_REQUEST,
					"Dynamic client registration is disabled"));
		}
		if (metadata == null) {
			return CompletableFuture.failedFuture(
					new RegistrationException(OAuthErrorCode.INVALID_CLIENT_METADATA, "Missing client metadata"));
		}
		try {
			return CompletableFuture.completedFuture(provider.registerClient(metadata));
		}
		catch (RegistrationException ex) {
			return CompletableFuture.failedFuture(ex);
		}
	}

}

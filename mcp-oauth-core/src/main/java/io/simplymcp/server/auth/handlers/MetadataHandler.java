/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.handlers;

import java.util.concurrent.CompletableFuture;

import io.simplymcp.auth.OAuthMetadata;

/**
 * Handler for authorization server metadata requests.
 */
public class MetadataHandler {

	private final OAuthMetadata metadata;

	public MetadataHandler(OAuthMetadata metadata) {
		this.metadata = metadata;
	}

	/**
	 * Handle a metadata request.
	 * @return A CompletableFuture that resolves to the OAuth metadata
	 */
	public CompletableFuture<OAuthMetadata> handle() {
		return CompletableFuture.completedFuture(metadata);
	}

}

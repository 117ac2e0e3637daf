/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.handlers;

import java.util.concurrent.CompletableFuture;

import io.simplymcp.auth.ProtectedResourceMetadata;

/**
 * Handler for RFC 9728 protected resource metadata requests.
 */
public class ProtectedResourceMetadataHandler {

	private final ProtectedResourceMetadata metadata;

	public ProtectedResourceMetadataHandler(ProtectedResourceMetadata metadata) {
		this.metadata = metadata;
	}

	public CompletableFuture<ProtectedResourceMetadata> handle() {
		return CompletableFuture.completedFuture(metadata);
	}

}

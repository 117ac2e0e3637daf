/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.settings;

/**
 * Options for the token revocation endpoint.
 */
public class RevocationOptions {

	private boolean enabled = true;

	public boolean isEnabled() {
		return enabled;
	}

	public void setEnabled(boolean enabled) {
		this.enabled = enabled;
	}

}

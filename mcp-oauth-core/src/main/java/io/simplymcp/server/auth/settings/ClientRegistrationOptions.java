/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.settings;

import java.util.List;

/**
 * Options for OAuth client registration.
 */
public class ClientRegistrationOptions {

	private boolean enabled = false;

	private boolean allowLocalhostRedirect = true;

	private List<String> validScopes;

	private List<String> defaultScopes;

	/**
	 * Check if client registration is enabled.
	 * @return true if client registration is enabled, false otherwise
	 */
	public boolean isEnabled() {
		return enabled;
	}

	/**
	 * Set whether client registration is enabled.
	 * @param enabled true to enable client registration, false to disable
	 */
	public void setEnabled(boolean enabled) {
		this.enabled = enabled;
	}

	/**
	 * Check if http redirect URIs to localhost are allowed.
	 * @return true if localhost redirect URIs are allowed, false otherwise
	 */
	public boolean isAllowLocalhostRedirect() {
		return allowLocalhostRedirect;
	}

	/**
	 * Set whether http redirect URIs to localhost are allowed.
	 * @param allowLocalhostRedirect true to allow localhost redirect URIs, false to
	 * require https everywhere
	 */
	public void setAllowLocalhostRedirect(boolean allowLocalhostRedirect) {
		this.allowLocalhostRedirect = allowLocalhostRedirect;
	}

	/**
	 * Get the scopes a dynamically registered client may ask for. A null list places
	 * no restriction.
	 * @return the list of valid scopes
	 */
	public List<String> getValidScopes() {
		return validScopes;
	}

	public void setValidScopes(List<String> validScopes) {
		this.validScopes = validScopes;
	}

	/**
	 * Get the scopes granted to a registering client that does not name any.
	 * @return the default scopes
	 */
	public List<String> getDefaultScopes() {
		return defaultScopes;
	}

	public void setDefaultScopes(List<String> defaultScopes) {
		this.defaultScopes = defaultScopes;
	}

}

/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.middleware;

import java.util.Set;

import io.simplymcp.auth.AuthInfo;

/**
 * Holds authentication context for a request.
 */
public class AuthContext {

	/**
	 * Name of the request attribute under which the bearer filter stores the context.
	 */
	public static final String REQUEST_ATTRIBUTE = AuthContext.class.getName();

	private static final ThreadLocal<AuthContext> CURRENT = new ThreadLocal<>();

	private final AuthInfo authInfo;

	/**
	 * Creates a new AuthContext.
	 * @param authInfo The verified access token information.
	 */
	public AuthContext(AuthInfo authInfo) {
		this.authInfo = authInfo;
	}

	/**
	 * Gets the verified access token information.
	 * @return The token information.
	 */
	public AuthInfo getAuthInfo() {
		return authInfo;
	}

	/**
	 * Gets the client ID.
	 * @return The client ID.
	 */
	public String getClientId() {
		return authInfo != null ? authInfo.getClientId() : null;
	}

	public Set<String> getScopes() {
		return authInfo != null ? authInfo.getScopes() : Set.of();
	}

	/**
	 * Checks if the token carries the specified scope.
	 * @param scope The scope to check.
	 * @return True if the token has the scope, false otherwise.
	 */
	public boolean hasScope(String scope) {
		return authInfo != null && authInfo.hasScope(scope);
	}

	/**
	 * Gets the context bound to the current thread.
	 * @return The current context, or null outside an authenticated request.
	 */
	public static AuthContext getCurrent() {
		return CURRENT.get();
	}

	public static void setCurrent(AuthContext authContext) {
		CURRENT.set(authContext);
	}

	public static void clearCurrent() {
		CURRENT.remove();
	}

}

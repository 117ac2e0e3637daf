/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.util;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Conversions between the space-delimited wire form of scopes and scope sets.
 */
public final class ScopeUtils {

	private ScopeUtils() {
	}

	public static Set<String> parse(String scope) {
		Set<String> scopes = new LinkedHashSet<>();
		if (scope == null) {
			return scopes;
		}
		for (String part : scope.trim().split("\\s+")) {
			if (!part.isEmpty()) {
				scopes.add(part);
			}
		}
		return scopes;
	}

	public static String format(Collection<String> scopes) {
		return scopes == null ? "" : String.join(" ", scopes);
	}

}

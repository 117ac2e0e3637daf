/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.store;

/**
 * The {@code token_type_hint} of RFC 7009. A hint only decides which kind of token is
 * looked up first.
 */
public enum TokenTypeHint {

	ACCESS_TOKEN("access_token"),

	REFRESH_TOKEN("refresh_token");

	private final String value;

	TokenTypeHint(String value) {
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	/**
	 * @param value the wire value, may be null
	 * @return the matching hint, or null for a missing or unknown value
	 */
	public static TokenTypeHint fromValue(String value) {
		for (TokenTypeHint hint : values()) {
			if (hint.value.equals(value)) {
				return hint;
			}
		}
		return null;
	}

}

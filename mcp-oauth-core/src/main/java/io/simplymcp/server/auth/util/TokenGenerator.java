/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.util;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Generates opaque, unguessable token strings for codes, tokens, client ids and
 * secrets.
 */
public final class TokenGenerator {

	private static final int SAFE_ID_LENGTH = 8;

	private static final int MIN_PREFIXED_LENGTH = 16;

	private static final SecureRandom secureRandom = new SecureRandom();

	private static final int DEFAULT_BYTES = 32;

	private TokenGenerator() {
	}

	/**
	 * Generates a 256-bit random value encoded as unpadded base64url.
	 * @return a new token string
	 */
	public static String generate() {
		return generate(DEFAULT_BYTES);
	}

	public static String generate(int numBytes) {
		byte[] bytes = new byte[numBytes];
		secureRandom.nextBytes(bytes);
		return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
	}

	/**
	 * Returns a loggable prefix of a secret value. Full tokens, codes and secrets are
	 * never written to logs.
	 * @param token the secret value
	 * @return the first eight characters followed by an ellipsis, or only a mask for
	 * values too short to give away a prefix
	 */
	public static String safeId(String token) {
		if (token == null) {
			return "null";
		}
		if (token.length() < MIN_PREFIXED_LENGTH) {
			return "***";
		}
		return token.substring(0, SAFE_ID_LENGTH) + "...";
	}

}

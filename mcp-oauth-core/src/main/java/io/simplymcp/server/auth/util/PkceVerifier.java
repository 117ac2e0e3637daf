/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * Server side of PKCE (RFC 7636) with the S256 method.
 */
public final class PkceVerifier {

	private static final Pattern VERIFIER_PATTERN = Pattern.compile("^[A-Za-z0-9\\-._~]{43,128}$");

	private PkceVerifier() {
	}

	/**
	 * Computes the S256 code challenge for a code verifier.
	 * @param codeVerifier The code verifier to hash.
	 * @return base64url(SHA-256(codeVerifier)) without padding.
	 */
	public static String computeChallenge(String codeVerifier) {
		try {
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			byte[] hash = digest.digest(codeVerifier.getBytes(StandardCharsets.US_ASCII));
			return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
		}
		catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 algorithm not available", e);
		}
	}

	/**
	 * Checks a code verifier against a stored challenge in constant time.
	 * @param codeVerifier the verifier presented at the token endpoint
	 * @param codeChallenge the challenge recorded at authorization time
	 * @return true if the verifier is well formed and hashes to the challenge
	 */
	public static boolean verify(String codeVerifier, String codeChallenge) {
		if (codeVerifier == null || codeChallenge == null || !isWellFormed(codeVerifier)) {
			return false;
		}
		byte[] computed = computeChallenge(codeVerifier).getBytes(StandardCharsets.US_ASCII);
		byte[] expected = codeChallenge.getBytes(StandardCharsets.US_ASCII);
		return MessageDigest.isEqual(computed, expected);
	}

	public static boolean isWellFormed(String codeVerifier) {
		return VERIFIER_PATTERN.matcher(codeVerifier).matches();
	}

}

/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.middleware;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

import io.simplymcp.auth.exception.OAuthErrorCode;
import io.simplymcp.auth.exception.TokenException;
import io.simplymcp.util.Utils;

/**
 * Extracts client credentials from a token or revocation request, either from the
 * request body ({@code client_secret_post}) or from an HTTP Basic
 * {@code Authorization} header ({@code client_secret_basic}). The secret itself is
 * verified later by the provider.
 */
public class ClientAuthenticator {

	private static final String BASIC_PREFIX = "Basic ";

	/**
	 * @param params the request parameters
	 * @param authorizationHeader the Authorization header, may be null
	 * @return the presented credentials
	 * @throws TokenException {@code invalid_request} if both methods are used with
	 * conflicting ids, {@code invalid_client} if no credentials are present
	 */
	public ClientCredentials extractCredentials(Map<String, String> params, String authorizationHeader)
			throws TokenException {
		String bodyClientId = params.get("client_id");
		String bodyClientSecret = params.get("client_secret");

		if (authorizationHeader != null
				&& authorizationHeader.regionMatches(true, 0, BASIC_PREFIX, 0, BASIC_PREFIX.length())) {
			if (Utils.hasText(bodyClientSecret)) {
				throw new TokenException(OAuthErrorCode.INVALID_REQUEST,
						"Multiple client authentication methods are not allowed");
			}
			ClientCredentials basic = decodeBasic(authorizationHeader.substring(BASIC_PREFIX.length()).trim());
			if (Utils.hasText(bodyClientId) && !bodyClientId.equals(basic.getClientId())) {
				throw new TokenException(OAuthErrorCode.INVALID_REQUEST, "client_id does not match credentials");
			}
			return basic;
		}

		if (!Utils.hasText(bodyClientId) || !Utils.hasText(bodyClientSecret)) {
			throw TokenException.invalidClient();
		}
		return new ClientCredentials(bodyClientId, bodyClientSecret);
	}

	private ClientCredentials decodeBasic(String encoded) throws TokenException {
		String decoded;
		try {
			decoded = new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8);
		}
		catch (IllegalArgumentException ex) {
			throw TokenException.invalidClient();
		}
		int separator = decoded.indexOf(':');
		if (separator <= 0) {
			throw TokenException.invalidClient();
		}
		// RFC 6749 section 2.3.1: both parts are form-urlencoded before base64
		try {
			String clientId = URLDecoder.decode(decoded.substring(0, separator), StandardCharsets.UTF_8);
			String clientSecret = URLDecoder.decode(decoded.substring(separator + 1), StandardCharsets.UTF_8);
			return new ClientCredentials(clientId, clientSecret);
		}
		catch (IllegalArgumentException ex) {
			throw TokenException.invalidClient();
		}
	}

}

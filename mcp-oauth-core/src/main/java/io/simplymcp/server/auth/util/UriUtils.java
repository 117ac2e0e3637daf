/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

/**
 * URI helpers for issuer validation, endpoint construction and redirect building.
 */
public final class UriUtils {

	private UriUtils() {
	}

	/**
	 * Validates an issuer URL per RFC 8414 section 2: https (http allowed for loopback
	 * hosts), no query and no fragment.
	 * @param issuerUrl the issuer URL
	 * @throws IllegalArgumentException if the URL is not a valid issuer
	 */
	public static void validateIssuerUrl(URI issuerUrl) {
		if (issuerUrl == null || !issuerUrl.isAbsolute()) {
			throw new IllegalArgumentException("Issuer URL must be an absolute URI");
		}
		String scheme = issuerUrl.getScheme().toLowerCase(Locale.ROOT);
		if (!"https".equals(scheme) && !("http".equals(scheme) && isLoopbackHost(issuerUrl.getHost()))) {
			throw new IllegalArgumentException("Issuer URL must be HTTPS: " + issuerUrl);
		}
		if (issuerUrl.getRawQuery() != null) {
			throw new IllegalArgumentException("Issuer URL must not have a query component: " + issuerUrl);
		}
		if (issuerUrl.getRawFragment() != null) {
			throw new IllegalArgumentException("Issuer URL must not have a fragment: " + issuerUrl);
		}
	}

	/**
	 * Builds an endpoint URL under the issuer.
	 * @param issuerUrl the issuer URL
	 * @param path the endpoint path, starting with a slash
	 * @return the endpoint URL
	 */
	public static URI buildEndpointUrl(URI issuerUrl, String path) {
		String base = issuerUrl.toString();
		if (base.endsWith("/")) {
			base = base.substring(0, base.length() - 1);
		}
		return URI.create(base + path);
	}

	/**
	 * Appends query parameters to a redirect URI, preserving any existing query.
	 * Parameters with a null value are skipped.
	 * @param baseUri the redirect URI
	 * @param params parameters in insertion order
	 * @return the redirect URL as a string
	 */
	public static String appendQueryParams(String baseUri, Map<String, String> params) {
		StringBuilder query = new StringBuilder();
		params.forEach((key, value) -> {
			if (value != null) {
				if (query.length() > 0) {
					query.append('&');
				}
				query.append(encode(key)).append('=').append(encode(value));
			}
		});
		if (query.length() == 0) {
			return baseUri;
		}
		int fragmentIndex = baseUri.indexOf('#');
		String withoutFragment = fragmentIndex >= 0 ? baseUri.substring(0, fragmentIndex) : baseUri;
		char separator = withoutFragment.contains("?") ? '&' : '?';
		return withoutFragment + separator + query;
	}

	/**
	 * Checks that a redirect URI may be registered: absolute, without fragment, and
	 * https unless it points at a loopback host and loopback redirects are allowed.
	 * @param redirectUri the candidate URI
	 * @param allowLoopbackHttp whether plain http to localhost is acceptable
	 * @return true if the URI is acceptable
	 */
	public static boolean isAcceptableRedirectUri(String redirectUri, boolean allowLoopbackHttp) {
		URI uri;
		try {
			uri = new URI(redirectUri);
		}
		catch (URISyntaxException e) {
			return false;
		}
		if (!uri.isAbsolute() || uri.getRawFragment() != null || uri.getHost() == null) {
			return false;
		}
		String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
		if ("https".equals(scheme)) {
			return true;
		}
		return "http".equals(scheme) && allowLoopbackHttp && isLoopbackHost(uri.getHost());
	}

	public static boolean isLoopbackHost(String host) {
		return "localhost".equalsIgnoreCase(host) || "127.0.0.1".equals(host) || "[::1]".equals(host);
	}

	private static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8);
	}

}

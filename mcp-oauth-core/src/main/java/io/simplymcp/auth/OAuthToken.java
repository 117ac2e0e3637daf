/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.auth;

import java.time.Duration;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * OAuth token response as defined in RFC 6749 section 5.1
 * https://datatracker.ietf.org/doc/html/rfc6749#section-5.1
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OAuthToken {

	public static final String TOKEN_TYPE_BEARER = "Bearer";

	@JsonProperty("access_token")
	private String accessToken;

	@JsonProperty("token_type")
	private String tokenType;

	@JsonProperty("expires_in")
	private Long expiresIn;

	@JsonProperty("scope")
	private String scope;

	@JsonProperty("refresh_token")
	private String refreshToken;

	public OAuthToken() {
		this.tokenType = TOKEN_TYPE_BEARER;
	}

	public OAuthToken(String accessToken, Long expiresIn, String scope, String refreshToken) {
		this.accessToken = accessToken;
		this.tokenType = TOKEN_TYPE_BEARER;
		this.expiresIn = expiresIn;
		this.scope = scope;
		this.refreshToken = refreshToken;
	}

	/**
	 * Builds the wire response for a freshly issued token pair.
	 * @param pair the issued tokens
	 * @return the token response
	 */
	public static OAuthToken from(TokenPair pair) {
		AccessToken accessToken = pair.getAccessToken();
		long expiresIn = Duration.between(accessToken.getIssuedAt(), accessToken.getExpiresAt()).getSeconds();
		return new OAuthToken(accessToken.getToken(), expiresIn, String.join(" ", accessToken.getScopes()),
				pair.getRefreshToken().getToken());
	}

	public String getAccessToken() {
		return accessToken;
	}

	public void setAccessToken(String accessToken) {
		this.accessToken = accessToken;
	}

	public String getTokenType() {
		return tokenType;
	}

	public void setTokenType(String tokenType) {
		this.tokenType = tokenType;
	}

	public Long getExpiresIn() {
		return expiresIn;
	}

	public void setExpiresIn(Long expiresIn) {
		this.expiresIn = expiresIn;
	}

	public String getScope() {
		return scope;
	}

	public void setScope(String scope) {
		this.scope = scope;
	}

	public String getRefreshToken() {
		return refreshToken;
	}

	public void setRefreshToken(String refreshToken) {
		this.refreshToken = refreshToken;
	}

}

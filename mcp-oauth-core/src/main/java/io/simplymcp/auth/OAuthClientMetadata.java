/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.auth;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * RFC 7591 OAuth 2.0 Dynamic Client Registration metadata, as sent by the client.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class OAuthClientMetadata {

	@JsonProperty("redirect_uris")
	private List<String> redirectUris;

	@JsonProperty("token_endpoint_auth_method")
	private String tokenEndpointAuthMethod;

	@JsonProperty("grant_types")
	private List<String> grantTypes;

	@JsonProperty("response_types")
	private List<String> responseTypes;

	@JsonProperty("scope")
	private String scope;

	@JsonProperty("client_name")
	private String clientName;

	@JsonProperty("client_secret")
	private String clientSecret;

	public OAuthClientMetadata() {
		this.tokenEndpointAuthMethod = "client_secret_post";
		this.grantTypes = List.of("authorization_code", "refresh_token");
		this.responseTypes = List.of("code");
	}

	public List<String> getRedirectUris() {
		return redirectUris;
	}

	public void setRedirectUris(List<String> redirectUris) {
		this.redirectUris = redirectUris;
	}

	public String getTokenEndpointAuthMethod() {
		return tokenEndpointAuthMethod;
	}

	public void setTokenEndpointAuthMethod(String tokenEndpointAuthMethod) {
		this.tokenEndpointAuthMethod = tokenEndpointAuthMethod;
	}

	public List<String> getGrantTypes() {
		return grantTypes;
	}

	public void setGrantTypes(List<String> grantTypes) {
		this.grantTypes = grantTypes;
	}

	public List<String> getResponseTypes() {
		return responseTypes;
	}

	public void setResponseTypes(List<String> responseTypes) {
		this.responseTypes = responseTypes;
	}

	public String getScope() {
		return scope;
	}

	public void setScope(String scope) {
		this.scope = scope;
	}

	public String getClientName() {
		return clientName;
	}

	public void setClientName(String clientName) {
		this.clientName = clientName;
	}

	/**
	 * Optional client-chosen secret. When absent the server generates one.
	 */
	public String getClientSecret() {
		return clientSecret;
	}

	public void setClientSecret(String clientSecret) {
		this.clientSecret = clientSecret;
	}

}

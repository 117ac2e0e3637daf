/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.auth;

import java.net.URI;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * RFC 8414 OAuth 2.0 Authorization Server Metadata. See
 * https://datatracker.ietf.org/doc/html/rfc8414#section-2
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OAuthMetadata {

	@JsonProperty("issuer")
	private URI issuer;

	@JsonProperty("authorization_endpoint")
	private URI authorizationEndpoint;

	@JsonProperty("token_endpoint")
	private URI tokenEndpoint;

	@JsonProperty("registration_endpoint")
	private URI registrationEndpoint;

	@JsonProperty("revocation_endpoint")
	private URI revocationEndpoint;

	@JsonProperty("scopes_supported")
	private List<String> scopesSupported;

	@JsonProperty("response_types_supported")
	private List<String> responseTypesSupported;

	@JsonProperty("grant_types_supported")
	private List<String> grantTypesSupported;

	@JsonProperty("token_endpoint_auth_methods_supported")
	private List<String> tokenEndpointAuthMethodsSupported;

	@JsonProperty("revocation_endpoint_auth_methods_supported")
	private List<String> revocationEndpointAuthMethodsSupported;

	@JsonProperty("code_challenge_methods_supported")
	private List<String> codeChallengeMethodsSupported;

	@JsonProperty("service_documentation")
	private URI serviceDocumentation;

	public OAuthMetadata() {
		this.responseTypesSupported = List.of("code");
	}

	public URI getIssuer() {
		return issuer;
	}

	public void setIssuer(URI issuer) {
		this.issuer = issuer;
	}

	public URI getAuthorizationEndpoint() {
		return authorizationEndpoint;
	}

	public void setAuthorizationEndpoint(URI authorizationEndpoint) {
		this.authorizationEndpoint = authorizationEndpoint;
	}

	public URI getTokenEndpoint() {
		return tokenEndpoint;
	}

	public void setTokenEndpoint(URI tokenEndpoint) {
		this.tokenEndpoint = tokenEndpoint;
	}

	public URI getRegistrationEndpoint() {
		return registrationEndpoint;
	}

	public void setRegistrationEndpoint(URI registrationEndpoint) {
		this.registrationEndpoint = registrationEndpoint;
	}

	public URI getRevocationEndpoint() {
		return revocationEndpoint;
	}

	public void setRevocationEndpoint(URI revocationEndpoint) {
		this.revocationEndpoint = revocationEndpoint;
	}

	public List<String> getScopesSupported() {
		return scopesSupported;
	}

	public void setScopesSupported(List<String> scopesSupported) {
		this.scopesSupported = scopesSupported;
	}

	public List<String> getResponseTypesSupported() {
		return responseTypesSupported;
	}

	public void setResponseTypesSupported(List<String> responseTypesSupported) {
		this.responseTypesSupported = responseTypesSupported;
	}

	public List<String> getGrantTypesSupported() {
		return grantTypesSupported;
	}

	public void setGrantTypesSupported(List<String> grantTypesSupported) {
		this.grantTypesSupported = grantTypesSupported;
	}

	public List<String> getTokenEndpointAuthMethodsSupported() {
		return tokenEndpointAuthMethodsSupported;
	}

	public void setTokenEndpointAuthMethodsSupported(List<String> tokenEndpointAuthMethodsSupported) {
		this.tokenEndpointAuthMethodsSupported = tokenEndpointAuthMethodsSupported;
	}

	public List<String> getRevocationEndpointAuthMethodsSupported() {
		return revocationEndpointAuthMethodsSupported;
	}

	public void setRevocationEndpointAuthMethodsSupported(List<String> revocationEndpointAuthMethodsSupported) {
		this.revocationEndpointAuthMethodsSupported = revocationEndpointAuthMethodsSupported;
	}

	public List<String> getCodeChallengeMethodsSupported() {
		return codeChallengeMethodsSupported;
	}

	public void setCodeChallengeMethodsSupported(List<String> codeChallengeMethodsSupported) {
		this.codeChallengeMethodsSupported = codeChallengeMethodsSupported;
	}

	public URI getServiceDocumentation() {
		return serviceDocumentation;
	}

	public void setServiceDocumentation(URI serviceDocumentation) {
		this.serviceDocumentation = serviceDocumentation;
	}

}

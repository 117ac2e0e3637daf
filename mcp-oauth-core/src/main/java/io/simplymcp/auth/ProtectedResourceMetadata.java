/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.auth;

import java.net.URI;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * RFC 9728 OAuth 2.0 Protected Resource Metadata.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProtectedResourceMetadata {

	@JsonProperty("resource")
	private URI resource;

	@JsonProperty("authorization_servers")
	private List<URI> authorizationServers;

	@JsonProperty("scopes_supported")
	private List<String> scopesSupported;

	@JsonProperty("bearer_methods_supported")
	private List<String> bearerMethodsSupported;

	@JsonProperty("resource_documentation")
	private URI resourceDocumentation;

	public URI getResource() {
		return resource;
	}

	public void setResource(URI resource) {
		this.resource = resource;
	}

	public List<URI> getAuthorizationServers() {
		return authorizationServers;
	}

	public void setAuthorizationServers(List<URI> authorizationServers) {
		this.authorizationServers = authorizationServers;
	}

	public List<String> getScopesSupported() {
		return scopesSupported;
	}

	public void setScopesSupported(List<String> scopesSupported) {
		this.scopesSupported = scopesSupported;
	}

	public List<String> getBearerMethodsSupported() {
		return bearerMethodsSupported;
	}

	public void setBearerMethodsSupported(List<String> bearerMethodsSupported) {
		this.bearerMethodsSupported = bearerMethodsSupported;
	}

	public URI getResourceDocumentation() {
		return resourceDocumentation;
	}

	public void setResourceDocumentation(URI resourceDocumentation) {
		this.resourceDocumentation = resourceDocumentation;
	}

}

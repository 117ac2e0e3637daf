/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth;

import java.net.URI;
import java.util.List;

import io.simplymcp.auth.AuthorizationCode;
import io.simplymcp.auth.OAuthMetadata;
import io.simplymcp.auth.ProtectedResourceMetadata;
import io.simplymcp.server.auth.handlers.AuthorizationHandler;
import io.simplymcp.server.auth.handlers.MetadataHandler;
import io.simplymcp.server.auth.handlers.ProtectedResourceMetadataHandler;
import io.simplymcp.server.auth.handlers.RegistrationHandler;
import io.simplymcp.server.auth.handlers.RevocationHandler;
import io.simplymcp.server.auth.handlers.TokenHandler;
import io.simplymcp.server.auth.middleware.ClientAuthenticator;
import io.simplymcp.server.auth.settings.ClientRegistrationOptions;
import io.simplymcp.server.auth.settings.RevocationOptions;
import io.simplymcp.server.auth.util.UriUtils;

/**
 * Helper class for creating OAuth routes.
 */
public class OAuthRoutes {

	public static final String AUTHORIZATION_PATH = "/oauth/authorize";

	public static final String TOKEN_PATH = "/oauth/token";

	public static final String REGISTRATION_PATH = "/oauth/register";

	public static final String REVOCATION_PATH = "/oauth/revoke";

	public static final String METADATA_PATH = "/.well-known/oauth-authorization-server";

	public static final String PROTECTED_RESOURCE_METADATA_PATH = "/.well-known/oauth-protected-resource";

	private static final List<String> CLIENT_AUTH_METHODS = List.of("client_secret_post", "client_secret_basic");

	/**
	 * Create OAuth metadata for the server.
	 * @param issuerUrl The issuer URL
	 * @param serviceDocumentationUrl The service documentation URL, may be null
	 * @param clientRegistrationOptions The client registration options
	 * @param revocationOptions The revocation options
	 * @param scopesSupported The scopes advertised to clients, may be null
	 * @return The OAuth metadata
	 */
	public static OAuthMetadata buildMetadata(URI issuerUrl, URI serviceDocumentationUrl,
			ClientRegistrationOptions clientRegistrationOptions, RevocationOptions revocationOptions,
			List<String> scopesSupported) {

		UriUtils.validateIssuerUrl(issuerUrl);

		OAuthMetadata metadata = new OAuthMetadata();
		metadata.setIssuer(issuerUrl);
		metadata.setAuthorizationEndpoint(UriUtils.buildEndpointUrl(issuerUrl, AUTHORIZATION_PATH));
		metadata.setTokenEndpoint(UriUtils.buildEndpointUrl(issuerUrl, TOKEN_PATH));
		metadata.setScopesSupported(
				scopesSupported != null ? scopesSupported : clientRegistrationOptions.getValidScopes());
		metadata.setResponseTypesSupported(List.of(OAuthProvider.RESPONSE_TYPE_CODE));
		metadata.setGrantTypesSupported(
				List.of(OAuthProvider.GRANT_TYPE_AUTHORIZATION_CODE, OAuthProvider.GRANT_TYPE_REFRESH_TOKEN));
		metadata.setTokenEndpointAuthMethodsSupported(CLIENT_AUTH_METHODS);
		metadata.setServiceDocumentation(serviceDocumentationUrl);
		metadata.setCodeChallengeMethodsSupported(List.of(AuthorizationCode.CODE_CHALLENGE_METHOD_S256));

		if (clientRegistrationOptions.isEnabled()) {
			metadata.setRegistrationEndpoint(UriUtils.buildEndpointUrl(issuerUrl, REGISTRATION_PATH));
		}

		if (revocationOptions.isEnabled()) {
			metadata.setRevocationEndpoint(UriUtils.buildEndpointUrl(issuerUrl, REVOCATION_PATH));
			metadata.setRevocationEndpointAuthMethodsSupported(CLIENT_AUTH_METHODS);
		}

		return metadata;
	}

	/**
	 * Create RFC 9728 metadata describing a resource server protected by this
	 * authorization server.
	 * @param resourceUrl The protected resource URL
	 * @param issuerUrl The issuer URL of the authorization server
	 * @param scopesSupported The scopes the resource understands, may be null
	 * @param resourceDocumentationUrl The resource documentation URL, may be null
	 * @return The protected resource metadata
	 */
	public static ProtectedResourceMetadata buildProtectedResourceMetadata(URI resourceUrl, URI issuerUrl,
			List<String> scopesSupported, URI resourceDocumentationUrl) {
		ProtectedResourceMetadata metadata = new ProtectedResourceMetadata();
		metadata.setResource(resourceUrl);
		metadata.setAuthorizationServers(List.of(issuerUrl));
		metadata.setScopesSupported(scopesSupported);
		metadata.setBearerMethodsSupported(List.of("header"));
		metadata.setResourceDocumentation(resourceDocumentationUrl);
		return metadata;
	}

	/**
	 * Create handlers for OAuth routes.
	 * @param provider The OAuth provider
	 * @param metadata The OAuth metadata
	 * @param resourceMetadata The protected resource metadata, may be null
	 * @param clientRegistrationOptions The client registration options
	 * @param revocationOptions The revocation options
	 * @return The route handlers
	 */
	public static OAuthHandlers createHandlers(OAuthProvider provider, OAuthMetadata metadata,
			ProtectedResourceMetadata resourceMetadata, ClientRegistrationOptions clientRegistrationOptions,
			RevocationOptions revocationOptions) {

		ClientAuthenticator clientAuthenticator = new ClientAuthenticator();

		OAuthHandlers handlers = new OAuthHandlers();
		handlers.setMetadataHandler(new MetadataHandler(metadata));
		handlers.setAuthorizationHandler(new AuthorizationHandler(provider));
		handlers.setTokenHandler(new TokenHandler(provider, clientAuthenticator));

		if (resourceMetadata != null) {
			handlers.setProtectedResourceMetadataHandler(new ProtectedResourceMetadataHandler(resourceMetadata));
		}

		if (clientRegistrationOptions.isEnabled()) {
			handlers.setRegistrationHandler(new RegistrationHandler(provider, clientRegistrationOptions));
		}

		if (revocationOptions.isEnabled()) {
			handlers.setRevocationHandler(new RevocationHandler(provider, clientAuthenticator));
		}

		return handlers;
	}

	/**
	 * Container for OAuth route handlers. Optional handlers are null when the
	 * corresponding endpoint is disabled.
	 */
	public static class OAuthHandlers {

		private MetadataHandler metadataHandler;

		private ProtectedResourceMetadataHandler protectedResourceMetadataHandler;

		private AuthorizationHandler authorizationHandler;

		private TokenHandler tokenHandler;

		private RegistrationHandler registrationHandler;

		private RevocationHandler revocationHandler;

		public MetadataHandler getMetadataHandler() {
			return metadataHandler;
		}

		public void setMetadataHandler(MetadataHandler metadataHandler) {
			this.metadataHandler = metadataHandler;
		}

		public ProtectedResourceMetadataHandler getProtectedResourceMetadataHandler() {
			return protectedResourceMetadataHandler;
		}

		public void setProtectedResourceMetadataHandler(
				ProtectedResourceMetadataHandler protectedResourceMetadataHandler) {
			this.protectedResourceMetadataHandler = protectedResourceMetadataHandler;
		}

		public AuthorizationHandler getAuthorizationHandler() {
			return authorizationHandler;
		}

		public void setAuthorizationHandler(AuthorizationHandler authorizationHandler) {
			this.authorizationHandler = authorizationHandler;
		}

		public TokenHandler getTokenHandler() {
			return tokenHandler;
		}

		public void setTokenHandler(TokenHandler tokenHandler) {
			this.tokenHandler = tokenHandler;
		}

		public RegistrationHandler getRegistrationHandler() {
			return registrationHandler;
		}

		public void setRegistrationHandler(RegistrationHandler registrationHandler) {
			this.registrationHandler = registrationHandler;
		}

		public RevocationHandler getRevocationHandler() {
			return revocationHandler;
		}

		public void setRevocationHandler(RevocationHandler revocationHandler) {
			this.revocationHandler = revocationHandler;
		}

	}

}

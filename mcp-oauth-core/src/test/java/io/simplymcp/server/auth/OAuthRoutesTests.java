/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth;

import java.net.URI;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.simplymcp.auth.OAuthMetadata;
import io.simplymcp.auth.ProtectedResourceMetadata;
import io.simplymcp.server.auth.OAuthRoutes.OAuthHandlers;
import io.simplymcp.server.auth.settings.ClientRegistrationOptions;
import io.simplymcp.server.auth.settings.RevocationOptions;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class OAuthRoutesTests {

	private static final URI ISSUER = URI.create("https://auth.example.com");

	@Test
	void metadataAdvertisesEndpointsAndCapabilities() {
		ClientRegistrationOptions registration = new ClientRegistrationOptions();
		registration.setEnabled(true);

		OAuthMetadata metadata = OAuthRoutes.buildMetadata(ISSUER, URI.create("https://docs.example.com"),
				registration, new RevocationOptions(), List.of("read", "write"));

		assertThat(metadata.getIssuer()).isEqualTo(ISSUER);
		assertThat(metadata.getAuthorizationEndpoint()).isEqualTo(URI.create("https://auth.example.com/oauth/authorize"));
		assertThat(metadata.getTokenEndpoint()).isEqualTo(URI.create("https://auth.example.com/oauth/token"));
		assertThat(metadata.getRevocationEndpoint()).isEqualTo(URI.create("https://auth.example.com/oauth/revoke"));
		assertThat(metadata.getRegistrationEndpoint()).isEqualTo(URI.create("https://auth.example.com/oauth/register"));
		assertThat(metadata.getResponseTypesSupported()).containsExactly("code");
		assertThat(metadata.getGrantTypesSupported()).containsExactly("authorization_code", "refresh_token");
		assertThat(metadata.getCodeChallengeMethodsSupported()).containsExactly("S256");
		assertThat(metadata.getTokenEndpointAuthMethodsSupported()).contains("client_secret_post",
				"client_secret_basic");
		assertThat(metadata.getScopesSupported()).containsExactly("read", "write");
		assertThat(metadata.getServiceDocumentation()).isEqualTo(URI.create("https://docs.example.com"));
	}

	@Test
	void disabledEndpointsAreNotAdvertised() {
		RevocationOptions revocation = new RevocationOptions();
		revocation.setEnabled(false);

		OAuthMetadata metadata = OAuthRoutes.buildMetadata(ISSUER, null, new ClientRegistrationOptions(), revocation,
				null);

		assertThat(metadata.getRegistrationEndpoint()).isNull();
		assertThat(metadata.getRevocationEndpoint()).isNull();
		assertThat(metadata.getRevocationEndpointAuthMethodsSupported()).isNull();
	}

	@Test
	void insecureIssuerIsRejected() {
		assertThatThrownBy(() -> OAuthRoutes.buildMetadata(URI.create("http://auth.example.com"), null,
				new ClientRegistrationOptions(), new RevocationOptions(), null))
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void protectedResourceMetadataPointsAtIssuer() {
		ProtectedResourceMetadata metadata = OAuthRoutes.buildProtectedResourceMetadata(
				URI.create("https://mcp.example.com"), ISSUER, List.of("read"), null);

		assertThat(metadata.getResource()).isEqualTo(URI.create("https://mcp.example.com"));
		assertThat(metadata.getAuthorizationServers()).containsExactly(ISSUER);
		assertThat(metadata.getBearerMethodsSupported()).containsExactly("header");
	}

	@Test
	void optionalHandlersFollowOptions() {
		OAuthProvider provider = mock(OAuthProvider.class);
		ClientRegistrationOptions registration = new ClientRegistrationOptions();
		RevocationOptions revocation = new RevocationOptions();
		OAuthMetadata metadata = OAuthRoutes.buildMetadata(ISSUER, null, registration, revocation, null);

		OAuthHandlers handlers = OAuthRoutes.createHandlers(provider, metadata, null, registration, revocation);

		assertThat(handlers.getMetadataHandler().handle().join()).isSameAs(metadata);
		assertThat(handlers.getAuthorizationHandler()).isNotNull();
		assertThat(handlers.getTokenHandler()).isNotNull();
		assertThat(handlers.getRevocationHandler()).isNotNull();
		assertThat(handlers.getRegistrationHandler()).isNull();
		assertThat(handlers.getProtectedResourceMetadataHandler()).isNull();
	}

}

/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.middleware;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletionException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.simplymcp.auth.AuthInfo;
import io.simplymcp.auth.exception.OAuthErrorCode;
import io.simplymcp.server.auth.OAuthProvider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BearerAuthenticatorTests {

	private OAuthProvider provider;

	@BeforeEach
	void setUp() {
		provider = mock(OAuthProvider.class);
		when(provider.verifyAccessToken("good"))
			.thenReturn(new AuthInfo("good", "c1", Set.of("read"), 1_735_693_200L));
	}

	@Test
	void acceptsValidBearerToken() {
		AuthInfo info = new BearerAuthenticator(provider).authenticate("Bearer good").join();

		assertThat(info.getClientId()).isEqualTo("c1");
	}

	@Test
	void schemeIsCaseInsensitive() {
		assertThat(new BearerAuthenticator(provider).authenticate("bearer good").join().getToken()).isEqualTo("good");
	}

	@Test
	void missingOrMalformedHeaderCarriesNoErrorCode() {
		BearerAuthenticator authenticator = new BearerAuthenticator(provider);

		for (String header : new String[] { null, "", "Basic abc", "Bearer ", "Bearer" }) {
			AuthenticationException ex = failure(authenticator, header);
			assertThat(ex.getStatus()).isEqualTo(401);
			assertThat(ex.getError()).isNull();
			assertThat(ex.toWwwAuthenticateHeader(null)).isEqualTo("Bearer");
		}
		verify(provider, never()).verifyAccessToken(null);
	}

	@Test
	void unknownTokenIsInvalidToken() {
		AuthenticationException ex = failure(new BearerAuthenticator(provider), "Bearer bad");

		assertThat(ex.getStatus()).isEqualTo(401);
		assertThat(ex.getError()).isEqualTo(OAuthErrorCode.INVALID_TOKEN);
		assertThat(ex.toWwwAuthenticateHeader("https://rs/.well-known/oauth-protected-resource"))
			.startsWith("Bearer error=\"invalid_token\"")
			.contains("resource_metadata=\"https://rs/.well-known/oauth-protected-resource\"");
	}

	@Test
	void missingRequiredScopeIsInsufficientScope() {
		AuthenticationException ex = failure(new BearerAuthenticator(provider, List.of("read", "write")),
				"Bearer good");

		assertThat(ex.getStatus()).isEqualTo(403);
		assertThat(ex.getError()).isEqualTo(OAuthErrorCode.INSUFFICIENT_SCOPE);
		assertThat(ex.toWwwAuthenticateHeader(null)).contains("error=\"insufficient_scope\"")
			.contains("scope=\"write\"");
	}

	@Test
	void presentRequiredScopePasses() {
		assertThat(new BearerAuthenticator(provider, List.of("read")).authenticate("Bearer good").join())
			.isNotNull();
	}

	private static AuthenticationException failure(BearerAuthenticator authenticator, String header) {
		Throwable thrown = null;
		try {
			authenticator.authenticate(header).join();
		}
		catch (CompletionException ex) {
			thrown = ex.getCause();
		}
		assertThat(thrown).isInstanceOf(AuthenticationException.class);
		return (AuthenticationException) thrown;
	}

}

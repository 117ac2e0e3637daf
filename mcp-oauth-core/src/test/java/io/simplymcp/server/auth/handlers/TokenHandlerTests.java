/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.handlers;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.simplymcp.auth.AuthorizationCode;
import io.simplymcp.auth.AuthorizationParams;
import io.simplymcp.auth.OAuthToken;
import io.simplymcp.auth.exception.OAuthErrorCode;
import io.simplymcp.auth.exception.TokenException;
import io.simplymcp.server.auth.OAuthProvider;
import io.simplymcp.server.auth.audit.AuditLogger;
import io.simplymcp.server.auth.middleware.ClientAuthenticator;
import io.simplymcp.server.auth.settings.ClientSettings;
import io.simplymcp.server.auth.settings.TokenSettings;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;

class TokenHandlerTests {

	private static final String VERIFIER = "dBjftJeZ4CVP-mB92K27uhbUJU1p1r_wW1gFWFOEjXk";

	private static final String CHALLENGE = "E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM";

	private OAuthProvider provider;

	private TokenHandler handler;

	@BeforeEach
	void setUp() {
		provider = OAuthProvider.builder()
			.tokenSettings(TokenSettings.builder().bcryptStrength(4).build())
			.client(new ClientSettings("c1", "s1", List.of("https://app/cb"), List.of("read", "write")))
			.auditLogger(AuditLogger.noop())
			.sweepExpiredEntries(false)
			.build();
		handler = new TokenHandler(provider, new ClientAuthenticator());
	}

	@AfterEach
	void tearDown() {
		provider.close();
	}

	@Test
	void exchangesCodeForBearerTokens() throws Exception {
		OAuthToken token = handler.handle(codeGrant(issueCode()), null).join();

		assertThat(token.getTokenType()).isEqualTo("Bearer");
		assertThat(token.getAccessToken()).isNotBlank();
		assertThat(token.getRefreshToken()).isNotBlank();
		assertThat(token.getExpiresIn()).isEqualTo(3600L);
		assertThat(token.getScope()).isEqualTo("read");
	}

	@Test
	void refreshGrantRotatesAndNarrowsScope() throws Exception {
		AuthorizationParams params = authorizationParams();
		params.setScopes(List.of("read", "write"));
		OAuthToken first = handler.handle(codeGrant(provider.handleAuthorize(params).getCode()), null).join();

		Map<String, String> refresh = new HashMap<>();
		refresh.put("grant_type", "refresh_token");
		refresh.put("refresh_token", first.getRefreshToken());
		refresh.put("scope", "write");
		refresh.put("client_id", "c1");
		refresh.put("client_secret", "s1");

		OAuthToken second = handler.handle(refresh, null).join();
		assertThat(second.getScope()).isEqualTo("write");
		assertThat(second.getRefreshToken()).isNotEqualTo(first.getRefreshToken());

		assertError(handler.handle(refresh, null), OAuthErrorCode.INVALID_GRANT);
	}

	@Test
	void missingFieldsAreInvalidRequest() throws Exception {
		Map<String, String> params = codeGrant(issueCode());
		params.remove("code_verifier");
		assertError(handler.handle(params, null), OAuthErrorCode.INVALID_REQUEST);

		Map<String, String> noGrantType = codeGrant("x");
		noGrantType.remove("grant_type");
		assertError(handler.handle(noGrantType, null), OAuthErrorCode.INVALID_REQUEST);
	}

	@Test
	void otherGrantTypesAreUnsupported() {
		Map<String, String> params = codeGrant("x");
		params.put("grant_type", "client_credentials");

		assertError(handler.handle(params, null), OAuthErrorCode.UNSUPPORTED_GRANT_TYPE);
	}

	@Test
	void wrongSecretIsInvalidClient() throws Exception {
		Map<String, String> params = codeGrant(issueCode());
		params.put("client_secret", "nope");

		assertError(handler.handle(params, null), OAuthErrorCode.INVALID_CLIENT);
	}

	private String issueCode() throws Exception {
		return provider.handleAuthorize(authorizationParams()).getCode();
	}

	private static AuthorizationParams authorizationParams() {
		AuthorizationParams params = new AuthorizationParams();
		params.setClientId("c1");
		params.setRedirectUri("https://app/cb");
		params.setResponseType("code");
		params.setScopes(List.of("read"));
		params.setCodeChallenge(CHALLENGE);
		params.setCodeChallengeMethod(AuthorizationCode.CODE_CHALLENGE_METHOD_S256);
		return params;
	}

	private static Map<String, String> codeGrant(String code) {
		Map<String, String> params = new HashMap<>();
		params.put("grant_type", "authorization_code");
		params.put("code", code);
		params.put("code_verifier", VERIFIER);
		params.put("redirect_uri", "https://app/cb");
		params.put("client_id", "c1");
		params.put("client_secret", "s1");
		return params;
	}

	private static void assertError(CompletableFuture<?> future, OAuthErrorCode error) {
		try {
			future.join();
			fail("Expected " + error.getValue());
		}
		catch (CompletionException ex) {
			assertThat(ex.getCause()).isInstanceOf(TokenException.class);
			assertThat(((TokenException) ex.getCause()).getError()).isEqualTo(error);
		}
	}

}

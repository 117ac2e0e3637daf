/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.transport;

import java.io.BufferedReader;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.net.URI;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.simplymcp.auth.OAuthToken;
import io.simplymcp.auth.exception.AuthorizeException;
import io.simplymcp.auth.exception.OAuthErrorCode;
import io.simplymcp.auth.exception.TokenException;
import io.simplymcp.server.auth.OAuthRoutes;
import io.simplymcp.server.auth.OAuthRoutes.OAuthHandlers;
import io.simplymcp.server.auth.handlers.AuthorizationHandler;
import io.simplymcp.server.auth.handlers.AuthorizationResponse;
import io.simplymcp.server.auth.handlers.MetadataHandler;
import io.simplymcp.server.auth.handlers.RevocationHandler;
import io.simplymcp.server.auth.handlers.TokenHandler;
import io.simplymcp.server.auth.settings.ClientRegistrationOptions;
import io.simplymcp.server.auth.settings.RevocationOptions;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OAuthRouterServletTests {

	private final ObjectMapper objectMapper = new ObjectMapper();

	private TokenHandler tokenHandler;

	private AuthorizationHandler authorizationHandler;

	private RevocationHandler revocationHandler;

	private OAuthRouterServlet servlet;

	private HttpServletRequest request;

	private HttpServletResponse response;

	private StringWriter body;

	@BeforeEach
	void setUp() throws Exception {
		tokenHandler = mock(TokenHandler.class);
		authorizationHandler = mock(AuthorizationHandler.class);
		revocationHandler = mock(RevocationHandler.class);

		OAuthHandlers handlers = new OAuthHandlers();
		handlers.setMetadataHandler(new MetadataHandler(OAuthRoutes.buildMetadata(
				URI.create("https://auth.example.com"), null, new ClientRegistrationOptions(), new RevocationOptions(),
				null)));
		handlers.setTokenHandler(tokenHandler);
		handlers.setAuthorizationHandler(authorizationHandler);
		handlers.setRevocationHandler(revocationHandler);
		servlet = new OAuthRouterServlet(objectMapper, handlers);

		request = mock(HttpServletRequest.class);
		response = mock(HttpServletResponse.class);
		body = new StringWriter();
		when(response.getWriter()).thenReturn(new PrintWriter(body));
		when(request.getContextPath()).thenReturn("");
		when(request.getParameterMap()).thenReturn(Map.of());
	}

	@Test
	void servesAuthorizationServerMetadata() throws Exception {
		when(request.getRequestURI()).thenReturn(OAuthRoutes.METADATA_PATH);

		servlet.doGet(request, response);

		verify(response).setStatus(200);
		JsonNode json = objectMapper.readTree(body.toString());
		assertThat(json.get("issuer").asText()).isEqualTo("https://auth.example.com");
		assertThat(json.get("token_endpoint").asText()).isEqualTo("https://auth.example.com/oauth/token");
		assertThat(json.has("registration_endpoint")).isFalse();
	}

	@Test
	void contextPathIsStrippedBeforeRouting() throws Exception {
		when(request.getContextPath()).thenReturn("/auth");
		when(request.getRequestURI()).thenReturn("/auth" + OAuthRoutes.METADATA_PATH);

		servlet.doGet(request, response);

		verify(response).setStatus(200);
	}

	@Test
	void authorizeRedirects() throws Exception {
		when(request.getRequestURI()).thenReturn(OAuthRoutes.AUTHORIZATION_PATH);
		when(authorizationHandler.handle(anyMap())).thenReturn(
				CompletableFuture.completedFuture(AuthorizationResponse.success("https://app/cb?code=abc&state=s")));

		servlet.doGet(request, response);

		verify(response).setStatus(302);
		verify(response).setHeader("Location", "https://app/cb?code=abc&state=s");
	}

	@Test
	void untrustedAuthorizeRequestIsAnsweredDirectly() throws Exception {
		when(request.getRequestURI()).thenReturn(OAuthRoutes.AUTHORIZATION_PATH);
		when(authorizationHandler.handle(anyMap())).thenReturn(CompletableFuture
			.failedFuture(AuthorizeException.direct(OAuthErrorCode.INVALID_REQUEST, "Invalid redirect_uri")));

		servlet.doGet(request, response);

		verify(response).setStatus(400);
		verify(response, never()).setHeader(eq("Location"), any());
		assertThat(body.toString()).contains("\"error\":\"invalid_request\"");
	}

	@Test
	void tokenSuccessIsNotCacheable() throws Exception {
		when(request.getRequestURI()).thenReturn(OAuthRoutes.TOKEN_PATH);
		when(tokenHandler.handle(anyMap(), any()))
			.thenReturn(CompletableFuture.completedFuture(new OAuthToken("at", 3600L, "read", "rt")));

		servlet.doPost(request, response);

		verify(response).setStatus(200);
		verify(response).setHeader("Cache-Control", "no-store");
		assertThat(objectMapper.readTree(body.toString()).get("token_type").asText()).isEqualTo("Bearer");
	}

	@Test
	void tokenRequestAcceptsJsonBody() throws Exception {
		when(request.getRequestURI()).thenReturn(OAuthRoutes.TOKEN_PATH);
		when(request.getContentType()).thenReturn("application/json; charset=UTF-8");
		when(request.getReader()).thenReturn(new BufferedReader(
				new StringReader("{\"grant_type\":\"refresh_token\",\"refresh_token\":\"rt\",\"client_id\":\"c1\"}")));
		when(tokenHandler.handle(eq(Map.of("grant_type", "refresh_token", "refresh_token", "rt", "client_id", "c1")),
				any()))
			.thenReturn(CompletableFuture.completedFuture(new OAuthToken("at", 3600L, "read", "rt2")));

		servlet.doPost(request, response);

		verify(response).setStatus(200);
	}

	@Test
	void invalidClientGetsBasicChallenge() throws Exception {
		when(request.getRequestURI()).thenReturn(OAuthRoutes.TOKEN_PATH);
		when(tokenHandler.handle(anyMap(), any()))
			.thenReturn(CompletableFuture.failedFuture(TokenException.invalidClient()));

		servlet.doPost(request, response);

		verify(response).setStatus(401);
		verify(response).setHeader("WWW-Authenticate", "Basic");
		assertThat(body.toString()).contains("\"error\":\"invalid_client\"");
	}

	@Test
	void invalidGrantIsBadRequest() throws Exception {
		when(request.getRequestURI()).thenReturn(OAuthRoutes.TOKEN_PATH);
		when(tokenHandler.handle(anyMap(), any()))
			.thenReturn(CompletableFuture.failedFuture(TokenException.invalidGrant("Invalid authorization code")));

		servlet.doPost(request, response);

		verify(response).setStatus(400);
		assertThat(body.toString()).contains("\"error\":\"invalid_grant\"");
	}

	@Test
	void unexpectedFailureIsGenericServerError() throws Exception {
		when(request.getRequestURI()).thenReturn(OAuthRoutes.TOKEN_PATH);
		when(tokenHandler.handle(anyMap(), any()))
			.thenReturn(CompletableFuture.failedFuture(new IllegalStateException("database password is hunter2")));

		servlet.doPost(request, response);

		verify(response).setStatus(500);
		assertThat(body.toString()).contains("server_error").doesNotContain("hunter2");
	}

	@Test
	void revocationAnswersOk() throws Exception {
		when(request.getRequestURI()).thenReturn(OAuthRoutes.REVOCATION_PATH);
		when(revocationHandler.handle(anyMap(), any())).thenReturn(CompletableFuture.completedFuture(null));

		servlet.doPost(request, response);

		verify(response).setStatus(200);
	}

	@Test
	void disabledRegistrationIsNotRouted() throws Exception {
		when(request.getRequestURI()).thenReturn(OAuthRoutes.REGISTRATION_PATH);

		servlet.doPost(request, response);

		verify(response).sendError(404);
	}

	@Test
	void unknownPathIsNotFound() throws Exception {
		when(request.getRequestURI()).thenReturn("/elsewhere");

		servlet.doGet(request, response);

		verify(response).sendError(404);
	}

}

/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.transport;

import java.io.IOException;
import java.net.URI;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.simplymcp.auth.OAuthClientInformation;
import io.simplymcp.auth.OAuthClientMetadata;
import io.simplymcp.auth.OAuthErrorResponse;
import io.simplymcp.auth.OAuthMetadata;
import io.simplymcp.auth.OAuthToken;
import io.simplymcp.auth.ProtectedResourceMetadata;
import io.simplymcp.auth.exception.AuthorizeException;
import io.simplymcp.auth.exception.OAuthErrorCode;
import io.simplymcp.auth.exception.OAuthException;
import io.simplymcp.server.auth.OAuthProvider;
import io.simplymcp.server.auth.OAuthRoutes;
import io.simplymcp.server.auth.OAuthRoutes.OAuthHandlers;
import io.simplymcp.server.auth.handlers.AuthorizationResponse;
import io.simplymcp.server.auth.settings.ClientRegistrationOptions;
import io.simplymcp.server.auth.settings.RevocationOptions;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Servlet exposing the OAuth endpoints: authorization server metadata, protected
 * resource metadata, authorization, token, revocation and dynamic client
 * registration. Protocol errors are answered with RFC 6749 shaped bodies, anything
 * unexpected with a generic {@code server_error}.
 * <p>
 * Mount it at the root of the context ({@code /*}) so that the well-known paths
 * resolve.
 */
public class OAuthRouterServlet extends HttpServlet {

	private static final Logger logger = LoggerFactory.getLogger(OAuthRouterServlet.class);

	private static final String APPLICATION_JSON = "application/json";

	private static final String UTF_8 = "UTF-8";

	private static final String AUTHORIZATION_HEADER = "Authorization";

	private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {
	};

	private final ObjectMapper objectMapper;

	private final OAuthHandlers handlers;

	/**
	 * Creates a new OAuthRouterServlet.
	 * @param objectMapper The JSON object mapper
	 * @param handlers The route handlers, see {@link OAuthRoutes#createHandlers}
	 */
	public OAuthRouterServlet(ObjectMapper objectMapper, OAuthHandlers handlers) {
		this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
		this.handlers = Objects.requireNonNull(handlers, "handlers must not be null");
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	protected void doGet(HttpServletRequest request, HttpServletResponse response)
			throws ServletException, IOException {
		String path = resolvePath(request);
		logger.debug("Handling OAuth GET request: {}", path);
		try {
			if (OAuthRoutes.METADATA_PATH.equals(path)) {
				OAuthMetadata metadata = handlers.getMetadataHandler().handle().join();
				writeJson(response, HttpServletResponse.SC_OK, metadata);
			}
			else if (OAuthRoutes.PROTECTED_RESOURCE_METADATA_PATH.equals(path)
					&& handlers.getProtectedResourceMetadataHandler() != null) {
				ProtectedResourceMetadata metadata = handlers.getProtectedResourceMetadataHandler().handle().join();
				writeJson(response, HttpServletResponse.SC_OK, metadata);
			}
			else if (OAuthRoutes.AUTHORIZATION_PATH.equals(path)) {
				handleAuthorizeRequest(request, response);
			}
			else {
				response.sendError(HttpServletResponse.SC_NOT_FOUND);
			}
		}
		catch (RuntimeException ex) {
			sendServerError(response, path, ex);
		}
	}

	@Override
	protected void doPost(HttpServletRequest request, HttpServletResponse response)
			throws ServletException, IOException {
		String path = resolvePath(request);
		logger.debug("Handling OAuth POST request: {}", path);
		try {
			if (OAuthRoutes.TOKEN_PATH.equals(path)) {
				handleTokenRequest(request, response);
			}
			else if (OAuthRoutes.REVOCATION_PATH.equals(path) && handlers.getRevocationHandler() != null) {
				handleRevokeRequest(request, response);
			}
			else if (OAuthRoutes.REGISTRATION_PATH.equals(path) && handlers.getRegistrationHandler() != null) {
				handleRegisterRequest(request, response);
			}
			else if (OAuthRoutes.AUTHORIZATION_PATH.equals(path)) {
				handleAuthorizeRequest(request, response);
			}
			else {
				response.sendError(HttpServletResponse.SC_NOT_FOUND);
			}
		}
		catch (RuntimeException ex) {
			sendServerError(response, path, ex);
		}
	}

	private void handleAuthorizeRequest(HttpServletRequest request, HttpServletResponse response)
			throws IOException {
		try {
			AuthorizationResponse result = handlers.getAuthorizationHandler().handle(formParameters(request)).join();
			response.setHeader("Location", result.getRedirectUrl());
			response.setHeader("Cache-Control", "no-store");
			response.setStatus(HttpServletResponse.SC_FOUND);
		}
		catch (CompletionException ex) {
			// the redirect target is not trusted, so the error goes to the user agent
			AuthorizeException authorizeException = unwrap(ex, AuthorizeException.class);
			sendOAuthError(response, HttpServletResponse.SC_BAD_REQUEST, authorizeException);
		}
	}

	private void handleTokenRequest(HttpServletRequest request, HttpServletResponse response) throws IOException {
		Map<String, String> params;
		try {
			params = requestParameters(request);
		}
		catch (JsonProcessingException ex) {
			sendOAuthError(response, HttpServletResponse.SC_BAD_REQUEST,
					new OAuthErrorResponse(OAuthErrorCode.INVALID_REQUEST.getValue(), "Malformed request body"));
			return;
		}

		response.setHeader("Cache-Control", "no-store");
		response.setHeader("Pragma", "no-cache");
		try {
			OAuthToken token = handlers.getTokenHandler()
				.handle(params, request.getHeader(AUTHORIZATION_HEADER))
				.join();
			writeJson(response, HttpServletResponse.SC_OK, token);
		}
		catch (CompletionException ex) {
			OAuthException tokenException = unwrap(ex, OAuthException.class);
			if (tokenException.getError() == OAuthErrorCode.INVALID_CLIENT) {
				response.setHeader("WWW-Authenticate", "Basic");
			}
			sendOAuthError(response, tokenException.getError().getHttpStatus(), tokenException);
		}
	}

	private void handleRevokeRequest(HttpServletRequest request, HttpServletResponse response) throws IOException {
		Map<String, String> params;
		try {
			params = requestParameters(request);
		}
		catch (JsonProcessingException ex) {
			sendOAuthError(response, HttpServletResponse.SC_BAD_REQUEST,
					new OAuthErrorResponse(OAuthErrorCode.INVALID_REQUEST.getValue(), "Malformed request body"));
			return;
		}

		try {
			handlers.getRevocationHandler().handle(params, request.getHeader(AUTHORIZATION_HEADER)).join();
			response.setHeader("Cache-Control", "no-store");
			response.setStatus(HttpServletResponse.SC_OK);
		}
		catch (CompletionException ex) {
			OAuthException revocationException = unwrap(ex, OAuthException.class);
			sendOAuthError(response, HttpServletResponse.SC_BAD_REQUEST, revocationException);
		}
	}

	private void handleRegisterRequest(HttpServletRequest request, HttpServletResponse response)
			throws IOException {
		OAuthClientMetadata clientMetadata;
		try {
			clientMetadata = objectMapper.readValue(request.getReader(), OAuthClientMetadata.class);
		}
		catch (JsonProcessingException ex) {
			sendOAuthError(response, HttpServletResponse.SC_BAD_REQUEST, new OAuthErrorResponse(
					OAuthErrorCode.INVALID_CLIENT_METADATA.getValue(), "Malformed client metadata"));
			return;
		}

		try {
			OAuthClientInformation clientInfo = handlers.getRegistrationHandler().handle(clientMetadata).join();
			response.setHeader("Cache-Control", "no-store");
			writeJson(response, HttpServletResponse.SC_CREATED, clientInfo);
		}
		catch (CompletionException ex) {
			OAuthException registrationException = unwrap(ex, OAuthException.class);
			sendOAuthError(response, HttpServletResponse.SC_BAD_REQUEST, registrationException);
		}
	}

	/**
	 * Returns the cause of a failed handler future if it has the expected type, and
	 * rethrows anything else so that it ends up as a server error.
	 */
	private static <T extends Throwable> T unwrap(CompletionException ex, Class<T> expected) {
		Throwable cause = ex.getCause();
		if (expected.isInstance(cause)) {
			return expected.cast(cause);
		}
		throw ex;
	}

	private Map<String, String> requestParameters(HttpServletRequest request) throws IOException {
		String contentType = request.getContentType();
		if (contentType != null && contentType.toLowerCase(Locale.ROOT).startsWith(APPLICATION_JSON)) {
			Map<String, Object> body = objectMapper.readValue(request.getReader(), JSON_OBJECT);
			Map<String, String> params = new HashMap<>();
			if (body != null) {
				body.forEach((key, value) -> {
					if (value != null) {
						params.put(key, value.toString());
					}
				});
			}
			return params;
		}
		return formParameters(request);
	}

	private static Map<String, String> formParameters(HttpServletRequest request) {
		Map<String, String> params = new HashMap<>();
		request.getParameterMap().forEach((key, values) -> {
			if (values != null && values.length > 0) {
				params.put(key, values[0]);
			}
		});
		return params;
	}

	private static String resolvePath(HttpServletRequest request) {
		String uri = request.getRequestURI();
		String contextPath = request.getContextPath();
		if (uri == null) {
			return "";
		}
		if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
			return uri.substring(contextPath.length());
		}
		return uri;
	}

	private void sendOAuthError(HttpServletResponse response, int status, OAuthException ex) throws IOException {
		logger.debug("OAuth request rejected: {}", ex.getMessage());
		sendOAuthError(response, status, OAuthErrorResponse.from(ex));
	}

	private void sendOAuthError(HttpServletResponse response, int status, OAuthErrorResponse error)
			throws IOException {
		writeJson(response, status, error);
	}

	private void sendServerError(HttpServletResponse response, String path, RuntimeException ex)
			throws IOException {
		logger.error("Unexpected error while handling OAuth request to {}", path, ex);
		if (!response.isCommitted()) {
			response.resetBuffer();
			writeJson(response, HttpServletResponse.SC_INTERNAL_SERVER_ERROR,
					new OAuthErrorResponse(OAuthErrorCode.SERVER_ERROR.getValue(), "Internal server error"));
		}
	}

	private void writeJson(HttpServletResponse response, int status, Object body) throws IOException {
		response.setStatus(status);
		response.setContentType(APPLICATION_JSON);
		response.setCharacterEncoding(UTF_8);
		response.getWriter().write(objectMapper.writeValueAsString(body));
		response.getWriter().flush();
	}

	/**
	 * Builder for creating instances of {@link OAuthRouterServlet}.
	 */
	public static class Builder {

		private ObjectMapper objectMapper = new ObjectMapper();

		private OAuthProvider provider;

		private URI issuerUrl;

		private URI serviceDocumentationUrl;

		private URI resourceUrl;

		private URI resourceDocumentationUrl;

		private List<String> scopesSupported;

		private ClientRegistrationOptions registrationOptions = new ClientRegistrationOptions();

		private RevocationOptions revocationOptions = new RevocationOptions();

		public Builder objectMapper(ObjectMapper objectMapper) {
			this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
			return this;
		}

		public Builder provider(OAuthProvider provider) {
			this.provider = provider;
			return this;
		}

		/**
		 * Sets the issuer URL; endpoint URLs in the metadata are derived from it.
		 * @param issuerUrl https URL, or http for localhost
		 * @return this builder
		 */
		public Builder issuerUrl(URI issuerUrl) {
			this.issuerUrl = issuerUrl;
			return this;
		}

		public Builder serviceDocumentationUrl(URI serviceDocumentationUrl) {
			this.serviceDocumentationUrl = serviceDocumentationUrl;
			return this;
		}

		/**
		 * Sets the URL of the protected resource. When set, the router also serves
		 * protected resource metadata.
		 * @param resourceUrl the resource URL
		 * @return this builder
		 */
		public Builder resourceUrl(URI resourceUrl) {
			this.resourceUrl = resourceUrl;
			return this;
		}

		public Builder resourceDocumentationUrl(URI resourceDocumentationUrl) {
			this.resourceDocumentationUrl = resourceDocumentationUrl;
			return this;
		}

		public Builder scopesSupported(List<String> scopesSupported) {
			this.scopesSupported = scopesSupported;
			return this;
		}

		public Builder registrationOptions(ClientRegistrationOptions registrationOptions) {
			this.registrationOptions = Objects.requireNonNull(registrationOptions,
					"registrationOptions must not be null");
			return this;
		}

		public Builder revocationOptions(RevocationOptions revocationOptions) {
			this.revocationOptions = Objects.requireNonNull(revocationOptions, "revocationOptions must not be null");
			return this;
		}

		public OAuthRouterServlet build() {
			Objects.requireNonNull(provider, "provider must be set");
			Objects.requireNonNull(issuerUrl, "issuerUrl must be set");

			OAuthMetadata metadata = OAuthRoutes.buildMetadata(issuerUrl, serviceDocumentationUrl,
					registrationOptions, revocationOptions, scopesSupported);
			ProtectedResourceMetadata resourceMetadata = resourceUrl != null ? OAuthRoutes
				.buildProtectedResourceMetadata(resourceUrl, issuerUrl, scopesSupported, resourceDocumentationUrl)
					: null;
			OAuthHandlers handlers = OAuthRoutes.createHandlers(provider, metadata, resourceMetadata,
					registrationOptions, revocationOptions);

			logger.info("OAuth router initialized for issuer {}", issuerUrl);
			return new OAuthRouterServlet(objectMapper, handlers);
		}

	}

}

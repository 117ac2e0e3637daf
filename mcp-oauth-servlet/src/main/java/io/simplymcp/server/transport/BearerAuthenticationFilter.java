/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.transport;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.CompletionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.simplymcp.auth.AuthInfo;
import io.simplymcp.auth.OAuthErrorResponse;
import io.simplymcp.server.auth.middleware.AuthContext;
import io.simplymcp.server.auth.middleware.AuthenticationException;
import io.simplymcp.server.auth.middleware.BearerAuthenticator;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Servlet filter guarding protected resources with OAuth bearer tokens. Requests
 * without a valid token are answered with 401 (or 403 when a required scope is
 * missing) and an RFC 6750 {@code WWW-Authenticate} challenge; accepted requests see
 * their {@link AuthContext} as request attribute and as thread-local for the
 * duration of the chain.
 */
public class BearerAuthenticationFilter implements Filter {

	private static final Logger logger = LoggerFactory.getLogger(BearerAuthenticationFilter.class);

	private final BearerAuthenticator authenticator;

	private final String resourceMetadataUrl;

	private final ObjectMapper objectMapper;

	public BearerAuthenticationFilter(BearerAuthenticator authenticator) {
		this(authenticator, null, new ObjectMapper());
	}

	/**
	 * @param authenticator the bearer authenticator
	 * @param resourceMetadataUrl URL of the protected resource metadata, advertised in
	 * challenges; may be null
	 * @param objectMapper mapper for error bodies
	 */
	public BearerAuthenticationFilter(BearerAuthenticator authenticator, String resourceMetadataUrl,
			ObjectMapper objectMapper) {
		this.authenticator = Objects.requireNonNull(authenticator, "authenticator must not be null");
		this.resourceMetadataUrl = resourceMetadataUrl;
		this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
	}

	@Override
	public void doFilter(ServletRequest servletRequest, ServletResponse servletResponse, FilterChain chain)
			throws IOException, ServletException {
		HttpServletRequest request = (HttpServletRequest) servletRequest;
		HttpServletResponse response = (HttpServletResponse) servletResponse;

		AuthInfo authInfo;
		try {
			authInfo = authenticator.authenticate(request.getHeader("Authorization")).join();
		}
		catch (CompletionException ex) {
			if (!(ex.getCause() instanceof AuthenticationException)) {
				throw new ServletException("Bearer authentication failed unexpectedly", ex.getCause());
			}
			sendChallenge(response, (AuthenticationException) ex.getCause());
			return;
		}

		AuthContext authContext = new AuthContext(authInfo);
		request.setAttribute(AuthContext.REQUEST_ATTRIBUTE, authContext);
		AuthContext.setCurrent(authContext);
		try {
			chain.doFilter(request, response);
		}
		finally {
			AuthContext.clearCurrent();
		}
	}

	private void sendChallenge(HttpServletResponse response, AuthenticationException ex) throws IOException {
		logger.debug("Rejecting request: {}", ex.getMessage());
		response.setStatus(ex.getStatus());
		response.setHeader("WWW-Authenticate", ex.toWwwAuthenticateHeader(resourceMetadataUrl));
		if (ex.getError() != null) {
			response.setContentType("application/json");
			response.setCharacterEncoding("UTF-8");
			response.getWriter()
				.write(objectMapper.writeValueAsString(new OAuthErrorResponse(ex.getError().getValue(), ex.getMessage())));
			response.getWriter().flush();
		}
	}

}

/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.simplymcp.auth.AuthInfo;
import io.simplymcp.auth.AuthorizationCode;
import io.simplymcp.auth.AuthorizationParams;
import io.simplymcp.auth.OAuthClientInformation;
import io.simplymcp.auth.OAuthClientMetadata;
import io.simplymcp.auth.RegisteredClient;
import io.simplymcp.auth.TokenPair;
import io.simplymcp.auth.exception.AuthorizeException;
import io.simplymcp.auth.exception.DuplicateClientIdException;
import io.simplymcp.auth.exception.OAuthErrorCode;
import io.simplymcp.auth.exception.RegistrationException;
import io.simplymcp.auth.exception.TokenException;
import io.simplymcp.server.auth.audit.AuditEvent;
import io.simplymcp.server.auth.audit.AuditEventType;
import io.simplymcp.server.auth.audit.AuditLogger;
import io.simplymcp.server.auth.audit.Slf4jAuditLogger;
import io.simplymcp.server.auth.settings.ClientRegistrationOptions;
import io.simplymcp.server.auth.settings.ClientSettings;
import io.simplymcp.server.auth.settings.TokenSettings;
import io.simplymcp.server.auth.store.AuthorizationCodeStore;
import io.simplymcp.server.auth.store.ClientRegistry;
import io.simplymcp.server.auth.store.ExpiredEntrySweeper;
import io.simplymcp.server.auth.store.InMemoryAuthorizationCodeStore;
import io.simplymcp.server.auth.store.InMemoryClientRegistry;
import io.simplymcp.server.auth.store.InMemoryTokenStore;
import io.simplymcp.server.auth.store.TokenStore;
import io.simplymcp.server.auth.store.TokenTypeHint;
import io.simplymcp.server.auth.util.ScopeUtils;
import io.simplymcp.server.auth.util.TokenGenerator;
import io.simplymcp.server.auth.util.UriUtils;
import io.simplymcp.util.Utils;

/**
 * OAuth 2.1 authorization server implementing the authorization code grant with PKCE
 * and the refresh token grant on top of a {@link ClientRegistry}, an
 * {@link AuthorizationCodeStore} and a {@link TokenStore}.
 * <p>
 * The provider keeps no state of its own. An authorization code moves from issued to
 * consumed to exchanged; once the code store has consumed it the code is gone for
 * good, even when the exchange fails afterwards (for example on a redirect URI
 * mismatch). The client has to start a new authorization in that case.
 * <p>
 * Refresh tokens always rotate: every successful refresh returns a new refresh token
 * and invalidates the presented one.
 *
 * <pre>{@code
 * OAuthProvider provider = OAuthProvider.builder()
 *     .client(new ClientSettings("my-client", "my-secret",
 *             List.of("http://localhost:3000/callback"), List.of("read", "write")))
 *     .build();
 * }</pre>
 */
public class OAuthProvider implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(OAuthProvider.class);

	public static final String RESPONSE_TYPE_CODE = "code";

	public static final String GRANT_TYPE_AUTHORIZATION_CODE = RegisteredClient.GRANT_TYPE_AUTHORIZATION_CODE;

	public static final String GRANT_TYPE_REFRESH_TOKEN = RegisteredClient.GRANT_TYPE_REFRESH_TOKEN;

	private static final List<String> SUPPORTED_GRANT_TYPES = RegisteredClient.DEFAULT_GRANT_TYPES;

	private static final List<String> SUPPORTED_AUTH_METHODS = List.of("client_secret_post", "client_secret_basic");

	private final ClientRegistry clientRegistry;

	private final AuthorizationCodeStore codeStore;

	private final TokenStore tokenStore;

	private final ClientRegistrationOptions registrationOptions;

	private final AuditLogger auditLogger;

	private final ExpiredEntrySweeper sweeper;

	public OAuthProvider(ClientRegistry clientRegistry, AuthorizationCodeStore codeStore, TokenStore tokenStore,
			ClientRegistrationOptions registrationOptions, AuditLogger auditLogger) {
		this(clientRegistry, codeStore, tokenStore, registrationOptions, auditLogger, null);
	}

	private OAuthProvider(ClientRegistry clientRegistry, AuthorizationCodeStore codeStore, TokenStore tokenStore,
			ClientRegistrationOptions registrationOptions, AuditLogger auditLogger, ExpiredEntrySweeper sweeper) {
		this.clientRegistry = Objects.requireNonNull(clientRegistry, "clientRegistry must not be null");
		this.codeStore = Objects.requireNonNull(codeStore, "codeStore must not be null");
		this.tokenStore = Objects.requireNonNull(tokenStore, "tokenStore must not be null");
		this.registrationOptions = registrationOptions != null ? registrationOptions : new ClientRegistrationOptions();
		this.auditLogger = auditLogger != null ? auditLogger : AuditLogger.noop();
		this.sweeper = sweeper;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Checks that an authorization error may be reported by redirecting to the given
	 * URI, i.e. the client exists and the URI is registered for it.
	 * @param clientId the client id of the request
	 * @param redirectUri the redirect URI of the request
	 * @throws AuthorizeException (not redirectable) if the client is unknown or the URI
	 * is not registered
	 */
	public void validateRedirectTarget(String clientId, String redirectUri) throws AuthorizeException {
		if (!Utils.hasText(clientId)) {
			throw AuthorizeException.direct(OAuthErrorCode.INVALID_REQUEST, "Missing client_id");
		}
		if (clientRegistry.getClient(clientId).isEmpty()) {
			throw AuthorizeException.direct(OAuthErrorCode.INVALID_REQUEST, "Unknown client_id");
		}
		if (!Utils.hasText(redirectUri)) {
			throw AuthorizeException.direct(OAuthErrorCode.INVALID_REQUEST, "Missing redirect_uri");
		}
		if (!clientRegistry.validateRedirectUri(clientId, redirectUri)) {
			throw AuthorizeException.direct(OAuthErrorCode.INVALID_REQUEST, "Invalid redirect_uri");
		}
	}

	/**
	 * Validates an authorization request and issues an authorization code bound to
	 * its PKCE challenge.
	 * @param params the parsed authorization request
	 * @return the issued code
	 * @throws AuthorizeException if the request is rejected; redirectable unless the
	 * client or redirect URI is invalid
	 */
	public AuthorizationCode handleAuthorize(AuthorizationParams params) throws AuthorizeException {
		String clientId = params.getClientId();
		List<String> requestedScopes = params.getScopes() != null ? params.getScopes() : List.of();
		auditLogger.log(AuditEvent.success(AuditEventType.AUTHORIZATION_REQUESTED)
			.clientId(clientId)
			.detail("scopes", requestedScopes)
			.detail("redirectUri", params.getRedirectUri())
			.build());

		try {
			validateRedirectTarget(clientId, params.getRedirectUri());
			validateAuthorizationShape(params);
			if (!clientRegistry.getClient(clientId)
				.map(client -> client.isGrantTypeAllowed(GRANT_TYPE_AUTHORIZATION_CODE))
				.orElse(false)) {
				throw AuthorizeException.redirect(OAuthErrorCode.UNAUTHORIZED_CLIENT,
						"Client is not authorized for the authorization_code grant");
			}
			if (!clientRegistry.validateScopes(clientId, requestedScopes)) {
				throw AuthorizeException.redirect(OAuthErrorCode.INVALID_SCOPE,
						"One or more requested scopes are not allowed");
			}
		}
		catch (AuthorizeException ex) {
			auditLogger.log(AuditEvent.failure(AuditEventType.AUTHORIZATION_DENIED)
				.clientId(clientId)
				.detail("scopes", requestedScopes)
				.detail("error", ex.getError().getValue())
				.detail("reason", ex.getErrorDescription())
				.build());
			throw ex;
		}

		Set<String> scopes = clientRegistry.resolveScopes(clientId, requestedScopes);
		AuthorizationCode code = codeStore.issue(clientId, params.getRedirectUri(), params.getCodeChallenge(), scopes);

		auditLogger.log(AuditEvent.success(AuditEventType.AUTHORIZATION_GRANTED)
			.clientId(clientId)
			.detail("scopes", scopes)
			.detail("codeId", TokenGenerator.safeId(code.getCode()))
			.detail("expiresAt", code.getExpiresAt())
			.build());
		return code;
	}

	private void validateAuthorizationShape(AuthorizationParams params) throws AuthorizeException {
		if (!Utils.hasText(params.getResponseType())) {
			throw AuthorizeException.redirect(OAuthErrorCode.INVALID_REQUEST, "Missing response_type");
		}
		if (!RESPONSE_TYPE_CODE.equals(params.getResponseType())) {
			throw AuthorizeException.redirect(OAuthErrorCode.UNSUPPORTED_RESPONSE_TYPE,
					"Only response_type=code is supported");
		}
		if (!Utils.hasText(params.getCodeChallenge())) {
			throw AuthorizeException.redirect(OAuthErrorCode.INVALID_REQUEST, "Missing code_challenge (PKCE required)");
		}
		if (!AuthorizationCode.CODE_CHALLENGE_METHOD_S256.equals(params.getCodeChallengeMethod())) {
			throw AuthorizeException.redirect(OAuthErrorCode.INVALID_REQUEST, "code_challenge_method must be S256");
		}
	}

	/**
	 * Exchanges an authorization code for an access token and a refresh token. Either
	 * both tokens are issued or none; the code is consumed as soon as the PKCE check
	 * passes and stays consumed whatever happens next.
	 * @param clientId the authenticating client
	 * @param clientSecret the client's secret
	 * @param code the authorization code
	 * @param codeVerifier the PKCE code verifier
	 * @param redirectUri the redirect URI, which must equal the one the code was issued
	 * for
	 * @return the issued tokens
	 * @throws TokenException {@code invalid_client} if the client fails to
	 * authenticate, {@code unauthorized_client} if it may not use this grant,
	 * {@code invalid_grant} for any problem with the code
	 */
	public TokenPair exchangeCode(String clientId, String clientSecret, String code, String codeVerifier,
			String redirectUri) throws TokenException {
		authenticateClient(clientId, clientSecret);
		checkGrantType(AuditEventType.TOKEN_ISSUED, clientId, GRANT_TYPE_AUTHORIZATION_CODE);

		AuthorizationCode consumed;
		try {
			consumed = codeStore.consume(code, codeVerifier);
		}
		catch (TokenException ex) {
			auditTokenFailure(AuditEventType.TOKEN_ISSUED, clientId, code, ex.getErrorDescription());
			throw ex;
		}

		if (!consumed.getClientId().equals(clientId)) {
			auditTokenFailure(AuditEventType.TOKEN_ISSUED, clientId, code,
					"Authorization code does not belong to this client");
			throw TokenException.invalidGrant("Authorization code does not belong to this client");
		}
		if (!consumed.getRedirectUri().equals(redirectUri)) {
			auditTokenFailure(AuditEventType.TOKEN_ISSUED, clientId, code,
					"Redirect URI does not match authorization request");
			throw TokenException.invalidGrant("Redirect URI does not match authorization request");
		}

		TokenPair pair = tokenStore.issueTokenPair(clientId, consumed.getScopes());
		auditLogger.log(AuditEvent.success(AuditEventType.TOKEN_ISSUED)
			.clientId(clientId)
			.detail("scopes", consumed.getScopes())
			.detail("tokenId", TokenGenerator.safeId(pair.getAccessToken().getToken()))
			.detail("codeId", TokenGenerator.safeId(code))
			.build());
		return pair;
	}

	/**
	 * Exchanges a refresh token for a new token pair. The presented refresh token is
	 * invalidated.
	 * @param clientId the authenticating client
	 * @param clientSecret the client's secret
	 * @param refreshToken the refresh token
	 * @param requestedScopes optional narrower scopes, null or empty to keep the
	 * original ones
	 * @return the new tokens
	 * @throws TokenException {@code invalid_client}, {@code unauthorized_client},
	 * {@code invalid_grant} or {@code invalid_scope}
	 */
	public TokenPair refreshToken(String clientId, String clientSecret, String refreshToken,
			Collection<String> requestedScopes) throws TokenException {
		authenticateClient(clientId, clientSecret);
		checkGrantType(AuditEventType.TOKEN_REFRESHED, clientId, GRANT_TYPE_REFRESH_TOKEN);

		TokenPair pair;
		try {
			pair = tokenStore.rotateRefreshToken(refreshToken, requestedScopes);
		}
		catch (TokenException ex) {
			auditTokenFailure(AuditEventType.TOKEN_REFRESHED, clientId, refreshToken, ex.getErrorDescription());
			throw ex;
		}

		if (!pair.getClientId().equals(clientId)) {
			// the presented token belonged to another client: burn the new pair as well
			tokenStore.revoke(pair.getAccessToken().getToken(), TokenTypeHint.ACCESS_TOKEN);
			auditTokenFailure(AuditEventType.TOKEN_REFRESHED, clientId, refreshToken,
					"Refresh token does not belong to this client");
			throw TokenException.invalidGrant("Invalid refresh token");
		}

		auditLogger.log(AuditEvent.success(AuditEventType.TOKEN_REFRESHED)
			.clientId(clientId)
			.detail("scopes", pair.getAccessToken().getScopes())
			.detail("newTokenId", TokenGenerator.safeId(pair.getAccessToken().getToken()))
			.detail("oldRefreshTokenId", TokenGenerator.safeId(refreshToken))
			.detail("newRefreshTokenId", TokenGenerator.safeId(pair.getRefreshToken().getToken()))
			.build());
		return pair;
	}

	/**
	 * Verifies an access token for a protected resource.
	 * @param token the bearer token
	 * @return the token information, or null if the token is unknown, expired or
	 * revoked
	 */
	public AuthInfo verifyAccessToken(String token) {
		AuthInfo authInfo = tokenStore.verifyAccessToken(token);
		if (authInfo == null) {
			auditLogger.log(AuditEvent.failure(AuditEventType.TOKEN_VALIDATION_FAILED)
				.detail("tokenId", TokenGenerator.safeId(token))
				.build());
			return null;
		}
		auditLogger.log(AuditEvent.success(AuditEventType.TOKEN_VALIDATION_SUCCESS)
			.clientId(authInfo.getClientId())
			.detail("scopes", authInfo.getScopes())
			.detail("tokenId", TokenGenerator.safeId(token))
			.build());
		return authInfo;
	}

	/**
	 * Revokes a token and the token issued alongside it. Unknown tokens are ignored.
	 * @param token an access or refresh token
	 */
	public void revoke(String token) {
		tokenStore.revoke(token);
	}

	/**
	 * Revokes a token on behalf of a client, as done by the revocation endpoint. The
	 * token is only revoked when the client authenticates and owns it; in every other
	 * case the call silently does nothing, so the outcome never reveals whether the
	 * token exists.
	 * @param clientId the client id
	 * @param clientSecret the client's secret
	 * @param token the token to revoke
	 * @param hint optional token type hint
	 */
	public void revoke(String clientId, String clientSecret, String token, TokenTypeHint hint) {
		if (!clientRegistry.authenticate(clientId, clientSecret)) {
			auditLogger.log(AuditEvent.failure(AuditEventType.CLIENT_AUTHENTICATION_FAILED)
				.clientId(clientId)
				.detail("endpoint", "revocation")
				.build());
			return;
		}
		Optional<String> owner = tokenStore.findClientId(token);
		if (owner.isPresent() && owner.get().equals(clientId)) {
			tokenStore.revoke(token, hint);
			auditLogger.log(AuditEvent.success(AuditEventType.TOKEN_REVOKED)
				.clientId(clientId)
				.detail("tokenType", hint != null ? hint.getValue() : null)
				.detail("tokenId", TokenGenerator.safeId(token))
				.build());
		}
		else {
			auditLogger.log(AuditEvent.success(AuditEventType.TOKEN_REVOKED)
				.clientId(clientId)
				.detail("tokenId", TokenGenerator.safeId(token))
				.detail("note", "Token not found or does not belong to client")
				.build());
		}
	}

	/**
	 * Registers a client dynamically (RFC 7591). The generated or supplied secret is
	 * returned once in the response and only its hash is kept.
	 * @param metadata the client metadata
	 * @return the client information including id and secret
	 * @throws RegistrationException if the metadata is invalid
	 */
	public OAuthClientInformation registerClient(OAuthClientMetadata metadata) throws RegistrationException {
		List<String> redirectUris = metadata.getRedirectUris();
		if (Utils.isEmpty(redirectUris)) {
			throw new RegistrationException(OAuthErrorCode.INVALID_REDIRECT_URI, "At least one redirect_uri is required");
		}
		for (String redirectUri : redirectUris) {
			if (!UriUtils.isAcceptableRedirectUri(redirectUri, registrationOptions.isAllowLocalhostRedirect())) {
				throw new RegistrationException(OAuthErrorCode.INVALID_REDIRECT_URI,
						"Invalid redirect_uri: " + redirectUri);
			}
		}
		List<String> grantTypes = Utils.isEmpty(metadata.getGrantTypes()) ? SUPPORTED_GRANT_TYPES
				: metadata.getGrantTypes();
		if (!SUPPORTED_GRANT_TYPES.containsAll(grantTypes)) {
			throw new RegistrationException(OAuthErrorCode.INVALID_CLIENT_METADATA,
					"Supported grant_types are " + SUPPORTED_GRANT_TYPES);
		}
		if (metadata.getResponseTypes() != null && !List.of(RESPONSE_TYPE_CODE).containsAll(metadata.getResponseTypes())) {
			throw new RegistrationException(OAuthErrorCode.INVALID_CLIENT_METADATA,
					"Only response_type code is supported");
		}
		if (metadata.getTokenEndpointAuthMethod() != null
				&& !SUPPORTED_AUTH_METHODS.contains(metadata.getTokenEndpointAuthMethod())) {
			throw new RegistrationException(OAuthErrorCode.INVALID_CLIENT_METADATA,
					"Supported token_endpoint_auth_method values are " + SUPPORTED_AUTH_METHODS);
		}

		Set<String> scopes = ScopeUtils.parse(metadata.getScope());
		if (scopes.isEmpty() && registrationOptions.getDefaultScopes() != null) {
			scopes.addAll(registrationOptions.getDefaultScopes());
		}
		List<String> validScopes = registrationOptions.getValidScopes();
		if (validScopes != null && !validScopes.containsAll(scopes)) {
			List<String> invalid = new ArrayList<>(scopes);
			invalid.removeAll(validScopes);
			throw new RegistrationException(OAuthErrorCode.INVALID_CLIENT_METADATA,
					"Requested scopes are not valid: " + String.join(", ", invalid));
		}

		String clientSecret = Utils.hasText(metadata.getClientSecret()) ? metadata.getClientSecret()
				: TokenGenerator.generate();
		if (clientSecret.getBytes(StandardCharsets.UTF_8).length > ClientRegistry.MAX_CLIENT_SECRET_BYTES) {
			throw new RegistrationException(OAuthErrorCode.INVALID_CLIENT_METADATA,
					"client_secret must not be longer than " + ClientRegistry.MAX_CLIENT_SECRET_BYTES + " bytes");
		}
		RegisteredClient client = clientRegistry.register(clientSecret, redirectUris, scopes, grantTypes);

		OAuthClientInformation info = new OAuthClientInformation();
		info.setClientId(client.getClientId());
		info.setClientSecret(clientSecret);
		info.setClientIdIssuedAt(client.getClientIdIssuedAt().getEpochSecond());
		info.setClientSecretExpiresAt(0L);
		info.setRedirectUris(new ArrayList<>(client.getRedirectUris()));
		info.setScope(ScopeUtils.format(client.getAllowedScopes()));
		info.setClientName(metadata.getClientName());
		info.setTokenEndpointAuthMethod(
				metadata.getTokenEndpointAuthMethod() != null ? metadata.getTokenEndpointAuthMethod()
						: "client_secret_post");
		info.setGrantTypes(new ArrayList<>(client.getGrantTypes()));
		info.setResponseTypes(List.of(RESPONSE_TYPE_CODE));

		auditLogger.log(AuditEvent.success(AuditEventType.CLIENT_REGISTERED)
			.clientId(client.getClientId())
			.detail("clientName", metadata.getClientName())
			.detail("redirectUris", client.getRedirectUris())
			.detail("scopes", client.getAllowedScopes())
			.build());
		return info;
	}

	/**
	 * Counts of the entries currently held by the stores.
	 */
	public Stats stats() {
		return new Stats(clientRegistry.size(), codeStore.size(), tokenStore.accessTokenCount(),
				tokenStore.refreshTokenCount());
	}

	@Override
	public void close() {
		if (sweeper != null) {
			sweeper.close();
		}
	}

	private void authenticateClient(String clientId, String clientSecret) throws TokenException {
		if (!clientRegistry.authenticate(clientId, clientSecret)) {
			auditLogger.log(AuditEvent.failure(AuditEventType.CLIENT_AUTHENTICATION_FAILED)
				.clientId(clientId)
				.detail("endpoint", "token")
				.build());
			throw TokenException.invalidClient();
		}
	}

	private void checkGrantType(AuditEventType auditType, String clientId, String grantType) throws TokenException {
		boolean allowed = clientRegistry.getClient(clientId)
			.map(client -> client.isGrantTypeAllowed(grantType))
			.orElse(false);
		if (!allowed) {
			auditLogger.log(AuditEvent.failure(auditType)
				.clientId(clientId)
				.detail("grantType", grantType)
				.detail("error", "Grant type not allowed for client")
				.build());
			throw new TokenException(OAuthErrorCode.UNAUTHORIZED_CLIENT,
					"Client is not authorized for grant_type " + grantType);
		}
	}

	private void auditTokenFailure(AuditEventType type, String clientId, String credential, String reason) {
		auditLogger.log(AuditEvent.failure(type)
			.clientId(clientId)
			.detail("credentialId", TokenGenerator.safeId(credential))
			.detail("error", reason)
			.build());
	}

	public static final class Stats {

		private final int clients;

		private final int authorizationCodes;

		private final int accessTokens;

		private final int refreshTokens;

		public Stats(int clients, int authorizationCodes, int accessTokens, int refreshTokens) {
			this.clients = clients;
			this.authorizationCodes = authorizationCodes;
			this.accessTokens = accessTokens;
			this.refreshTokens = refreshTokens;
		}

		public int getClients() {
			return clients;
		}

		public int getAuthorizationCodes() {
			return authorizationCodes;
		}

		public int getAccessTokens() {
			return accessTokens;
		}

		public int getRefreshTokens() {
			return refreshTokens;
		}

	}

	/**
	 * Builds a provider over in-memory stores unless stores are supplied.
	 */
	public static class Builder {

		private TokenSettings tokenSettings = TokenSettings.defaults();

		private ClientRegistrationOptions registrationOptions = new ClientRegistrationOptions();

		private final List<ClientSettings> clients = new ArrayList<>();

		private Clock clock = Clock.systemUTC();

		private AuditLogger auditLogger;

		private boolean sweepExpiredEntries = true;

		private ClientRegistry clientRegistry;

		private AuthorizationCodeStore codeStore;

		private TokenStore tokenStore;

		public Builder tokenSettings(TokenSettings tokenSettings) {
			this.tokenSettings = Objects.requireNonNull(tokenSettings, "tokenSettings must not be null");
			return this;
		}

		public Builder registrationOptions(ClientRegistrationOptions registrationOptions) {
			this.registrationOptions = Objects.requireNonNull(registrationOptions,
					"registrationOptions must not be null");
			return this;
		}

		public Builder client(ClientSettings client) {
			this.clients.add(Objects.requireNonNull(client, "client must not be null"));
			return this;
		}

		public Builder clients(Collection<ClientSettings> clients) {
			clients.forEach(this::client);
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = Objects.requireNonNull(clock, "clock must not be null");
			return this;
		}

		public Builder auditLogger(AuditLogger auditLogger) {
			this.auditLogger = auditLogger;
			return this;
		}

		/**
		 * Whether to run a background sweep of expired codes and tokens. Enabled by
		 * default.
		 */
		public Builder sweepExpiredEntries(boolean sweepExpiredEntries) {
			this.sweepExpiredEntries = sweepExpiredEntries;
			return this;
		}

		public Builder clientRegistry(ClientRegistry clientRegistry) {
			this.clientRegistry = clientRegistry;
			return this;
		}

		public Builder codeStore(AuthorizationCodeStore codeStore) {
			this.codeStore = codeStore;
			return this;
		}

		public Builder tokenStore(TokenStore tokenStore) {
			this.tokenStore = tokenStore;
			return this;
		}

		public OAuthProvider build() {
			ClientRegistry registry = clientRegistry != null ? clientRegistry
					: new InMemoryClientRegistry(tokenSettings.getBcryptStrength(), clock);
			AuthorizationCodeStore codes = codeStore != null ? codeStore
					: new InMemoryAuthorizationCodeStore(tokenSettings.getAuthorizationCodeTtl(), clock);
			TokenStore tokens = tokenStore != null ? tokenStore : new InMemoryTokenStore(
					tokenSettings.getAccessTokenTtl(), tokenSettings.getRefreshTokenTtl(), clock);

			for (ClientSettings client : clients) {
				try {
					registry.add(client.getClientId(), client.getClientSecret(), client.getRedirectUris(),
							client.getScopes());
				}
				catch (DuplicateClientIdException ex) {
					throw new IllegalArgumentException("Duplicate client configured: " + ex.getClientId(), ex);
				}
			}
			logger.info("OAuth provider initialized with {} configured clients", clients.size());

			ExpiredEntrySweeper sweeper = sweepExpiredEntries
					? new ExpiredEntrySweeper(codes, tokens, tokenSettings.getSweepInterval()) : null;
			return new OAuthProvider(registry, codes, tokens, registrationOptions,
					auditLogger != null ? auditLogger : new Slf4jAuditLogger(), sweeper);
		}

	}

}

/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.handlers;

import java.util.Map;

import org.junit.jupiter.api.Test;

import io.simplymcp.auth.exception.TokenException;
import io.simplymcp.server.auth.OAuthProvider;
import io.simplymcp.server.auth.middleware.ClientAuthenticator;
import io.simplymcp.server.auth.store.TokenTypeHint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class RevocationHandlerTests {

	private final OAuthProvider provider = mock(OAuthProvider.class);

	private final RevocationHandler handler = new RevocationHandler(provider, new ClientAuthenticator());

	@Test
	void passesTokenAndHintToProvider() {
		handler.handle(Map.of("token", "t1", "token_type_hint", "refresh_token", "client_id", "c1", "client_secret",
				"s1"), null).join();

		verify(provider).revoke("c1", "s1", "t1", TokenTypeHint.REFRESH_TOKEN);
	}

	@Test
	void unknownHintIsIgnored() {
		handler.handle(Map.of("token", "t1", "token_type_hint", "id_token", "client_id", "c1", "client_secret", "s1"),
				null).join();

		verify(provider).revoke("c1", "s1", "t1", null);
	}

	@Test
	void missingTokenIsInvalidRequest() {
		assertThatThrownBy(() -> handler.handle(Map.of("client_id", "c1", "client_secret", "s1"), null).join())
			.hasCauseInstanceOf(TokenException.class);
	}

	@Test
	void missingClientCredentialsCompleteWithoutRevoking() {
		assertThat(handler.handle(Map.of("token", "t1"), null).join()).isNull();

		verify(provider, never()).revoke(anyString(), anyString(), anyString(), any());
	}

}

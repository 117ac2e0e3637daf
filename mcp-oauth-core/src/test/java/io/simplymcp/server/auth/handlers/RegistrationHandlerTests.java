/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.handlers;

import java.util.List;

import org.junit.jupiter.api.Test;

import io.simplymcp.auth.OAuthClientInformation;
import io.simplymcp.auth.OAuthClientMetadata;
import io.simplymcp.auth.exception.RegistrationException;
import io.simplymcp.server.auth.OAuthProvider;
import io.simplymcp.server.auth.settings.ClientRegistrationOptions;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RegistrationHandlerTests {

	private final OAuthProvider provider = mock(OAuthProvider.class);

	@Test
	void delegatesToProviderWhenEnabled() throws Exception {
		ClientRegistrationOptions options = new ClientRegistrationOptions();
		options.setEnabled(true);
		OAuthClientMetadata metadata = new OAuthClientMetadata();
		metadata.setRedirectUris(List.of("https://app/cb"));
		OAuthClientInformation info = new OAuthClientInformation();
		info.setClientId("generated");
		when(provider.registerClient(metadata)).thenReturn(info);

		assertThat(new RegistrationHandler(provider, options).handle(metadata).join().getClientId())
			.isEqualTo("generated");
	}

	@Test
	void refusesWhenDisabled() throws Exception {
		RegistrationHandler handler = new RegistrationHandler(provider, new ClientRegistrationOptions());

		assertThatThrownBy(() -> handler.handle(new OAuthClientMetadata()).join())
			.hasCauseInstanceOf(RegistrationException.class);
		verify(provider, never()).registerClient(any());
	}

}

/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.store;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.password.PasswordEncoder;

import io.simplymcp.auth.RegisteredClient;
import io.simplymcp.auth.exception.DuplicateClientIdException;
import io.simplymcp.server.auth.MutableClock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class InMemoryClientRegistryTests {

	private final MutableClock clock = MutableClock.startingAt("2025-01-01T00:00:00Z");

	private InMemoryClientRegistry registry;

	@BeforeEach
	void setUp() throws Exception {
		registry = new InMemoryClientRegistry(4, clock);
		registry.add("c1", "s1", List.of("https://app/cb"), List.of("read", "write"));
	}

	@Test
	void authenticatesWithCorrectSecret() {
		assertThat(registry.authenticate("c1", "s1")).isTrue();
	}

	@Test
	void rejectsWrongSecretUnknownClientAndNulls() {
		assertThat(registry.authenticate("c1", "s2")).isFalse();
		assertThat(registry.authenticate("unknown", "s1")).isFalse();
		assertThat(registry.authenticate(null, "s1")).isFalse();
		assertThat(registry.authenticate("c1", null)).isFalse();
	}

	@Test
	void storesOnlyTheHashOfTheSecret() {
		RegisteredClient client = registry.getClient("c1").orElseThrow();

		assertThat(client.getHashedSecret()).isNotEqualTo("s1").startsWith("$2a$04$");
		assertThat(client.getClientIdIssuedAt()).isEqualTo(clock.instant());
	}

	@Test
	void redirectUriRequiresExactMatch() {
		assertThat(registry.validateRedirectUri("c1", "https://app/cb")).isTrue();
		assertThat(registry.validateRedirectUri("c1", "https://app/cb/")).isFalse();
		assertThat(registry.validateRedirectUri("c1", "https://app/cb?x=1")).isFalse();
		assertThat(registry.validateRedirectUri("c1", "HTTPS://app/cb")).isFalse();
		assertThat(registry.validateRedirectUri("unknown", "https://app/cb")).isFalse();
	}

	@Test
	void scopesMustBeSubsetOfAllowedScopes() {
		assertThat(registry.validateScopes("c1", List.of("read"))).isTrue();
		assertThat(registry.validateScopes("c1", List.of("read", "write"))).isTrue();
		assertThat(registry.validateScopes("c1", List.of())).isTrue();
		assertThat(registry.validateScopes("c1", List.of("admin"))).isFalse();
		assertThat(registry.validateScopes("c1", List.of("read", "admin"))).isFalse();
		assertThat(registry.validateScopes("unknown", List.of("read"))).isFalse();
	}

	@Test
	void emptyScopeRequestResolvesToAllowedScopes() {
		assertThat(registry.resolveScopes("c1", List.of())).containsExactly("read", "write");
		assertThat(registry.resolveScopes("c1", null)).containsExactly("read", "write");
		assertThat(registry.resolveScopes("c1", List.of("write"))).containsExactly("write");
	}

	@Test
	void duplicateClientIdIsRejected() {
		assertThatThrownBy(() -> registry.add("c1", "other", List.of("https://other/cb"), List.of("read")))
			.isInstanceOf(DuplicateClientIdException.class)
			.satisfies(ex -> assertThat(((DuplicateClientIdException) ex).getClientId()).isEqualTo("c1"));

		// the original registration is untouched
		assertThat(registry.authenticate("c1", "s1")).isTrue();
	}

	@Test
	void registerGeneratesClientId() throws Exception {
		RegisteredClient client = registry.register("secret", List.of("https://new/cb"), Set.of("read"));

		assertThat(client.getClientId()).isNotBlank().isNotEqualTo("c1");
		assertThat(registry.size()).isEqualTo(2);
		assertThat(registry.authenticate(client.getClientId(), "secret")).isTrue();
	}

	@Test
	void secretsLongerThanBcryptInputAreRejected() {
		assertThatThrownBy(() -> registry.add("long", "x".repeat(72) + "REAL-TAIL", List.of("https://app/cb"),
				List.of("read")))
			.isInstanceOf(IllegalArgumentException.class);
		assertThat(registry.getClient("long")).isEmpty();

		// multi-byte characters count by their UTF-8 length
		assertThatThrownBy(() -> registry.add("utf8", "\u00e9".repeat(37), List.of("https://app/cb"), List.of("read")))
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void secretSharingTheFirst72BytesDoesNotAuthenticate() throws Exception {
		String secret = "x".repeat(72);
		registry.add("c72", secret, List.of("https://app/cb"), List.of("read"));

		assertThat(registry.authenticate("c72", secret)).isTrue();
		assertThat(registry.authenticate("c72", secret + "FORGED")).isFalse();
	}

	@Test
	void grantTypesDefaultToCodeAndRefresh() throws Exception {
		assertThat(registry.getClient("c1").orElseThrow().getGrantTypes()).containsExactly("authorization_code",
				"refresh_token");

		RegisteredClient codeOnly = registry.register("secret", List.of("https://new/cb"), Set.of("read"),
				List.of("authorization_code"));
		assertThat(codeOnly.isGrantTypeAllowed("authorization_code")).isTrue();
		assertThat(codeOnly.isGrantTypeAllowed("refresh_token")).isFalse();
	}

	@Test
	void removeDeletesClient() {
		assertThat(registry.remove("c1")).isTrue();
		assertThat(registry.remove("c1")).isFalse();
		assertThat(registry.getClient("c1")).isEmpty();
		assertThat(registry.authenticate("c1", "s1")).isFalse();
	}

	@Test
	void encoderFailureRejectsAuthentication() throws Exception {
		PasswordEncoder encoder = mock(PasswordEncoder.class);
		when(encoder.encode(anyString())).thenReturn("hash");
		when(encoder.matches("s1", "hash")).thenThrow(new IllegalStateException("boom"));

		InMemoryClientRegistry failing = new InMemoryClientRegistry(encoder, clock);
		failing.add("c1", "s1", List.of("https://app/cb"), List.of("read"));

		assertThat(failing.authenticate("c1", "s1")).isFalse();
	}

}

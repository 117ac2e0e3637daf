/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PkceVerifierTests {

	// RFC 7636 appendix B
	private static final String VERIFIER = "dBjftJeZ4CVP-mB92K27uhbUJU1p1r_wW1gFWFOEjXk";

	private static final String CHALLENGE = "E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM";

	@Test
	void computesRfcExampleChallenge() {
		assertThat(PkceVerifier.computeChallenge(VERIFIER)).isEqualTo(CHALLENGE);
	}

	@Test
	void verifiesMatchingVerifier() {
		assertThat(PkceVerifier.verify(VERIFIER, CHALLENGE)).isTrue();
	}

	@Test
	void rejectsMismatchAndMissingValues() {
		assertThat(PkceVerifier.verify(VERIFIER.replace('d', 'e'), CHALLENGE)).isFalse();
		assertThat(PkceVerifier.verify(null, CHALLENGE)).isFalse();
		assertThat(PkceVerifier.verify(VERIFIER, null)).isFalse();
	}

	@Test
	void verifierMustUseUnreservedCharactersAndValidLength() {
		assertThat(PkceVerifier.isWellFormed("a".repeat(43))).isTrue();
		assertThat(PkceVerifier.isWellFormed("a".repeat(128))).isTrue();
		assertThat(PkceVerifier.isWellFormed("a".repeat(42))).isFalse();
		assertThat(PkceVerifier.isWellFormed("a".repeat(129))).isFalse();
		assertThat(PkceVerifier.isWellFormed("a".repeat(42) + "+")).isFalse();
	}

	@Test
	void generatedVerifierRoundTrips() {
		String verifier = TokenGenerator.generate();

		assertThat(PkceVerifier.isWellFormed(verifier)).isTrue();
		assertThat(PkceVerifier.verify(verifier, PkceVerifier.computeChallenge(verifier))).isTrue();
	}

}

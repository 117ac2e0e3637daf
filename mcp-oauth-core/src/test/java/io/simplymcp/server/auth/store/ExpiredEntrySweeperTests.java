/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.store;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExpiredEntrySweeperTests {

	private final AuthorizationCodeStore codeStore = mock(AuthorizationCodeStore.class);

	private final TokenStore tokenStore = mock(TokenStore.class);

	@Test
	void sweepPurgesBothStores() {
		when(codeStore.purgeExpired()).thenReturn(2);
		when(tokenStore.purgeExpired()).thenReturn(3);

		try (ExpiredEntrySweeper sweeper = new ExpiredEntrySweeper(codeStore, tokenStore, Duration.ofHours(1))) {
			assertThat(sweeper.sweep()).isEqualTo(5);
		}
	}

	@Test
	void failingSweepIsContained() {
		when(codeStore.purgeExpired()).thenThrow(new IllegalStateException("boom"));

		try (ExpiredEntrySweeper sweeper = new ExpiredEntrySweeper(codeStore, tokenStore, Duration.ofHours(1))) {
			assertThat(sweeper.sweep()).isZero();
		}
	}

	@Test
	void sweepRunsOnSchedule() {
		try (ExpiredEntrySweeper sweeper = new ExpiredEntrySweeper(codeStore, tokenStore, Duration.ofMillis(20))) {
			verify(codeStore, timeout(2000).atLeastOnce()).purgeExpired();
			verify(tokenStore, timeout(2000).atLeastOnce()).purgeExpired();
		}
	}

}

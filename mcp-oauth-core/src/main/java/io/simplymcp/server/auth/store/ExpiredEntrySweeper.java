/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.store;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically removes expired authorization codes and tokens. Expiry is always
 * checked at lookup; the sweep only bounds memory.
 */
public class ExpiredEntrySweeper implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(ExpiredEntrySweeper.class);

	private final AuthorizationCodeStore codeStore;

	private final TokenStore tokenStore;

	private final ScheduledExecutorService executor;

	public ExpiredEntrySweeper(AuthorizationCodeStore codeStore, TokenStore tokenStore, Duration interval) {
		this.codeStore = Objects.requireNonNull(codeStore, "codeStore must not be null");
		this.tokenStore = Objects.requireNonNull(tokenStore, "tokenStore must not be null");
		this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
			Thread thread = new Thread(runnable, "oauth-expired-entry-sweeper");
			thread.setDaemon(true);
			return thread;
		});
		long millis = interval.toMillis();
		this.executor.scheduleWithFixedDelay(this::sweep, millis, millis, TimeUnit.MILLISECONDS);
	}

	/**
	 * Runs one sweep over both stores.
	 * @return the number of entries removed
	 */
	public int sweep() {
		try {
			int removed = codeStore.purgeExpired() + tokenStore.purgeExpired();
			if (removed > 0) {
				logger.debug("Removed {} expired authorization codes and tokens", removed);
			}
			return removed;
		}
		catch (RuntimeException ex) {
			// an exception would cancel the scheduled task
			logger.error("Expired entry sweep failed", ex);
			return 0;
		}
	}

	@Override
	public void close() {
		executor.shutdownNow();
	}

}

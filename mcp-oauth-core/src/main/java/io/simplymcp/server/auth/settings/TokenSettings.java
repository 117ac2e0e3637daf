/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.settings;

import java.time.Duration;
import java.util.Objects;

/**
 * Lifetimes and hashing cost used by the authorization server.
 * <p>
 * Defaults: access tokens 1 hour, refresh tokens 24 hours, authorization codes 10
 * minutes, bcrypt strength 10, expired-entry sweep every 60 seconds.
 */
public class TokenSettings {

	public static final Duration DEFAULT_ACCESS_TOKEN_TTL = Duration.ofSeconds(3600);

	public static final Duration DEFAULT_REFRESH_TOKEN_TTL = Duration.ofSeconds(86400);

	public static final Duration DEFAULT_AUTHORIZATION_CODE_TTL = Duration.ofSeconds(600);

	public static final int DEFAULT_BCRYPT_STRENGTH = 10;

	public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofSeconds(60);

	private final Duration accessTokenTtl;

	private final Duration refreshTokenTtl;

	private final Duration authorizationCodeTtl;

	private final int bcryptStrength;

	private final Duration sweepInterval;

	private TokenSettings(Builder builder) {
		this.accessTokenTtl = builder.accessTokenTtl;
		this.refreshTokenTtl = builder.refreshTokenTtl;
		this.authorizationCodeTtl = builder.authorizationCodeTtl;
		this.bcryptStrength = builder.bcryptStrength;
		this.sweepInterval = builder.sweepInterval;
	}

	public static TokenSettings defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public Duration getAccessTokenTtl() {
		return accessTokenTtl;
	}

	public Duration getRefreshTokenTtl() {
		return refreshTokenTtl;
	}

	public Duration getAuthorizationCodeTtl() {
		return authorizationCodeTtl;
	}

	public int getBcryptStrength() {
		return bcryptStrength;
	}

	public Duration getSweepInterval() {
		return sweepInterval;
	}

	public static class Builder {

		private Duration accessTokenTtl = DEFAULT_ACCESS_TOKEN_TTL;

		private Duration refreshTokenTtl = DEFAULT_REFRESH_TOKEN_TTL;

		private Duration authorizationCodeTtl = DEFAULT_AUTHORIZATION_CODE_TTL;

		private int bcryptStrength = DEFAULT_BCRYPT_STRENGTH;

		private Duration sweepInterval = DEFAULT_SWEEP_INTERVAL;

		public Builder accessTokenTtl(Duration accessTokenTtl) {
			this.accessTokenTtl = requirePositive(accessTokenTtl, "accessTokenTtl");
			return this;
		}

		public Builder refreshTokenTtl(Duration refreshTokenTtl) {
			this.refreshTokenTtl = requirePositive(refreshTokenTtl, "refreshTokenTtl");
			return this;
		}

		public Builder authorizationCodeTtl(Duration authorizationCodeTtl) {
			this.authorizationCodeTtl = requirePositive(authorizationCodeTtl, "authorizationCodeTtl");
			return this;
		}

		/**
		 * Sets the bcrypt log rounds, between 4 and 31.
		 */
		public Builder bcryptStrength(int bcryptStrength) {
			if (bcryptStrength < 4 || bcryptStrength > 31) {
				throw new IllegalArgumentException("bcryptStrength must be between 4 and 31");
			}
			this.bcryptStrength = bcryptStrength;
			return this;
		}

		public Builder sweepInterval(Duration sweepInterval) {
			this.sweepInterval = requirePositive(sweepInterval, "sweepInterval");
			return this;
		}

		public TokenSettings build() {
			return new TokenSettings(this);
		}

		private static Duration requirePositive(Duration value, String name) {
			Objects.requireNonNull(value, name + " must not be null");
			if (value.isNegative() || value.isZero()) {
				throw new IllegalArgumentException(name + " must be positive");
			}
			return value;
		}

	}

}

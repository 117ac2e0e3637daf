/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.server.auth.audit;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A security-relevant event of the authorization server. Details must never contain
 * full tokens, codes, verifiers or secrets.
 */
public final class AuditEvent {

	public enum Result {

		SUCCESS, FAILURE, WARNING

	}

	private final AuditEventType type;

	private final Result result;

	private final String clientId;

	private final Instant timestamp;

	private final Map<String, Object> details;

	private AuditEvent(AuditEventType type, Result result, String clientId, Instant timestamp,
			Map<String, Object> details) {
		this.type = type;
		this.result = result;
		this.clientId = clientId;
		this.timestamp = timestamp;
		this.details = Collections.unmodifiableMap(details);
	}

	public static Builder success(AuditEventType type) {
		return new Builder(type, Result.SUCCESS);
	}

	public static Builder failure(AuditEventType type) {
		return new Builder(type, Result.FAILURE);
	}

	public AuditEventType getType() {
		return type;
	}

	public Result getResult() {
		return result;
	}

	public String getClientId() {
		return clientId;
	}

	public Instant getTimestamp() {
		return timestamp;
	}

	public Map<String, Object> getDetails() {
		return details;
	}

	@Override
	public String toString() {
		return type.getEventName() + " result=" + result + " clientId=" + clientId + " " + details;
	}

	public static class Builder {

		private final AuditEventType type;

		private final Result result;

		private String clientId;

		private Instant timestamp;

		private final Map<String, Object> details = new LinkedHashMap<>();

		private Builder(AuditEventType type, Result result) {
			this.type = type;
			this.result = result;
		}

		public Builder clientId(String clientId) {
			this.clientId = clientId;
			return this;
		}

		public Builder timestamp(Instant timestamp) {
			this.timestamp = timestamp;
			return this;
		}

		public Builder detail(String key, Object value) {
			if (value != null) {
				this.details.put(key, value);
			}
			return this;
		}

		public AuditEvent build() {
			return new AuditEvent(type, result, clientId, timestamp != null ? timestamp : Instant.now(), details);
		}

	}

}

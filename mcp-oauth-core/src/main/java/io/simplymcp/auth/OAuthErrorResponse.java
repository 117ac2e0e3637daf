/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.simplymcp.auth;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.simplymcp.auth.exception.OAuthException;

/**
 * OAuth error response body, RFC 6749 section 5.2.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OAuthErrorResponse {

	@JsonProperty("error")
	private String error;

	@JsonProperty("error_description")
	private String errorDescription;

	public OAuthErrorResponse() {
	}

	public OAuthErrorResponse(String error, String errorDescription) {
		this.error = error;
		this.errorDescription = errorDescription;
	}

	public static OAuthErrorResponse from(OAuthException ex) {
		return new OAuthErrorResponse(ex.getError().getValue(), ex.getErrorDescription());
	}

	public String getError() {
		return error;
	}

	public void setError(String error) {
		this.error = error;
	}

	public String getErrorDescription() {
		return errorDescription;
	}

	public void setErrorDescription(String errorDescription) {
		this.errorDescription = errorDescription;
	}

}

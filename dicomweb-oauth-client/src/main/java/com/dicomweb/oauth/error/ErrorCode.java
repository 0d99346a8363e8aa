package com.dicomweb.oauth.error;

import lombok.Getter;

/**
 * Catalogue of error codes surfaced to the request interceptor.
 * The HTTP status is what the interceptor answers with when the error reaches it.
 */
@Getter
public enum ErrorCode {

    CONFIG_MISSING_KEY("CFG-001", 500, "Required configuration key is missing"),
    CONFIG_INVALID_VALUE("CFG-002", 500, "Configuration value is invalid"),
    UNKNOWN_SERVER("CFG-004", 500, "No server is configured under this name"),

    TOKEN_ACQUISITION_FAILED("TOK-001", 502, "Failed to acquire OAuth2 token"),
    TOKEN_VALIDATION_FAILED("TOK-004", 401, "Token validation failed"),
    TOKEN_INVALID_RESPONSE("TOK-005", 502, "Invalid response from token endpoint"),

    NETWORK_TIMEOUT("NET-001", 502, "Token endpoint did not answer in time"),
    NETWORK_CONNECTION_ERROR("NET-002", 502, "Could not connect to token endpoint"),

    RATE_LIMITED("RATE-001", 429, "Too many requests");

    private final String code;
    private final int httpStatus;
    private final String description;

    ErrorCode(String code, int httpStatus, String description) {
        this.code = code;
        this.httpStatus = httpStatus;
        this.description = description;
    }
}

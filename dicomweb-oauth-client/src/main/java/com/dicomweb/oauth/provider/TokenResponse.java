package com.dicomweb.oauth.provider;

import com.dicomweb.oauth.security.SecretRedactor;

import java.util.Objects;

public record TokenResponse(String accessToken, long expiresInSeconds, String tokenType) {

    public static final String BEARER = "Bearer";

    /** Lifetimes above one year are treated as a broken response. */
    public static final long MAX_EXPIRES_IN_SECONDS = 366L * 24 * 60 * 60;

    public TokenResponse {
        Objects.requireNonNull(accessToken, "accessToken");
        tokenType = (tokenType == null || tokenType.isBlank()) ? BEARER : tokenType;
    }

    public TokenResponse(String accessToken, long expiresInSeconds) {
        this(accessToken, expiresInSeconds, BEARER);
    }

    @Override
    public String toString() {
        return "TokenResponse[accessToken=" + SecretRedactor.maskToken(accessToken)
            + ", expiresInSeconds=" + expiresInSeconds + ", tokenType=" + tokenType + "]";
    }
}

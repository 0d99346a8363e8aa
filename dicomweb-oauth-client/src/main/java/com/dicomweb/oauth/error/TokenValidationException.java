package com.dicomweb.oauth.error;

import lombok.Getter;

/**
 * A token failed signature, algorithm or claim checks. The token is never cached;
 * a later acquisition may still succeed if the provider issues a different one.
 */
@Getter
public class TokenValidationException extends DicomWebOAuthException {

    private final ValidationFailure failure;
    private final String detail;

    public TokenValidationException(ValidationFailure failure, String detail) {
        this(failure, null, detail, null);
    }

    public TokenValidationException(ValidationFailure failure, String detail, Throwable cause) {
        this(failure, null, detail, cause);
    }

    public TokenValidationException(ValidationFailure failure, String serverName, String detail, Throwable cause) {
        super(ErrorCode.TOKEN_VALIDATION_FAILED, serverName, failure + ": " + detail, cause);
        this.failure = failure;
        this.detail = detail;
    }

    /**
     * Same failure, re-attributed to the server whose token was being validated.
     */
    public TokenValidationException forServer(String serverName) {
        return new TokenValidationException(failure, serverName, detail, getCause());
    }
}

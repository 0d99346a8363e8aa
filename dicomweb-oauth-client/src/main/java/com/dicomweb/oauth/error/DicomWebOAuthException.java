package com.dicomweb.oauth.error;

import lombok.Getter;

/**
 * Base of every failure raised by the token engine.
 * Messages carry the server name and provider type, never secret material.
 */
@Getter
public abstract class DicomWebOAuthException extends RuntimeException {

    private final ErrorCode errorCode;
    private final String serverName;

    protected DicomWebOAuthException(ErrorCode errorCode, String serverName, String message, Throwable cause) {
        super(format(errorCode, serverName, message), cause);
        this.errorCode = errorCode;
        this.serverName = serverName;
    }

    public boolean isRetryable() {
        return false;
    }

    private static String format(ErrorCode errorCode, String serverName, String message) {
        String prefix = "[" + errorCode.getCode() + "]";
        return serverName == null
            ? prefix + " " + message
            : prefix + " server '" + serverName + "': " + message;
    }
}

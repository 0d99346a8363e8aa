package com.dicomweb.oauth.error;

import com.dicomweb.oauth.config.ProviderType;
import lombok.Getter;

/**
 * The provider could not hand out a token. Callers may retry with backoff;
 * the token manager never retries on its own.
 */
@Getter
public class TokenAcquisitionException extends DicomWebOAuthException {

    private final ProviderType providerType;

    public TokenAcquisitionException(ErrorCode errorCode, String serverName, ProviderType providerType,
                                     String message) {
        this(errorCode, serverName, providerType, message, null);
    }

    public TokenAcquisitionException(ErrorCode errorCode, String serverName, ProviderType providerType,
                                     String message, Throwable cause) {
        super(errorCode, serverName, withProvider(providerType, message), cause);
        this.providerType = providerType;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }

    private static String withProvider(ProviderType providerType, String message) {
        return providerType == null ? message : providerType.getConfigName() + " provider: " + message;
    }
}

package com.dicomweb.oauth.config;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.nio.file.Path;

/**
 * TLS verification for calls to a token endpoint: the JVM trust store, a custom
 * PEM CA bundle, or nothing at all.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SslVerification {

    public static final SslVerification ENABLED = new SslVerification(true, null);
    public static final SslVerification DISABLED = new SslVerification(false, null);

    boolean enabled;
    Path caBundle;

    public static SslVerification caBundle(Path caBundle) {
        return new SslVerification(true, caBundle);
    }

    public boolean hasCaBundle() {
        return caBundle != null;
    }
}

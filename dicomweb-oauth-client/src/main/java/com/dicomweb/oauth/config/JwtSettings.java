package com.dicomweb.oauth.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Validation parameters for tokens issued to one server. Without a public key
 * validation is skipped.
 */
@Value
@Builder(toBuilder = true)
public class JwtSettings {

    public static final String DEFAULT_ALGORITHM = "RS256";
    public static final long DEFAULT_CLOCK_SKEW_SECONDS = 30;

    String publicKeyPem;
    String audience;
    String issuer;
    @Singular
    Set<String> allowedAlgorithms;
    @Builder.Default
    long clockSkewSeconds = DEFAULT_CLOCK_SKEW_SECONDS;

    public boolean isEnabled() {
        return publicKeyPem != null && !publicKeyPem.isBlank();
    }

    public Set<String> effectiveAlgorithms() {
        return allowedAlgorithms.isEmpty() ? Set.of(DEFAULT_ALGORITHM) : allowedAlgorithms;
    }
}

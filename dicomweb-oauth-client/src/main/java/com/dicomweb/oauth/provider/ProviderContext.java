package com.dicomweb.oauth.provider;

import com.dicomweb.oauth.security.SecretVault;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Clock;
import java.util.function.UnaryOperator;

/**
 * What every provider needs besides its own server configuration.
 */
@Value
@Builder
public class ProviderContext {

    @NonNull
    SecretVault vault;
    @Builder.Default
    ObjectMapper mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    @Builder.Default
    Clock clock = Clock.systemUTC();
    /** Environment lookup; platform identity providers read their endpoints from it. */
    @Builder.Default
    UnaryOperator<String> environment = System::getenv;

    public String env(String name) {
        String value = environment.apply(name);
        return value == null || value.isBlank() ? null : value;
    }
}

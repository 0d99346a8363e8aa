package com.dicomweb.oauth.config;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Static description of one remote DICOMweb server and the identity provider
 * that issues its tokens. Immutable once loaded.
 */
@Value
@Builder(toBuilder = true)
public class ServerConfig {

    public static final long DEFAULT_REFRESH_BUFFER_SECONDS = 300;

    String name;
    String baseUrl;
    @Builder.Default
    ProviderType providerType = ProviderType.AUTO;
    String tokenEndpoint;
    String clientId;
    @ToString.Exclude
    String clientSecret;
    String scope;
    @Builder.Default
    long refreshBufferSeconds = DEFAULT_REFRESH_BUFFER_SECONDS;
    @Builder.Default
    SslVerification sslVerification = SslVerification.ENABLED;
    JwtSettings jwt;

    // provider specific
    String tenantId;
    Path serviceAccountKeyFile;
    /** Overrides the platform identity endpoint of the managed identity and AWS providers. */
    String metadataEndpoint;
    @Builder.Default
    ClientAuthMethod clientAuthMethod = ClientAuthMethod.CLIENT_SECRET_POST;

    @Builder.Default
    Duration requestTimeout = Duration.ofSeconds(30);
    @Builder.Default
    Duration connectTimeout = Duration.ofSeconds(10);

    /** The configured provider type, {@link ProviderType#AUTO} when unset. */
    public ProviderType effectiveProviderType() {
        return providerType == null ? ProviderType.AUTO : providerType;
    }

    public boolean jwtValidationEnabled() {
        return jwt != null && jwt.isEnabled();
    }

    public Duration refreshBuffer() {
        return Duration.ofSeconds(refreshBufferSeconds);
    }

    public boolean hasClientSecret() {
        return clientSecret != null && !clientSecret.isEmpty();
    }

    /**
     * Copy without the client secret, for holders that must not keep it in clear text.
     */
    public ServerConfig withoutSecret() {
        return toBuilder().clientSecret(null).build();
    }
}

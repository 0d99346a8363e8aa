package com.dicomweb.oauth.config;

import com.dicomweb.oauth.error.ConfigurationException;
import lombok.Getter;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

@Getter
public enum ProviderType {
    GENERIC("generic"),
    AZURE("azure"),
    AZURE_MANAGED_IDENTITY("azure-managed-identity"),
    GOOGLE("google"),
    AWS("aws"),
    KEYCLOAK("keycloak"),
    AUTO("auto");

    private final String configName;

    ProviderType(String configName) {
        this.configName = configName;
    }

    /**
     * Providers that obtain tokens from a platform identity instead of a stored client secret.
     */
    public boolean usesPlatformIdentity() {
        return this == AZURE_MANAGED_IDENTITY || this == AWS;
    }

    /**
     * Parses a configured provider name. Separators and case are ignored, so
     * {@code azure-managed-identity}, {@code azure_managed_identity} and
     * {@code AzureManagedIdentity} are the same provider.
     */
    public static ProviderType fromConfigName(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        String wanted = squash(value);
        for (ProviderType type : values()) {
            if (squash(type.configName).equals(wanted)) {
                return type;
            }
        }
        throw new ConfigurationException("Unknown provider type '" + value + "'. Supported: "
            + Arrays.stream(values()).map(ProviderType::getConfigName).collect(Collectors.joining(", ")));
    }

    private static String squash(String value) {
        return value.replaceAll("[-_\\s]", "").toLowerCase(Locale.ROOT);
    }
}

package com.dicomweb.oauth.provider;

import com.dicomweb.oauth.config.ProviderType;
import com.dicomweb.oauth.config.ServerConfig;

/**
 * Azure AD (Entra ID) client credentials. Without a configured endpoint the tenant's v2.0
 * endpoint is used, and a resource given as scope gets the {@code /.default} suffix the
 * v2.0 endpoint requires for this grant.
 */
public class AzureAdTokenProvider extends ClientCredentialsTokenProvider {

    public static final String AUTHORITY = "https://login.microsoftonline.com/";
    public static final String DEFAULT_TENANT = "common";

    public AzureAdTokenProvider(ServerConfig config, ProviderContext context) {
        super(config, context);
    }

    @Override
    public ProviderType type() {
        return ProviderType.AZURE;
    }

    @Override
    protected String resolveTokenEndpoint(ServerConfig config) {
        if (config.getTokenEndpoint() != null && !config.getTokenEndpoint().isBlank()) {
            return config.getTokenEndpoint();
        }
        String tenant = config.getTenantId() == null || config.getTenantId().isBlank()
            ? DEFAULT_TENANT
            : config.getTenantId().trim();
        return AUTHORITY + tenant + "/oauth2/v2.0/token";
    }

    @Override
    protected String resolveScope(ServerConfig config) {
        return defaultScope(super.resolveScope(config));
    }

    /**
     * {@code https://dicom.healthcareapis.azure.com} becomes
     * {@code https://dicom.healthcareapis.azure.com/.default}; scope lists and scopes that
     * already end in {@code .default} are left alone.
     */
    static String defaultScope(String scope) {
        if (scope == null || scope.contains(" ") || scope.endsWith(".default")) {
            return scope;
        }
        if (scope.startsWith("https://") || scope.startsWith("http://") || scope.startsWith("api://")) {
            String resource = scope.endsWith("/") ? scope.substring(0, scope.length() - 1) : scope;
            if (resource.indexOf('/', resource.indexOf("//") + 2) < 0) {
                return resource + "/.default";
            }
        }
        return scope;
    }
}

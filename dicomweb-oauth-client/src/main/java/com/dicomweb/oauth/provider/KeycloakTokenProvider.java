package com.dicomweb.oauth.provider;

import com.dicomweb.oauth.config.ProviderType;
import com.dicomweb.oauth.config.ServerConfig;

/**
 * Client credentials against a Keycloak realm. A bare realm URL
 * ({@code https://kc/realms/pacs}) is completed to the realm's token endpoint.
 */
public class KeycloakTokenProvider extends ClientCredentialsTokenProvider {

    static final String TOKEN_PATH = "/protocol/openid-connect/token";

    public KeycloakTokenProvider(ServerConfig config, ProviderContext context) {
        super(config, context);
    }

    @Override
    public ProviderType type() {
        return ProviderType.KEYCLOAK;
    }

    @Override
    protected String resolveTokenEndpoint(ServerConfig config) {
        String endpoint = super.resolveTokenEndpoint(config).trim();
        while (endpoint.endsWith("/")) {
            endpoint = endpoint.substring(0, endpoint.length() - 1);
        }
        int realms = endpoint.lastIndexOf("/realms/");
        if (realms >= 0 && endpoint.indexOf('/', realms + "/realms/".length()) < 0) {
            return endpoint + TOKEN_PATH;
        }
        return endpoint;
    }
}

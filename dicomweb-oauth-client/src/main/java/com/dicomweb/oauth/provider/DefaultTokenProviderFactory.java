package com.dicomweb.oauth.provider;

import com.dicomweb.oauth.config.ProviderType;
import com.dicomweb.oauth.config.ServerConfig;
import com.dicomweb.oauth.error.ConfigurationException;
import com.dicomweb.oauth.error.ErrorCode;

/**
 * Maps each provider type to its implementation, resolving {@code auto} first.
 */
public class DefaultTokenProviderFactory implements TokenProviderFactory {

    private final ProviderContext context;
    private final ProviderDetector detector;

    public DefaultTokenProviderFactory(ProviderContext context) {
        this(context, new ProviderDetector());
    }

    public DefaultTokenProviderFactory(ProviderContext context, ProviderDetector detector) {
        this.context = context;
        this.detector = detector;
    }

    @Override
    public TokenProvider create(ServerConfig config) {
        ProviderType type = config.effectiveProviderType();
        if (type == ProviderType.AUTO) {
            type = detector.detect(config);
        }
        return switch (type) {
            case GENERIC -> new ClientCredentialsTokenProvider(config, context);
            case AZURE -> new AzureAdTokenProvider(config, context);
            case AZURE_MANAGED_IDENTITY -> new AzureManagedIdentityTokenProvider(config, context);
            case GOOGLE -> new GoogleTokenProvider(config, context);
            case AWS -> new AwsTokenProvider(config, context);
            case KEYCLOAK -> new KeycloakTokenProvider(config, context);
            case AUTO -> throw new ConfigurationException(ErrorCode.CONFIG_INVALID_VALUE, config.getName(),
                "provider detection did not resolve a concrete type");
        };
    }
}

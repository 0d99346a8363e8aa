package com.dicomweb.oauth.provider;

import com.dicomweb.oauth.config.ClientAuthMethod;
import com.dicomweb.oauth.config.ProviderType;
import com.dicomweb.oauth.config.ServerConfig;
import com.dicomweb.oauth.error.ConfigurationException;
import com.dicomweb.oauth.error.ErrorCode;
import com.dicomweb.oauth.security.SealedSecret;
import com.dicomweb.oauth.security.SecretRedactor;
import com.dicomweb.oauth.security.SecretVault;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * OAuth2 client credentials grant: a form-encoded POST of {@code grant_type=client_credentials}
 * with the client id, secret and optional scope. The secret stays sealed in the vault
 * except for the duration of a request.
 */
@Slf4j
public class ClientCredentialsTokenProvider implements TokenProvider {

    protected final String serverName;
    protected final String clientId;
    protected final String scope;
    protected final TokenEndpointClient endpointClient;
    protected final SecretVault vault;
    private final URI tokenEndpoint;
    private final SealedSecret clientSecret;
    private final ClientAuthMethod authMethod;

    public ClientCredentialsTokenProvider(ServerConfig config, ProviderContext context) {
        this.serverName = config.getName();
        this.vault = context.getVault();
        this.clientId = config.getClientId();
        this.clientSecret = config.hasClientSecret() ? vault.seal(config.getClientSecret()) : null;
        this.scope = resolveScope(config);
        this.authMethod = config.getClientAuthMethod();
        this.tokenEndpoint = toUri(serverName, resolveTokenEndpoint(config));
        this.endpointClient = new TokenEndpointClient(config, type(), context);
    }

    @Override
    public ProviderType type() {
        return ProviderType.GENERIC;
    }

    public URI tokenEndpoint() {
        return tokenEndpoint;
    }

    public String scope() {
        return scope;
    }

    /**
     * The endpoint to POST to. Subclasses derive it from provider-specific settings when
     * none is configured.
     */
    protected String resolveTokenEndpoint(ServerConfig config) {
        if (config.getTokenEndpoint() == null || config.getTokenEndpoint().isBlank()) {
            throw ConfigurationException.missing(config.getName(), "TokenEndpoint");
        }
        return config.getTokenEndpoint();
    }

    protected String resolveScope(ServerConfig config) {
        return config.getScope() == null || config.getScope().isBlank() ? null : config.getScope().trim();
    }

    @Override
    public TokenResponse acquire() {
        if (clientId == null || clientSecret == null) {
            throw new ConfigurationException(ErrorCode.CONFIG_MISSING_KEY, serverName,
                type().getConfigName() + " provider needs ClientId and ClientSecret");
        }
        String secret = vault.open(clientSecret);

        Map<String, String> form = new LinkedHashMap<>();
        Map<String, String> headers = new LinkedHashMap<>();
        form.put("grant_type", "client_credentials");
        if (authMethod == ClientAuthMethod.CLIENT_SECRET_BASIC) {
            String basic = Base64.getEncoder().encodeToString(
                (urlEncode(clientId) + ":" + urlEncode(secret)).getBytes(StandardCharsets.UTF_8));
            headers.put("Authorization", "Basic " + basic);
        } else {
            form.put("client_id", clientId);
            form.put("client_secret", secret);
        }
        if (scope != null) {
            form.put("scope", scope);
        }

        log.info("Requesting {} token for server '{}' from {} (client_id={}, client_secret={})",
            type().getConfigName(), serverName, tokenEndpoint, clientId, SecretRedactor.maskSecret(secret));
        return endpointClient.postForm(tokenEndpoint, form, headers, secret);
    }

    static URI toUri(String serverName, String value) {
        try {
            return new URI(value.trim());
        } catch (URISyntaxException e) {
            throw new ConfigurationException(ErrorCode.CONFIG_INVALID_VALUE, serverName, "malformed URL " + value, e);
        }
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}

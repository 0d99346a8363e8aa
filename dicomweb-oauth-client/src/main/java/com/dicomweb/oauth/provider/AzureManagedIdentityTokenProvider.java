package com.dicomweb.oauth.provider;

import com.dicomweb.oauth.config.ProviderType;
import com.dicomweb.oauth.config.ServerConfig;
import com.dicomweb.oauth.error.ConfigurationException;
import com.dicomweb.oauth.error.ErrorCode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tokens from the Azure platform identity, no client secret involved. Configured
 * {@code ClientId}/{@code ClientSecret} are ignored; a user-assigned identity is picked
 * through {@code AZURE_CLIENT_ID}. The source is chosen from the environment, in order:
 * <ol>
 *   <li>workload identity federation ({@code AZURE_FEDERATED_TOKEN_FILE}, {@code AZURE_CLIENT_ID},
 *       {@code AZURE_TENANT_ID}): the projected service account token is exchanged as a client
 *       assertion at the tenant's token endpoint;</li>
 *   <li>App Service / Functions ({@code IDENTITY_ENDPOINT}, {@code IDENTITY_HEADER});</li>
 *   <li>the instance metadata service.</li>
 * </ol>
 */
@Slf4j
public class AzureManagedIdentityTokenProvider implements TokenProvider {

    public static final String DEFAULT_SCOPE = "https://dicom.healthcareapis.azure.com/.default";
    public static final String IMDS_ENDPOINT = "http://169.254.169.254/metadata/identity/oauth2/token";
    static final String IMDS_API_VERSION = "2018-02-01";
    static final String APP_SERVICE_API_VERSION = "2019-08-01";
    static final String CLIENT_ASSERTION_TYPE = "urn:ietf:params:oauth:client-assertion-type:jwt-bearer";

    enum Source { WORKLOAD_IDENTITY, APP_SERVICE, IMDS }

    private final String serverName;
    private final String scope;
    private final String metadataEndpoint;
    private final ProviderContext context;
    private final TokenEndpointClient endpointClient;

    public AzureManagedIdentityTokenProvider(ServerConfig config, ProviderContext context) {
        this.serverName = config.getName();
        this.scope = config.getScope() == null || config.getScope().isBlank()
            ? DEFAULT_SCOPE
            : AzureAdTokenProvider.defaultScope(config.getScope().trim());
        this.metadataEndpoint = config.getMetadataEndpoint();
        this.context = context;
        this.endpointClient = new TokenEndpointClient(config, type(), context);
        if (config.hasClientSecret()) {
            log.warn("Server '{}' uses managed identity; the configured client secret is ignored", serverName);
        }
        log.info("Managed identity for server '{}' will request scope {} via {}", serverName, scope, source());
    }

    @Override
    public ProviderType type() {
        return ProviderType.AZURE_MANAGED_IDENTITY;
    }

    Source source() {
        if (context.env("AZURE_FEDERATED_TOKEN_FILE") != null
            && context.env("AZURE_CLIENT_ID") != null
            && context.env("AZURE_TENANT_ID") != null) {
            return Source.WORKLOAD_IDENTITY;
        }
        if (context.env("IDENTITY_ENDPOINT") != null && context.env("IDENTITY_HEADER") != null) {
            return Source.APP_SERVICE;
        }
        return Source.IMDS;
    }

    /**
     * The v1 resource the identity endpoints expect, i.e. the scope without {@code /.default}.
     */
    String resource() {
        return scope.endsWith("/.default") ? scope.substring(0, scope.length() - "/.default".length()) : scope;
    }

    @Override
    public TokenResponse acquire() {
        return switch (source()) {
            case WORKLOAD_IDENTITY -> acquireWithFederatedToken();
            case APP_SERVICE -> acquireFromAppService();
            case IMDS -> acquireFromImds();
        };
    }

    private TokenResponse acquireWithFederatedToken() {
        String tenant = context.env("AZURE_TENANT_ID");
        String authority = context.env("AZURE_AUTHORITY_HOST");
        if (authority == null) {
            authority = AzureAdTokenProvider.AUTHORITY;
        } else if (!authority.endsWith("/")) {
            authority = authority + "/";
        }
        Path tokenFile = Path.of(context.env("AZURE_FEDERATED_TOKEN_FILE"));
        String assertion;
        try {
            assertion = Files.readString(tokenFile).trim();
        } catch (IOException e) {
            throw new ConfigurationException(ErrorCode.CONFIG_INVALID_VALUE, serverName,
                "cannot read federated token file " + tokenFile, e);
        }

        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "client_credentials");
        form.put("client_id", context.env("AZURE_CLIENT_ID"));
        form.put("scope", scope);
        form.put("client_assertion_type", CLIENT_ASSERTION_TYPE);
        form.put("client_assertion", assertion);

        URI endpoint = ClientCredentialsTokenProvider.toUri(serverName, authority + tenant + "/oauth2/v2.0/token");
        log.info("Requesting workload identity token for server '{}' from {}", serverName, endpoint);
        return endpointClient.postForm(endpoint, form, Map.of(), assertion);
    }

    private TokenResponse acquireFromAppService() {
        String identityHeader = context.env("IDENTITY_HEADER");
        URI endpoint = query(context.env("IDENTITY_ENDPOINT"), APP_SERVICE_API_VERSION);
        log.info("Requesting App Service managed identity token for server '{}'", serverName);
        return endpointClient.getToken(endpoint, Map.of("X-IDENTITY-HEADER", identityHeader), identityHeader);
    }

    private TokenResponse acquireFromImds() {
        String base = metadataEndpoint != null ? metadataEndpoint : IMDS_ENDPOINT;
        URI endpoint = query(base, IMDS_API_VERSION);
        log.info("Requesting managed identity token for server '{}' from instance metadata", serverName);
        return endpointClient.getToken(endpoint, Map.of("Metadata", "true"));
    }

    private URI query(String base, String apiVersion) {
        StringBuilder url = new StringBuilder(base)
            .append(base.contains("?") ? '&' : '?')
            .append("api-version=").append(apiVersion)
            .append("&resource=").append(URLEncoder.encode(resource(), StandardCharsets.UTF_8));
        String clientId = context.env("AZURE_CLIENT_ID");
        if (clientId != null) {
            url.append("&client_id=").append(URLEncoder.encode(clientId, StandardCharsets.UTF_8));
        }
        return ClientCredentialsTokenProvider.toUri(serverName, url.toString());
    }
}

package com.dicomweb.oauth.provider;

import com.dicomweb.oauth.config.ProviderType;
import com.dicomweb.oauth.config.ServerConfig;
import com.dicomweb.oauth.error.ConfigurationException;
import com.dicomweb.oauth.error.ErrorCode;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Temporary credentials of the AWS platform identity, used as the bearer value.
 * <p>
 * On ECS (or any host exporting {@code AWS_CONTAINER_CREDENTIALS_*_URI}) the container
 * credentials endpoint is queried; elsewhere the EC2 instance metadata service is used
 * with an IMDSv2 session token. The session token of the returned credentials is the
 * bearer value and its {@code Expiration} drives the refresh. Request signing is not done here.
 */
@Slf4j
public class AwsTokenProvider implements TokenProvider {

    public static final String IMDS_BASE = "http://169.254.169.254";
    public static final String ECS_BASE = "http://169.254.170.2";
    static final String IMDS_TOKEN_PATH = "/latest/api/token";
    static final String IMDS_CREDENTIALS_PATH = "/latest/meta-data/iam/security-credentials/";
    static final String IMDS_TOKEN_TTL_SECONDS = "21600";

    private final String serverName;
    private final String metadataBase;
    private final ProviderContext context;
    private final Clock clock;
    private final TokenEndpointClient endpointClient;

    public AwsTokenProvider(ServerConfig config, ProviderContext context) {
        this.serverName = config.getName();
        String base = config.getMetadataEndpoint() != null ? config.getMetadataEndpoint() : IMDS_BASE;
        this.metadataBase = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        this.context = context;
        this.clock = context.getClock();
        this.endpointClient = new TokenEndpointClient(config, type(), context);
        if (config.hasClientSecret()) {
            log.warn("Server '{}' uses the AWS platform identity; the configured client secret is ignored", serverName);
        }
    }

    @Override
    public ProviderType type() {
        return ProviderType.AWS;
    }

    @Override
    public TokenResponse acquire() {
        URI containerEndpoint = containerCredentialsUri();
        JsonNode credentials = containerEndpoint != null
            ? fromContainer(containerEndpoint)
            : fromInstanceMetadata();
        return toTokenResponse(credentials);
    }

    URI containerCredentialsUri() {
        String full = context.env("AWS_CONTAINER_CREDENTIALS_FULL_URI");
        if (full != null) {
            return ClientCredentialsTokenProvider.toUri(serverName, full);
        }
        String relative = context.env("AWS_CONTAINER_CREDENTIALS_RELATIVE_URI");
        if (relative != null) {
            return ClientCredentialsTokenProvider.toUri(serverName,
                ECS_BASE + (relative.startsWith("/") ? relative : "/" + relative));
        }
        return null;
    }

    private JsonNode fromContainer(URI endpoint) {
        Map<String, String> headers = new LinkedHashMap<>();
        String authorization = containerAuthorization();
        if (authorization != null) {
            headers.put("Authorization", authorization);
        }
        log.info("Requesting container credentials for server '{}'", serverName);
        HttpRequest request = endpointClient.newRequest(endpoint, headers).GET().build();
        return endpointClient.readJson(endpointClient.send(request, authorization));
    }

    private String containerAuthorization() {
        String token = context.env("AWS_CONTAINER_AUTHORIZATION_TOKEN");
        if (token != null) {
            return token;
        }
        String tokenFile = context.env("AWS_CONTAINER_AUTHORIZATION_TOKEN_FILE");
        if (tokenFile == null) {
            return null;
        }
        try {
            return Files.readString(Path.of(tokenFile)).trim();
        } catch (IOException e) {
            throw new ConfigurationException(ErrorCode.CONFIG_INVALID_VALUE, serverName,
                "cannot read container authorization token file " + tokenFile, e);
        }
    }

    private JsonNode fromInstanceMetadata() {
        log.info("Requesting instance profile credentials for server '{}' from {}", serverName, metadataBase);
        HttpRequest tokenRequest = endpointClient
            .newRequest(URI.create(metadataBase + IMDS_TOKEN_PATH),
                Map.of("X-aws-ec2-metadata-token-ttl-seconds", IMDS_TOKEN_TTL_SECONDS))
            .PUT(HttpRequest.BodyPublishers.noBody())
            .build();
        String sessionToken = endpointClient.send(tokenRequest).trim();
        Map<String, String> headers = Map.of("X-aws-ec2-metadata-token", sessionToken);

        HttpRequest roleRequest = endpointClient
            .newRequest(URI.create(metadataBase + IMDS_CREDENTIALS_PATH), headers).GET().build();
        String role = endpointClient.send(roleRequest, sessionToken).lines()
            .map(String::trim)
            .filter(line -> !line.isEmpty())
            .findFirst()
            .orElseThrow(() -> endpointClient.failure(ErrorCode.TOKEN_INVALID_RESPONSE,
                "instance has no IAM role attached", null));

        HttpRequest credentialsRequest = endpointClient
            .newRequest(URI.create(metadataBase + IMDS_CREDENTIALS_PATH + role), headers).GET().build();
        return endpointClient.readJson(endpointClient.send(credentialsRequest, sessionToken));
    }

    private TokenResponse toTokenResponse(JsonNode credentials) {
        JsonNode token = credentials.get("Token");
        if (token == null || !token.isTextual() || token.asText().isEmpty()) {
            throw endpointClient.failure(ErrorCode.TOKEN_INVALID_RESPONSE, "credentials have no session Token", null);
        }

        long expiresIn = TokenEndpointClient.DEFAULT_EXPIRES_IN_SECONDS;
        JsonNode expiration = credentials.get("Expiration");
        if (expiration != null && expiration.isTextual()) {
            try {
                expiresIn = Instant.parse(expiration.asText()).getEpochSecond() - clock.instant().getEpochSecond();
            } catch (DateTimeParseException e) {
                throw endpointClient.failure(ErrorCode.TOKEN_INVALID_RESPONSE,
                    "unparseable Expiration " + expiration.asText(), e);
            }
        }
        if (expiresIn <= 0) {
            throw endpointClient.failure(ErrorCode.TOKEN_INVALID_RESPONSE, "credentials already expired", null);
        }
        if (expiresIn > TokenResponse.MAX_EXPIRES_IN_SECONDS) {
            throw endpointClient.failure(ErrorCode.TOKEN_INVALID_RESPONSE,
                "Expiration " + expiration.asText() + " is out of range", null);
        }
        return new TokenResponse(token.asText(), expiresIn, TokenResponse.BEARER);
    }
}

package com.dicomweb.oauth.config;

import com.dicomweb.oauth.error.ConfigurationException;
import com.dicomweb.oauth.error.ErrorCode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Binds the {@code DicomWebOAuth} configuration section. Values are expected to be
 * fully resolved already; no environment substitution happens here.
 *
 * <pre>
 * "DicomWebOAuth": {
 *   "RateLimitRequests": 10,
 *   "RateLimitWindowSeconds": 60,
 *   "Servers": {
 *     "pacs": { "Url": "...", "TokenEndpoint": "...", "ClientId": "...", "ClientSecret": "..." }
 *   }
 * }
 * </pre>
 */
@Slf4j
public class OAuthSettingsReader {

    public static final String SECTION = "DicomWebOAuth";

    private final ObjectMapper mapper;

    public OAuthSettingsReader() {
        this(new ObjectMapper());
    }

    public OAuthSettingsReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public OAuthSettings read(Path file) {
        try {
            return read(mapper.readTree(Files.readString(file)));
        } catch (IOException e) {
            throw new ConfigurationException(ErrorCode.CONFIG_INVALID_VALUE, null,
                "cannot read configuration file " + file, e);
        }
    }

    public OAuthSettings read(String json) {
        try {
            return read(mapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new ConfigurationException(ErrorCode.CONFIG_INVALID_VALUE, null,
                "configuration is not valid JSON", e);
        }
    }

    /**
     * Accepts either the whole host configuration or just the {@code DicomWebOAuth} section.
     */
    public OAuthSettings read(JsonNode root) {
        JsonNode section = root.has(SECTION) ? root.get(SECTION) : root;
        JsonNode servers = section.get("Servers");
        if (servers == null || !servers.isObject()) {
            throw ConfigurationException.missing(null, SECTION + ".Servers");
        }

        List<ServerConfig> configs = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = servers.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            configs.add(readServer(field.getKey(), field.getValue()));
        }

        RateLimiterSettings.RateLimiterSettingsBuilder rateLimiter = RateLimiterSettings.builder();
        if (section.hasNonNull("RateLimitRequests")) {
            rateLimiter.maxRequests(section.get("RateLimitRequests").asInt());
        }
        if (section.hasNonNull("RateLimitWindowSeconds")) {
            rateLimiter.windowSeconds(section.get("RateLimitWindowSeconds").asLong());
        }

        log.info("Read OAuth configuration for {} server(s)", configs.size());
        return new OAuthSettings(List.copyOf(configs), rateLimiter.build());
    }

    private ServerConfig readServer(String name, JsonNode node) {
        ServerConfig.ServerConfigBuilder builder = ServerConfig.builder()
            .name(name)
            .baseUrl(text(node, "Url"))
            .providerType(ProviderType.fromConfigName(text(node, "ProviderType")))
            .tokenEndpoint(text(node, "TokenEndpoint"))
            .clientId(text(node, "ClientId"))
            .clientSecret(text(node, "ClientSecret"))
            .scope(text(node, "Scope"))
            .tenantId(text(node, "TenantId"))
            .metadataEndpoint(text(node, "MetadataEndpoint"))
            .sslVerification(sslVerification(name, node.get("VerifySSL")));

        if (node.hasNonNull("TokenRefreshBufferSeconds")) {
            builder.refreshBufferSeconds(node.get("TokenRefreshBufferSeconds").asLong());
        }
        if (node.hasNonNull("RequestTimeoutSeconds")) {
            builder.requestTimeout(Duration.ofSeconds(node.get("RequestTimeoutSeconds").asLong()));
        }
        if (node.hasNonNull("ServiceAccountKeyFile")) {
            builder.serviceAccountKeyFile(Path.of(node.get("ServiceAccountKeyFile").asText()));
        }
        if ("basic".equalsIgnoreCase(text(node, "ClientAuthMethod"))) {
            builder.clientAuthMethod(ClientAuthMethod.CLIENT_SECRET_BASIC);
        }

        String publicKey = text(node, "JWTPublicKey");
        if (publicKey != null) {
            JwtSettings.JwtSettingsBuilder jwt = JwtSettings.builder()
                .publicKeyPem(publicKey)
                .audience(text(node, "JWTAudience"))
                .issuer(text(node, "JWTIssuer"));
            JsonNode algorithms = node.get("JWTAlgorithms");
            if (algorithms != null && algorithms.isArray()) {
                algorithms.forEach(a -> jwt.allowedAlgorithm(a.asText()));
            } else if (algorithms != null && algorithms.isTextual()) {
                jwt.allowedAlgorithm(algorithms.asText());
            }
            builder.jwt(jwt.build());
        }
        return builder.build();
    }

    private static SslVerification sslVerification(String server, JsonNode node) {
        if (node == null || node.isNull()) {
            return SslVerification.ENABLED;
        }
        if (node.isBoolean()) {
            if (!node.asBoolean()) {
                log.warn("TLS verification disabled for server '{}'", server);
                return SslVerification.DISABLED;
            }
            return SslVerification.ENABLED;
        }
        String value = node.asText();
        if (value.equalsIgnoreCase("true")) {
            return SslVerification.ENABLED;
        }
        if (value.equalsIgnoreCase("false")) {
            log.warn("TLS verification disabled for server '{}'", server);
            return SslVerification.DISABLED;
        }
        return SslVerification.caBundle(Path.of(value));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}

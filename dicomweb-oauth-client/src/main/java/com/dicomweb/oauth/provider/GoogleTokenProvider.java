package com.dicomweb.oauth.provider;

import com.dicomweb.oauth.config.ProviderType;
import com.dicomweb.oauth.config.ServerConfig;
import com.dicomweb.oauth.error.ConfigurationException;
import com.dicomweb.oauth.error.ErrorCode;
import com.dicomweb.oauth.jwt.key.PemKeyLoader;
import com.dicomweb.oauth.security.SealedSecret;
import com.fasterxml.jackson.databind.JsonNode;
import io.jsonwebtoken.Jwts;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.PrivateKey;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Google OAuth2. With a service-account key file the provider signs a JWT bearer assertion
 * (RFC 7523) with the account's private key; otherwise it falls back to client credentials
 * against {@value #DEFAULT_TOKEN_ENDPOINT}.
 */
@Slf4j
public class GoogleTokenProvider extends ClientCredentialsTokenProvider {

    public static final String DEFAULT_TOKEN_ENDPOINT = "https://oauth2.googleapis.com/token";
    public static final String HEALTHCARE_SCOPE = "https://www.googleapis.com/auth/cloud-healthcare";
    static final String JWT_BEARER_GRANT = "urn:ietf:params:oauth:grant-type:jwt-bearer";
    static final long ASSERTION_TTL_SECONDS = 3600;

    private final ServiceAccount serviceAccount;
    private final Clock clock;

    public GoogleTokenProvider(ServerConfig config, ProviderContext context) {
        super(config, context);
        this.clock = context.getClock();
        this.serviceAccount = config.getServiceAccountKeyFile() == null
            ? null
            : ServiceAccount.load(config, context);
        if (scope != null && !scope.contains("googleapis.com/auth/cloud-healthcare")
            && !scope.contains("googleapis.com/auth/cloud-platform")) {
            log.warn("Scope '{}' for server '{}' may not grant Cloud Healthcare API access, recommended: {}",
                scope, serverName, HEALTHCARE_SCOPE);
        }
    }

    @Override
    public ProviderType type() {
        return ProviderType.GOOGLE;
    }

    @Override
    protected String resolveTokenEndpoint(ServerConfig config) {
        return config.getTokenEndpoint() == null || config.getTokenEndpoint().isBlank()
            ? DEFAULT_TOKEN_ENDPOINT
            : config.getTokenEndpoint();
    }

    @Override
    protected String resolveScope(ServerConfig config) {
        String scope = super.resolveScope(config);
        return scope == null ? HEALTHCARE_SCOPE : scope;
    }

    public boolean usesServiceAccount() {
        return serviceAccount != null;
    }

    @Override
    public TokenResponse acquire() {
        if (serviceAccount == null) {
            return super.acquire();
        }
        URI audience = serviceAccount.tokenUri() != null ? serviceAccount.tokenUri() : tokenEndpoint();
        String assertion = signAssertion(audience);

        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", JWT_BEARER_GRANT);
        form.put("assertion", assertion);

        log.info("Requesting google token for server '{}' as service account {}", serverName, serviceAccount.clientEmail());
        return endpointClient.postForm(audience, form, Map.of(), assertion);
    }

    String signAssertion(URI audience) {
        Instant now = clock.instant();
        PrivateKey privateKey = PemKeyLoader.loadPrivateKey(vault.open(serviceAccount.privateKeyPem()));

        var builder = Jwts.builder();
        if (serviceAccount.privateKeyId() != null) {
            builder.header().keyId(serviceAccount.privateKeyId()).and();
        }
        return builder
            .issuer(serviceAccount.clientEmail())
            .audience().add(audience.toString()).and()
            .issuedAt(Date.from(now))
            .expiration(Date.from(now.plusSeconds(ASSERTION_TTL_SECONDS)))
            .claim("scope", scope)
            .signWith(privateKey, Jwts.SIG.RS256)
            .compact();
    }

    record ServiceAccount(String clientEmail, String privateKeyId, SealedSecret privateKeyPem, URI tokenUri) {

        static ServiceAccount load(ServerConfig config, ProviderContext context) {
            Path file = config.getServiceAccountKeyFile();
            JsonNode json;
            try {
                json = context.getMapper().readTree(Files.readString(file));
            } catch (IOException e) {
                throw new ConfigurationException(ErrorCode.CONFIG_INVALID_VALUE, config.getName(),
                    "cannot read service account key file " + file, e);
            }
            String clientEmail = text(json, "client_email");
            String privateKey = text(json, "private_key");
            if (clientEmail == null || privateKey == null) {
                throw new ConfigurationException(ErrorCode.CONFIG_INVALID_VALUE, config.getName(),
                    "service account key file " + file + " lacks client_email or private_key");
            }
            try {
                PemKeyLoader.loadPrivateKey(privateKey);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(ErrorCode.CONFIG_INVALID_VALUE, config.getName(),
                    "service account private key is unusable", e);
            }
            String tokenUri = text(json, "token_uri");
            return new ServiceAccount(
                clientEmail,
                text(json, "private_key_id"),
                context.getVault().seal(privateKey),
                tokenUri == null ? null : toUri(config.getName(), tokenUri));
        }

        private static String text(JsonNode json, String field) {
            JsonNode value = json.get(field);
            return value == null || value.isNull() ? null : value.asText();
        }
    }
}

package com.dicomweb.oauth.jwt;

import com.dicomweb.oauth.config.JwtSettings;
import com.dicomweb.oauth.error.ConfigurationException;
import com.dicomweb.oauth.error.ErrorCode;
import com.dicomweb.oauth.error.TokenValidationException;
import com.dicomweb.oauth.error.ValidationFailure;
import com.dicomweb.oauth.jwt.key.PemKeyLoader;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.PrematureJwtException;
import io.jsonwebtoken.security.SecurityException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.PublicKey;
import java.time.Clock;
import java.util.Base64;
import java.util.Date;
import java.util.Set;

/**
 * Checks a bearer token before it is trusted and cached.
 * <ol>
 *   <li>the header's {@code alg} must be in the allow-list, read before anything else is trusted;</li>
 *   <li>the signature must verify against the configured public key;</li>
 *   <li>{@code exp} must be in the future and {@code nbf}, when present, in the past,
 *       both within the configured clock skew;</li>
 *   <li>{@code aud} must contain the expected audience and {@code iss} must equal the expected
 *       issuer, when those are configured.</li>
 * </ol>
 * The first failing check aborts with a {@link TokenValidationException} naming the reason.
 */
@Slf4j
public class JwtValidator {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PublicKey publicKey;
    private final String audience;
    private final String issuer;
    @Getter
    private final Set<String> allowedAlgorithms;
    private final long clockSkewSeconds;
    private final Clock clock;

    public JwtValidator(JwtSettings settings) {
        this(settings, Clock.systemUTC());
    }

    public JwtValidator(JwtSettings settings, Clock clock) {
        if (!settings.isEnabled()) {
            throw new ConfigurationException(ErrorCode.CONFIG_MISSING_KEY, null, "JWT validation needs a public key");
        }
        try {
            this.publicKey = PemKeyLoader.loadPublicKey(settings.getPublicKeyPem());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(ErrorCode.CONFIG_INVALID_VALUE, null, "unusable JWT public key", e);
        }
        this.audience = settings.getAudience();
        this.issuer = settings.getIssuer();
        this.allowedAlgorithms = Set.copyOf(settings.effectiveAlgorithms());
        this.clockSkewSeconds = settings.getClockSkewSeconds();
        this.clock = clock;
    }

    public void validate(String token) {
        if (token == null || token.isBlank()) {
            throw new TokenValidationException(ValidationFailure.MALFORMED, "empty token");
        }

        String algorithm = headerAlgorithm(token);
        if (!allowedAlgorithms.contains(algorithm)) {
            log.warn("Rejected token signed with disallowed algorithm {}", algorithm);
            throw new TokenValidationException(ValidationFailure.DISALLOWED_ALGORITHM,
                "algorithm '" + algorithm + "' is not in " + allowedAlgorithms);
        }

        Claims claims;
        try {
            claims = Jwts.parser()
                .verifyWith(publicKey)
                .clock(() -> Date.from(clock.instant()))
                .clockSkewSeconds(clockSkewSeconds)
                .build()
                .parseSignedClaims(token)
                .getPayload();
        } catch (ExpiredJwtException e) {
            throw reject(ValidationFailure.EXPIRED, "token expired at " + e.getClaims().getExpiration().toInstant(), e);
        } catch (PrematureJwtException e) {
            throw reject(ValidationFailure.NOT_YET_VALID, "token not valid before " + e.getClaims().getNotBefore().toInstant(), e);
        } catch (SecurityException e) {
            throw reject(ValidationFailure.BAD_SIGNATURE, "signature verification failed", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw reject(ValidationFailure.MALFORMED, "token could not be parsed: " + e.getClass().getSimpleName(), e);
        }

        if (claims.getExpiration() == null) {
            throw reject(ValidationFailure.MALFORMED, "token has no exp claim", null);
        }
        if (audience != null) {
            Set<String> tokenAudience = claims.getAudience();
            if (tokenAudience == null || !tokenAudience.contains(audience)) {
                throw reject(ValidationFailure.WRONG_AUDIENCE, "audience " + tokenAudience + " does not contain " + audience, null);
            }
        }
        if (issuer != null && !issuer.equals(claims.getIssuer())) {
            throw reject(ValidationFailure.WRONG_ISSUER, "issuer '" + claims.getIssuer() + "' is not '" + issuer + "'", null);
        }

        log.debug("JWT validated (alg={}, iss={}, aud={})", algorithm, claims.getIssuer(), claims.getAudience());
    }

    private static String headerAlgorithm(String token) {
        int dot = token.indexOf('.');
        if (dot <= 0 || token.indexOf('.', dot + 1) < 0) {
            throw new TokenValidationException(ValidationFailure.MALFORMED, "not a compact JWS");
        }
        try {
            byte[] header = Base64.getUrlDecoder().decode(token.substring(0, dot));
            JsonNode alg = MAPPER.readTree(new String(header, StandardCharsets.UTF_8)).get("alg");
            if (alg == null || !alg.isTextual()) {
                throw new TokenValidationException(ValidationFailure.MALFORMED, "header has no alg");
            }
            return alg.asText();
        } catch (IllegalArgumentException | IOException e) {
            throw new TokenValidationException(ValidationFailure.MALFORMED, "header is not base64url JSON", e);
        }
    }

    private static TokenValidationException reject(ValidationFailure failure, String detail, Exception cause) {
        log.warn("JWT validation failed: {} ({})", failure, detail);
        return new TokenValidationException(failure, detail, cause);
    }
}

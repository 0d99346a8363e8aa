package com.dicomweb.oauth.jwt;

import com.dicomweb.oauth.MutableClock;
import com.dicomweb.oauth.TestKeys;
import com.dicomweb.oauth.config.JwtSettings;
import com.dicomweb.oauth.error.ConfigurationException;
import com.dicomweb.oauth.error.ErrorCode;
import com.dicomweb.oauth.error.TokenValidationException;
import com.dicomweb.oauth.error.ValidationFailure;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.Jwts;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class JwtValidatorTest {

    private static final String ISSUER = "https://idp.example.com/realms/pacs";
    private static final String AUDIENCE = "dicomweb";

    private static KeyPair signingKey;
    private static KeyPair otherKey;

    private MutableClock clock;
    private JwtValidator validator;

    @BeforeAll
    static void generateKeys() {
        signingKey = TestKeys.rsa();
        otherKey = TestKeys.rsa();
    }

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-06-01T12:00:00Z");
        validator = new JwtValidator(JwtSettings.builder()
            .publicKeyPem(TestKeys.publicPem(signingKey))
            .audience(AUDIENCE)
            .issuer(ISSUER)
            .build(), clock);
    }

    private JwtBuilder token() {
        Instant now = clock.instant();
        return Jwts.builder()
            .issuer(ISSUER)
            .audience().add(AUDIENCE).and()
            .subject("orthanc")
            .issuedAt(Date.from(now))
            .expiration(Date.from(now.plusSeconds(3600)));
    }

    private String signed(JwtBuilder builder) {
        return builder.signWith(signingKey.getPrivate(), Jwts.SIG.RS256).compact();
    }

    private ValidationFailure failureOf(String token) {
        TokenValidationException e = catchThrowableOfType(() -> validator.validate(token), TokenValidationException.class);
        assertThat(e).as("token should be rejected").isNotNull();
        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.TOKEN_VALIDATION_FAILED);
        return e.getFailure();
    }

    @Test
    @DisplayName("Should accept a correctly signed token with matching claims")
    void testValidate_Valid() {
        assertThatCode(() -> validator.validate(signed(token()))).doesNotThrowAnyException();
        assertThat(validator.getAllowedAlgorithms()).containsExactly("RS256");
    }

    @Test
    @DisplayName("Should reject each defect with its own failure reason")
    void testValidate_RejectionSet() {
        Instant now = clock.instant();
        String expired = signed(token().expiration(Date.from(now.minusSeconds(120))));
        String wrongAudience = signed(Jwts.builder()
            .issuer(ISSUER)
            .audience().add("someone-else").and()
            .expiration(Date.from(now.plusSeconds(3600))));
        String wrongIssuer = signed(token().issuer("https://evil.example.com"));
        String disallowedAlgorithm = token().signWith(TestKeys.ec().getPrivate(), Jwts.SIG.ES256).compact();
        String badSignature = token().signWith(otherKey.getPrivate(), Jwts.SIG.RS256).compact();

        List<ValidationFailure> failures = List.of(
            failureOf(expired),
            failureOf(wrongAudience),
            failureOf(wrongIssuer),
            failureOf(disallowedAlgorithm),
            failureOf(badSignature));

        assertThat(failures).containsExactly(
            ValidationFailure.EXPIRED,
            ValidationFailure.WRONG_AUDIENCE,
            ValidationFailure.WRONG_ISSUER,
            ValidationFailure.DISALLOWED_ALGORITHM,
            ValidationFailure.BAD_SIGNATURE);
        assertThat(EnumSet.copyOf(failures)).hasSize(5);
    }

    @Test
    @DisplayName("Should detect a payload altered after signing")
    void testValidate_TamperedPayload() {
        String[] parts = signed(token()).split("\\.");
        String payload = new String(Base64.getUrlDecoder().decode(parts[1]), StandardCharsets.UTF_8)
            .replace("orthanc", "admin");
        String tampered = parts[0] + "."
            + Base64.getUrlEncoder().withoutPadding().encodeToString(payload.getBytes(StandardCharsets.UTF_8))
            + "." + parts[2];

        assertThat(failureOf(tampered)).isEqualTo(ValidationFailure.BAD_SIGNATURE);
    }

    @Test
    @DisplayName("Should reject unsigned and HMAC tokens before verifying anything")
    void testValidate_NoneAndHmac() {
        String header = Base64.getUrlEncoder().withoutPadding()
            .encodeToString("{\"alg\":\"none\"}".getBytes(StandardCharsets.UTF_8));
        String payload = Base64.getUrlEncoder().withoutPadding()
            .encodeToString("{\"sub\":\"orthanc\"}".getBytes(StandardCharsets.UTF_8));
        String hmac = token().signWith(Jwts.SIG.HS256.key().build()).compact();

        assertThat(failureOf(header + "." + payload + ".")).isEqualTo(ValidationFailure.DISALLOWED_ALGORITHM);
        assertThat(failureOf(hmac)).isEqualTo(ValidationFailure.DISALLOWED_ALGORITHM);
    }

    @Test
    @DisplayName("Should honour the clock skew on exp and nbf")
    void testValidate_ClockSkew() {
        Instant now = clock.instant();

        assertThatCode(() -> validator.validate(signed(token().expiration(Date.from(now.minusSeconds(10))))))
            .doesNotThrowAnyException();
        assertThatCode(() -> validator.validate(signed(token().notBefore(Date.from(now.plusSeconds(10))))))
            .doesNotThrowAnyException();
        assertThat(failureOf(signed(token().notBefore(Date.from(now.plusSeconds(120))))))
            .isEqualTo(ValidationFailure.NOT_YET_VALID);
    }

    @Test
    @DisplayName("Should treat garbage and tokens without exp as malformed")
    void testValidate_Malformed() {
        assertThat(failureOf("not-a-jwt")).isEqualTo(ValidationFailure.MALFORMED);
        assertThat(failureOf("%%%.%%%.%%%")).isEqualTo(ValidationFailure.MALFORMED);
        assertThat(failureOf("")).isEqualTo(ValidationFailure.MALFORMED);
        assertThat(failureOf(signed(Jwts.builder().issuer(ISSUER).audience().add(AUDIENCE).and())))
            .isEqualTo(ValidationFailure.MALFORMED);
    }

    @Test
    @DisplayName("Should verify EC signatures when ES256 is allowed")
    void testValidate_EcKey() {
        KeyPair ec = TestKeys.ec();
        JwtValidator ecValidator = new JwtValidator(JwtSettings.builder()
            .publicKeyPem(TestKeys.publicPem(ec))
            .allowedAlgorithm("ES256")
            .build(), clock);

        assertThatCode(() -> ecValidator.validate(token().signWith(ec.getPrivate(), Jwts.SIG.ES256).compact()))
            .doesNotThrowAnyException();
        assertThat(ecValidator.getAllowedAlgorithms()).isEqualTo(Set.of("ES256"));
    }

    @Test
    @DisplayName("Should refuse settings without a usable public key")
    void testConstructor_InvalidKey() {
        assertThatThrownBy(() -> new JwtValidator(JwtSettings.builder().build()))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new JwtValidator(JwtSettings.builder()
            .publicKeyPem("-----BEGIN PUBLIC KEY-----\nAAAA\n-----END PUBLIC KEY-----").build()))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("Should attribute a failure to a server without losing its reason")
    void testForServer() {
        TokenValidationException e = new TokenValidationException(ValidationFailure.EXPIRED, "token expired");

        TokenValidationException attributed = e.forServer("pacs");

        assertThat(attributed.getServerName()).isEqualTo("pacs");
        assertThat(attributed.getFailure()).isEqualTo(ValidationFailure.EXPIRED);
        assertThat(attributed.getMessage()).isEqualTo("[TOK-004] server 'pacs': EXPIRED: token expired");
    }
}

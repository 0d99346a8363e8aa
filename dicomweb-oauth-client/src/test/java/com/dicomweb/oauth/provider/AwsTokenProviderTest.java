package com.dicomweb.oauth.provider;

import com.dicomweb.oauth.MutableClock;
import com.dicomweb.oauth.config.ProviderType;
import com.dicomweb.oauth.config.ServerConfig;
import com.dicomweb.oauth.error.ErrorCode;
import com.dicomweb.oauth.error.TokenAcquisitionException;
import com.dicomweb.oauth.security.SecretVault;
import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import java.util.HashMap;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.put;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class AwsTokenProviderTest {

    private static final String CREDENTIALS_PATH = "/latest/meta-data/iam/security-credentials/";

    @RegisterExtension
    static WireMockExtension metadata = WireMockExtension.newInstance()
        .options(wireMockConfig().dynamicPort())
        .build();

    private final SecretVault vault = new SecretVault();
    private final MutableClock clock = MutableClock.at("2024-06-01T12:00:00Z");
    private final Map<String, String> env = new HashMap<>();

    @AfterEach
    void tearDown() {
        vault.close();
    }

    private AwsTokenProvider provider(String metadataEndpoint) {
        ProviderContext context = ProviderContext.builder().vault(vault).clock(clock).environment(env::get).build();
        return new AwsTokenProvider(ServerConfig.builder()
            .name("aws")
            .baseUrl("https://dicom-medical-imaging.us-east-1.amazonaws.com")
            .providerType(ProviderType.AWS)
            .metadataEndpoint(metadataEndpoint)
            .build(), context);
    }

    private String credentials(String expiration) {
        return "{\"Code\":\"Success\",\"AccessKeyId\":\"ASIAEXAMPLE\",\"SecretAccessKey\":\"wJalrXUtnFEMI\","
            + "\"Token\":\"session-token-value\",\"Expiration\":\"" + expiration + "\"}";
    }

    @Test
    @DisplayName("Should walk the IMDSv2 session, role and credentials lookups")
    void testAcquire_InstanceMetadata() {
        // Given
        metadata.stubFor(put(urlEqualTo("/latest/api/token"))
            .withHeader("X-aws-ec2-metadata-token-ttl-seconds", equalTo("21600"))
            .willReturn(aResponse().withStatus(200).withBody("imds-session")));
        metadata.stubFor(get(urlEqualTo(CREDENTIALS_PATH))
            .withHeader("X-aws-ec2-metadata-token", equalTo("imds-session"))
            .willReturn(aResponse().withStatus(200).withBody("dicom-role\n")));
        metadata.stubFor(get(urlEqualTo(CREDENTIALS_PATH + "dicom-role"))
            .withHeader("X-aws-ec2-metadata-token", equalTo("imds-session"))
            .willReturn(okJson(credentials("2024-06-01T13:00:00Z"))));

        // When
        TokenResponse response = provider(metadata.getRuntimeInfo().getHttpBaseUrl()).acquire();

        // Then
        assertThat(response.accessToken()).isEqualTo("session-token-value");
        assertThat(response.expiresInSeconds()).isEqualTo(3600);
        assertThat(response.tokenType()).isEqualTo(TokenResponse.BEARER);
    }

    @Test
    @DisplayName("Should prefer the container credentials endpoint when one is exported")
    void testAcquire_ContainerCredentials() {
        env.put("AWS_CONTAINER_CREDENTIALS_FULL_URI", metadata.getRuntimeInfo().getHttpBaseUrl() + "/v2/credentials/task");
        env.put("AWS_CONTAINER_AUTHORIZATION_TOKEN", "ecs-auth-token");
        metadata.stubFor(get(urlEqualTo("/v2/credentials/task"))
            .withHeader("Authorization", equalTo("ecs-auth-token"))
            .willReturn(okJson(credentials("2024-06-01T12:30:00Z"))));

        TokenResponse response = provider(null).acquire();

        assertThat(response.accessToken()).isEqualTo("session-token-value");
        assertThat(response.expiresInSeconds()).isEqualTo(1800);
    }

    @Test
    @DisplayName("Should resolve a relative container URI against the ECS endpoint")
    void testContainerCredentialsUri_Relative() {
        env.put("AWS_CONTAINER_CREDENTIALS_RELATIVE_URI", "/v2/credentials/abc");

        assertThat(provider(null).containerCredentialsUri()).hasToString("http://169.254.170.2/v2/credentials/abc");
    }

    @Test
    @DisplayName("Should reject expired credentials and instances without a role")
    void testAcquire_Failures() {
        env.put("AWS_CONTAINER_CREDENTIALS_FULL_URI", metadata.getRuntimeInfo().getHttpBaseUrl() + "/v2/credentials/task");
        metadata.stubFor(get(urlEqualTo("/v2/credentials/task")).willReturn(okJson(credentials("2024-06-01T11:00:00Z"))));

        TokenAcquisitionException expired = catchThrowableOfType(() -> provider(null).acquire(),
            TokenAcquisitionException.class);
        assertThat(expired.getErrorCode()).isEqualTo(ErrorCode.TOKEN_INVALID_RESPONSE);
        assertThat(expired.getProviderType()).isEqualTo(ProviderType.AWS);

        metadata.stubFor(get(urlEqualTo("/v2/credentials/task")).willReturn(okJson(credentials("9999-12-31T23:59:59Z"))));
        TokenAcquisitionException farFuture = catchThrowableOfType(() -> provider(null).acquire(),
            TokenAcquisitionException.class);
        assertThat(farFuture.getErrorCode()).isEqualTo(ErrorCode.TOKEN_INVALID_RESPONSE);

        env.clear();
        metadata.stubFor(put(urlEqualTo("/latest/api/token")).willReturn(aResponse().withStatus(200).withBody("s")));
        metadata.stubFor(get(urlEqualTo(CREDENTIALS_PATH)).willReturn(aResponse().withStatus(404)));

        TokenAcquisitionException noRole = catchThrowableOfType(
            () -> provider(metadata.getRuntimeInfo().getHttpBaseUrl()).acquire(), TokenAcquisitionException.class);
        assertThat(noRole.getErrorCode()).isEqualTo(ErrorCode.TOKEN_ACQUISITION_FAILED);
        assertThat(noRole.getMessage()).contains("HTTP 404");
    }
}

package com.dicomweb.oauth.interceptor;

import com.dicomweb.oauth.TokenManager;
import com.dicomweb.oauth.config.ProviderType;
import com.dicomweb.oauth.config.ServerConfig;
import com.dicomweb.oauth.config.ServerRegistry;
import com.dicomweb.oauth.error.TokenAcquisitionException;
import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class OutboundRequestAuthorizerTest {

    @RegisterExtension
    static WireMockExtension remote = WireMockExtension.newInstance()
        .options(wireMockConfig().dynamicPort())
        .build();

    private TokenManager tokenManager;
    private OutboundRequestAuthorizer authorizer;
    private URI studies;

    @BeforeEach
    void setUp() {
        String base = remote.getRuntimeInfo().getHttpBaseUrl();
        ServerRegistry registry = ServerRegistry.of(List.of(ServerConfig.builder()
            .name("pacs")
            .baseUrl(base + "/dicom-web")
            .providerType(ProviderType.GENERIC)
            .tokenEndpoint(base + "/token")
            .clientId("orthanc")
            .clientSecret("orthanc-secret")
            .build()));
        tokenManager = new TokenManager(registry);
        authorizer = new OutboundRequestAuthorizer(tokenManager, registry);
        studies = URI.create(base + "/dicom-web/studies");
    }

    @AfterEach
    void tearDown() {
        tokenManager.close();
    }

    @Test
    @DisplayName("Should add the bearer token to requests for a configured server")
    void testAuthorize_ConfiguredServer() {
        remote.stubFor(post(urlEqualTo("/token")).willReturn(okJson("{\"access_token\":\"abc\",\"expires_in\":3600}")));

        HttpRequest request = authorizer.authorize(studies, HttpRequest.newBuilder(studies)).build();

        assertThat(authorizer.serverFor(studies)).contains("pacs");
        assertThat(request.headers().firstValue("Authorization")).contains("Bearer abc");
    }

    @Test
    @DisplayName("Should leave requests for other URLs untouched")
    void testAuthorize_OtherUrl() {
        URI other = URI.create(remote.getRuntimeInfo().getHttpBaseUrl() + "/other/studies");

        HttpRequest request = authorizer.authorize(other, HttpRequest.newBuilder(other)).build();

        assertThat(request.headers().firstValue("Authorization")).isEmpty();
        assertThat(authorizer.onResponse(other, 401)).isFalse();
        remote.verify(0, postRequestedFor(urlEqualTo("/token")));
    }

    @Test
    @DisplayName("Should drop a rejected token and retry once with a new one")
    void testSend_RetriesAfterUnauthorized() throws Exception {
        // Given: the IdP rotates the token and the PACS only accepts the second one
        remote.stubFor(post(urlEqualTo("/token")).inScenario("rotation")
            .whenScenarioStateIs(Scenario.STARTED)
            .willReturn(okJson("{\"access_token\":\"revoked-token\",\"expires_in\":3600}"))
            .willSetStateTo("rotated"));
        remote.stubFor(post(urlEqualTo("/token")).inScenario("rotation")
            .whenScenarioStateIs("rotated")
            .willReturn(okJson("{\"access_token\":\"current-token\",\"expires_in\":3600}")));
        remote.stubFor(get(urlEqualTo("/dicom-web/studies"))
            .withHeader("Authorization", equalTo("Bearer revoked-token"))
            .willReturn(aResponse().withStatus(401)));
        remote.stubFor(get(urlEqualTo("/dicom-web/studies"))
            .withHeader("Authorization", equalTo("Bearer current-token"))
            .willReturn(okJson("[]")));

        // When
        HttpResponse<String> response = authorizer.send(
            HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build(),
            HttpRequest.newBuilder(studies).GET().build(),
            HttpResponse.BodyHandlers.ofString());

        // Then
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).isEqualTo("[]");
        remote.verify(2, postRequestedFor(urlEqualTo("/token")));
    }

    @Test
    @DisplayName("Should only react to 401 answers")
    void testOnResponse() {
        remote.stubFor(post(urlEqualTo("/token")).willReturn(okJson("{\"access_token\":\"abc\",\"expires_in\":3600}")));
        tokenManager.getToken("pacs");

        assertThat(authorizer.onResponse(studies, 403)).isFalse();
        assertThat(tokenManager.status("pacs").cached()).isTrue();
        assertThat(authorizer.onResponse(studies, 401)).isTrue();
        assertThat(tokenManager.status("pacs").cached()).isFalse();
    }

    @Test
    @DisplayName("Should map an unavailable identity provider to 502")
    void testAuthorize_ProviderDown() {
        remote.stubFor(post(urlEqualTo("/token")).willReturn(aResponse().withStatus(503)));

        TokenAcquisitionException e = catchThrowableOfType(
            () -> authorizer.authorize(studies, HttpRequest.newBuilder(studies)), TokenAcquisitionException.class);

        assertThat(e).isNotNull();
        assertThat(new FailureResponses().toResponse(e).status()).isEqualTo(502);
    }
}

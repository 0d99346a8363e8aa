package com.dicomweb.oauth.provider;

import com.dicomweb.oauth.config.ProviderType;
import com.dicomweb.oauth.config.ServerConfig;
import com.dicomweb.oauth.security.SecretVault;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultTokenProviderFactoryTest {

    private final SecretVault vault = new SecretVault();
    private final ProviderContext context = ProviderContext.builder()
        .vault(vault)
        .environment(Map.<String, String>of()::get)
        .build();
    private final DefaultTokenProviderFactory factory = new DefaultTokenProviderFactory(context);

    @AfterEach
    void tearDown() {
        vault.close();
    }

    private static ServerConfig.ServerConfigBuilder config(ProviderType type, String tokenEndpoint) {
        return ServerConfig.builder()
            .name("pacs")
            .baseUrl("https://pacs.example.com")
            .providerType(type)
            .tokenEndpoint(tokenEndpoint)
            .clientId("client")
            .clientSecret("secret");
    }

    @ParameterizedTest
    @CsvSource({
        "https://login.microsoftonline.com/tenant/oauth2/v2.0/token, AZURE",
        "https://oauth2.googleapis.com/token, GOOGLE",
        "https://accounts.google.com/o/oauth2/token, GOOGLE",
        "https://kc.example.com/realms/pacs/protocol/openid-connect/token, KEYCLOAK",
        "https://idp.example.com/oauth2/token, GENERIC",
        "https://login.microsoftonline.com.evil.example/token, GENERIC"
    })
    @DisplayName("Should detect the provider from the token endpoint")
    void testDetect(String endpoint, ProviderType expected) {
        assertThat(new ProviderDetector().detect(config(ProviderType.AUTO, endpoint).build())).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should try override rules before the defaults")
    void testDetect_Override() {
        ProviderDetector detector = new ProviderDetector(List.of(
            new ProviderDetector.Rule("corporate keycloak", ProviderType.KEYCLOAK,
                uri -> "sso.corp.example".equals(uri.getHost()))));

        assertThat(detector.detect(config(ProviderType.AUTO, "https://sso.corp.example/auth/token").build()))
            .isEqualTo(ProviderType.KEYCLOAK);
        assertThat(detector.rules()).hasSize(ProviderDetector.DEFAULT_RULES.size() + 1);
        assertThat(detector.detect(config(ProviderType.AUTO, null).build())).isEqualTo(ProviderType.GENERIC);
    }

    @Test
    @DisplayName("Should build the implementation of each configured type")
    void testCreate_EachType() {
        assertThat(factory.create(config(ProviderType.GENERIC, "https://idp.example.com/token").build()))
            .isExactlyInstanceOf(ClientCredentialsTokenProvider.class);
        assertThat(factory.create(config(ProviderType.AZURE, null).build()))
            .isExactlyInstanceOf(AzureAdTokenProvider.class);
        assertThat(factory.create(config(ProviderType.AZURE_MANAGED_IDENTITY, null).build()))
            .isExactlyInstanceOf(AzureManagedIdentityTokenProvider.class);
        assertThat(factory.create(config(ProviderType.GOOGLE, null).build()))
            .isExactlyInstanceOf(GoogleTokenProvider.class);
        assertThat(factory.create(config(ProviderType.AWS, null).build()))
            .isExactlyInstanceOf(AwsTokenProvider.class);
        assertThat(factory.create(config(ProviderType.KEYCLOAK, "https://kc.example.com/realms/pacs").build()))
            .isExactlyInstanceOf(KeycloakTokenProvider.class);
    }

    @Test
    @DisplayName("Should resolve auto through the detector")
    void testCreate_Auto() {
        TokenProvider provider = factory.create(
            config(ProviderType.AUTO, "https://kc.example.com/realms/pacs/protocol/openid-connect/token").build());

        assertThat(provider.type()).isEqualTo(ProviderType.KEYCLOAK);
    }
}

package com.dicomweb.oauth.provider;

import com.dicomweb.oauth.config.ServerConfig;
import com.dicomweb.oauth.config.SslVerification;
import com.dicomweb.oauth.error.ConfigurationException;
import com.dicomweb.oauth.error.ErrorCode;
import com.dicomweb.oauth.jwt.key.PemKeyLoader;
import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509ExtendedTrustManager;
import java.io.IOException;
import java.net.Socket;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.util.List;

/**
 * Builds the {@link HttpClient} a provider talks through, honouring the server's
 * TLS verification setting.
 */
@Slf4j
final class HttpClients {

    private HttpClients() {}

    static HttpClient create(ServerConfig config) {
        HttpClient.Builder builder = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(config.getConnectTimeout())
            .followRedirects(HttpClient.Redirect.NEVER);

        SslVerification ssl = config.getSslVerification();
        if (!ssl.isEnabled()) {
            log.warn("TLS certificate verification is DISABLED for server '{}'", config.getName());
            builder.sslContext(sslContext(new TrustManager[]{new TrustAllManager()}));
        } else if (ssl.hasCaBundle()) {
            builder.sslContext(sslContext(caBundleTrustManagers(config)));
        }
        return builder.build();
    }

    private static TrustManager[] caBundleTrustManagers(ServerConfig config) {
        try {
            List<X509Certificate> certificates = PemKeyLoader.loadCertificates(
                Files.readString(config.getSslVerification().getCaBundle()));
            if (certificates.isEmpty()) {
                throw new ConfigurationException(ErrorCode.CONFIG_INVALID_VALUE, config.getName(),
                    "CA bundle contains no certificate");
            }
            KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
            trustStore.load(null, null);
            for (int i = 0; i < certificates.size(); i++) {
                trustStore.setCertificateEntry("ca-" + i, certificates.get(i));
            }
            TrustManagerFactory factory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            factory.init(trustStore);
            log.info("Server '{}' trusts {} certificate(s) from {}", config.getName(), certificates.size(),
                config.getSslVerification().getCaBundle());
            return factory.getTrustManagers();
        } catch (IOException | IllegalArgumentException e) {
            throw new ConfigurationException(ErrorCode.CONFIG_INVALID_VALUE, config.getName(),
                "cannot read CA bundle " + config.getSslVerification().getCaBundle(), e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to build trust store", e);
        }
    }

    private static SSLContext sslContext(TrustManager[] trustManagers) {
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, trustManagers, new SecureRandom());
            return context;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("TLS not available", e);
        }
    }

    private static final class TrustAllManager extends X509ExtendedTrustManager {

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {}

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {}

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {}

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {}

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {}

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {}

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}

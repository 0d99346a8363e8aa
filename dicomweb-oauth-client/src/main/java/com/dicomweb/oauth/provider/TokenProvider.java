package com.dicomweb.oauth.provider;

import com.dicomweb.oauth.config.ProviderType;

/**
 * Exchanges the credentials (or platform identity) of one configured server for an
 * access token. Instances are bound to their server when the configuration is loaded;
 * {@link DefaultTokenProviderFactory} is the only place that maps a provider type to
 * an implementation.
 */
public interface TokenProvider {

    ProviderType type();

    /**
     * Performs one token request. Never retries.
     *
     * @throws com.dicomweb.oauth.error.TokenAcquisitionException on network failure, timeout,
     *         non-2xx answer or an unusable response body
     */
    TokenResponse acquire();
}

package com.dicomweb.oauth.provider;

import com.dicomweb.oauth.config.ServerConfig;

@FunctionalInterface
public interface TokenProviderFactory {

    TokenProvider create(ServerConfig config);
}

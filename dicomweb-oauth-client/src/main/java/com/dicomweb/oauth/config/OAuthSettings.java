package com.dicomweb.oauth.config;

import lombok.Value;

import java.util.List;

@Value
public class OAuthSettings {
    List<ServerConfig> servers;
    RateLimiterSettings rateLimiter;

    public ServerRegistry registry() {
        return ServerRegistry.of(servers);
    }
}

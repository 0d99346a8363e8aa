package com.dicomweb.oauth.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class RateLimiterSettings {

    public static final RateLimiterSettings DEFAULTS = RateLimiterSettings.builder().build();

    @Builder.Default
    int maxRequests = 10;
    @Builder.Default
    long windowSeconds = 60;

    public Duration window() {
        return Duration.ofSeconds(windowSeconds);
    }
}

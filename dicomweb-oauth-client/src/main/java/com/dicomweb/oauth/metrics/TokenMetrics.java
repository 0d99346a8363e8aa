package com.dicomweb.oauth.metrics;

import com.dicomweb.oauth.error.ErrorCode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.AllArgsConstructor;

/**
 * Token lifecycle meters. Tags carry the server name, never token material.
 */
@AllArgsConstructor
public class TokenMetrics {

    public static final String METRIC_ACQUISITIONS = "dicomweb.oauth.token.acquisitions";
    public static final String METRIC_CACHE_HITS = "dicomweb.oauth.cache.hits";
    public static final String METRIC_CACHE_MISSES = "dicomweb.oauth.cache.misses";
    public static final String METRIC_ERRORS = "dicomweb.oauth.errors";

    public static final String TAG_SERVER = "server";
    public static final String TAG_STATUS = "status";
    public static final String TAG_ERROR_CODE = "error_code";

    private final MeterRegistry meterRegistry;

    public TokenMetrics() {
        this(new SimpleMeterRegistry());
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordAcquisition(Timer.Sample sample, String server, boolean success) {
        Timer timer = Timer.builder(METRIC_ACQUISITIONS)
            .description("Token acquisition attempts")
            .tag(TAG_SERVER, server)
            .tag(TAG_STATUS, success ? "success" : "failure")
            .register(meterRegistry);
        sample.stop(timer);
    }

    public void recordCacheHit(String server) {
        counter(METRIC_CACHE_HITS, "Tokens served from cache", server).increment();
    }

    public void recordCacheMiss(String server) {
        counter(METRIC_CACHE_MISSES, "Token requests that needed an acquisition", server).increment();
    }

    public void recordError(String server, ErrorCode code) {
        Counter.builder(METRIC_ERRORS)
            .description("Token errors by code")
            .tag(TAG_SERVER, server)
            .tag(TAG_ERROR_CODE, code.getCode())
            .register(meterRegistry)
            .increment();
    }

    private Counter counter(String name, String description, String server) {
        return Counter.builder(name).description(description).tag(TAG_SERVER, server).register(meterRegistry);
    }
}

package com.dicomweb.oauth;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically refreshes tokens that entered their refresh buffer, so that request
 * threads rarely wait on an acquisition.
 */
@Slf4j
public class BackgroundTokenRefresher implements AutoCloseable {

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(60);

    private final TokenManager tokenManager;
    private final ScheduledExecutorService ses = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "dicomweb-oauth-background-refresh");
        thread.setDaemon(true);
        return thread;
    });

    public BackgroundTokenRefresher(TokenManager tokenManager) {
        this(tokenManager, DEFAULT_INTERVAL);
    }

    public BackgroundTokenRefresher(TokenManager tokenManager, Duration interval) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.tokenManager = tokenManager;
        ses.scheduleWithFixedDelay(this::refreshOnce, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Background token refresh every {}s", interval.toSeconds());
    }

    void refreshOnce() {
        try {
            int started = tokenManager.refreshExpiring();
            if (started > 0) {
                log.debug("Started proactive refresh for {} server(s)", started);
            }
        } catch (RuntimeException e) {
            log.warn("Background token refresh failed", e);
        }
    }

    @Override
    public void close() {
        ses.shutdownNow();
    }
}

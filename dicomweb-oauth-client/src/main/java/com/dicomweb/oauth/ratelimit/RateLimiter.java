package com.dicomweb.oauth.ratelimit;

import com.dicomweb.oauth.config.RateLimiterSettings;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Sliding-window limiter keyed by client identifier (usually the source IP).
 * <p>
 * Each client keeps the timestamps of its admitted requests inside the trailing window.
 * A request is admitted when fewer than {@code maxRequests} timestamps survive pruning;
 * a rejected request is not recorded. Updates for one client are serialized through
 * {@link ConcurrentHashMap#compute}, so different clients never contend on a shared lock.
 * <p>
 * Idle clients are swept at most once per window from {@link #allow}, so the map only holds
 * clients seen during roughly the last two windows.
 */
@Slf4j
public class RateLimiter {

    @Getter
    private final int maxRequests;
    @Getter
    private final Duration window;
    private final Clock clock;
    private final ConcurrentMap<String, Deque<Long>> windows = new ConcurrentHashMap<>();
    private final AtomicLong lastSweep;

    public RateLimiter() {
        this(RateLimiterSettings.DEFAULTS, Clock.systemUTC());
    }

    public RateLimiter(RateLimiterSettings settings) {
        this(settings, Clock.systemUTC());
    }

    public RateLimiter(RateLimiterSettings settings, Clock clock) {
        if (settings.getMaxRequests() <= 0) {
            throw new IllegalArgumentException("maxRequests must be positive");
        }
        if (settings.getWindowSeconds() <= 0) {
            throw new IllegalArgumentException("windowSeconds must be positive");
        }
        this.maxRequests = settings.getMaxRequests();
        this.window = settings.window();
        this.clock = clock;
        this.lastSweep = new AtomicLong(clock.millis());
    }

    /**
     * Records a request for {@code clientId} if the window has room.
     *
     * @return {@code true} when the request is admitted
     */
    public boolean allow(String clientId) {
        long now = clock.millis();
        boolean[] admitted = new boolean[1];
        windows.compute(key(clientId), (k, timestamps) -> {
            Deque<Long> entries = timestamps == null ? new ArrayDeque<>() : timestamps;
            prune(entries, now);
            if (entries.size() < maxRequests) {
                entries.addLast(now);
                admitted[0] = true;
            }
            return entries;
        });
        if (!admitted[0]) {
            log.debug("Rate limit reached for client {} ({} requests per {}s)", clientId, maxRequests, window.toSeconds());
        }
        sweepIfDue(now);
        return admitted[0];
    }

    /**
     * Whole seconds until {@code clientId} would be admitted again, {@code 0} when it has room now.
     */
    public long retryAfterSeconds(String clientId) {
        long now = clock.millis();
        long[] waitMillis = new long[1];
        windows.computeIfPresent(key(clientId), (k, timestamps) -> {
            prune(timestamps, now);
            if (timestamps.size() >= maxRequests) {
                // a timestamp exactly one window old still counts
                waitMillis[0] = timestamps.peekFirst() + window.toMillis() + 1 - now;
            }
            return timestamps.isEmpty() ? null : timestamps;
        });
        return (waitMillis[0] + 999) / 1000;
    }

    public int remaining(String clientId) {
        long now = clock.millis();
        int[] used = new int[1];
        windows.computeIfPresent(key(clientId), (k, timestamps) -> {
            prune(timestamps, now);
            used[0] = timestamps.size();
            return timestamps.isEmpty() ? null : timestamps;
        });
        return Math.max(0, maxRequests - used[0]);
    }

    public void reset(String clientId) {
        windows.remove(key(clientId));
    }

    /**
     * Drops clients with no request left in the window.
     *
     * @return number of clients dropped
     */
    public int evictIdle() {
        long now = clock.millis();
        int before = windows.size();
        for (String clientId : windows.keySet()) {
            windows.computeIfPresent(clientId, (k, timestamps) -> {
                prune(timestamps, now);
                return timestamps.isEmpty() ? null : timestamps;
            });
        }
        return Math.max(0, before - windows.size());
    }

    private void sweepIfDue(long now) {
        long last = lastSweep.get();
        if (now - last >= window.toMillis() && lastSweep.compareAndSet(last, now)) {
            int dropped = evictIdle();
            if (dropped > 0) {
                log.debug("Evicted {} idle rate-limit windows", dropped);
            }
        }
    }

    int trackedClients() {
        return windows.size();
    }

    private void prune(Deque<Long> timestamps, long now) {
        long cutoff = now - window.toMillis();
        while (!timestamps.isEmpty() && timestamps.peekFirst() < cutoff) {
            timestamps.pollFirst();
        }
    }

    private static String key(String clientId) {
        return clientId == null ? "" : clientId;
    }
}

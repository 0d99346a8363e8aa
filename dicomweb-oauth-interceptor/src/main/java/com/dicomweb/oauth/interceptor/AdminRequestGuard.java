package com.dicomweb.oauth.interceptor;

import com.dicomweb.oauth.ratelimit.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the rate limit to administrative calls (status, server listing, test token).
 * Denials are also reported on the {@code com.dicomweb.oauth.security} logger so they
 * can be routed to a separate audit sink.
 */
@Slf4j
public class AdminRequestGuard {

    private static final Logger SECURITY = LoggerFactory.getLogger("com.dicomweb.oauth.security");

    private final RateLimiter rateLimiter;
    private final FailureResponses responses;

    public AdminRequestGuard(RateLimiter rateLimiter) {
        this(rateLimiter, new FailureResponses());
    }

    public AdminRequestGuard(RateLimiter rateLimiter, FailureResponses responses) {
        this.rateLimiter = rateLimiter;
        this.responses = responses;
    }

    public GuardDecision check(String clientIp, String method, String path) {
        if (rateLimiter.allow(clientIp)) {
            log.debug("Admin request {} {} from {} admitted", method, path, clientIp);
            return GuardDecision.allow();
        }
        long retryAfter = Math.max(1, rateLimiter.retryAfterSeconds(clientIp));
        SECURITY.warn("event=rate_limit_exceeded client={} method={} path={} limit={}/{}s retry_after={}s",
            clientIp, method, path, rateLimiter.getMaxRequests(), rateLimiter.getWindow().toSeconds(), retryAfter);
        FailureResponse response = responses.rateLimited(retryAfter);
        return new GuardDecision(false, response.status(), retryAfter, response.body());
    }
}

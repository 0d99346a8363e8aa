package com.dicomweb.oauth.interceptor;

/**
 * Outcome of {@link AdminRequestGuard#check}. When denied, {@code status} is 429 and
 * {@code body} the JSON error to answer with.
 */
public record GuardDecision(boolean allowed, int status, long retryAfterSeconds, String body) {

    static GuardDecision allow() {
        return new GuardDecision(true, 200, 0, null);
    }
}

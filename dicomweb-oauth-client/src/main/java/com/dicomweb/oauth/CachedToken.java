package com.dicomweb.oauth;

import com.dicomweb.oauth.security.SealedSecret;

import java.time.Instant;

/**
 * Immutable snapshot of one server's current token. The token itself stays sealed;
 * a snapshot is replaced as a whole, never mutated.
 */
record CachedToken(SealedSecret accessToken, Instant expiresAt, Instant acquiredAt, String tokenType) {

    boolean isUsableAt(Instant now, long refreshBufferSeconds) {
        return now.isBefore(expiresAt.minusSeconds(refreshBufferSeconds));
    }

    boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }
}

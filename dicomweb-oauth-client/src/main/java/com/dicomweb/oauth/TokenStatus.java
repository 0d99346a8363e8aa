package com.dicomweb.oauth;

import com.dicomweb.oauth.config.ProviderType;

import java.time.Instant;

/**
 * What the status endpoint may report about a server's token. Carries no token material.
 *
 * @param cached      whether a token is held at all
 * @param valid       whether the held token has not expired yet
 * @param refreshDue  whether the next request would trigger an acquisition
 * @param refreshing  whether an acquisition is currently running
 */
public record TokenStatus(String serverName,
                          ProviderType providerType,
                          boolean cached,
                          Instant acquiredAt,
                          Instant expiresAt,
                          String tokenType,
                          boolean valid,
                          boolean refreshDue,
                          boolean refreshing) {
}

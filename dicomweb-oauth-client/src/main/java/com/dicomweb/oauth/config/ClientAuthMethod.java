package com.dicomweb.oauth.config;

/**
 * How client credentials travel to the token endpoint.
 */
public enum ClientAuthMethod {
    /** {@code client_id} and {@code client_secret} as form fields. */
    CLIENT_SECRET_POST,
    /** HTTP Basic authorization header. */
    CLIENT_SECRET_BASIC
}

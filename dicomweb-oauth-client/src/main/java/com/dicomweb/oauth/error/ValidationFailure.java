package com.dicomweb.oauth.error;

/**
 * Why a freshly acquired token was refused.
 */
public enum ValidationFailure {
    MALFORMED,
    DISALLOWED_ALGORITHM,
    BAD_SIGNATURE,
    EXPIRED,
    NOT_YET_VALID,
    WRONG_AUDIENCE,
    WRONG_ISSUER
}

package com.storefront.authservice.exception;

/**
 * Stable machine-readable reason codes sent as {@code code} in problem responses.
 * Renaming a constant is a breaking change for clients.
 */
public enum AuthReason {
    NO_TOKEN,
    INVALID_TOKEN,
    TOKEN_EXPIRED,
    TOKEN_REVOKED,
    TOKEN_NOT_YET_VALID,
    ACCOUNT_NOT_FOUND,
    INVALID_CREDENTIALS,
    ACCOUNT_DEACTIVATED,
    VERIFICATION_REQUIRED,
    INSUFFICIENT_ROLE,
    IP_BLOCKED,
    ACCOUNT_LOCKED,
    PERSISTENCE_UNAVAILABLE
}

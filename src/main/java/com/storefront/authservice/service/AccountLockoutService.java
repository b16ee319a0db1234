package com.storefront.authservice.service;

import com.storefront.authservice.exception.AuthExceptions;

import java.util.UUID;

/**
 * Per-account failure counter kept on the identity record, independent of the source-address guard.
 */
public interface AccountLockoutService {

    /**
     * @throws AuthExceptions.RateLimited with reason {@code ACCOUNT_LOCKED} while a lock is in force
     */
    void ensureNotLocked(UUID identityId);

    /** Counts one failure and locks the account once the threshold is reached. */
    void recordFailure(UUID identityId);

    void reset(UUID identityId);
}

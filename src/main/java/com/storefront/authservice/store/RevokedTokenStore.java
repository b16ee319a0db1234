package com.storefront.authservice.store;

import java.time.Instant;

/**
 * Set of revoked token digests, each with the instant after which it may be forgotten.
 */
public interface RevokedTokenStore {

    /** Idempotent; a repeated put never shortens the existing retention. */
    void put(String digest, Instant evictAt);

    /** Entries past their evict-at instant read as absent. */
    boolean contains(String digest, Instant now);

    /** Drops entries past their evict-at instant; returns how many were removed. */
    int sweep(Instant now);
}

package com.storefront.authservice.store;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Per-source failed-login counters. Implementations make {@link #increment} atomic per key.
 */
public interface LoginAttemptStore {

    Optional<AttemptRecord> get(String key);

    /**
     * Adds one failure at {@code now}. A record whose window has already elapsed restarts at 1.
     *
     * @return the record after the increment
     */
    AttemptRecord increment(String key, Instant now, Duration window);

    void delete(String key);

    /** Drops records whose window has elapsed; returns how many were removed. */
    int sweep(Instant now, Duration window);
}

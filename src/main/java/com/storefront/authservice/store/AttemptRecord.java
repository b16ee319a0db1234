package com.storefront.authservice.store;

import java.time.Duration;
import java.time.Instant;

/** Failed-login counter for one source key. */
public record AttemptRecord(int count, Instant lastFailure) {

    /** True once {@code window} has fully elapsed since the last failure. */
    public boolean isStale(Instant now, Duration window) {
        return !lastFailure.plus(window).isAfter(now);
    }
}

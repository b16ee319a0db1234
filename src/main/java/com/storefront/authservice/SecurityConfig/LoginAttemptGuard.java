package com.storefront.authservice.SecurityConfig;

import com.storefront.authservice.config.SecurityProperties;
import com.storefront.authservice.store.AttemptRecord;
import com.storefront.authservice.store.LoginAttemptStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Per-source brute-force guard.
 * <pre>
 * Clear --fail--> Warming(1..threshold-1) --fail--> Blocked
 * Blocked --(window since last failure elapses)--> Clear   (lazy, on read)
 * any     --reset (successful login)------------> Clear
 * </pre>
 */
@Slf4j
@Component
public class LoginAttemptGuard {

    private final LoginAttemptStore store;
    private final Clock clock;
    private final int threshold;
    private final Duration window;

    public LoginAttemptGuard(LoginAttemptStore store, SecurityProperties props, Clock clock) {
        this.store = store;
        this.clock = clock;
        this.threshold = Math.max(1, props.getAuthentication().getLockoutThreshold());
        this.window = props.getAuthentication().getLockoutWindow();
    }

    /** Pure read; never mutates the record. */
    public boolean isBlocked(String source) {
        return activeBlock(source).isPresent();
    }

    /** Remaining block time, empty when not blocked. */
    public Optional<Duration> retryAfter(String source) {
        Instant now = clock.instant();
        return activeBlock(source).map(rec -> Duration.between(now, rec.lastFailure().plus(window)));
    }

    public Optional<Instant> blockedUntil(String source) {
        return activeBlock(source).map(rec -> rec.lastFailure().plus(window));
    }

    public int failureCount(String source) {
        Instant now = clock.instant();
        return store.get(key(source))
                .filter(rec -> !rec.isStale(now, window))
                .map(AttemptRecord::count)
                .orElse(0);
    }

    public void recordFailure(String source) {
        AttemptRecord rec = store.increment(key(source), clock.instant(), window);
        if (rec.count() == threshold) {
            log.warn("Source {} blocked after {} failed logins (window {})", source, rec.count(), window);
        } else {
            log.debug("Failed login from {} ({}/{})", source, rec.count(), threshold);
        }
    }

    public void reset(String source) {
        store.delete(key(source));
    }

    public int sweep() {
        return store.sweep(clock.instant(), window);
    }

    private Optional<AttemptRecord> activeBlock(String source) {
        Instant now = clock.instant();
        return store.get(key(source))
                .filter(rec -> rec.count() >= threshold)
                .filter(rec -> !rec.isStale(now, window));
    }

    private static String key(String source) {
        return source == null || source.isBlank() ? "unknown" : source;
    }
}

package com.storefront.authservice.store;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-local counters. State is lost on restart.
 */
public class InMemoryLoginAttemptStore implements LoginAttemptStore {

    private final Map<String, AttemptRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<AttemptRecord> get(String key) {
        return Optional.ofNullable(records.get(key));
    }

    @Override
    public AttemptRecord increment(String key, Instant now, Duration window) {
        return records.compute(key, (k, current) -> {
            if (current == null || current.isStale(now, window)) {
                return new AttemptRecord(1, now);
            }
            return new AttemptRecord(current.count() + 1, now);
        });
    }

    @Override
    public void delete(String key) {
        records.remove(key);
    }

    @Override
    public int sweep(Instant now, Duration window) {
        AtomicInteger removed = new AtomicInteger();
        // Entry by entry; increments on other keys proceed meanwhile.
        for (String key : records.keySet()) {
            records.computeIfPresent(key, (k, rec) -> {
                if (rec.isStale(now, window)) {
                    removed.incrementAndGet();
                    return null;
                }
                return rec;
            });
        }
        return removed.get();
    }

    int size() {
        return records.size();
    }
}

package com.storefront.authservice.store;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-local revocation list. State is lost on restart.
 */
public class InMemoryRevokedTokenStore implements RevokedTokenStore {

    private final Map<String, Instant> entries = new ConcurrentHashMap<>();

    @Override
    public void put(String digest, Instant evictAt) {
        entries.merge(digest, evictAt, (a, b) -> a.isAfter(b) ? a : b);
    }

    @Override
    public boolean contains(String digest, Instant now) {
        Instant evictAt = entries.get(digest);
        if (evictAt == null) {
            return false;
        }
        if (!evictAt.isAfter(now)) {
            entries.remove(digest, evictAt);
            return false;
        }
        return true;
    }

    @Override
    public int sweep(Instant now) {
        AtomicInteger removed = new AtomicInteger();
        for (String digest : entries.keySet()) {
            entries.computeIfPresent(digest, (k, evictAt) -> {
                if (!evictAt.isAfter(now)) {
                    removed.incrementAndGet();
                    return null;
                }
                return evictAt;
            });
        }
        return removed.get();
    }

    int size() {
        return entries.size();
    }
}

package com.storefront.authservice.store;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;

/**
 * Shared revocation list; one key per digest with a native TTL up to the evict-at instant.
 */
@RequiredArgsConstructor
public class RedisRevokedTokenStore implements RevokedTokenStore {

    private static final String KEY_PREFIX = "auth:revoked:";

    // Only ever extends the TTL. ARGV[1]=ttl millis.
    private static final DefaultRedisScript<Long> PUT_MAX = new DefaultRedisScript<>(
            "local cur = redis.call('PTTL', KEYS[1])\n" +
            "if cur < tonumber(ARGV[1]) then\n" +
            "  redis.call('SET', KEYS[1], '1', 'PX', ARGV[1])\n" +
            "end\n" +
            "return 1",
            Long.class);

    private final StringRedisTemplate redis;
    private final Clock clock;

    @Override
    public void put(String digest, Instant evictAt) {
        long ttlMs = Duration.between(clock.instant(), evictAt).toMillis();
        if (ttlMs <= 0) {
            return;
        }
        redis.execute(PUT_MAX, Collections.singletonList(KEY_PREFIX + digest), String.valueOf(ttlMs));
    }

    @Override
    public boolean contains(String digest, Instant now) {
        return Boolean.TRUE.equals(redis.hasKey(KEY_PREFIX + digest));
    }

    @Override
    public int sweep(Instant now) {
        return 0;
    }
}

package com.storefront.authservice.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Shared counters in a Redis hash per source ({@code count}, {@code last} epoch millis).
 * The key's own TTL equals the window, so Redis evicts stale records and {@link #sweep} is a no-op.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisLoginAttemptStore implements LoginAttemptStore {

    private static final String KEY_PREFIX = "auth:attempts:";

    // KEYS[1]=record, ARGV[1]=now millis, ARGV[2]=window millis. Returns {count, last}.
    private static final DefaultRedisScript<List<Long>> INCREMENT = new DefaultRedisScript<>(
            "local last = redis.call('HGET', KEYS[1], 'last')\n" +
            "if last and (tonumber(ARGV[1]) - tonumber(last)) >= tonumber(ARGV[2]) then\n" +
            "  redis.call('DEL', KEYS[1])\n" +
            "end\n" +
            "local c = redis.call('HINCRBY', KEYS[1], 'count', 1)\n" +
            "redis.call('HSET', KEYS[1], 'last', ARGV[1])\n" +
            "redis.call('PEXPIRE', KEYS[1], ARGV[2])\n" +
            "return {c, tonumber(ARGV[1])}",
            longList());

    private final StringRedisTemplate redis;

    @Override
    public Optional<AttemptRecord> get(String key) {
        Map<Object, Object> raw = redis.opsForHash().entries(KEY_PREFIX + key);
        Object count = raw.get("count");
        Object last = raw.get("last");
        if (count == null || last == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(new AttemptRecord(
                    Integer.parseInt(count.toString()),
                    Instant.ofEpochMilli(Long.parseLong(last.toString()))));
        } catch (NumberFormatException e) {
            log.warn("Corrupt attempt record under {}; ignoring", KEY_PREFIX + key);
            return Optional.empty();
        }
    }

    @Override
    public AttemptRecord increment(String key, Instant now, Duration window) {
        List<Long> result = redis.execute(INCREMENT,
                Collections.singletonList(KEY_PREFIX + key),
                String.valueOf(now.toEpochMilli()),
                String.valueOf(window.toMillis()));
        if (result == null || result.size() < 2) {
            throw new IllegalStateException("Attempt counter script returned no result");
        }
        return new AttemptRecord(result.get(0).intValue(), Instant.ofEpochMilli(result.get(1)));
    }

    @Override
    public void delete(String key) {
        redis.delete(KEY_PREFIX + key);
    }

    @Override
    public int sweep(Instant now, Duration window) {
        return 0;
    }

    @SuppressWarnings("unchecked")
    private static Class<List<Long>> longList() {
        return (Class<List<Long>>) (Class<?>) List.class;
    }
}

package com.storefront.authservice.store;

import com.storefront.authservice.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Keys, arguments and result mapping of the Redis stores, without a server.
 */
@ExtendWith(MockitoExtension.class)
class RedisStoreCommandsTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    @Mock
    StringRedisTemplate redis;

    @Mock
    HashOperations<String, Object, Object> hash;

    @Test
    @SuppressWarnings("unchecked")
    void incrementPassesMillisAndMapsTheScriptResult() {
        when(redis.execute(any(RedisScript.class), anyList(), anyString(), anyString()))
                .thenReturn(List.of(4L, NOW.toEpochMilli()));

        AttemptRecord record = new RedisLoginAttemptStore(redis).increment("203.0.113.9", NOW, Duration.ofHours(1));

        assertThat(record).isEqualTo(new AttemptRecord(4, NOW));
        ArgumentCaptor<List<String>> keys = ArgumentCaptor.forClass(List.class);
        verify(redis).execute(any(RedisScript.class), keys.capture(),
                eq(String.valueOf(NOW.toEpochMilli())), eq("3600000"));
        assertThat(keys.getValue()).containsExactly("auth:attempts:203.0.113.9");
    }

    @Test
    @SuppressWarnings("unchecked")
    void emptyScriptResultIsAnError() {
        when(redis.execute(any(RedisScript.class), anyList(), anyString(), anyString())).thenReturn(List.of());

        assertThatThrownBy(() -> new RedisLoginAttemptStore(redis).increment("k", NOW, Duration.ofHours(1)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void getParsesTheHash() {
        doReturn(hash).when(redis).opsForHash();
        when(hash.entries("auth:attempts:k")).thenReturn(Map.of("count", "7", "last", String.valueOf(NOW.toEpochMilli())));

        assertThat(new RedisLoginAttemptStore(redis).get("k")).contains(new AttemptRecord(7, NOW));
    }

    @Test
    void getTreatsMissingOrCorruptHashAsAbsent() {
        doReturn(hash).when(redis).opsForHash();
        when(hash.entries("auth:attempts:none")).thenReturn(Map.of());
        when(hash.entries("auth:attempts:bad")).thenReturn(Map.of("count", "x", "last", "1"));

        RedisLoginAttemptStore store = new RedisLoginAttemptStore(redis);

        assertThat(store.get("none")).isEmpty();
        assertThat(store.get("bad")).isEmpty();
    }

    @Test
    @SuppressWarnings("unchecked")
    void revokePassesRemainingTtlInMillis() {
        MutableClock clock = MutableClock.startingAt("2025-01-01T00:00:00Z");

        new RedisRevokedTokenStore(redis, clock).put("abc", NOW.plus(Duration.ofMinutes(2)));

        ArgumentCaptor<List<String>> keys = ArgumentCaptor.forClass(List.class);
        verify(redis).execute(any(RedisScript.class), keys.capture(), eq("120000"));
        assertThat(keys.getValue()).containsExactly("auth:revoked:abc");
    }

    @Test
    @SuppressWarnings("unchecked")
    void revokeInThePastIsSkipped() {
        MutableClock clock = MutableClock.startingAt("2025-01-01T00:00:00Z");

        new RedisRevokedTokenStore(redis, clock).put("abc", NOW);

        verify(redis, never()).execute(any(RedisScript.class), anyList(), anyString());
    }

    @Test
    void containsChecksTheDigestKey() {
        when(redis.hasKey("auth:revoked:abc")).thenReturn(true);

        assertThat(new RedisRevokedTokenStore(redis, MutableClock.startingAt("2025-01-01T00:00:00Z"))
                .contains("abc", NOW)).isTrue();
    }
}

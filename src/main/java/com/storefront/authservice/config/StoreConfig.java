package com.storefront.authservice.config;

import com.storefront.authservice.store.InMemoryLoginAttemptStore;
import com.storefront.authservice.store.InMemoryRevokedTokenStore;
import com.storefront.authservice.store.LoginAttemptStore;
import com.storefront.authservice.store.RedisLoginAttemptStore;
import com.storefront.authservice.store.RedisRevokedTokenStore;
import com.storefront.authservice.store.RevokedTokenStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Selects the backing store for lockout counters and revoked tokens via {@code app.security.store}.
 */
@Slf4j
@Configuration
public class StoreConfig {

    @Configuration
    @ConditionalOnProperty(prefix = "app.security", name = "store", havingValue = "memory", matchIfMissing = true)
    static class InMemoryStores {

        @Bean
        LoginAttemptStore loginAttemptStore() {
            log.info("Using in-memory login attempt store (state resets on restart)");
            return new InMemoryLoginAttemptStore();
        }

        @Bean
        RevokedTokenStore revokedTokenStore() {
            return new InMemoryRevokedTokenStore();
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "app.security", name = "store", havingValue = "redis")
    static class RedisStores {

        @Bean
        LoginAttemptStore loginAttemptStore(StringRedisTemplate redis) {
            log.info("Using Redis login attempt store");
            return new RedisLoginAttemptStore(redis);
        }

        @Bean
        RevokedTokenStore revokedTokenStore(StringRedisTemplate redis, Clock clock) {
            return new RedisRevokedTokenStore(redis, clock);
        }
    }
}

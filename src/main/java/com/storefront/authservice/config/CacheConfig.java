package com.storefront.authservice.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.CachingConfigurer;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.cache.interceptor.CacheErrorHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ForkJoinPool;

@Slf4j
@Configuration
@EnableCaching
public class CacheConfig implements CachingConfigurer {

    /** Identity snapshots keyed by id, read on every authenticated request. */
    public static final String IDENTITY_BY_ID = "identityById";

    @Value("${app.cache.identity-ttl:PT30S}")
    private Duration identityTtl;

    /**
     * Caffeine-backed CacheManager.
     * - TTL is short on purpose: deactivation must bite quickly even if an eviction is missed.
     * - Admin mutations evict explicitly.
     */
    @Bean
    @Override
    public CacheManager cacheManager() {
        CaffeineCacheManager mgr = new CaffeineCacheManager();
        mgr.setCaffeine(
                Caffeine.newBuilder()
                        .maximumSize(10_000)
                        .expireAfterWrite(identityTtl)
                        .executor(ForkJoinPool.commonPool())
                        .recordStats()
        );
        mgr.setCacheNames(List.of(IDENTITY_BY_ID));
        mgr.setAllowNullValues(false);
        return mgr;
    }

    /**
     * Cache failures never fail a request; the lookup falls through to the database.
     */
    @Bean
    @Override
    public CacheErrorHandler errorHandler() {
        return new CacheErrorHandler() {
            @Override
            public void handleCacheGetError(@NonNull RuntimeException exception,
                                            @NonNull Cache cache,
                                            @NonNull Object key) {
                log.warn("Cache GET error on {} key={}: {}", cache.getName(), key, exception.toString());
            }

            @Override
            public void handleCachePutError(@NonNull RuntimeException exception,
                                            @NonNull Cache cache,
                                            @NonNull Object key,
                                            @Nullable Object value) {
                log.warn("Cache PUT error on {} key={}: {}", cache.getName(), key, exception.toString());
            }

            @Override
            public void handleCacheEvictError(@NonNull RuntimeException exception,
                                              @NonNull Cache cache,
                                              @NonNull Object key) {
                log.warn("Cache EVICT error on {} key={}: {}", cache.getName(), key, exception.toString());
            }

            @Override
            public void handleCacheClearError(@NonNull RuntimeException exception,
                                              @NonNull Cache cache) {
                log.warn("Cache CLEAR error on {}: {}", cache.getName(), exception.toString());
            }
        };
    }
}

package com.storefront.authservice.config;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.api.StatefulConnection;
import io.lettuce.core.resource.DefaultClientResources;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.util.StringUtils;

import java.time.Duration;

/**
 * Lettuce wiring for the shared (multi-instance) lockout and revocation stores.
 * Only active with {@code app.security.store=redis}; the in-process stores need no Redis at all.
 */
@Configuration
@ConditionalOnProperty(prefix = "app.security", name = "store", havingValue = "redis")
@EnableConfigurationProperties(RedisProperties.class)
public class RedisConfig {

    @Bean(destroyMethod = "shutdown")
    DefaultClientResources lettuceClientResources() {
        return DefaultClientResources.create();
    }

    @Bean
    public LettuceConnectionFactory redisConnectionFactory(RedisProperties props,
                                                           DefaultClientResources clientResources) {
        RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration();
        standalone.setHostName(props.getHost());
        standalone.setPort(props.getPort());
        standalone.setDatabase(props.getDatabase());
        if (StringUtils.hasText(props.getUsername())) {
            standalone.setUsername(props.getUsername());
        }
        if (StringUtils.hasText(props.getPassword())) {
            standalone.setPassword(RedisPassword.of(props.getPassword()));
        }

        GenericObjectPoolConfig<StatefulConnection<?, ?>> pool = new GenericObjectPoolConfig<>();
        RedisProperties.Pool p = props.getLettuce().getPool();
        if (p != null && Boolean.TRUE.equals(p.getEnabled())) {
            pool.setMaxTotal(p.getMaxActive());
            pool.setMaxIdle(p.getMaxIdle());
            pool.setMinIdle(p.getMinIdle());
        } else {
            pool.setMaxTotal(32);
            pool.setMaxIdle(16);
            pool.setMinIdle(2);
            pool.setTestOnBorrow(true);
            pool.setTestWhileIdle(true);
        }

        // Every request touches the revocation store: keep command timeouts short.
        Duration cmdTimeout = props.getTimeout() != null ? props.getTimeout() : Duration.ofSeconds(2);

        LettucePoolingClientConfiguration.LettucePoolingClientConfigurationBuilder builder =
                LettucePoolingClientConfiguration.builder()
                        .clientResources(clientResources)
                        .commandTimeout(cmdTimeout)
                        .shutdownTimeout(Duration.ofSeconds(2))
                        .clientOptions(ClientOptions.builder()
                                .autoReconnect(true)
                                .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
                                .timeoutOptions(TimeoutOptions.enabled())
                                .build())
                        .poolConfig(pool);

        if (props.getSsl().isEnabled()) {
            builder.useSsl();
        }

        return new LettuceConnectionFactory(standalone, builder.build());
    }

    @Bean
    public StringRedisTemplate stringRedisTemplate(LettuceConnectionFactory cf) {
        StringRedisTemplate tpl = new StringRedisTemplate();
        tpl.setConnectionFactory(cf);
        tpl.afterPropertiesSet();
        return tpl;
    }
}

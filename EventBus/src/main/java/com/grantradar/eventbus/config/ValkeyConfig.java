package com.grantradar.eventbus.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;

/**
 * Valkey (Redis) connection settings.
 *
 * Only the configuration is exposed as beans; the connection factory itself
 * is created lazily by StreamConnectionManager.
 */
@Configuration
public class ValkeyConfig {

    @Bean
    public RedisStandaloneConfiguration redisStandaloneConfiguration(EventBusProperties properties) {
        EventBusProperties.RedisProps redis = properties.getRedis();

        RedisStandaloneConfiguration config = new RedisStandaloneConfiguration();
        config.setHostName(redis.getHost());
        config.setPort(redis.getPort());
        config.setDatabase(redis.getDatabase());

        if (redis.getPassword() != null && !redis.getPassword().isEmpty()) {
            config.setPassword(redis.getPassword());
        }

        return config;
    }

    @Bean
    public LettuceClientConfiguration lettuceClientConfiguration(EventBusProperties properties) {
        return LettuceClientConfiguration.builder()
                .commandTimeout(properties.getRedis().getTimeout())
                .build();
    }
}

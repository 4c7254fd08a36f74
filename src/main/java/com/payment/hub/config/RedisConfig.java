package com.payment.hub.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.payment.hub.cache.InMemoryKeyValueCache;
import com.payment.hub.cache.KeyValueCache;
import com.payment.hub.cache.RedisKeyValueCache;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Picks the key-value cache behind verification contexts and health probes:
 * Redis by default, in-process with {@code payment.cache.type=memory}.
 */
@Configuration
public class RedisConfig {

    @Bean
    @ConditionalOnProperty(name = "payment.cache.type", havingValue = "redis", matchIfMissing = true)
    public KeyValueCache redisKeyValueCache(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        return new RedisKeyValueCache(redisTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "payment.cache.type", havingValue = "memory")
    public KeyValueCache inMemoryKeyValueCache(Clock clock) {
        return new InMemoryKeyValueCache(clock);
    }
}

package com.payment.hub.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Redis-backed cache storing values as JSON strings. Redis being down degrades to
 * "always miss"; callers then fall through to the store or the provider.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisKeyValueCache implements KeyValueCache {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        try {
            String json = redisTemplate.opsForValue().get(key);
            if (json == null) {
                return Optional.empty();
            }
            return Optional.ofNullable(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            log.error("Cache value for key={} cannot be read as {}; treating as miss", key, type.getSimpleName(), e);
            return Optional.empty();
        } catch (DataAccessException e) {
            log.warn("Cache read failed for key={} (Redis unavailable): {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, Object value, Duration ttl) {
        if (value == null) {
            return;
        }
        try {
            redisTemplate.opsForValue().set(key, objectMapper.writeValueAsString(value), ttl);
            log.debug("Cached key={} ttl={}s", key, ttl.toSeconds());
        } catch (JsonProcessingException | DataAccessException e) {
            log.warn("Cache write failed for key={}: {}", key, e.getMessage());
        }
    }

    @Override
    public boolean putIfAbsent(String key, Object value, Duration ttl) {
        try {
            Boolean stored = redisTemplate.opsForValue().setIfAbsent(key, objectMapper.writeValueAsString(value), ttl);
            return Boolean.TRUE.equals(stored);
        } catch (JsonProcessingException | DataAccessException e) {
            log.warn("Cache putIfAbsent failed for key={}, assuming absent: {}", key, e.getMessage());
            return true;
        }
    }

    @Override
    public <T> T getOrCompute(String key, Duration ttl, Class<T> type, Supplier<T> producer) {
        Optional<T> cached = get(key, type);
        if (cached.isPresent()) {
            return cached.get();
        }
        T value = producer.get();
        put(key, value, ttl);
        return value;
    }

    @Override
    public void evict(String key) {
        try {
            redisTemplate.delete(key);
        } catch (DataAccessException e) {
            log.warn("Cache evict failed for key={}: {}", key, e.getMessage());
        }
    }
}

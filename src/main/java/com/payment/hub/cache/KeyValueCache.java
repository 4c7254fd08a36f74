package com.payment.hub.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Short-lived key/value memo used for verification contexts and health probes.
 * Implementations never throw on backend failure; a failed read is a miss and a failed
 * write is dropped.
 */
public interface KeyValueCache {

    <T> Optional<T> get(String key, Class<T> type);

    void put(String key, Object value, Duration ttl);

    /**
     * Stores {@code value} only when {@code key} is absent or expired.
     *
     * @return true when this call stored the value; also true when the backend is unavailable
     */
    boolean putIfAbsent(String key, Object value, Duration ttl);

    /**
     * Returns the cached value for {@code key}, or computes, stores and returns it. The
     * producer is called at most once per call; its exceptions propagate.
     */
    <T> T getOrCompute(String key, Duration ttl, Class<T> type, Supplier<T> producer);

    void evict(String key);
}

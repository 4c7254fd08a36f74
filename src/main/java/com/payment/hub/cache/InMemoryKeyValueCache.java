package com.payment.hub.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Process-local cache with per-entry expiry. Selected with {@code payment.cache.type=memory};
 * used for local runs and tests.
 */
@Slf4j
public class InMemoryKeyValueCache implements KeyValueCache {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryKeyValueCache() {
        this(Clock.systemUTC());
    }

    public InMemoryKeyValueCache(Clock clock) {
        this.clock = clock;
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        if (!type.isInstance(entry.value)) {
            log.warn("Cached value has unexpected type: key={}, expected={}, actual={}",
                    key, type.getSimpleName(), entry.value.getClass().getSimpleName());
            return Optional.empty();
        }
        return Optional.of(type.cast(entry.value));
    }

    @Override
    public void put(String key, Object value, Duration ttl) {
        if (value == null) {
            return;
        }
        entries.put(key, new Entry(value, clock.instant().plus(ttl)));
    }

    @Override
    public boolean putIfAbsent(String key, Object value, Duration ttl) {
        Entry candidate = new Entry(value, clock.instant().plus(ttl));
        Entry stored = entries.compute(key, (k, existing) ->
                existing != null && !existing.isExpired(clock.instant()) ? existing : candidate);
        return stored == candidate;
    }

    @Override
    public <T> T getOrCompute(String key, Duration ttl, Class<T> type, Supplier<T> producer) {
        Optional<T> cached = get(key, type);
        if (cached.isPresent()) {
            return cached.get();
        }
        // compute() holds the bin lock, so concurrent callers for one key share a single producer call
        Entry computed = entries.compute(key, (k, existing) -> {
            Instant now = clock.instant();
            if (existing != null && !existing.isExpired(now) && type.isInstance(existing.value)) {
                return existing;
            }
            T value = producer.get();
            return value == null ? null : new Entry(value, now.plus(ttl));
        });
        return computed == null ? null : type.cast(computed.value);
    }

    @Override
    public void evict(String key) {
        entries.remove(key);
    }

    private static final class Entry {
        private final Object value;
        private final Instant expiresAt;

        private Entry(Object value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        private boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}

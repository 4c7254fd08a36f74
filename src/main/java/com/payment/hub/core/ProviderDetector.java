package com.payment.hub.core;

import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Guesses the provider behind a reference from its prefix. A prefix only matches when an
 * underscore follows it, so "MONACO_1" is not taken for the "MON" provider. Longer
 * prefixes are tried first.
 */
@Slf4j
public class ProviderDetector {

    private static final char DELIMITER = '_';

    private final Map<String, String> prefixes = new ConcurrentHashMap<>();

    public ProviderDetector() {
        registerPrefix("PAYSTACK", "paystack");
        registerPrefix("FLW", "flutterwave");
        registerPrefix("MON", "monnify");
        registerPrefix("STRIPE", "stripe");
        registerPrefix("PAYPAL", "paypal");
        registerPrefix("SQUARE", "square");
    }

    public Optional<String> detectFromReference(String reference) {
        if (reference == null || reference.isBlank()) {
            return Optional.empty();
        }
        String upper = reference.trim().toUpperCase(Locale.ROOT);
        return prefixes.entrySet().stream()
                .sorted(Comparator.comparingInt((Map.Entry<String, String> e) -> e.getKey().length()).reversed()
                        .thenComparing(Map.Entry::getKey))
                .filter(e -> upper.length() > e.getKey().length()
                        && upper.startsWith(e.getKey())
                        && upper.charAt(e.getKey().length()) == DELIMITER)
                .map(Map.Entry::getValue)
                .findFirst();
    }

    /** Maps {@code prefix} (case-insensitive) to {@code provider}, replacing any earlier owner. */
    public ProviderDetector registerPrefix(String prefix, String provider) {
        String key = prefix.trim().toUpperCase(Locale.ROOT);
        String previous = prefixes.put(key, provider);
        if (previous != null && !previous.equals(provider)) {
            log.info("Reference prefix reassigned: prefix={}, from={}, to={}", key, previous, provider);
        }
        return this;
    }

    public Map<String, String> getPrefixes() {
        return new LinkedHashMap<>(prefixes);
    }
}

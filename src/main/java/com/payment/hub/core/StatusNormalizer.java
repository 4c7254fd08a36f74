package com.payment.hub.core;

import com.payment.hub.domain.PaymentStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps provider-native status tokens to canonical {@link PaymentStatus} values.
 * Per-provider overrides are consulted before the default table; matching ignores case.
 * Tokens nobody knows come back lower-cased rather than failing the caller.
 */
@Slf4j
public class StatusNormalizer {

    private static final String UNKNOWN = "unknown";

    private final Map<String, PaymentStatus> defaults = new ConcurrentHashMap<>();
    private final Map<String, Map<String, PaymentStatus>> providerOverrides = new ConcurrentHashMap<>();

    public StatusNormalizer() {
        register(defaults, PaymentStatus.SUCCESS,
                List.of("SUCCESS", "SUCCEEDED", "COMPLETED", "SUCCESSFUL", "PAID", "OVERPAID", "CAPTURED"));
        register(defaults, PaymentStatus.FAILED,
                List.of("FAILED", "REJECTED", "DECLINED", "DENIED", "EXPIRED", "ERROR"));
        register(defaults, PaymentStatus.CANCELLED,
                List.of("CANCELLED", "CANCELED", "VOIDED", "ABANDONED"));
        register(defaults, PaymentStatus.PENDING,
                List.of("PENDING", "PROCESSING", "PARTIALLY_PAID", "CREATED", "SAVED", "APPROVED",
                        "PAYER_ACTION_REQUIRED", "REQUIRES_ACTION", "REQUIRES_PAYMENT_METHOD",
                        "REQUIRES_CONFIRMATION", "ONGOING", "QUEUED"));
    }

    /** Normalizes against the default table only. */
    public String normalize(String status) {
        return normalize(status, null);
    }

    public String normalize(String status, String provider) {
        if (status == null || status.isBlank()) {
            return UNKNOWN;
        }
        String token = status.trim().toUpperCase(Locale.ROOT);
        if (provider != null) {
            Map<String, PaymentStatus> overrides = providerOverrides.get(provider.toLowerCase(Locale.ROOT));
            if (overrides != null && overrides.containsKey(token)) {
                return overrides.get(token).getValue();
            }
        }
        PaymentStatus mapped = defaults.get(token);
        if (mapped != null) {
            return mapped.getValue();
        }
        log.debug("Unmapped payment status passed through: provider={}, status={}", provider, status);
        return status.trim().toLowerCase(Locale.ROOT);
    }

    /** Adds or replaces provider-specific mappings; later registrations win. */
    public StatusNormalizer registerProviderMappings(String provider, Map<PaymentStatus, List<String>> mappings) {
        Map<String, PaymentStatus> overrides = providerOverrides.computeIfAbsent(
                provider.toLowerCase(Locale.ROOT), k -> new ConcurrentHashMap<>());
        mappings.forEach((canonical, tokens) -> register(overrides, canonical, tokens));
        return this;
    }

    /** Adds tokens to the default table. */
    public StatusNormalizer registerDefaultMappings(PaymentStatus canonical, List<String> tokens) {
        register(defaults, canonical, tokens);
        return this;
    }

    private static void register(Map<String, PaymentStatus> table, PaymentStatus canonical, List<String> tokens) {
        tokens.forEach(token -> table.put(token.trim().toUpperCase(Locale.ROOT), canonical));
    }
}

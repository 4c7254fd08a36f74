package com.payment.hub.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Canonical payment states. Every provider-native status is normalized to one of these
 * before it leaves the status normalizer.
 */
public enum PaymentStatus {
    SUCCESS("success"),
    FAILED("failed"),
    PENDING("pending"),
    CANCELLED("cancelled");

    private final String value;

    PaymentStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isSuccessful() {
        return this == SUCCESS;
    }

    /** Cancelled payments count as failed for reporting. */
    public boolean isFailed() {
        return this == FAILED || this == CANCELLED;
    }

    public boolean isPending() {
        return this == PENDING;
    }

    public static Optional<PaymentStatus> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(status -> status.value.equals(normalized))
                .findFirst();
    }

    public static boolean isCanonical(String value) {
        return fromValue(value).isPresent();
    }
}

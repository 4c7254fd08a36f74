package com.payment.hub.driver;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.hub.domain.ChargeRequest;
import com.payment.hub.domain.ChargeResponse;
import com.payment.hub.domain.VerificationResponse;
import org.springframework.http.HttpHeaders;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Contract every payment provider integration implements. Implementations are created once
 * per provider by the {@code DriverFactory} and shared, so they must be thread-safe.
 */
public interface PaymentDriver {

    /** Provider name as configured, e.g. "paystack". */
    String getName();

    List<String> getSupportedCurrencies();

    default boolean isCurrencySupported(String currency) {
        if (currency == null) {
            return false;
        }
        String upper = currency.toUpperCase(Locale.ROOT);
        return getSupportedCurrencies().stream().anyMatch(c -> c.equalsIgnoreCase(upper));
    }

    /**
     * Initializes a charge with the provider.
     *
     * @throws com.payment.hub.exception.ChargeException when the provider refuses or cannot be reached
     */
    ChargeResponse charge(ChargeRequest request);

    /**
     * Re-checks a transaction with the provider. {@code verificationId} is whatever
     * {@link #resolveVerificationId} returned for it.
     *
     * @throws com.payment.hub.exception.VerificationException when the provider refuses or cannot be reached
     */
    VerificationResponse verify(String verificationId);

    /**
     * Checks the provider signature over the raw body and the payload timestamp. A false
     * answer means the delivery must be dropped.
     */
    boolean validateWebhook(HttpHeaders headers, String rawBody);

    /** Live probe; anything below a 5xx counts as healthy. */
    boolean healthCheck();

    /** {@link #healthCheck()} memoized for the configured health TTL. */
    boolean getCachedHealthCheck();

    default String extractWebhookReference(JsonNode payload) {
        return text(payload, "reference", "transactionReference");
    }

    /** Provider-native status; normalization happens in the webhook processor. */
    default String extractWebhookStatus(JsonNode payload) {
        String status = text(payload, "status", "paymentStatus", "payment_status");
        return status != null ? status : "unknown";
    }

    default String extractWebhookChannel(JsonNode payload) {
        return text(payload, "channel", "paymentMethod");
    }

    default Optional<Instant> extractWebhookTimestamp(JsonNode payload) {
        return Optional.empty();
    }

    /**
     * Picks the id the provider's verify call expects. By default the provider-issued id
     * saved at charge time, or the reference when none was saved.
     */
    default String resolveVerificationId(String reference, String providerId) {
        return providerId != null && !providerId.isBlank() ? providerId : reference;
    }

    /** First non-blank textual field among {@code fields}, or null. */
    static String text(JsonNode node, String... fields) {
        if (node == null) {
            return null;
        }
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }
}

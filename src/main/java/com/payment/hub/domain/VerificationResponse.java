package com.payment.hub.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Result of re-checking a transaction with its provider. {@code status} has already been
 * through the status normalizer.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class VerificationResponse {

    String reference;
    String status;
    BigDecimal amount;
    String currency;
    Instant paidAt;
    String channel;
    String cardType;
    String bank;
    Map<String, Object> customer;
    Map<String, Object> metadata;
    String provider;

    public boolean isSuccessful() {
        return PaymentStatus.fromValue(status).map(PaymentStatus::isSuccessful).orElse(false);
    }

    public boolean isFailed() {
        return PaymentStatus.fromValue(status).map(PaymentStatus::isFailed).orElse(false);
    }

    public boolean isPending() {
        return PaymentStatus.fromValue(status).map(PaymentStatus::isPending).orElse(false);
    }
}

package com.payment.hub.messaging;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Lifecycle event published to Kafka whenever a charge is initialized, a payment is
 * verified or a webhook changes a transaction. Keyed by reference so every event for one
 * payment lands on the same partition.
 */
@Value
@Builder
@Jacksonized
public class PaymentEvent {

    String eventId;
    /** CHARGE_INITIALIZED, PAYMENT_VERIFIED, WEBHOOK_PROCESSED */
    String eventType;
    String reference;
    String provider;
    String providerId;
    /** Canonical status, or the provider's own word when it had no canonical mapping. */
    String status;
    BigDecimal amount;
    String currency;
    String channel;
    Instant timestamp;
}

package com.payment.hub.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Transaction as seen by the transaction store. Created on a successful charge and later
 * mutated by verify and webhook processing.
 */
@Value
@Builder(toBuilder = true)
public class TransactionRecord {

    String reference;
    String provider;
    /** Provider-issued id (access code, session, order id) needed by some providers to verify. */
    String providerId;
    String status;
    BigDecimal amount;
    String currency;
    String email;
    String channel;
    Instant paidAt;
    Map<String, Object> metadata;
    Map<String, Object> customer;
}

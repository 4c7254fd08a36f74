package com.payment.hub.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Canonical fields written back to a stored transaction. Null fields are left untouched.
 */
@Value
@Builder
public class TransactionUpdate {

    String status;
    String channel;
    Instant paidAt;
}

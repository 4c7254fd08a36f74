package com.payment.hub.webhook;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * An authenticated webhook delivery waiting to be processed. The body is kept exactly as
 * received so processing reads the same bytes the signature was checked against.
 */
@Value
@Builder
@Jacksonized
public class WebhookJob {

    String jobId;
    String provider;
    String payload;
    Instant receivedAt;
}

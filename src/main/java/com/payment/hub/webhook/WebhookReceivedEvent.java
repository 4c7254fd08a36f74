package com.payment.hub.webhook;

import lombok.Value;

/**
 * Published in-process after a webhook has been applied to its transaction. Not published
 * for duplicate deliveries that changed nothing.
 */
@Value
public class WebhookReceivedEvent {

    String provider;
    String reference;
    /** Canonical status, or the provider's own word lower-cased when it had no mapping. */
    String status;
    String channel;
    String payload;
}

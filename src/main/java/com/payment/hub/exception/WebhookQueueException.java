package com.payment.hub.exception;

/**
 * A verified webhook could not be handed to the queue.
 */
public class WebhookQueueException extends PaymentException {

    public WebhookQueueException(String message, Throwable cause) {
        super(message, cause);
    }
}

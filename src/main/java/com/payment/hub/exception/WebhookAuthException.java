package com.payment.hub.exception;

/**
 * Webhook rejected because its signature or timestamp did not check out. The delivery is
 * not queued.
 */
public class WebhookAuthException extends PaymentException {

    private final String provider;

    public WebhookAuthException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}

package com.payment.hub.exception;

/**
 * A driver was constructed with missing or invalid settings. Raised before any network
 * call and never retried.
 */
public class InvalidConfigurationException extends PaymentException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

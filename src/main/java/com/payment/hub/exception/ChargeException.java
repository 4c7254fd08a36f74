package com.payment.hub.exception;

/**
 * A single provider failed to initialize a charge.
 */
public class ChargeException extends PaymentException {

    public ChargeException(String message) {
        super(message);
    }

    public ChargeException(String message, Throwable cause) {
        super(message, cause);
    }
}

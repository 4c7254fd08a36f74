package com.payment.hub.exception;

/**
 * A single provider could not verify a transaction.
 */
public class VerificationException extends PaymentException {

    public VerificationException(String message) {
        super(message);
    }

    public VerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}

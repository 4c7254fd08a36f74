package com.payment.hub.exception;

/**
 * Unknown or disabled provider requested, or no driver implementation could be resolved.
 */
public class DriverNotFoundException extends PaymentException {

    public DriverNotFoundException(String message) {
        super(message);
    }

    public DriverNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}

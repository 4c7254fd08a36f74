package com.payment.hub.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base of every error raised by the payment core. Carries an optional, immutable context
 * map (provider, reference, ...) for logging and API responses.
 */
public class PaymentException extends RuntimeException {

    private final Map<String, Object> context;

    public PaymentException(String message) {
        this(message, null, Collections.emptyMap());
    }

    public PaymentException(String message, Throwable cause) {
        this(message, cause, Collections.emptyMap());
    }

    public PaymentException(String message, Throwable cause, Map<String, ?> context) {
        super(message, cause);
        this.context = context == null || context.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public Map<String, Object> getContext() {
        return context;
    }
}

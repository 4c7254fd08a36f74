package com.payment.hub.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Every candidate provider failed. {@link #getErrors()} keeps one message per provider in
 * the order the providers were attempted.
 */
public class ProviderAggregateException extends PaymentException {

    private final Map<String, String> errors;

    public ProviderAggregateException(String message, Map<String, String> errors) {
        super(message, null, Map.of("exceptions", copy(errors)));
        this.errors = copy(errors);
    }

    public Map<String, String> getErrors() {
        return errors;
    }

    private static Map<String, String> copy(Map<String, String> errors) {
        return errors == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }
}

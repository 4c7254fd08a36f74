package com.payment.hub.driver;

/**
 * Builds a driver from its settings. Registered per provider name with the
 * {@code DriverFactory}.
 */
@FunctionalInterface
public interface DriverConstructor {

    PaymentDriver create(DriverSettings settings, DriverContext context);
}

package com.payment.hub.core;

import com.payment.hub.driver.DriverConstructor;
import com.payment.hub.driver.DriverContext;
import com.payment.hub.driver.DriverSettings;
import com.payment.hub.driver.PaymentDriver;
import com.payment.hub.exception.DriverNotFoundException;
import com.payment.hub.exception.InvalidConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Turns a provider name into a driver instance. Resolution order:
 * <ol>
 *   <li>a constructor registered for the name,</li>
 *   <li>the configured {@code driver-class},</li>
 *   <li>the naming convention {@code <drivers package>.<PascalCase>Driver},</li>
 *   <li>the name itself read as a class name.</li>
 * </ol>
 * Class-based drivers need a public {@code (DriverSettings, DriverContext)} constructor.
 */
@Slf4j
public class DriverFactory {

    public static final String CONVENTION_PACKAGE = "com.payment.hub.drivers";

    /** Brands whose class name is not a plain capitalization of the provider name. */
    private static final Map<String, String> SPECIAL_CASES = Map.of(
            "paypal", "PayPal",
            "nowpayments", "NowPayments",
            "opay", "OPay");

    private final Map<String, DriverConstructor> registered = new ConcurrentHashMap<>();
    private final DriverContext context;

    public DriverFactory(DriverContext context) {
        this.context = context;
    }

    public DriverFactory register(String name, DriverConstructor constructor) {
        registered.put(name.toLowerCase(Locale.ROOT), constructor);
        log.debug("Registered driver constructor: name={}", name);
        return this;
    }

    public boolean isRegistered(String name) {
        return name != null && registered.containsKey(name.toLowerCase(Locale.ROOT));
    }

    public Set<String> getRegisteredDrivers() {
        return new TreeSet<>(registered.keySet());
    }

    /**
     * @param driverName  registry name or class name ({@code driver} setting, defaults to the provider name)
     * @param driverClass optional fully qualified implementation
     * @throws DriverNotFoundException      when nothing resolves
     * @throws InvalidConfigurationException when the driver rejects its settings
     */
    public PaymentDriver create(String driverName, String driverClass, DriverSettings settings) {
        DriverConstructor constructor = registered.get(driverName.toLowerCase(Locale.ROOT));
        if (constructor != null) {
            log.debug("Creating driver from registry: provider={}, driver={}", settings.getName(), driverName);
            return constructor.create(settings, context);
        }
        if (driverClass != null && !driverClass.isBlank()) {
            Class<?> configured = loadClass(driverClass.trim());
            if (configured != null) {
                return instantiate(configured, settings);
            }
            log.warn("Configured driver-class not found, trying conventions: provider={}, driverClass={}",
                    settings.getName(), driverClass);
        }
        Class<?> byConvention = loadClass(conventionClassName(driverName));
        if (byConvention != null) {
            return instantiate(byConvention, settings);
        }
        Class<?> literal = loadClass(driverName);
        if (literal != null) {
            return instantiate(literal, settings);
        }
        throw new DriverNotFoundException("No driver found for provider '" + settings.getName()
                + "' (driver '" + driverName + "')");
    }

    /** "paystack" -> com.payment.hub.drivers.PaystackDriver, "pay-pal"/"paypal" -> PayPalDriver. */
    public static String conventionClassName(String driverName) {
        String key = driverName.trim().toLowerCase(Locale.ROOT);
        String pascal = SPECIAL_CASES.get(key.replaceAll("[-_\\s]", ""));
        if (pascal == null) {
            pascal = Arrays.stream(key.split("[-_\\s]+"))
                    .filter(part -> !part.isEmpty())
                    .map(part -> Character.toUpperCase(part.charAt(0)) + part.substring(1))
                    .collect(Collectors.joining());
        }
        return CONVENTION_PACKAGE + "." + pascal + "Driver";
    }

    private PaymentDriver instantiate(Class<?> type, DriverSettings settings) {
        if (!PaymentDriver.class.isAssignableFrom(type)) {
            throw new DriverNotFoundException("Driver class " + type.getName() + " does not implement PaymentDriver");
        }
        try {
            Constructor<?> constructor = type.getConstructor(DriverSettings.class, DriverContext.class);
            log.debug("Creating driver by class: provider={}, class={}", settings.getName(), type.getName());
            return (PaymentDriver) constructor.newInstance(settings, context);
        } catch (NoSuchMethodException e) {
            throw new DriverNotFoundException("Driver class " + type.getName()
                    + " needs a public (DriverSettings, DriverContext) constructor", e);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new InvalidConfigurationException("Driver " + type.getName() + " failed to initialize", e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new DriverNotFoundException("Driver class " + type.getName() + " cannot be instantiated", e);
        }
    }

    private static Class<?> loadClass(String name) {
        if (name == null || name.isBlank() || !name.contains(".")) {
            return null;
        }
        try {
            return Class.forName(name, true, DriverFactory.class.getClassLoader());
        } catch (ClassNotFoundException | LinkageError e) {
            return null;
        }
    }
}

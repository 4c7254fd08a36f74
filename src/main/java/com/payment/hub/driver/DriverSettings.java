package com.payment.hub.driver;

import com.payment.hub.exception.InvalidConfigurationException;
import org.springframework.boot.convert.DurationStyle;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Validated view over one provider's configuration block. Keys are kebab-case
 * ({@code secret-key}, {@code base-url}).
 */
public class DriverSettings {

    private final String name;
    private final Map<String, String> values;
    private final List<String> currencies;

    public DriverSettings(String name, Map<String, String> values, List<String> currencies) {
        this.name = name;
        this.values = values == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.currencies = currencies == null
                ? List.of()
                : currencies.stream().map(c -> c.trim().toUpperCase(Locale.ROOT)).collect(Collectors.toUnmodifiableList());
    }

    public String getName() {
        return name;
    }

    public List<String> getCurrencies() {
        return currencies;
    }

    public String get(String key) {
        String value = values.get(key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    public String get(String key, String defaultValue) {
        String value = get(key);
        return value != null ? value : defaultValue;
    }

    /**
     * @throws InvalidConfigurationException naming the missing field
     */
    public String require(String key) {
        String value = get(key);
        if (value == null) {
            throw new InvalidConfigurationException(
                    "Missing required setting '" + key + "' for provider '" + name + "'");
        }
        return value;
    }

    /** Accepts "30s", "PT30S" or a bare number of seconds. */
    public Duration getDuration(String key, Duration defaultValue) {
        String value = get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            if (value.chars().allMatch(Character::isDigit)) {
                return Duration.ofSeconds(Long.parseLong(value));
            }
            return DurationStyle.detectAndParse(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException(
                    "Setting '" + key + "' for provider '" + name + "' is not a duration: " + value, e);
        }
    }
}

package com.payment.hub.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.Currency;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Canonical charge request handed to every driver. Validated once at construction, so a
 * driver never sees a partially valid request.
 */
@Value
public class ChargeRequest {

    private static final BigDecimal MAX_AMOUNT = new BigDecimal("999999999.99");
    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    /** Amount in major units (e.g. 100.00 NGN). */
    BigDecimal amount;

    /** ISO 4217 currency code, upper-cased. */
    String currency;

    String email;

    /** Merchant reference; drivers generate one when absent. */
    String reference;

    String callbackUrl;

    /** Forwarded unchanged to the provider on every attempt. */
    String idempotencyKey;

    String description;

    Map<String, Object> metadata;

    /** Canonical channel values ({@link PaymentChannel}); null means provider defaults. */
    List<String> channels;

    Map<String, Object> customer;

    @Builder(toBuilder = true)
    private ChargeRequest(BigDecimal amount, String currency, String email, String reference,
                          String callbackUrl, String idempotencyKey, String description,
                          Map<String, Object> metadata, List<String> channels,
                          Map<String, Object> customer) {
        BigDecimal scaled = amount == null ? null : amount.setScale(2, RoundingMode.HALF_UP);
        if (scaled == null || scaled.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be greater than zero");
        }
        if (scaled.compareTo(MAX_AMOUNT) > 0) {
            throw new IllegalArgumentException("Amount exceeds maximum allowed value");
        }
        if (currency == null || currency.isBlank()) {
            throw new IllegalArgumentException("Currency is required");
        }
        if (currency.trim().length() != 3) {
            throw new IllegalArgumentException("Currency must be a 3-letter ISO code");
        }
        if (email == null || !EMAIL.matcher(email).matches()) {
            throw new IllegalArgumentException("Invalid email address");
        }
        if (channels != null && channels.contains(null)) {
            throw new IllegalArgumentException("Channels must not contain empty entries");
        }
        this.amount = scaled;
        this.currency = currency.trim().toUpperCase(Locale.ROOT);
        this.email = email;
        this.reference = blankToNull(reference);
        this.callbackUrl = blankToNull(callbackUrl);
        this.idempotencyKey = blankToNull(idempotencyKey);
        this.description = blankToNull(description);
        this.metadata = metadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.channels = channels == null ? null : List.copyOf(channels);
        this.customer = customer == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(customer));
    }

    /**
     * Amount in the currency's smallest unit (kobo, cents). Currencies unknown to the JDK
     * are assumed to have two decimals.
     */
    public long getAmountInMinorUnits() {
        int digits;
        try {
            digits = Math.max(Currency.getInstance(currency).getDefaultFractionDigits(), 0);
        } catch (IllegalArgumentException e) {
            digits = 2;
        }
        return amount.movePointRight(digits).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    public boolean hasChannels() {
        return channels != null && !channels.isEmpty();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}

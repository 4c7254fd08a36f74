package com.payment.hub.domain;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Provider-neutral payment channels a caller may restrict a charge to.
 */
public enum PaymentChannel {
    CARD("card"),
    BANK_TRANSFER("bank_transfer"),
    USSD("ussd"),
    MOBILE_MONEY("mobile_money"),
    QR_CODE("qr_code");

    private final String value;

    PaymentChannel(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static List<String> toValues(PaymentChannel... channels) {
        return Arrays.stream(channels).map(PaymentChannel::getValue).collect(Collectors.toList());
    }

    public static List<String> allValues() {
        return toValues(values());
    }
}

package com.payment.hub.webhook.signature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * The header value is the credential itself; no hashing involved.
 */
public final class SharedSecretVerifier {

    private SharedSecretVerifier() {
    }

    public static boolean matches(String expectedSecret, String headerValue) {
        if (expectedSecret == null || expectedSecret.isEmpty() || headerValue == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expectedSecret.getBytes(StandardCharsets.UTF_8),
                headerValue.trim().getBytes(StandardCharsets.UTF_8));
    }
}

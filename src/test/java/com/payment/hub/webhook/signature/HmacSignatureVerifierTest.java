package com.payment.hub.webhook.signature;

import com.payment.hub.webhook.signature.HmacSignatureVerifier.Algorithm;
import com.payment.hub.webhook.signature.HmacSignatureVerifier.Encoding;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HmacSignatureVerifierTest {

    private static final String MESSAGE = "The quick brown fox jumps over the lazy dog";

    @Test
    void sha512HexMatchesKnownDigest() {
        HmacSignatureVerifier verifier = new HmacSignatureVerifier(Algorithm.SHA512, Encoding.HEX);

        assertThat(verifier.sign("key", MESSAGE)).isEqualTo(
                "b42af09057bac1e2d41708e48a902e09b5ff7f12ab428a4fe86653c73dd248fb"
                        + "82f948a549f7b791a5b41915ee4d1ec3935357e4e2317250d0372afa2ebeeb3a");
    }

    @Test
    void sha256Base64MatchesKnownDigest() {
        HmacSignatureVerifier verifier = new HmacSignatureVerifier(Algorithm.SHA256, Encoding.BASE64);

        assertThat(verifier.verify("key", MESSAGE, "97yD9DBThCSxMpjmqm+xQ+9NWaFJRhdZl0edvC0aPNg=")).isTrue();
    }

    @Test
    void hexComparisonIgnoresCase() {
        HmacSignatureVerifier verifier = new HmacSignatureVerifier(Algorithm.SHA512, Encoding.HEX);
        String signature = verifier.sign("secret", "{\"event\":\"charge.success\"}");

        assertThat(verifier.verify("secret", "{\"event\":\"charge.success\"}", signature.toUpperCase())).isTrue();
    }

    @Test
    void rejectsTamperedBodyWrongSecretAndMissingSignature() {
        HmacSignatureVerifier verifier = new HmacSignatureVerifier(Algorithm.SHA512, Encoding.HEX);
        String signature = verifier.sign("secret", "{\"amount\":100}");

        assertThat(verifier.verify("secret", "{\"amount\":1000}", signature)).isFalse();
        assertThat(verifier.verify("other", "{\"amount\":100}", signature)).isFalse();
        assertThat(verifier.verify("secret", "{\"amount\":100}", null)).isFalse();
        assertThat(verifier.verify(null, "{\"amount\":100}", signature)).isFalse();
    }

    @Test
    void sharedSecretRequiresExactMatch() {
        assertThat(SharedSecretVerifier.matches("hash-123", "hash-123")).isTrue();
        assertThat(SharedSecretVerifier.matches("hash-123", "hash-124")).isFalse();
        assertThat(SharedSecretVerifier.matches("hash-123", null)).isFalse();
        assertThat(SharedSecretVerifier.matches(null, "hash-123")).isFalse();
    }
}

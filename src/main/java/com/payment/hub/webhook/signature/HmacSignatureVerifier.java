package com.payment.hub.webhook.signature;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Locale;

/**
 * HMAC over the raw request body with a shared secret, compared in constant time against
 * the signature a provider puts in a header.
 */
public class HmacSignatureVerifier {

    public enum Algorithm {
        SHA256("HmacSHA256"),
        SHA512("HmacSHA512");

        private final String jcaName;

        Algorithm(String jcaName) {
            this.jcaName = jcaName;
        }
    }

    public enum Encoding {
        HEX,
        BASE64
    }

    private final Algorithm algorithm;
    private final Encoding encoding;

    public HmacSignatureVerifier(Algorithm algorithm, Encoding encoding) {
        this.algorithm = algorithm;
        this.encoding = encoding;
    }

    public boolean verify(String secret, String signedContent, String providedSignature) {
        if (secret == null || secret.isEmpty() || providedSignature == null || providedSignature.isBlank()) {
            return false;
        }
        String expected = sign(secret, signedContent);
        String provided = providedSignature.trim();
        if (encoding == Encoding.HEX) {
            provided = provided.toLowerCase(Locale.ROOT);
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                provided.getBytes(StandardCharsets.UTF_8));
    }

    public String sign(String secret, String content) {
        try {
            Mac mac = Mac.getInstance(algorithm.jcaName);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), algorithm.jcaName));
            byte[] digest = mac.doFinal(content == null ? new byte[0] : content.getBytes(StandardCharsets.UTF_8));
            return encoding == Encoding.HEX
                    ? HexFormat.of().formatHex(digest)
                    : Base64.getEncoder().encodeToString(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(algorithm.jcaName + " is not available", e);
        }
    }
}

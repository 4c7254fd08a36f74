package com.payment.hub.webhook.signature;

import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.Signature;
import java.security.cert.X509Certificate;
import java.util.Base64;
import java.util.Locale;
import java.util.Set;
import java.util.zip.CRC32;

/**
 * Verifies a base64 signature over {@code transmissionId|timestamp|webhookId|crc32(body)}
 * with the public key of a certificate fetched from the provider. Certificate URLs must be
 * https and on an allowed host, so a forged header cannot point verification at an
 * attacker's certificate.
 */
@Slf4j
public class CertificateSignatureVerifier {

    private final CertificateFetcher fetcher;
    private final Set<String> allowedHostSuffixes;

    public CertificateSignatureVerifier(CertificateFetcher fetcher, Set<String> allowedHostSuffixes) {
        this.fetcher = fetcher;
        this.allowedHostSuffixes = allowedHostSuffixes;
    }

    public boolean verify(String certificateUrl, String algorithm, String transmissionId,
                          String timestamp, String webhookId, String body, String signature) {
        if (isBlank(certificateUrl) || isBlank(transmissionId) || isBlank(timestamp)
                || isBlank(webhookId) || isBlank(signature)) {
            return false;
        }
        if (!isTrustedUrl(certificateUrl)) {
            log.warn("Webhook certificate URL is not trusted: host={}", hostOf(certificateUrl));
            return false;
        }
        try {
            X509Certificate certificate = fetcher.fetch(certificateUrl);
            certificate.checkValidity();
            Signature verifier = Signature.getInstance(jcaAlgorithm(algorithm));
            verifier.initVerify(certificate.getPublicKey());
            verifier.update(signedContent(transmissionId, timestamp, webhookId, body).getBytes(StandardCharsets.UTF_8));
            return verifier.verify(Base64.getDecoder().decode(signature.trim()));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            log.warn("Webhook certificate verification failed: {}", e.getMessage());
            return false;
        }
    }

    public static String signedContent(String transmissionId, String timestamp, String webhookId, String body) {
        CRC32 crc = new CRC32();
        crc.update((body == null ? "" : body).getBytes(StandardCharsets.UTF_8));
        return transmissionId + "|" + timestamp + "|" + webhookId + "|" + crc.getValue();
    }

    private boolean isTrustedUrl(String url) {
        try {
            URI uri = URI.create(url);
            String host = uri.getHost();
            if (!"https".equalsIgnoreCase(uri.getScheme()) || host == null) {
                return false;
            }
            String lowerHost = host.toLowerCase(Locale.ROOT);
            return allowedHostSuffixes.stream()
                    .anyMatch(suffix -> lowerHost.equals(suffix) || lowerHost.endsWith("." + suffix));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    // Providers send e.g. "SHA256withRSA"; absent means the same.
    private static String jcaAlgorithm(String algorithm) {
        return isBlank(algorithm) ? "SHA256withRSA" : algorithm.trim();
    }

    private static String hostOf(String url) {
        try {
            return URI.create(url).getHost();
        } catch (IllegalArgumentException e) {
            return "invalid";
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

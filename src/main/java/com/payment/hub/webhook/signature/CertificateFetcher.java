package com.payment.hub.webhook.signature;

import java.security.cert.X509Certificate;

/**
 * Loads the signing certificate a provider points to in its webhook headers.
 */
@FunctionalInterface
public interface CertificateFetcher {

    X509Certificate fetch(String certificateUrl);
}

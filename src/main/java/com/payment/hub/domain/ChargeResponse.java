package com.payment.hub.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * What a provider handed back when a charge was initialized. The payer finishes the
 * payment at {@link #authorizationUrl}; the outcome is learned later by verify or webhook.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChargeResponse {

    String reference;
    String authorizationUrl;
    /** Provider-issued access code, session, order or payment-link id. */
    String accessCode;
    /** Provider status at creation time, always pending-like. */
    String status;
    Map<String, Object> metadata;
    String provider;

    public boolean isPending() {
        return "pending".equalsIgnoreCase(status);
    }
}

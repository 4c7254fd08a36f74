package com.payment.hub.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Which provider to ask about a reference, and the provider-side id saved at charge time
 * (may be null when only the provider is known).
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class VerificationContext {

    String provider;
    String providerId;

    /** Where the context came from, for logging. */
    Source source;

    public enum Source {
        EXPLICIT,
        CACHE,
        STORE,
        HEURISTIC
    }
}

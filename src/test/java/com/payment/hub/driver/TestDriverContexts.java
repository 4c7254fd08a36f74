package com.payment.hub.driver;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.payment.hub.cache.InMemoryKeyValueCache;
import com.payment.hub.core.ChannelMapper;
import com.payment.hub.core.StatusNormalizer;
import com.payment.hub.webhook.signature.CertificateFetcher;
import com.payment.hub.webhook.signature.ReplayGuard;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Driver contexts for unit tests: in-memory cache, fixed clock, five minute replay window.
 */
public final class TestDriverContexts {

    public static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private TestDriverContexts() {
    }

    public static DriverContext create() {
        return create(Clock.fixed(NOW, ZoneOffset.UTC), url -> {
            throw new IllegalArgumentException("No certificate for " + url);
        });
    }

    public static DriverContext create(Clock clock, CertificateFetcher certificateFetcher) {
        ObjectMapper objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return DriverContext.builder()
                .statusNormalizer(new StatusNormalizer())
                .channelMapper(new ChannelMapper())
                .cache(new InMemoryKeyValueCache(clock))
                .replayGuard(new ReplayGuard(clock, Duration.ofMinutes(5), false))
                .certificateFetcher(certificateFetcher)
                .objectMapper(objectMapper)
                .clock(clock)
                .build();
    }
}

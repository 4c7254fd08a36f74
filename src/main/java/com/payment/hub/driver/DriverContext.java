package com.payment.hub.driver;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.payment.hub.cache.KeyValueCache;
import com.payment.hub.core.ChannelMapper;
import com.payment.hub.core.StatusNormalizer;
import com.payment.hub.webhook.signature.CertificateFetcher;
import com.payment.hub.webhook.signature.ReplayGuard;
import lombok.Builder;
import lombok.Value;

import java.time.Clock;
import java.time.Duration;

/**
 * Shared collaborators handed to every driver at construction.
 */
@Value
@Builder
public class DriverContext {

    StatusNormalizer statusNormalizer;
    ChannelMapper channelMapper;
    KeyValueCache cache;
    ReplayGuard replayGuard;
    CertificateFetcher certificateFetcher;
    ObjectMapper objectMapper;
    Clock clock;

    @Builder.Default
    Duration healthCacheTtl = Duration.ofMinutes(5);

    /** Connect and read timeout used when a provider sets none. */
    @Builder.Default
    Duration defaultTimeout = Duration.ofSeconds(30);
}

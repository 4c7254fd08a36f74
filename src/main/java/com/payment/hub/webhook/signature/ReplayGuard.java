package com.payment.hub.webhook.signature;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Rejects webhook deliveries whose embedded timestamp is further than the tolerance from
 * now, in either direction. Every signature scheme runs this after its signature check.
 */
@Slf4j
public class ReplayGuard {

    private static final long EPOCH_MILLIS_THRESHOLD = 100_000_000_000L;

    private static final List<DateTimeFormatter> LOCAL_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss[.SSS]", Locale.ROOT),
            DateTimeFormatter.ofPattern("dd/MM/yyyy hh:mm:ss a", Locale.US),
            DateTimeFormatter.ISO_LOCAL_DATE_TIME);

    private final Clock clock;
    private final Duration tolerance;
    private final boolean requireTimestamp;

    public ReplayGuard(Clock clock, Duration tolerance, boolean requireTimestamp) {
        this.clock = clock;
        this.tolerance = tolerance;
        this.requireTimestamp = requireTimestamp;
    }

    /**
     * @param issuedAt timestamp carried by the payload, or null when it has none
     */
    public boolean isFresh(Instant issuedAt) {
        if (issuedAt == null) {
            if (requireTimestamp) {
                log.warn("Webhook rejected: payload carries no timestamp");
            }
            return !requireTimestamp;
        }
        Duration skew = Duration.between(issuedAt, clock.instant()).abs();
        if (skew.compareTo(tolerance) > 0) {
            log.warn("Webhook rejected: timestamp outside tolerance, issuedAt={}, skewSeconds={}, toleranceSeconds={}",
                    issuedAt, skew.toSeconds(), tolerance.toSeconds());
            return false;
        }
        return true;
    }

    public Duration getTolerance() {
        return tolerance;
    }

    /**
     * Reads a timestamp node: epoch seconds or millis (number or numeric string), ISO-8601
     * with or without offset, or a few common provider layouts taken as UTC. Anything
     * else reads as absent.
     */
    public static Optional<Instant> parseTimestamp(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Optional.empty();
        }
        if (node.isNumber()) {
            return Optional.of(fromEpoch(node.asLong()));
        }
        return parseTimestamp(node.asText());
    }

    public static Optional<Instant> parseTimestamp(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String value = text.trim();
        if (value.chars().allMatch(Character::isDigit)) {
            try {
                return Optional.of(fromEpoch(Long.parseLong(value)));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        Optional<Instant> withOffset = tryParse(() -> OffsetDateTime.parse(value).toInstant());
        if (withOffset.isPresent()) {
            return withOffset;
        }
        for (DateTimeFormatter format : LOCAL_FORMATS) {
            Optional<Instant> local = tryParse(() -> LocalDateTime.parse(value, format).toInstant(ZoneOffset.UTC));
            if (local.isPresent()) {
                return local;
            }
        }
        log.debug("Unrecognised webhook timestamp layout: {}", value);
        return Optional.empty();
    }

    private static Optional<Instant> tryParse(Supplier<Instant> parser) {
        try {
            return Optional.of(parser.get());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Instant fromEpoch(long value) {
        return value >= EPOCH_MILLIS_THRESHOLD ? Instant.ofEpochMilli(value) : Instant.ofEpochSecond(value);
    }
}

package com.payment.hub.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payment.hub.cache.KeyValueCache;
import com.payment.hub.config.PaymentProperties;
import com.payment.hub.core.PaymentOrchestrator;
import com.payment.hub.core.StatusNormalizer;
import com.payment.hub.domain.PaymentStatus;
import com.payment.hub.domain.TransactionUpdate;
import com.payment.hub.driver.PaymentDriver;
import com.payment.hub.messaging.PaymentEventProducer;
import com.payment.hub.persistence.service.TransactionStore;
import com.payment.hub.persistence.service.TransactionStore.UpdateOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Applies a queued webhook to its transaction. The store update runs under a row lock on
 * the reference, so concurrent deliveries for one payment are applied one after the other.
 * Each delivery is claimed in the cache by a hash of its provider and body; a redelivery of
 * the same body within {@code payment.webhook.delivery-ttl} produces no second event.
 * <p>
 * Malformed payloads and payloads without a reference are dropped; they will not improve
 * on retry. Store failures propagate so the listener container retries the job.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookProcessor {

    public static final String DELIVERY_KEY_PREFIX = "payments:webhook:delivery:";

    private final PaymentOrchestrator orchestrator;
    private final StatusNormalizer statusNormalizer;
    private final TransactionStore transactionStore;
    private final KeyValueCache cache;
    private final PaymentProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final PaymentEventProducer eventProducer;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public void process(WebhookJob job) {
        PaymentDriver driver = orchestrator.getDriver(job.getProvider());
        JsonNode payload;
        try {
            payload = objectMapper.readTree(job.getPayload());
        } catch (JsonProcessingException e) {
            log.error("Dropping webhook with unreadable payload: jobId={}, provider={}, error={}",
                    job.getJobId(), job.getProvider(), e.getOriginalMessage());
            return;
        }

        String reference = driver.extractWebhookReference(payload);
        if (reference == null) {
            log.warn("Dropping webhook without reference: jobId={}, provider={}", job.getJobId(), job.getProvider());
            return;
        }
        String status = statusNormalizer.normalize(driver.extractWebhookStatus(payload), driver.getName());
        String channel = driver.extractWebhookChannel(payload);

        String deliveryKey = DELIVERY_KEY_PREFIX + deliveryId(job);
        if (!cache.putIfAbsent(deliveryKey, job.getJobId(), properties.getWebhook().getDeliveryTtl())) {
            log.info("Duplicate webhook delivery ignored: jobId={}, provider={}, reference={}",
                    job.getJobId(), job.getProvider(), reference);
            return;
        }

        UpdateOutcome outcome = UpdateOutcome.APPLIED;
        if (!PaymentStatus.isCanonical(status)) {
            log.warn("Webhook status has no canonical mapping, transaction left as is: reference={}, provider={}, status={}",
                    reference, job.getProvider(), status);
        } else if (properties.getLogging().isEnabled()) {
            try {
                outcome = transactionStore.updateWithLock(reference, TransactionUpdate.builder()
                        .status(status)
                        .channel(channel)
                        .paidAt(PaymentStatus.SUCCESS.getValue().equals(status) ? paidAt(driver, payload) : null)
                        .build());
            } catch (RuntimeException e) {
                // released so the listener retry is not taken for a duplicate
                cache.evict(deliveryKey);
                throw e;
            }
        }

        log.info("Webhook processed: jobId={}, provider={}, reference={}, status={}, outcome={}",
                job.getJobId(), job.getProvider(), reference, status, outcome);
        if (outcome == UpdateOutcome.NOT_FOUND) {
            log.warn("Webhook for unknown transaction: reference={}, provider={}", reference, job.getProvider());
        }

        WebhookReceivedEvent event = new WebhookReceivedEvent(job.getProvider(), reference, status, channel, job.getPayload());
        eventPublisher.publishEvent(event);
        eventProducer.publishWebhookProcessed(event);
    }

    private static String deliveryId(WebhookJob job) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(job.getProvider().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            return HexFormat.of().formatHex(digest.digest(job.getPayload().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private Instant paidAt(PaymentDriver driver, JsonNode payload) {
        return driver.extractWebhookTimestamp(payload).orElseGet(clock::instant);
    }
}

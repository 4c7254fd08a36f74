package com.payment.hub.messaging;

import com.payment.hub.domain.ChargeRequest;
import com.payment.hub.domain.ChargeResponse;
import com.payment.hub.domain.PaymentStatus;
import com.payment.hub.domain.VerificationResponse;
import com.payment.hub.webhook.WebhookReceivedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes payment lifecycle events for audit and downstream consumers. Publication is
 * fire-and-forget: a broker failure is logged and never reaches the payment flow.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentEventProducer {

    public static final String CHARGE_INITIALIZED = "CHARGE_INITIALIZED";
    public static final String PAYMENT_VERIFIED = "PAYMENT_VERIFIED";
    public static final String WEBHOOK_PROCESSED = "WEBHOOK_PROCESSED";

    private final KafkaTemplate<String, PaymentEvent> kafkaTemplate;
    private final Clock clock;

    @Value("${payment.events.topic:payment-events}")
    private String topic;

    @Value("${payment.events.enabled:true}")
    private boolean enabled;

    public void publishChargeInitialized(ChargeRequest request, ChargeResponse response) {
        send(PaymentEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(CHARGE_INITIALIZED)
                .reference(response.getReference())
                .provider(response.getProvider())
                .providerId(response.getAccessCode())
                .status(PaymentStatus.PENDING.getValue())
                .amount(request.getAmount())
                .currency(request.getCurrency())
                .timestamp(clock.instant())
                .build());
    }

    public void publishVerified(VerificationResponse response) {
        send(PaymentEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(PAYMENT_VERIFIED)
                .reference(response.getReference())
                .provider(response.getProvider())
                .status(response.getStatus())
                .amount(response.getAmount())
                .currency(response.getCurrency())
                .channel(response.getChannel())
                .timestamp(clock.instant())
                .build());
    }

    public void publishWebhookProcessed(WebhookReceivedEvent webhook) {
        send(PaymentEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(WEBHOOK_PROCESSED)
                .reference(webhook.getReference())
                .provider(webhook.getProvider())
                .status(webhook.getStatus())
                .channel(webhook.getChannel())
                .timestamp(clock.instant())
                .build());
    }

    private void send(PaymentEvent event) {
        if (!enabled) {
            return;
        }
        String key = event.getReference();
        log.info("Publishing payment event: key={}, eventId={}, eventType={}, provider={}, status={}",
                key, event.getEventId(), event.getEventType(), event.getProvider(), event.getStatus());
        CompletableFuture<SendResult<String, PaymentEvent>> future;
        try {
            future = kafkaTemplate.send(topic, key, event);
        } catch (RuntimeException e) {
            log.error("Failed to hand payment event to Kafka: key={}, eventId={}", key, event.getEventId(), e);
            return;
        }
        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish payment event key={} eventId={}", key, event.getEventId(), ex);
            } else {
                log.debug("Published payment event: key={}, eventId={}, partition={}, offset={}",
                        key, event.getEventId(),
                        result != null ? result.getRecordMetadata().partition() : null,
                        result != null ? result.getRecordMetadata().offset() : null);
            }
        });
    }
}

package com.payment.hub.webhook;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

/**
 * Kafka worker for queued webhooks. Exceptions are left to the container's error handler,
 * which retries with a fixed backoff and then gives up.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookJobConsumer {

    private final WebhookProcessor processor;

    @KafkaListener(
            topics = "${payment.webhook.topic:payment-webhooks}",
            groupId = "${payment.webhook.consumer-group:payment-webhook-processor}",
            containerFactory = "webhookListenerContainerFactory"
    )
    public void onWebhook(
            @Payload(required = false) WebhookJob job,
            @Header(value = KafkaHeaders.RECEIVED_PARTITION, required = false) Integer partition,
            @Header(value = KafkaHeaders.OFFSET, required = false) Long offset) {
        if (job == null || job.getProvider() == null) {
            log.warn("Skipping empty webhook job: partition={}, offset={}", partition, offset);
            return;
        }
        log.debug("Processing webhook job: jobId={}, provider={}, partition={}, offset={}",
                job.getJobId(), job.getProvider(), partition, offset);
        processor.process(job);
    }
}

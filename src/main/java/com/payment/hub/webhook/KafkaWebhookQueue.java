package com.payment.hub.webhook;

import com.payment.hub.exception.WebhookQueueException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Queues webhook jobs on Kafka, keyed by provider. Waits for the broker acknowledgement so
 * the HTTP intake only answers 202 for jobs that will be delivered.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KafkaWebhookQueue implements WebhookQueue {

    private final KafkaTemplate<String, WebhookJob> webhookKafkaTemplate;

    @Value("${payment.webhook.topic:payment-webhooks}")
    private String topic;

    @Value("${payment.webhook.enqueue-timeout:5s}")
    private Duration enqueueTimeout;

    @Override
    public void enqueue(WebhookJob job) {
        try {
            SendResult<String, WebhookJob> result = webhookKafkaTemplate.send(topic, job.getProvider(), job)
                    .get(enqueueTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Webhook queued: jobId={}, provider={}, partition={}, offset={}",
                    job.getJobId(), job.getProvider(),
                    result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WebhookQueueException("Interrupted while queuing webhook " + job.getJobId(), e);
        } catch (ExecutionException e) {
            throw new WebhookQueueException("Kafka rejected webhook " + job.getJobId(), e.getCause());
        } catch (TimeoutException e) {
            throw new WebhookQueueException("Timed out queuing webhook " + job.getJobId(), e);
        } catch (RuntimeException e) {
            throw new WebhookQueueException("Failed to queue webhook " + job.getJobId(), e);
        }
    }
}

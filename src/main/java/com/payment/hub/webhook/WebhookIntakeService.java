package com.payment.hub.webhook;

import com.payment.hub.core.PaymentOrchestrator;
import com.payment.hub.driver.PaymentDriver;
import com.payment.hub.exception.WebhookAuthException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

/**
 * Request-path half of webhook handling: authenticate the delivery with its provider's
 * driver and queue it. Nothing is parsed for processing here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookIntakeService {

    private final PaymentOrchestrator orchestrator;
    private final WebhookQueue webhookQueue;
    private final Clock clock;

    /**
     * @return the queued job's id
     * @throws com.payment.hub.exception.DriverNotFoundException for unknown or disabled providers
     * @throws WebhookAuthException when the signature or timestamp is rejected
     * @throws com.payment.hub.exception.WebhookQueueException when the job could not be queued
     */
    public String accept(String provider, HttpHeaders headers, String rawBody) {
        PaymentDriver driver = orchestrator.getDriver(provider);
        if (!driver.validateWebhook(headers, rawBody)) {
            log.warn("Webhook rejected: provider={}, bodyLength={}", driver.getName(), rawBody == null ? 0 : rawBody.length());
            throw new WebhookAuthException(driver.getName(), "Invalid webhook signature");
        }
        WebhookJob job = WebhookJob.builder()
                .jobId(UUID.randomUUID().toString())
                .provider(driver.getName())
                .payload(rawBody)
                .receivedAt(clock.instant())
                .build();
        webhookQueue.enqueue(job);
        return job.getJobId();
    }
}

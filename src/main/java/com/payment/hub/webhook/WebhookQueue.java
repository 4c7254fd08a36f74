package com.payment.hub.webhook;

/**
 * Hands authenticated webhooks to the asynchronous processor.
 */
public interface WebhookQueue {

    /**
     * Returns once the job is durably queued.
     *
     * @throws com.payment.hub.exception.WebhookQueueException when the queue did not accept the job
     */
    void enqueue(WebhookJob job);
}

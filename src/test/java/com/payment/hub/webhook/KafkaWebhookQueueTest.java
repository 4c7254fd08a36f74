package com.payment.hub.webhook;

import com.payment.hub.exception.WebhookQueueException;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class KafkaWebhookQueueTest {

    @Mock
    private KafkaTemplate<String, WebhookJob> kafkaTemplate;

    private KafkaWebhookQueue queue;
    private WebhookJob job;

    @BeforeEach
    void setUp() {
        queue = new KafkaWebhookQueue(kafkaTemplate);
        ReflectionTestUtils.setField(queue, "topic", "payment-webhooks");
        ReflectionTestUtils.setField(queue, "enqueueTimeout", Duration.ofMillis(200));
        job = WebhookJob.builder()
                .jobId("job-1")
                .provider("paystack")
                .payload("{}")
                .receivedAt(Instant.parse("2024-06-01T12:00:00Z"))
                .build();
    }

    @Test
    void waitsForBrokerAcknowledgement() {
        RecordMetadata metadata = new RecordMetadata(new TopicPartition("payment-webhooks", 0), 0, 7, 0L, 0, 0);
        when(kafkaTemplate.send("payment-webhooks", "paystack", job)).thenReturn(CompletableFuture.completedFuture(
                new SendResult<>(new ProducerRecord<>("payment-webhooks", "paystack", job), metadata)));

        assertThatCode(() -> queue.enqueue(job)).doesNotThrowAnyException();
        verify(kafkaTemplate).send("payment-webhooks", "paystack", job);
    }

    @Test
    void brokerFailureBecomesQueueException() {
        when(kafkaTemplate.send("payment-webhooks", "paystack", job))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("not enough replicas")));

        assertThatThrownBy(() -> queue.enqueue(job))
                .isInstanceOf(WebhookQueueException.class)
                .hasRootCauseMessage("not enough replicas");
    }

    @Test
    void missingAcknowledgementTimesOut() {
        when(kafkaTemplate.send("payment-webhooks", "paystack", job)).thenReturn(new CompletableFuture<>());

        assertThatThrownBy(() -> queue.enqueue(job))
                .isInstanceOf(WebhookQueueException.class)
                .hasMessageContaining("Timed out");
    }
}

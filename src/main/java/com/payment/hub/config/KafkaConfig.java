package com.payment.hub.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.payment.hub.exception.DriverNotFoundException;
import com.payment.hub.messaging.PaymentEvent;
import com.payment.hub.webhook.WebhookJob;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Serializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.support.serializer.ErrorHandlingDeserializer;
import org.springframework.kafka.support.serializer.JsonDeserializer;
import org.springframework.util.backoff.FixedBackOff;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka wiring for the two topics this service owns: payment lifecycle events (produce
 * only) and webhook jobs (produce on intake, consume in the processor). Both use JSON so
 * consumers outside the JVM can read them.
 */
@Slf4j
@Configuration
public class KafkaConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    private final ObjectMapper kafkaObjectMapper = kafkaObjectMapper();

    @Bean
    public ProducerFactory<String, PaymentEvent> paymentEventProducerFactory() {
        return new DefaultKafkaProducerFactory<>(producerProps(), new StringSerializer(),
                new JsonValueSerializer<>(kafkaObjectMapper));
    }

    @Bean
    public KafkaTemplate<String, PaymentEvent> paymentEventKafkaTemplate(
            ProducerFactory<String, PaymentEvent> paymentEventProducerFactory) {
        return new KafkaTemplate<>(paymentEventProducerFactory);
    }

    @Bean
    public ProducerFactory<String, WebhookJob> webhookJobProducerFactory() {
        return new DefaultKafkaProducerFactory<>(producerProps(), new StringSerializer(),
                new JsonValueSerializer<>(kafkaObjectMapper));
    }

    @Bean
    public KafkaTemplate<String, WebhookJob> webhookKafkaTemplate(
            ProducerFactory<String, WebhookJob> webhookJobProducerFactory) {
        return new KafkaTemplate<>(webhookJobProducerFactory);
    }

    @Bean
    public ConsumerFactory<String, WebhookJob> webhookJobConsumerFactory(PaymentProperties properties) {
        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, properties.getWebhook().getConsumerGroup());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        JsonDeserializer<WebhookJob> deserializer = new JsonDeserializer<>(WebhookJob.class, kafkaObjectMapper);
        deserializer.setUseTypeHeaders(false);
        deserializer.addTrustedPackages("com.payment.hub");
        ErrorHandlingDeserializer<WebhookJob> errorHandlingDeserializer = new ErrorHandlingDeserializer<>(deserializer);
        return new DefaultKafkaConsumerFactory<>(props, new StringDeserializer(), errorHandlingDeserializer);
    }

    /**
     * Failed jobs are redelivered after {@code payment.webhook.backoff} until
     * {@code payment.webhook.max-attempts} attempts in total have run, then logged and
     * skipped.
     */
    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, WebhookJob> webhookListenerContainerFactory(
            ConsumerFactory<String, WebhookJob> webhookJobConsumerFactory, PaymentProperties properties) {
        ConcurrentKafkaListenerContainerFactory<String, WebhookJob> factory = new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(webhookJobConsumerFactory);
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.RECORD);

        PaymentProperties.Webhook webhook = properties.getWebhook();
        long retries = Math.max(webhook.getMaxAttempts() - 1, 0);
        DefaultErrorHandler errorHandler = new DefaultErrorHandler(
                (record, ex) -> log.error("Giving up on webhook job after {} attempts: key={}, partition={}, offset={}, error={}",
                        webhook.getMaxAttempts(), record.key(), record.partition(), record.offset(), ex.getMessage(), ex),
                new FixedBackOff(webhook.getBackoff().toMillis(), retries));
        errorHandler.addNotRetryableExceptions(DriverNotFoundException.class);
        factory.setCommonErrorHandler(errorHandler);
        log.info("Webhook listener configured: topic={}, maxAttempts={}, backoff={}",
                webhook.getTopic(), webhook.getMaxAttempts(), webhook.getBackoff());
        return factory;
    }

    private Map<String, Object> producerProps() {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        return props;
    }

    private static ObjectMapper kafkaObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /** Writes values with a shared ObjectMapper; message bodies are never logged. */
    static class JsonValueSerializer<T> implements Serializer<T> {

        private final ObjectMapper objectMapper;

        JsonValueSerializer(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
        }

        @Override
        public byte[] serialize(String topic, T data) {
            if (data == null) {
                return null;
            }
            try {
                byte[] result = objectMapper.writeValueAsBytes(data);
                log.debug("Serialized {} (topic={}, length={})", data.getClass().getSimpleName(), topic, result.length);
                return result;
            } catch (JsonProcessingException e) {
                log.error("Serialization failed for topic={}", topic, e);
                throw new SerializationException("Failed to serialize " + data.getClass().getSimpleName(), e);
            }
        }
    }
}

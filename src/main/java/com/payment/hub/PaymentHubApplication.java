package com.payment.hub;

import com.payment.hub.config.PaymentProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Entry point for the payment hub. Enables:
 * <ul>
 *   <li>One charge/verify API over many payment providers, with ordered fallback</li>
 *   <li>Per-provider webhook authentication and Kafka-queued webhook processing</li>
 *   <li>Circuit breaker and retry around provider calls (Resilience4j)</li>
 *   <li>REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(PaymentProperties.class)
public class PaymentHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaymentHubApplication.class, args);
    }
}

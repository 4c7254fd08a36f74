package com.payment.hub.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything under {@code payment.*} in application.yml. Provider order in
 * {@link #providers} is the order verify falls back through when nothing else is known.
 */
@Data
@ConfigurationProperties(prefix = "payment")
public class PaymentProperties {

    /** Provider tried first when a charge names no providers. */
    private String defaultProvider;

    /** Tried in order after the default provider. */
    private List<String> fallbackProviders = new ArrayList<>();

    private Map<String, ProviderProperties> providers = new LinkedHashMap<>();

    private HealthCheck healthCheck = new HealthCheck();

    private Logging logging = new Logging();

    private Cache cache = new Cache();

    private Webhook webhook = new Webhook();

    private Events events = new Events();

    @Data
    public static class ProviderProperties {
        /** Short driver name ("paystack") or a class name. Defaults to the provider key. */
        private String driver;
        /** Fully qualified driver implementation, consulted before naming conventions. */
        private String driverClass;
        private boolean enabled = true;
        private List<String> currencies = new ArrayList<>();
        /** Reference prefix used for provider detection; defaults to the upper-cased name. */
        private String referencePrefix;
        /** Driver-specific settings: secret-key, base-url, timeout, webhook-secret, ... */
        private Map<String, String> settings = new LinkedHashMap<>();
    }

    @Data
    public static class HealthCheck {
        private boolean enabled = true;
        private Duration cacheTtl = Duration.ofMinutes(5);
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Logging {
        /** When false the transaction store is neither written nor consulted. */
        private boolean enabled = true;
    }

    @Data
    public static class Cache {
        /** redis or memory. */
        private String type = "redis";
        /** How long reference -> (provider, providerId) mappings live after a charge. */
        private Duration verificationTtl = Duration.ofHours(1);
    }

    @Data
    public static class Webhook {
        private String path = "/payments/webhook";
        /** Accepted clock skew between a payload timestamp and now. */
        private Duration tolerance = Duration.ofMinutes(5);
        /** Reject payloads that carry no timestamp at all. */
        private boolean requireTimestamp = false;
        private String topic = "payment-webhooks";
        private String consumerGroup = "payment-webhook-processor";
        /** Total processing attempts per delivery, first attempt included. */
        private int maxAttempts = 3;
        private Duration backoff = Duration.ofSeconds(60);
        private Duration enqueueTimeout = Duration.ofSeconds(5);
        /** How long a processed delivery is remembered so a redelivery emits no second event. */
        private Duration deliveryTtl = Duration.ofHours(24);
    }

    @Data
    public static class Events {
        private boolean enabled = true;
        private String topic = "payment-events";
    }
}

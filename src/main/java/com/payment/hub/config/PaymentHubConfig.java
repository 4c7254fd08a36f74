package com.payment.hub.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.payment.hub.cache.KeyValueCache;
import com.payment.hub.core.ChannelMapper;
import com.payment.hub.core.DriverFactory;
import com.payment.hub.core.ProviderDetector;
import com.payment.hub.core.StatusNormalizer;
import com.payment.hub.driver.DriverContext;
import com.payment.hub.drivers.FlutterwaveDriver;
import com.payment.hub.drivers.MonnifyDriver;
import com.payment.hub.drivers.PayPalDriver;
import com.payment.hub.drivers.PaystackDriver;
import com.payment.hub.drivers.SquareDriver;
import com.payment.hub.webhook.signature.CertificateFetcher;
import com.payment.hub.webhook.signature.HttpCertificateFetcher;
import com.payment.hub.webhook.signature.ReplayGuard;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the registries and the driver factory. Built-in drivers are registered here by
 * name; other drivers resolve through {@code driver-class} or the naming convention.
 */
@Slf4j
@Configuration
public class PaymentHubConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public StatusNormalizer statusNormalizer() {
        return new StatusNormalizer();
    }

    @Bean
    public ChannelMapper channelMapper() {
        return new ChannelMapper();
    }

    @Bean
    public ProviderDetector providerDetector() {
        return new ProviderDetector();
    }

    @Bean
    public ReplayGuard replayGuard(Clock clock, PaymentProperties properties) {
        PaymentProperties.Webhook webhook = properties.getWebhook();
        return new ReplayGuard(clock, webhook.getTolerance(), webhook.isRequireTimestamp());
    }

    @Bean
    public CertificateFetcher certificateFetcher(
            @Value("${payment.webhook.certificate-timeout:10s}") Duration timeout) {
        return new HttpCertificateFetcher(timeout);
    }

    @Bean
    public DriverContext driverContext(StatusNormalizer statusNormalizer, ChannelMapper channelMapper,
                                       KeyValueCache cache, ReplayGuard replayGuard,
                                       CertificateFetcher certificateFetcher, ObjectMapper objectMapper,
                                       Clock clock, PaymentProperties properties) {
        return DriverContext.builder()
                .statusNormalizer(statusNormalizer)
                .channelMapper(channelMapper)
                .cache(cache)
                .replayGuard(replayGuard)
                .certificateFetcher(certificateFetcher)
                .objectMapper(objectMapper)
                .clock(clock)
                .healthCacheTtl(properties.getHealthCheck().getCacheTtl())
                .build();
    }

    @Bean
    public DriverFactory driverFactory(DriverContext driverContext) {
        DriverFactory factory = new DriverFactory(driverContext)
                .register("paystack", PaystackDriver::new)
                .register("flutterwave", FlutterwaveDriver::new)
                .register("monnify", MonnifyDriver::new)
                .register("square", SquareDriver::new)
                .register("paypal", PayPalDriver::new);
        log.info("Built-in payment drivers registered: {}", factory.getRegisteredDrivers());
        return factory;
    }
}

package com.payment.hub.core;

import com.payment.hub.cache.KeyValueCache;
import com.payment.hub.config.PaymentProperties;
import com.payment.hub.config.PaymentProperties.ProviderProperties;
import com.payment.hub.domain.ChargeRequest;
import com.payment.hub.domain.ChargeResponse;
import com.payment.hub.domain.PaymentStatus;
import com.payment.hub.domain.TransactionRecord;
import com.payment.hub.domain.TransactionUpdate;
import com.payment.hub.domain.VerificationContext;
import com.payment.hub.domain.VerificationResponse;
import com.payment.hub.driver.DriverSettings;
import com.payment.hub.driver.PaymentDriver;
import com.payment.hub.exception.DriverNotFoundException;
import com.payment.hub.exception.InvalidConfigurationException;
import com.payment.hub.exception.ProviderAggregateException;
import com.payment.hub.messaging.PaymentEventProducer;
import com.payment.hub.persistence.service.TransactionStore;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Runs charges down the provider fallback chain and works out which provider to ask when
 * a reference comes back for verification.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentOrchestrator {

    public static final String CONTEXT_KEY_PREFIX = "payments:verification:";
    private static final String RETRY_INSTANCE = "verify";

    private final PaymentProperties properties;
    private final DriverFactory driverFactory;
    private final ProviderDetector providerDetector;
    private final KeyValueCache cache;
    private final TransactionStore transactionStore;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final RetryRegistry retryRegistry;
    private final PaymentEventProducer eventProducer;

    private final Map<String, PaymentDriver> drivers = new ConcurrentHashMap<>();

    @jakarta.annotation.PostConstruct
    void init() {
        properties.getProviders().forEach((name, provider) -> {
            String prefix = provider.getReferencePrefix();
            providerDetector.registerPrefix(
                    prefix != null && !prefix.isBlank() ? prefix : name.toUpperCase(Locale.ROOT), name);
        });
        log.info("PaymentOrchestrator configuration: enabledProviders={}, fallbackChain={}, healthChecks={}, transactionLogging={}",
                getEnabledProviders(), getFallbackChain(), properties.getHealthCheck().isEnabled(),
                properties.getLogging().isEnabled());
        if (getEnabledProviders().isEmpty()) {
            log.warn("No payment providers are enabled; every charge will fail. Check payment.providers configuration.");
        }
    }

    /**
     * Charges through the configured default provider and then the fallback providers.
     */
    public ChargeResponse charge(ChargeRequest request) {
        return charge(request, null);
    }

    /**
     * Tries each provider in order until one initializes the charge. Unhealthy providers
     * and providers that do not take the request's currency are skipped. When every
     * candidate fails, the thrown {@link ProviderAggregateException} names each provider's
     * failure in attempt order.
     */
    public ChargeResponse charge(ChargeRequest request, List<String> providers) {
        List<String> candidates = providers != null && !providers.isEmpty() ? providers : getFallbackChain();
        log.info("Executing charge: amount={}, currency={}, reference={}, candidates={}",
                request.getAmount(), request.getCurrency(), request.getReference(), candidates);
        if (candidates.isEmpty()) {
            throw new ProviderAggregateException("No payment providers are configured", Map.of());
        }

        Map<String, String> errors = new LinkedHashMap<>();
        for (String name : candidates) {
            ChargeResponse response;
            try {
                PaymentDriver driver = getDriver(name);
                if (properties.getHealthCheck().isEnabled() && !driver.getCachedHealthCheck()) {
                    log.warn("Skipping provider={}: health check failed", name);
                    errors.put(name, "Provider is currently unavailable");
                    continue;
                }
                if (!driver.isCurrencySupported(request.getCurrency())) {
                    log.info("Skipping provider={}: currency={} not supported", name, request.getCurrency());
                    errors.put(name, "Currency " + request.getCurrency() + " not supported");
                    continue;
                }

                CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker(name);
                response = CircuitBreaker.decorateSupplier(circuitBreaker, () -> driver.charge(request)).get();
            } catch (DriverNotFoundException | InvalidConfigurationException e) {
                log.warn("Skipping provider={}: {}", name, e.getMessage());
                errors.put(name, e.getMessage());
                continue;
            } catch (CallNotPermittedException e) {
                log.warn("Circuit open for provider={}; failing over to next provider", name);
                errors.put(name, "Circuit breaker open");
                continue;
            } catch (RuntimeException e) {
                log.error("Charge failed for provider={}: {}", name, e.getMessage());
                errors.put(name, messageOf(e));
                continue;
            }
            log.info("Charge initialized with provider={}, reference={}", name, response.getReference());
            recordCharge(request, response);
            return response;
        }

        log.error("All providers failed to charge: errors={}", errors);
        throw new ProviderAggregateException("All payment providers failed", errors);
    }

    public VerificationResponse verify(String reference) {
        return verify(reference, null);
    }

    /**
     * Verifies {@code reference}. With an explicit provider only that provider is asked.
     * Otherwise the provider is taken from the cache, then the transaction store, then the
     * reference prefix, and any remaining enabled providers are tried after it.
     */
    public VerificationResponse verify(String reference, String provider) {
        if (reference == null || reference.isBlank()) {
            throw new IllegalArgumentException("Reference is required");
        }

        List<VerificationContext> attempts = new ArrayList<>();
        if (provider != null && !provider.isBlank()) {
            getDriver(provider);
            attempts.add(VerificationContext.builder()
                    .provider(provider)
                    .source(VerificationContext.Source.EXPLICIT)
                    .build());
        } else {
            Optional<VerificationContext> resolved = resolveContext(reference);
            resolved.ifPresent(attempts::add);
            Set<String> seen = new LinkedHashSet<>();
            resolved.ifPresent(context -> seen.add(context.getProvider()));
            for (String name : getEnabledProviders()) {
                if (seen.add(name)) {
                    attempts.add(VerificationContext.builder().provider(name).build());
                }
            }
            log.debug("Verification plan for reference={}: resolvedBy={}, providers={}",
                    reference, resolved.map(VerificationContext::getSource).orElse(null), seen);
        }

        Map<String, String> errors = new LinkedHashMap<>();
        for (VerificationContext context : attempts) {
            String name = context.getProvider();
            try {
                PaymentDriver driver = getDriver(name);
                String verificationId = driver.resolveVerificationId(reference, context.getProviderId());
                VerificationResponse response = verifyWithProvider(driver, verificationId);
                log.info("Payment verified: reference={}, provider={}, status={}, source={}",
                        reference, name, response.getStatus(), context.getSource());
                recordVerification(reference, response);
                return response;
            } catch (CallNotPermittedException e) {
                log.warn("Circuit open for provider={} while verifying reference={}", name, reference);
                errors.put(name, "Circuit breaker open");
            } catch (RuntimeException e) {
                log.warn("Verification failed: reference={}, provider={}, error={}", reference, name, e.getMessage());
                errors.put(name, messageOf(e));
            }
        }

        log.error("Unable to verify reference={}: errors={}", reference, errors);
        throw new ProviderAggregateException("Unable to verify payment " + reference, errors);
    }

    /**
     * Cache first, then the transaction store, then the reference prefix. Empty when none
     * of them knows the reference.
     */
    public Optional<VerificationContext> resolveContext(String reference) {
        Optional<VerificationContext> cached = cache.get(CONTEXT_KEY_PREFIX + reference, VerificationContext.class)
                .filter(context -> context.getProvider() != null);
        if (cached.isPresent()) {
            return Optional.of(cached.get().toBuilder().source(VerificationContext.Source.CACHE).build());
        }

        if (properties.getLogging().isEnabled()) {
            Optional<TransactionRecord> stored = transactionStore.findByReference(reference)
                    .filter(record -> record.getProvider() != null);
            if (stored.isPresent()) {
                return Optional.of(VerificationContext.builder()
                        .provider(stored.get().getProvider())
                        .providerId(stored.get().getProviderId())
                        .source(VerificationContext.Source.STORE)
                        .build());
            }
        }

        return providerDetector.detectFromReference(reference)
                .map(name -> VerificationContext.builder()
                        .provider(name)
                        .source(VerificationContext.Source.HEURISTIC)
                        .build());
    }

    /**
     * Returns the single driver instance for {@code provider}, building it on first use.
     *
     * @throws DriverNotFoundException when the provider is not configured or is disabled
     */
    public PaymentDriver getDriver(String provider) {
        String name = provider.toLowerCase(Locale.ROOT);
        ProviderProperties config = properties.getProviders().get(name);
        if (config == null) {
            throw new DriverNotFoundException("Payment provider '" + provider + "' is not configured");
        }
        if (!config.isEnabled()) {
            throw new DriverNotFoundException("Payment provider '" + provider + "' is disabled");
        }
        return drivers.computeIfAbsent(name, key -> buildDriver(key, config));
    }

    /** Default provider followed by the configured fallbacks, without duplicates. */
    public List<String> getFallbackChain() {
        Set<String> chain = new LinkedHashSet<>();
        if (properties.getDefaultProvider() != null && !properties.getDefaultProvider().isBlank()) {
            chain.add(properties.getDefaultProvider());
        }
        chain.addAll(properties.getFallbackProviders());
        return new ArrayList<>(chain);
    }

    /** Enabled providers in configuration order. */
    public List<String> getEnabledProviders() {
        List<String> enabled = new ArrayList<>();
        properties.getProviders().forEach((name, config) -> {
            if (config.isEnabled()) {
                enabled.add(name);
            }
        });
        return enabled;
    }

    private PaymentDriver buildDriver(String name, ProviderProperties config) {
        Map<String, String> settings = new LinkedHashMap<>(config.getSettings());
        if (config.getReferencePrefix() != null) {
            settings.putIfAbsent("reference-prefix", config.getReferencePrefix());
        }
        String driverName = config.getDriver() != null ? config.getDriver() : name;
        PaymentDriver driver = driverFactory.create(driverName, config.getDriverClass(),
                new DriverSettings(name, settings, config.getCurrencies()));
        log.info("Driver created: provider={}, class={}, currencies={}",
                name, driver.getClass().getSimpleName(), driver.getSupportedCurrencies());
        return driver;
    }

    private VerificationResponse verifyWithProvider(PaymentDriver driver, String verificationId) {
        CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(driver.getName());
        Retry retry = retryRegistry.retry(RETRY_INSTANCE);
        Supplier<VerificationResponse> supplier = () -> driver.verify(verificationId);
        Supplier<VerificationResponse> withRetry = Retry.decorateSupplier(retry, supplier);
        Supplier<VerificationResponse> withCb = CircuitBreaker.decorateSupplier(cb, withRetry);
        return withCb.get();
    }

    private void recordCharge(ChargeRequest request, ChargeResponse response) {
        if (properties.getLogging().isEnabled()) {
            transactionStore.create(TransactionRecord.builder()
                    .reference(response.getReference())
                    .provider(response.getProvider())
                    .providerId(response.getAccessCode())
                    .status(PaymentStatus.PENDING.getValue())
                    .amount(request.getAmount())
                    .currency(request.getCurrency())
                    .email(request.getEmail())
                    .metadata(request.getMetadata())
                    .customer(request.getCustomer())
                    .build());
        }
        cache.put(CONTEXT_KEY_PREFIX + response.getReference(),
                VerificationContext.builder()
                        .provider(response.getProvider())
                        .providerId(response.getAccessCode())
                        .build(),
                properties.getCache().getVerificationTtl());
        eventProducer.publishChargeInitialized(request, response);
    }

    private void recordVerification(String reference, VerificationResponse response) {
        if (properties.getLogging().isEnabled()) {
            transactionStore.update(reference, TransactionUpdate.builder()
                    .status(PaymentStatus.isCanonical(response.getStatus()) ? response.getStatus() : null)
                    .channel(response.getChannel())
                    .paidAt(response.getPaidAt())
                    .build());
        }
        eventProducer.publishVerified(response);
    }

    private static String messageOf(Throwable e) {
        Throwable t = e;
        while (t != null) {
            if (t.getMessage() != null && !t.getMessage().isBlank()) {
                return t.getMessage();
            }
            t = t.getCause();
        }
        return e.getClass().getSimpleName();
    }
}

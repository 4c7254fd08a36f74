package com.payment.hub.core;

import com.payment.hub.driver.PaymentDriver;
import com.payment.hub.exception.PaymentException;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated health of every enabled provider, built from the cached probes so a health
 * page refresh costs at most one provider call per TTL.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProviderHealthService {

    public static final String OPERATIONAL = "operational";

    private final PaymentOrchestrator orchestrator;

    public Map<String, ProviderHealth> checkAll() {
        Map<String, ProviderHealth> result = new LinkedHashMap<>();
        for (String name : orchestrator.getEnabledProviders()) {
            result.put(name, check(name));
        }
        return result;
    }

    private ProviderHealth check(String name) {
        try {
            PaymentDriver driver = orchestrator.getDriver(name);
            return new ProviderHealth(driver.getCachedHealthCheck(), driver.getSupportedCurrencies());
        } catch (PaymentException e) {
            log.warn("Health check unavailable for provider={}: {}", name, e.getMessage());
            return new ProviderHealth(false, List.of());
        }
    }

    @Value
    public static class ProviderHealth {
        boolean healthy;
        List<String> currencies;
    }
}

package com.payment.hub.core;

import com.payment.hub.core.ProviderHealthService.ProviderHealth;
import com.payment.hub.driver.PaymentDriver;
import com.payment.hub.exception.InvalidConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProviderHealthServiceTest {

    @Mock
    private PaymentOrchestrator orchestrator;
    @Mock
    private PaymentDriver paystack;

    @InjectMocks
    private ProviderHealthService healthService;

    @Test
    void reportsCachedProbeAndCurrenciesInProviderOrder() {
        when(orchestrator.getEnabledProviders()).thenReturn(List.of("paystack", "monnify"));
        when(orchestrator.getDriver("paystack")).thenReturn(paystack);
        when(paystack.getCachedHealthCheck()).thenReturn(true);
        when(paystack.getSupportedCurrencies()).thenReturn(List.of("NGN", "GHS"));
        when(orchestrator.getDriver("monnify")).thenThrow(new InvalidConfigurationException("Missing required setting 'api-key'"));

        Map<String, ProviderHealth> health = healthService.checkAll();

        assertThat(health).containsOnlyKeys("paystack", "monnify");
        assertThat(health.keySet()).containsExactly("paystack", "monnify");
        assertThat(health.get("paystack").isHealthy()).isTrue();
        assertThat(health.get("paystack").getCurrencies()).containsExactly("NGN", "GHS");
        assertThat(health.get("monnify").isHealthy()).isFalse();
        assertThat(health.get("monnify").getCurrencies()).isEmpty();
    }
}

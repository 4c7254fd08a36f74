package com.payment.hub.api;

import com.payment.hub.core.ProviderHealthService;
import com.payment.hub.core.ProviderHealthService.ProviderHealth;
import com.payment.hub.exception.DriverNotFoundException;
import com.payment.hub.exception.WebhookAuthException;
import com.payment.hub.exception.WebhookQueueException;
import com.payment.hub.webhook.WebhookIntakeService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = WebhookController.class)
class WebhookControllerTest {

    private static final String BODY = "{\"event\":\"charge.success\",\"data\":{\"reference\":\"R1\"}}";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private WebhookIntakeService intakeService;

    @MockitoBean
    private ProviderHealthService healthService;

    @Test
    void acceptedWebhookIsQueuedWithRawBodyAndHeaders() throws Exception {
        when(intakeService.accept(eq("paystack"), any(), eq(BODY))).thenReturn("job-1");

        mockMvc.perform(post("/payments/webhook/paystack")
                        .header("x-paystack-signature", "abc123")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BODY))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("queued"));

        ArgumentCaptor<HttpHeaders> headers = ArgumentCaptor.forClass(HttpHeaders.class);
        verify(intakeService).accept(eq("paystack"), headers.capture(), eq(BODY));
        assertThat(headers.getValue().getFirst("X-Paystack-Signature")).isEqualTo("abc123");
    }

    @Test
    void invalidSignatureIsUnauthorized() throws Exception {
        when(intakeService.accept(eq("paystack"), any(), any()))
                .thenThrow(new WebhookAuthException("paystack", "Invalid webhook signature"));

        mockMvc.perform(post("/payments/webhook/paystack").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("INVALID_SIGNATURE"));
    }

    @Test
    void unknownProviderIsNotFound() throws Exception {
        when(intakeService.accept(eq("acme"), any(), any()))
                .thenThrow(new DriverNotFoundException("Unknown provider: acme"));

        mockMvc.perform(post("/payments/webhook/acme").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("PROVIDER_NOT_FOUND"));
    }

    @Test
    void queueFailureIsServerErrorSoProviderRedelivers() throws Exception {
        when(intakeService.accept(eq("paystack"), any(), any()))
                .thenThrow(new WebhookQueueException("Timed out queuing webhook job-1", new RuntimeException("timeout")));

        mockMvc.perform(post("/payments/webhook/paystack").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("WEBHOOK_QUEUE_FAILED"))
                .andExpect(jsonPath("$.message").value("Webhook received but queuing failed internally"));
    }

    @Test
    void healthListsEveryEnabledProvider() throws Exception {
        Map<String, ProviderHealth> providers = new LinkedHashMap<>();
        providers.put("paystack", new ProviderHealth(true, List.of("NGN", "GHS")));
        providers.put("monnify", new ProviderHealth(false, List.of()));
        when(healthService.checkAll()).thenReturn(providers);

        mockMvc.perform(get("/payments/webhook/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("operational"))
                .andExpect(jsonPath("$.providers.paystack.healthy").value(true))
                .andExpect(jsonPath("$.providers.paystack.currencies[1]").value("GHS"))
                .andExpect(jsonPath("$.providers.monnify.healthy").value(false));
    }
}

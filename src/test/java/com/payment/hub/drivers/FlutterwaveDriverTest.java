package com.payment.hub.drivers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payment.hub.domain.ChargeRequest;
import com.payment.hub.domain.ChargeResponse;
import com.payment.hub.domain.VerificationResponse;
import com.payment.hub.driver.DriverSettings;
import com.payment.hub.driver.TestDriverContexts;
import com.payment.hub.exception.ChargeException;
import com.payment.hub.exception.VerificationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class FlutterwaveDriverTest {

    private FlutterwaveDriver driver;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        driver = new FlutterwaveDriver(new DriverSettings("flutterwave", Map.of(
                "secret-key", "FLWSECK_TEST",
                "webhook-secret", "my-hash",
                "reference-prefix", "FLW",
                "callback-url", "https://shop.example.com/return"), List.of("NGN", "KES")),
                TestDriverContexts.create());
        server = MockRestServiceServer.bindTo(driver.getRestTemplate()).build();
    }

    @Test
    void chargeSendsMajorUnitsAndRedirectCarryingReference() {
        server.expect(requestTo("https://api.flutterwave.com/v3/payments"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer FLWSECK_TEST"))
                .andExpect(jsonPath("$.tx_ref").value("ORDER-7"))
                .andExpect(jsonPath("$.amount").value(2500.0))
                .andExpect(jsonPath("$.redirect_url").value("https://shop.example.com/return?reference=ORDER-7"))
                .andExpect(jsonPath("$.payment_options").value("card,banktransfer"))
                .andExpect(jsonPath("$.customer.email").value("buyer@example.com"))
                .andRespond(withSuccess("{\"status\":\"success\",\"data\":{\"link\":\"https://checkout.flutterwave.com/v3/hosted/pay/xyz\"}}",
                        MediaType.APPLICATION_JSON));

        ChargeResponse response = driver.charge(ChargeRequest.builder()
                .amount(new BigDecimal("2500"))
                .currency("NGN")
                .email("buyer@example.com")
                .reference("ORDER-7")
                .channels(List.of("card", "bank_transfer"))
                .build());

        assertThat(response.getAuthorizationUrl()).isEqualTo("https://checkout.flutterwave.com/v3/hosted/pay/xyz");
        assertThat(response.getAccessCode()).isEqualTo("ORDER-7");
        server.verify();
    }

    @Test
    void chargeErrorStatusRaisesChargeException() {
        server.expect(requestTo("https://api.flutterwave.com/v3/payments"))
                .andRespond(withSuccess("{\"status\":\"error\",\"message\":\"Invalid currency\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> driver.charge(ChargeRequest.builder()
                .amount(BigDecimal.TEN).currency("NGN").email("buyer@example.com").build()))
                .isInstanceOf(ChargeException.class)
                .hasMessage("Invalid currency");
    }

    @Test
    void verifyLooksUpByTxRef() {
        server.expect(requestTo("https://api.flutterwave.com/v3/transactions/verify_by_reference?tx_ref=FLW_1_aa"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("""
                        {"status":"success","data":{"tx_ref":"FLW_1_aa","status":"successful","amount":2500,
                         "currency":"NGN","payment_type":"card","created_at":"2024-06-01T11:58:00.000Z",
                         "card":{"type":"MASTERCARD","issuer":"GTBANK"},"customer":{"email":"buyer@example.com"}}}
                        """, MediaType.APPLICATION_JSON));

        VerificationResponse response = driver.verify("FLW_1_aa");

        assertThat(response.getStatus()).isEqualTo("success");
        assertThat(response.getAmount()).isEqualByComparingTo("2500");
        assertThat(response.getPaidAt()).isEqualTo(Instant.parse("2024-06-01T11:58:00Z"));
        assertThat(response.getChannel()).isEqualTo("card");
        assertThat(response.getBank()).isEqualTo("GTBANK");
    }

    @Test
    void verifyFailureRaisesVerificationException() {
        server.expect(requestTo("https://api.flutterwave.com/v3/transactions/verify_by_reference?tx_ref=missing"))
                .andRespond(withSuccess("{\"status\":\"error\",\"message\":\"No transaction was found\"}",
                        MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> driver.verify("missing"))
                .isInstanceOf(VerificationException.class)
                .hasMessageContaining("No transaction");
    }

    @Test
    void webhookComparesSecretHashVerbatim() {
        String body = "{\"event\":\"charge.completed\",\"data\":{\"tx_ref\":\"FLW_1_aa\",\"status\":\"successful\","
                + "\"created_at\":\"2024-06-01T11:58:00.000Z\"}}";
        HttpHeaders good = new HttpHeaders();
        good.set("verif-hash", "my-hash");
        HttpHeaders bad = new HttpHeaders();
        bad.set("verif-hash", "other");

        assertThat(driver.validateWebhook(good, body)).isTrue();
        assertThat(driver.validateWebhook(bad, body)).isFalse();
        assertThat(driver.validateWebhook(new HttpHeaders(), body)).isFalse();
        assertThat(driver.validateWebhook(good, "not json")).isFalse();
    }

    @Test
    void extractsLegacyTxRefLayout() throws Exception {
        JsonNode legacy = new ObjectMapper().readTree("{\"txRef\":\"FLW_9\",\"status\":\"failed\"}");

        assertThat(driver.extractWebhookReference(legacy)).isEqualTo("FLW_9");
        assertThat(driver.extractWebhookStatus(legacy)).isEqualTo("failed");
    }
}

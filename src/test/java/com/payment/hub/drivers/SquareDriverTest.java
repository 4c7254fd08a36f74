package com.payment.hub.drivers;

import com.payment.hub.domain.ChargeRequest;
import com.payment.hub.domain.ChargeResponse;
import com.payment.hub.domain.VerificationResponse;
import com.payment.hub.driver.DriverSettings;
import com.payment.hub.driver.TestDriverContexts;
import com.payment.hub.exception.VerificationException;
import com.payment.hub.webhook.signature.HmacSignatureVerifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
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
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class SquareDriverTest {

    private static final String BASE = "https://connect.squareupsandbox.com";
    private static final String NOTIFICATION_URL = "https://hub.example.com/payments/webhook/square";

    private SquareDriver driver;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        driver = new SquareDriver(new DriverSettings("square", Map.of(
                "access-token", "EAAA_TEST",
                "location-id", "LOC1",
                "webhook-signature-key", "sig-key",
                "webhook-notification-url", NOTIFICATION_URL,
                "base-url", BASE), List.of("USD")),
                TestDriverContexts.create());
        server = MockRestServiceServer.bindTo(driver.getRestTemplate()).build();
    }

    @Test
    void chargeCreatesPaymentLinkWithOrderInCents() {
        server.expect(requestTo(BASE + "/v2/online-checkout/payment-links"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Square-Version", SquareDriver.API_VERSION))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer EAAA_TEST"))
                .andExpect(jsonPath("$.idempotency_key").value("idem-9"))
                .andExpect(jsonPath("$.order.location_id").value("LOC1"))
                .andExpect(jsonPath("$.order.reference_id").value("SQ-1"))
                .andExpect(jsonPath("$.order.line_items[0].base_price_money.amount").value(1999))
                .andExpect(jsonPath("$.checkout_options.redirect_url").value("https://shop.example.com/done?reference=SQ-1"))
                .andRespond(withSuccess("""
                        {"payment_link":{"id":"PL1","order_id":"ORD1","url":"https://square.link/u/abc"}}
                        """, MediaType.APPLICATION_JSON));

        ChargeResponse response = driver.charge(ChargeRequest.builder()
                .amount(new BigDecimal("19.99"))
                .currency("USD")
                .email("buyer@example.com")
                .reference("SQ-1")
                .idempotencyKey("idem-9")
                .callbackUrl("https://shop.example.com/done")
                .build());

        assertThat(response.getAccessCode()).isEqualTo("PL1");
        assertThat(response.getAuthorizationUrl()).isEqualTo("https://square.link/u/abc");
        assertThat(response.getMetadata()).containsEntry("order_id", "ORD1").containsEntry("is_sandbox", true);
        server.verify();
    }

    @Test
    void unpaidOrderBehindPaymentLinkIsPending() {
        server.expect(requestTo(BASE + "/v2/online-checkout/payment-links/PL1"))
                .andRespond(withSuccess("{\"payment_link\":{\"id\":\"PL1\",\"order_id\":\"ORD1\"}}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/v2/orders/ORD1"))
                .andRespond(withSuccess("""
                        {"order":{"id":"ORD1","reference_id":"SQ-1","total_money":{"amount":1999,"currency":"USD"}}}
                        """, MediaType.APPLICATION_JSON));

        VerificationResponse response = driver.verify("PL1");

        assertThat(response.getStatus()).isEqualTo("pending");
        assertThat(response.getReference()).isEqualTo("SQ-1");
        assertThat(response.getAmount()).isEqualByComparingTo("19.99");
    }

    @Test
    void fallsBackToOrderSearchByReference() {
        server.expect(requestTo(BASE + "/v2/online-checkout/payment-links/SQ-1"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));
        server.expect(requestTo(BASE + "/v2/payments/SQ-1"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));
        server.expect(requestTo(BASE + "/v2/orders/search"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.location_ids[0]").value("LOC1"))
                .andRespond(withSuccess("{\"orders\":[{\"id\":\"ORD0\",\"reference_id\":\"OTHER\"},{\"id\":\"ORD1\",\"reference_id\":\"SQ-1\"}]}",
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/v2/orders/ORD1"))
                .andRespond(withSuccess("{\"order\":{\"id\":\"ORD1\",\"reference_id\":\"SQ-1\",\"tenders\":[{\"payment_id\":\"PAY1\"}]}}",
                        MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/v2/payments/PAY1"))
                .andRespond(withSuccess("""
                        {"payment":{"id":"PAY1","status":"COMPLETED","amount_money":{"amount":1999,"currency":"USD"},
                         "updated_at":"2024-06-01T11:59:00Z","source_type":"CARD",
                         "card_details":{"card":{"card_brand":"VISA"}}}}
                        """, MediaType.APPLICATION_JSON));

        VerificationResponse response = driver.verify("SQ-1");

        assertThat(response.getStatus()).isEqualTo("success");
        assertThat(response.getReference()).isEqualTo("SQ-1");
        assertThat(response.getPaidAt()).isEqualTo(Instant.parse("2024-06-01T11:59:00Z"));
        assertThat(response.getCardType()).isEqualTo("VISA");
        server.verify();
    }

    @Test
    void unknownReferenceIsVerificationFailure() {
        server.expect(requestTo(BASE + "/v2/online-checkout/payment-links/NOPE")).andRespond(withStatus(HttpStatus.NOT_FOUND));
        server.expect(requestTo(BASE + "/v2/payments/NOPE")).andRespond(withStatus(HttpStatus.NOT_FOUND));
        server.expect(requestTo(BASE + "/v2/orders/search")).andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> driver.verify("NOPE"))
                .isInstanceOf(VerificationException.class)
                .hasMessageContaining("NOPE");
    }

    @Test
    void webhookSignatureCoversNotificationUrlAndBody() {
        String body = "{\"type\":\"payment.updated\",\"created_at\":\"2024-06-01T11:59:00Z\","
                + "\"data\":{\"object\":{\"payment\":{\"reference_id\":\"SQ-1\",\"status\":\"COMPLETED\"}}}}";
        HmacSignatureVerifier hmac = new HmacSignatureVerifier(
                HmacSignatureVerifier.Algorithm.SHA256, HmacSignatureVerifier.Encoding.BASE64);

        HttpHeaders current = new HttpHeaders();
        current.set("x-square-hmacsha256-signature", hmac.sign("sig-key", NOTIFICATION_URL + body));
        HttpHeaders bodyOnly = new HttpHeaders();
        bodyOnly.set("x-square-signature", hmac.sign("sig-key", body));

        assertThat(driver.validateWebhook(current, body)).isTrue();
        assertThat(driver.validateWebhook(bodyOnly, body)).isFalse();
    }

    @Test
    void webhookRejectedWithoutSignatureKey() {
        SquareDriver unsigned = new SquareDriver(new DriverSettings("square",
                Map.of("access-token", "t", "location-id", "L"), List.of("USD")), TestDriverContexts.create());
        HttpHeaders headers = new HttpHeaders();
        headers.set("x-square-signature", "anything");

        assertThat(unsigned.validateWebhook(headers, "{}")).isFalse();
    }
}

package com.payment.hub.drivers;

import com.payment.hub.domain.ChargeRequest;
import com.payment.hub.domain.ChargeResponse;
import com.payment.hub.domain.VerificationResponse;
import com.payment.hub.driver.DriverSettings;
import com.payment.hub.driver.TestDriverContexts;
import com.payment.hub.exception.ChargeException;
import com.payment.hub.exception.InvalidConfigurationException;
import com.payment.hub.webhook.signature.HmacSignatureVerifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class MonnifyDriverTest {

    private static final String BASE = "https://sandbox.monnify.com";
    private static final String LOGIN_RESPONSE =
            "{\"requestSuccessful\":true,\"responseBody\":{\"accessToken\":\"tok-1\",\"expiresIn\":3600}}";

    private MonnifyDriver driver;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        driver = new MonnifyDriver(new DriverSettings("monnify", Map.of(
                "api-key", "MK_TEST",
                "secret-key", "SK_TEST",
                "contract-code", "1234567890",
                "base-url", BASE), List.of("NGN")),
                TestDriverContexts.create());
        server = MockRestServiceServer.bindTo(driver.getRestTemplate()).build();
    }

    @Test
    void loginTokenIsReusedAcrossCalls() {
        String basic = "Basic " + Base64.getEncoder().encodeToString("MK_TEST:SK_TEST".getBytes(StandardCharsets.UTF_8));
        server.expect(requestTo(BASE + "/api/v1/auth/login"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, basic))
                .andRespond(withSuccess(LOGIN_RESPONSE, MediaType.APPLICATION_JSON));
        for (int i = 0; i < 2; i++) {
            server.expect(requestTo(BASE + "/api/v1/merchant/transactions/init-transaction"))
                    .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer tok-1"))
                    .andExpect(jsonPath("$.contractCode").value("1234567890"))
                    .andExpect(jsonPath("$.paymentMethods[0]").value("CARD"))
                    .andExpect(jsonPath("$.paymentMethods[1]").value("ACCOUNT_TRANSFER"))
                    .andRespond(withSuccess("""
                            {"requestSuccessful":true,"responseBody":{"transactionReference":"MNFY|20240601|000123",
                             "checkoutUrl":"https://sandbox.sdk.monnify.com/checkout/MNFY|20240601|000123"}}
                            """, MediaType.APPLICATION_JSON));
        }

        ChargeResponse first = driver.charge(request("MON-1"));
        driver.charge(request("MON-2"));

        assertThat(first.getAccessCode()).isEqualTo("MNFY|20240601|000123");
        assertThat(first.getAuthorizationUrl()).startsWith("https://sandbox.sdk.monnify.com/checkout/");
        server.verify();
    }

    @Test
    void failedLoginSurfacesAsChargeException() {
        server.expect(requestTo(BASE + "/api/v1/auth/login"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThatThrownBy(() -> driver.charge(request("MON-1")))
                .isInstanceOf(ChargeException.class)
                .hasMessageContaining("authentication failed");
    }

    @Test
    void verifyUsesV2LookupForMonnifyReferences() {
        server.expect(requestTo(BASE + "/api/v1/auth/login"))
                .andRespond(withSuccess(LOGIN_RESPONSE, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/api/v2/transactions/MNFY%7C20240601%7C000123"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("""
                        {"requestSuccessful":true,"responseBody":{"paymentReference":"MON-1","paymentStatus":"PAID",
                         "amountPaid":"5000.00","currencyCode":"NGN","paidOn":"2024-06-01 11:59:00.000",
                         "paymentMethod":"ACCOUNT_TRANSFER"}}
                        """, MediaType.APPLICATION_JSON));

        VerificationResponse response = driver.verify("MNFY|20240601|000123");

        assertThat(response.getReference()).isEqualTo("MON-1");
        assertThat(response.getStatus()).isEqualTo("success");
        assertThat(response.getAmount()).isEqualByComparingTo("5000");
    }

    @Test
    void verifyQueriesByPaymentReferenceOtherwise() {
        server.expect(requestTo(BASE + "/api/v1/auth/login"))
                .andRespond(withSuccess(LOGIN_RESPONSE, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/api/v1/merchant/transactions/query?paymentReference=MON-1"))
                .andRespond(withSuccess(
                        "{\"requestSuccessful\":true,\"responseBody\":{\"paymentReference\":\"MON-1\",\"paymentStatus\":\"EXPIRED\"}}",
                        MediaType.APPLICATION_JSON));

        assertThat(driver.verify("MON-1").getStatus()).isEqualTo("failed");
    }

    @Test
    void webhookSignedWithSecretKey() {
        String body = "{\"eventType\":\"SUCCESSFUL_TRANSACTION\",\"eventData\":{\"paymentReference\":\"MON-1\","
                + "\"paymentStatus\":\"PAID\",\"paidOn\":\"2024-06-01 11:59:30.000\"}}";
        HttpHeaders headers = new HttpHeaders();
        headers.set("monnify-signature", new HmacSignatureVerifier(
                HmacSignatureVerifier.Algorithm.SHA512, HmacSignatureVerifier.Encoding.HEX).sign("SK_TEST", body));

        assertThat(driver.validateWebhook(headers, body)).isTrue();
        assertThat(driver.validateWebhook(headers, body.replace("PAID", "FAILED"))).isFalse();
    }

    @Test
    void healthCheckCountsRejectedLoginAsReachable() {
        server.expect(requestTo(BASE + "/api/v1/auth/login")).andRespond(withStatus(HttpStatus.UNAUTHORIZED));
        assertThat(driver.healthCheck()).isTrue();

        server.reset();
        server.expect(requestTo(BASE + "/api/v1/auth/login")).andRespond(withServerError());
        assertThat(driver.healthCheck()).isFalse();
    }

    @Test
    void contractCodeIsRequired() {
        assertThatThrownBy(() -> new MonnifyDriver(new DriverSettings("monnify",
                Map.of("api-key", "k", "secret-key", "s"), List.of("NGN")), TestDriverContexts.create()))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("contract-code");
    }

    private static ChargeRequest request(String reference) {
        return ChargeRequest.builder()
                .amount(new BigDecimal("5000"))
                .currency("NGN")
                .email("buyer@example.com")
                .reference(reference)
                .build();
    }
}

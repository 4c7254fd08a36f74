package com.payment.hub.drivers;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.hub.domain.ChargeRequest;
import com.payment.hub.domain.ChargeResponse;
import com.payment.hub.domain.PaymentStatus;
import com.payment.hub.domain.VerificationResponse;
import com.payment.hub.driver.DriverContext;
import com.payment.hub.driver.DriverSettings;
import com.payment.hub.driver.DriverSupport;
import com.payment.hub.driver.PaymentDriver;
import com.payment.hub.exception.ChargeException;
import com.payment.hub.exception.VerificationException;
import com.payment.hub.webhook.signature.HmacSignatureVerifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Square online checkout through payment links. Webhooks are signed with HMAC-SHA256
 * (base64) using the endpoint's signature key; when {@code webhook-notification-url} is
 * set it is prepended to the body before signing, as Square does for current endpoints.
 * Verification expects the payment-link id saved at charge time and falls back to a
 * payment id, then to an order search by reference.
 */
@Slf4j
public class SquareDriver implements PaymentDriver {

    static final String DEFAULT_BASE_URL = "https://connect.squareup.com";
    static final String SIGNATURE_HEADER = "x-square-signature";
    static final String SIGNATURE_HEADER_SHA256 = "x-square-hmacsha256-signature";
    static final String API_VERSION = "2024-10-18";

    private static final HmacSignatureVerifier SIGNATURE =
            new HmacSignatureVerifier(HmacSignatureVerifier.Algorithm.SHA256, HmacSignatureVerifier.Encoding.BASE64);

    private final DriverSupport support;
    private final String accessToken;
    private final String locationId;
    private final String webhookSignatureKey;
    private final String notificationUrl;

    public SquareDriver(DriverSettings settings, DriverContext context) {
        this.accessToken = settings.require("access-token");
        this.locationId = settings.require("location-id");
        this.webhookSignatureKey = settings.get("webhook-signature-key");
        this.notificationUrl = settings.get("webhook-notification-url", "");
        this.support = new DriverSupport(settings, context, DEFAULT_BASE_URL);
        context.getStatusNormalizer().registerProviderMappings(settings.getName(), Map.of(
                PaymentStatus.SUCCESS, List.of("completed", "approved"),
                PaymentStatus.CANCELLED, List.of("canceled")));
    }

    @Override
    public String getName() {
        return support.getSettings().getName();
    }

    @Override
    public List<String> getSupportedCurrencies() {
        return support.getSettings().getCurrencies();
    }

    @Override
    public ChargeResponse charge(ChargeRequest request) {
        String reference = request.getReference() != null
                ? request.getReference()
                : support.generateReference(support.getSettings().get("reference-prefix"));
        String idempotencyKey = request.getIdempotencyKey() != null
                ? request.getIdempotencyKey()
                : UUID.randomUUID().toString();

        Map<String, Object> money = new LinkedHashMap<>();
        money.put("amount", request.getAmountInMinorUnits());
        money.put("currency", request.getCurrency());
        Map<String, Object> lineItem = new LinkedHashMap<>();
        lineItem.put("name", request.getDescription() != null ? request.getDescription() : "Payment");
        lineItem.put("quantity", "1");
        lineItem.put("base_price_money", money);
        Map<String, Object> order = new LinkedHashMap<>();
        order.put("location_id", locationId);
        order.put("reference_id", reference);
        order.put("line_items", List.of(lineItem));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("idempotency_key", idempotencyKey);
        payload.put("order", order);
        if (request.getCallbackUrl() != null) {
            payload.put("checkout_options", Map.of(
                    "redirect_url", DriverSupport.appendQueryParam(request.getCallbackUrl(), "reference", reference)));
        }
        payload.put("pre_populated_data", Map.of("buyer_email", request.getEmail()));

        HttpHeaders headers = headers();
        DriverSupport.addIdempotencyKey(headers, "Idempotency-Key", request.getIdempotencyKey());

        JsonNode body;
        try {
            body = support.restTemplate()
                    .exchange("/v2/online-checkout/payment-links", HttpMethod.POST, new HttpEntity<>(payload, headers),
                            JsonNode.class)
                    .getBody();
        } catch (RestClientException e) {
            log.error("[{}] Charge failed: reference={}, error={}", getName(), reference, DriverSupport.describe(e));
            throw new ChargeException("Square charge failed: " + DriverSupport.describe(e), e);
        }
        JsonNode link = body != null ? body.path("payment_link") : null;
        if (link == null || link.isMissingNode() || DriverSupport.text(link, "/id") == null) {
            throw new ChargeException("Failed to create Square payment link");
        }

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("payment_link_id", DriverSupport.text(link, "/id"));
        metadata.put("order_id", DriverSupport.text(link, "/order_id"));
        metadata.put("is_sandbox", support.getBaseUrl().contains("squareupsandbox.com"));
        log.info("[{}] Charge initialized: reference={}, paymentLinkId={}", getName(), reference, DriverSupport.text(link, "/id"));
        return ChargeResponse.builder()
                .reference(reference)
                .authorizationUrl(DriverSupport.text(link, "/url"))
                .accessCode(DriverSupport.text(link, "/id"))
                .status(PaymentStatus.PENDING.getValue())
                .metadata(metadata)
                .provider(getName())
                .build();
    }

    @Override
    public VerificationResponse verify(String id) {
        try {
            Optional<VerificationResponse> byLink = verifyByPaymentLinkId(id);
            if (byLink.isPresent()) {
                return byLink.get();
            }
            Optional<VerificationResponse> byPayment = verifyByPaymentId(id);
            if (byPayment.isPresent()) {
                return byPayment.get();
            }
            return verifyByReferenceId(id);
        } catch (RestClientException e) {
            log.error("[{}] Verification failed: id={}, error={}", getName(), id, DriverSupport.describe(e));
            throw new VerificationException("Square verification failed: " + DriverSupport.describe(e), e);
        }
    }

    private Optional<VerificationResponse> verifyByPaymentLinkId(String id) {
        JsonNode link = getOrNotFound("/v2/online-checkout/payment-links/{id}", id);
        String orderId = link == null ? null : DriverSupport.text(link, "/payment_link/order_id");
        if (orderId == null) {
            return Optional.empty();
        }
        return Optional.of(verifyOrder(orderId, id));
    }

    private Optional<VerificationResponse> verifyByPaymentId(String id) {
        JsonNode payment = getOrNotFound("/v2/payments/{id}", id);
        if (payment == null || payment.path("payment").isMissingNode()) {
            return Optional.empty();
        }
        return Optional.of(fromPayment(payment.path("payment"), id));
    }

    private VerificationResponse verifyByReferenceId(String reference) {
        Map<String, Object> query = Map.of(
                "location_ids", List.of(locationId),
                "query", Map.of("filter", Map.of("state_filter", Map.of(
                        "states", List.of("OPEN", "COMPLETED", "CANCELED")))));
        JsonNode result = support.restTemplate()
                .exchange("/v2/orders/search", HttpMethod.POST, new HttpEntity<>(query, headers()), JsonNode.class)
                .getBody();
        if (result != null) {
            for (JsonNode order : result.path("orders")) {
                if (reference.equals(DriverSupport.text(order, "/reference_id"))) {
                    return verifyOrder(DriverSupport.text(order, "/id"), reference);
                }
            }
        }
        throw new VerificationException("Payment not found for reference [" + reference + "]");
    }

    /** An order without tenders has not been paid yet and reads as pending. */
    private VerificationResponse verifyOrder(String orderId, String fallbackReference) {
        JsonNode orderBody = support.restTemplate()
                .exchange("/v2/orders/{id}", HttpMethod.GET, new HttpEntity<>(headers()), JsonNode.class, orderId)
                .getBody();
        JsonNode order = orderBody != null ? orderBody.path("order") : null;
        if (order == null || order.isMissingNode()) {
            throw new VerificationException("Order not found for ID [" + orderId + "]");
        }
        String reference = Optional.ofNullable(DriverSupport.text(order, "/reference_id")).orElse(fallbackReference);
        String paymentId = DriverSupport.text(order, "/tenders/0/payment_id");
        if (paymentId == null) {
            String currency = DriverSupport.text(order, "/total_money/currency");
            return VerificationResponse.builder()
                    .reference(reference)
                    .status(PaymentStatus.PENDING.getValue())
                    .amount(DriverSupport.fromMinorUnits(DriverSupport.decimal(order, "/total_money/amount"), currency))
                    .currency(currency)
                    .metadata(Map.of("order_id", orderId))
                    .provider(getName())
                    .build();
        }
        JsonNode payment = support.restTemplate()
                .exchange("/v2/payments/{id}", HttpMethod.GET, new HttpEntity<>(headers()), JsonNode.class, paymentId)
                .getBody();
        if (payment == null || payment.path("payment").isMissingNode()) {
            throw new VerificationException("Payment [" + paymentId + "] not found for order [" + orderId + "]");
        }
        return fromPayment(payment.path("payment"), reference);
    }

    private VerificationResponse fromPayment(JsonNode payment, String fallbackReference) {
        String nativeStatus = DriverSupport.text(payment, "/status");
        String status = support.getContext().getStatusNormalizer().normalize(nativeStatus, getName());
        String currency = DriverSupport.text(payment, "/amount_money/currency");
        Instant paidAt = null;
        if (PaymentStatus.SUCCESS.getValue().equals(status)) {
            paidAt = DriverSupport.instant(payment, "/updated_at");
            if (paidAt == null) {
                paidAt = DriverSupport.instant(payment, "/created_at");
            }
        }
        log.info("[{}] Payment verified: paymentId={}, status={}", getName(), DriverSupport.text(payment, "/id"), nativeStatus);

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("payment_id", DriverSupport.text(payment, "/id"));
        metadata.put("order_id", DriverSupport.text(payment, "/order_id"));
        Map<String, Object> customer = new HashMap<>();
        customer.put("email", DriverSupport.text(payment, "/buyer_email_address"));
        return VerificationResponse.builder()
                .reference(Optional.ofNullable(DriverSupport.text(payment, "/reference_id")).orElse(fallbackReference))
                .status(status)
                .amount(DriverSupport.fromMinorUnits(DriverSupport.decimal(payment, "/amount_money/amount"), currency))
                .currency(currency)
                .paidAt(paidAt)
                .channel(Optional.ofNullable(DriverSupport.text(payment, "/source_type")).orElse("CARD"))
                .cardType(DriverSupport.text(payment, "/card_details/card/card_brand"))
                .customer(customer)
                .metadata(metadata)
                .provider(getName())
                .build();
    }

    private JsonNode getOrNotFound(String path, String id) {
        try {
            return support.restTemplate()
                    .exchange(path, HttpMethod.GET, new HttpEntity<>(headers()), JsonNode.class, id)
                    .getBody();
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                return null;
            }
            throw e;
        }
    }

    @Override
    public boolean validateWebhook(HttpHeaders headers, String rawBody) {
        String signature = DriverSupport.header(headers, SIGNATURE_HEADER, SIGNATURE_HEADER_SHA256);
        if (signature == null) {
            log.warn("[{}] Webhook signature missing", getName());
            return false;
        }
        if (webhookSignatureKey == null) {
            log.warn("[{}] Webhook signature key not configured (settings.webhook-signature-key)", getName());
            return false;
        }
        if (!SIGNATURE.verify(webhookSignatureKey, notificationUrl + rawBody, signature)) {
            log.warn("[{}] Webhook signature mismatch", getName());
            return false;
        }
        return support.readPayload(rawBody).map(payload -> support.isFresh(this, payload)).orElse(false);
    }

    @Override
    public boolean healthCheck() {
        return support.probe(() -> support.restTemplate().exchange("/v2/locations", HttpMethod.GET,
                new HttpEntity<>(headers()), String.class));
    }

    @Override
    public boolean getCachedHealthCheck() {
        return support.cachedHealthCheck(this);
    }

    @Override
    public String extractWebhookReference(JsonNode payload) {
        String reference = DriverSupport.text(payload, "/data/object/payment/reference_id");
        return reference != null ? reference : DriverSupport.text(payload, "/data/id");
    }

    @Override
    public String extractWebhookStatus(JsonNode payload) {
        String status = DriverSupport.text(payload, "/data/object/payment/status");
        return status != null ? status : Optional.ofNullable(DriverSupport.text(payload, "/type")).orElse("unknown");
    }

    @Override
    public String extractWebhookChannel(JsonNode payload) {
        return Optional.ofNullable(DriverSupport.text(payload, "/data/object/payment/source_type")).orElse("CARD");
    }

    @Override
    public Optional<Instant> extractWebhookTimestamp(JsonNode payload) {
        return Optional.ofNullable(DriverSupport.instant(payload, "/created_at"));
    }

    RestTemplate getRestTemplate() {
        return support.restTemplate();
    }

    private HttpHeaders headers() {
        HttpHeaders headers = support.bearerHeaders(accessToken);
        headers.set("Square-Version", API_VERSION);
        return headers;
    }
}

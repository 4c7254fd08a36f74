package com.payment.hub.drivers;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.hub.core.MappedChannels;
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
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Paystack: bearer secret key, amounts in kobo, webhooks signed with HMAC-SHA512 (hex) of
 * the body using the same secret key. Verification is by merchant reference.
 */
@Slf4j
public class PaystackDriver implements PaymentDriver {

    static final String DEFAULT_BASE_URL = "https://api.paystack.co";
    static final String SIGNATURE_HEADER = "x-paystack-signature";

    private static final HmacSignatureVerifier SIGNATURE =
            new HmacSignatureVerifier(HmacSignatureVerifier.Algorithm.SHA512, HmacSignatureVerifier.Encoding.HEX);

    private final DriverSupport support;
    private final String secretKey;

    public PaystackDriver(DriverSettings settings, DriverContext context) {
        this.secretKey = settings.require("secret-key");
        this.support = new DriverSupport(settings, context, DEFAULT_BASE_URL);
        context.getStatusNormalizer().registerProviderMappings(settings.getName(), Map.of(
                PaymentStatus.CANCELLED, List.of("abandoned"),
                PaymentStatus.FAILED, List.of("reversed")));
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

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("email", request.getEmail());
        payload.put("amount", request.getAmountInMinorUnits());
        payload.put("currency", request.getCurrency());
        payload.put("reference", reference);
        if (request.getCallbackUrl() != null) {
            payload.put("callback_url", request.getCallbackUrl());
        }
        if (!request.getMetadata().isEmpty()) {
            payload.put("metadata", request.getMetadata());
        }
        MappedChannels channels = support.getContext().getChannelMapper().mapChannels(request.getChannels(), getName());
        if (!channels.isOmitted()) {
            payload.put("channels", channels.getChannels());
        }

        HttpHeaders headers = authHeaders();
        DriverSupport.addIdempotencyKey(headers, "Idempotency-Key", request.getIdempotencyKey());

        JsonNode body;
        try {
            body = support.restTemplate()
                    .exchange("/transaction/initialize", HttpMethod.POST, new HttpEntity<>(payload, headers), JsonNode.class)
                    .getBody();
        } catch (RestClientException e) {
            log.error("[{}] Charge failed: reference={}, error={}", getName(), reference, DriverSupport.describe(e));
            throw new ChargeException("Paystack charge failed: " + DriverSupport.describe(e), e);
        }
        if (body == null || !body.path("status").asBoolean(false)) {
            String message = body != null ? DriverSupport.text(body, "/message") : null;
            throw new ChargeException(message != null ? message : "Failed to initialize Paystack transaction");
        }

        JsonNode data = body.path("data");
        String issuedReference = Optional.ofNullable(DriverSupport.text(data, "/reference")).orElse(reference);
        log.info("[{}] Charge initialized: reference={}, idempotent={}",
                getName(), issuedReference, request.getIdempotencyKey() != null);
        return ChargeResponse.builder()
                .reference(issuedReference)
                .authorizationUrl(DriverSupport.text(data, "/authorization_url"))
                .accessCode(DriverSupport.text(data, "/access_code"))
                .status(PaymentStatus.PENDING.getValue())
                .metadata(request.getMetadata())
                .provider(getName())
                .build();
    }

    @Override
    public VerificationResponse verify(String reference) {
        JsonNode body;
        try {
            body = support.restTemplate()
                    .exchange("/transaction/verify/{reference}", HttpMethod.GET, new HttpEntity<>(authHeaders()),
                            JsonNode.class, reference)
                    .getBody();
        } catch (RestClientException e) {
            log.error("[{}] Verification failed: reference={}, error={}", getName(), reference, DriverSupport.describe(e));
            throw new VerificationException("Paystack verification failed: " + DriverSupport.describe(e), e);
        }
        if (body == null || !body.path("status").asBoolean(false)) {
            String message = body != null ? DriverSupport.text(body, "/message") : null;
            throw new VerificationException(message != null ? message : "Failed to verify Paystack transaction");
        }

        JsonNode data = body.path("data");
        String nativeStatus = DriverSupport.text(data, "/status");
        String currency = DriverSupport.text(data, "/currency");
        log.info("[{}] Payment verified: reference={}, status={}", getName(), reference, nativeStatus);

        Map<String, Object> customer = new HashMap<>();
        customer.put("email", DriverSupport.text(data, "/customer/email"));
        customer.put("code", DriverSupport.text(data, "/customer/customer_code"));
        return VerificationResponse.builder()
                .reference(Optional.ofNullable(DriverSupport.text(data, "/reference")).orElse(reference))
                .status(support.getContext().getStatusNormalizer().normalize(nativeStatus, getName()))
                .amount(DriverSupport.fromMinorUnits(DriverSupport.decimal(data, "/amount"), currency))
                .currency(currency)
                .paidAt(DriverSupport.instant(data, "/paid_at"))
                .channel(DriverSupport.text(data, "/channel"))
                .cardType(DriverSupport.text(data, "/authorization/card_type"))
                .bank(DriverSupport.text(data, "/authorization/bank"))
                .customer(customer)
                .metadata(support.toMap(data.path("metadata")))
                .provider(getName())
                .build();
    }

    @Override
    public boolean validateWebhook(HttpHeaders headers, String rawBody) {
        String signature = DriverSupport.header(headers, SIGNATURE_HEADER);
        if (signature == null) {
            log.warn("[{}] Webhook signature missing", getName());
            return false;
        }
        if (!SIGNATURE.verify(secretKey, rawBody, signature)) {
            log.warn("[{}] Webhook signature mismatch", getName());
            return false;
        }
        return support.readPayload(rawBody).map(payload -> support.isFresh(this, payload)).orElse(false);
    }

    @Override
    public boolean healthCheck() {
        return support.probe(() -> support.restTemplate().exchange("/transaction/verify/invalid_ref_test",
                HttpMethod.GET, new HttpEntity<>(authHeaders()), String.class));
    }

    @Override
    public boolean getCachedHealthCheck() {
        return support.cachedHealthCheck(this);
    }

    @Override
    public String extractWebhookReference(JsonNode payload) {
        return DriverSupport.text(payload, "/data/reference");
    }

    @Override
    public String extractWebhookStatus(JsonNode payload) {
        return Optional.ofNullable(DriverSupport.text(payload, "/data/status")).orElse("unknown");
    }

    @Override
    public String extractWebhookChannel(JsonNode payload) {
        return DriverSupport.text(payload, "/data/channel");
    }

    @Override
    public Optional<Instant> extractWebhookTimestamp(JsonNode payload) {
        Instant paidAt = DriverSupport.instant(payload, "/data/paid_at");
        if (paidAt == null) {
            paidAt = DriverSupport.instant(payload, "/data/paidAt");
        }
        return Optional.ofNullable(paidAt != null ? paidAt : DriverSupport.instant(payload, "/data/created_at"));
    }

    /** Paystack verifies by the merchant reference, never the access code. */
    @Override
    public String resolveVerificationId(String reference, String providerId) {
        return reference;
    }

    RestTemplate getRestTemplate() {
        return support.restTemplate();
    }

    private HttpHeaders authHeaders() {
        return support.bearerHeaders(secretKey);
    }
}

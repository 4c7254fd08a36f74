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
import com.payment.hub.webhook.signature.SharedSecretVerifier;
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
 * Flutterwave v3 standard checkout. Webhooks carry the configured secret hash verbatim in
 * {@code verif-hash}; there is no body signature to compute.
 */
@Slf4j
public class FlutterwaveDriver implements PaymentDriver {

    static final String DEFAULT_BASE_URL = "https://api.flutterwave.com/v3";
    static final String SIGNATURE_HEADER = "verif-hash";
    static final String DEFAULT_PREFIX = "FLW";

    private final DriverSupport support;
    private final String secretKey;
    private final String webhookSecret;

    public FlutterwaveDriver(DriverSettings settings, DriverContext context) {
        this.secretKey = settings.require("secret-key");
        this.webhookSecret = settings.get("webhook-secret", secretKey);
        this.support = new DriverSupport(settings, context, DEFAULT_BASE_URL);
        context.getStatusNormalizer().registerProviderMappings(settings.getName(), Map.of(
                PaymentStatus.SUCCESS, List.of("successful", "completed")));
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
                : support.generateReference(support.getSettings().get("reference-prefix", DEFAULT_PREFIX));
        String callback = request.getCallbackUrl() != null
                ? request.getCallbackUrl()
                : support.getSettings().get("callback-url");
        String title = request.getDescription() != null ? request.getDescription() : "Payment";

        Map<String, Object> customer = new LinkedHashMap<>();
        customer.put("email", request.getEmail());
        customer.put("name", customerName(request));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("tx_ref", reference);
        payload.put("amount", request.getAmount());
        payload.put("currency", request.getCurrency());
        if (callback != null) {
            payload.put("redirect_url", DriverSupport.appendQueryParam(callback, "reference", reference));
        }
        payload.put("customer", customer);
        payload.put("customizations", Map.of(
                "title", title,
                "description", request.getDescription() != null ? request.getDescription() : "Payment for services"));
        payload.put("meta", request.getMetadata());
        MappedChannels channels = support.getContext().getChannelMapper().mapChannels(request.getChannels(), getName());
        if (!channels.isOmitted()) {
            payload.put("payment_options", String.join(",", channels.getChannels()));
        }

        HttpHeaders headers = support.bearerHeaders(secretKey);
        DriverSupport.addIdempotencyKey(headers, "Idempotency-Key", request.getIdempotencyKey());

        JsonNode body;
        try {
            body = support.restTemplate()
                    .exchange("/payments", HttpMethod.POST, new HttpEntity<>(payload, headers), JsonNode.class)
                    .getBody();
        } catch (RestClientException e) {
            log.error("[{}] Charge failed: reference={}, error={}", getName(), reference, DriverSupport.describe(e));
            throw new ChargeException("Flutterwave charge failed: " + DriverSupport.describe(e), e);
        }
        if (body == null || !"success".equalsIgnoreCase(DriverSupport.text(body, "/status"))) {
            String message = body != null ? DriverSupport.text(body, "/message") : null;
            throw new ChargeException(message != null ? message : "Failed to initialize Flutterwave transaction");
        }

        log.info("[{}] Charge initialized: reference={}, idempotent={}",
                getName(), reference, request.getIdempotencyKey() != null);
        return ChargeResponse.builder()
                .reference(reference)
                .authorizationUrl(DriverSupport.text(body, "/data/link"))
                .accessCode(reference)
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
                    .exchange("/transactions/verify_by_reference?tx_ref={reference}", HttpMethod.GET,
                            new HttpEntity<>(support.bearerHeaders(secretKey)), JsonNode.class, reference)
                    .getBody();
        } catch (RestClientException e) {
            log.error("[{}] Verification failed: reference={}, error={}", getName(), reference, DriverSupport.describe(e));
            throw new VerificationException("Flutterwave verification failed: " + DriverSupport.describe(e), e);
        }
        if (body == null || !"success".equalsIgnoreCase(DriverSupport.text(body, "/status"))) {
            String message = body != null ? DriverSupport.text(body, "/message") : null;
            throw new VerificationException(message != null ? message : "Failed to verify Flutterwave transaction");
        }

        JsonNode data = body.path("data");
        String nativeStatus = DriverSupport.text(data, "/status");
        String status = support.getContext().getStatusNormalizer().normalize(nativeStatus, getName());
        log.info("[{}] Payment verified: reference={}, status={}", getName(), reference, nativeStatus);

        Map<String, Object> customer = new HashMap<>();
        customer.put("email", DriverSupport.text(data, "/customer/email"));
        customer.put("name", DriverSupport.text(data, "/customer/name"));
        return VerificationResponse.builder()
                .reference(Optional.ofNullable(DriverSupport.text(data, "/tx_ref")).orElse(reference))
                .status(status)
                .amount(DriverSupport.decimal(data, "/amount"))
                .currency(DriverSupport.text(data, "/currency"))
                .paidAt(PaymentStatus.SUCCESS.getValue().equals(status) ? DriverSupport.instant(data, "/created_at") : null)
                .channel(DriverSupport.text(data, "/payment_type"))
                .cardType(DriverSupport.text(data, "/card/type"))
                .bank(DriverSupport.text(data, "/card/issuer"))
                .customer(customer)
                .metadata(support.toMap(data.path("meta")))
                .provider(getName())
                .build();
    }

    @Override
    public boolean validateWebhook(HttpHeaders headers, String rawBody) {
        String hash = DriverSupport.header(headers, SIGNATURE_HEADER);
        if (hash == null) {
            log.warn("[{}] Webhook hash header missing", getName());
            return false;
        }
        if (!SharedSecretVerifier.matches(webhookSecret, hash)) {
            log.warn("[{}] Webhook hash mismatch", getName());
            return false;
        }
        return support.readPayload(rawBody).map(payload -> support.isFresh(this, payload)).orElse(false);
    }

    @Override
    public boolean healthCheck() {
        return support.probe(() -> support.restTemplate().exchange("/banks/NG", HttpMethod.GET,
                new HttpEntity<>(support.bearerHeaders(secretKey)), String.class));
    }

    @Override
    public boolean getCachedHealthCheck() {
        return support.cachedHealthCheck(this);
    }

    @Override
    public String extractWebhookReference(JsonNode payload) {
        String reference = DriverSupport.text(payload, "/data/tx_ref");
        return reference != null ? reference : DriverSupport.text(payload, "/txRef");
    }

    @Override
    public String extractWebhookStatus(JsonNode payload) {
        String status = DriverSupport.text(payload, "/data/status");
        return status != null ? status : Optional.ofNullable(DriverSupport.text(payload, "/status")).orElse("unknown");
    }

    @Override
    public String extractWebhookChannel(JsonNode payload) {
        return DriverSupport.text(payload, "/data/payment_type");
    }

    @Override
    public Optional<Instant> extractWebhookTimestamp(JsonNode payload) {
        return Optional.ofNullable(DriverSupport.instant(payload, "/data/created_at"));
    }

    @Override
    public String resolveVerificationId(String reference, String providerId) {
        return reference;
    }

    RestTemplate getRestTemplate() {
        return support.restTemplate();
    }

    private static String customerName(ChargeRequest request) {
        Object name = request.getCustomer() != null ? request.getCustomer().get("name") : null;
        return name != null ? name.toString() : "Customer";
    }
}

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
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Monnify: API key/secret exchanged for a bearer token (cached until a minute before it
 * expires), webhooks signed with HMAC-SHA512 (hex) of the body using the secret key.
 * Verification uses Monnify's own transaction reference when it is known, the merchant
 * payment reference otherwise.
 */
@Slf4j
public class MonnifyDriver implements PaymentDriver {

    static final String DEFAULT_BASE_URL = "https://api.monnify.com";
    static final String SIGNATURE_HEADER = "monnify-signature";
    static final String DEFAULT_PREFIX = "MON";
    private static final String MONNIFY_REFERENCE_PREFIX = "MNFY";
    private static final long TOKEN_EXPIRY_MARGIN_SECONDS = 60;

    private static final HmacSignatureVerifier SIGNATURE =
            new HmacSignatureVerifier(HmacSignatureVerifier.Algorithm.SHA512, HmacSignatureVerifier.Encoding.HEX);

    private final DriverSupport support;
    private final String apiKey;
    private final String secretKey;
    private final String contractCode;

    private String accessToken;
    private Instant tokenExpiry;

    public MonnifyDriver(DriverSettings settings, DriverContext context) {
        this.apiKey = settings.require("api-key");
        this.secretKey = settings.require("secret-key");
        this.contractCode = settings.require("contract-code");
        this.support = new DriverSupport(settings, context, DEFAULT_BASE_URL);
        context.getStatusNormalizer().registerProviderMappings(settings.getName(), Map.of(
                PaymentStatus.SUCCESS, List.of("paid", "overpaid"),
                PaymentStatus.PENDING, List.of("partially_paid", "pending"),
                PaymentStatus.FAILED, List.of("expired", "failed")));
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
        MappedChannels channels = support.getContext().getChannelMapper().mapChannels(request.getChannels(), getName());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("amount", request.getAmount());
        payload.put("customerName", customerName(request));
        payload.put("customerEmail", request.getEmail());
        payload.put("paymentReference", reference);
        payload.put("paymentDescription", request.getDescription() != null ? request.getDescription() : "Payment");
        payload.put("currencyCode", request.getCurrency());
        payload.put("contractCode", contractCode);
        String callback = request.getCallbackUrl() != null ? request.getCallbackUrl() : support.getSettings().get("callback-url");
        if (callback != null) {
            payload.put("redirectUrl", callback);
        }
        payload.put("paymentMethods", channels.isOmitted() ? List.of("CARD", "ACCOUNT_TRANSFER") : channels.getChannels());
        if (!request.getMetadata().isEmpty()) {
            payload.put("metadata", request.getMetadata());
        }

        JsonNode body;
        try {
            HttpHeaders headers = support.bearerHeaders(getAccessToken());
            DriverSupport.addIdempotencyKey(headers, "Idempotency-Key", request.getIdempotencyKey());
            body = support.restTemplate()
                    .exchange("/api/v1/merchant/transactions/init-transaction", HttpMethod.POST,
                            new HttpEntity<>(payload, headers), JsonNode.class)
                    .getBody();
        } catch (RestClientException e) {
            log.error("[{}] Charge failed: reference={}, error={}", getName(), reference, DriverSupport.describe(e));
            throw new ChargeException("Monnify charge failed: " + DriverSupport.describe(e), e);
        }
        if (body == null || !body.path("requestSuccessful").asBoolean(false)) {
            String message = body != null ? DriverSupport.text(body, "/responseMessage") : null;
            throw new ChargeException(message != null ? message : "Failed to initialize Monnify transaction");
        }

        JsonNode result = body.path("responseBody");
        log.info("[{}] Charge initialized: reference={}, idempotent={}",
                getName(), reference, request.getIdempotencyKey() != null);
        return ChargeResponse.builder()
                .reference(reference)
                .authorizationUrl(DriverSupport.text(result, "/checkoutUrl"))
                .accessCode(DriverSupport.text(result, "/transactionReference"))
                .status(PaymentStatus.PENDING.getValue())
                .metadata(request.getMetadata())
                .provider(getName())
                .build();
    }

    @Override
    public VerificationResponse verify(String id) {
        JsonNode body;
        try {
            HttpEntity<Void> entity = new HttpEntity<>(support.bearerHeaders(getAccessToken()));
            body = id.toUpperCase(Locale.ROOT).startsWith(MONNIFY_REFERENCE_PREFIX)
                    ? support.restTemplate().exchange("/api/v2/transactions/{id}", HttpMethod.GET, entity,
                            JsonNode.class, id).getBody()
                    : support.restTemplate().exchange("/api/v1/merchant/transactions/query?paymentReference={id}",
                            HttpMethod.GET, entity, JsonNode.class, id).getBody();
        } catch (ChargeException e) {
            throw new VerificationException("Monnify verification failed: " + e.getMessage(), e);
        } catch (RestClientException e) {
            log.error("[{}] Verification failed: id={}, error={}", getName(), id, DriverSupport.describe(e));
            throw new VerificationException("Monnify verification failed: " + DriverSupport.describe(e), e);
        }
        if (body == null || !body.path("requestSuccessful").asBoolean(false)) {
            String message = body != null ? DriverSupport.text(body, "/responseMessage") : null;
            throw new VerificationException(message != null ? message : "Failed to verify Monnify transaction");
        }

        JsonNode result = body.path("responseBody");
        String nativeStatus = DriverSupport.text(result, "/paymentStatus");
        log.info("[{}] Payment verified: id={}, status={}", getName(), id, nativeStatus);

        Map<String, Object> customer = new HashMap<>();
        customer.put("email", DriverSupport.text(result, "/customerEmail"));
        customer.put("name", DriverSupport.text(result, "/customerName"));
        return VerificationResponse.builder()
                .reference(Optional.ofNullable(DriverSupport.text(result, "/paymentReference")).orElse(id))
                .status(support.getContext().getStatusNormalizer().normalize(nativeStatus, getName()))
                .amount(DriverSupport.decimal(result, "/amountPaid"))
                .currency(DriverSupport.text(result, "/currencyCode"))
                .paidAt(DriverSupport.instant(result, "/paidOn"))
                .channel(DriverSupport.text(result, "/paymentMethod"))
                .customer(customer)
                .metadata(support.toMap(result.path("metaData")))
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

    /** A successful login proves the API is up; a 4xx still means it answered. */
    @Override
    public boolean healthCheck() {
        try {
            requestAccessToken();
            return true;
        } catch (ChargeException e) {
            if (e.getCause() instanceof HttpClientErrorException) {
                return true;
            }
            log.warn("[{}] Health check failed: {}", getName(), e.getMessage());
            return false;
        }
    }

    @Override
    public boolean getCachedHealthCheck() {
        return support.cachedHealthCheck(this);
    }

    @Override
    public String extractWebhookReference(JsonNode payload) {
        return DriverSupport.text(payload, "/eventData/paymentReference");
    }

    @Override
    public String extractWebhookStatus(JsonNode payload) {
        return Optional.ofNullable(DriverSupport.text(payload, "/eventData/paymentStatus")).orElse("unknown");
    }

    @Override
    public String extractWebhookChannel(JsonNode payload) {
        return DriverSupport.text(payload, "/eventData/paymentMethod");
    }

    @Override
    public Optional<Instant> extractWebhookTimestamp(JsonNode payload) {
        return Optional.ofNullable(DriverSupport.instant(payload, "/eventData/paidOn"));
    }

    RestTemplate getRestTemplate() {
        return support.restTemplate();
    }

    synchronized String getAccessToken() {
        Instant now = support.getContext().getClock().instant();
        if (accessToken != null && tokenExpiry != null && now.isBefore(tokenExpiry)) {
            return accessToken;
        }
        return requestAccessToken();
    }

    private synchronized String requestAccessToken() {
        HttpHeaders headers = support.jsonHeaders();
        headers.setBasicAuth(apiKey, secretKey);
        JsonNode body;
        try {
            body = support.restTemplate()
                    .exchange("/api/v1/auth/login", HttpMethod.POST, new HttpEntity<>(headers), JsonNode.class)
                    .getBody();
        } catch (RestClientException e) {
            throw new ChargeException("Monnify authentication failed: " + DriverSupport.describe(e), e);
        }
        String token = body != null && body.path("requestSuccessful").asBoolean(false)
                ? DriverSupport.text(body, "/responseBody/accessToken")
                : null;
        if (token == null) {
            throw new ChargeException("Failed to authenticate with Monnify");
        }
        long expiresIn = body.path("responseBody").path("expiresIn").asLong(3600);
        accessToken = token;
        tokenExpiry = support.getContext().getClock().instant().plusSeconds(expiresIn - TOKEN_EXPIRY_MARGIN_SECONDS);
        log.debug("[{}] Access token refreshed, expiresInSeconds={}", getName(), expiresIn);
        return token;
    }

    private static String customerName(ChargeRequest request) {
        Object name = request.getCustomer() != null ? request.getCustomer().get("name") : null;
        return name != null ? name.toString() : "Customer";
    }
}

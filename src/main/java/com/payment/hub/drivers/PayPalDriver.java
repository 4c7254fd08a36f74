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
import com.payment.hub.exception.InvalidConfigurationException;
import com.payment.hub.exception.VerificationException;
import com.payment.hub.webhook.signature.CertificateSignatureVerifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.RoundingMode;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * PayPal Orders v2. Client credentials are exchanged for a bearer token cached until a
 * minute before expiry. Webhooks are verified either by PayPal's
 * verify-webhook-signature API ({@code webhook-verification: api}, the default) or
 * locally against PayPal's signing certificate ({@code certificate}); both need
 * {@code webhook-id}. Verification is by order id.
 */
@Slf4j
public class PayPalDriver implements PaymentDriver {

    static final String DEFAULT_BASE_URL = "https://api-m.paypal.com";
    static final String IDEMPOTENCY_HEADER = "PayPal-Request-Id";
    static final String TRANSMISSION_ID = "paypal-transmission-id";
    static final String TRANSMISSION_TIME = "paypal-transmission-time";
    static final String TRANSMISSION_SIG = "paypal-transmission-sig";
    static final String CERT_URL = "paypal-cert-url";
    static final String AUTH_ALGO = "paypal-auth-algo";
    private static final long TOKEN_EXPIRY_MARGIN_SECONDS = 60;
    private static final Set<String> CERTIFICATE_HOSTS = Set.of("paypal.com");

    enum WebhookVerification {
        API,
        CERTIFICATE
    }

    private final DriverSupport support;
    private final String clientId;
    private final String clientSecret;
    private final String webhookId;
    private final WebhookVerification webhookVerification;
    private final CertificateSignatureVerifier certificateVerifier;

    private String accessToken;
    private Instant tokenExpiry;

    public PayPalDriver(DriverSettings settings, DriverContext context) {
        this.clientId = settings.require("client-id");
        this.clientSecret = settings.require("client-secret");
        this.webhookId = settings.get("webhook-id");
        this.webhookVerification = parseVerification(settings);
        this.support = new DriverSupport(settings, context, DEFAULT_BASE_URL);
        this.certificateVerifier = new CertificateSignatureVerifier(context.getCertificateFetcher(), CERTIFICATE_HOSTS);
        context.getStatusNormalizer().registerProviderMappings(settings.getName(), Map.of(
                PaymentStatus.SUCCESS, List.of("completed"),
                PaymentStatus.PENDING, List.of("created", "saved", "approved", "payer_action_required"),
                PaymentStatus.CANCELLED, List.of("voided", "cancelled")));
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
        String callback = request.getCallbackUrl() != null ? request.getCallbackUrl() : support.getSettings().get("callback-url");

        Map<String, Object> amount = new LinkedHashMap<>();
        amount.put("currency_code", request.getCurrency());
        amount.put("value", request.getAmount()
                .setScale(DriverSupport.fractionDigits(request.getCurrency()), RoundingMode.HALF_UP)
                .toPlainString());
        Map<String, Object> unit = new LinkedHashMap<>();
        unit.put("reference_id", reference);
        unit.put("custom_id", reference);
        unit.put("description", request.getDescription() != null ? request.getDescription() : "Payment");
        unit.put("amount", amount);

        Map<String, Object> experience = new LinkedHashMap<>();
        experience.put("brand_name", support.getSettings().get("brand-name", "Your Store"));
        experience.put("user_action", "PAY_NOW");
        experience.put("payment_method_preference", "IMMEDIATE_PAYMENT_REQUIRED");
        if (callback != null) {
            experience.put("return_url", DriverSupport.appendQueryParam(callback, "reference", reference));
            experience.put("cancel_url", DriverSupport.appendQueryParam(callback, "reference", reference));
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("intent", "CAPTURE");
        payload.put("purchase_units", List.of(unit));
        payload.put("payment_source", Map.of("paypal", Map.of("experience_context", experience)));

        JsonNode body;
        try {
            HttpHeaders headers = support.bearerHeaders(getAccessToken());
            DriverSupport.addIdempotencyKey(headers, IDEMPOTENCY_HEADER, request.getIdempotencyKey());
            body = support.restTemplate()
                    .exchange("/v2/checkout/orders", HttpMethod.POST, new HttpEntity<>(payload, headers), JsonNode.class)
                    .getBody();
        } catch (RestClientException e) {
            log.error("[{}] Charge failed: reference={}, error={}", getName(), reference, DriverSupport.describe(e));
            throw new ChargeException("PayPal charge failed: " + DriverSupport.describe(e), e);
        }
        String orderId = body != null ? DriverSupport.text(body, "/id") : null;
        if (orderId == null) {
            throw new ChargeException("Failed to create PayPal order");
        }

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("order_id", orderId);
        log.info("[{}] Charge initialized: reference={}, orderId={}", getName(), reference, orderId);
        return ChargeResponse.builder()
                .reference(reference)
                .authorizationUrl(approvalLink(body))
                .accessCode(orderId)
                .status(support.getContext().getStatusNormalizer().normalize(DriverSupport.text(body, "/status"), getName()))
                .metadata(metadata)
                .provider(getName())
                .build();
    }

    @Override
    public VerificationResponse verify(String orderId) {
        JsonNode body;
        try {
            body = support.restTemplate()
                    .exchange("/v2/checkout/orders/{id}", HttpMethod.GET,
                            new HttpEntity<>(support.bearerHeaders(getAccessToken())), JsonNode.class, orderId)
                    .getBody();
        } catch (ChargeException e) {
            throw new VerificationException("PayPal verification failed: " + e.getMessage(), e);
        } catch (RestClientException e) {
            log.error("[{}] Verification failed: orderId={}, error={}", getName(), orderId, DriverSupport.describe(e));
            throw new VerificationException("PayPal verification failed: " + DriverSupport.describe(e), e);
        }
        if (body == null || DriverSupport.text(body, "/id") == null) {
            throw new VerificationException("PayPal order not found");
        }

        JsonNode unit = body.path("purchase_units").path(0);
        JsonNode capture = unit.path("payments").path("captures").path(0);
        String nativeStatus = DriverSupport.text(body, "/status");
        log.info("[{}] Payment verified: orderId={}, status={}", getName(), orderId, nativeStatus);

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("order_id", DriverSupport.text(body, "/id"));
        metadata.put("capture_id", DriverSupport.text(capture, "/id"));
        Map<String, Object> customer = new HashMap<>();
        customer.put("email", DriverSupport.text(body, "/payer/email_address"));
        customer.put("name", DriverSupport.text(body, "/payer/name/given_name"));
        String reference = DriverSupport.text(unit, "/custom_id");
        return VerificationResponse.builder()
                .reference(reference != null ? reference : orderId)
                .status(support.getContext().getStatusNormalizer().normalize(nativeStatus, getName()))
                .amount(DriverSupport.decimal(unit, "/amount/value"))
                .currency(DriverSupport.text(unit, "/amount/currency_code"))
                .paidAt(DriverSupport.instant(capture, "/create_time"))
                .channel("paypal")
                .customer(customer)
                .metadata(metadata)
                .provider(getName())
                .build();
    }

    @Override
    public boolean validateWebhook(HttpHeaders headers, String rawBody) {
        if (webhookId == null) {
            log.warn("[{}] Webhook rejected: webhook-id is not configured", getName());
            return false;
        }
        String transmissionId = DriverSupport.header(headers, TRANSMISSION_ID);
        String transmissionTime = DriverSupport.header(headers, TRANSMISSION_TIME);
        String signature = DriverSupport.header(headers, TRANSMISSION_SIG);
        String certUrl = DriverSupport.header(headers, CERT_URL);
        String authAlgo = DriverSupport.header(headers, AUTH_ALGO);
        if (transmissionId == null || transmissionTime == null || signature == null || certUrl == null) {
            log.warn("[{}] Webhook transmission headers missing", getName());
            return false;
        }
        Optional<JsonNode> payload = support.readPayload(rawBody);
        if (payload.isEmpty()) {
            return false;
        }

        boolean valid = webhookVerification == WebhookVerification.CERTIFICATE
                ? certificateVerifier.verify(certUrl, authAlgo, transmissionId, transmissionTime, webhookId, rawBody, signature)
                : verifyWithApi(transmissionId, transmissionTime, signature, certUrl, authAlgo, payload.get());
        if (!valid) {
            log.warn("[{}] Webhook signature rejected: transmissionId={}, mode={}", getName(), transmissionId, webhookVerification);
            return false;
        }
        return support.isFresh(this, payload.get());
    }

    private boolean verifyWithApi(String transmissionId, String transmissionTime, String signature,
                                  String certUrl, String authAlgo, JsonNode event) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("auth_algo", authAlgo);
        request.put("cert_url", certUrl);
        request.put("transmission_id", transmissionId);
        request.put("transmission_sig", signature);
        request.put("transmission_time", transmissionTime);
        request.put("webhook_id", webhookId);
        request.put("webhook_event", event);
        try {
            JsonNode body = support.restTemplate()
                    .exchange("/v1/notifications/verify-webhook-signature", HttpMethod.POST,
                            new HttpEntity<>(request, support.bearerHeaders(getAccessToken())), JsonNode.class)
                    .getBody();
            return body != null && "SUCCESS".equalsIgnoreCase(DriverSupport.text(body, "/verification_status"));
        } catch (RestClientException | ChargeException e) {
            log.error("[{}] Webhook verification call failed: {}", getName(), e.getMessage());
            return false;
        }
    }

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
        String reference = DriverSupport.text(payload, "/resource/custom_id");
        if (reference == null) {
            reference = DriverSupport.text(payload, "/resource/purchase_units/0/custom_id");
        }
        if (reference == null) {
            reference = DriverSupport.text(payload, "/resource/purchase_units/0/reference_id");
        }
        return reference;
    }

    @Override
    public String extractWebhookStatus(JsonNode payload) {
        String status = DriverSupport.text(payload, "/resource/status");
        return status != null ? status : Optional.ofNullable(DriverSupport.text(payload, "/event_type")).orElse("unknown");
    }

    @Override
    public String extractWebhookChannel(JsonNode payload) {
        return "paypal";
    }

    @Override
    public Optional<Instant> extractWebhookTimestamp(JsonNode payload) {
        return Optional.ofNullable(DriverSupport.instant(payload, "/create_time"));
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
        HttpHeaders headers = new HttpHeaders();
        headers.setBasicAuth(clientId, clientSecret);
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");
        JsonNode body;
        try {
            body = support.restTemplate()
                    .exchange("/v1/oauth2/token", HttpMethod.POST, new HttpEntity<>(form, headers), JsonNode.class)
                    .getBody();
        } catch (RestClientException e) {
            throw new ChargeException("PayPal authentication failed: " + DriverSupport.describe(e), e);
        }
        String token = body != null ? DriverSupport.text(body, "/access_token") : null;
        if (token == null) {
            throw new ChargeException("Failed to authenticate with PayPal");
        }
        long expiresIn = body.path("expires_in").asLong(3600);
        accessToken = token;
        tokenExpiry = support.getContext().getClock().instant().plusSeconds(expiresIn - TOKEN_EXPIRY_MARGIN_SECONDS);
        log.debug("[{}] Access token refreshed, expiresInSeconds={}", getName(), expiresIn);
        return token;
    }

    private static String approvalLink(JsonNode order) {
        for (JsonNode link : order.path("links")) {
            String rel = DriverSupport.text(link, "/rel");
            if ("approve".equals(rel) || "payer-action".equals(rel)) {
                return DriverSupport.text(link, "/href");
            }
        }
        return null;
    }

    private static WebhookVerification parseVerification(DriverSettings settings) {
        String mode = settings.get("webhook-verification", "api");
        try {
            return WebhookVerification.valueOf(mode.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("Setting 'webhook-verification' for provider '"
                    + settings.getName() + "' must be api or certificate, was: " + mode, e);
        }
    }
}

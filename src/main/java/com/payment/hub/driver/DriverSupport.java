package com.payment.hub.driver;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.payment.hub.webhook.signature.ReplayGuard;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.DefaultUriBuilderFactory;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Currency;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Scaffolding every driver composes: the lazily built HTTP client, reference generation
 * and the memoized health probe.
 */
@Slf4j
public class DriverSupport {

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final String HEALTH_KEY_PREFIX = "payments:health:";
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() { };

    private final DriverSettings settings;
    private final DriverContext context;
    private final String baseUrl;
    private volatile RestTemplate restTemplate;

    public DriverSupport(DriverSettings settings, DriverContext context, String defaultBaseUrl) {
        this.settings = settings;
        this.context = context;
        this.baseUrl = settings.get("base-url", defaultBaseUrl);
    }

    public DriverSettings getSettings() {
        return settings;
    }

    public DriverContext getContext() {
        return context;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * Client bound to the provider base URL with the provider timeout. Built on first use,
     * then shared.
     */
    public RestTemplate restTemplate() {
        RestTemplate template = restTemplate;
        if (template == null) {
            synchronized (this) {
                template = restTemplate;
                if (template == null) {
                    template = buildRestTemplate();
                    restTemplate = template;
                }
            }
        }
        return template;
    }

    private RestTemplate buildRestTemplate() {
        Duration timeout = settings.getDuration("timeout", context.getDefaultTimeout());
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) timeout.toMillis());
        factory.setReadTimeout((int) timeout.toMillis());
        RestTemplate template = new RestTemplate(factory);
        template.setUriTemplateHandler(new DefaultUriBuilderFactory(baseUrl));
        log.debug("[{}] HTTP client created: baseUrl={}, timeoutMs={}", settings.getName(), baseUrl, timeout.toMillis());
        return template;
    }

    /** {@code PREFIX_<unix seconds>_<16 hex chars>}; prefix defaults to the upper-cased provider name. */
    public String generateReference(String prefix) {
        String effective = prefix != null ? prefix : settings.getName().toUpperCase(Locale.ROOT);
        byte[] random = new byte[8];
        RANDOM.nextBytes(random);
        return effective + "_" + context.getClock().instant().getEpochSecond() + "_" + HexFormat.of().formatHex(random);
    }

    /**
     * Runs a probe request. Providers answer deliberately invalid probes with 4xx, which
     * still proves they are up; only 5xx and transport failures are unhealthy.
     */
    public boolean probe(Runnable call) {
        try {
            call.run();
            return true;
        } catch (HttpClientErrorException e) {
            return true;
        } catch (RestClientResponseException e) {
            log.warn("[{}] Health check failed: status={}", settings.getName(), e.getStatusCode().value());
            return e.getStatusCode().value() < 500;
        } catch (RestClientException e) {
            log.warn("[{}] Health check failed: {}", settings.getName(), e.getMessage());
            return false;
        }
    }

    /** At most one real probe per health TTL, shared through the key-value cache. */
    public boolean cachedHealthCheck(PaymentDriver driver) {
        Boolean healthy = context.getCache().getOrCompute(
                HEALTH_KEY_PREFIX + driver.getName(),
                context.getHealthCacheTtl(),
                Boolean.class,
                driver::healthCheck);
        return Boolean.TRUE.equals(healthy);
    }

    /** Adds {@code key=value} to a callback URL, keeping any query it already has. */
    public static String appendQueryParam(String url, String key, String value) {
        if (url == null || url.isBlank()) {
            return null;
        }
        return UriComponentsBuilder.fromUriString(url).queryParam(key, value).build().toUriString();
    }

    /** Short description of an HTTP failure for exception messages; never includes request headers. */
    public static String describe(RestClientException e) {
        if (e instanceof RestClientResponseException) {
            RestClientResponseException response = (RestClientResponseException) e;
            String body = response.getResponseBodyAsString();
            return "HTTP " + response.getStatusCode().value()
                    + (body.isBlank() ? "" : " " + abbreviate(body, 300));
        }
        return e.getMessage();
    }

    public static String text(JsonNode node, String path) {
        JsonNode value = node == null ? null : node.at(path);
        return value == null || value.isMissingNode() || value.isNull() || value.asText().isBlank()
                ? null
                : value.asText();
    }

    /** Parses a webhook body, or empty when it is not JSON. */
    public Optional<JsonNode> readPayload(String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(context.getObjectMapper().readTree(rawBody));
        } catch (JsonProcessingException e) {
            log.warn("[{}] Webhook body is not valid JSON: {}", settings.getName(), e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /** Replay check shared by every signature scheme; runs after the signature matched. */
    public boolean isFresh(PaymentDriver driver, JsonNode payload) {
        Instant issuedAt = driver.extractWebhookTimestamp(payload).orElse(null);
        return context.getReplayGuard().isFresh(issuedAt);
    }

    public Map<String, Object> toMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Collections.emptyMap();
        }
        return context.getObjectMapper().convertValue(node, MAP_TYPE);
    }

    public HttpHeaders jsonHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }

    public HttpHeaders bearerHeaders(String token) {
        HttpHeaders headers = jsonHeaders();
        headers.setBearerAuth(token);
        return headers;
    }

    /** Adds the idempotency header when the caller supplied a key; the key is never regenerated. */
    public static void addIdempotencyKey(HttpHeaders headers, String headerName, String idempotencyKey) {
        if (idempotencyKey != null && !headers.containsKey(headerName)) {
            headers.set(headerName, idempotencyKey);
        }
    }

    /** First present header among {@code names}; lookup ignores case. */
    public static String header(HttpHeaders headers, String... names) {
        if (headers == null) {
            return null;
        }
        for (String name : names) {
            String value = headers.getFirst(name);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    public static Instant instant(JsonNode node, String path) {
        return node == null ? null : ReplayGuard.parseTimestamp(node.at(path)).orElse(null);
    }

    public static BigDecimal decimal(JsonNode node, String path) {
        JsonNode value = node == null ? null : node.at(path);
        if (value == null || value.isMissingNode() || value.isNull() || value.asText().isBlank()) {
            return null;
        }
        return value.isNumber() ? value.decimalValue() : new BigDecimal(value.asText().trim());
    }

    /** Minor units (kobo, cents) back to a major-unit amount in {@code currency}. */
    public static BigDecimal fromMinorUnits(BigDecimal minor, String currency) {
        if (minor == null) {
            return null;
        }
        return minor.movePointLeft(fractionDigits(currency));
    }

    public static int fractionDigits(String currency) {
        if (currency == null) {
            return 2;
        }
        try {
            return Math.max(Currency.getInstance(currency.toUpperCase(Locale.ROOT)).getDefaultFractionDigits(), 0);
        } catch (IllegalArgumentException e) {
            return 2;
        }
    }

    private static String abbreviate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max) + "...";
    }
}

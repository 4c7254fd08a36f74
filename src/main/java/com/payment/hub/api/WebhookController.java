package com.payment.hub.api;

import com.payment.hub.core.ProviderHealthService;
import com.payment.hub.core.ProviderHealthService.ProviderHealth;
import com.payment.hub.webhook.WebhookIntakeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Provider webhook intake and aggregated provider health, both under
 * {@code payment.webhook.path}.
 */
@Slf4j
@RestController
@RequestMapping("${payment.webhook.path:/payments/webhook}")
@RequiredArgsConstructor
@Tag(name = "Webhooks", description = "Provider callbacks and provider health")
public class WebhookController {

    private final WebhookIntakeService intakeService;
    private final ProviderHealthService healthService;

    @PostMapping("/{provider}")
    @Operation(summary = "Receive a provider webhook",
            description = "Checks the provider signature and timestamp, then queues the event for processing.")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Queued. Body: { \"status\": \"queued\" }"),
            @ApiResponse(responseCode = "401", description = "Signature or timestamp rejected; nothing was queued."),
            @ApiResponse(responseCode = "404", description = "Unknown or disabled provider."),
            @ApiResponse(responseCode = "500", description = "Accepted but could not be queued; the provider should redeliver.")
    })
    public ResponseEntity<Map<String, String>> receive(
            @PathVariable String provider,
            @RequestHeader HttpHeaders headers,
            @RequestBody(required = false) String rawBody) {
        String jobId = intakeService.accept(provider, headers, rawBody);
        log.info("Webhook accepted: provider={}, jobId={}", provider, jobId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("status", "queued"));
    }

    @GetMapping("/health")
    @Operation(summary = "Provider health", description = "Cached health probe result and currencies per enabled provider.")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, ProviderHealth> providers = healthService.checkAll();
        return ResponseEntity.ok(Map.of("status", ProviderHealthService.OPERATIONAL, "providers", providers));
    }
}

package com.payment.hub.api;

import com.payment.hub.core.PaymentOrchestrator;
import com.payment.hub.domain.ChargeRequest;
import com.payment.hub.domain.ChargeResponse;
import com.payment.hub.domain.VerificationResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for charge initialization and verification.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
@Tag(name = "Payments", description = "Initialize and verify payments across providers")
public class PaymentController {

    private final PaymentOrchestrator orchestrator;

    @PostMapping("/charge")
    @Operation(
            summary = "Initialize a charge",
            description = "Tries the given providers (or the configured default and fallback providers) in order "
                    + "and returns the first provider's checkout details. Send Idempotency-Key to make retries safe; "
                    + "it is forwarded unchanged to the provider.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Charge initialized; redirect the payer to authorizationUrl.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ChargeResponse.class))),
            @ApiResponse(responseCode = "400", description = "Validation failed. Body: { \"error\": \"VALIDATION_FAILED\"|\"BAD_REQUEST\", ... }"),
            @ApiResponse(responseCode = "502", description = "Every provider failed. Body: { \"error\": \"ALL_PROVIDERS_FAILED\", \"errors\": { provider: message } }")
    })
    public ResponseEntity<ChargeResponse> charge(
            @Valid @RequestBody ChargeRequestDto dto,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey) {
        ChargeRequest request = dto.toChargeRequest(idempotencyKey);
        ChargeResponse response = orchestrator.charge(request, dto.getProviders());
        log.debug("Charge completed: reference={}, provider={}", response.getReference(), response.getProvider());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/verify/{reference}")
    @Operation(
            summary = "Verify a payment",
            description = "Re-checks the payment with its provider. The provider is worked out from earlier charges "
                    + "or the reference prefix unless given explicitly.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Current canonical status (success, failed, pending, cancelled).",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = VerificationResponse.class))),
            @ApiResponse(responseCode = "404", description = "The named provider is not configured or disabled."),
            @ApiResponse(responseCode = "502", description = "No provider could verify the reference.")
    })
    public ResponseEntity<VerificationResponse> verify(
            @PathVariable String reference,
            @RequestParam(value = "provider", required = false) String provider) {
        return ResponseEntity.ok(orchestrator.verify(reference, provider));
    }
}

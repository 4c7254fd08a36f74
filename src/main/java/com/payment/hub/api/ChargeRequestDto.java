package com.payment.hub.api;

import com.payment.hub.domain.ChargeRequest;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * REST request body for initializing a charge.
 */
@Data
public class ChargeRequestDto {

    @NotNull(message = "amount is required")
    @DecimalMin(value = "0.01", message = "amount must be greater than zero")
    private BigDecimal amount;

    @NotBlank(message = "currency is required")
    @Size(min = 3, max = 3, message = "currency must be a 3-letter ISO code")
    private String currency;

    @NotBlank(message = "email is required")
    @Email(message = "email must be a valid address")
    private String email;

    private String reference;
    private String callbackUrl;
    /** Falls back to the Idempotency-Key request header. */
    private String idempotencyKey;
    private String description;
    private Map<String, Object> metadata;
    /** Canonical channels: card, bank_transfer, ussd, mobile_money, qr_code. */
    private List<String> channels;
    private Map<String, Object> customer;
    /** Providers to try in order; the configured fallback chain when empty. */
    private List<String> providers;

    public ChargeRequest toChargeRequest(String headerIdempotencyKey) {
        return ChargeRequest.builder()
                .amount(amount)
                .currency(currency)
                .email(email)
                .reference(reference)
                .callbackUrl(callbackUrl)
                .idempotencyKey(idempotencyKey != null && !idempotencyKey.isBlank() ? idempotencyKey : headerIdempotencyKey)
                .description(description)
                .metadata(metadata)
                .channels(channels)
                .customer(customer)
                .build();
    }
}

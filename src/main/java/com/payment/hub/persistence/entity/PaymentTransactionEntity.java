package com.payment.hub.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * One row per charge reference. Created when a charge succeeds; status, channel and
 * paid-at are rewritten by verify and by webhook processing.
 */
@Entity
@Table(name = "payment_transactions", indexes = {
    @Index(name = "idx_payment_provider", columnList = "provider"),
    @Index(name = "idx_payment_status", columnList = "status"),
    @Index(name = "idx_payment_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentTransactionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "reference", unique = true, nullable = false)
    private String reference;

    @Column(name = "provider", nullable = false, length = 50)
    private String provider;

    /** Access code, session, order or payment-link id issued by the provider. */
    @Column(name = "provider_id")
    private String providerId;

    @Column(name = "status", nullable = false, length = 50)
    private String status;

    @Column(name = "amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "email")
    private String email;

    @Column(name = "channel", length = 50)
    private String channel;

    @Column(name = "paid_at")
    private Instant paidAt;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "metadata", columnDefinition = "TEXT")
    private Map<String, Object> metadata;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "customer", columnDefinition = "TEXT")
    private Map<String, Object> customer;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}

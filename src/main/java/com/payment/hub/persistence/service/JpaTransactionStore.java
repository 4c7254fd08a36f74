package com.payment.hub.persistence.service;

import com.payment.hub.domain.TransactionRecord;
import com.payment.hub.domain.TransactionUpdate;
import com.payment.hub.persistence.entity.PaymentTransactionEntity;
import com.payment.hub.persistence.repository.PaymentTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Objects;
import java.util.Optional;

/**
 * {@link TransactionStore} over PostgreSQL through Spring Data JPA. The best-effort
 * operations run in the repository's own short transactions and flush eagerly, so
 * constraint violations surface here rather than at a later commit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaTransactionStore implements TransactionStore {

    private final PaymentTransactionRepository repository;

    @Override
    public boolean create(TransactionRecord record) {
        try {
            PaymentTransactionEntity entity = PaymentTransactionEntity.builder()
                    .reference(record.getReference())
                    .provider(record.getProvider())
                    .providerId(record.getProviderId())
                    .status(record.getStatus())
                    .amount(record.getAmount())
                    .currency(record.getCurrency())
                    .email(record.getEmail())
                    .channel(record.getChannel())
                    .paidAt(record.getPaidAt())
                    .metadata(record.getMetadata())
                    .customer(record.getCustomer())
                    .build();
            repository.saveAndFlush(entity);
            log.debug("Persisted transaction: reference={}, provider={}, status={}",
                    record.getReference(), record.getProvider(), record.getStatus());
            return true;
        } catch (DataIntegrityViolationException e) {
            log.warn("Transaction already exists for reference={}; keeping the stored row", record.getReference());
            return false;
        } catch (Exception e) {
            log.error("Failed to persist transaction: reference={}, provider={}",
                    record.getReference(), record.getProvider(), e);
            // Don't throw - persistence failure shouldn't break the charge
            return false;
        }
    }

    @Override
    public Optional<TransactionRecord> findByReference(String reference) {
        try {
            return repository.findByReference(reference).map(JpaTransactionStore::toRecord);
        } catch (Exception e) {
            log.error("Transaction lookup failed: reference={}", reference, e);
            return Optional.empty();
        }
    }

    @Override
    public boolean update(String reference, TransactionUpdate update) {
        try {
            Optional<PaymentTransactionEntity> existing = repository.findByReference(reference);
            if (existing.isEmpty()) {
                log.debug("No stored transaction to update: reference={}", reference);
                return false;
            }
            PaymentTransactionEntity entity = existing.get();
            if (apply(entity, update)) {
                repository.saveAndFlush(entity);
            }
            return true;
        } catch (Exception e) {
            log.error("Failed to update transaction: reference={}, status={}", reference, update.getStatus(), e);
            // Don't throw - verify already has its answer from the provider
            return false;
        }
    }

    @Override
    @Transactional
    public UpdateOutcome updateWithLock(String reference, TransactionUpdate update) {
        Optional<PaymentTransactionEntity> locked = repository.findByReferenceForUpdate(reference);
        if (locked.isEmpty()) {
            return UpdateOutcome.NOT_FOUND;
        }
        PaymentTransactionEntity entity = locked.get();
        if (!apply(entity, update)) {
            log.debug("Transaction already up to date: reference={}, status={}", reference, entity.getStatus());
            return UpdateOutcome.UNCHANGED;
        }
        repository.save(entity);
        log.info("Transaction updated under lock: reference={}, status={}, channel={}",
                reference, entity.getStatus(), entity.getChannel());
        return UpdateOutcome.APPLIED;
    }

    /** Null fields leave the column alone; the first recorded paid-at is kept. */
    static boolean apply(PaymentTransactionEntity entity, TransactionUpdate update) {
        boolean changed = false;
        if (update.getStatus() != null && !Objects.equals(entity.getStatus(), update.getStatus())) {
            entity.setStatus(update.getStatus());
            changed = true;
        }
        if (update.getChannel() != null && !Objects.equals(entity.getChannel(), update.getChannel())) {
            entity.setChannel(update.getChannel());
            changed = true;
        }
        if (update.getPaidAt() != null && entity.getPaidAt() == null) {
            entity.setPaidAt(update.getPaidAt());
            changed = true;
        }
        return changed;
    }

    private static TransactionRecord toRecord(PaymentTransactionEntity entity) {
        return TransactionRecord.builder()
                .reference(entity.getReference())
                .provider(entity.getProvider())
                .providerId(entity.getProviderId())
                .status(entity.getStatus())
                .amount(entity.getAmount())
                .currency(entity.getCurrency())
                .email(entity.getEmail())
                .channel(entity.getChannel())
                .paidAt(entity.getPaidAt())
                .metadata(entity.getMetadata())
                .customer(entity.getCustomer())
                .build();
    }
}

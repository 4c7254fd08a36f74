package com.payment.hub.persistence.service;

import com.payment.hub.domain.TransactionRecord;
import com.payment.hub.domain.TransactionUpdate;

import java.util.Optional;

/**
 * Durable record of transactions, keyed by reference.
 */
public interface TransactionStore {

    /** Best effort: failures are logged, never thrown. Returns false when nothing was written. */
    boolean create(TransactionRecord record);

    /** Best effort: a failed read is logged and treated as not found. */
    Optional<TransactionRecord> findByReference(String reference);

    /** Best effort: failures are logged, never thrown. */
    boolean update(String reference, TransactionUpdate update);

    /**
     * Applies {@code update} while holding a row lock on {@code reference}, so concurrent
     * callers for one reference are serialized. Unlike the other operations, failures
     * propagate so the caller can retry.
     */
    UpdateOutcome updateWithLock(String reference, TransactionUpdate update);

    enum UpdateOutcome {
        /** At least one field changed. */
        APPLIED,
        /** The row already held these values. */
        UNCHANGED,
        NOT_FOUND
    }
}

package com.payment.hub.persistence.service;

import com.payment.hub.domain.TransactionRecord;
import com.payment.hub.domain.TransactionUpdate;
import com.payment.hub.persistence.entity.PaymentTransactionEntity;
import com.payment.hub.persistence.repository.PaymentTransactionRepository;
import com.payment.hub.persistence.service.TransactionStore.UpdateOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JpaTransactionStoreTest {

    private static final Instant PAID = Instant.parse("2024-06-01T11:59:00Z");

    @Mock
    private PaymentTransactionRepository repository;

    private JpaTransactionStore store;

    @BeforeEach
    void setUp() {
        store = new JpaTransactionStore(repository);
    }

    @Test
    void createMapsEveryField() {
        boolean created = store.create(TransactionRecord.builder()
                .reference("R1")
                .provider("paystack")
                .providerId("ac_1")
                .status("pending")
                .amount(new BigDecimal("100.50"))
                .currency("NGN")
                .email("buyer@example.com")
                .metadata(Map.of("order", "42"))
                .build());

        assertThat(created).isTrue();
        ArgumentCaptor<PaymentTransactionEntity> saved = ArgumentCaptor.forClass(PaymentTransactionEntity.class);
        verify(repository).saveAndFlush(saved.capture());
        assertThat(saved.getValue().getProviderId()).isEqualTo("ac_1");
        assertThat(saved.getValue().getMetadata()).containsEntry("order", "42");
    }

    @Test
    void createNeverThrows() {
        when(repository.saveAndFlush(any())).thenThrow(new DataIntegrityViolationException("duplicate reference"));
        assertThat(store.create(record("R1"))).isFalse();

        when(repository.saveAndFlush(any())).thenThrow(new QueryTimeoutException("db down"));
        assertThat(store.create(record("R2"))).isFalse();
    }

    @Test
    void findFailureReadsAsAbsent() {
        when(repository.findByReference("R1")).thenThrow(new QueryTimeoutException("db down"));

        assertThat(store.findByReference("R1")).isEmpty();
    }

    @Test
    void updateSkipsWriteWhenNothingChanged() {
        PaymentTransactionEntity entity = entity("success", "card", PAID);
        when(repository.findByReference("R1")).thenReturn(Optional.of(entity));

        assertThat(store.update("R1", TransactionUpdate.builder().status("success").channel("card").build())).isTrue();
        verify(repository, never()).saveAndFlush(any());
    }

    @Test
    void lockedUpdateReportsOutcome() {
        when(repository.findByReferenceForUpdate("R1")).thenReturn(Optional.of(entity("pending", null, null)));
        when(repository.findByReferenceForUpdate("R9")).thenReturn(Optional.empty());
        TransactionUpdate paid = TransactionUpdate.builder().status("success").channel("card").paidAt(PAID).build();

        assertThat(store.updateWithLock("R1", paid)).isEqualTo(UpdateOutcome.APPLIED);
        assertThat(store.updateWithLock("R1", paid)).isEqualTo(UpdateOutcome.UNCHANGED);
        assertThat(store.updateWithLock("R9", paid)).isEqualTo(UpdateOutcome.NOT_FOUND);
    }

    @Test
    void lockedUpdatePropagatesStoreFailures() {
        when(repository.findByReferenceForUpdate("R1")).thenThrow(new QueryTimeoutException("lock timeout"));

        assertThatThrownBy(() -> store.updateWithLock("R1", TransactionUpdate.builder().status("success").build()))
                .isInstanceOf(QueryTimeoutException.class);
    }

    @Test
    void applyKeepsFirstPaidAtAndIgnoresNullFields() {
        PaymentTransactionEntity entity = entity("success", "card", PAID);

        boolean changed = JpaTransactionStore.apply(entity, TransactionUpdate.builder()
                .paidAt(PAID.plusSeconds(3600))
                .build());

        assertThat(changed).isFalse();
        assertThat(entity.getPaidAt()).isEqualTo(PAID);
        assertThat(entity.getStatus()).isEqualTo("success");
        assertThat(entity.getChannel()).isEqualTo("card");
    }

    @Test
    void applyOverwritesDifferentStatus() {
        PaymentTransactionEntity entity = entity("success", "card", PAID);

        assertThat(JpaTransactionStore.apply(entity, TransactionUpdate.builder().status("failed").build())).isTrue();
        assertThat(entity.getStatus()).isEqualTo("failed");
    }

    private static TransactionRecord record(String reference) {
        return TransactionRecord.builder()
                .reference(reference)
                .provider("paystack")
                .status("pending")
                .amount(BigDecimal.TEN)
                .currency("NGN")
                .build();
    }

    private static PaymentTransactionEntity entity(String status, String channel, Instant paidAt) {
        return PaymentTransactionEntity.builder()
                .reference("R1")
                .provider("paystack")
                .status(status)
                .channel(channel)
                .paidAt(paidAt)
                .amount(BigDecimal.TEN)
                .currency("NGN")
                .build();
    }
}

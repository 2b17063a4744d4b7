package io.practicedb.core.tx;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;

import org.junit.jupiter.api.Test;

import io.practicedb.core.MutableClock;
import io.practicedb.core.PracticeDbException;

class TransactionManagerTest {

    private final MutableClock clock = MutableClock.at("2024-03-01T08:00:00Z");

    @Test
    void shouldRejectSecondBeginOnSameThread() {
        TransactionManager manager = new TransactionManager(clock);
        String first = manager.beginTransaction();

        PracticeDbException e = assertThrows(PracticeDbException.class, manager::beginTransaction);

        assertThat(e.getMessage()).contains(first);
        assertThat(manager.currentTransaction().getId()).isEqualTo(first);
        assertThat(manager.commit(first)).isTrue();
        assertThat(manager.beginTransaction()).isNotEqualTo(first);
    }

    @Test
    void shouldRecordOnlyWhilePending() {
        TransactionManager manager = new TransactionManager(clock);
        String tx = manager.beginTransaction();
        manager.record(new TransactionOperation.Created("patients", Map.of("id", "p1")));
        manager.commit(tx);
        manager.record(new TransactionOperation.Created("patients", Map.of("id", "p2")));

        assertThat(manager.getTransaction(tx).getOperations()).hasSize(1);
        assertThat(manager.currentTransaction()).isNull();
    }

    @Test
    void shouldForgetOldestFinishedTransactionsBeyondRetention() {
        TransactionManager manager = new TransactionManager(clock, 2);
        String first = manager.beginTransaction();
        manager.commit(first);
        String second = manager.beginTransaction();
        manager.beginRollback(second);
        String third = manager.beginTransaction();
        manager.commit(third);
        String pending = manager.beginTransaction();

        assertThat(manager.getTransaction(first)).isNull();
        assertThat(manager.getTransaction(second).getStatus()).isEqualTo(TransactionStatus.ROLLED_BACK);
        assertThat(manager.getTransaction(third).getStatus()).isEqualTo(TransactionStatus.COMMITTED);
        assertThat(manager.getTransaction(pending).getStatus()).isEqualTo(TransactionStatus.PENDING);
        assertThat(manager.size()).isEqualTo(3);
        assertThat(manager.commit(first)).isFalse();
    }
}

package io.practicedb.core.tx;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.logging.Logger;

import io.practicedb.core.Documents;
import io.practicedb.core.PracticeDbException;

/**
 * Tracks transactions for the engine. A transaction is bound to the thread that began it, and
 * mutations that thread makes while it is pending are recorded against it. A thread holds at most
 * one pending transaction. Only the most recent finished transactions stay queryable.
 */
public class TransactionManager {
    private static final Logger LOGGER = Logger.getLogger(TransactionManager.class.getName());
    public static final int DEFAULT_RETENTION = 100;

    private final Map<String, Transaction> transactions = new ConcurrentHashMap<>();
    private final Deque<String> finished = new ConcurrentLinkedDeque<>();
    private final ThreadLocal<Transaction> current = new ThreadLocal<>();
    private final Clock clock;
    private final int retention;

    public TransactionManager(Clock clock) {
        this(clock, DEFAULT_RETENTION);
    }

    public TransactionManager(Clock clock, int retention) {
        this.clock = clock;
        this.retention = retention;
    }

    /**
     * @throws PracticeDbException when the calling thread already has a pending transaction
     */
    public String beginTransaction() {
        Transaction active = current.get();
        if (active != null && active.getStatus() == TransactionStatus.PENDING) {
            throw new PracticeDbException("Transaction already active on this thread: " + active.getId());
        }
        Transaction tx = new Transaction("tx_" + Documents.generateId(clock), Documents.timestamp(clock));
        transactions.put(tx.getId(), tx);
        current.set(tx);
        LOGGER.fine(() -> "Began transaction " + tx.getId());
        return tx.getId();
    }

    /**
     * Records {@code operation} against the calling thread's transaction, if it has a pending one.
     */
    public void record(TransactionOperation operation) {
        Transaction tx = current.get();
        if (tx != null && tx.getStatus() == TransactionStatus.PENDING) {
            tx.add(operation);
        }
    }

    public synchronized boolean commit(String transactionId) {
        Transaction tx = transactions.get(transactionId);
        if (tx == null || tx.getStatus() != TransactionStatus.PENDING) {
            return false;
        }
        tx.setStatus(TransactionStatus.COMMITTED);
        finish(tx);
        return true;
    }

    /**
     * Marks the transaction rolled back and returns its operations newest first, or null when the id
     * is unknown or no longer pending. The caller restores the before-images.
     */
    public synchronized List<TransactionOperation> beginRollback(String transactionId) {
        Transaction tx = transactions.get(transactionId);
        if (tx == null || tx.getStatus() != TransactionStatus.PENDING) {
            return null;
        }
        tx.setStatus(TransactionStatus.ROLLED_BACK);
        finish(tx);
        List<TransactionOperation> operations = new ArrayList<>(tx.getOperations());
        Collections.reverse(operations);
        return operations;
    }

    public Transaction getTransaction(String transactionId) {
        return transactions.get(transactionId);
    }

    public Transaction currentTransaction() {
        return current.get();
    }

    public int size() {
        return transactions.size();
    }

    public void clear() {
        transactions.clear();
        finished.clear();
        current.remove();
    }

    private void finish(Transaction tx) {
        if (current.get() == tx) {
            current.remove();
        }
        finished.addLast(tx.getId());
        while (finished.size() > retention) {
            String evicted = finished.pollFirst();
            if (evicted != null) {
                transactions.remove(evicted);
            }
        }
    }
}

package io.practicedb.core.tx;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Client-side record of mutations made while pending. Offers no isolation from other callers.
 */
public class Transaction {

    private final String id;
    private final String createdAt;
    private final List<TransactionOperation> operations = Collections.synchronizedList(new ArrayList<>());
    private volatile TransactionStatus status = TransactionStatus.PENDING;

    Transaction(String id, String createdAt) {
        this.id = id;
        this.createdAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public String getCreatedAt() {
        return createdAt;
    }

    public TransactionStatus getStatus() {
        return status;
    }

    public List<TransactionOperation> getOperations() {
        synchronized (operations) {
            return new ArrayList<>(operations);
        }
    }

    void add(TransactionOperation operation) {
        operations.add(operation);
    }

    void setStatus(TransactionStatus status) {
        this.status = status;
    }
}

package io.practicedb.core.tx;

public enum TransactionStatus {
    PENDING, COMMITTED, ROLLED_BACK
}

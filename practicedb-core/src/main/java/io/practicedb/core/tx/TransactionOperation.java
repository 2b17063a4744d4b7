package io.practicedb.core.tx;

import java.util.Map;

import io.practicedb.core.Documents;

/**
 * A mutation recorded while a transaction was pending, carrying the before-image needed to undo it.
 */
public interface TransactionOperation {

    enum Kind {
        CREATED, UPDATED, DELETED
    }

    Kind kind();

    String collection();

    String documentId();

    /**
     * State of the document before the operation; null when it did not exist.
     */
    Map<String, Object> before();

    record Created(String collection, Map<String, Object> document) implements TransactionOperation {
        @Override
        public Kind kind() {
            return Kind.CREATED;
        }

        @Override
        public String documentId() {
            return Documents.idOf(document);
        }

        @Override
        public Map<String, Object> before() {
            return null;
        }
    }

    record Updated(String collection, Map<String, Object> before, Map<String, Object> after)
            implements TransactionOperation {
        @Override
        public Kind kind() {
            return Kind.UPDATED;
        }

        @Override
        public String documentId() {
            return Documents.idOf(after);
        }
    }

    record Deleted(String collection, Map<String, Object> document) implements TransactionOperation {
        @Override
        public Kind kind() {
            return Kind.DELETED;
        }

        @Override
        public String documentId() {
            return Documents.idOf(document);
        }

        @Override
        public Map<String, Object> before() {
            return document;
        }
    }
}

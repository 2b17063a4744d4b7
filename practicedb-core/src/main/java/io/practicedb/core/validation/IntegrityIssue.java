package io.practicedb.core.validation;

public record IntegrityIssue(String documentId, Type type, String field, String message) {

    public enum Type {
        ORPHAN, UNIQUE_VIOLATION
    }
}

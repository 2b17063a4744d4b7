package io.practicedb.core.validation;

/**
 * {@code sourceCollection.sourceField} holds the id of a document in {@code targetCollection}.
 */
public record ReferenceConstraint(String sourceCollection, String sourceField, String targetCollection,
        OnDelete onDelete, OnUpdate onUpdate) {
}

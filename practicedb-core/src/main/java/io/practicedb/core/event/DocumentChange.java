package io.practicedb.core.event;

import java.util.Map;

/**
 * One document-level entry of a {@link CollectionChange}. {@code document} is the state after the
 * change, or the removed document for deletions.
 */
public record DocumentChange(Type type, String documentId, Map<String, Object> document) {

    public enum Type {
        CREATED, UPDATED, DELETED
    }
}

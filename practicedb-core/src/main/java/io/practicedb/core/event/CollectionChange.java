package io.practicedb.core.event;

import java.util.List;
import java.util.Map;

/**
 * Delivered to subscribers once per mutating call.
 *
 * @param collection the collection that changed
 * @param changes    the documents touched by the call, in the order they were applied
 * @param snapshot   the whole collection after the change
 * @param external   true when the change came from the sync peer rather than a local caller
 */
public record CollectionChange(String collection, List<DocumentChange> changes, List<Map<String, Object>> snapshot,
        boolean external) {
}

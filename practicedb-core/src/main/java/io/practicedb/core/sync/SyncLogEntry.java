package io.practicedb.core.sync;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One row of the sync log: a local mutation the remote peer has not acknowledged yet.
 * Rows in {@code error} status hold the last push failure and are retried like pending ones.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncLogEntry(String id, String collection, SyncAction action, String documentId, String timestamp,
        String syncedAt, SyncStatus status, String error) {

    public static SyncLogEntry pending(String id, String collection, SyncAction action, String documentId,
            String timestamp) {
        return new SyncLogEntry(id, collection, action, documentId, timestamp, null, SyncStatus.PENDING, null);
    }

    public SyncLogEntry synced(String at) {
        return new SyncLogEntry(id, collection, action, documentId, timestamp, at, SyncStatus.SYNCED, null);
    }

    public SyncLogEntry failed(String message) {
        return new SyncLogEntry(id, collection, action, documentId, timestamp, null, SyncStatus.ERROR, message);
    }

    @JsonIgnore
    public boolean isUnsynced() {
        return status != SyncStatus.SYNCED;
    }
}

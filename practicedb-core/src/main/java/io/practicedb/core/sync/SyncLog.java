package io.practicedb.core.sync;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.core.type.TypeReference;

import io.practicedb.core.storage.StorageAdapter;
import io.practicedb.core.storage.StorageKeys;

/**
 * Capped sync log persisted under {@code _sync_log}. Appends drop the oldest rows beyond the
 * capacity. Callers serialize access; the engine does so under its write lock.
 */
public class SyncLog {
    public static final int DEFAULT_CAPACITY = 1000;

    private static final TypeReference<List<SyncLogEntry>> ENTRIES_TYPE = new TypeReference<List<SyncLogEntry>>() {
    };

    private final StorageAdapter storage;
    private final int capacity;

    public SyncLog(StorageAdapter storage, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Sync log capacity must be positive: " + capacity);
        }
        this.storage = storage;
        this.capacity = capacity;
    }

    public void append(Collection<SyncLogEntry> rows) throws IOException {
        if (rows.isEmpty()) {
            return;
        }
        List<SyncLogEntry> entries = entries();
        entries.addAll(rows);
        if (entries.size() > capacity) {
            entries = new ArrayList<>(entries.subList(entries.size() - capacity, entries.size()));
        }
        storage.set(StorageKeys.SYNC_LOG, entries);
    }

    public List<SyncLogEntry> entries() throws IOException {
        List<SyncLogEntry> entries = storage.get(StorageKeys.SYNC_LOG, ENTRIES_TYPE);
        return entries == null ? new ArrayList<>() : new ArrayList<>(entries);
    }

    /**
     * Rows not yet acknowledged by the peer, oldest first.
     */
    public List<SyncLogEntry> pending() throws IOException {
        List<SyncLogEntry> result = new ArrayList<>();
        for (SyncLogEntry entry : entries()) {
            if (entry.isUnsynced()) {
                result.add(entry);
            }
        }
        return result;
    }

    public int markSynced(Collection<String> ids, String syncedAt) throws IOException {
        Set<String> wanted = new HashSet<>(ids);
        List<SyncLogEntry> entries = entries();
        int marked = 0;
        for (int i = 0; i < entries.size(); i++) {
            SyncLogEntry entry = entries.get(i);
            if (wanted.contains(entry.id()) && entry.isUnsynced()) {
                entries.set(i, entry.synced(syncedAt));
                marked++;
            }
        }
        if (marked > 0) {
            storage.set(StorageKeys.SYNC_LOG, entries);
        }
        return marked;
    }

    public boolean markFailed(String id, String error) throws IOException {
        List<SyncLogEntry> entries = entries();
        for (int i = 0; i < entries.size(); i++) {
            SyncLogEntry entry = entries.get(i);
            if (entry.id().equals(id) && entry.isUnsynced()) {
                entries.set(i, entry.failed(error));
                storage.set(StorageKeys.SYNC_LOG, entries);
                return true;
            }
        }
        return false;
    }

    public void clear() throws IOException {
        storage.delete(StorageKeys.SYNC_LOG);
    }

    public int getCapacity() {
        return capacity;
    }
}

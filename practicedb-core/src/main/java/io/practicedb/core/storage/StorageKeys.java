package io.practicedb.core.storage;

/**
 * Reserved key namespace shared by the engine, the migration runner and export/import.
 */
public final class StorageKeys {
    public static final String METADATA = "_metadata";
    public static final String SYNC_LOG = "_sync_log";
    public static final String SYSTEM_PREFIX = "_";
    public static final String INDEX_PREFIX = "idx_";

    private StorageKeys() {
    }

    /**
     * True for keys holding documents, false for metadata, sync log and index keys.
     */
    public static boolean isCollectionKey(String key) {
        return !key.startsWith(SYSTEM_PREFIX) && !key.startsWith(INDEX_PREFIX);
    }
}

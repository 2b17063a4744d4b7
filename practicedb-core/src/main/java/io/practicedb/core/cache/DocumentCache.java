package io.practicedb.core.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.practicedb.core.Documents;

/**
 * Read-through cache of single documents keyed {@code collection:id}.
 * <p>
 * Entries expire after a fixed TTL regardless of writes; the engine invalidates them on every
 * mutation of the id or its collection.
 */
public class DocumentCache {
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private record Entry(Map<String, Object> document, long timestamp) {
    }

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final long ttlMillis;

    public DocumentCache(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttlMillis = ttl.toMillis();
    }

    public Map<String, Object> get(String collection, String id) {
        String key = key(collection, id);
        Entry entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (clock.millis() - entry.timestamp() >= ttlMillis) {
            entries.remove(key, entry);
            return null;
        }
        return Documents.copy(entry.document());
    }

    public void put(String collection, String id, Map<String, Object> document) {
        entries.put(key(collection, id), new Entry(Documents.copy(document), clock.millis()));
    }

    public void invalidate(String collection, String id) {
        entries.remove(key(collection, id));
    }

    public void invalidateCollection(String collection) {
        String prefix = collection + ":";
        entries.keySet().removeIf(key -> key.startsWith(prefix));
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    private static String key(String collection, String id) {
        return collection + ":" + id;
    }
}

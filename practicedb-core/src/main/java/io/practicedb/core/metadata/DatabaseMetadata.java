package io.practicedb.core.metadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Singleton document stored under {@code _metadata}. {@code statistics} maps each tracked
 * collection to its document count as of the last recompute.
 */
public record DatabaseMetadata(String version, String lastMigration, String createdAt, String updatedAt,
        Map<String, Integer> statistics) {

    public static final String INITIAL_VERSION = "1.0.0";

    public DatabaseMetadata {
        statistics = statistics == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(statistics));
    }

    public static DatabaseMetadata initial(String now) {
        return new DatabaseMetadata(INITIAL_VERSION, null, now, now, Collections.emptyMap());
    }

    public DatabaseMetadata withStatistics(Map<String, Integer> newStatistics, String now) {
        return new DatabaseMetadata(version, lastMigration, createdAt, now, newStatistics);
    }

    public DatabaseMetadata withMigration(String migratedVersion, String now) {
        return new DatabaseMetadata(migratedVersion, migratedVersion, createdAt, now, statistics);
    }

    public int count(String collection) {
        Integer count = statistics.get(collection);
        return count == null ? 0 : count;
    }
}

package io.practicedb.core.index;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Secondary value-to-ids indexes persisted next to the collections they describe.
 * Indexes are derived data: they reflect the documents at build time only.
 */
public interface IndexEngine {

    void createIndex(String collection, String field, String indexName, List<Map<String, Object>> documents)
            throws IOException;

    /**
     * Ids recorded for {@code value}, or an empty list when the index or value is unknown.
     */
    List<String> lookup(String indexName, Object value) throws IOException;

    void dropIndex(String indexName) throws IOException;

    List<IndexDefinition> getIndexes() throws IOException;

    List<IndexDefinition> getIndexes(String collection) throws IOException;

    record IndexDefinition(String name, String collection, String field) {
    }
}

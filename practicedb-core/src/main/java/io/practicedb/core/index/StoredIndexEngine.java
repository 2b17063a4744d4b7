package io.practicedb.core.index;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import com.fasterxml.jackson.core.type.TypeReference;

import io.practicedb.core.Documents;
import io.practicedb.core.storage.StorageAdapter;
import io.practicedb.core.storage.StorageKeys;

/**
 * Index engine that keeps each index as a {@code String(value) -> [ids]} map under its own storage
 * key, and the list of definitions under {@code _indexes}.
 */
public class StoredIndexEngine implements IndexEngine {
    private static final Logger LOGGER = Logger.getLogger(StoredIndexEngine.class.getName());
    static final String DEFINITIONS_KEY = StorageKeys.SYSTEM_PREFIX + "indexes";

    private static final TypeReference<Map<String, List<String>>> INDEX_TYPE = new TypeReference<Map<String, List<String>>>() {
    };
    private static final TypeReference<List<IndexDefinition>> DEFINITIONS_TYPE = new TypeReference<List<IndexDefinition>>() {
    };

    private final StorageAdapter storage;

    public StoredIndexEngine(StorageAdapter storage) {
        this.storage = storage;
    }

    @Override
    public void createIndex(String collection, String field, String indexName, List<Map<String, Object>> documents)
            throws IOException {
        Map<String, List<String>> index = new LinkedHashMap<>();
        for (Map<String, Object> document : documents) {
            String id = Documents.idOf(document);
            if (id == null) {
                continue;
            }
            index.computeIfAbsent(indexKey(document.get(field)), k -> new ArrayList<>()).add(id);
        }
        storage.set(storageKey(indexName), index);

        List<IndexDefinition> definitions = getIndexes();
        definitions.removeIf(def -> def.name().equals(indexName));
        definitions.add(new IndexDefinition(indexName, collection, field));
        storage.set(DEFINITIONS_KEY, definitions);
        LOGGER.fine(() -> "Built index " + indexName + " on " + collection + "." + field + " with "
                + index.size() + " distinct values");
    }

    @Override
    public List<String> lookup(String indexName, Object value) throws IOException {
        Map<String, List<String>> index = storage.get(storageKey(indexName), INDEX_TYPE);
        if (index == null) {
            return new ArrayList<>();
        }
        List<String> ids = index.get(indexKey(value));
        return ids == null ? new ArrayList<>() : ids;
    }

    @Override
    public void dropIndex(String indexName) throws IOException {
        storage.delete(storageKey(indexName));
        List<IndexDefinition> definitions = getIndexes();
        if (definitions.removeIf(def -> def.name().equals(indexName))) {
            storage.set(DEFINITIONS_KEY, definitions);
        }
    }

    @Override
    public List<IndexDefinition> getIndexes() throws IOException {
        List<IndexDefinition> definitions = storage.get(DEFINITIONS_KEY, DEFINITIONS_TYPE);
        return definitions == null ? new ArrayList<>() : new ArrayList<>(definitions);
    }

    @Override
    public List<IndexDefinition> getIndexes(String collection) throws IOException {
        List<IndexDefinition> result = new ArrayList<>();
        for (IndexDefinition def : getIndexes()) {
            if (def.collection().equals(collection)) {
                result.add(def);
            }
        }
        return result;
    }

    /**
     * Storage key for an index. Names without the {@code idx_} prefix get it added so an index can
     * never shadow a collection.
     */
    static String storageKey(String indexName) {
        if (indexName == null || indexName.isBlank()) {
            throw new IllegalArgumentException("Index name is required");
        }
        return indexName.startsWith(StorageKeys.INDEX_PREFIX) ? indexName : StorageKeys.INDEX_PREFIX + indexName;
    }

    /**
     * Index keys are strings; whole numbers drop their fraction so 45 and 45.0 share a bucket.
     */
    static String indexKey(Object value) {
        if (value instanceof Number) {
            BigDecimal decimal = new BigDecimal(value.toString()).stripTrailingZeros();
            return decimal.scale() <= 0 ? decimal.toBigInteger().toString() : decimal.toPlainString();
        }
        return String.valueOf(value);
    }
}

package io.practicedb.core.storage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Volatile adapter for tests and ephemeral runs. Values are held as Jackson trees so callers
 * never share mutable state with the store.
 */
public class MemoryStorageAdapter implements StorageAdapter {
    private final Map<String, JsonNode> store = new ConcurrentHashMap<>();
    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public <T> T get(String key, TypeReference<T> type) {
        JsonNode node = store.get(key);
        if (node == null || node.isNull()) {
            return null;
        }
        return mapper.convertValue(node, type);
    }

    @Override
    public void set(String key, Object value) {
        store.put(key, mapper.valueToTree(value));
    }

    @Override
    public void delete(String key) {
        store.remove(key);
    }

    @Override
    public List<String> keys(String prefix) {
        List<String> result = new ArrayList<>();
        for (String key : store.keySet()) {
            if (prefix == null || key.startsWith(prefix)) {
                result.add(key);
            }
        }
        return result;
    }

    @Override
    public void clear(String prefix) {
        if (prefix == null) {
            store.clear();
            return;
        }
        store.keySet().removeIf(key -> key.startsWith(prefix));
    }

    public int size() {
        return store.size();
    }
}

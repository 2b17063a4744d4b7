package io.practicedb.core.storage;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.core.type.TypeReference;

class MemoryStorageAdapterTest {
    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<Map<String, Object>>() {
    };

    @Test
    void shouldStoreDetachedCopies() {
        MemoryStorageAdapter storage = new MemoryStorageAdapter();
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("tags", new ArrayList<>(List.of("a")));
        storage.set("patients", value);

        value.put("extra", true);
        Map<String, Object> read = storage.get("patients", MAP);
        read.put("other", 1);

        assertThat(storage.get("patients", MAP)).containsOnlyKeys("tags");
    }

    @Test
    void shouldListAndClearByPrefix() throws IOException {
        MemoryStorageAdapter storage = new MemoryStorageAdapter();
        storage.set("patients", List.of());
        storage.set("_metadata", Map.of());
        storage.set("_sync_log", List.of());

        assertThat(storage.keys("_")).containsExactlyInAnyOrder("_metadata", "_sync_log");
        storage.clear("_");
        assertThat(storage.keys()).containsExactly("patients");
        storage.delete("patients");
        assertThat(storage.size()).isZero();
        assertThat(storage.get("patients", MAP)).isNull();
    }
}

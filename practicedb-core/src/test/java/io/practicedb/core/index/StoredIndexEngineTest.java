package io.practicedb.core.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.practicedb.core.storage.MemoryStorageAdapter;

class StoredIndexEngineTest {

    @Test
    void shouldBucketWholeNumbersTogether() throws IOException {
        StoredIndexEngine indexes = new StoredIndexEngine(new MemoryStorageAdapter());
        indexes.createIndex("patients", "age", "idx_age", List.of(
                Map.of("id", "p1", "age", 45),
                Map.of("id", "p2", "age", 45.0),
                Map.of("id", "p3", "age", 45.5)));

        assertThat(indexes.lookup("idx_age", 45L)).containsExactly("p1", "p2");
        assertThat(indexes.lookup("idx_age", 45.5)).containsExactly("p3");
        assertThat(indexes.lookup("idx_missing", 45)).isEmpty();
    }

    @Test
    void shouldReplaceDefinitionWhenRebuilt() throws IOException {
        StoredIndexEngine indexes = new StoredIndexEngine(new MemoryStorageAdapter());
        indexes.createIndex("patients", "mrn", "idx_mrn", List.of());
        indexes.createIndex("patients", "mrn", "idx_mrn", List.of(Map.of("id", "p1", "mrn", "M1")));
        indexes.createIndex("claims", "status", "idx_status", List.of());

        assertThat(indexes.getIndexes()).hasSize(2);
        assertThat(indexes.getIndexes("patients"))
                .containsExactly(new IndexEngine.IndexDefinition("idx_mrn", "patients", "mrn"));

        indexes.dropIndex("idx_mrn");
        assertThat(indexes.getIndexes()).extracting(IndexEngine.IndexDefinition::name).containsExactly("idx_status");
    }

    @Test
    void shouldNormalizeIndexKeys() {
        assertThat(StoredIndexEngine.indexKey(10)).isEqualTo("10");
        assertThat(StoredIndexEngine.indexKey(10.0)).isEqualTo("10");
        assertThat(StoredIndexEngine.indexKey(0.25)).isEqualTo("0.25");
        assertThat(StoredIndexEngine.indexKey(null)).isEqualTo("null");
        assertThat(StoredIndexEngine.indexKey(true)).isEqualTo("true");
    }

    @Test
    void shouldStoreIndexesUnderPrefixedKeys() throws IOException {
        MemoryStorageAdapter storage = new MemoryStorageAdapter();
        storage.set("patients", List.of(Map.of("id", "p1")));
        StoredIndexEngine indexes = new StoredIndexEngine(storage);

        indexes.createIndex("patients", "id", "patients", List.of(Map.of("id", "p1")));

        assertThat(storage.keys("idx_")).containsExactly("idx_patients");
        assertThat(storage.keys("patients")).containsExactly("patients");
        assertThat(indexes.lookup("patients", "p1")).containsExactly("p1");
        assertThat(StoredIndexEngine.storageKey("idx_mrn")).isEqualTo("idx_mrn");
        assertThat(StoredIndexEngine.storageKey("mrn")).isEqualTo("idx_mrn");
        assertThrows(IllegalArgumentException.class, () -> StoredIndexEngine.storageKey(" "));
    }
}

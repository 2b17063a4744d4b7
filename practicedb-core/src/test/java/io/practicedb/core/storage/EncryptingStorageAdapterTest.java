package io.practicedb.core.storage;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.crypto.SecretKey;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.core.type.TypeReference;

class EncryptingStorageAdapterTest {
    private static final TypeReference<List<Map<String, Object>>> DOCUMENTS = new TypeReference<List<Map<String, Object>>>() {
    };
    private static final TypeReference<Map<String, Object>> MAP = new TypeReference<Map<String, Object>>() {
    };

    @Test
    void shouldEncryptOnlySensitiveKeys() throws IOException {
        MemoryStorageAdapter raw = new MemoryStorageAdapter();
        EncryptingStorageAdapter storage = new EncryptingStorageAdapter(raw, EncryptingStorageAdapter.generateKey(),
                Set.of("patients"));

        storage.set("patients", List.of(Map.of("id", "p1", "name", "Ahmed")));
        storage.set("claims", List.of(Map.of("id", "c1")));

        Map<String, Object> envelope = raw.get("patients", MAP);
        assertThat(envelope).containsEntry("alg", "AES-GCM").containsKey("payload");
        assertThat(envelope.toString()).doesNotContain("Ahmed");
        assertThat(raw.get("claims", DOCUMENTS)).hasSize(1);

        assertThat(storage.get("patients", DOCUMENTS).get(0)).containsEntry("name", "Ahmed");
    }

    @Test
    void shouldReadAsAbsentWithWrongKey() throws IOException {
        MemoryStorageAdapter raw = new MemoryStorageAdapter();
        new EncryptingStorageAdapter(raw, EncryptingStorageAdapter.generateKey(), Set.of("patients"))
                .set("patients", List.of(Map.of("id", "p1")));

        EncryptingStorageAdapter other = new EncryptingStorageAdapter(raw, EncryptingStorageAdapter.generateKey(),
                Set.of("patients"));

        assertThat(other.get("patients", DOCUMENTS)).isNull();
    }

    @Test
    void shouldRestoreKeyFromBase64() throws IOException {
        SecretKey key = EncryptingStorageAdapter.generateKey();
        MemoryStorageAdapter raw = new MemoryStorageAdapter();
        new EncryptingStorageAdapter(raw, key, Set.of("patients")).set("patients", List.of(Map.of("id", "p1")));

        SecretKey restored = EncryptingStorageAdapter.keyFromBase64(EncryptingStorageAdapter.keyToBase64(key));
        EncryptingStorageAdapter reopened = new EncryptingStorageAdapter(raw, restored, Set.of("patients"));

        assertThat(reopened.get("patients", DOCUMENTS)).hasSize(1);
    }
}

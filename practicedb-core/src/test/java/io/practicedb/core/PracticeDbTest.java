package io.practicedb.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.practicedb.core.config.PracticeDbConfig;
import io.practicedb.core.event.CollectionChange;
import io.practicedb.core.storage.EncryptingStorageAdapter;
import io.practicedb.core.storage.FileStorageAdapter;
import io.practicedb.core.storage.StorageAdapter;
import io.practicedb.core.validation.IntegrityException;
import io.practicedb.core.validation.IntegrityReport;
import io.practicedb.core.validation.ValidationException;

class PracticeDbTest {

    private static Map<String, Object> patient(String mrn) {
        Map<String, Object> patient = new HashMap<>();
        patient.put("mrn", mrn);
        patient.put("name", "Layla Hassan");
        patient.put("age", 34);
        patient.put("dateOfBirth", "1990-06-01");
        patient.put("gender", "female");
        patient.put("phone", "+966500000001");
        patient.put("address", "Olaya Street, Riyadh");
        patient.put("emergencyContact", Map.of("name", "Omar Hassan", "phone", "+966500000002",
                "relationship", "Brother"));
        patient.put("bloodType", "A+");
        patient.put("allergies", List.of());
        patient.put("conditions", List.of("Asthma"));
        patient.put("medications", List.of());
        patient.put("lastVisit", "2024-02-01");
        patient.put("status", "stable");
        return patient;
    }

    @Test
    void shouldMigrateOnOpen() throws IOException {
        try (PracticeDb db = PracticeDb.open(PracticeDbConfig.defaults())) {
            assertThat(db.getMigrations().pending()).isEmpty();
            assertThat(db.getMigrations().currentVersion()).isEqualTo("1.2.0");
            assertThat(db.getEngine().getIndexes()).isNotEmpty();
            assertThat(db.patients().count()).isZero();
        }
    }

    @Test
    void shouldSeedConsistentDataWhenConfigured() throws IOException {
        try (PracticeDb db = PracticeDb.open(PracticeDbConfig.defaults().seed(true))) {
            assertThat(db.patients().count()).isEqualTo(6);
            assertThat(db.appointments().count()).isEqualTo(5);
            assertThat(db.claims().count()).isEqualTo(4);
            for (IntegrityReport report : db.getIntegrityChecker().runFullIntegrityCheck()) {
                assertThat(report.issues()).as(report.collection()).isEmpty();
            }
        }
    }

    @Test
    void shouldValidateThroughCollectionFacade() throws IOException {
        try (PracticeDb db = PracticeDb.open(PracticeDbConfig.defaults())) {
            DocumentCollection patients = db.patients();
            Map<String, Object> created = patients.createValidated(patient("MRN-9"));

            assertThat(created).containsKey(Documents.ID);
            assertThrows(IntegrityException.class, () -> patients.createValidated(patient("MRN-9")));

            Map<String, Object> invalid = patient("MRN-10");
            invalid.put("gender", "unknown");
            assertThrows(ValidationException.class, () -> patients.createValidated(invalid));
            assertThat(patients.count()).isEqualTo(1);
        }
    }

    @Test
    void shouldBlockDeletingReferencedPatient() throws IOException {
        try (PracticeDb db = PracticeDb.open(PracticeDbConfig.defaults().seed(true))) {
            IntegrityException e = assertThrows(IntegrityException.class,
                    () -> db.patients().deleteValidated("patient_1"));

            assertThat(e.getMessage()).startsWith("Cannot delete: referenced by appointments");
            assertThat(db.patients().get("patient_1")).isNotNull();
        }
    }

    @Test
    void shouldNotifyFacadeSubscribers() throws IOException {
        try (PracticeDb db = PracticeDb.open(PracticeDbConfig.defaults())) {
            List<CollectionChange> changes = new ArrayList<>();
            db.collection(PracticeCollections.NOTIFICATIONS).subscribe(changes::add);

            db.collection(PracticeCollections.NOTIFICATIONS).create(Map.of("title", "Lab results ready"));

            assertThat(changes).hasSize(1);
            assertThat(changes.get(0).snapshot()).hasSize(1);
        }
    }

    @Test
    void shouldEncryptSensitiveCollectionsWhenKeyConfigured() throws IOException {
        String key = EncryptingStorageAdapter.keyToBase64(EncryptingStorageAdapter.generateKey());
        PracticeDbConfig config = PracticeDbConfig.defaults().encryptionKey(key);

        StorageAdapter storage = PracticeDb.createStorage(config);

        assertThat(storage).isInstanceOf(EncryptingStorageAdapter.class);
        EncryptingStorageAdapter encrypting = (EncryptingStorageAdapter) storage;
        assertThat(encrypting.isSensitive(PracticeCollections.PATIENTS)).isTrue();
        assertThat(encrypting.isSensitive(PracticeCollections.APPOINTMENTS)).isFalse();
    }

    @Test
    void shouldPersistAcrossReopenWithFileStorage(@TempDir Path dir) throws IOException {
        PracticeDbConfig config = PracticeDbConfig.defaults()
                .storageType(PracticeDbConfig.StorageType.FILE)
                .dataDirectory(dir.toString())
                .namespace("clinic");
        String id;
        try (PracticeDb db = PracticeDb.open(config)) {
            assertThat(db.getEngine().getStorage()).isInstanceOf(FileStorageAdapter.class);
            id = (String) db.patients().createValidated(patient("MRN-1")).get(Documents.ID);
        }

        try (PracticeDb db = PracticeDb.open(config)) {
            assertThat(db.patients().get(id)).containsEntry("mrn", "MRN-1");
            assertThat(db.getMigrations().pending()).isEmpty();
        }
        assertThat(Files.isDirectory(dir.resolve("clinic"))).isTrue();
    }
}

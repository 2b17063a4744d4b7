package io.practicedb.core.migration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.practicedb.core.DatabaseEngine;
import io.practicedb.core.index.IndexEngine;
import io.practicedb.core.storage.MemoryStorageAdapter;

class MigrationRunnerTest {

    private DatabaseEngine engine;

    @BeforeEach
    void setUp() {
        engine = new DatabaseEngine(new MemoryStorageAdapter());
    }

    @Test
    void shouldApplyAllMigrationsOnce() throws IOException {
        MigrationRunner runner = new MigrationRunner(engine);

        List<String> applied = runner.runMigrations();

        assertThat(applied).containsExactly("1.0.0: initial_schema", "1.1.0: add_patient_national_id_index",
                "1.2.0: add_lookup_indexes");
        assertThat(runner.currentVersion()).isEqualTo("1.2.0");
        assertThat(engine.getMetadata().version()).isEqualTo("1.2.0");
        assertThat(engine.getIndexes()).extracting(IndexEngine.IndexDefinition::name).containsExactlyInAnyOrder(
                PracticeMigrations.INDEX_PATIENT_MRN, PracticeMigrations.INDEX_APPOINTMENT_DATE,
                PracticeMigrations.INDEX_CLAIM_STATUS, PracticeMigrations.INDEX_PATIENT_NATIONAL_ID,
                PracticeMigrations.INDEX_APPOINTMENT_PATIENT, PracticeMigrations.INDEX_CLAIM_NUMBER);

        assertThat(runner.runMigrations()).isEmpty();
        assertThat(runner.pending()).isEmpty();
    }

    @Test
    void shouldApplyOnlyNewerMigrationsInVersionOrder() throws IOException {
        engine.recordMigration("1.0.0");
        MigrationRunner runner = new MigrationRunner(engine, List.of(
                new Migration("1.10.0", "later", e -> e.create("log", Map.of("id", "1.10.0")), e -> {
                }),
                new Migration("1.2.0", "earlier", e -> e.create("log", Map.of("id", "1.2.0")), e -> {
                }),
                new Migration("0.9.0", "old", e -> e.create("log", Map.of("id", "0.9.0")), e -> {
                })));

        assertThat(runner.runMigrations()).containsExactly("1.2.0: earlier", "1.10.0: later");
        assertThat(engine.getAll("log")).extracting(d -> d.get("id")).containsExactly("1.2.0", "1.10.0");
    }

    @Test
    void shouldStopAtFailureAndKeepEarlierVersions() throws IOException {
        MigrationRunner runner = new MigrationRunner(engine, List.of(
                new Migration("1.0.0", "ok", e -> e.createIndex("patients", "mrn", "idx_mrn"), e -> {
                }),
                new Migration("1.1.0", "broken", e -> {
                    throw new IOException("disk full");
                }, e -> {
                }),
                new Migration("1.2.0", "never", e -> e.createIndex("claims", "status", "idx_status"), e -> {
                })));

        MigrationException e = assertThrows(MigrationException.class, runner::runMigrations);

        assertThat(e.getMessage()).contains("1.1.0: broken").contains("disk full");
        assertThat(runner.currentVersion()).isEqualTo("1.0.0");
        assertThat(engine.getIndexes()).extracting(IndexEngine.IndexDefinition::name).containsExactly("idx_mrn");
    }

    @Test
    void shouldRollBackToTargetVersion() throws IOException {
        MigrationRunner runner = new MigrationRunner(engine);
        runner.runMigrations();

        List<String> rolledBack = runner.rollback("1.0.0");

        assertThat(rolledBack).containsExactly("1.2.0: add_lookup_indexes", "1.1.0: add_patient_national_id_index");
        assertThat(runner.currentVersion()).isEqualTo("1.0.0");
        assertThat(engine.getIndexes()).hasSize(3);
        assertThat(runner.pending()).hasSize(2);
    }

    @Test
    void shouldCompareVersionsNumerically() {
        assertThat(SemanticVersion.compare("1.10.0", "1.9.0")).isPositive();
        assertThat(SemanticVersion.compare("1.1", "1.1.0")).isZero();
        assertThat(SemanticVersion.compare("0.0.0", "1.0.0")).isNegative();
    }
}

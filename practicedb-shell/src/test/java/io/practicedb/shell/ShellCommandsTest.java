package io.practicedb.shell;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.practicedb.core.PracticeDb;
import io.practicedb.core.config.PracticeDbConfig;

class ShellCommandsTest {

    private PracticeDb db;
    private StringWriter buffer;
    private ShellCommands commands;

    @BeforeEach
    void setUp() throws IOException {
        db = PracticeDb.open(PracticeDbConfig.defaults().seed(true));
        buffer = new StringWriter();
        commands = new ShellCommands(db, new PrintWriter(buffer, true));
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private String run(String line) {
        buffer.getBuffer().setLength(0);
        commands.execute(line);
        return buffer.toString();
    }

    @Test
    void shouldExitOnQuit() {
        assertThat(commands.execute("exit")).isFalse();
        assertThat(commands.execute("QUIT")).isFalse();
        assertThat(commands.execute("   ")).isTrue();
    }

    @Test
    void shouldListCollectionsWithCounts() {
        String output = run("collections");

        assertThat(output).contains("patients (6)").contains("appointments (5)");
        assertThat(output).doesNotContain("idx_").doesNotContain("_metadata");
    }

    @Test
    void shouldGetAndFindDocuments() {
        assertThat(run("get patients patient_1")).contains("\"mrn\" : \"MRN-2024-001\"");
        assertThat(run("get patients nobody")).contains("Not found: nobody");
        assertThat(run("find patients {\"gender\":\"male\"}")).startsWith("Results (");
        assertThat(run("count claims")).isEqualTo("4" + System.lineSeparator());
    }

    @Test
    void shouldInsertUpdateAndDeleteThroughValidation() {
        String inserted = run("insert notes {\"title\":\"Reminder\"}");
        assertThat(inserted).startsWith("Inserted ID: ");
        String id = inserted.substring("Inserted ID: ".length()).trim();

        assertThat(run("update notes " + id + " {\"title\":\"Updated\"}")).contains("Updated " + id);
        assertThat(run("delete notes " + id)).contains("Deleted.");
        assertThat(run("delete notes " + id)).contains("Not found: " + id);
    }

    @Test
    void shouldReportIntegrityErrorsInsteadOfThrowing() {
        String output = run("delete patients patient_1");

        assertThat(output).startsWith("Error: Cannot delete: referenced by appointments");
        assertThat(run("insert patients {\"name\":\"X\"}")).startsWith("Error: ");
    }

    @Test
    void shouldReportUnknownCommandsAndUsage() {
        assertThat(run("frobnicate")).contains("Unknown command: frobnicate");
        assertThat(run("get patients")).contains("Usage: get <col> <id>");
        assertThat(run("index bogus")).contains("Usage: index list | create | drop | find");
    }

    @Test
    void shouldManageIndexes() {
        assertThat(run("index create patients bloodType idx_blood")).contains("Index created: idx_blood");
        assertThat(run("index list")).contains("idx_blood on patients.bloodType");
        assertThat(run("index find patients idx_blood \"O+\"")).startsWith("Results (");
        assertThat(run("index drop idx_blood")).contains("Index dropped: idx_blood");
        assertThat(run("index list")).doesNotContain("idx_blood");
    }

    @Test
    void shouldAggregateByGroup() {
        String output = run("aggregate claims status amount");

        assertThat(output).contains("count=").contains("sum=");
    }

    @Test
    void shouldExportAndImportThroughFiles(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("backup.json");
        assertThat(run("export " + file)).contains("Exported to " + file);
        assertThat(Files.readString(file)).contains("patient_1");

        assertThat(run("delete appointments apt_1")).contains("Deleted.");
        assertThat(run("import " + file + " merge")).contains("(merged)");
        assertThat(run("get appointments apt_1")).contains("\"patientId\" : \"patient_1\"");
    }

    @Test
    void shouldReportMigrationsAndSeedState() {
        assertThat(run("migrate")).contains("Up to date at 1.2.0");
        assertThat(run("seed")).contains("Database already has data");
        assertThat(run("integrity patients")).contains("patients: 6 records, 0 issues");
    }

    @Test
    void shouldTrackTransactionLifecycle() {
        assertThat(run("commit")).contains("No active transaction.");
        assertThat(run("begin")).startsWith("Transaction started: ");
        assertThat(commands.getCurrentTransaction()).isNotNull();
        assertThat(run("begin")).contains("Transaction already active");
        assertThat(run("abort")).contains("Transaction rolled back.");
        assertThat(commands.getCurrentTransaction()).isNull();
    }

    @Test
    void shouldShowPendingSyncChangesAndFailWithoutEndpoint() {
        run("insert notes {\"title\":\"Reminder\"}");

        assertThat(run("sync status")).contains("Pending changes: ").contains("create notes/");
        assertThat(run("sync")).contains("Error: Sync endpoint not configured");
    }
}

package io.practicedb.shell;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.practicedb.core.DatabaseEngine;
import io.practicedb.core.PracticeDb;
import io.practicedb.core.PracticeDbException;
import io.practicedb.core.index.IndexEngine;
import io.practicedb.core.query.AggregateResult;
import io.practicedb.core.query.AggregateSpec;
import io.practicedb.core.query.QueryOptions;
import io.practicedb.core.query.QueryResult;
import io.practicedb.core.sync.SyncLogEntry;
import io.practicedb.core.sync.SyncResult;
import io.practicedb.core.validation.IntegrityIssue;
import io.practicedb.core.validation.IntegrityReport;

/**
 * Interprets one shell line at a time against an open {@link PracticeDb}.
 */
public class ShellCommands {
    private static final TypeReference<Map<String, Object>> DOCUMENT = new TypeReference<Map<String, Object>>() {
    };

    static final List<String> COMMANDS = List.of("help", "collections", "get", "find", "count", "insert",
            "update", "delete", "index", "aggregate", "export", "import", "migrate", "rollback", "seed",
            "integrity", "stats", "sync", "begin", "commit", "abort", "exit", "quit");

    private final PracticeDb db;
    private final DatabaseEngine engine;
    private final PrintWriter out;
    private final ObjectMapper mapper = new ObjectMapper();
    private String currentTx;

    public ShellCommands(PracticeDb db, PrintWriter out) {
        this.db = db;
        this.engine = db.getEngine();
        this.out = out;
    }

    public String getCurrentTransaction() {
        return currentTx;
    }

    /**
     * @return false when the line asks the shell to exit
     */
    public boolean execute(String line) {
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return true;
        }
        String[] head = trimmed.split("\\s+", 2);
        String cmd = head[0].toLowerCase();
        String args = head.length > 1 ? head[1] : "";

        try {
            switch (cmd) {
                case "exit":
                case "quit":
                    return false;
                case "help": printHelp(); break;
                case "collections": handleCollections(); break;
                case "get": handleGet(args); break;
                case "find": handleFind(args); break;
                case "count": handleCount(args); break;
                case "insert": handleInsert(args); break;
                case "update": handleUpdate(args); break;
                case "delete": handleDelete(args); break;
                case "index": handleIndex(args); break;
                case "aggregate": handleAggregate(args); break;
                case "export": handleExport(args); break;
                case "import": handleImport(args); break;
                case "migrate": handleMigrate(); break;
                case "rollback": handleRollback(args); break;
                case "seed": handleSeed(args); break;
                case "integrity": handleIntegrity(args); break;
                case "stats": handleStats(); break;
                case "sync": handleSync(args); break;
                case "begin": handleBegin(); break;
                case "commit": handleCommit(); break;
                case "abort": handleAbort(); break;
                default: out.println("Unknown command: " + cmd);
            }
        } catch (PracticeDbException | IOException | IllegalArgumentException e) {
            out.println("Error: " + e.getMessage());
        }
        out.flush();
        return true;
    }

    private void handleCollections() throws IOException {
        for (String collection : engine.listCollections()) {
            out.println("  " + collection + " (" + engine.count(collection) + ")");
        }
    }

    private void handleGet(String args) throws IOException {
        String[] parts = split(args, 2);
        if (parts.length < 2) { out.println("Usage: get <col> <id>"); return; }
        Map<String, Object> document = engine.get(parts[0], parts[1]);
        if (document == null) {
            out.println("Not found: " + parts[1]);
        } else {
            out.println(pretty(document));
        }
    }

    private void handleFind(String args) throws IOException {
        String[] parts = split(args, 2);
        if (parts.length < 1) { out.println("Usage: find <col> [json-filter]"); return; }
        QueryOptions options = QueryOptions.all();
        if (parts.length > 1) {
            options.where(mapper.readValue(parts[1], DOCUMENT));
        }
        QueryResult result = engine.query(parts[0], options);
        out.println("Results (" + result.data().size() + " of " + result.total() + "):");
        for (Map<String, Object> document : result.data()) {
            out.println(pretty(document));
        }
    }

    private void handleCount(String args) throws IOException {
        String[] parts = split(args, 2);
        if (parts.length < 1) { out.println("Usage: count <col>"); return; }
        out.println(engine.count(parts[0]));
    }

    private void handleInsert(String args) throws IOException {
        String[] parts = split(args, 2);
        if (parts.length < 2) { out.println("Usage: insert <col> <json>"); return; }
        Map<String, Object> created = db.collection(parts[0]).createValidated(mapper.readValue(parts[1], DOCUMENT));
        out.println("Inserted ID: " + created.get("id"));
    }

    private void handleUpdate(String args) throws IOException {
        String[] parts = split(args, 3);
        if (parts.length < 3) { out.println("Usage: update <col> <id> <json>"); return; }
        Map<String, Object> updated = db.collection(parts[0]).updateValidated(parts[1],
                mapper.readValue(parts[2], DOCUMENT));
        out.println(updated == null ? "Not found: " + parts[1] : "Updated " + parts[1]);
    }

    private void handleDelete(String args) throws IOException {
        String[] parts = split(args, 2);
        if (parts.length < 2) { out.println("Usage: delete <col> <id>"); return; }
        boolean deleted = db.collection(parts[0]).deleteValidated(parts[1]);
        out.println(deleted ? "Deleted." : "Not found: " + parts[1]);
    }

    private void handleIndex(String args) throws IOException {
        String[] parts = split(args, 5);
        String action = parts.length > 0 ? parts[0].toLowerCase() : "list";
        switch (action) {
            case "list":
                for (IndexEngine.IndexDefinition index : engine.getIndexes()) {
                    out.println("  " + index.name() + " on " + index.collection() + "." + index.field());
                }
                break;
            case "create":
                if (parts.length < 4) { out.println("Usage: index create <col> <field> <name>"); return; }
                engine.createIndex(parts[1], parts[2], parts[3]);
                out.println("Index created: " + parts[3]);
                break;
            case "drop":
                if (parts.length < 2) { out.println("Usage: index drop <name>"); return; }
                engine.dropIndex(parts[1]);
                out.println("Index dropped: " + parts[1]);
                break;
            case "find":
                if (parts.length < 4) { out.println("Usage: index find <col> <name> <value>"); return; }
                List<Map<String, Object>> found = engine.findByIndex(parts[1], parts[2], parseValue(parts[3]));
                out.println("Results (" + found.size() + "):");
                for (Map<String, Object> document : found) {
                    out.println(pretty(document));
                }
                break;
            default:
                out.println("Usage: index list | create | drop | find");
        }
    }

    private void handleAggregate(String args) throws IOException {
        String[] parts = split(args, 3);
        if (parts.length < 2) { out.println("Usage: aggregate <col> <groupBy> [sumField]"); return; }
        AggregateSpec spec = AggregateSpec.create().count();
        if (parts.length > 2) {
            spec.sum(parts[2]).avg(parts[2]);
        }
        for (AggregateResult result : engine.aggregate(parts[0], parts[1], spec)) {
            StringBuilder row = new StringBuilder("  ").append(result.group()).append(": count=").append(result.count());
            if (result.sum() != null) {
                row.append(", sum=").append(result.sum()).append(", avg=").append(result.avg());
            }
            out.println(row);
        }
    }

    private void handleExport(String args) throws IOException {
        String json = engine.exportJson();
        if (args.isBlank()) {
            out.println(json);
            return;
        }
        Path target = Path.of(args.trim());
        Files.writeString(target, json, StandardCharsets.UTF_8);
        out.println("Exported to " + target);
    }

    private void handleImport(String args) throws IOException {
        String[] parts = split(args, 2);
        if (parts.length < 1) { out.println("Usage: import <file> [merge]"); return; }
        boolean merge = parts.length > 1 && "merge".equalsIgnoreCase(parts[1]);
        engine.importJson(Files.readString(Path.of(parts[0]), StandardCharsets.UTF_8), merge);
        out.println("Imported " + parts[0] + (merge ? " (merged)" : ""));
    }

    private void handleMigrate() throws IOException {
        List<String> applied = db.getMigrations().runMigrations();
        out.println(applied.isEmpty() ? "Up to date at " + db.getMigrations().currentVersion()
                : "Applied: " + String.join(", ", applied));
    }

    private void handleRollback(String args) throws IOException {
        if (args.isBlank()) { out.println("Usage: rollback <version>"); return; }
        List<String> reverted = db.getMigrations().rollback(args.trim());
        out.println(reverted.isEmpty() ? "Nothing to roll back" : "Rolled back: " + String.join(", ", reverted));
    }

    private void handleSeed(String args) throws IOException {
        boolean force = "force".equalsIgnoreCase(args.trim());
        Map<String, Integer> seeded = db.getSeeder().seed(force);
        out.println(seeded.isEmpty() ? "Database already has data; use 'seed force'" : "Seeded: " + seeded);
    }

    private void handleIntegrity(String args) throws IOException {
        List<IntegrityReport> reports = args.isBlank()
                ? db.getIntegrityChecker().runFullIntegrityCheck()
                : List.of(db.getIntegrityChecker().runIntegrityCheck(args.trim()));
        for (IntegrityReport report : reports) {
            out.println(report.collection() + ": " + report.totalRecords() + " records, "
                    + report.issues().size() + " issues");
            for (IntegrityIssue issue : report.issues()) {
                out.println("  [" + issue.type() + "] " + issue.documentId() + " " + issue.message());
            }
        }
    }

    private void handleStats() throws IOException {
        out.println(pretty(engine.updateStatistics()));
    }

    private void handleSync(String args) throws IOException {
        if ("status".equalsIgnoreCase(args.trim())) {
            List<SyncLogEntry> pending = engine.getPendingSyncs();
            out.println("Pending changes: " + pending.size());
            for (SyncLogEntry entry : pending) {
                out.println("  " + entry.action().getWireName() + " " + entry.collection() + "/" + entry.documentId()
                        + (entry.error() != null ? " (" + entry.error() + ")" : ""));
            }
            return;
        }
        SyncResult result = db.getSyncManager().sync();
        out.println("Pushed " + result.pushed() + ", pulled " + result.pulled() + ", conflicts "
                + result.conflicts() + ", skipped " + result.skipped());
    }

    private void handleBegin() {
        if (currentTx != null) { out.println("Transaction already active: " + currentTx); return; }
        currentTx = engine.beginTransaction();
        out.println("Transaction started: " + currentTx);
    }

    private void handleCommit() {
        if (currentTx == null) { out.println("No active transaction."); return; }
        engine.commitTransaction(currentTx);
        out.println("Transaction committed.");
        currentTx = null;
    }

    private void handleAbort() throws IOException {
        if (currentTx == null) { out.println("No active transaction."); return; }
        engine.rollbackTransaction(currentTx);
        out.println("Transaction rolled back.");
        currentTx = null;
    }

    private void printHelp() {
        out.println("Commands:");
        out.println("  collections                        List collections with counts");
        out.println("  get <col> <id>                     Show one document");
        out.println("  find <col> [json]                  Query, optionally by field equality");
        out.println("  count <col>                        Count documents");
        out.println("  insert <col> <json>                Validated insert");
        out.println("  update <col> <id> <json>           Validated partial update");
        out.println("  delete <col> <id>                  Validated delete (applies cascades)");
        out.println("  index list|create|drop|find ...    Manage and query indexes");
        out.println("  aggregate <col> <groupBy> [field]  Count per group, optional sum/avg");
        out.println("  export [file]                      Export database as JSON");
        out.println("  import <file> [merge]              Import an export bundle");
        out.println("  migrate                            Apply pending migrations");
        out.println("  rollback <version>                 Revert migrations above version");
        out.println("  seed [force]                       Load sample data");
        out.println("  integrity [col]                    Report orphans and duplicates");
        out.println("  stats                              Recompute and show metadata");
        out.println("  sync [status]                      Run a sync pass or list pending changes");
        out.println("  begin | commit | abort             Transaction control");
        out.println("  exit / quit                        Exit shell");
    }

    private Object parseValue(String raw) {
        try {
            return mapper.readValue(raw, Object.class);
        } catch (JsonProcessingException e) {
            return raw;
        }
    }

    private String pretty(Object value) throws JsonProcessingException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
    }

    private static String[] split(String args, int limit) {
        if (args.isBlank()) {
            return new String[0];
        }
        return args.trim().split("\\s+", limit);
    }
}

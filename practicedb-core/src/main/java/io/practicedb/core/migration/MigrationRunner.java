package io.practicedb.core.migration;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.practicedb.core.DatabaseEngine;

/**
 * Applies versioned migrations in order, recording the last applied version in the metadata
 * document after every step.
 */
public class MigrationRunner {
    private static final Logger LOGGER = Logger.getLogger(MigrationRunner.class.getName());

    public static final String BASE_VERSION = "0.0.0";

    private final DatabaseEngine engine;
    private final List<Migration> migrations;

    public MigrationRunner(DatabaseEngine engine) {
        this(engine, PracticeMigrations.all());
    }

    public MigrationRunner(DatabaseEngine engine, List<Migration> migrations) {
        this.engine = engine;
        List<Migration> sorted = new ArrayList<>(migrations);
        sorted.sort((a, b) -> SemanticVersion.compare(a.version(), b.version()));
        this.migrations = Collections.unmodifiableList(sorted);
    }

    /**
     * Applies every migration newer than the recorded one. A failure stops the run; versions
     * applied before it stay recorded.
     *
     * @return labels of the applied migrations
     * @throws MigrationException wrapping the failure of a migration
     */
    public List<String> runMigrations() throws IOException {
        String lastVersion = currentVersion();
        List<String> applied = new ArrayList<>();
        for (Migration migration : migrations) {
            if (SemanticVersion.compare(migration.version(), lastVersion) <= 0) {
                continue;
            }
            run(migration, migration.up(), "apply");
            engine.recordMigration(migration.version());
            applied.add(migration.label());
            LOGGER.info(() -> "Applied migration " + migration.label());
        }
        return applied;
    }

    /**
     * Runs {@code down} for migrations newer than {@code targetVersion} up to the current one,
     * newest first, then records {@code targetVersion}.
     *
     * @return labels of the rolled back migrations
     */
    public List<String> rollback(String targetVersion) throws IOException {
        String current = currentVersion();
        List<Migration> toRollback = new ArrayList<>();
        for (Migration migration : migrations) {
            if (SemanticVersion.compare(migration.version(), targetVersion) > 0
                    && SemanticVersion.compare(migration.version(), current) <= 0) {
                toRollback.add(migration);
            }
        }
        Collections.reverse(toRollback);

        List<String> rolledBack = new ArrayList<>();
        for (Migration migration : toRollback) {
            run(migration, migration.down(), "roll back");
            rolledBack.add(migration.label());
            LOGGER.info(() -> "Rolled back migration " + migration.label());
        }
        engine.recordMigration(targetVersion);
        return rolledBack;
    }

    public String currentVersion() throws IOException {
        String last = engine.getMetadata().lastMigration();
        return last == null ? BASE_VERSION : last;
    }

    /**
     * Migrations newer than the recorded version.
     */
    public List<Migration> pending() throws IOException {
        String current = currentVersion();
        List<Migration> result = new ArrayList<>();
        for (Migration migration : migrations) {
            if (SemanticVersion.compare(migration.version(), current) > 0) {
                result.add(migration);
            }
        }
        return result;
    }

    public List<Migration> getMigrations() {
        return migrations;
    }

    private void run(Migration migration, MigrationStep step, String verb) {
        try {
            step.apply(engine);
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Failed to " + verb + " migration " + migration.label(), e);
            throw new MigrationException(migration.version(), "Failed to " + verb + " migration "
                    + migration.label() + ": " + e.getMessage(), e);
        }
    }
}

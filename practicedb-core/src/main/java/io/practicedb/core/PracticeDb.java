package io.practicedb.core;

import java.io.IOException;
import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import io.practicedb.core.config.PracticeDbConfig;
import io.practicedb.core.migration.MigrationRunner;
import io.practicedb.core.schema.SchemaRegistry;
import io.practicedb.core.seed.DatabaseSeeder;
import io.practicedb.core.storage.EncryptingStorageAdapter;
import io.practicedb.core.storage.FileStorageAdapter;
import io.practicedb.core.storage.MemoryStorageAdapter;
import io.practicedb.core.storage.StorageAdapter;
import io.practicedb.core.storage.StorageKeys;
import io.practicedb.core.sync.SyncManager;
import io.practicedb.core.validation.IntegrityChecker;
import io.practicedb.core.validation.IntegrityRules;
import io.practicedb.core.validation.ValidationManager;

/**
 * Wires storage, engine, validation, migrations, seeding and sync from a {@link PracticeDbConfig}.
 */
public class PracticeDb implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(PracticeDb.class.getName());

    private final PracticeDbConfig config;
    private final DatabaseEngine engine;
    private final SchemaRegistry schemas;
    private final ValidationManager validator;
    private final IntegrityChecker integrityChecker;
    private final MigrationRunner migrations;
    private final DatabaseSeeder seeder;
    private final SyncManager syncManager;

    PracticeDb(PracticeDbConfig config, DatabaseEngine engine, SyncManager syncManager) {
        this.config = config;
        this.engine = engine;
        this.schemas = SchemaRegistry.withDefaults();
        IntegrityRules rules = IntegrityRules.defaults();
        this.validator = new ValidationManager(engine, schemas, rules);
        this.integrityChecker = new IntegrityChecker(engine, rules);
        this.migrations = new MigrationRunner(engine);
        this.seeder = new DatabaseSeeder(engine);
        this.syncManager = syncManager != null ? syncManager : new SyncManager(engine, config.getSync());
    }

    /**
     * Opens the database, applies pending migrations and optionally seeds it and starts sync.
     *
     * @throws io.practicedb.core.migration.MigrationException if a migration fails
     */
    public static PracticeDb open(PracticeDbConfig config) throws IOException {
        DatabaseEngine engine = new DatabaseEngine(createStorage(config), Clock.systemUTC(),
                config.getCacheTtl(), config.getSyncLogCapacity());
        PracticeDb db = new PracticeDb(config, engine, null);
        db.bootstrap();
        return db;
    }

    static StorageAdapter createStorage(PracticeDbConfig config) throws IOException {
        StorageAdapter storage;
        switch (config.getStorageType()) {
            case FILE:
                storage = new FileStorageAdapter(config.getDataDirectory(), config.getNamespace());
                break;
            case MEMORY:
            default:
                storage = new MemoryStorageAdapter();
                break;
        }
        if (config.getEncryptionKey() != null) {
            Set<String> sensitive = new HashSet<>(PracticeCollections.SENSITIVE);
            sensitive.add(StorageKeys.SYNC_LOG);
            storage = new EncryptingStorageAdapter(storage,
                    EncryptingStorageAdapter.keyFromBase64(config.getEncryptionKey()), sensitive);
        }
        LOGGER.info(() -> "Storage: " + config.getStorageType()
                + (config.getEncryptionKey() != null ? " (encrypted)" : ""));
        return storage;
    }

    void bootstrap() throws IOException {
        if (config.isMigrate()) {
            List<String> applied = migrations.runMigrations();
            if (!applied.isEmpty()) {
                LOGGER.info(() -> "Applied migrations: " + applied);
            }
        }
        if (config.isSeed()) {
            Map<String, Integer> seeded = seeder.seed(false);
            if (!seeded.isEmpty()) {
                LOGGER.info(() -> "Seeded: " + seeded);
            }
        }
        if (syncManager.getConfig().isEnabled()) {
            syncManager.start();
        }
    }

    public DocumentCollection collection(String name) {
        return new DocumentCollection(name, engine, validator);
    }

    public DocumentCollection patients() {
        return collection(PracticeCollections.PATIENTS);
    }

    public DocumentCollection appointments() {
        return collection(PracticeCollections.APPOINTMENTS);
    }

    public DocumentCollection claims() {
        return collection(PracticeCollections.CLAIMS);
    }

    public DatabaseEngine getEngine() {
        return engine;
    }

    public SchemaRegistry getSchemas() {
        return schemas;
    }

    public ValidationManager getValidator() {
        return validator;
    }

    public IntegrityChecker getIntegrityChecker() {
        return integrityChecker;
    }

    public MigrationRunner getMigrations() {
        return migrations;
    }

    public DatabaseSeeder getSeeder() {
        return seeder;
    }

    public SyncManager getSyncManager() {
        return syncManager;
    }

    public PracticeDbConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        syncManager.close();
        LOGGER.info("PracticeDb closed");
    }
}

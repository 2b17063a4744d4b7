package io.practicedb.core.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import io.helidon.config.Config;
import io.helidon.config.ConfigSources;
import io.practicedb.core.PracticeCollections;
import io.practicedb.core.cache.DocumentCache;
import io.practicedb.core.sync.ConflictResolution;
import io.practicedb.core.sync.SyncConfig;
import io.practicedb.core.sync.SyncLog;

/**
 * Settings for {@code PracticeDb.open}. Loaded from {@code practicedb.properties} on the classpath,
 * optionally overridden by an external file, with system properties taking precedence over both.
 */
public class PracticeDbConfig {
    private static final Logger LOGGER = Logger.getLogger(PracticeDbConfig.class.getName());

    public static final String RESOURCE = "practicedb.properties";

    public enum StorageType {
        MEMORY, FILE
    }

    private StorageType storageType = StorageType.MEMORY;
    private String dataDirectory = "data";
    private String namespace = "practicedb";
    private String encryptionKey;
    private Duration cacheTtl = DocumentCache.DEFAULT_TTL;
    private int syncLogCapacity = SyncLog.DEFAULT_CAPACITY;
    private boolean migrate = true;
    private boolean seed = false;
    private SyncConfig sync = SyncConfig.disabled();

    public static PracticeDbConfig defaults() {
        return new PracticeDbConfig();
    }

    public static PracticeDbConfig load() {
        return load(null);
    }

    /**
     * @param externalFile optional properties file layered over the classpath defaults; may be null
     */
    public static PracticeDbConfig load(Path externalFile) {
        Config.Builder builder = Config.builder().disableEnvironmentVariablesSource();
        if (externalFile != null) {
            builder.addSource(ConfigSources.file(externalFile).optional().build());
        }
        builder.addSource(ConfigSources.classpath(RESOURCE).optional().build());
        return from(builder.build());
    }

    public static PracticeDbConfig from(Config config) {
        PracticeDbConfig result = new PracticeDbConfig();
        result.storageType = StorageType.valueOf(config.get("storage.type").asString().orElse("memory")
                .trim().toUpperCase());
        result.dataDirectory = config.get("storage.data-dir").asString().orElse(result.dataDirectory);
        result.namespace = config.get("storage.namespace").asString().orElse(result.namespace);
        result.encryptionKey = config.get("storage.encryption-key").asString().asOptional()
                .filter(key -> !key.isBlank()).orElse(null);
        result.cacheTtl = Duration.ofMillis(config.get("cache.ttl-ms").asLong().orElse(result.cacheTtl.toMillis()));
        result.syncLogCapacity = config.get("sync-log.capacity").asInt().orElse(result.syncLogCapacity);
        result.migrate = config.get("bootstrap.migrate").asBoolean().orElse(result.migrate);
        result.seed = config.get("bootstrap.seed").asBoolean().orElse(result.seed);

        List<String> collections = new ArrayList<>();
        for (String name : config.get("sync.collections").asString().orElse("").split(",")) {
            if (!name.isBlank()) {
                collections.add(name.trim());
            }
        }
        result.sync = SyncConfig.builder()
                .enabled(config.get("sync.enabled").asBoolean().orElse(false))
                .endpoint(config.get("sync.endpoint").asString().asOptional().filter(url -> !url.isBlank()).orElse(null))
                .apiKey(config.get("sync.api-key").asString().asOptional().filter(key -> !key.isBlank()).orElse(null))
                .syncInterval(Duration.ofMillis(config.get("sync.interval-ms").asLong()
                        .orElse(SyncConfig.DEFAULT_INTERVAL.toMillis())))
                .collections(collections.isEmpty() ? PracticeCollections.ALL : collections)
                .conflictResolution(ConflictResolution.fromConfigName(config.get("sync.conflict-resolution")
                        .asString().orElse(ConflictResolution.NEWEST_WINS.getConfigName())))
                .requestTimeout(Duration.ofMillis(config.get("sync.timeout-ms").asLong()
                        .orElse(SyncConfig.DEFAULT_TIMEOUT.toMillis())))
                .build();
        LOGGER.fine(() -> "Loaded configuration: storage=" + result.storageType + ", sync=" + result.sync.isEnabled());
        return result;
    }

    public StorageType getStorageType() {
        return storageType;
    }

    public PracticeDbConfig storageType(StorageType storageType) {
        this.storageType = storageType;
        return this;
    }

    public String getDataDirectory() {
        return dataDirectory;
    }

    public PracticeDbConfig dataDirectory(String dataDirectory) {
        this.dataDirectory = dataDirectory;
        return this;
    }

    public String getNamespace() {
        return namespace;
    }

    public PracticeDbConfig namespace(String namespace) {
        this.namespace = namespace;
        return this;
    }

    /**
     * Base64 AES key; null keeps values in plain form.
     */
    public String getEncryptionKey() {
        return encryptionKey;
    }

    public PracticeDbConfig encryptionKey(String encryptionKey) {
        this.encryptionKey = encryptionKey;
        return this;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public PracticeDbConfig cacheTtl(Duration cacheTtl) {
        this.cacheTtl = cacheTtl;
        return this;
    }

    public int getSyncLogCapacity() {
        return syncLogCapacity;
    }

    public PracticeDbConfig syncLogCapacity(int syncLogCapacity) {
        this.syncLogCapacity = syncLogCapacity;
        return this;
    }

    public boolean isMigrate() {
        return migrate;
    }

    public PracticeDbConfig migrate(boolean migrate) {
        this.migrate = migrate;
        return this;
    }

    public boolean isSeed() {
        return seed;
    }

    public PracticeDbConfig seed(boolean seed) {
        this.seed = seed;
        return this;
    }

    public SyncConfig getSync() {
        return sync;
    }

    public PracticeDbConfig sync(SyncConfig sync) {
        this.sync = sync;
        return this;
    }
}

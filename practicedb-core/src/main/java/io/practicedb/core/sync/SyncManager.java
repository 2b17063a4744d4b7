package io.practicedb.core.sync;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

import io.practicedb.core.DatabaseEngine;
import io.practicedb.core.Documents;

/**
 * Best-effort two-way sync: pushes pending sync-log rows, then pulls each configured collection's
 * changes feed. Failures are isolated per entry and per collection and retried on the next pass.
 */
public class SyncManager implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(SyncManager.class.getName());

    private final DatabaseEngine engine;
    private final SyncConfig config;
    private final SyncTransport transport;
    private final ReentrantLock passLock = new ReentrantLock();
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> task;

    public SyncManager(DatabaseEngine engine, SyncConfig config) {
        this(engine, config, config.hasEndpoint() ? new HttpSyncTransport(config) : null);
    }

    public SyncManager(DatabaseEngine engine, SyncConfig config, SyncTransport transport) {
        this.engine = engine;
        this.config = config;
        this.transport = transport;
    }

    /**
     * Schedules periodic sync. Does nothing when sync is disabled, no endpoint is configured, or it
     * is already running.
     */
    public synchronized void start() {
        if (!config.isEnabled() || !config.hasEndpoint() || transport == null) {
            LOGGER.info("Sync disabled or no endpoint configured");
            return;
        }
        if (task != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "PracticeDb-Sync");
            t.setDaemon(true);
            return t;
        });
        long interval = config.getSyncInterval().toMillis();
        task = scheduler.scheduleWithFixedDelay(this::syncQuietly, interval, interval, TimeUnit.MILLISECONDS);
        LOGGER.info(() -> "Started auto-sync every " + interval + " ms against " + config.getEndpoint());
    }

    public synchronized void stop() {
        if (task == null) {
            return;
        }
        task.cancel(false);
        scheduler.shutdown();
        task = null;
        scheduler = null;
        LOGGER.info("Stopped auto-sync");
    }

    public synchronized boolean isRunning() {
        return task != null;
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Runs one push and pull pass. Passes never overlap: a call made while another pass is running
     * waits for it to finish.
     *
     * @throws SyncException when no endpoint is configured
     */
    public SyncResult sync() throws IOException {
        if (!config.hasEndpoint() || transport == null) {
            throw new SyncException("Sync endpoint not configured");
        }
        passLock.lock();
        try {
            return runPass();
        } finally {
            passLock.unlock();
        }
    }

    private SyncResult runPass() throws IOException {
        int pushed = 0;
        int conflicts = 0;
        for (SyncLogEntry entry : engine.getPendingSyncs()) {
            try {
                Map<String, Object> document = engine.get(entry.collection(), entry.documentId());
                transport.push(entry.collection(),
                        new SyncChange(entry.action(), entry.documentId(), document, entry.timestamp()));
                engine.markAsSynced(List.of(entry.id()));
                pushed++;
            } catch (SyncException e) {
                LOGGER.log(Level.WARNING, "Failed to push " + entry.collection() + "/" + entry.documentId(), e);
                engine.markSyncFailed(entry.id(), e.getMessage());
                conflicts++;
            }
        }

        int pulled = 0;
        int skipped = 0;
        int failedPulls = 0;
        for (String collection : config.getCollections()) {
            List<SyncChange> changes;
            try {
                changes = transport.pullChanges(collection);
            } catch (SyncException e) {
                LOGGER.log(Level.WARNING, "Failed to pull " + collection, e);
                failedPulls++;
                continue;
            }
            for (SyncChange change : changes) {
                if (applyRemoteChange(collection, change)) {
                    pulled++;
                } else {
                    skipped++;
                }
            }
        }

        SyncResult result = new SyncResult(pushed, pulled, conflicts, skipped, failedPulls);
        LOGGER.info(() -> "Sync completed: pushed=" + result.pushed() + ", pulled=" + result.pulled()
                + ", conflicts=" + result.conflicts());
        return result;
    }

    /**
     * Applies one remote change according to the conflict policy.
     *
     * @return false when the local copy was kept
     */
    public boolean applyRemoteChange(String collection, SyncChange change) throws IOException {
        Map<String, Object> local = engine.get(collection, change.documentId());
        if (local != null && !keepsRemote(local, change)) {
            return false;
        }
        if (change.action() == SyncAction.DELETE) {
            engine.applyRemoteDelete(collection, change.documentId());
            return true;
        }
        if (change.data() == null) {
            LOGGER.warning(() -> "Ignoring " + change.action() + " of " + collection + "/" + change.documentId()
                    + " without data");
            return false;
        }
        Map<String, Object> data = Documents.copy(change.data());
        data.put(Documents.ID, change.documentId());
        engine.applyRemoteUpsert(collection, data);
        return true;
    }

    public boolean checkHealth() {
        return transport != null && transport.checkHealth();
    }

    public SyncConfig getConfig() {
        return config;
    }

    private boolean keepsRemote(Map<String, Object> local, SyncChange change) {
        switch (config.getConflictResolution()) {
            case SERVER_WINS:
                return true;
            case CLIENT_WINS:
                return false;
            case NEWEST_WINS:
            default:
                Instant localTime = parse(local.get(Documents.UPDATED_AT));
                Instant remoteTime = parse(change.timestamp());
                return localTime == null || remoteTime == null || !localTime.isAfter(remoteTime);
        }
    }

    private static Instant parse(Object timestamp) {
        if (timestamp == null) {
            return null;
        }
        try {
            return Instant.parse(timestamp.toString());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private void syncQuietly() {
        try {
            sync();
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.WARNING, "Auto-sync failed", e);
        }
    }
}

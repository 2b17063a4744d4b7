package io.practicedb.core;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.logging.Logger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import io.practicedb.core.cache.DocumentCache;
import io.practicedb.core.event.ChangeBus;
import io.practicedb.core.event.CollectionChange;
import io.practicedb.core.event.CollectionListener;
import io.practicedb.core.event.DocumentChange;
import io.practicedb.core.event.Subscription;
import io.practicedb.core.index.IndexEngine;
import io.practicedb.core.index.StoredIndexEngine;
import io.practicedb.core.metadata.DatabaseMetadata;
import io.practicedb.core.query.AggregateResult;
import io.practicedb.core.query.AggregateSpec;
import io.practicedb.core.query.QueryOptions;
import io.practicedb.core.query.QueryResult;
import io.practicedb.core.storage.StorageAdapter;
import io.practicedb.core.storage.StorageKeys;
import io.practicedb.core.sync.SyncAction;
import io.practicedb.core.sync.SyncLog;
import io.practicedb.core.sync.SyncLogEntry;
import io.practicedb.core.tx.Transaction;
import io.practicedb.core.tx.TransactionManager;
import io.practicedb.core.tx.TransactionOperation;

/**
 * Document engine over a {@link StorageAdapter}. Each collection is stored as one list under its
 * own key.
 * <p>
 * Reads share a lock and mutations are exclusive. Subscribers are notified on the mutating thread
 * after the lock is released and before the mutating call returns. Mutations append one sync-log
 * row per affected document, except those applied on behalf of the sync peer.
 * <p>
 * Indexes are not maintained on writes. Call {@link #reindex(String)} after bulk changes to an
 * indexed collection.
 */
public class DatabaseEngine {
    private static final Logger LOGGER = Logger.getLogger(DatabaseEngine.class.getName());

    public static final String EXPORT_METADATA = "metadata";
    public static final String EXPORT_TIMESTAMP = "exportedAt";

    private static final TypeReference<List<Map<String, Object>>> DOCUMENTS_TYPE = new TypeReference<List<Map<String, Object>>>() {
    };
    private static final TypeReference<DatabaseMetadata> METADATA_TYPE = new TypeReference<DatabaseMetadata>() {
    };

    private final StorageAdapter storage;
    private final Clock clock;
    private final DocumentCache cache;
    private final IndexEngine indexEngine;
    private final SyncLog syncLog;
    private final ChangeBus changeBus = new ChangeBus();
    private final TransactionManager transactionManager;
    private final Set<String> trackedCollections;
    private final ObjectMapper jsonMapper;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public DatabaseEngine(StorageAdapter storage) {
        this(storage, Clock.systemUTC(), DocumentCache.DEFAULT_TTL, SyncLog.DEFAULT_CAPACITY);
    }

    public DatabaseEngine(StorageAdapter storage, Clock clock, Duration cacheTtl, int syncLogCapacity) {
        this.storage = storage;
        this.clock = clock;
        this.cache = new DocumentCache(clock, cacheTtl);
        this.indexEngine = new StoredIndexEngine(storage);
        this.syncLog = new SyncLog(storage, syncLogCapacity);
        this.transactionManager = new TransactionManager(clock);
        this.trackedCollections = new LinkedHashSet<>(PracticeCollections.ALL);
        this.jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    // ---------------------------------------------------------------- reads

    public Map<String, Object> get(String collection, String id) throws IOException {
        Map<String, Object> cached = cache.get(collection, id);
        if (cached != null) {
            return cached;
        }
        lock.readLock().lock();
        try {
            Map<String, Object> found = find(load(collection), id);
            if (found != null) {
                cache.put(collection, id, found);
            }
            return found;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Map<String, Object>> getAll(String collection) throws IOException {
        lock.readLock().lock();
        try {
            return load(collection);
        } finally {
            lock.readLock().unlock();
        }
    }

    public QueryResult query(String collection, QueryOptions options) throws IOException {
        List<Map<String, Object>> matches = filter(getAll(collection), options.getWhere());

        if (options.getOrderBy() != null) {
            String field = options.getOrderBy();
            Comparator<Map<String, Object>> comparator = (a, b) -> Documents.compareValues(a.get(field), b.get(field));
            if (options.getOrderDirection() == QueryOptions.Direction.DESC) {
                comparator = comparator.reversed();
            }
            // List.sort is stable
            matches.sort(comparator);
        }

        int total = matches.size();
        int limit = options.getLimit();
        int offset = options.getOffset();
        int from = Math.min(offset, total);
        int to = Math.min(from + limit, total);

        List<Map<String, Object>> page = new ArrayList<>(to - from);
        for (Map<String, Object> document : matches.subList(from, to)) {
            page.add(project(document, options));
        }
        int totalPages = (int) Math.ceil((double) total / limit);
        return new QueryResult(page, total, offset / limit + 1, limit, totalPages);
    }

    public int count(String collection) throws IOException {
        return getAll(collection).size();
    }

    public int count(String collection, Predicate<Map<String, Object>> where) throws IOException {
        return filter(getAll(collection), where).size();
    }

    /**
     * Groups documents by {@code groupBy} and computes the requested aggregates per group, in order
     * of first appearance. Sums and averages count non-numeric values as 0; min and max ignore nulls.
     */
    public List<AggregateResult> aggregate(String collection, String groupBy, AggregateSpec spec) throws IOException {
        Map<Object, List<Map<String, Object>>> groups = new LinkedHashMap<>();
        for (Map<String, Object> document : getAll(collection)) {
            Object key = groupBy == null ? null : document.get(groupBy);
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(document);
        }

        List<AggregateResult> results = new ArrayList<>(groups.size());
        for (Map.Entry<Object, List<Map<String, Object>>> group : groups.entrySet()) {
            List<Map<String, Object>> items = group.getValue();
            Integer count = spec.isCount() ? items.size() : null;
            Double sum = spec.getSum() != null ? sum(items, spec.getSum()) : null;
            Double avg = spec.getAvg() != null && !items.isEmpty() ? sum(items, spec.getAvg()) / items.size() : null;
            Object min = spec.getMin() != null ? extreme(items, spec.getMin(), true) : null;
            Object max = spec.getMax() != null ? extreme(items, spec.getMax(), false) : null;
            results.add(new AggregateResult(group.getKey(), count, sum, avg, min, max));
        }
        return results;
    }

    // ---------------------------------------------------------------- mutations

    /**
     * Inserts a document, generating an id when none is given. Client-supplied timestamps are
     * replaced.
     *
     * @throws DuplicateDocumentException if the id already exists in the collection
     */
    public Map<String, Object> create(String collection, Map<String, Object> data) throws IOException {
        Map<String, Object> document = stamp(data);
        String id = Documents.idOf(document);
        CollectionChange change;
        lock.writeLock().lock();
        try {
            List<Map<String, Object>> documents = load(collection);
            if (find(documents, id) != null) {
                throw new DuplicateDocumentException(collection, id);
            }
            documents.add(document);
            save(collection, documents);
            cache.invalidateCollection(collection);
            transactionManager.record(new TransactionOperation.Created(collection, Documents.copy(document)));
            syncLog.append(List.of(syncRow(collection, SyncAction.CREATE, id)));
            refreshStatistic(collection, documents.size());
            change = changeOf(collection, documents, false,
                    List.of(new DocumentChange(DocumentChange.Type.CREATED, id, document)));
        } finally {
            lock.writeLock().unlock();
        }
        publish(change);
        return Documents.copy(document);
    }

    /**
     * Inserts all documents or none: every id is checked against the collection and the batch
     * before anything is written.
     */
    public List<Map<String, Object>> createMany(String collection, List<Map<String, Object>> items) throws IOException {
        if (items.isEmpty()) {
            return new ArrayList<>();
        }
        List<Map<String, Object>> created = new ArrayList<>(items.size());
        for (Map<String, Object> item : items) {
            created.add(stamp(item));
        }
        CollectionChange change;
        lock.writeLock().lock();
        try {
            List<Map<String, Object>> documents = load(collection);
            Set<String> ids = idsOf(documents);
            for (Map<String, Object> document : created) {
                if (!ids.add(Documents.idOf(document))) {
                    throw new DuplicateDocumentException(collection, Documents.idOf(document));
                }
            }
            documents.addAll(created);
            save(collection, documents);
            cache.invalidateCollection(collection);

            List<SyncLogEntry> rows = new ArrayList<>();
            List<DocumentChange> changes = new ArrayList<>();
            for (Map<String, Object> document : created) {
                String id = Documents.idOf(document);
                transactionManager.record(new TransactionOperation.Created(collection, Documents.copy(document)));
                rows.add(syncRow(collection, SyncAction.CREATE, id));
                changes.add(new DocumentChange(DocumentChange.Type.CREATED, id, document));
            }
            syncLog.append(rows);
            refreshStatistic(collection, documents.size());
            change = changeOf(collection, documents, false, changes);
        } finally {
            lock.writeLock().unlock();
        }
        publish(change);
        return Documents.copyAll(created);
    }

    /**
     * Merges {@code patch} onto the stored document. {@code id} and {@code createdAt} are kept and
     * {@code updatedAt} is bumped.
     *
     * @return the updated document, or null when the id does not exist
     */
    public Map<String, Object> update(String collection, String id, Map<String, Object> patch) throws IOException {
        Map<String, Object> updated;
        CollectionChange change;
        lock.writeLock().lock();
        try {
            List<Map<String, Object>> documents = load(collection);
            int position = indexOf(documents, id);
            if (position < 0) {
                return null;
            }
            Map<String, Object> before = documents.get(position);
            updated = merge(before, patch);
            documents.set(position, updated);
            save(collection, documents);
            cache.invalidate(collection, id);
            transactionManager.record(new TransactionOperation.Updated(collection, Documents.copy(before),
                    Documents.copy(updated)));
            syncLog.append(List.of(syncRow(collection, SyncAction.UPDATE, id)));
            change = changeOf(collection, documents, false,
                    List.of(new DocumentChange(DocumentChange.Type.UPDATED, id, updated)));
        } finally {
            lock.writeLock().unlock();
        }
        publish(change);
        return Documents.copy(updated);
    }

    /**
     * Applies one patch per id. Missing ids are skipped.
     *
     * @return the updated documents
     */
    public List<Map<String, Object>> updateMany(String collection, Map<String, Map<String, Object>> patches)
            throws IOException {
        return updateMatching(collection, patches);
    }

    /**
     * Applies the same patch to every document matching {@code where}.
     *
     * @return number of documents updated
     */
    public int updateWhere(String collection, Predicate<Map<String, Object>> where, Map<String, Object> patch)
            throws IOException {
        Map<String, Map<String, Object>> patches = new LinkedHashMap<>();
        for (Map<String, Object> document : filter(getAll(collection), where)) {
            patches.put(Documents.idOf(document), patch);
        }
        return updateMatching(collection, patches).size();
    }

    public Map<String, Object> upsert(String collection, Map<String, Object> data) throws IOException {
        String id = Documents.idOf(data);
        if (id != null && get(collection, id) != null) {
            return update(collection, id, data);
        }
        return create(collection, data);
    }

    /**
     * @return true when a document was removed
     */
    public boolean delete(String collection, String id) throws IOException {
        CollectionChange change;
        lock.writeLock().lock();
        try {
            List<Map<String, Object>> documents = load(collection);
            int position = indexOf(documents, id);
            if (position < 0) {
                return false;
            }
            Map<String, Object> removed = documents.remove(position);
            save(collection, documents);
            cache.invalidate(collection, id);
            transactionManager.record(new TransactionOperation.Deleted(collection, Documents.copy(removed)));
            syncLog.append(List.of(syncRow(collection, SyncAction.DELETE, id)));
            refreshStatistic(collection, documents.size());
            change = changeOf(collection, documents, false,
                    List.of(new DocumentChange(DocumentChange.Type.DELETED, id, removed)));
        } finally {
            lock.writeLock().unlock();
        }
        publish(change);
        return true;
    }

    /**
     * @return number of documents removed
     */
    public int deleteMany(String collection, Predicate<Map<String, Object>> where) throws IOException {
        CollectionChange change;
        int removedCount;
        lock.writeLock().lock();
        try {
            List<Map<String, Object>> documents = load(collection);
            List<Map<String, Object>> remaining = new ArrayList<>(documents.size());
            List<Map<String, Object>> removed = new ArrayList<>();
            for (Map<String, Object> document : documents) {
                if (where.test(document)) {
                    removed.add(document);
                } else {
                    remaining.add(document);
                }
            }
            removedCount = removed.size();
            if (removedCount == 0) {
                return 0;
            }
            save(collection, remaining);
            cache.invalidateCollection(collection);

            List<SyncLogEntry> rows = new ArrayList<>();
            List<DocumentChange> changes = new ArrayList<>();
            for (Map<String, Object> document : removed) {
                String id = Documents.idOf(document);
                transactionManager.record(new TransactionOperation.Deleted(collection, Documents.copy(document)));
                rows.add(syncRow(collection, SyncAction.DELETE, id));
                changes.add(new DocumentChange(DocumentChange.Type.DELETED, id, document));
            }
            syncLog.append(rows);
            refreshStatistic(collection, remaining.size());
            change = changeOf(collection, remaining, false, changes);
        } finally {
            lock.writeLock().unlock();
        }
        publish(change);
        return removedCount;
    }

    // ---------------------------------------------------------------- remote changes

    /**
     * Stores a document received from the sync peer. The remote fields are merged onto any local
     * copy and the remote {@code updatedAt} is kept. Subscribers see an external change; the sync
     * log is not touched.
     */
    public Map<String, Object> applyRemoteUpsert(String collection, Map<String, Object> data) throws IOException {
        String id = Documents.idOf(data);
        if (id == null) {
            throw new IllegalArgumentException("Remote document for " + collection + " has no id");
        }
        String now = Documents.timestamp(clock);
        Map<String, Object> stored;
        CollectionChange change;
        lock.writeLock().lock();
        try {
            List<Map<String, Object>> documents = load(collection);
            int position = indexOf(documents, id);
            DocumentChange.Type type;
            if (position < 0) {
                stored = Documents.copy(data);
                stored.putIfAbsent(Documents.CREATED_AT, now);
                stored.putIfAbsent(Documents.UPDATED_AT, now);
                documents.add(stored);
                type = DocumentChange.Type.CREATED;
            } else {
                Map<String, Object> local = documents.get(position);
                stored = Documents.copy(local);
                stored.putAll(Documents.copy(data));
                stored.put(Documents.CREATED_AT, local.get(Documents.CREATED_AT));
                if (data.get(Documents.UPDATED_AT) == null) {
                    stored.put(Documents.UPDATED_AT, now);
                }
                documents.set(position, stored);
                type = DocumentChange.Type.UPDATED;
            }
            save(collection, documents);
            cache.invalidate(collection, id);
            refreshStatistic(collection, documents.size());
            change = changeOf(collection, documents, true, List.of(new DocumentChange(type, id, stored)));
        } finally {
            lock.writeLock().unlock();
        }
        publish(change);
        return Documents.copy(stored);
    }

    public boolean applyRemoteDelete(String collection, String id) throws IOException {
        CollectionChange change;
        lock.writeLock().lock();
        try {
            List<Map<String, Object>> documents = load(collection);
            int position = indexOf(documents, id);
            if (position < 0) {
                return false;
            }
            Map<String, Object> removed = documents.remove(position);
            save(collection, documents);
            cache.invalidate(collection, id);
            refreshStatistic(collection, documents.size());
            change = changeOf(collection, documents, true,
                    List.of(new DocumentChange(DocumentChange.Type.DELETED, id, removed)));
        } finally {
            lock.writeLock().unlock();
        }
        publish(change);
        return true;
    }

    // ---------------------------------------------------------------- indexes

    public void createIndex(String collection, String field, String indexName) throws IOException {
        lock.writeLock().lock();
        try {
            indexEngine.createIndex(collection, field, indexName, load(collection));
        } finally {
            lock.writeLock().unlock();
        }
        LOGGER.fine(() -> "Created index " + indexName + " on " + collection + "." + field);
    }

    /**
     * Documents whose id the index lists under {@code value}. Documents indexed against an old value
     * or added after the index was built are not returned.
     */
    public List<Map<String, Object>> findByIndex(String collection, String indexName, Object value) throws IOException {
        lock.readLock().lock();
        try {
            Set<String> ids = new HashSet<>(indexEngine.lookup(indexName, value));
            List<Map<String, Object>> result = new ArrayList<>();
            if (ids.isEmpty()) {
                return result;
            }
            for (Map<String, Object> document : load(collection)) {
                if (ids.contains(Documents.idOf(document))) {
                    result.add(document);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void dropIndex(String indexName) throws IOException {
        lock.writeLock().lock();
        try {
            indexEngine.dropIndex(indexName);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Rebuilds every index defined on {@code collection}.
     *
     * @return number of indexes rebuilt
     */
    public int reindex(String collection) throws IOException {
        lock.writeLock().lock();
        try {
            List<IndexEngine.IndexDefinition> definitions = indexEngine.getIndexes(collection);
            List<Map<String, Object>> documents = load(collection);
            for (IndexEngine.IndexDefinition def : definitions) {
                indexEngine.createIndex(collection, def.field(), def.name(), documents);
            }
            return definitions.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<IndexEngine.IndexDefinition> getIndexes() throws IOException {
        lock.readLock().lock();
        try {
            return indexEngine.getIndexes();
        } finally {
            lock.readLock().unlock();
        }
    }

    // ---------------------------------------------------------------- subscriptions

    public Subscription subscribe(String collection, CollectionListener listener) {
        return changeBus.subscribe(collection, listener);
    }

    // ---------------------------------------------------------------- transactions

    public String beginTransaction() {
        return transactionManager.beginTransaction();
    }

    public boolean commitTransaction(String transactionId) {
        return transactionManager.commit(transactionId);
    }

    /**
     * Restores the before-image of every document the transaction touched, newest operation first.
     * Changes other callers made to those documents in the meantime are overwritten.
     *
     * @return false when the id is unknown or the transaction is no longer pending
     */
    public boolean rollbackTransaction(String transactionId) throws IOException {
        List<TransactionOperation> operations = transactionManager.beginRollback(transactionId);
        if (operations == null) {
            return false;
        }
        for (TransactionOperation operation : operations) {
            restore(operation.collection(), operation.documentId(), operation.before());
        }
        LOGGER.info(() -> "Rolled back transaction " + transactionId + " (" + operations.size() + " operations)");
        return true;
    }

    public Transaction getTransaction(String transactionId) {
        return transactionManager.getTransaction(transactionId);
    }

    // ---------------------------------------------------------------- sync log

    public List<SyncLogEntry> getPendingSyncs() throws IOException {
        lock.readLock().lock();
        try {
            return syncLog.pending();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<SyncLogEntry> getSyncLog() throws IOException {
        lock.readLock().lock();
        try {
            return syncLog.entries();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int markAsSynced(Collection<String> entryIds) throws IOException {
        lock.writeLock().lock();
        try {
            return syncLog.markSynced(entryIds, Documents.timestamp(clock));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean markSyncFailed(String entryId, String error) throws IOException {
        lock.writeLock().lock();
        try {
            return syncLog.markFailed(entryId, error);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ---------------------------------------------------------------- export / import

    /**
     * Every document collection keyed by name, plus {@code metadata} and {@code exportedAt}.
     */
    public Map<String, Object> exportDatabase() throws IOException {
        DatabaseMetadata metadata = getMetadata();
        lock.readLock().lock();
        try {
            Map<String, Object> bundle = new LinkedHashMap<>();
            for (String collection : listCollections()) {
                bundle.put(collection, load(collection));
            }
            bundle.put(EXPORT_METADATA, metadata);
            bundle.put(EXPORT_TIMESTAMP, Documents.timestamp(clock));
            return bundle;
        } finally {
            lock.readLock().unlock();
        }
    }

    public String exportJson() throws IOException {
        return jsonMapper.writeValueAsString(exportDatabase());
    }

    /**
     * Restores collections from an export bundle. Without {@code merge} each bundled collection
     * replaces the stored one; with it, only documents whose id is new are appended. Bulk restores
     * bypass the sync log and subscribers. Statistics are recomputed afterwards.
     */
    @SuppressWarnings("unchecked")
    public void importDatabase(Map<String, Object> bundle, boolean merge) throws IOException {
        lock.writeLock().lock();
        try {
            for (Map.Entry<String, Object> entry : bundle.entrySet()) {
                String collection = entry.getKey();
                if (EXPORT_METADATA.equals(collection) || EXPORT_TIMESTAMP.equals(collection)
                        || !StorageKeys.isCollectionKey(collection) || !(entry.getValue() instanceof List)) {
                    continue;
                }
                List<Map<String, Object>> incoming = new ArrayList<>();
                for (Object item : (List<Object>) entry.getValue()) {
                    if (item instanceof Map) {
                        incoming.add(Documents.copy((Map<String, Object>) item));
                    }
                }
                if (merge) {
                    List<Map<String, Object>> documents = load(collection);
                    Set<String> ids = idsOf(documents);
                    for (Map<String, Object> document : incoming) {
                        if (ids.add(Documents.idOf(document))) {
                            documents.add(document);
                        }
                    }
                    save(collection, documents);
                } else {
                    save(collection, incoming);
                }
                cache.invalidateCollection(collection);
            }
            updateStatistics();
        } finally {
            lock.writeLock().unlock();
        }
        LOGGER.info(() -> "Imported " + bundle.size() + " bundle entries (merge=" + merge + ")");
    }

    public void importJson(String json, boolean merge) throws IOException {
        Map<String, Object> bundle = jsonMapper.readValue(json, new TypeReference<Map<String, Object>>() {
        });
        importDatabase(bundle, merge);
    }

    // ---------------------------------------------------------------- metadata

    /**
     * Reads the metadata document, creating it on first access.
     */
    public DatabaseMetadata getMetadata() throws IOException {
        lock.writeLock().lock();
        try {
            return loadMetadata();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public DatabaseMetadata updateStatistics() throws IOException {
        lock.writeLock().lock();
        try {
            Map<String, Integer> statistics = new LinkedHashMap<>();
            for (String collection : trackedCollections) {
                statistics.put(collection, load(collection).size());
            }
            DatabaseMetadata metadata = loadMetadata().withStatistics(statistics, Documents.timestamp(clock));
            storage.set(StorageKeys.METADATA, metadata);
            return metadata;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Records {@code version} as both the schema version and the last applied migration.
     */
    public DatabaseMetadata recordMigration(String version) throws IOException {
        lock.writeLock().lock();
        try {
            DatabaseMetadata metadata = loadMetadata().withMigration(version, Documents.timestamp(clock));
            storage.set(StorageKeys.METADATA, metadata);
            return metadata;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ---------------------------------------------------------------- housekeeping

    /**
     * Names of the stored document collections, sorted. Reserved and index keys are skipped.
     */
    public List<String> listCollections() throws IOException {
        List<String> names = new ArrayList<>();
        for (String key : storage.keys()) {
            if (StorageKeys.isCollectionKey(key)) {
                names.add(key);
            }
        }
        Collections.sort(names);
        return names;
    }

    /**
     * Wipes all stored keys, the cache and the transaction log. Subscriptions stay registered.
     */
    public void clearDatabase() throws IOException {
        lock.writeLock().lock();
        try {
            storage.clear();
            cache.clear();
            transactionManager.clear();
        } finally {
            lock.writeLock().unlock();
        }
        LOGGER.info("Database cleared");
    }

    public Clock getClock() {
        return clock;
    }

    public StorageAdapter getStorage() {
        return storage;
    }

    DocumentCache getCache() {
        return cache;
    }

    // ---------------------------------------------------------------- internals

    private void restore(String collection, String id, Map<String, Object> before) throws IOException {
        CollectionChange change;
        lock.writeLock().lock();
        try {
            List<Map<String, Object>> documents = load(collection);
            int position = indexOf(documents, id);
            DocumentChange documentChange;
            SyncAction action;
            if (before == null) {
                if (position < 0) {
                    return;
                }
                Map<String, Object> removed = documents.remove(position);
                documentChange = new DocumentChange(DocumentChange.Type.DELETED, id, removed);
                action = SyncAction.DELETE;
            } else if (position < 0) {
                documents.add(Documents.copy(before));
                documentChange = new DocumentChange(DocumentChange.Type.CREATED, id, before);
                action = SyncAction.CREATE;
            } else {
                documents.set(position, Documents.copy(before));
                documentChange = new DocumentChange(DocumentChange.Type.UPDATED, id, before);
                action = SyncAction.UPDATE;
            }
            save(collection, documents);
            cache.invalidate(collection, id);
            syncLog.append(List.of(syncRow(collection, action, id)));
            refreshStatistic(collection, documents.size());
            change = changeOf(collection, documents, false, List.of(documentChange));
        } finally {
            lock.writeLock().unlock();
        }
        publish(change);
    }

    private List<Map<String, Object>> updateMatching(String collection, Map<String, Map<String, Object>> patches)
            throws IOException {
        List<Map<String, Object>> updated = new ArrayList<>();
        if (patches.isEmpty()) {
            return updated;
        }
        CollectionChange change;
        lock.writeLock().lock();
        try {
            List<Map<String, Object>> documents = load(collection);
            List<SyncLogEntry> rows = new ArrayList<>();
            List<DocumentChange> changes = new ArrayList<>();
            for (Map.Entry<String, Map<String, Object>> patch : patches.entrySet()) {
                String id = patch.getKey();
                int position = indexOf(documents, id);
                if (position < 0) {
                    continue;
                }
                Map<String, Object> before = documents.get(position);
                Map<String, Object> after = merge(before, patch.getValue());
                documents.set(position, after);
                updated.add(after);
                transactionManager.record(new TransactionOperation.Updated(collection, Documents.copy(before),
                        Documents.copy(after)));
                rows.add(syncRow(collection, SyncAction.UPDATE, id));
                changes.add(new DocumentChange(DocumentChange.Type.UPDATED, id, after));
            }
            if (updated.isEmpty()) {
                return updated;
            }
            save(collection, documents);
            cache.invalidateCollection(collection);
            syncLog.append(rows);
            change = changeOf(collection, documents, false, changes);
        } finally {
            lock.writeLock().unlock();
        }
        publish(change);
        return Documents.copyAll(updated);
    }

    private Map<String, Object> stamp(Map<String, Object> data) {
        String now = Documents.timestamp(clock);
        Map<String, Object> document = new LinkedHashMap<>();
        String id = Documents.idOf(data);
        document.put(Documents.ID, id != null ? id : Documents.generateId(clock));
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            if (!Documents.ID.equals(entry.getKey())) {
                document.put(entry.getKey(), Documents.deepCopy(entry.getValue()));
            }
        }
        document.put(Documents.CREATED_AT, now);
        document.put(Documents.UPDATED_AT, now);
        return document;
    }

    private Map<String, Object> merge(Map<String, Object> existing, Map<String, Object> patch) {
        Map<String, Object> merged = Documents.copy(existing);
        for (Map.Entry<String, Object> entry : patch.entrySet()) {
            merged.put(entry.getKey(), Documents.deepCopy(entry.getValue()));
        }
        merged.put(Documents.ID, existing.get(Documents.ID));
        merged.put(Documents.CREATED_AT, existing.get(Documents.CREATED_AT));

        String now = Documents.timestamp(clock);
        Object previous = existing.get(Documents.UPDATED_AT);
        // never move updatedAt backwards if the clock does
        if (previous instanceof String && ((String) previous).compareTo(now) > 0) {
            now = (String) previous;
        }
        merged.put(Documents.UPDATED_AT, now);
        return merged;
    }

    private SyncLogEntry syncRow(String collection, SyncAction action, String documentId) {
        return SyncLogEntry.pending("sync_" + Documents.generateId(clock), collection, action, documentId,
                Documents.timestamp(clock));
    }

    private CollectionChange changeOf(String collection, List<Map<String, Object>> documents, boolean external,
            List<DocumentChange> changes) {
        if (!changeBus.hasListeners(collection)) {
            return null;
        }
        List<DocumentChange> copies = new ArrayList<>(changes.size());
        for (DocumentChange change : changes) {
            copies.add(new DocumentChange(change.type(), change.documentId(), Documents.copy(change.document())));
        }
        return new CollectionChange(collection, Collections.unmodifiableList(copies),
                Collections.unmodifiableList(Documents.copyAll(documents)), external);
    }

    private void publish(CollectionChange change) {
        if (change != null) {
            changeBus.publish(change);
        }
    }

    private void refreshStatistic(String collection, int size) throws IOException {
        if (!trackedCollections.contains(collection)) {
            return;
        }
        DatabaseMetadata metadata = loadMetadata();
        if (metadata.statistics().containsKey(collection) && metadata.count(collection) == size) {
            return;
        }
        Map<String, Integer> statistics = new LinkedHashMap<>(metadata.statistics());
        statistics.put(collection, size);
        storage.set(StorageKeys.METADATA, metadata.withStatistics(statistics, Documents.timestamp(clock)));
    }

    private DatabaseMetadata loadMetadata() throws IOException {
        DatabaseMetadata metadata = storage.get(StorageKeys.METADATA, METADATA_TYPE);
        if (metadata == null) {
            metadata = DatabaseMetadata.initial(Documents.timestamp(clock));
            storage.set(StorageKeys.METADATA, metadata);
        }
        return metadata;
    }

    private List<Map<String, Object>> load(String collection) throws IOException {
        List<Map<String, Object>> documents = storage.get(collection, DOCUMENTS_TYPE);
        return documents == null ? new ArrayList<>() : new ArrayList<>(documents);
    }

    private void save(String collection, List<Map<String, Object>> documents) throws IOException {
        storage.set(collection, documents);
    }

    private static List<Map<String, Object>> filter(List<Map<String, Object>> documents,
            Predicate<Map<String, Object>> where) {
        if (where == null) {
            return documents;
        }
        List<Map<String, Object>> result = new ArrayList<>();
        for (Map<String, Object> document : documents) {
            if (where.test(document)) {
                result.add(document);
            }
        }
        return result;
    }

    private static Map<String, Object> project(Map<String, Object> document, QueryOptions options) {
        if (!options.getInclude().isEmpty()) {
            Map<String, Object> projected = new LinkedHashMap<>();
            for (String field : options.getInclude()) {
                if (document.containsKey(field)) {
                    projected.put(field, document.get(field));
                }
            }
            return projected;
        }
        if (!options.getExclude().isEmpty()) {
            Map<String, Object> projected = new LinkedHashMap<>(document);
            for (String field : options.getExclude()) {
                projected.remove(field);
            }
            return projected;
        }
        return document;
    }

    private static double sum(List<Map<String, Object>> items, String field) {
        double total = 0;
        for (Map<String, Object> item : items) {
            total += Documents.numericValue(item.get(field));
        }
        return total;
    }

    private static Object extreme(List<Map<String, Object>> items, String field, boolean min) {
        Object best = null;
        for (Map<String, Object> item : items) {
            Object value = item.get(field);
            if (value == null) {
                continue;
            }
            if (best == null) {
                best = value;
                continue;
            }
            int cmp = Documents.compareValues(value, best);
            if (min ? cmp < 0 : cmp > 0) {
                best = value;
            }
        }
        return best;
    }

    private static Map<String, Object> find(List<Map<String, Object>> documents, String id) {
        int position = indexOf(documents, id);
        return position < 0 ? null : documents.get(position);
    }

    private static int indexOf(List<Map<String, Object>> documents, String id) {
        if (id == null) {
            return -1;
        }
        for (int i = 0; i < documents.size(); i++) {
            if (id.equals(Documents.idOf(documents.get(i)))) {
                return i;
            }
        }
        return -1;
    }

    private static Set<String> idsOf(List<Map<String, Object>> documents) {
        Set<String> ids = new HashSet<>();
        for (Map<String, Object> document : documents) {
            ids.add(Documents.idOf(document));
        }
        return ids;
    }
}

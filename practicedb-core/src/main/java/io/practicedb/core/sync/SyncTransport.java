package io.practicedb.core.sync;

import java.util.List;

/**
 * Remote side of synchronization. Failures surface as {@link SyncException}.
 */
public interface SyncTransport {

    void push(String collection, SyncChange change);

    List<SyncChange> pullChanges(String collection);

    boolean checkHealth();
}

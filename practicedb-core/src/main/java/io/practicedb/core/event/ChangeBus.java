package io.practicedb.core.event;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-collection listener registry. Listeners run on the publishing thread in registration order;
 * a listener that throws is logged and skipped.
 */
public class ChangeBus {
    private static final Logger LOGGER = Logger.getLogger(ChangeBus.class.getName());

    private final Map<String, List<CollectionListener>> listeners = new ConcurrentHashMap<>();

    public Subscription subscribe(String collection, CollectionListener listener) {
        List<CollectionListener> topic = listeners.computeIfAbsent(collection, k -> new CopyOnWriteArrayList<>());
        topic.add(listener);
        return () -> topic.remove(listener);
    }

    public boolean hasListeners(String collection) {
        List<CollectionListener> topic = listeners.get(collection);
        return topic != null && !topic.isEmpty();
    }

    public int listenerCount(String collection) {
        List<CollectionListener> topic = listeners.get(collection);
        return topic == null ? 0 : topic.size();
    }

    public void publish(CollectionChange change) {
        List<CollectionListener> topic = listeners.get(change.collection());
        if (topic == null) {
            return;
        }
        for (CollectionListener listener : topic) {
            try {
                listener.changed(change);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Subscriber for " + change.collection() + " failed", e);
            }
        }
    }

    public void clear() {
        listeners.clear();
    }
}

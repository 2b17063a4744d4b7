package io.practicedb.core.event;

/**
 * Handle returned by {@code subscribe}; closing it detaches the listener. Closing twice is a no-op.
 */
public interface Subscription extends AutoCloseable {

    void unsubscribe();

    @Override
    default void close() {
        unsubscribe();
    }
}

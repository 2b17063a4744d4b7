package io.practicedb.core.storage;

import java.io.IOException;
import java.util.List;

import com.fasterxml.jackson.core.type.TypeReference;

/**
 * Raw key/value persistence underneath the engine.
 * <p>
 * Values are plain structures (maps, lists, strings, numbers, booleans). Every call is atomic for
 * its own key; nothing is atomic across keys.
 */
public interface StorageAdapter {

    /**
     * Reads the value stored under {@code key}.
     *
     * @return the value converted to {@code type}, or {@code null} when absent or unreadable
     */
    <T> T get(String key, TypeReference<T> type) throws IOException;

    void set(String key, Object value) throws IOException;

    void delete(String key) throws IOException;

    /**
     * Lists stored keys, optionally restricted to those starting with {@code prefix}.
     */
    List<String> keys(String prefix) throws IOException;

    default List<String> keys() throws IOException {
        return keys(null);
    }

    /**
     * Removes every key starting with {@code prefix}, or every key when the prefix is null.
     */
    void clear(String prefix) throws IOException;

    default void clear() throws IOException {
        clear(null);
    }
}

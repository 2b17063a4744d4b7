package io.practicedb.core.storage;

import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.cbor.CBORFactory;

/**
 * Durable adapter: one CBOR file per key under {@code <dataDirectory>/<namespace>/}.
 * <p>
 * Reads that fail (missing file, truncated or corrupt content) return {@code null}; callers see a
 * miss, never a half-parsed value.
 */
public class FileStorageAdapter implements StorageAdapter {
    private static final Logger LOGGER = Logger.getLogger(FileStorageAdapter.class.getName());
    private static final String EXTENSION = ".jdb";

    private final Path directory;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final ObjectMapper mapper = new ObjectMapper(new CBORFactory());

    public FileStorageAdapter(String dataDirectory, String namespace) throws IOException {
        this.directory = Paths.get(dataDirectory, namespace);
        Files.createDirectories(directory);
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public <T> T get(String key, TypeReference<T> type) {
        lock.readLock().lock();
        try {
            Path file = fileFor(key);
            if (!Files.exists(file)) {
                return null;
            }
            return mapper.readValue(file.toFile(), type);
        } catch (Exception e) {
            LOGGER.log(Level.WARNING, "Treating unreadable key ''{0}'' as absent: {1}",
                    new Object[]{key, e.getMessage()});
            return null;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void set(String key, Object value) throws IOException {
        lock.writeLock().lock();
        try {
            Path target = fileFor(key);
            Path temp = directory.resolve(target.getFileName() + ".tmp");
            mapper.writeValue(temp.toFile(), value);
            Files.move(temp, target, java.nio.file.StandardCopyOption.REPLACE_EXISTING,
                    java.nio.file.StandardCopyOption.ATOMIC_MOVE);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void delete(String key) throws IOException {
        lock.writeLock().lock();
        try {
            Files.deleteIfExists(fileFor(key));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<String> keys(String prefix) throws IOException {
        lock.readLock().lock();
        try {
            return listKeys(prefix);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void clear(String prefix) throws IOException {
        lock.writeLock().lock();
        try {
            for (String key : listKeys(prefix)) {
                Files.deleteIfExists(fileFor(key));
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private List<String> listKeys(String prefix) throws IOException {
        List<String> keys = new ArrayList<>();
        if (!Files.exists(directory)) {
            return keys;
        }
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : files.toList()) {
                String name = file.getFileName().toString();
                if (!name.endsWith(EXTENSION)) {
                    continue;
                }
                String key = URLDecoder.decode(name.substring(0, name.length() - EXTENSION.length()),
                        StandardCharsets.UTF_8);
                if (prefix == null || key.startsWith(prefix)) {
                    keys.add(key);
                }
            }
        }
        return keys;
    }

    private Path fileFor(String key) {
        return directory.resolve(URLEncoder.encode(key, StandardCharsets.UTF_8) + EXTENSION);
    }
}

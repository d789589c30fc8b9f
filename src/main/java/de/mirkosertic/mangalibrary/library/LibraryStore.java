package de.mirkosertic.mangalibrary.library;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import de.mirkosertic.mangalibrary.util.Throttler;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * In-memory map of collection id to {@link CollectionRecord}, persisted to a single
 * JSON file.
 * <p>
 * Every mutation is applied synchronously under one lock and is visible to the
 * next read. Durability is deferred: after the lock is released a flush is
 * requested through a {@link Throttler}, so bursts of mutations result in at most
 * one write per throttle window, the last one always carrying the latest state.
 * <p>
 * The file is written to a {@code .tmp} sibling first and then moved over the
 * target atomically, so readers only ever see a complete snapshot.
 */
public class LibraryStore implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(LibraryStore.class);

    private static final String TEMP_SUFFIX = ".tmp";
    private static final TypeReference<Map<String, StoredCollection>> FILE_TYPE = new TypeReference<>() {
    };

    private final Path storeFile;
    private final Path tempFile;
    private final ObjectMapper objectMapper;
    private final Throttler flushThrottler;

    private final ReentrantLock lock = new ReentrantLock();
    // Serialises flushes so an older copy never replaces a newer file
    private final ReentrantLock flushLock = new ReentrantLock();
    private final Map<String, CollectionRecord> collections = new HashMap<>();
    private final List<Runnable> changeListeners = new CopyOnWriteArrayList<>();

    @Nullable
    private volatile PersistenceLoadException loadFailure;

    public LibraryStore(final Path storeFile, final long flushThrottleMs) {
        this(storeFile, flushThrottleMs, createObjectMapper());
    }

    public LibraryStore(final Path storeFile, final long flushThrottleMs, final ObjectMapper objectMapper) {
        this.storeFile = storeFile.toAbsolutePath().normalize();
        this.tempFile = this.storeFile.resolveSibling(this.storeFile.getFileName() + TEMP_SUFFIX);
        this.objectMapper = objectMapper;
        this.flushThrottler = new Throttler("library-flush", flushThrottleMs);
    }

    /**
     * Mapper used for the library file: ISO-8601 timestamps, pretty printed,
     * unknown properties ignored.
     */
    public static ObjectMapper createObjectMapper() {
        final ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Load the persisted library. A missing file yields an empty store. A corrupt or
     * unreadable file also yields an empty store; the failure is logged and
     * available through {@link #getLoadFailure()}.
     */
    public void init() {
        removeStaleTempFile();

        final Map<String, CollectionRecord> loaded = new HashMap<>();
        if (!Files.exists(storeFile)) {
            logger.info("No library file found at {}, starting with an empty library", storeFile);
        } else {
            try {
                final Map<String, StoredCollection> stored = objectMapper.readValue(storeFile.toFile(), FILE_TYPE);
                if (stored != null) {
                    final Instant now = Instant.now();
                    for (final Map.Entry<String, StoredCollection> entry : stored.entrySet()) {
                        final CollectionRecord record = entry.getValue() != null
                                ? entry.getValue().toRecord(entry.getKey(), now)
                                : null;
                        if (record == null) {
                            logger.warn("Skipping invalid library entry {} in {}", entry.getKey(), storeFile);
                            continue;
                        }
                        loaded.put(entry.getKey(), record);
                    }
                }
                loadFailure = null;
                logger.info("Loaded {} collections from {}", loaded.size(), storeFile);
            } catch (final IOException e) {
                loadFailure = new PersistenceLoadException(storeFile, e);
                logger.error("Failed to load library file {}, starting with an empty library", storeFile, e);
                loaded.clear();
            }
        }

        lock.lock();
        try {
            collections.clear();
            collections.putAll(loaded);
        } finally {
            lock.unlock();
        }
    }

    @Nullable
    public CollectionRecord get(final String id) {
        lock.lock();
        try {
            return collections.get(id);
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(final String id) {
        lock.lock();
        try {
            return collections.containsKey(id);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return collections.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Insert or replace the record stored under {@code id}.
     *
     * @throws IllegalArgumentException if the record id differs from {@code id}
     */
    public void set(final String id, final CollectionRecord record) {
        if (!id.equals(record.id())) {
            throw new IllegalArgumentException("Record id " + record.id() + " does not match key " + id);
        }
        lock.lock();
        try {
            collections.put(id, record);
        } finally {
            lock.unlock();
        }
        afterMutation();
    }

    /**
     * @return true if a record was removed
     */
    public boolean delete(final String id) {
        final boolean removed;
        lock.lock();
        try {
            removed = collections.remove(id) != null;
        } finally {
            lock.unlock();
        }
        if (removed) {
            afterMutation();
        }
        return removed;
    }

    /**
     * Atomically replace the record under {@code id} with the result of {@code updater}.
     * The updater receives the current record or {@code null} and runs under the
     * store lock, so it must not block. Returning {@code null} removes the record.
     *
     * @return the new record, or {@code null} if there is none afterwards
     */
    @Nullable
    public CollectionRecord update(final String id, final UnaryOperator<@Nullable CollectionRecord> updater) {
        final CollectionRecord result;
        final boolean changed;
        lock.lock();
        try {
            final CollectionRecord current = collections.get(id);
            result = updater.apply(current);
            if (result == null) {
                changed = collections.remove(id) != null;
            } else {
                if (!id.equals(result.id())) {
                    throw new IllegalArgumentException("Record id " + result.id() + " does not match key " + id);
                }
                collections.put(id, result);
                changed = true;
            }
        } finally {
            lock.unlock();
        }
        if (changed) {
            afterMutation();
        }
        return result;
    }

    /**
     * Move the record stored under {@code oldId} to {@code newId} in one mutation,
     * transforming it with {@code renamer}.
     *
     * @return the migrated record, or {@code null} if {@code oldId} was not present
     */
    @Nullable
    public CollectionRecord rename(final String oldId, final String newId, final UnaryOperator<CollectionRecord> renamer) {
        final CollectionRecord renamed;
        lock.lock();
        try {
            final CollectionRecord current = collections.get(oldId);
            if (current == null) {
                return null;
            }
            renamed = renamer.apply(current);
            if (!newId.equals(renamed.id())) {
                throw new IllegalArgumentException("Record id " + renamed.id() + " does not match key " + newId);
            }
            collections.remove(oldId);
            collections.put(newId, renamed);
        } finally {
            lock.unlock();
        }
        afterMutation();
        return renamed;
    }

    public LibrarySnapshot snapshot() {
        lock.lock();
        try {
            return new LibrarySnapshot(collections);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Write the current state to disk now, cancelling any pending throttled flush.
     *
     * @throws PersistenceWriteException if the file could not be written
     */
    public void forceFlush() throws PersistenceWriteException {
        flushThrottler.cancelPending();
        writeFile();
    }

    /**
     * Register a callback invoked after every mutation, outside the store lock.
     */
    public void addChangeListener(final Runnable listener) {
        changeListeners.add(listener);
    }

    @Nullable
    public PersistenceLoadException getLoadFailure() {
        return loadFailure;
    }

    public Path getStoreFile() {
        return storeFile;
    }

    private void afterMutation() {
        flushThrottler.schedule(this::flushQuietly);
        for (final Runnable listener : changeListeners) {
            try {
                listener.run();
            } catch (final RuntimeException e) {
                logger.error("Library change listener failed", e);
            }
        }
    }

    private void flushQuietly() {
        try {
            writeFile();
        } catch (final PersistenceWriteException e) {
            logger.error("Throttled flush of {} failed, will retry on next change", storeFile, e);
        }
    }

    private void writeFile() throws PersistenceWriteException {
        flushLock.lock();
        try {
            final Map<String, StoredCollection> content = new TreeMap<>();
            lock.lock();
            try {
                for (final Map.Entry<String, CollectionRecord> entry : collections.entrySet()) {
                    content.put(entry.getKey(), StoredCollection.from(entry.getValue()));
                }
            } finally {
                lock.unlock();
            }

            try {
                final byte[] data = objectMapper.writeValueAsBytes(content);
                final Path parent = storeFile.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }

                try (final FileChannel channel = FileChannel.open(tempFile,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.TRUNCATE_EXISTING,
                        StandardOpenOption.WRITE)) {
                    final ByteBuffer buffer = ByteBuffer.wrap(data);
                    while (buffer.hasRemaining()) {
                        channel.write(buffer);
                    }
                    channel.force(true);
                }

                Files.move(tempFile, storeFile,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);

                logger.debug("Saved {} collections to {}", content.size(), storeFile);
            } catch (final IOException e) {
                try {
                    Files.deleteIfExists(tempFile);
                } catch (final IOException cleanupFailure) {
                    e.addSuppressed(cleanupFailure);
                }
                throw new PersistenceWriteException(storeFile, e);
            }
        } finally {
            flushLock.unlock();
        }
    }

    private void removeStaleTempFile() {
        try {
            if (Files.deleteIfExists(tempFile)) {
                logger.warn("Removed stale temporary library file {}", tempFile);
            }
        } catch (final IOException e) {
            logger.warn("Could not remove stale temporary library file {}", tempFile, e);
        }
    }

    /**
     * Cancel the pending throttled flush and write the final state.
     */
    @Override
    public void close() {
        flushThrottler.close();
        try {
            writeFile();
        } catch (final PersistenceWriteException e) {
            logger.error("Final flush of {} failed", storeFile, e);
        }
    }
}

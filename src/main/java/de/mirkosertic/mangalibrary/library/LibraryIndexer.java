package de.mirkosertic.mangalibrary.library;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Derives {@link CollectionRecord}s from the directory tree and writes them to the
 * {@link LibraryStore}.
 * <p>
 * A collection is always re-read completely from disk rather than patched from the
 * event that triggered the update, so the store cannot drift away from what is
 * actually on disk. Directory listings happen outside the store lock; only the merge
 * into the existing record runs under it.
 */
public class LibraryIndexer {

    private static final Logger logger = LoggerFactory.getLogger(LibraryIndexer.class);

    private final Path libraryRoot;
    private final String chapterExtension;
    private final LibraryStore store;
    private final Clock clock;

    public LibraryIndexer(final Path libraryRoot, final String chapterExtension, final LibraryStore store) {
        this(libraryRoot, chapterExtension, store, Clock.systemUTC());
    }

    public LibraryIndexer(final Path libraryRoot, final String chapterExtension, final LibraryStore store, final Clock clock) {
        this.libraryRoot = libraryRoot.toAbsolutePath().normalize();
        this.chapterExtension = chapterExtension;
        this.store = store;
        this.clock = clock;
    }

    /**
     * Re-derive the record of one collection from its directory. A missing directory
     * removes the record.
     *
     * @return the updated record, or {@code null} if the collection no longer exists
     * @throws IOException if the directory exists but cannot be listed
     */
    @Nullable
    public CollectionRecord refreshCollection(final String collectionId) throws IOException {
        final Path directory = libraryRoot.resolve(collectionId);

        if (!Files.isDirectory(directory)) {
            removeCollection(collectionId);
            return null;
        }

        final Set<String> chapterFiles;
        try {
            chapterFiles = listChapterFiles(directory);
        } catch (final NoSuchFileException e) {
            // Directory vanished between the check and the listing
            removeCollection(collectionId);
            return null;
        }

        final Instant now = clock.instant();
        final CollectionRecord updated = store.update(collectionId, existing -> existing != null
                ? existing.withChapterFiles(directory, chapterFiles, now)
                : CollectionRecord.create(collectionId, directory, chapterFiles, now));

        logger.debug("Refreshed collection {} with {} chapters", collectionId, chapterFiles.size());
        return updated;
    }

    /**
     * Move a collection record to a new id, keeping its creation time, then re-read the
     * renamed directory. Chapters written into it before it was watched are picked up
     * that way. Falls back to a fresh {@link #refreshCollection(String)} when the old
     * id is unknown.
     *
     * @return the record stored under {@code newId} afterwards, or {@code null}
     */
    @Nullable
    public CollectionRecord renameCollection(final String oldId, final String newId) throws IOException {
        final Path newPath = libraryRoot.resolve(newId);
        final Instant now = clock.instant();
        final CollectionRecord renamed = store.rename(oldId, newId, existing -> existing.renamedTo(newId, newPath, now));
        if (renamed == null) {
            logger.debug("Renamed collection {} was not indexed, indexing {} from disk", oldId, newId);
        } else {
            logger.info("Collection renamed: {} -> {}", oldId, newId);
        }
        return refreshCollection(newId);
    }

    /**
     * @return true if a record was removed
     */
    public boolean removeCollection(final String collectionId) {
        final boolean removed = store.delete(collectionId);
        if (removed) {
            logger.info("Collection removed: {}", collectionId);
        }
        return removed;
    }

    /**
     * Bring the whole store in line with the directory tree: refresh every collection
     * directory and drop records whose directory has disappeared.
     *
     * @return number of collections present after the scan
     * @throws IOException if the library root cannot be listed
     */
    public int scanAll() throws IOException {
        final long startTime = System.currentTimeMillis();

        final Set<String> onDisk = new LinkedHashSet<>();
        try (final Stream<Path> entries = Files.list(libraryRoot)) {
            entries.filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .sorted()
                    .forEach(onDisk::add);
        }

        int failed = 0;
        for (final String collectionId : onDisk) {
            try {
                refreshCollection(collectionId);
            } catch (final IOException e) {
                failed++;
                logger.error("Failed to scan collection {}", collectionId, e);
            }
        }

        final Set<String> orphans = new HashSet<>(store.snapshot().ids());
        orphans.removeAll(onDisk);
        for (final String orphan : orphans) {
            removeCollection(orphan);
        }

        logger.info("Library scan finished in {}ms: collections={}, removed={}, failed={}",
                System.currentTimeMillis() - startTime, onDisk.size(), orphans.size(), failed);
        return store.size();
    }

    /**
     * Whether the given file name is a chapter archive. Matching is case-sensitive.
     */
    public boolean isChapterFile(final String fileName) {
        return fileName.endsWith(chapterExtension);
    }

    public Path getLibraryRoot() {
        return libraryRoot;
    }

    private Set<String> listChapterFiles(final Path directory) throws IOException {
        final Set<String> result = new LinkedHashSet<>();
        try (final Stream<Path> entries = Files.list(directory)) {
            entries.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .filter(this::isChapterFile)
                    .forEach(result::add);
        }
        return result;
    }
}

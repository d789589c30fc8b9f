package de.mirkosertic.mangalibrary.library;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * One collection of the library: a first-level directory below the library root
 * together with the chapter archives found directly inside it.
 * <p>
 * Instances are immutable. Changes produce a new record through the copy
 * methods, which always move {@code lastUpdated} forward and never touch
 * {@code createdAt}.
 */
public record CollectionRecord(
        /** Name of the collection directory, also the key in the store. */
        String id,
        /** Absolute path of the collection directory. */
        Path path,
        /** When the collection was first detected. */
        Instant createdAt,
        /** When the record was last changed. */
        Instant lastUpdated,
        /** File names of the chapter archives inside the collection directory. */
        Set<String> chapterFiles
) {

    public CollectionRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(lastUpdated, "lastUpdated");
        chapterFiles = Set.copyOf(chapterFiles);
    }

    /**
     * Create the record of a collection seen for the first time.
     */
    public static CollectionRecord create(final String id, final Path path, final Set<String> chapterFiles, final Instant now) {
        return new CollectionRecord(id, path, now, now, chapterFiles);
    }

    /** Always equal to the number of chapter files. */
    public int totalChapters() {
        return chapterFiles.size();
    }

    public CollectionRecord withChapterFiles(final Path newPath, final Set<String> newChapterFiles, final Instant now) {
        return new CollectionRecord(id, newPath, createdAt, now, newChapterFiles);
    }

    public CollectionRecord renamedTo(final String newId, final Path newPath, final Instant now) {
        return new CollectionRecord(newId, newPath, createdAt, now, chapterFiles);
    }
}

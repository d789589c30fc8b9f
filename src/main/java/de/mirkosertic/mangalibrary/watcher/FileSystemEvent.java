package de.mirkosertic.mangalibrary.watcher;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A raw notification from a {@link FileSystemEventSource}.
 */
public record FileSystemEvent(
        Kind kind,
        /** Whether the affected entry is (or was) a directory. */
        boolean directory,
        /** The created or deleted path, or the old path of a move. */
        Path sourcePath,
        /** The new path of a move, {@code null} for other kinds. */
        @Nullable Path destinationPath
) {

    public enum Kind {
        CREATED,
        DELETED,
        MOVED
    }

    public FileSystemEvent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(sourcePath, "sourcePath");
        if (kind == Kind.MOVED && destinationPath == null) {
            throw new IllegalArgumentException("A move needs a destination path");
        }
    }

    public static FileSystemEvent created(final Path path, final boolean directory) {
        return new FileSystemEvent(Kind.CREATED, directory, path, null);
    }

    public static FileSystemEvent deleted(final Path path, final boolean directory) {
        return new FileSystemEvent(Kind.DELETED, directory, path, null);
    }

    public static FileSystemEvent moved(final Path from, final Path to, final boolean directory) {
        return new FileSystemEvent(Kind.MOVED, directory, from, to);
    }

    /** The destination for moves, the source path otherwise. */
    public Path effectivePath() {
        return destinationPath != null ? destinationPath : sourcePath;
    }
}

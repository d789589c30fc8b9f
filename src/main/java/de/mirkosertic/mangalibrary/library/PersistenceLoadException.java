package de.mirkosertic.mangalibrary.library;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The library file exists but could not be read or parsed. The store starts empty.
 */
public class PersistenceLoadException extends IOException {

    private final Path file;

    public PersistenceLoadException(final Path file, final Throwable cause) {
        super("Failed to load library file " + file + ": " + cause.getMessage(), cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}

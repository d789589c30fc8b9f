package de.mirkosertic.mangalibrary.library;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writing the library file failed. The in-memory state is unaffected and the
 * previous file, if any, is still in place.
 */
public class PersistenceWriteException extends IOException {

    private final Path file;

    public PersistenceWriteException(final Path file, final Throwable cause) {
        super("Failed to write library file " + file + ": " + cause.getMessage(), cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}

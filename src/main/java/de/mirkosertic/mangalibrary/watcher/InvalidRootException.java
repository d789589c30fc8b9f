package de.mirkosertic.mangalibrary.watcher;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The library root to watch does not exist or is not a directory.
 */
public class InvalidRootException extends IOException {

    private final Path root;

    public InvalidRootException(final Path root, final String reason) {
        super("Invalid library root " + root + ": " + reason);
        this.root = root;
    }

    public Path getRoot() {
        return root;
    }
}

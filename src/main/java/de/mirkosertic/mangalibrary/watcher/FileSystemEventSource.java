package de.mirkosertic.mangalibrary.watcher;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Delivers recursive filesystem notifications for one root directory.
 * <p>
 * Events for the same path are delivered in the order they were generated; events
 * for unrelated paths may be reordered.
 */
public interface FileSystemEventSource {

    /**
     * Subscribe to notifications below {@code root} and start delivering them to
     * {@code listener} on a background thread.
     */
    void start(Path root, FileSystemEventListener listener) throws IOException;

    /**
     * Unsubscribe and block until no further notification will be delivered.
     */
    void stop();
}

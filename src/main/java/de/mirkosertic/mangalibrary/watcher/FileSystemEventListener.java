package de.mirkosertic.mangalibrary.watcher;

public interface FileSystemEventListener {

    void onEvent(FileSystemEvent event);

    /**
     * Notifications were lost; the receiver should resynchronise from disk.
     */
    default void onOverflow() {
    }
}

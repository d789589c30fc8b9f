package de.mirkosertic.mangalibrary;

import de.mirkosertic.mangalibrary.config.ApplicationConfig;
import de.mirkosertic.mangalibrary.library.LibraryIndexer;
import de.mirkosertic.mangalibrary.library.LibrarySnapshot;
import de.mirkosertic.mangalibrary.library.LibraryStore;
import de.mirkosertic.mangalibrary.reconcile.LibraryChangeListener;
import de.mirkosertic.mangalibrary.reconcile.LibraryChangePublisher;
import de.mirkosertic.mangalibrary.reconcile.LoggingLibraryChangeListener;
import de.mirkosertic.mangalibrary.watcher.DirectoryWatcherService;
import de.mirkosertic.mangalibrary.watcher.FileSystemEventSource;
import de.mirkosertic.mangalibrary.watcher.WatchServiceEventSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Owns every component of one library instance. Built once at process start and
 * handed to whoever needs the store, for example a serving layer reading
 * {@link #snapshot()}.
 */
public class MangaLibraryContext {

    private static final Logger logger = LoggerFactory.getLogger(MangaLibraryContext.class);

    private final LibraryStore store;
    private final LibraryIndexer indexer;
    private final DirectoryWatcherService watcherService;
    private final LibraryChangePublisher changePublisher;

    public MangaLibraryContext(final ApplicationConfig config) {
        this(config, new WatchServiceEventSource(config.getWatchPollIntervalMs()));
    }

    public MangaLibraryContext(final ApplicationConfig config, final FileSystemEventSource eventSource) {
        // Initialize services in dependency order
        this.store = new LibraryStore(config.getStoreFile(), config.getFlushThrottleMs());

        this.indexer = new LibraryIndexer(config.getLibraryPath(), config.getChapterExtension(), store);

        this.watcherService = new DirectoryWatcherService(indexer, eventSource, config.isScanOnStart());

        this.changePublisher = new LibraryChangePublisher(store, config.getChangeThrottleMs());
        this.changePublisher.addListener(new LoggingLibraryChangeListener());
        this.store.addChangeListener(changePublisher::scheduleUpdate);
    }

    /**
     * Load the persisted library.
     */
    public void init() {
        logger.info("Initializing manga library...");
        store.init();
        // Changes are reported relative to the persisted library
        changePublisher.resetBaseline();
        logger.info("Manga library initialized with {} collections", store.size());
    }

    /**
     * Start watching the library root.
     *
     * @throws IOException if the root is invalid or cannot be watched
     */
    public void start() throws IOException {
        watcherService.start();
    }

    public void addChangeListener(final LibraryChangeListener listener) {
        changePublisher.addListener(listener);
    }

    public LibrarySnapshot snapshot() {
        return store.snapshot();
    }

    public LibraryStore getStore() {
        return store;
    }

    public LibraryIndexer getIndexer() {
        return indexer;
    }

    public DirectoryWatcherService getWatcherService() {
        return watcherService;
    }

    public LibraryChangePublisher getChangePublisher() {
        return changePublisher;
    }

    /**
     * Shutdown all services gracefully, in reverse order of initialization.
     */
    public void shutdown() {
        logger.info("Shutting down manga library...");

        try {
            watcherService.stop();
        } catch (final Exception e) {
            logger.error("Error stopping directory watcher", e);
        }

        try {
            changePublisher.close();
            changePublisher.publishNow();
        } catch (final Exception e) {
            logger.error("Error closing change publisher", e);
        }

        try {
            store.close();
        } catch (final Exception e) {
            logger.error("Error closing library store", e);
        }

        logger.info("Manga library shutdown complete");
    }
}

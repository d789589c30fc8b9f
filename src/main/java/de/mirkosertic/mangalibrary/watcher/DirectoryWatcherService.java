package de.mirkosertic.mangalibrary.watcher;

import de.mirkosertic.mangalibrary.library.LibraryIndexer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Keeps the library store in sync with the directory tree below the library root.
 * <p>
 * Notifications from the {@link FileSystemEventSource} are classified and turned
 * into collection updates. Each event is handled in isolation: a failure for one
 * collection is logged and does not affect the processing of other events.
 */
public class DirectoryWatcherService implements FileSystemEventListener {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryWatcherService.class);

    public enum WatcherState {
        STOPPED,
        WATCHING
    }

    private final Path libraryRoot;
    private final LibraryIndexer indexer;
    private final FileSystemEventSource eventSource;
    private final LibraryEventClassifier classifier;
    private final boolean scanOnStart;

    private volatile WatcherState state = WatcherState.STOPPED;

    public DirectoryWatcherService(final LibraryIndexer indexer,
                                   final FileSystemEventSource eventSource,
                                   final boolean scanOnStart) {
        this.libraryRoot = indexer.getLibraryRoot();
        this.indexer = indexer;
        this.eventSource = eventSource;
        this.classifier = new LibraryEventClassifier(libraryRoot);
        this.scanOnStart = scanOnStart;
    }

    /**
     * Subscribe to the library root and, if configured, bring the store up to date
     * with a full scan. Does nothing if already watching.
     *
     * @throws InvalidRootException if the root does not exist or is not a directory
     * @throws IOException          if the subscription fails
     */
    public synchronized void start() throws IOException {
        if (state == WatcherState.WATCHING) {
            logger.info("Already watching {}", libraryRoot);
            return;
        }
        if (!Files.exists(libraryRoot)) {
            throw new InvalidRootException(libraryRoot, "does not exist");
        }
        if (!Files.isDirectory(libraryRoot)) {
            throw new InvalidRootException(libraryRoot, "is not a directory");
        }

        // Subscribe before scanning so that nothing changed during the scan is missed
        eventSource.start(libraryRoot, this);
        state = WatcherState.WATCHING;
        logger.info("Started watching: {}", libraryRoot);

        if (scanOnStart) {
            try {
                indexer.scanAll();
            } catch (final IOException e) {
                logger.error("Initial scan of {} failed", libraryRoot, e);
            }
        }
    }

    /**
     * Unsubscribe and wait until the notification thread has finished. No store
     * mutation happens after this method returns. Does nothing if not watching.
     */
    public synchronized void stop() {
        if (state == WatcherState.STOPPED) {
            logger.info("Watcher for {} is not running", libraryRoot);
            return;
        }
        eventSource.stop();
        state = WatcherState.STOPPED;
        logger.info("Stopped watching: {}", libraryRoot);
    }

    public WatcherState getState() {
        return state;
    }

    @Override
    public void onEvent(final FileSystemEvent event) {
        final LibraryEvent libraryEvent = classifier.classify(event);
        if (!libraryEvent.isRelevant()) {
            return;
        }

        try {
            handle(libraryEvent);
        } catch (final Exception e) {
            logger.error("Error handling {} for collection {}", libraryEvent.type(), libraryEvent.collectionId(), e);
        }
    }

    @Override
    public void onOverflow() {
        logger.warn("Filesystem notifications were lost, rescanning {}", libraryRoot);
        try {
            indexer.scanAll();
        } catch (final IOException e) {
            logger.error("Rescan of {} after overflow failed", libraryRoot, e);
        }
    }

    void handle(final LibraryEvent event) throws IOException {
        final String collectionId = event.collectionId();
        if (collectionId == null) {
            return;
        }

        switch (event.type()) {
            case COLLECTION_CREATED:
                indexer.refreshCollection(collectionId);
                logger.info("New collection: {}", collectionId);
                break;

            case COLLECTION_RENAMED:
                final String oldId = event.previousCollectionId();
                if (oldId != null) {
                    indexer.renameCollection(oldId, collectionId);
                } else {
                    indexer.refreshCollection(collectionId);
                }
                break;

            case COLLECTION_REMOVED:
                indexer.removeCollection(collectionId);
                break;

            case CHAPTER_ADDED:
            case CHAPTER_REMOVED:
            case CHAPTER_RENAMED:
                if (!concernsChapterFile(event)) {
                    logger.debug("Ignoring non-chapter file {} in {}", event.chapterFile(), collectionId);
                    return;
                }
                logger.debug("{} in {}: {}", event.type(), collectionId, event.chapterFile());
                indexer.refreshCollection(collectionId);
                final String previousCollection = event.previousCollectionId();
                if (previousCollection != null) {
                    indexer.refreshCollection(previousCollection);
                }
                break;

            default:
                break;
        }
    }

    private boolean concernsChapterFile(final LibraryEvent event) {
        final String file = event.chapterFile();
        final String previousFile = event.previousChapterFile();
        return (file != null && indexer.isChapterFile(file))
                || (previousFile != null && indexer.isChapterFile(previousFile));
    }
}

package de.mirkosertic.mangalibrary.watcher;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * {@link FileSystemEventSource} on top of the JDK {@link WatchService}.
 * <p>
 * The WatchService only reports creations and deletions per directory, so this
 * source adds what the library needs on top:
 * <ul>
 *   <li>every directory below the root is registered, new ones as soon as they appear,</li>
 *   <li>deleted entries are known to be directories if they were registered,</li>
 *   <li>a deletion directly followed by a creation of the same kind within one
 *       batch of the same directory is reported as a single move, provided the
 *       deleted entry is really gone and a created directory was not watched before.</li>
 * </ul>
 * An unrelated deletion and creation that land next to each other in one batch are
 * indistinguishable from a rename and are still reported as a move.
 */
public class WatchServiceEventSource implements FileSystemEventSource {

    private static final Logger logger = LoggerFactory.getLogger(WatchServiceEventSource.class);

    private final long pollIntervalMs;
    private final Map<WatchKey, Path> watchKeys = new ConcurrentHashMap<>();
    private final Map<Path, WatchKey> watchedDirectories = new ConcurrentHashMap<>();

    @Nullable
    private volatile WatchService watchService;
    @Nullable
    private ExecutorService watchExecutor;
    @Nullable
    private volatile FileSystemEventListener listener;

    public WatchServiceEventSource(final long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    @Override
    public synchronized void start(final Path root, final FileSystemEventListener listener) throws IOException {
        if (watchExecutor != null) {
            throw new IllegalStateException("Event source already started");
        }
        this.listener = listener;
        this.watchService = FileSystems.getDefault().newWatchService();

        try {
            registerRecursive(root.toAbsolutePath().normalize());
        } catch (final IOException e) {
            closeWatchService();
            throw e;
        }

        final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            final Thread thread = new Thread(r, "directory-watcher");
            thread.setDaemon(true);
            return thread;
        });
        executor.execute(this::processEvents);
        watchExecutor = executor;
    }

    @Override
    public synchronized void stop() {
        final ExecutorService executor = watchExecutor;
        if (executor == null) {
            return;
        }
        logger.info("Stopping directory watcher");
        closeWatchService();
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Directory watcher thread did not terminate in time");
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for directory watcher thread");
        }
        watchExecutor = null;
        listener = null;
        watchKeys.clear();
        watchedDirectories.clear();
    }

    private void closeWatchService() {
        final WatchService service = watchService;
        watchService = null;
        if (service != null) {
            try {
                service.close();
            } catch (final IOException e) {
                logger.warn("Error closing watch service", e);
            }
        }
    }

    private void registerRecursive(final Path directory) throws IOException {
        final WatchService service = watchService;
        if (service == null) {
            return;
        }
        Files.walkFileTree(directory, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(final Path dir, final BasicFileAttributes attrs) throws IOException {
                final WatchKey key = dir.register(service, ENTRY_CREATE, ENTRY_DELETE);
                watchKeys.put(key, dir);
                watchedDirectories.put(dir, key);
                logger.debug("Registered watch for directory: {}", dir);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(final Path file, final IOException exc) {
                logger.warn("Cannot watch {}", file, exc);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void unregisterRecursive(final Path directory) {
        final Iterator<Map.Entry<Path, WatchKey>> it = watchedDirectories.entrySet().iterator();
        while (it.hasNext()) {
            final Map.Entry<Path, WatchKey> entry = it.next();
            if (entry.getKey().startsWith(directory)) {
                entry.getValue().cancel();
                watchKeys.remove(entry.getValue());
                it.remove();
                logger.debug("Unregistered watch for directory: {}", entry.getKey());
            }
        }
    }

    private void processEvents() {
        logger.info("Directory watcher started");

        while (!Thread.currentThread().isInterrupted()) {
            final WatchService service = watchService;
            if (service == null) {
                break;
            }

            final WatchKey key;
            try {
                key = service.poll(pollIntervalMs, TimeUnit.MILLISECONDS);
                if (key == null) {
                    continue;
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (final ClosedWatchServiceException e) {
                logger.info("Watch service closed");
                break;
            }

            final Path directory = watchKeys.get(key);
            if (directory == null) {
                logger.warn("Watch key not recognized");
                key.reset();
                continue;
            }

            final List<WatchEvent<?>> batch = key.pollEvents();
            if (!Thread.currentThread().isInterrupted()) {
                dispatchBatch(directory, batch);
            }

            final boolean valid = key.reset();
            if (!valid) {
                // The directory stays known until its parent reports the deletion
                watchKeys.remove(key);
                logger.debug("Watch key for {} no longer valid", directory);
            }
        }

        logger.info("Directory watcher stopped");
    }

    private void dispatchBatch(final Path directory, final List<WatchEvent<?>> batch) {
        final FileSystemEventListener target = listener;
        if (target == null) {
            return;
        }
        for (final FileSystemEvent event : translateBatch(directory, batch, watchedDirectories::containsKey)) {
            try {
                if (event.directory()) {
                    updateRegistrations(event);
                }
                target.onEvent(event);
            } catch (final Exception e) {
                logger.error("Error processing watch event for: {}", event.effectivePath(), e);
            }
        }
    }

    /**
     * Turn one batch of raw events of a directory into library notifications, pairing
     * a deletion that is directly followed by a creation of the same kind into a move.
     * An overflow is forwarded to the listener immediately.
     *
     * @param watched tells whether a path is a directory registered with the watch service
     */
    List<FileSystemEvent> translateBatch(final Path directory, final List<WatchEvent<?>> batch,
                                         final Predicate<Path> watched) {
        final List<FileSystemEvent> result = new ArrayList<>();
        FileSystemEvent pendingDelete = null;

        for (final WatchEvent<?> event : batch) {
            final WatchEvent.Kind<?> kind = event.kind();

            if (kind == OVERFLOW) {
                logger.warn("Watch event overflow in {}", directory);
                final FileSystemEventListener target = listener;
                if (target != null) {
                    target.onOverflow();
                }
                continue;
            }

            final Path fullPath = directory.resolve((Path) event.context());

            if (kind == ENTRY_DELETE) {
                if (pendingDelete != null) {
                    result.add(pendingDelete);
                }
                pendingDelete = FileSystemEvent.deleted(fullPath, watched.test(fullPath));
            } else if (kind == ENTRY_CREATE) {
                final boolean isDirectory = Files.isDirectory(fullPath);
                if (pendingDelete != null && pendingDelete.directory() == isDirectory
                        && !Files.exists(pendingDelete.sourcePath())
                        && !(isDirectory && watched.test(fullPath))) {
                    result.add(FileSystemEvent.moved(pendingDelete.sourcePath(), fullPath, isDirectory));
                } else {
                    if (pendingDelete != null) {
                        result.add(pendingDelete);
                    }
                    result.add(FileSystemEvent.created(fullPath, isDirectory));
                }
                pendingDelete = null;
            }
        }

        if (pendingDelete != null) {
            result.add(pendingDelete);
        }
        return result;
    }

    private void updateRegistrations(final FileSystemEvent event) throws IOException {
        switch (event.kind()) {
            case CREATED:
                registerRecursive(event.sourcePath());
                break;
            case DELETED:
                unregisterRecursive(event.sourcePath());
                break;
            case MOVED:
                unregisterRecursive(event.sourcePath());
                final Path destination = event.destinationPath();
                if (destination != null) {
                    registerRecursive(destination);
                }
                break;
            default:
                break;
        }
    }
}

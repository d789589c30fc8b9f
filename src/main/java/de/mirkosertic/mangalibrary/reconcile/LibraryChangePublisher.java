package de.mirkosertic.mangalibrary.reconcile;

import de.mirkosertic.mangalibrary.library.CollectionRecord;
import de.mirkosertic.mangalibrary.library.LibrarySnapshot;
import de.mirkosertic.mangalibrary.library.LibraryStore;
import de.mirkosertic.mangalibrary.util.Throttler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Tells interested parties what changed in the library since the last time they
 * were told.
 * <p>
 * The publisher remembers the snapshot it published last. Each publication
 * compares it with the store's current snapshot and hands the resulting
 * {@link LibraryDiff} to every registered {@link LibraryChangeListener}.
 * Publications requested through {@link #scheduleUpdate()} are throttled, so a
 * burst of filesystem changes is reported as one consolidated diff. Since the diff
 * is computed between whole snapshots, a missed or reordered request never loses a
 * change; it is reported with the next publication.
 */
public class LibraryChangePublisher implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(LibraryChangePublisher.class);

    private final LibraryStore store;
    private final Throttler throttler;
    private final List<LibraryChangeListener> listeners = new CopyOnWriteArrayList<>();

    private LibrarySnapshot lastPublished;

    public LibraryChangePublisher(final LibraryStore store, final long throttleMs) {
        this.store = store;
        this.throttler = new Throttler("library-changes", throttleMs);
        this.lastPublished = store.snapshot();
    }

    public void addListener(final LibraryChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(final LibraryChangeListener listener) {
        listeners.remove(listener);
    }

    /**
     * Request a publication, subject to the throttle window.
     */
    public void scheduleUpdate() {
        throttler.schedule(this::publishNow);
    }

    /**
     * Publish the changes since the last publication immediately.
     *
     * @return the published diff, empty if nothing changed
     */
    public synchronized LibraryDiff publishNow() {
        final LibrarySnapshot current = store.snapshot();
        final LibraryDiff diff = SnapshotReconciler.reconcile(lastPublished, current);

        if (!diff.isEmpty()) {
            logger.debug("Publishing library changes: added={}, removed={}, collectionsWithNewChapters={}, collectionsWithRemovedChapters={}",
                    diff.addedCollections().size(), diff.removedCollections().size(),
                    diff.addedChapters().size(), diff.removedChapters().size());
            for (final LibraryChangeListener listener : listeners) {
                dispatch(listener, diff, lastPublished, current);
            }
        }

        lastPublished = current;
        return diff;
    }

    /**
     * Take the store's current snapshot as published without notifying anyone.
     */
    public synchronized void resetBaseline() {
        lastPublished = store.snapshot();
    }

    public synchronized LibrarySnapshot getLastPublished() {
        return lastPublished;
    }

    private void dispatch(final LibraryChangeListener listener, final LibraryDiff diff,
                          final LibrarySnapshot previous, final LibrarySnapshot current) {
        try {
            for (final String id : diff.removedCollections()) {
                final CollectionRecord removed = previous.get(id);
                if (removed != null) {
                    listener.onCollectionRemoved(removed);
                }
            }
            for (final String id : diff.addedCollections()) {
                final CollectionRecord added = current.get(id);
                if (added != null) {
                    listener.onCollectionAdded(added);
                }
            }
            for (final Map.Entry<String, Set<String>> entry : diff.removedChapters().entrySet()) {
                listener.onChaptersRemoved(entry.getKey(), entry.getValue());
            }
            for (final Map.Entry<String, Set<String>> entry : diff.addedChapters().entrySet()) {
                listener.onChaptersAdded(entry.getKey(), entry.getValue());
            }
        } catch (final RuntimeException e) {
            logger.error("Library change listener {} failed", listener, e);
        }
    }

    @Override
    public void close() {
        throttler.close();
    }
}

package de.mirkosertic.mangalibrary.reconcile;

import de.mirkosertic.mangalibrary.library.CollectionRecord;
import de.mirkosertic.mangalibrary.library.LibrarySnapshot;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Computes the {@link LibraryDiff} between two snapshots.
 * <p>
 * The computation has no side effects and sorts every result, so equal inputs
 * always give equal output and reconciling a snapshot with itself gives an
 * empty diff.
 */
public final class SnapshotReconciler {

    private SnapshotReconciler() {
    }

    public static LibraryDiff reconcile(final LibrarySnapshot previous, final LibrarySnapshot current) {
        final SortedSet<String> added = new TreeSet<>(current.ids());
        added.removeAll(previous.ids());

        final SortedSet<String> removed = new TreeSet<>(previous.ids());
        removed.removeAll(current.ids());

        final SortedMap<String, Set<String>> addedChapters = new TreeMap<>();
        final SortedMap<String, Set<String>> removedChapters = new TreeMap<>();

        for (final Map.Entry<String, CollectionRecord> entry : current.collections().entrySet()) {
            final CollectionRecord before = previous.get(entry.getKey());
            if (before == null) {
                continue;
            }
            final Set<String> oldFiles = before.chapterFiles();
            final Set<String> newFiles = entry.getValue().chapterFiles();

            final SortedSet<String> appeared = new TreeSet<>(newFiles);
            appeared.removeAll(oldFiles);
            if (!appeared.isEmpty()) {
                addedChapters.put(entry.getKey(), Collections.unmodifiableSortedSet(appeared));
            }

            final SortedSet<String> disappeared = new TreeSet<>(oldFiles);
            disappeared.removeAll(newFiles);
            if (!disappeared.isEmpty()) {
                removedChapters.put(entry.getKey(), Collections.unmodifiableSortedSet(disappeared));
            }
        }

        if (added.isEmpty() && removed.isEmpty() && addedChapters.isEmpty() && removedChapters.isEmpty()) {
            return LibraryDiff.empty();
        }

        return new LibraryDiff(
                Collections.unmodifiableSortedSet(added),
                Collections.unmodifiableSortedSet(removed),
                Collections.unmodifiableSortedMap(addedChapters),
                Collections.unmodifiableSortedMap(removedChapters)
        );
    }
}

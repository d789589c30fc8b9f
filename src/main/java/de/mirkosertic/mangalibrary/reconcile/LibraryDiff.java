package de.mirkosertic.mangalibrary.reconcile;

import java.util.Map;
import java.util.Set;

/**
 * Immutable difference between two library snapshots.
 * <p>
 * Chapters of newly added collections are not listed in {@link #addedChapters()};
 * they are implied by the collection being new.
 */
public record LibraryDiff(
        /** Collection ids present only in the newer snapshot. */
        Set<String> addedCollections,
        /** Collection ids present only in the older snapshot. */
        Set<String> removedCollections,
        /** Per collection present in both snapshots, chapter files that appeared. */
        Map<String, Set<String>> addedChapters,
        /** Per collection present in both snapshots, chapter files that disappeared. */
        Map<String, Set<String>> removedChapters
) {

    private static final LibraryDiff EMPTY = new LibraryDiff(Set.of(), Set.of(), Map.of(), Map.of());

    public static LibraryDiff empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return addedCollections.isEmpty()
                && removedCollections.isEmpty()
                && addedChapters.isEmpty()
                && removedChapters.isEmpty();
    }
}

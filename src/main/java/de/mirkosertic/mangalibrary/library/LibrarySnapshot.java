package de.mirkosertic.mangalibrary.library;

import org.jspecify.annotations.Nullable;

import java.util.Map;
import java.util.Set;

/**
 * Immutable point-in-time copy of the whole library, keyed by collection id.
 */
public record LibrarySnapshot(Map<String, CollectionRecord> collections) {

    private static final LibrarySnapshot EMPTY = new LibrarySnapshot(Map.of());

    public LibrarySnapshot {
        collections = Map.copyOf(collections);
    }

    public static LibrarySnapshot empty() {
        return EMPTY;
    }

    @Nullable
    public CollectionRecord get(final String id) {
        return collections.get(id);
    }

    public boolean contains(final String id) {
        return collections.containsKey(id);
    }

    public Set<String> ids() {
        return collections.keySet();
    }

    public int size() {
        return collections.size();
    }

    public boolean isEmpty() {
        return collections.isEmpty();
    }
}

package de.mirkosertic.mangalibrary.reconcile;

import de.mirkosertic.mangalibrary.library.CollectionRecord;

import java.util.Set;

/**
 * Receives the changes found by the {@link LibraryChangePublisher}. Chapter
 * callbacks are only made with non-empty sets.
 */
public interface LibraryChangeListener {

    void onCollectionAdded(CollectionRecord collection);

    void onCollectionRemoved(CollectionRecord collection);

    void onChaptersAdded(String collectionId, Set<String> chapterFiles);

    void onChaptersRemoved(String collectionId, Set<String> chapterFiles);
}

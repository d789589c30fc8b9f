package de.mirkosertic.mangalibrary.reconcile;

import de.mirkosertic.mangalibrary.library.CollectionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

public class LoggingLibraryChangeListener implements LibraryChangeListener {

    private static final Logger logger = LoggerFactory.getLogger(LoggingLibraryChangeListener.class);

    @Override
    public void onCollectionAdded(final CollectionRecord collection) {
        logger.info("Collection added: {} ({} chapters)", collection.id(), collection.totalChapters());
    }

    @Override
    public void onCollectionRemoved(final CollectionRecord collection) {
        logger.info("Collection removed: {}", collection.id());
    }

    @Override
    public void onChaptersAdded(final String collectionId, final Set<String> chapterFiles) {
        logger.info("Chapters added to {}: {}", collectionId, chapterFiles);
    }

    @Override
    public void onChaptersRemoved(final String collectionId, final Set<String> chapterFiles) {
        logger.info("Chapters removed from {}: {}", collectionId, chapterFiles);
    }
}

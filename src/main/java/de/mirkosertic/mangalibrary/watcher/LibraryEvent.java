package de.mirkosertic.mangalibrary.watcher;

import org.jspecify.annotations.Nullable;

/**
 * A filesystem notification interpreted in terms of the library structure.
 */
public record LibraryEvent(
        Type type,
        /** The affected collection; for renames the new id. {@code null} only for {@link Type#IRRELEVANT}. */
        @Nullable String collectionId,
        /** Old collection id for collection renames and for chapters moved between collections. */
        @Nullable String previousCollectionId,
        /** The affected chapter file name; for chapter renames the new name. */
        @Nullable String chapterFile,
        /** Old chapter file name for chapter renames. */
        @Nullable String previousChapterFile
) {

    private static final LibraryEvent IRRELEVANT_EVENT = new LibraryEvent(Type.IRRELEVANT, null, null, null, null);

    public enum Type {
        COLLECTION_CREATED,
        COLLECTION_REMOVED,
        COLLECTION_RENAMED,
        CHAPTER_ADDED,
        CHAPTER_REMOVED,
        CHAPTER_RENAMED,
        IRRELEVANT
    }

    public static LibraryEvent irrelevant() {
        return IRRELEVANT_EVENT;
    }

    public static LibraryEvent collection(final Type type, final String collectionId) {
        return new LibraryEvent(type, collectionId, null, null, null);
    }

    public static LibraryEvent collectionRenamed(final String oldId, final String newId) {
        return new LibraryEvent(Type.COLLECTION_RENAMED, newId, oldId, null, null);
    }

    public static LibraryEvent chapter(final Type type, final String collectionId, final String chapterFile) {
        return new LibraryEvent(type, collectionId, null, chapterFile, null);
    }

    public static LibraryEvent chapterRenamed(final String oldCollectionId, final String oldFile,
                                              final String newCollectionId, final String newFile) {
        return new LibraryEvent(Type.CHAPTER_RENAMED, newCollectionId,
                oldCollectionId.equals(newCollectionId) ? null : oldCollectionId,
                newFile, oldFile);
    }

    public boolean isRelevant() {
        return type != Type.IRRELEVANT;
    }
}

package de.mirkosertic.mangalibrary.watcher;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Decides which filesystem notifications concern the library structure.
 * <p>
 * Only two levels below the root are of interest:
 * <ul>
 *   <li>directories whose parent is the root are collections,</li>
 *   <li>files whose grandparent is the root are chapters.</li>
 * </ul>
 * Everything else, including the root itself, deeper nesting and paths that
 * cannot be related to the root, is {@link LibraryEvent.Type#IRRELEVANT}.
 * Moves are resolved from whichever side lies at the right level.
 */
public class LibraryEventClassifier {

    private static final Logger logger = LoggerFactory.getLogger(LibraryEventClassifier.class);

    private final Path root;

    public LibraryEventClassifier(final Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public LibraryEvent classify(final FileSystemEvent event) {
        final LibraryEvent result = event.directory() ? classifyDirectory(event) : classifyFile(event);
        if (!result.isRelevant()) {
            logger.trace("Ignoring {} of {}", event.kind(), event.effectivePath());
        }
        return result;
    }

    private LibraryEvent classifyDirectory(final FileSystemEvent event) {
        switch (event.kind()) {
            case CREATED:
                return isCollection(event.sourcePath())
                        ? LibraryEvent.collection(LibraryEvent.Type.COLLECTION_CREATED, name(event.sourcePath()))
                        : LibraryEvent.irrelevant();
            case DELETED:
                return isCollection(event.sourcePath())
                        ? LibraryEvent.collection(LibraryEvent.Type.COLLECTION_REMOVED, name(event.sourcePath()))
                        : LibraryEvent.irrelevant();
            case MOVED:
                final Path from = event.sourcePath();
                final Path to = event.destinationPath();
                final boolean fromIsCollection = isCollection(from);
                final boolean toIsCollection = to != null && isCollection(to);
                if (fromIsCollection && toIsCollection) {
                    return LibraryEvent.collectionRenamed(name(from), name(to));
                } else if (toIsCollection) {
                    return LibraryEvent.collection(LibraryEvent.Type.COLLECTION_CREATED, name(to));
                } else if (fromIsCollection) {
                    return LibraryEvent.collection(LibraryEvent.Type.COLLECTION_REMOVED, name(from));
                }
                return LibraryEvent.irrelevant();
            default:
                return LibraryEvent.irrelevant();
        }
    }

    private LibraryEvent classifyFile(final FileSystemEvent event) {
        switch (event.kind()) {
            case CREATED:
                return isChapter(event.sourcePath())
                        ? chapterEvent(LibraryEvent.Type.CHAPTER_ADDED, event.sourcePath())
                        : LibraryEvent.irrelevant();
            case DELETED:
                return isChapter(event.sourcePath())
                        ? chapterEvent(LibraryEvent.Type.CHAPTER_REMOVED, event.sourcePath())
                        : LibraryEvent.irrelevant();
            case MOVED:
                final Path from = event.sourcePath();
                final Path to = event.destinationPath();
                final boolean fromIsChapter = isChapter(from);
                final boolean toIsChapter = to != null && isChapter(to);
                if (fromIsChapter && toIsChapter) {
                    return LibraryEvent.chapterRenamed(name(from.getParent()), name(from), name(to.getParent()), name(to));
                } else if (toIsChapter) {
                    return chapterEvent(LibraryEvent.Type.CHAPTER_ADDED, to);
                } else if (fromIsChapter) {
                    return chapterEvent(LibraryEvent.Type.CHAPTER_REMOVED, from);
                }
                return LibraryEvent.irrelevant();
            default:
                return LibraryEvent.irrelevant();
        }
    }

    private LibraryEvent chapterEvent(final LibraryEvent.Type type, final Path file) {
        return LibraryEvent.chapter(type, name(file.getParent()), name(file));
    }

    private boolean isCollection(final Path path) {
        return root.equals(parentOf(path));
    }

    private boolean isChapter(final Path path) {
        final Path parent = parentOf(path);
        return parent != null && root.equals(parent.getParent());
    }

    @Nullable
    private Path parentOf(final Path path) {
        if (!path.isAbsolute()) {
            logger.debug("Cannot relate relative path {} to library root {}", path, root);
            return null;
        }
        return path.normalize().getParent();
    }

    private static String name(final Path path) {
        return path.normalize().getFileName().toString();
    }

    public Path getRoot() {
        return root;
    }
}

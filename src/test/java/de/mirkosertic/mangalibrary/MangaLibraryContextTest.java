package de.mirkosertic.mangalibrary;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mangalibrary.config.ApplicationConfig;
import de.mirkosertic.mangalibrary.library.CollectionRecord;
import de.mirkosertic.mangalibrary.reconcile.LibraryChangeListener;
import de.mirkosertic.mangalibrary.watcher.DirectoryWatcherService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static de.mirkosertic.mangalibrary.TestLibraries.await;
import static de.mirkosertic.mangalibrary.TestLibraries.createCollection;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

@DisplayName("MangaLibraryContext Tests")
class MangaLibraryContextTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    @TempDir
    Path tempDir;

    private Path libraryRoot;
    private Path storeFile;
    private MangaLibraryContext context;

    @BeforeEach
    void setUp() throws IOException {
        libraryRoot = Files.createDirectories(tempDir.resolve("manga"));
        storeFile = tempDir.resolve("state").resolve("manga_library.json");
    }

    @AfterEach
    void tearDown() {
        if (context != null) {
            context.shutdown();
        }
    }

    private MangaLibraryContext createContext() {
        final Map<String, Object> library = new LinkedHashMap<>();
        library.put("root", libraryRoot.toString());
        library.put("store-file", storeFile.toString());
        library.put("flush-throttle-ms", 100);
        library.put("change-throttle-ms", 100);
        library.put("watch-poll-interval-ms", 50);
        final Map<String, Object> yaml = new LinkedHashMap<>();
        yaml.put("library", library);
        return new MangaLibraryContext(ApplicationConfig.fromYaml(yaml));
    }

    private boolean storeHas(final String id, final String... chapters) {
        final CollectionRecord record = context.snapshot().get(id);
        return record != null && record.chapterFiles().equals(Set.of(chapters));
    }

    @Test
    @DisplayName("Should index existing collections on start and follow later changes")
    void shouldFollowLibraryChanges() throws IOException {
        createCollection(libraryRoot, "Foo", "v1c1.cbz");
        context = createContext();
        final LibraryChangeListener listener = mock(LibraryChangeListener.class);
        context.addChangeListener(listener);
        context.init();
        context.start();

        assertThat(context.getWatcherService().getState()).isEqualTo(DirectoryWatcherService.WatcherState.WATCHING);
        assertThat(storeHas("Foo", "v1c1.cbz")).isTrue();

        // New collection with a chapter
        final Path bar = createCollection(libraryRoot, "Bar");
        await(() -> context.snapshot().contains("Bar"), WAIT, "collection Bar to be indexed");
        Files.write(bar.resolve("c1.cbz"), new byte[0]);
        await(() -> storeHas("Bar", "c1.cbz"), WAIT, "chapter c1.cbz to be indexed");

        // Non-chapter files are ignored
        Files.write(bar.resolve("cover.jpg"), new byte[0]);

        // Renamed collection
        Files.move(libraryRoot.resolve("Foo"), libraryRoot.resolve("Baz"));
        await(() -> storeHas("Baz", "v1c1.cbz") && !context.snapshot().contains("Foo"), WAIT, "Foo to be renamed to Baz");

        // Removed chapter, once its addition has been published
        await(() -> {
            final CollectionRecord published = context.getChangePublisher().getLastPublished().get("Bar");
            return published != null && published.chapterFiles().contains("c1.cbz");
        }, WAIT, "chapter c1.cbz to be published");
        Files.delete(bar.resolve("c1.cbz"));
        await(() -> storeHas("Bar"), WAIT, "chapter c1.cbz to be removed");

        verify(listener, timeout(5000)).onCollectionAdded(argThat(added -> added.id().equals("Bar")));
        verify(listener, timeout(5000)).onChaptersRemoved(eq("Bar"), eq(Set.of("c1.cbz")));
    }

    @Test
    @DisplayName("Should index a chapter written right after its collection was renamed")
    void shouldIndexChapterAfterRename() throws IOException {
        createCollection(libraryRoot, "Foo");
        context = createContext();
        context.init();
        context.start();
        assertThat(context.snapshot().contains("Foo")).isTrue();

        final Path bar = Files.move(libraryRoot.resolve("Foo"), libraryRoot.resolve("Bar"));
        Files.write(bar.resolve("x.cbz"), new byte[0]);

        await(() -> storeHas("Bar", "x.cbz") && !context.snapshot().contains("Foo"), WAIT,
                "chapter x.cbz to be indexed under Bar");
    }

    @Test
    @DisplayName("Should persist the library on shutdown and load it again")
    void shouldPersistAcrossRestarts() throws IOException {
        createCollection(libraryRoot, "Foo", "a.cbz", "b.cbz");
        context = createContext();
        context.init();
        context.start();
        final CollectionRecord before = context.snapshot().get("Foo");
        context.shutdown();

        final JsonNode persisted = new ObjectMapper().readTree(storeFile.toFile());
        assertThat(persisted.get("Foo").get("total_chapters").asInt()).isEqualTo(2);

        context = createContext();
        context.init();

        assertThat(context.snapshot().get("Foo")).isEqualTo(before);
        assertThat(context.getWatcherService().getState()).isEqualTo(DirectoryWatcherService.WatcherState.STOPPED);
    }
}

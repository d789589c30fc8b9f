package de.mirkosertic.mangalibrary.library;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jspecify.annotations.Nullable;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * On-disk representation of a {@link CollectionRecord}. The collection id is the
 * key of the enclosing JSON object and therefore not repeated here.
 */
@JsonPropertyOrder({"path", "created_at", "last_updated", "cbz_files", "total_chapters"})
record StoredCollection(
        @JsonProperty("path") @Nullable String path,
        @JsonProperty("created_at") @Nullable Instant createdAt,
        @JsonProperty("last_updated") @Nullable Instant lastUpdated,
        @JsonProperty("cbz_files") @Nullable List<String> cbzFiles,
        @JsonProperty("total_chapters") int totalChapters
) {

    static StoredCollection from(final CollectionRecord record) {
        final List<String> files = record.chapterFiles().stream().sorted().toList();
        return new StoredCollection(
                record.path().toString(),
                record.createdAt(),
                record.lastUpdated(),
                files,
                files.size()
        );
    }

    /**
     * Convert back into a record. The chapter count is recomputed from the file list,
     * missing timestamps fall back to {@code fallbackTime}.
     *
     * @return the record, or {@code null} if the stored entry has no usable path
     */
    @Nullable
    CollectionRecord toRecord(final String id, final Instant fallbackTime) {
        if (path == null || path.isBlank()) {
            return null;
        }
        final Path directory;
        try {
            directory = Path.of(path);
        } catch (final InvalidPathException e) {
            return null;
        }
        final Instant created = createdAt != null ? createdAt : fallbackTime;
        final Instant updated = lastUpdated != null ? lastUpdated : created;
        final LinkedHashSet<String> files = new LinkedHashSet<>();
        if (cbzFiles != null) {
            for (final String file : cbzFiles) {
                if (file != null) {
                    files.add(file);
                }
            }
        }
        return new CollectionRecord(id, directory, created, updated, files);
    }
}

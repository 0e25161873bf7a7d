package io.zither.canvas.model;

import io.zither.canvas.coord.ChunkCoord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Persisted snapshot of one chunk.
 *
 * @param coord        grid coordinate, the storage key
 * @param id           stable identifier, never regenerated for the same coordinate
 * @param panes        pane attributes at the time of the snapshot
 * @param dimensions   pixel dimensions (may be null)
 * @param loaded       whether the chunk was loaded when the snapshot was taken
 * @param lastAccessed last time the chunk was loaded or touched (may be null for legacy records)
 */
public record ChunkRecord(
        ChunkCoord coord,
        String id,
        List<PaneRecord> panes,
        Dimensions dimensions,
        boolean loaded,
        Instant lastAccessed
) {

    public ChunkRecord {
        Objects.requireNonNull(coord, "coord cannot be null");
        Objects.requireNonNull(id, "id cannot be null");

        if (id.isBlank()) {
            throw new IllegalArgumentException("id cannot be blank");
        }

        // Null entries are kept: they are restore failures the window manager reports
        panes = panes == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(panes));
    }

    /**
     * Creates a record for a chunk with no panes.
     */
    public static ChunkRecord empty(ChunkCoord coord, String id) {
        return new ChunkRecord(coord, id, List.of(), null, false, null);
    }

    public Optional<Dimensions> dimensionsIfPresent() {
        return Optional.ofNullable(dimensions);
    }

    public Optional<Instant> lastAccessedIfPresent() {
        return Optional.ofNullable(lastAccessed);
    }

    /**
     * Returns the storage key of this record.
     */
    public String key() {
        return coord.toKey();
    }

    public ChunkRecord withPanes(List<PaneRecord> newPanes) {
        return new ChunkRecord(coord, id, newPanes, dimensions, loaded, lastAccessed);
    }

    public ChunkRecord withLoaded(boolean isLoaded) {
        return new ChunkRecord(coord, id, panes, dimensions, isLoaded, lastAccessed);
    }

    public ChunkRecord withDimensions(Dimensions newDimensions) {
        return new ChunkRecord(coord, id, panes, newDimensions, loaded, lastAccessed);
    }

    public ChunkRecord withLastAccessed(Instant instant) {
        return new ChunkRecord(coord, id, panes, dimensions, loaded, instant);
    }
}

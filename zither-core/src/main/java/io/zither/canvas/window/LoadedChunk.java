package io.zither.canvas.window;

import io.zither.canvas.coord.ChunkCoord;
import io.zither.canvas.model.ChunkRecord;
import io.zither.canvas.model.Dimensions;

import java.time.Instant;

/**
 * In-memory state of one loaded chunk.
 */
final class LoadedChunk {

    private final ChunkCoord coord;
    private final String id;
    private final PaneRegistry panes;
    private final Dimensions dimensions;
    private Instant lastAccessed;

    LoadedChunk(ChunkCoord coord, String id, Dimensions dimensions, Instant lastAccessed) {
        this.coord = coord;
        this.id = id;
        this.panes = new PaneRegistry(coord);
        this.dimensions = dimensions;
        this.lastAccessed = lastAccessed;
    }

    ChunkCoord coord() {
        return coord;
    }

    String id() {
        return id;
    }

    PaneRegistry panes() {
        return panes;
    }

    Dimensions dimensions() {
        return dimensions;
    }

    Instant lastAccessed() {
        return lastAccessed;
    }

    void touch(Instant now) {
        this.lastAccessed = now;
    }

    ChunkRecord toRecord(boolean loaded) {
        return new ChunkRecord(coord, id, panes.snapshot(), dimensions, loaded, lastAccessed);
    }
}

package io.zither.canvas.window;

import io.zither.canvas.coord.ChunkCoord;
import io.zither.canvas.model.ChunkRecord;

/**
 * Receives change notifications from a {@link ChunkWindowManager}.
 *
 * <p>Callbacks run synchronously on the caller's thread, after the state change they
 * report. A listener must not call {@code load} or {@code unload} for the coordinate it is
 * being notified about while that chunk is still transitioning.
 */
public interface ChunkWindowListener {

    /**
     * A chunk became loaded. {@code restored} is true if it was read back from storage.
     */
    default void chunkLoaded(ChunkRecord chunk, boolean restored) {
    }

    /**
     * A chunk was persisted and evicted from memory.
     */
    default void chunkUnloaded(ChunkRecord chunk) {
    }

    /**
     * A loaded chunk was deleted and dropped from memory without being persisted.
     */
    default void chunkDeleted(ChunkRecord chunk) {
    }

    /**
     * A chunk snapshot was written to storage.
     */
    default void chunkPersisted(ChunkRecord chunk) {
    }

    /**
     * A stored pane could not be restored and was skipped.
     */
    default void paneRestoreFailed(ChunkCoord coord, int index, RuntimeException cause) {
    }
}

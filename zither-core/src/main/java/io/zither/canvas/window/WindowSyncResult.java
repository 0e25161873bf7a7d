package io.zither.canvas.window;

import io.zither.canvas.coord.ChunkCoord;
import io.zither.canvas.storage.StorageException;

import java.util.List;
import java.util.Map;

/**
 * What one {@link ChunkWindowManager#requestWindow} call changed.
 *
 * @param loaded   chunks loaded by this call, in load (spiral) order
 * @param unloaded chunks unloaded by this call, in scan order
 * @param failures storage failures that were logged and skipped, by coordinate
 */
public record WindowSyncResult(
        List<ChunkCoord> loaded,
        List<ChunkCoord> unloaded,
        Map<ChunkCoord, StorageException> failures
) {

    public WindowSyncResult {
        loaded = List.copyOf(loaded);
        unloaded = List.copyOf(unloaded);
        failures = Map.copyOf(failures);
    }

    /**
     * Returns true if the call neither loaded nor unloaded anything.
     */
    public boolean isUnchanged() {
        return loaded.isEmpty() && unloaded.isEmpty();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}

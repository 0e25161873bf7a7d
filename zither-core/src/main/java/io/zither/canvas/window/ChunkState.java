package io.zither.canvas.window;

/**
 * Lifecycle of a chunk inside the window manager.
 *
 * <p>{@code LOADING} and {@code UNLOADING} last only for the duration of one
 * {@code load}/{@code unload} call.
 */
public enum ChunkState {
    /** Not in memory; may or may not exist in storage */
    UNLOADED,

    /** Being fetched from storage */
    LOADING,

    /** In memory and owned by the window manager */
    LOADED,

    /** Being persisted before eviction */
    UNLOADING;

    /**
     * Returns true if this is a transient state.
     */
    public boolean isTransitioning() {
        return this == LOADING || this == UNLOADING;
    }
}

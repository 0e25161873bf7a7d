package io.zither.canvas.window;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChunkStateTest {

    @Test
    void onlyLoadingAndUnloadingAreTransitioning() {
        assertTrue(ChunkState.LOADING.isTransitioning());
        assertTrue(ChunkState.UNLOADING.isTransitioning());
        assertFalse(ChunkState.LOADED.isTransitioning());
        assertFalse(ChunkState.UNLOADED.isTransitioning());
    }
}

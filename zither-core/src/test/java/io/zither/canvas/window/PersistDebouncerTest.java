package io.zither.canvas.window;

import io.zither.canvas.coord.ChunkCoord;
import io.zither.canvas.model.ChunkRecord;
import io.zither.canvas.model.PaneRecord;
import io.zither.canvas.storage.StorageException;
import io.zither.canvas.testing.RecordingStorageAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for PersistDebouncer.
 */
class PersistDebouncerTest {

    private static final ChunkCoord A = new ChunkCoord(0, 0);
    private static final ChunkCoord B = new ChunkCoord(1, 0);

    private TickClock clock;
    private RecordingStorageAdapter storage;
    private ChunkWindowManager manager;
    private PersistDebouncer debouncer;

    @BeforeEach
    void setUp() throws StorageException {
        clock = new TickClock(Instant.parse("2025-01-01T00:00:00Z"));
        storage = new RecordingStorageAdapter();
        manager = ChunkWindowManager.builder(storage).clock(clock).build();
        debouncer = new PersistDebouncer(manager, Duration.ofMillis(100), clock);
        manager.load(A);
        manager.load(B);
    }

    private void drag(ChunkCoord coord, double x) {
        manager.updatePane(coord, PaneRecord.builder("pane").position(x, 0).build());
        debouncer.markDirty(coord);
    }

    @Test
    void burstOfMutationsIsWrittenOnce() throws StorageException {
        manager.mountPane(A, PaneRecord.builder("pane").build());
        int savesBefore = storage.getSaveCount();

        for (int i = 0; i < 10; i++) {
            drag(A, i * 10);
            clock.advance(Duration.ofMillis(20));
            assertTrue(debouncer.flushDue().isEmpty());
        }
        clock.advance(Duration.ofMillis(100));

        assertEquals(List.of(A), debouncer.flushDue());
        assertEquals(savesBefore + 1, storage.getSaveCount());
        assertEquals(90, storage.getChunk(A).panes().get(0).position().x());
        assertFalse(debouncer.isDirty(A));
    }

    @Test
    void flushAllIgnoresDeadlines() {
        debouncer.markDirty(A);
        debouncer.markDirty(B);

        assertEquals(List.of(A, B), debouncer.flushAll());
        assertTrue(debouncer.dirtyCoords().isEmpty());
    }

    @Test
    void failedWriteStaysDirtyForRetry() {
        debouncer.markDirty(A);
        clock.advance(Duration.ofMillis(150));
        storage.setSaveException(new StorageException("disk full"));

        assertTrue(debouncer.flushDue().isEmpty());
        assertTrue(debouncer.isDirty(A));

        storage.clearFailures();
        assertEquals(List.of(A), debouncer.flushDue());
        assertFalse(debouncer.isDirty(A));
    }

    @Test
    void unloadedChunkIsDropped() throws StorageException {
        debouncer.markDirty(B);
        manager.unload(B);
        int saves = storage.getSaveCount();

        assertTrue(debouncer.flushAll().isEmpty());
        assertFalse(debouncer.isDirty(B));
        assertEquals(saves, storage.getSaveCount());
    }

    @Test
    void chunkMarkedDirtyDuringFlushIsKeptForNextTick() {
        boolean[] remarked = {false};
        manager.addListener(new ChunkWindowListener() {
            @Override
            public void chunkPersisted(ChunkRecord chunk) {
                if (chunk.coord().equals(A) && !remarked[0]) {
                    remarked[0] = true;
                    debouncer.markDirty(A);
                }
            }
        });
        debouncer.markDirty(A);
        debouncer.markDirty(B);

        assertEquals(List.of(A, B), debouncer.flushAll());
        assertTrue(debouncer.isDirty(A));
        assertFalse(debouncer.isDirty(B));

        assertEquals(List.of(A), debouncer.flushAll());
        assertTrue(debouncer.dirtyCoords().isEmpty());
    }

    @Test
    void negativeDelayIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new PersistDebouncer(manager, Duration.ofMillis(-1), clock));
    }

    /**
     * Clock advanced by hand.
     */
    static final class TickClock extends Clock {
        private Instant now;

        TickClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}

package io.zither.canvas.storage.memory;

import io.zither.canvas.coord.ChunkCoord;
import io.zither.canvas.model.ChunkRecord;
import io.zither.canvas.storage.SpatialStorageAdapter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Storage adapter that keeps snapshots in memory.
 *
 * <p>Nothing survives the process. Suits previews and scratch canvases, and is the
 * backing map of the recording test double.
 */
public final class MemoryStorageAdapter implements SpatialStorageAdapter {

    private final Map<ChunkCoord, ChunkRecord> chunks = new ConcurrentSkipListMap<>();

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public Optional<ChunkRecord> loadChunk(ChunkCoord coord) {
        return Optional.ofNullable(chunks.get(coord));
    }

    @Override
    public void saveChunk(ChunkRecord record) {
        Objects.requireNonNull(record, "record cannot be null");
        chunks.put(record.coord(), record);
    }

    @Override
    public boolean hasChunk(ChunkCoord coord) {
        return chunks.containsKey(coord);
    }

    @Override
    public boolean deleteChunk(ChunkCoord coord) {
        return chunks.remove(coord) != null;
    }

    @Override
    public List<ChunkRecord> listAllChunks() {
        return new ArrayList<>(chunks.values());
    }

    @Override
    public List<ChunkCoord> listAllCoords() {
        return new ArrayList<>(chunks.keySet());
    }

    /**
     * Returns the number of stored snapshots.
     */
    public int size() {
        return chunks.size();
    }

    /**
     * Removes every stored snapshot.
     */
    public void clear() {
        chunks.clear();
    }
}

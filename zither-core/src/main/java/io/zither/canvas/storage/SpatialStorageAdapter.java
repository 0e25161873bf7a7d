package io.zither.canvas.storage;

import io.zither.canvas.coord.ChunkCoord;
import io.zither.canvas.model.ChunkRecord;
import io.zither.canvas.storage.json.JsonFileStorageAdapter;
import io.zither.canvas.storage.memory.MemoryStorageAdapter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Durable key/value store of chunk snapshots, keyed by chunk coordinate.
 *
 * <p>Backends that address records by string use {@link ChunkCoord#toKey()} as the key.
 * Implementations are not required to be thread-safe: the window manager is their only
 * writer and never issues two operations on the same coordinate at once.
 */
public interface SpatialStorageAdapter extends AutoCloseable {

    /**
     * Returns the name of this adapter.
     */
    String name();

    /**
     * Loads the snapshot stored at a coordinate.
     *
     * @param coord chunk coordinate
     * @return the stored record, or empty if nothing is stored there
     * @throws StorageException if the backend fails
     */
    Optional<ChunkRecord> loadChunk(ChunkCoord coord) throws StorageException;

    /**
     * Saves a snapshot, replacing whatever was stored at its coordinate.
     *
     * @param record the snapshot to save
     * @throws StorageException if the backend fails
     */
    void saveChunk(ChunkRecord record) throws StorageException;

    /**
     * Checks if a snapshot is stored at a coordinate.
     *
     * @throws StorageException if the backend fails
     */
    boolean hasChunk(ChunkCoord coord) throws StorageException;

    /**
     * Deletes the snapshot at a coordinate.
     *
     * @return true if deleted, false if nothing was stored there
     * @throws StorageException if the backend fails
     */
    boolean deleteChunk(ChunkCoord coord) throws StorageException;

    /**
     * Lists every stored snapshot.
     *
     * @throws StorageException if the backend fails
     */
    List<ChunkRecord> listAllChunks() throws StorageException;

    /**
     * Lists the coordinates of every stored snapshot.
     *
     * @throws StorageException if the backend fails
     */
    default List<ChunkCoord> listAllCoords() throws StorageException {
        List<ChunkCoord> coords = new ArrayList<>();
        for (ChunkRecord record : listAllChunks()) {
            coords.add(record.coord());
        }
        return coords;
    }

    @Override
    default void close() {
        // Default no-op implementation
    }

    /**
     * Creates an adapter backed by a single JSON document.
     *
     * @param file the JSON file; created on first save
     */
    static SpatialStorageAdapter jsonFile(Path file) {
        return new JsonFileStorageAdapter(file);
    }

    /**
     * Creates an adapter that keeps snapshots in memory only.
     */
    static SpatialStorageAdapter inMemory() {
        return new MemoryStorageAdapter();
    }
}

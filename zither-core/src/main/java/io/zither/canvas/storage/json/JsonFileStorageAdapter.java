package io.zither.canvas.storage.json;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import io.zither.canvas.coord.ChunkCoord;
import io.zither.canvas.coord.CoordinateKey;
import io.zither.canvas.model.ChunkRecord;
import io.zither.canvas.storage.SpatialStorageAdapter;
import io.zither.canvas.storage.StorageException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Storage adapter backed by a single JSON document.
 *
 * <p>The document is an object keyed by {@code "x,y"} coordinate keys, one entry per chunk
 * (see {@link ChunkRecordCodec} for the entry format). The whole document is read on first
 * use and kept in memory; every mutation rewrites the file through a temporary sibling and
 * a rename, so a crash mid-write leaves the previous version intact.
 *
 * <p>Top-level entries whose key is not a coordinate key are preserved on rewrite but never
 * returned.
 */
public final class JsonFileStorageAdapter implements SpatialStorageAdapter {

    private static final Logger LOG = Logger.getLogger(JsonFileStorageAdapter.class.getName());

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .create();

    private final Path file;
    private JsonObject document;

    /**
     * Creates an adapter for a JSON file.
     *
     * @param file the storage file; it and its parent directories are created on first save
     */
    public JsonFileStorageAdapter(Path file) {
        this.file = Objects.requireNonNull(file, "file cannot be null");
    }

    @Override
    public String name() {
        return "json";
    }

    @Override
    public Optional<ChunkRecord> loadChunk(ChunkCoord coord) throws StorageException {
        JsonElement entry = document().get(coord.toKey());
        if (!isPresent(entry)) {
            return Optional.empty();
        }
        return Optional.of(decode(coord, entry));
    }

    @Override
    public void saveChunk(ChunkRecord record) throws StorageException {
        Objects.requireNonNull(record, "record cannot be null");
        JsonObject doc = document();
        String key = record.key();
        JsonElement previous = doc.get(key);

        doc.add(key, ChunkRecordCodec.encode(record));
        try {
            write(doc);
        } catch (StorageException e) {
            // Keep the cached document in line with the file
            if (previous == null) {
                doc.remove(key);
            } else {
                doc.add(key, previous);
            }
            throw e;
        }
        LOG.fine("Saved chunk " + key + " (" + record.panes().size() + " panes) to " + file);
    }

    @Override
    public boolean hasChunk(ChunkCoord coord) throws StorageException {
        return isPresent(document().get(coord.toKey()));
    }

    @Override
    public boolean deleteChunk(ChunkCoord coord) throws StorageException {
        JsonObject doc = document();
        String key = coord.toKey();
        if (!doc.has(key)) {
            return false;
        }
        JsonElement previous = doc.remove(key);
        try {
            write(doc);
        } catch (StorageException e) {
            doc.add(key, previous);
            throw e;
        }
        LOG.fine("Deleted chunk " + key + " from " + file);
        return true;
    }

    @Override
    public List<ChunkRecord> listAllChunks() throws StorageException {
        List<ChunkRecord> records = new ArrayList<>();
        for (Map.Entry<String, JsonElement> entry : document().entrySet()) {
            if (!CoordinateKey.isKey(entry.getKey())) {
                LOG.warning("Ignoring non-chunk entry '" + entry.getKey() + "' in " + file);
                continue;
            }
            if (!isPresent(entry.getValue())) {
                continue;
            }
            try {
                records.add(decode(CoordinateKey.fromKey(entry.getKey()), entry.getValue()));
            } catch (StorageException e) {
                LOG.log(Level.WARNING, "Skipping unreadable chunk '" + entry.getKey() + "' in " + file, e);
            }
        }
        return records;
    }

    @Override
    public List<ChunkCoord> listAllCoords() throws StorageException {
        List<ChunkCoord> coords = new ArrayList<>();
        for (Map.Entry<String, JsonElement> entry : document().entrySet()) {
            if (CoordinateKey.isKey(entry.getKey()) && isPresent(entry.getValue())) {
                coords.add(CoordinateKey.fromKey(entry.getKey()));
            }
        }
        return coords;
    }

    /**
     * Get the storage file.
     */
    public Path file() {
        return file;
    }

    /**
     * Drops the cached document so the next operation re-reads the file.
     */
    public void reload() {
        document = null;
    }

    private static boolean isPresent(JsonElement entry) {
        return entry != null && !entry.isJsonNull();
    }

    private JsonObject document() throws StorageException {
        if (document == null) {
            document = read();
        }
        return document;
    }

    private JsonObject read() throws StorageException {
        if (!Files.exists(file)) {
            return new JsonObject();
        }
        try {
            String json = Files.readString(file, StandardCharsets.UTF_8);
            if (json.isBlank()) {
                return new JsonObject();
            }
            JsonElement root = GSON.fromJson(json, JsonElement.class);
            if (root == null || !root.isJsonObject()) {
                throw new StorageException("Storage file is not a JSON object: " + file);
            }
            return root.getAsJsonObject();

        } catch (IOException e) {
            throw new StorageException("Failed to read storage file: " + file, e);
        } catch (JsonParseException e) {
            throw new StorageException("Storage file is not valid JSON: " + file, e);
        }
    }

    private void write(JsonObject doc) throws StorageException {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(temp, GSON.toJson(doc), StandardCharsets.UTF_8);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to write storage file: " + file, e);
        }
    }

    private ChunkRecord decode(ChunkCoord coord, JsonElement entry) throws StorageException {
        if (!entry.isJsonObject()) {
            throw new StorageException("Chunk " + coord.toKey() + " is not a JSON object in " + file);
        }
        try {
            return ChunkRecordCodec.decode(coord, entry.getAsJsonObject());
        } catch (JsonParseException e) {
            throw new StorageException("Failed to decode chunk " + coord.toKey() + " in " + file, e);
        }
    }
}

package io.zither.canvas.window;

import io.zither.canvas.coord.ChunkCoord;
import io.zither.canvas.layout.PackOptions;
import io.zither.canvas.layout.PackResult;
import io.zither.canvas.layout.Placement;
import io.zither.canvas.layout.RectPacker;
import io.zither.canvas.model.ChunkRecord;
import io.zither.canvas.model.Dimensions;
import io.zither.canvas.model.PaneRecord;
import io.zither.canvas.storage.SpatialStorageAdapter;
import io.zither.canvas.storage.StorageException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps the set of in-memory chunks in step with the viewport.
 *
 * <p>The manager owns every loaded chunk and its panes. Chunks enter memory through
 * {@link #load} (restored from the storage adapter, or created with a fresh identifier) and
 * leave through {@link #unload}, which always writes the chunk back first. Pane mutations
 * are written through to storage as they happen.
 *
 * <p>{@link #requestWindow} drives both directions for a viewport: it loads every chunk
 * within the render distance in square-spiral order (nearest first) and unloads every
 * loaded chunk outside it.
 *
 * <p>THREADING: not thread-safe. The manager assumes one logical caller and performs no
 * locking. Storage calls block the caller until they complete. Re-entering {@code load} or
 * {@code unload} for a coordinate that is mid-transition (for example from a listener)
 * throws {@link IllegalStateException}.
 *
 * <p>FAILURES: a storage failure leaves the in-memory state as it was before the call and
 * is rethrown as {@link StorageException}. Only {@link #requestWindow} and
 * {@link #unloadAll} log and continue, reporting what failed in their result.
 */
public final class ChunkWindowManager {

    private static final Logger LOG = Logger.getLogger(ChunkWindowManager.class.getName());

    /** Chunk size used for packing when a chunk has no stored dimensions */
    public static final Dimensions DEFAULT_CHUNK_DIMENSIONS = new Dimensions(1470, 735);

    private final SpatialStorageAdapter storage;
    private final Clock clock;
    private final Supplier<String> idGenerator;
    private final Dimensions defaultDimensions;

    // x column -> y -> chunk
    private final NavigableMap<Integer, NavigableMap<Integer, LoadedChunk>> columns = new TreeMap<>();
    private final Map<ChunkCoord, ChunkState> transitions = new HashMap<>();
    private final Map<String, ChunkCoord> paneOwners = new HashMap<>();
    private final List<ChunkWindowListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Creates a manager with the system clock, random UUID identifiers and the default
     * chunk dimensions.
     */
    public ChunkWindowManager(SpatialStorageAdapter storage) {
        this(builder(storage));
    }

    private ChunkWindowManager(Builder builder) {
        this.storage = Objects.requireNonNull(builder.storage, "storage cannot be null");
        this.clock = builder.clock;
        this.idGenerator = builder.idGenerator;
        this.defaultDimensions = builder.defaultDimensions;
    }

    public static Builder builder(SpatialStorageAdapter storage) {
        return new Builder(storage);
    }

    // ===== Window synchronisation =====

    /**
     * Loads every chunk within Chebyshev distance {@code renderDistance} of {@code origin}
     * and unloads every other loaded chunk.
     *
     * <p>Loads run in square-spiral order from the origin outwards. The unload pass scans
     * loaded columns: a column farther than the render distance from {@code origin.x} is
     * unloaded entirely; in the remaining columns only chunks farther than the render
     * distance from {@code origin.y} are unloaded. A second call with the same arguments
     * changes nothing.
     *
     * <p>Storage failures on individual chunks are logged and reported in the result; the
     * sync carries on with the remaining chunks.
     *
     * @param origin         viewport origin
     * @param renderDistance window radius, non-negative
     * @return the chunks this call loaded and unloaded
     */
    public WindowSyncResult requestWindow(ChunkCoord origin, int renderDistance) {
        Objects.requireNonNull(origin, "origin cannot be null");
        if (renderDistance < 0) {
            throw new IllegalArgumentException("renderDistance cannot be negative: " + renderDistance);
        }

        List<ChunkCoord> loadedNow = new ArrayList<>();
        List<ChunkCoord> unloadedNow = new ArrayList<>();
        Map<ChunkCoord, StorageException> failures = new LinkedHashMap<>();

        for (ChunkCoord coord : SpiralTraversal.around(origin, renderDistance)) {
            try {
                if (load(coord)) {
                    loadedNow.add(coord);
                }
            } catch (StorageException e) {
                LOG.log(Level.WARNING, "Failed to load chunk " + coord.toKey(), e);
                failures.put(coord, e);
            }
        }

        for (ChunkCoord coord : outsideWindow(origin, renderDistance)) {
            try {
                if (unload(coord)) {
                    unloadedNow.add(coord);
                }
            } catch (StorageException e) {
                LOG.log(Level.WARNING, "Failed to unload chunk " + coord.toKey(), e);
                failures.put(coord, e);
            }
        }

        if (!loadedNow.isEmpty() || !unloadedNow.isEmpty()) {
            LOG.fine("Window " + origin.toKey() + " r=" + renderDistance + ": loaded "
                    + loadedNow.size() + ", unloaded " + unloadedNow.size());
        }
        return new WindowSyncResult(loadedNow, unloadedNow, failures);
    }

    /**
     * Unloads every loaded chunk, persisting each one. Failures are logged and reported.
     */
    public WindowSyncResult unloadAll() {
        List<ChunkCoord> unloadedNow = new ArrayList<>();
        Map<ChunkCoord, StorageException> failures = new LinkedHashMap<>();
        for (ChunkCoord coord : loadedCoords()) {
            try {
                if (unload(coord)) {
                    unloadedNow.add(coord);
                }
            } catch (StorageException e) {
                LOG.log(Level.WARNING, "Failed to unload chunk " + coord.toKey(), e);
                failures.put(coord, e);
            }
        }
        return new WindowSyncResult(List.of(), unloadedNow, failures);
    }

    private List<ChunkCoord> outsideWindow(ChunkCoord origin, int renderDistance) {
        List<ChunkCoord> outside = new ArrayList<>();
        for (Map.Entry<Integer, NavigableMap<Integer, LoadedChunk>> column : columns.entrySet()) {
            int x = column.getKey();
            boolean columnOutside = Math.abs((long) x - origin.x()) > renderDistance;
            for (Integer y : column.getValue().keySet()) {
                if (columnOutside || Math.abs((long) y - origin.y()) > renderDistance) {
                    outside.add(new ChunkCoord(x, y));
                }
            }
        }
        return outside;
    }

    // ===== Chunk lifecycle =====

    /**
     * Loads a chunk into memory.
     *
     * <p>If storage holds a snapshot for the coordinate, its identifier and dimensions are
     * adopted and its panes restored; a pane that cannot be restored (missing, duplicate
     * id, or owned by another loaded chunk) is logged and skipped. Otherwise the chunk is
     * created empty with a new identifier.
     *
     * @param coord chunk coordinate
     * @return true if the chunk was loaded by this call, false if it was already loaded
     * @throws StorageException if the storage lookup fails; nothing is loaded in that case
     */
    public boolean load(ChunkCoord coord) throws StorageException {
        Objects.requireNonNull(coord, "coord cannot be null");
        checkNotTransitioning(coord, "load");
        if (find(coord) != null) {
            return false;
        }

        transitions.put(coord, ChunkState.LOADING);
        LoadedChunk chunk;
        boolean restored;
        try {
            Optional<ChunkRecord> stored = storage.loadChunk(coord);
            Instant now = clock.instant();
            restored = stored.isPresent();
            if (restored) {
                ChunkRecord record = stored.get();
                chunk = new LoadedChunk(coord, record.id(), record.dimensions(), now);
                restorePanes(chunk, record.panes());
            } else {
                chunk = new LoadedChunk(coord, idGenerator.get(), null, now);
            }
        } finally {
            transitions.remove(coord);
        }

        columns.computeIfAbsent(coord.x(), x -> new TreeMap<>()).put(coord.y(), chunk);
        for (String paneId : chunk.panes().ids()) {
            paneOwners.put(paneId, coord);
        }

        LOG.fine((restored ? "Restored chunk " : "Created chunk ") + coord.toKey()
                + " (" + chunk.id() + ", " + chunk.panes().size() + " panes)");
        ChunkRecord snapshot = chunk.toRecord(true);
        boolean wasRestored = restored;
        notifyListeners(l -> l.chunkLoaded(snapshot, wasRestored));
        return true;
    }

    private void restorePanes(LoadedChunk chunk, List<PaneRecord> stored) {
        for (int i = 0; i < stored.size(); i++) {
            PaneRecord pane = stored.get(i);
            try {
                if (pane != null) {
                    ChunkCoord owner = paneOwners.get(pane.id());
                    if (owner != null) {
                        throw new IllegalArgumentException("pane " + pane.id()
                                + " is already loaded in chunk " + owner.toKey());
                    }
                }
                chunk.panes().restore(pane);
            } catch (IllegalArgumentException e) {
                LOG.log(Level.WARNING, "Skipping pane #" + i + " of chunk " + chunk.coord().toKey()
                        + ": " + e.getMessage());
                int index = i;
                notifyListeners(l -> l.paneRestoreFailed(chunk.coord(), index, e));
            }
        }
    }

    /**
     * Persists a chunk and evicts it from memory.
     *
     * <p>The snapshot is written with {@code loaded = false} before the chunk is dropped, so
     * no pane mutation is lost by eviction.
     *
     * @param coord chunk coordinate
     * @return true if the chunk was unloaded, false if it was not loaded
     * @throws StorageException if the write fails; the chunk stays loaded in that case
     */
    public boolean unload(ChunkCoord coord) throws StorageException {
        Objects.requireNonNull(coord, "coord cannot be null");
        checkNotTransitioning(coord, "unload");
        LoadedChunk chunk = find(coord);
        if (chunk == null) {
            return false;
        }

        transitions.put(coord, ChunkState.UNLOADING);
        ChunkRecord snapshot = chunk.toRecord(false);
        try {
            storage.saveChunk(snapshot);
        } finally {
            transitions.remove(coord);
        }

        removeFromMemory(chunk);

        LOG.fine("Unloaded chunk " + coord.toKey() + " (" + snapshot.panes().size() + " panes)");
        notifyListeners(l -> l.chunkPersisted(snapshot));
        notifyListeners(l -> l.chunkUnloaded(snapshot));
        return true;
    }

    /**
     * Deletes a chunk from storage and, if loaded, from memory without persisting it.
     *
     * <p>Never called by the windowing policy.
     *
     * @return true if anything was deleted
     * @throws StorageException if the storage delete fails; the chunk stays loaded in that case
     */
    public boolean deleteChunk(ChunkCoord coord) throws StorageException {
        Objects.requireNonNull(coord, "coord cannot be null");
        checkNotTransitioning(coord, "delete");
        boolean deletedFromStorage = storage.deleteChunk(coord);
        LoadedChunk chunk = find(coord);
        if (chunk != null) {
            removeFromMemory(chunk);
            ChunkRecord dropped = chunk.toRecord(false);
            notifyListeners(l -> l.chunkDeleted(dropped));
        }
        if (deletedFromStorage || chunk != null) {
            LOG.fine("Deleted chunk " + coord.toKey());
            return true;
        }
        return false;
    }

    /**
     * Writes the current state of a loaded chunk to storage.
     *
     * <p>Performs no debouncing. Callers reacting to drag or resize should coalesce
     * mutations first (see {@link PersistDebouncer}).
     *
     * @return false if the chunk is not loaded
     * @throws StorageException if the write fails
     */
    public boolean persistChunk(ChunkCoord coord) throws StorageException {
        Objects.requireNonNull(coord, "coord cannot be null");
        LoadedChunk chunk = find(coord);
        if (chunk == null) {
            return false;
        }
        persist(chunk);
        return true;
    }

    // ===== Panes =====

    /**
     * Adds a pane to a loaded chunk and persists the chunk.
     *
     * <p>A pane with the same id in the same chunk is replaced. The pane's
     * {@code chunkCoords} are set to {@code chunkCoord}.
     *
     * @return false if the chunk is not loaded or the pane id belongs to another loaded chunk
     * @throws StorageException if the write fails; the pane is not added in that case
     */
    public boolean mountPane(ChunkCoord chunkCoord, PaneRecord pane) throws StorageException {
        Objects.requireNonNull(chunkCoord, "chunkCoord cannot be null");
        Objects.requireNonNull(pane, "pane cannot be null");
        checkNotTransitioning(chunkCoord, "mount pane into");
        LoadedChunk chunk = find(chunkCoord);
        if (chunk == null) {
            LOG.fine("Ignoring mount of pane " + pane.id() + ": chunk " + chunkCoord.toKey() + " is not loaded");
            return false;
        }
        ChunkCoord owner = paneOwners.get(pane.id());
        if (owner != null && !owner.equals(chunkCoord)) {
            LOG.warning("Ignoring mount of pane " + pane.id() + " into " + chunkCoord.toKey()
                    + ": it is loaded in chunk " + owner.toKey());
            return false;
        }

        Rollback rollback = new Rollback(chunk);
        chunk.panes().put(pane);
        paneOwners.put(pane.id(), chunkCoord);
        chunk.touch(clock.instant());
        try {
            persist(chunk);
        } catch (StorageException e) {
            rollback.apply();
            throw e;
        }
        return true;
    }

    /**
     * Removes a pane from a loaded chunk and persists the chunk.
     *
     * @return false if the chunk is not loaded or does not hold the pane
     * @throws StorageException if the write fails; the pane stays in that case
     */
    public boolean unmountPane(String paneId, ChunkCoord chunkCoord) throws StorageException {
        Objects.requireNonNull(paneId, "paneId cannot be null");
        Objects.requireNonNull(chunkCoord, "chunkCoord cannot be null");
        checkNotTransitioning(chunkCoord, "unmount pane from");
        LoadedChunk chunk = find(chunkCoord);
        if (chunk == null || !chunk.panes().contains(paneId)) {
            return false;
        }

        Rollback rollback = new Rollback(chunk);
        chunk.panes().remove(paneId);
        paneOwners.remove(paneId);
        chunk.touch(clock.instant());
        try {
            persist(chunk);
        } catch (StorageException e) {
            rollback.apply();
            throw e;
        }
        return true;
    }

    /**
     * Replaces the attributes of a pane in memory, e.g. after a drag or resize.
     *
     * <p>Does not persist; follow with a (debounced) {@link #persistChunk}.
     *
     * @return false if the chunk is not loaded or does not hold a pane with that id
     */
    public boolean updatePane(ChunkCoord chunkCoord, PaneRecord pane) {
        Objects.requireNonNull(chunkCoord, "chunkCoord cannot be null");
        Objects.requireNonNull(pane, "pane cannot be null");
        LoadedChunk chunk = find(chunkCoord);
        if (chunk == null || !chunk.panes().replace(pane)) {
            return false;
        }
        chunk.touch(clock.instant());
        return true;
    }

    /**
     * Moves a pane from one loaded chunk to another and persists both.
     *
     * <p>The destination is written first, so a failure part-way never loses the pane.
     *
     * @return false if either chunk is not loaded, they are the same chunk, or the source
     *         does not hold the pane
     * @throws StorageException if a write fails; both chunks keep their previous panes in memory
     */
    public boolean movePane(String paneId, ChunkCoord from, ChunkCoord to) throws StorageException {
        Objects.requireNonNull(paneId, "paneId cannot be null");
        Objects.requireNonNull(from, "from cannot be null");
        Objects.requireNonNull(to, "to cannot be null");
        if (from.equals(to)) {
            return false;
        }
        checkNotTransitioning(from, "move pane from");
        checkNotTransitioning(to, "move pane into");
        LoadedChunk source = find(from);
        LoadedChunk target = find(to);
        if (source == null || target == null) {
            return false;
        }
        Optional<PaneRecord> pane = source.panes().get(paneId);
        if (pane.isEmpty()) {
            return false;
        }

        Rollback sourceRollback = new Rollback(source);
        Rollback targetRollback = new Rollback(target);
        Instant now = clock.instant();
        source.panes().remove(paneId);
        target.panes().put(pane.get());
        paneOwners.put(paneId, to);
        source.touch(now);
        target.touch(now);

        try {
            persist(target);
        } catch (StorageException e) {
            sourceRollback.apply();
            targetRollback.apply();
            paneOwners.put(paneId, from);
            throw e;
        }
        try {
            persist(source);
        } catch (StorageException e) {
            sourceRollback.apply();
            targetRollback.apply();
            paneOwners.put(paneId, from);
            try {
                persist(target);
            } catch (StorageException restoreFailure) {
                e.addSuppressed(restoreFailure);
                LOG.log(Level.WARNING, "Chunk " + to.toKey() + " keeps a stored copy of pane " + paneId
                        + " after a failed move", restoreFailure);
            }
            throw e;
        }
        return true;
    }

    /**
     * Packs the panes of a loaded chunk, writes the placements back and persists the chunk.
     *
     * <p>The container is the chunk's stored dimensions, or the manager's default chunk
     * dimensions if it has none. Each pane receives its placement's position and size
     * (unsized panes receive the minimum item size).
     *
     * @return the packing result, or empty if the chunk is not loaded
     * @throws StorageException if the write fails; pane positions are unchanged in that case
     */
    public Optional<PackResult> arrangeChunk(ChunkCoord coord, PackOptions options) throws StorageException {
        Objects.requireNonNull(coord, "coord cannot be null");
        Objects.requireNonNull(options, "options cannot be null");
        checkNotTransitioning(coord, "arrange");
        LoadedChunk chunk = find(coord);
        if (chunk == null) {
            return Optional.empty();
        }

        Dimensions container = chunk.dimensions() != null ? chunk.dimensions() : defaultDimensions;
        PackResult result = RectPacker.pack(chunk.panes().snapshot(), container.toSize(), options);

        Rollback rollback = new Rollback(chunk);
        for (Placement placement : result.placements()) {
            chunk.panes().get(placement.itemId()).ifPresent(pane -> chunk.panes().replace(
                    pane.withPosition(placement.position()).withSize(placement.size())));
        }
        chunk.touch(clock.instant());
        try {
            persist(chunk);
        } catch (StorageException e) {
            rollback.apply();
            throw e;
        }

        LOG.fine("Arranged " + result.placements().size() + " panes in chunk " + coord.toKey()
                + " (allFit=" + result.allFit() + ", utilization=" + result.utilization() + ")");
        return Optional.of(result);
    }

    // ===== Queries =====

    public boolean isLoaded(ChunkCoord coord) {
        return find(coord) != null;
    }

    /**
     * Returns the lifecycle state of a coordinate.
     */
    public ChunkState state(ChunkCoord coord) {
        ChunkState transition = transitions.get(coord);
        if (transition != null) {
            return transition;
        }
        return find(coord) != null ? ChunkState.LOADED : ChunkState.UNLOADED;
    }

    /**
     * Returns the loaded coordinates, ordered by x then y.
     */
    public List<ChunkCoord> loadedCoords() {
        List<ChunkCoord> coords = new ArrayList<>();
        for (Map.Entry<Integer, NavigableMap<Integer, LoadedChunk>> column : columns.entrySet()) {
            for (Integer y : column.getValue().keySet()) {
                coords.add(new ChunkCoord(column.getKey(), y));
            }
        }
        return coords;
    }

    public int loadedCount() {
        int count = 0;
        for (NavigableMap<Integer, LoadedChunk> column : columns.values()) {
            count += column.size();
        }
        return count;
    }

    /**
     * Returns a snapshot of a loaded chunk.
     */
    public Optional<ChunkRecord> chunk(ChunkCoord coord) {
        LoadedChunk chunk = find(coord);
        return chunk == null ? Optional.empty() : Optional.of(chunk.toRecord(true));
    }

    /**
     * Returns the current attributes of a pane in any loaded chunk.
     */
    public Optional<PaneRecord> findPane(String paneId) {
        ChunkCoord owner = paneOwners.get(paneId);
        if (owner == null) {
            return Optional.empty();
        }
        return find(owner).panes().get(paneId);
    }

    /**
     * Returns the coordinate of the loaded chunk holding a pane.
     */
    public Optional<ChunkCoord> paneOwner(String paneId) {
        return Optional.ofNullable(paneOwners.get(paneId));
    }

    public SpatialStorageAdapter storage() {
        return storage;
    }

    public Dimensions defaultDimensions() {
        return defaultDimensions;
    }

    public void addListener(ChunkWindowListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    public void removeListener(ChunkWindowListener listener) {
        listeners.remove(listener);
    }

    // ===== Internals =====

    private LoadedChunk find(ChunkCoord coord) {
        NavigableMap<Integer, LoadedChunk> column = columns.get(coord.x());
        return column == null ? null : column.get(coord.y());
    }

    private void removeFromMemory(LoadedChunk chunk) {
        ChunkCoord coord = chunk.coord();
        NavigableMap<Integer, LoadedChunk> column = columns.get(coord.x());
        column.remove(coord.y());
        if (column.isEmpty()) {
            columns.remove(coord.x());
        }
        for (String paneId : chunk.panes().ids()) {
            paneOwners.remove(paneId, coord);
        }
    }

    private void persist(LoadedChunk chunk) throws StorageException {
        ChunkRecord snapshot = chunk.toRecord(true);
        storage.saveChunk(snapshot);
        notifyListeners(l -> l.chunkPersisted(snapshot));
    }

    private void checkNotTransitioning(ChunkCoord coord, String operation) {
        ChunkState state = state(coord);
        if (state.isTransitioning()) {
            throw new IllegalStateException("Cannot " + operation + " chunk " + coord.toKey()
                    + " while it is " + state);
        }
    }

    private void notifyListeners(Consumer<ChunkWindowListener> event) {
        for (ChunkWindowListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Chunk window listener failed", e);
            }
        }
    }

    /**
     * Captured pane set and access time of a chunk, restorable after a failed write.
     */
    private final class Rollback {
        private final LoadedChunk chunk;
        private final List<PaneRecord> panes;
        private final Instant lastAccessed;

        Rollback(LoadedChunk chunk) {
            this.chunk = chunk;
            this.panes = chunk.panes().snapshot();
            this.lastAccessed = chunk.lastAccessed();
        }

        void apply() {
            for (String paneId : chunk.panes().ids()) {
                paneOwners.remove(paneId, chunk.coord());
            }
            chunk.panes().resetTo(panes);
            for (PaneRecord pane : panes) {
                paneOwners.put(pane.id(), chunk.coord());
            }
            chunk.touch(lastAccessed);
        }
    }

    /**
     * Builder for ChunkWindowManager.
     */
    public static final class Builder {
        private final SpatialStorageAdapter storage;
        private Clock clock = Clock.systemUTC();
        private Supplier<String> idGenerator = () -> UUID.randomUUID().toString();
        private Dimensions defaultDimensions = DEFAULT_CHUNK_DIMENSIONS;

        private Builder(SpatialStorageAdapter storage) {
            this.storage = storage;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock cannot be null");
            return this;
        }

        public Builder idGenerator(Supplier<String> idGenerator) {
            this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator cannot be null");
            return this;
        }

        public Builder defaultDimensions(Dimensions dimensions) {
            this.defaultDimensions = Objects.requireNonNull(dimensions, "dimensions cannot be null");
            return this;
        }

        public ChunkWindowManager build() {
            return new ChunkWindowManager(this);
        }
    }
}

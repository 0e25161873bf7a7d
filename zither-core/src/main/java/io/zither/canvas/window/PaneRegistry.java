package io.zither.canvas.window;

import io.zither.canvas.coord.ChunkCoord;
import io.zither.canvas.model.PaneRecord;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Panes of one loaded chunk, keyed by pane id.
 *
 * <p>Every pane held here has {@code chunkCoords} equal to the owning chunk: panes that
 * arrive with another coordinate are re-homed on the way in. Iteration follows insertion
 * order so snapshots are deterministic.
 */
public final class PaneRegistry {

    private final ChunkCoord owner;
    private final Map<String, PaneRecord> panes = new LinkedHashMap<>();

    public PaneRegistry(ChunkCoord owner) {
        this.owner = owner;
    }

    public ChunkCoord owner() {
        return owner;
    }

    /**
     * Adds or replaces a pane.
     *
     * @return the pane previously registered under the same id, or empty
     */
    public Optional<PaneRecord> put(PaneRecord pane) {
        return Optional.ofNullable(panes.put(pane.id(), rehome(pane)));
    }

    /**
     * Restores a pane read back from storage.
     *
     * @throws IllegalArgumentException if the pane is null or its id is already registered
     */
    public void restore(PaneRecord pane) {
        if (pane == null) {
            throw new IllegalArgumentException("pane record is missing");
        }
        if (panes.containsKey(pane.id())) {
            throw new IllegalArgumentException("duplicate pane id " + pane.id());
        }
        panes.put(pane.id(), rehome(pane));
    }

    /**
     * Replaces an existing pane's attributes.
     *
     * @return false if no pane with that id is registered
     */
    public boolean replace(PaneRecord pane) {
        if (!panes.containsKey(pane.id())) {
            return false;
        }
        panes.put(pane.id(), rehome(pane));
        return true;
    }

    public Optional<PaneRecord> remove(String paneId) {
        return Optional.ofNullable(panes.remove(paneId));
    }

    public Optional<PaneRecord> get(String paneId) {
        return Optional.ofNullable(panes.get(paneId));
    }

    public boolean contains(String paneId) {
        return panes.containsKey(paneId);
    }

    public Set<String> ids() {
        return Set.copyOf(panes.keySet());
    }

    public int size() {
        return panes.size();
    }

    public boolean isEmpty() {
        return panes.isEmpty();
    }

    /**
     * Returns the current pane attributes in insertion order.
     */
    public List<PaneRecord> snapshot() {
        return new ArrayList<>(panes.values());
    }

    /**
     * Replaces the whole pane set with a previous snapshot.
     */
    void resetTo(List<PaneRecord> snapshot) {
        panes.clear();
        for (PaneRecord pane : snapshot) {
            panes.put(pane.id(), pane);
        }
    }

    private PaneRecord rehome(PaneRecord pane) {
        return owner.equals(pane.chunkCoords()) ? pane : pane.withChunkCoords(owner);
    }
}

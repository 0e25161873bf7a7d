package io.zither.canvas.window;

import io.zither.canvas.coord.ChunkCoord;
import io.zither.canvas.storage.StorageException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Coalesces bursts of pane mutations into one write per chunk.
 *
 * <p>Callers mark a chunk dirty after each drag or resize step and call {@link #flushDue()}
 * from their own tick. A chunk is written once no mutation has been marked for the
 * configured delay. The debouncer starts no threads.
 *
 * <p>A chunk whose write fails stays dirty and is retried on the next flush. A chunk that
 * is no longer loaded is dropped, since unloading already persisted it.
 */
public final class PersistDebouncer {

    private static final Logger LOG = Logger.getLogger(PersistDebouncer.class.getName());

    public static final Duration DEFAULT_DELAY = Duration.ofMillis(100);

    private final ChunkWindowManager manager;
    private final Duration delay;
    private final Clock clock;
    private final Map<ChunkCoord, Instant> deadlines = new LinkedHashMap<>();

    public PersistDebouncer(ChunkWindowManager manager) {
        this(manager, DEFAULT_DELAY, Clock.systemUTC());
    }

    public PersistDebouncer(ChunkWindowManager manager, Duration delay, Clock clock) {
        this.manager = Objects.requireNonNull(manager, "manager cannot be null");
        this.delay = Objects.requireNonNull(delay, "delay cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay cannot be negative: " + delay);
        }
    }

    /**
     * Records a mutation of a chunk, pushing its write back by the delay.
     */
    public void markDirty(ChunkCoord coord) {
        Objects.requireNonNull(coord, "coord cannot be null");
        deadlines.remove(coord);
        deadlines.put(coord, clock.instant().plus(delay));
    }

    /**
     * Writes every chunk whose delay has elapsed.
     *
     * @return the chunks written by this call
     */
    public List<ChunkCoord> flushDue() {
        Instant now = clock.instant();
        return flush(deadline -> !deadline.isAfter(now));
    }

    /**
     * Writes every dirty chunk regardless of its deadline, e.g. before shutdown.
     *
     * @return the chunks written by this call
     */
    public List<ChunkCoord> flushAll() {
        return flush(deadline -> true);
    }

    public boolean isDirty(ChunkCoord coord) {
        return deadlines.containsKey(coord);
    }

    public Set<ChunkCoord> dirtyCoords() {
        return Set.copyOf(deadlines.keySet());
    }

    public Duration delay() {
        return delay;
    }

    private List<ChunkCoord> flush(Predicate<Instant> due) {
        // Listeners may mark chunks dirty while a write is in progress
        List<ChunkCoord> pending = new ArrayList<>();
        for (Map.Entry<ChunkCoord, Instant> entry : deadlines.entrySet()) {
            if (due.test(entry.getValue())) {
                pending.add(entry.getKey());
            }
        }

        List<ChunkCoord> written = new ArrayList<>();
        for (ChunkCoord coord : pending) {
            Instant deadline = deadlines.remove(coord);
            if (deadline == null) {
                continue;
            }
            try {
                if (manager.persistChunk(coord)) {
                    written.add(coord);
                } else {
                    LOG.fine("Dropping dirty mark for unloaded chunk " + coord.toKey());
                }
            } catch (StorageException e) {
                deadlines.putIfAbsent(coord, deadline);
                LOG.log(Level.WARNING, "Deferred write of chunk " + coord.toKey() + " failed; will retry", e);
            }
        }
        return written;
    }
}

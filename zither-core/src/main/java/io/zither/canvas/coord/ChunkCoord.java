package io.zither.canvas.coord;

import java.util.Comparator;
import java.util.Optional;

/**
 * Integer address of one chunk in the canvas grid.
 *
 * <p>Any {@code int} pair is a valid address. Ordering is by x, then y, which is the
 * order the window manager scans its loaded columns in.
 *
 * @param x column index
 * @param y row index
 */
public record ChunkCoord(int x, int y) implements Comparable<ChunkCoord> {

    /** The canvas origin (0,0) */
    public static final ChunkCoord ORIGIN = new ChunkCoord(0, 0);

    private static final Comparator<ChunkCoord> ORDER =
            Comparator.comparingInt(ChunkCoord::x).thenComparingInt(ChunkCoord::y);

    public static ChunkCoord of(int x, int y) {
        return new ChunkCoord(x, y);
    }

    /**
     * Returns the Chebyshev distance {@code max(|dx|, |dy|)} to another coordinate.
     *
     * <p>Computed in {@code long}; the distance between two extreme {@code int} coordinates
     * does not fit in an {@code int}.
     */
    public long chebyshevDistance(ChunkCoord other) {
        long dx = Math.abs((long) x - other.x);
        long dy = Math.abs((long) y - other.y);
        return Math.max(dx, dy);
    }

    /**
     * Returns this coordinate shifted by the given offset, or empty if the result
     * would leave the {@code int} range.
     */
    public Optional<ChunkCoord> offset(int dx, int dy) {
        long nx = (long) x + dx;
        long ny = (long) y + dy;
        if (nx < Integer.MIN_VALUE || nx > Integer.MAX_VALUE
                || ny < Integer.MIN_VALUE || ny > Integer.MAX_VALUE) {
            return Optional.empty();
        }
        return Optional.of(new ChunkCoord((int) nx, (int) ny));
    }

    /**
     * Returns the storage key for this coordinate.
     *
     * @see CoordinateKey#toKey(ChunkCoord)
     */
    public String toKey() {
        return CoordinateKey.toKey(this);
    }

    @Override
    public int compareTo(ChunkCoord other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}

package io.zither.canvas.window;

import io.zither.canvas.coord.ChunkCoord;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Square-spiral enumeration of chunk offsets, innermost ring first.
 *
 * <p>Ring {@code i} (1-based) has side {@code L = 2(i-1) + 1} and radius {@code r = i - 1}.
 * The first ring is the centre cell alone. Every other ring is walked as {@code L - 1}
 * rounds; round {@code o} uses the side offset {@code s = ceil(o/2)}, negated for even
 * {@code o}, and emits one cell per edge in rotation:
 * <pre>
 *   ( r,  s)   right edge
 *   (-s,  r)   bottom edge
 *   (-r, -s)   left edge
 *   ( s, -r)   top edge
 * </pre>
 * Side offsets run 0, 1, -1, 2, -2, ..., r, so the last round visits the four corners.
 * Each ring emits {@code 4(L - 1)} cells and every offset with Chebyshev distance at most
 * the render distance is emitted exactly once.
 *
 * <p>Iteration is lazy and each call to {@code iterator()} starts over.
 */
public final class SpiralTraversal implements Iterable<ChunkCoord> {

    private final int renderDistance;

    private SpiralTraversal(int renderDistance) {
        if (renderDistance < 0) {
            throw new IllegalArgumentException("renderDistance cannot be negative: " + renderDistance);
        }
        this.renderDistance = renderDistance;
    }

    /**
     * Returns the offsets covering Chebyshev distance {@code 0..renderDistance}.
     */
    public static SpiralTraversal offsets(int renderDistance) {
        return new SpiralTraversal(renderDistance);
    }

    /**
     * Returns the coordinates around {@code origin} in spiral order. Offsets that would leave
     * the {@code int} coordinate range are skipped.
     */
    public static Iterable<ChunkCoord> around(ChunkCoord origin, int renderDistance) {
        SpiralTraversal offsets = offsets(renderDistance);
        return () -> new Iterator<>() {
            private final Iterator<ChunkCoord> source = offsets.iterator();
            private ChunkCoord next = advance();

            private ChunkCoord advance() {
                while (source.hasNext()) {
                    ChunkCoord offset = source.next();
                    Optional<ChunkCoord> shifted = origin.offset(offset.x(), offset.y());
                    if (shifted.isPresent()) {
                        return shifted.get();
                    }
                }
                return null;
            }

            @Override
            public boolean hasNext() {
                return next != null;
            }

            @Override
            public ChunkCoord next() {
                if (next == null) {
                    throw new NoSuchElementException();
                }
                ChunkCoord current = next;
                next = advance();
                return current;
            }
        };
    }

    /**
     * Returns the number of cells visited for a render distance: {@code (2R + 1)^2}.
     */
    public static long cellCount(int renderDistance) {
        long side = 2L * renderDistance + 1;
        return side * side;
    }

    public int renderDistance() {
        return renderDistance;
    }

    @Override
    public Iterator<ChunkCoord> iterator() {
        return new SpiralIterator(renderDistance);
    }

    private static final class SpiralIterator implements Iterator<ChunkCoord> {

        private final long lastRadius;
        private long radius;
        private long round;
        private int direction;
        private boolean centreDone;

        SpiralIterator(int renderDistance) {
            this.lastRadius = renderDistance;
        }

        @Override
        public boolean hasNext() {
            return !centreDone || radius <= lastRadius;
        }

        @Override
        public ChunkCoord next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            if (!centreDone) {
                centreDone = true;
                radius = 1;
                return ChunkCoord.ORIGIN;
            }

            int r = (int) radius;
            int s = (int) ((round + 1) / 2);
            if (round % 2 == 0) {
                s = -s;
            }

            ChunkCoord offset = switch (direction) {
                case 0 -> new ChunkCoord(r, s);
                case 1 -> new ChunkCoord(-s, r);
                case 2 -> new ChunkCoord(-r, -s);
                default -> new ChunkCoord(s, -r);
            };

            direction++;
            if (direction > 3) {
                direction = 0;
                round++;
                // a ring of side L = 2r + 1 takes L - 1 = 2r rounds
                if (round >= 2 * radius) {
                    round = 0;
                    radius++;
                }
            }
            return offset;
        }
    }
}

package io.zither.canvas.model;

/**
 * Chunk-local position of a pane's top-left corner.
 *
 * @param x horizontal offset from the chunk's left edge
 * @param y vertical offset from the chunk's top edge
 */
public record Position(double x, double y) {

    /** Top-left corner of the chunk */
    public static final Position ZERO = new Position(0, 0);

    public Position {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new IllegalArgumentException("position must be finite: (" + x + ", " + y + ")");
        }
    }

    public static Position of(double x, double y) {
        return new Position(x, y);
    }
}

package io.zither.canvas.model;

/**
 * Pixel dimensions of a chunk.
 *
 * @param width  width in pixels
 * @param height height in pixels
 */
public record Dimensions(int width, int height) {

    public Dimensions {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("dimensions must be positive: " + width + " x " + height);
        }
    }

    public static Dimensions of(int width, int height) {
        return new Dimensions(width, height);
    }

    /**
     * Returns these dimensions as a packing container size.
     */
    public Size toSize() {
        return new Size(width, height);
    }
}

package io.zither.canvas.model;

/**
 * Width and height in chunk-local units.
 *
 * <p>Zero is allowed: a pane that has never been sized reports {@code 0 x 0} and the
 * packer substitutes its minimum item size.
 *
 * @param width  horizontal extent, non-negative
 * @param height vertical extent, non-negative
 */
public record Size(double width, double height) {

    public static final Size ZERO = new Size(0, 0);

    public Size {
        if (!Double.isFinite(width) || !Double.isFinite(height)) {
            throw new IllegalArgumentException("size must be finite: " + width + " x " + height);
        }
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("size cannot be negative: " + width + " x " + height);
        }
    }

    public static Size of(double width, double height) {
        return new Size(width, height);
    }

    public double area() {
        return width * height;
    }

    /**
     * Returns true if both dimensions are strictly positive.
     */
    public boolean isPositive() {
        return width > 0 && height > 0;
    }

    @Override
    public String toString() {
        return width + " x " + height;
    }
}

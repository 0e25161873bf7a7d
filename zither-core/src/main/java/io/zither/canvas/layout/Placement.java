package io.zither.canvas.layout;

import io.zither.canvas.model.Position;
import io.zither.canvas.model.Size;

/**
 * Where the packer put one item.
 *
 * @param itemId the item identifier
 * @param x      left edge
 * @param y      top edge
 * @param width  item width (without padding)
 * @param height item height (without padding)
 * @param fitted true if the item was placed inside a free rectangle, false for an overflow placement
 */
public record Placement(String itemId, double x, double y, double width, double height, boolean fitted) {

    public double right() {
        return x + width;
    }

    public double bottom() {
        return y + height;
    }

    public double area() {
        return width * height;
    }

    public Position position() {
        return new Position(x, y);
    }

    public Size size() {
        return new Size(width, height);
    }

    /**
     * Returns true if the two rectangles, each grown by {@code padding} on the right and
     * bottom, share any interior area.
     */
    public boolean overlaps(Placement other, double padding) {
        return x < other.x + other.width + padding
                && other.x < x + width + padding
                && y < other.y + other.height + padding
                && other.y < y + height + padding;
    }
}

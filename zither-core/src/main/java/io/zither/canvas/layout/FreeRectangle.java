package io.zither.canvas.layout;

import java.util.ArrayList;
import java.util.List;

/**
 * Unused region of the container, tracked during a single pack call.
 */
record FreeRectangle(double x, double y, double width, double height) {

    double right() {
        return x + width;
    }

    double bottom() {
        return y + height;
    }

    boolean canHold(double w, double h) {
        return width >= w && height >= h;
    }

    boolean intersects(FreeRectangle other) {
        return !(x >= other.right()
                || right() <= other.x
                || y >= other.bottom()
                || bottom() <= other.y);
    }

    boolean isContainedIn(FreeRectangle other) {
        return x >= other.x
                && y >= other.y
                && right() <= other.right()
                && bottom() <= other.bottom();
    }

    /**
     * Splits this rectangle around an occupied one into up to four maximal slivers
     * (left, right, above, below). Slivers without positive area are dropped.
     */
    List<FreeRectangle> subtract(FreeRectangle occupied) {
        List<FreeRectangle> slivers = new ArrayList<>(4);
        if (x < occupied.x) {
            slivers.add(new FreeRectangle(x, y, occupied.x - x, height));
        }
        if (right() > occupied.right()) {
            slivers.add(new FreeRectangle(occupied.right(), y, right() - occupied.right(), height));
        }
        if (y < occupied.y) {
            slivers.add(new FreeRectangle(x, y, width, occupied.y - y));
        }
        if (bottom() > occupied.bottom()) {
            slivers.add(new FreeRectangle(x, occupied.bottom(), width, bottom() - occupied.bottom()));
        }
        slivers.removeIf(r -> r.width <= 0 || r.height <= 0);
        return slivers;
    }
}

package io.zither.canvas.layout;

import io.zither.canvas.model.PaneRecord;
import io.zither.canvas.model.Size;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Packs rectangles into a container without overlap.
 *
 * <p>Implements MaxRects with the Best-Short-Side-Fit heuristic:
 * <ol>
 *   <li>Start with one free rectangle: the container minus the margin on every side.</li>
 *   <li>Sort items by descending area, keeping input order between equal areas.</li>
 *   <li>For each item, reserve a footprint of {@code (w + padding, h + padding)} in the free
 *       rectangle that leaves the smallest leftover on its shorter side (ties: smallest
 *       leftover on the longer side, then the earliest rectangle).</li>
 *   <li>Place the item at that rectangle's top-left corner, carve the footprint out of every
 *       free rectangle it touches, and drop free rectangles contained in another.</li>
 * </ol>
 *
 * <p>The result is heuristic, not optimal. Items that fit nowhere are placed according to
 * the {@link OverflowPolicy} and reported through {@link PackResult#allFit()}.
 *
 * <p>This class holds no state. Results depend only on the arguments, so calls are safe
 * from any thread and may be memoized.
 */
public final class RectPacker {

    private RectPacker() {
    }

    /**
     * Packs items into a container.
     *
     * @param itemIds       items to place, in input order
     * @param containerSize container width and height
     * @param sizeLookup    size of each item; {@code null} or a non-positive dimension means
     *                      "use {@link PackOptions#minimumItemSize()}"
     * @param options       packing options
     * @return placements, fit flag and utilization
     */
    public static PackResult pack(List<String> itemIds, Size containerSize,
                                  Function<String, Size> sizeLookup, PackOptions options) {
        Objects.requireNonNull(itemIds, "itemIds cannot be null");
        Objects.requireNonNull(containerSize, "containerSize cannot be null");
        Objects.requireNonNull(sizeLookup, "sizeLookup cannot be null");
        Objects.requireNonNull(options, "options cannot be null");

        if (itemIds.isEmpty()) {
            return PackResult.empty();
        }

        double margin = options.margin();
        double padding = options.padding();

        List<FreeRectangle> freeRects = new ArrayList<>();
        FreeRectangle usable = new FreeRectangle(margin, margin,
                containerSize.width() - 2 * margin, containerSize.height() - 2 * margin);
        if (usable.width() > 0 && usable.height() > 0) {
            freeRects.add(usable);
        }

        List<Item> items = new ArrayList<>(itemIds.size());
        for (String id : itemIds) {
            items.add(new Item(id, resolveSize(sizeLookup.apply(id), options.minimumItemSize())));
        }
        // List.sort is stable, so equal areas keep their input order
        items.sort(Comparator.comparingDouble(Item::area).reversed());

        List<Placement> placements = new ArrayList<>(items.size());
        List<Item> overflow = new ArrayList<>();
        boolean allFit = true;

        for (Item item : items) {
            double footprintW = item.size.width() + padding;
            double footprintH = item.size.height() + padding;

            int best = findBestShortSideFit(freeRects, footprintW, footprintH);
            if (best < 0) {
                allFit = false;
                if (options.overflowPolicy() == OverflowPolicy.STACK_BELOW) {
                    placements.add(stackBelow(item, placements, margin, padding));
                } else {
                    overflow.add(item);
                }
                continue;
            }

            FreeRectangle chosen = freeRects.get(best);
            placements.add(new Placement(item.id, chosen.x(), chosen.y(),
                    item.size.width(), item.size.height(), true));

            FreeRectangle occupied = new FreeRectangle(chosen.x(), chosen.y(), footprintW, footprintH);
            splitFreeRectangles(freeRects, occupied);
            pruneContained(freeRects);
        }

        if (!overflow.isEmpty()) {
            placeOnShelves(overflow, placements, containerSize, margin, padding);
        }

        return new PackResult(placements, allFit, utilization(placements, containerSize));
    }

    /**
     * Packs panes using their current sizes.
     */
    public static PackResult pack(List<PaneRecord> panes, Size containerSize, PackOptions options) {
        Map<String, Size> sizes = new LinkedHashMap<>();
        for (PaneRecord pane : panes) {
            sizes.put(pane.id(), pane.size());
        }
        return pack(new ArrayList<>(sizes.keySet()), containerSize, sizes::get, options);
    }

    private static Size resolveSize(Size requested, Size minimum) {
        if (requested == null || !requested.isPositive()) {
            return minimum;
        }
        return requested;
    }

    private static int findBestShortSideFit(List<FreeRectangle> freeRects, double width, double height) {
        int best = -1;
        double bestShortSide = Double.POSITIVE_INFINITY;
        double bestLongSide = Double.POSITIVE_INFINITY;

        for (int i = 0; i < freeRects.size(); i++) {
            FreeRectangle rect = freeRects.get(i);
            if (!rect.canHold(width, height)) {
                continue;
            }
            double leftoverHoriz = rect.width() - width;
            double leftoverVert = rect.height() - height;
            double shortSide = Math.min(leftoverHoriz, leftoverVert);
            double longSide = Math.max(leftoverHoriz, leftoverVert);

            if (shortSide < bestShortSide || (shortSide == bestShortSide && longSide < bestLongSide)) {
                best = i;
                bestShortSide = shortSide;
                bestLongSide = longSide;
            }
        }
        return best;
    }

    private static void splitFreeRectangles(List<FreeRectangle> freeRects, FreeRectangle occupied) {
        List<FreeRectangle> next = new ArrayList<>(freeRects.size() + 4);
        for (FreeRectangle free : freeRects) {
            if (free.intersects(occupied)) {
                next.addAll(free.subtract(occupied));
            } else {
                next.add(free);
            }
        }
        freeRects.clear();
        freeRects.addAll(next);
    }

    private static void pruneContained(List<FreeRectangle> freeRects) {
        for (int i = freeRects.size() - 1; i >= 0; i--) {
            for (int j = freeRects.size() - 1; j >= 0; j--) {
                if (i != j && freeRects.get(i).isContainedIn(freeRects.get(j))) {
                    freeRects.remove(i);
                    break;
                }
            }
        }
    }

    private static Placement stackBelow(Item item, List<Placement> placed, double margin, double padding) {
        double y = margin;
        if (!placed.isEmpty()) {
            double lowest = Double.NEGATIVE_INFINITY;
            for (Placement p : placed) {
                lowest = Math.max(lowest, p.bottom());
            }
            y = lowest + padding;
        }
        return new Placement(item.id, margin, y, item.size.width(), item.size.height(), false);
    }

    private static void placeOnShelves(List<Item> overflow, List<Placement> placements,
                                       Size containerSize, double margin, double padding) {
        double shelfY = margin;
        if (!placements.isEmpty()) {
            double lowest = Double.NEGATIVE_INFINITY;
            for (Placement p : placements) {
                lowest = Math.max(lowest, p.bottom());
            }
            shelfY = lowest + padding;
        }
        double rightLimit = containerSize.width() - margin;
        double shelfX = margin;
        double shelfHeight = 0;

        for (Item item : overflow) {
            double w = item.size.width();
            double h = item.size.height();
            if (shelfX > margin && shelfX + w > rightLimit) {
                shelfY += shelfHeight + padding;
                shelfX = margin;
                shelfHeight = 0;
            }
            placements.add(new Placement(item.id, shelfX, shelfY, w, h, false));
            shelfX += w + padding;
            shelfHeight = Math.max(shelfHeight, h);
        }
    }

    private static double utilization(List<Placement> placements, Size containerSize) {
        double containerArea = containerSize.area();
        if (containerArea <= 0) {
            return 0.0;
        }
        double used = 0;
        for (Placement p : placements) {
            if (p.fitted()) {
                used += p.area();
            }
        }
        return Math.min(1.0, used / containerArea);
    }

    private record Item(String id, Size size) {
        double area() {
            return size.area();
        }
    }
}

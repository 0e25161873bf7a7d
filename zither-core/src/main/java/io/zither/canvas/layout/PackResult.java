package io.zither.canvas.layout;

import java.util.List;
import java.util.Optional;

/**
 * Output of one {@link RectPacker} call.
 *
 * @param placements  one placement per input item, in placement order
 * @param allFit      false if at least one item needed an overflow placement
 * @param utilization area of fitted items divided by the container area, in [0, 1]
 */
public record PackResult(List<Placement> placements, boolean allFit, double utilization) {

    public PackResult {
        placements = List.copyOf(placements);
    }

    static PackResult empty() {
        return new PackResult(List.of(), true, 0.0);
    }

    /**
     * Returns the placement of an item, or empty if it was not part of the input.
     */
    public Optional<Placement> placementFor(String itemId) {
        return placements.stream()
                .filter(p -> p.itemId().equals(itemId))
                .findFirst();
    }

    /**
     * Returns the number of overflow placements.
     */
    public long overflowCount() {
        return placements.stream().filter(p -> !p.fitted()).count();
    }
}

package io.zither.canvas.layout;

import java.util.Locale;

/**
 * Where the packer puts an item that no free rectangle can hold.
 */
public enum OverflowPolicy {

    /**
     * Stack the item at the left margin, directly beneath the lowest item placed so far
     * (or at the margin origin if nothing is placed yet). Overflowing items may overlap
     * each other or fitted items.
     */
    STACK_BELOW,

    /**
     * Once all fitting items are placed, lay overflowing items out in rows beneath the
     * lowest fitted item, wrapping at the container width. Never overlaps, at the cost
     * of extending past the container's bottom edge.
     */
    SHELF;

    /**
     * Parses a policy name, case-insensitive, accepting '-' for '_'.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static OverflowPolicy fromName(String name) {
        return valueOf(name.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}

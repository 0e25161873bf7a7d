package io.zither.canvas.layout;

import io.zither.canvas.model.Size;

import java.util.Objects;

/**
 * Options for {@link RectPacker}.
 *
 * @param minimumItemSize size used for items without a usable size of their own
 * @param padding         empty space kept between items, and between items and the margin
 * @param margin          border kept empty around the container edge
 * @param overflowPolicy  placement of items that do not fit
 */
public record PackOptions(
        Size minimumItemSize,
        double padding,
        double margin,
        OverflowPolicy overflowPolicy
) {

    /** Default minimum pane size */
    public static final Size DEFAULT_MINIMUM_ITEM_SIZE = new Size(100, 80);

    /** Default padding between panes */
    public static final double DEFAULT_PADDING = 8;

    /** Default margin from chunk edges */
    public static final double DEFAULT_MARGIN = 16;

    public PackOptions {
        Objects.requireNonNull(minimumItemSize, "minimumItemSize cannot be null");
        Objects.requireNonNull(overflowPolicy, "overflowPolicy cannot be null");

        if (!minimumItemSize.isPositive()) {
            throw new IllegalArgumentException("minimumItemSize must be positive: " + minimumItemSize);
        }
        if (!Double.isFinite(padding) || padding < 0) {
            throw new IllegalArgumentException("padding must be non-negative: " + padding);
        }
        if (!Double.isFinite(margin) || margin < 0) {
            throw new IllegalArgumentException("margin must be non-negative: " + margin);
        }
    }

    /**
     * Returns the defaults: 100 x 80 minimum, padding 8, margin 16, stack-below overflow.
     */
    public static PackOptions defaults() {
        return new PackOptions(DEFAULT_MINIMUM_ITEM_SIZE, DEFAULT_PADDING, DEFAULT_MARGIN,
                OverflowPolicy.STACK_BELOW);
    }

    /**
     * Returns the defaults with padding and margin set to zero.
     */
    public static PackOptions tight() {
        return defaults().withPadding(0).withMargin(0);
    }

    public PackOptions withMinimumItemSize(Size size) {
        return new PackOptions(size, padding, margin, overflowPolicy);
    }

    public PackOptions withPadding(double newPadding) {
        return new PackOptions(minimumItemSize, newPadding, margin, overflowPolicy);
    }

    public PackOptions withMargin(double newMargin) {
        return new PackOptions(minimumItemSize, padding, newMargin, overflowPolicy);
    }

    public PackOptions withOverflowPolicy(OverflowPolicy policy) {
        return new PackOptions(minimumItemSize, padding, margin, policy);
    }
}

package io.zither.canvas.layout;

import io.zither.canvas.model.Size;

/**
 * Quick capacity checks that do not run the packer.
 */
public final class PackingEstimates {

    private PackingEstimates() {
    }

    /**
     * Returns the item size that fits the largest number of equal items into {@code totalSize}
     * without going below {@code minimumSize}. If not even one minimum-sized item fits, returns
     * {@code minimumSize}.
     */
    public static double fitMaxAmountEvenly(double totalSize, double minimumSize) {
        if (minimumSize <= 0) {
            throw new IllegalArgumentException("minimumSize must be positive: " + minimumSize);
        }
        long canFit = (long) Math.floor(totalSize / minimumSize);
        if (canFit <= 0) {
            return minimumSize;
        }
        return totalSize / canFit;
    }

    /**
     * Returns true if {@code itemCount} items of {@code minimumItemSize} fit in some uniform
     * grid inside the container, after removing the margin and keeping {@code padding}
     * between neighbouring cells.
     */
    public static boolean canItemsFit(int itemCount, Size containerSize, Size minimumItemSize,
                                      double padding, double margin) {
        if (itemCount <= 0) {
            return true;
        }
        double availableWidth = containerSize.width() - 2 * margin;
        double availableHeight = containerSize.height() - 2 * margin;

        for (int cols = 1; cols <= itemCount; cols++) {
            int rows = (itemCount + cols - 1) / cols;
            double requiredWidth = cols * minimumItemSize.width() + (cols - 1) * padding;
            double requiredHeight = rows * minimumItemSize.height() + (rows - 1) * padding;
            if (requiredWidth <= availableWidth && requiredHeight <= availableHeight) {
                return true;
            }
        }
        return false;
    }

    /**
     * Grid feasibility check using the sizes and spacing of the given options.
     */
    public static boolean canItemsFit(int itemCount, Size containerSize, PackOptions options) {
        return canItemsFit(itemCount, containerSize, options.minimumItemSize(),
                options.padding(), options.margin());
    }
}

package io.zither.canvas.model;

/**
 * RGBA color with 8-bit channels.
 */
public record RgbaColor(int red, int green, int blue, int alpha) {

    /** Opaque white, the color of a pane nobody has colored yet */
    public static final RgbaColor WHITE = new RgbaColor(255, 255, 255, 255);

    public RgbaColor {
        checkChannel("red", red);
        checkChannel("green", green);
        checkChannel("blue", blue);
        checkChannel("alpha", alpha);
    }

    public static RgbaColor of(int red, int green, int blue, int alpha) {
        return new RgbaColor(red, green, blue, alpha);
    }

    /**
     * Returns the channels as {@code [r, g, b, a]}.
     */
    public int[] toArray() {
        return new int[]{red, green, blue, alpha};
    }

    /**
     * Creates a color from a {@code [r, g, b, a]} array.
     */
    public static RgbaColor fromArray(int[] rgba) {
        if (rgba == null || rgba.length != 4) {
            throw new IllegalArgumentException("color needs exactly 4 channels");
        }
        return new RgbaColor(rgba[0], rgba[1], rgba[2], rgba[3]);
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(name + " must be in [0, 255]: " + value);
        }
    }
}

package io.zither.canvas.coord;

import java.util.Objects;

/**
 * Maps chunk coordinates to and from their storage key.
 *
 * <p>The key is {@code "{x},{y}"}: both values in plain decimal, joined by a single comma,
 * no padding and no whitespace. Previously persisted canvases are keyed this way, so the
 * format must not change.
 */
public final class CoordinateKey {

    private static final char SEPARATOR = ',';

    private CoordinateKey() {
    }

    /**
     * Formats a coordinate as a storage key, e.g. {@code (-2, 3)} becomes {@code "-2,3"}.
     */
    public static String toKey(ChunkCoord coord) {
        Objects.requireNonNull(coord, "coord cannot be null");
        return coord.x() + String.valueOf(SEPARATOR) + coord.y();
    }

    /**
     * Parses a storage key back into a coordinate.
     *
     * @param key the key to parse
     * @return the coordinate
     * @throws IllegalArgumentException if the key is not two decimal integers separated by a comma
     */
    public static ChunkCoord fromKey(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        int comma = key.indexOf(SEPARATOR);
        if (comma <= 0 || comma == key.length() - 1 || key.indexOf(SEPARATOR, comma + 1) >= 0) {
            throw new IllegalArgumentException("Malformed chunk key: '" + key + "'");
        }
        try {
            int x = parseComponent(key.substring(0, comma));
            int y = parseComponent(key.substring(comma + 1));
            return new ChunkCoord(x, y);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed chunk key: '" + key + "'", e);
        }
    }

    /**
     * Returns true if the string is a well-formed storage key.
     */
    public static boolean isKey(String key) {
        if (key == null) {
            return false;
        }
        try {
            fromKey(key);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static int parseComponent(String text) {
        // Integer.parseInt accepts a leading '+', which toKey never writes
        if (text.startsWith("+")) {
            throw new NumberFormatException("Unexpected sign: " + text);
        }
        return Integer.parseInt(text);
    }
}

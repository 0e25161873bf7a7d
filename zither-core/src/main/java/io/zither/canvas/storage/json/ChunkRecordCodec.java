package io.zither.canvas.storage.json;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import io.zither.canvas.coord.ChunkCoord;
import io.zither.canvas.model.ChunkRecord;
import io.zither.canvas.model.Dimensions;
import io.zither.canvas.model.PaneRecord;
import io.zither.canvas.model.Position;
import io.zither.canvas.model.RgbaColor;
import io.zither.canvas.model.Size;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Converts chunk snapshots to and from JSON trees.
 *
 * <p>Field names follow the canvas document format:
 * <pre>
 * {
 *   "coords": [x, y],
 *   "uuid": "...",
 *   "panes": [{
 *     "uuid": "...", "paneType": "text", "data": {...},
 *     "chunkCoords": [x, y], "paneCoords": [px, py], "paneSize": [w, h],
 *     "semanticTags": "...", "color": [r, g, b, a]
 *   }],
 *   "dimensions": [w, h],
 *   "isLoaded": false,
 *   "lastAccessed": "2025-01-01T00:00:00Z"
 * }
 * </pre>
 *
 * <p>A pane entry that cannot be decoded is logged and dropped; the rest of the chunk
 * still decodes.
 */
public final class ChunkRecordCodec {

    private static final Logger LOG = Logger.getLogger(ChunkRecordCodec.class.getName());

    private ChunkRecordCodec() {
    }

    public static JsonObject encode(ChunkRecord record) {
        JsonObject json = new JsonObject();
        json.add("coords", intPair(record.coord().x(), record.coord().y()));
        json.addProperty("uuid", record.id());

        JsonArray panes = new JsonArray();
        for (PaneRecord pane : record.panes()) {
            if (pane != null) {
                panes.add(encodePane(pane));
            }
        }
        json.add("panes", panes);

        if (record.dimensions() != null) {
            json.add("dimensions", intPair(record.dimensions().width(), record.dimensions().height()));
        }
        json.addProperty("isLoaded", record.loaded());
        if (record.lastAccessed() != null) {
            json.addProperty("lastAccessed", record.lastAccessed().toString());
        }
        return json;
    }

    public static JsonObject encodePane(PaneRecord pane) {
        JsonObject json = new JsonObject();
        json.addProperty("uuid", pane.id());
        json.addProperty("paneType", pane.paneType());
        json.add("data", pane.data());
        json.add("chunkCoords", intPair(pane.chunkCoords().x(), pane.chunkCoords().y()));
        json.add("paneCoords", doublePair(pane.position().x(), pane.position().y()));
        json.add("paneSize", doublePair(pane.size().width(), pane.size().height()));
        json.addProperty("semanticTags", pane.semanticTags());

        JsonArray color = new JsonArray();
        for (int channel : pane.color().toArray()) {
            color.add(channel);
        }
        json.add("color", color);
        return json;
    }

    /**
     * Decodes a chunk stored under {@code coord}.
     *
     * <p>The storage key is authoritative: a {@code coords} field that disagrees with it is
     * ignored with a warning.
     *
     * @throws JsonParseException if the chunk itself is malformed
     */
    public static ChunkRecord decode(ChunkCoord coord, JsonObject json) {
        try {
            if (json.has("coords")) {
                int[] stored = readIntPair(json.get("coords"), "coords");
                if (stored[0] != coord.x() || stored[1] != coord.y()) {
                    LOG.warning("Chunk stored under " + coord.toKey() + " claims coords "
                            + stored[0] + "," + stored[1] + "; using the storage key");
                }
            }

            String id = requireString(json, "uuid");

            List<PaneRecord> panes = new ArrayList<>();
            JsonElement panesElement = json.get("panes");
            if (panesElement != null && panesElement.isJsonArray()) {
                JsonArray array = panesElement.getAsJsonArray();
                for (int i = 0; i < array.size(); i++) {
                    try {
                        panes.add(decodePane(coord, array.get(i).getAsJsonObject()));
                    } catch (JsonParseException | IllegalStateException | IllegalArgumentException
                             | UnsupportedOperationException | ClassCastException e) {
                        LOG.log(Level.WARNING, "Skipping unreadable pane #" + i + " of chunk " + coord.toKey(), e);
                    }
                }
            }

            Dimensions dimensions = null;
            if (json.has("dimensions") && !json.get("dimensions").isJsonNull()) {
                int[] dims = readIntPair(json.get("dimensions"), "dimensions");
                dimensions = new Dimensions(dims[0], dims[1]);
            }

            boolean loaded = json.has("isLoaded") && json.get("isLoaded").getAsBoolean();
            Instant lastAccessed = readInstant(json.get("lastAccessed"));

            return new ChunkRecord(coord, id, panes, dimensions, loaded, lastAccessed);

        } catch (IllegalStateException | IllegalArgumentException
                 | UnsupportedOperationException | ClassCastException e) {
            throw new JsonParseException("Malformed chunk " + coord.toKey() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Decodes one pane. A missing {@code chunkCoords} defaults to the owning chunk.
     */
    public static PaneRecord decodePane(ChunkCoord owner, JsonObject json) {
        String id = requireString(json, "uuid");

        ChunkCoord chunkCoords = owner;
        if (json.has("chunkCoords") && !json.get("chunkCoords").isJsonNull()) {
            int[] coords = readIntPair(json.get("chunkCoords"), "chunkCoords");
            chunkCoords = new ChunkCoord(coords[0], coords[1]);
        }

        Position position = Position.ZERO;
        if (json.has("paneCoords") && !json.get("paneCoords").isJsonNull()) {
            double[] xy = readDoublePair(json.get("paneCoords"), "paneCoords");
            position = new Position(xy[0], xy[1]);
        }

        Size size = Size.ZERO;
        if (json.has("paneSize") && !json.get("paneSize").isJsonNull()) {
            double[] wh = readDoublePair(json.get("paneSize"), "paneSize");
            size = new Size(wh[0], wh[1]);
        }

        RgbaColor color = RgbaColor.WHITE;
        if (json.has("color") && !json.get("color").isJsonNull()) {
            JsonArray channels = json.getAsJsonArray("color");
            if (channels.size() != 4) {
                throw new JsonParseException("color needs 4 channels, got " + channels.size());
            }
            color = new RgbaColor(channels.get(0).getAsInt(), channels.get(1).getAsInt(),
                    channels.get(2).getAsInt(), channels.get(3).getAsInt());
        }

        return new PaneRecord(
                id,
                optionalString(json, "paneType"),
                json.get("data"),
                chunkCoords,
                position,
                size,
                optionalString(json, "semanticTags"),
                color
        );
    }

    private static JsonArray intPair(int a, int b) {
        JsonArray array = new JsonArray();
        array.add(a);
        array.add(b);
        return array;
    }

    private static JsonArray doublePair(double a, double b) {
        JsonArray array = new JsonArray();
        array.add(a);
        array.add(b);
        return array;
    }

    private static int[] readIntPair(JsonElement element, String field) {
        JsonArray array = requirePair(element, field);
        return new int[]{array.get(0).getAsInt(), array.get(1).getAsInt()};
    }

    private static double[] readDoublePair(JsonElement element, String field) {
        JsonArray array = requirePair(element, field);
        return new double[]{array.get(0).getAsDouble(), array.get(1).getAsDouble()};
    }

    private static JsonArray requirePair(JsonElement element, String field) {
        if (element == null || !element.isJsonArray() || element.getAsJsonArray().size() != 2) {
            throw new JsonParseException(field + " must be a two-element array");
        }
        return element.getAsJsonArray();
    }

    private static String requireString(JsonObject json, String field) {
        JsonElement element = json.get(field);
        if (element == null || element.isJsonNull()) {
            throw new JsonParseException("missing field: " + field);
        }
        return element.getAsString();
    }

    private static String optionalString(JsonObject json, String field) {
        JsonElement element = json.get(field);
        return element == null || element.isJsonNull() ? null : element.getAsString();
    }

    private static Instant readInstant(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isNumber()) {
            return Instant.ofEpochMilli(element.getAsLong());
        }
        try {
            return Instant.parse(element.getAsString());
        } catch (DateTimeParseException e) {
            throw new JsonParseException("lastAccessed is not an ISO-8601 instant: " + element, e);
        }
    }
}

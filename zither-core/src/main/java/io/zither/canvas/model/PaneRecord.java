package io.zither.canvas.model;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import io.zither.canvas.coord.ChunkCoord;

import java.util.Objects;

/**
 * Last known attributes of one pane.
 *
 * <p>The id is unique across the whole canvas. {@code chunkCoords} names the owning chunk;
 * the window manager rewrites it whenever the pane is mounted into, or restored into, a
 * chunk at a different coordinate.
 *
 * @param id           globally unique pane identifier, assigned by the UI layer
 * @param paneType     type tag (e.g. "text", "image", "note")
 * @param data         opaque content payload
 * @param chunkCoords  coordinate of the owning chunk
 * @param position     chunk-local position of the top-left corner
 * @param size         chunk-local size
 * @param semanticTags free-text tags
 * @param color        RGBA color
 */
public record PaneRecord(
        String id,
        String paneType,
        JsonElement data,
        ChunkCoord chunkCoords,
        Position position,
        Size size,
        String semanticTags,
        RgbaColor color
) {

    public PaneRecord {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(chunkCoords, "chunkCoords cannot be null");

        if (id.isBlank()) {
            throw new IllegalArgumentException("id cannot be blank");
        }

        paneType = paneType == null ? "" : paneType;
        data = data == null ? JsonNull.INSTANCE : data.deepCopy();
        position = position == null ? Position.ZERO : position;
        size = size == null ? Size.ZERO : size;
        semanticTags = semanticTags == null ? "" : semanticTags;
        color = color == null ? RgbaColor.WHITE : color;
    }

    /**
     * Returns a copy of the payload; the record itself stays immutable.
     */
    @Override
    public JsonElement data() {
        return data.deepCopy();
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public PaneRecord withChunkCoords(ChunkCoord coords) {
        return new PaneRecord(id, paneType, data, coords, position, size, semanticTags, color);
    }

    public PaneRecord withPosition(Position newPosition) {
        return new PaneRecord(id, paneType, data, chunkCoords, newPosition, size, semanticTags, color);
    }

    public PaneRecord withSize(Size newSize) {
        return new PaneRecord(id, paneType, data, chunkCoords, position, newSize, semanticTags, color);
    }

    public PaneRecord withColor(RgbaColor newColor) {
        return new PaneRecord(id, paneType, data, chunkCoords, position, size, semanticTags, newColor);
    }

    public PaneRecord withSemanticTags(String tags) {
        return new PaneRecord(id, paneType, data, chunkCoords, position, size, tags, color);
    }

    /**
     * Builder for PaneRecord.
     */
    public static class Builder {
        private final String id;
        private String paneType = "";
        private JsonElement data;
        private ChunkCoord chunkCoords = ChunkCoord.ORIGIN;
        private Position position;
        private Size size;
        private String semanticTags;
        private RgbaColor color;

        private Builder(String id) {
            this.id = id;
        }

        public Builder paneType(String paneType) {
            this.paneType = paneType;
            return this;
        }

        public Builder data(JsonElement data) {
            this.data = data;
            return this;
        }

        public Builder chunkCoords(ChunkCoord chunkCoords) {
            this.chunkCoords = chunkCoords;
            return this;
        }

        public Builder chunkCoords(int x, int y) {
            this.chunkCoords = new ChunkCoord(x, y);
            return this;
        }

        public Builder position(double x, double y) {
            this.position = new Position(x, y);
            return this;
        }

        public Builder size(double width, double height) {
            this.size = new Size(width, height);
            return this;
        }

        public Builder semanticTags(String semanticTags) {
            this.semanticTags = semanticTags;
            return this;
        }

        public Builder color(RgbaColor color) {
            this.color = color;
            return this;
        }

        public PaneRecord build() {
            return new PaneRecord(id, paneType, data, chunkCoords, position, size, semanticTags, color);
        }
    }
}

package io.zither.canvas.config;

import io.zither.canvas.layout.OverflowPolicy;
import io.zither.canvas.layout.PackOptions;
import io.zither.canvas.model.Dimensions;
import io.zither.canvas.model.Size;
import io.zither.canvas.window.ChunkWindowManager;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Configuration for the zither canvas tools.
 *
 * <p>Loaded from {@code ~/.config/zither/canvas.json} by {@link CanvasConfigLoader}; CLI
 * arguments are merged on top by the caller.
 *
 * @param storageFile           chunk store file
 * @param renderDistance        default window radius in chunks
 * @param chunkDimensions       chunk size used when a chunk stores none
 * @param padding               gap between packed panes
 * @param margin                gap between packed panes and the chunk edge
 * @param minimumPaneSize       size given to panes without one when packing
 * @param overflowPolicy        placement of panes that do not fit
 */
public record CanvasConfig(
        Path storageFile,
        int renderDistance,
        Dimensions chunkDimensions,
        double padding,
        double margin,
        Size minimumPaneSize,
        OverflowPolicy overflowPolicy
) {

    /** Config directory */
    public static final Path CONFIG_DIR = Path.of(
            System.getProperty("user.home"), ".config", "zither"
    );

    /** Config file name */
    public static final String CONFIG_FILE = "canvas.json";

    /** Chunk store file name, inside the config directory by default */
    public static final String STORAGE_FILE = "chunks.json";

    public static final int DEFAULT_RENDER_DISTANCE = 2;

    public CanvasConfig {
        Objects.requireNonNull(storageFile, "storageFile cannot be null");
        Objects.requireNonNull(chunkDimensions, "chunkDimensions cannot be null");
        Objects.requireNonNull(minimumPaneSize, "minimumPaneSize cannot be null");
        Objects.requireNonNull(overflowPolicy, "overflowPolicy cannot be null");

        if (renderDistance < 0) {
            throw new IllegalArgumentException("renderDistance cannot be negative: " + renderDistance);
        }
        // Delegates padding, margin and size checks
        new PackOptions(minimumPaneSize, padding, margin, overflowPolicy);
    }

    /**
     * Returns the default configuration.
     */
    public static CanvasConfig defaults() {
        return new CanvasConfig(
                CONFIG_DIR.resolve(STORAGE_FILE),
                DEFAULT_RENDER_DISTANCE,
                ChunkWindowManager.DEFAULT_CHUNK_DIMENSIONS,
                PackOptions.DEFAULT_PADDING,
                PackOptions.DEFAULT_MARGIN,
                PackOptions.DEFAULT_MINIMUM_ITEM_SIZE,
                OverflowPolicy.STACK_BELOW
        );
    }

    /**
     * Returns the config file path.
     */
    public static Path configFile() {
        return CONFIG_DIR.resolve(CONFIG_FILE);
    }

    /**
     * Returns the packing options described by this configuration.
     */
    public PackOptions packOptions() {
        return new PackOptions(minimumPaneSize, padding, margin, overflowPolicy);
    }

    public CanvasConfig withStorageFile(Path file) {
        return new CanvasConfig(file, renderDistance, chunkDimensions, padding, margin,
                minimumPaneSize, overflowPolicy);
    }

    public CanvasConfig withRenderDistance(int distance) {
        return new CanvasConfig(storageFile, distance, chunkDimensions, padding, margin,
                minimumPaneSize, overflowPolicy);
    }

    public CanvasConfig withChunkDimensions(Dimensions dimensions) {
        return new CanvasConfig(storageFile, renderDistance, dimensions, padding, margin,
                minimumPaneSize, overflowPolicy);
    }

    public CanvasConfig withPadding(double value) {
        return new CanvasConfig(storageFile, renderDistance, chunkDimensions, value, margin,
                minimumPaneSize, overflowPolicy);
    }

    public CanvasConfig withMargin(double value) {
        return new CanvasConfig(storageFile, renderDistance, chunkDimensions, padding, value,
                minimumPaneSize, overflowPolicy);
    }

    public CanvasConfig withMinimumPaneSize(Size size) {
        return new CanvasConfig(storageFile, renderDistance, chunkDimensions, padding, margin,
                size, overflowPolicy);
    }

    public CanvasConfig withOverflowPolicy(OverflowPolicy policy) {
        return new CanvasConfig(storageFile, renderDistance, chunkDimensions, padding, margin,
                minimumPaneSize, policy);
    }
}

package io.zither.canvas.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.zither.canvas.layout.OverflowPolicy;
import io.zither.canvas.model.Dimensions;
import io.zither.canvas.model.Size;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads and saves CanvasConfig.
 *
 * <p>Keys missing from the file keep their defaults. A file that cannot be read or holds
 * invalid values is logged and ignored, leaving the defaults in place.
 *
 * <pre>
 * {
 *   "storageFile": "/home/me/.config/zither/chunks.json",
 *   "renderDistance": 2,
 *   "chunkWidth": 1470,
 *   "chunkHeight": 735,
 *   "padding": 8,
 *   "margin": 16,
 *   "minPaneWidth": 100,
 *   "minPaneHeight": 80,
 *   "overflowPolicy": "STACK_BELOW"
 * }
 * </pre>
 */
public final class CanvasConfigLoader {

    private static final Logger LOG = Logger.getLogger(CanvasConfigLoader.class.getName());

    private static final ObjectMapper JSON = new ObjectMapper();

    private CanvasConfigLoader() {
    }

    /**
     * Loads configuration from the default config file.
     */
    public static CanvasConfig load() {
        return load(CanvasConfig.configFile());
    }

    /**
     * Loads configuration from a specific file, or returns the defaults if it does not exist.
     *
     * @param configFile path to the config file
     * @return the loaded configuration
     */
    public static CanvasConfig load(Path configFile) {
        CanvasConfig defaults = CanvasConfig.defaults();
        if (!Files.exists(configFile)) {
            return defaults;
        }
        try {
            return apply(JSON.readTree(configFile.toFile()), defaults);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Cannot read config file " + configFile + "; using defaults", e);
            return defaults;
        } catch (IllegalArgumentException e) {
            LOG.warning("Invalid value in config file " + configFile + ": " + e.getMessage() + "; using defaults");
            return defaults;
        }
    }

    /**
     * Saves configuration to the default config file.
     *
     * @throws IOException if saving fails
     */
    public static void save(CanvasConfig config) throws IOException {
        save(config, CanvasConfig.configFile());
    }

    /**
     * Saves configuration to a specific file.
     *
     * @param config     the configuration to save
     * @param configFile path to write the config
     * @throws IOException if saving fails
     */
    public static void save(CanvasConfig config, Path configFile) throws IOException {
        Path parent = configFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        JSON.writerWithDefaultPrettyPrinter().writeValue(configFile.toFile(), toJson(config));
    }

    /**
     * Returns the JSON form of a configuration, as written by {@link #save}.
     */
    public static ObjectNode toJson(CanvasConfig config) {
        ObjectNode root = JSON.createObjectNode();
        root.put("storageFile", config.storageFile().toString());
        root.put("renderDistance", config.renderDistance());
        root.put("chunkWidth", config.chunkDimensions().width());
        root.put("chunkHeight", config.chunkDimensions().height());
        root.put("padding", config.padding());
        root.put("margin", config.margin());
        root.put("minPaneWidth", config.minimumPaneSize().width());
        root.put("minPaneHeight", config.minimumPaneSize().height());
        root.put("overflowPolicy", config.overflowPolicy().name());
        return root;
    }

    /**
     * Applies a single {@code key=value} setting, as accepted by {@code zither config --set}.
     *
     * @throws IllegalArgumentException if the key is unknown or the value invalid
     */
    public static CanvasConfig set(CanvasConfig config, String key, String value) {
        try {
            return switch (key) {
                case "storageFile" -> config.withStorageFile(Path.of(value));
                case "renderDistance" -> config.withRenderDistance(Integer.parseInt(value));
                case "chunkWidth" -> config.withChunkDimensions(
                        new Dimensions(Integer.parseInt(value), config.chunkDimensions().height()));
                case "chunkHeight" -> config.withChunkDimensions(
                        new Dimensions(config.chunkDimensions().width(), Integer.parseInt(value)));
                case "padding" -> config.withPadding(Double.parseDouble(value));
                case "margin" -> config.withMargin(Double.parseDouble(value));
                case "minPaneWidth" -> config.withMinimumPaneSize(
                        new Size(Double.parseDouble(value), config.minimumPaneSize().height()));
                case "minPaneHeight" -> config.withMinimumPaneSize(
                        new Size(config.minimumPaneSize().width(), Double.parseDouble(value)));
                case "overflowPolicy" -> config.withOverflowPolicy(OverflowPolicy.fromName(value));
                default -> throw new IllegalArgumentException("Unknown config key: " + key);
            };
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    private static CanvasConfig apply(JsonNode root, CanvasConfig base) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("config root must be a JSON object");
        }
        CanvasConfig config = base;

        if (root.has("storageFile")) {
            config = config.withStorageFile(Path.of(root.get("storageFile").asText()));
        }
        if (root.has("renderDistance")) {
            config = config.withRenderDistance(root.get("renderDistance").asInt());
        }
        if (root.has("chunkWidth") || root.has("chunkHeight")) {
            int width = getIntOrDefault(root, "chunkWidth", config.chunkDimensions().width());
            int height = getIntOrDefault(root, "chunkHeight", config.chunkDimensions().height());
            config = config.withChunkDimensions(new Dimensions(width, height));
        }
        if (root.has("padding")) {
            config = config.withPadding(root.get("padding").asDouble());
        }
        if (root.has("margin")) {
            config = config.withMargin(root.get("margin").asDouble());
        }
        if (root.has("minPaneWidth") || root.has("minPaneHeight")) {
            double width = getDoubleOrDefault(root, "minPaneWidth", config.minimumPaneSize().width());
            double height = getDoubleOrDefault(root, "minPaneHeight", config.minimumPaneSize().height());
            config = config.withMinimumPaneSize(new Size(width, height));
        }
        if (root.has("overflowPolicy")) {
            config = config.withOverflowPolicy(OverflowPolicy.fromName(root.get("overflowPolicy").asText()));
        }
        return config;
    }

    private static int getIntOrDefault(JsonNode node, String field, int defaultValue) {
        return node.has(field) ? node.get(field).asInt() : defaultValue;
    }

    private static double getDoubleOrDefault(JsonNode node, String field, double defaultValue) {
        return node.has(field) ? node.get(field).asDouble() : defaultValue;
    }
}

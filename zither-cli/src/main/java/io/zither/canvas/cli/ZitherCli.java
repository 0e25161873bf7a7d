package io.zither.canvas.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.zither.canvas.config.CanvasConfig;
import io.zither.canvas.config.CanvasConfigLoader;
import io.zither.canvas.coord.ChunkCoord;
import io.zither.canvas.coord.CoordinateKey;
import io.zither.canvas.layout.OverflowPolicy;
import io.zither.canvas.layout.PackOptions;
import io.zither.canvas.layout.PackResult;
import io.zither.canvas.layout.Placement;
import io.zither.canvas.model.ChunkRecord;
import io.zither.canvas.model.PaneRecord;
import io.zither.canvas.storage.SpatialStorageAdapter;
import io.zither.canvas.storage.StorageException;
import io.zither.canvas.window.ChunkWindowManager;
import io.zither.canvas.window.SpiralTraversal;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Zither CLI - inspects and maintains a canvas chunk store.
 *
 * <p>Commands:
 * <ul>
 *   <li>list - List stored chunks</li>
 *   <li>show - Show the panes of a chunk</li>
 *   <li>arrange - Pack the panes of a chunk and save the result</li>
 *   <li>window - Show the load order of a viewport window</li>
 *   <li>delete - Delete a stored chunk</li>
 *   <li>config - Show/set configuration</li>
 * </ul>
 */
public class ZitherCli {

    private static final String VERSION = "0.1.0";
    private static final ObjectMapper JSON = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);
    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    private final PrintStream out;
    private final PrintStream err;

    ZitherCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        configureLogging(hasFlag(args, "--verbose"));
        int exitCode = new ZitherCli(System.out, System.err).run(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Runs one command.
     *
     * @return the process exit code
     */
    int run(String[] args) {
        if (args.length == 0) {
            printHelp();
            return 0;
        }

        String command = args[0];

        if (command.equals("--help") || command.equals("-h")) {
            printHelp();
            return 0;
        }
        if (command.equals("--version") || command.equals("-v")) {
            out.println("zither " + VERSION);
            return 0;
        }
        String[] commandArgs = Arrays.copyOfRange(args, 1, args.length);

        try {
            return switch (command) {
                case "list" -> handleList(commandArgs);
                case "show" -> handleShow(commandArgs);
                case "arrange" -> handleArrange(commandArgs);
                case "window" -> handleWindow(commandArgs);
                case "delete" -> handleDelete(commandArgs);
                case "config" -> handleConfig(commandArgs);
                default -> {
                    err.println("Unknown command: " + command);
                    err.println("Run 'zither --help' for usage.");
                    yield 1;
                }
            };
        } catch (StorageException e) {
            err.println("Storage error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private int handleList(String[] args) throws StorageException, IOException {
        if (hasFlag(args, "--help")) {
            out.println("Usage: zither list [--storage <file>] [--config <file>] [--json]");
            return 0;
        }
        CanvasConfig config = loadConfig(args);
        boolean json = hasFlag(args, "--json");

        List<ChunkRecord> chunks;
        try (SpatialStorageAdapter storage = SpatialStorageAdapter.jsonFile(config.storageFile())) {
            chunks = new ArrayList<>(storage.listAllChunks());
        }
        chunks.sort(Comparator.comparing(ChunkRecord::coord));

        if (json) {
            ArrayNode array = JSON.createArrayNode();
            for (ChunkRecord chunk : chunks) {
                array.add(chunkSummary(chunk));
            }
            out.println(JSON.writeValueAsString(array));
            return 0;
        }

        if (chunks.isEmpty()) {
            out.println("No chunks stored in " + config.storageFile());
            return 0;
        }
        out.printf("%-12s  %-36s  %5s  %s%n", "CHUNK", "UUID", "PANES", "LAST ACCESSED");
        out.println("-".repeat(80));
        for (ChunkRecord chunk : chunks) {
            out.printf("%-12s  %-36s  %5d  %s%n",
                    chunk.key(),
                    chunk.id(),
                    chunk.panes().size(),
                    chunk.lastAccessedIfPresent().map(TIME_FORMAT::format).orElse("-"));
        }
        return 0;
    }

    private int handleShow(String[] args) throws StorageException, IOException {
        if (args.length == 0 || hasFlag(args, "--help")) {
            out.println("Usage: zither show <x,y> [--storage <file>] [--config <file>] [--json]");
            return args.length == 0 ? 1 : 0;
        }
        ChunkCoord coord = parseCoord(args[0]);
        CanvasConfig config = loadConfig(args);
        boolean json = hasFlag(args, "--json");

        Optional<ChunkRecord> stored;
        try (SpatialStorageAdapter storage = SpatialStorageAdapter.jsonFile(config.storageFile())) {
            stored = storage.loadChunk(coord);
        }
        if (stored.isEmpty()) {
            err.println("No chunk stored at " + coord.toKey());
            return 1;
        }
        ChunkRecord chunk = stored.get();

        if (json) {
            ObjectNode root = chunkSummary(chunk);
            ArrayNode panes = root.putArray("paneList");
            for (PaneRecord pane : chunk.panes()) {
                panes.add(paneJson(pane));
            }
            out.println(JSON.writeValueAsString(root));
            return 0;
        }

        out.println("Chunk " + chunk.key());
        out.println("-".repeat(40));
        out.println("UUID: " + chunk.id());
        out.println("Dimensions: " + chunk.dimensionsIfPresent()
                .map(d -> d.width() + " x " + d.height())
                .orElse("(default " + config.chunkDimensions().width() + " x "
                        + config.chunkDimensions().height() + ")"));
        out.println("Last Accessed: " + chunk.lastAccessedIfPresent().map(TIME_FORMAT::format).orElse("-"));
        out.println("Panes: " + chunk.panes().size());
        for (PaneRecord pane : chunk.panes()) {
            out.printf("  - %s  %-10s  at (%.1f, %.1f)  size %.1f x %.1f%s%n",
                    pane.id(),
                    pane.paneType(),
                    pane.position().x(), pane.position().y(),
                    pane.size().width(), pane.size().height(),
                    pane.semanticTags().isEmpty() ? "" : "  [" + pane.semanticTags() + "]");
        }
        return 0;
    }

    private int handleArrange(String[] args) throws StorageException, IOException {
        if (args.length == 0 || hasFlag(args, "--help")) {
            printArrangeHelp();
            return args.length == 0 ? 1 : 0;
        }
        ChunkCoord coord = parseCoord(args[0]);
        CanvasConfig config = loadConfig(args);
        boolean json = hasFlag(args, "--json");
        PackOptions options = packOptions(args, config);

        PackResult result;
        try (SpatialStorageAdapter storage = SpatialStorageAdapter.jsonFile(config.storageFile())) {
            if (!storage.hasChunk(coord)) {
                err.println("No chunk stored at " + coord.toKey());
                return 1;
            }
            ChunkWindowManager manager = ChunkWindowManager.builder(storage)
                    .defaultDimensions(config.chunkDimensions())
                    .build();
            manager.load(coord);
            result = manager.arrangeChunk(coord, options).orElseThrow();
            manager.unload(coord);
        }

        if (json) {
            out.println(JSON.writeValueAsString(packResultJson(result)));
            return 0;
        }

        out.println("Arranged " + result.placements().size() + " panes in chunk " + coord.toKey());
        out.println("All Fit: " + result.allFit());
        out.printf("Utilization: %.1f%%%n", result.utilization() * 100);
        for (Placement p : result.placements()) {
            out.printf("  - %s  at (%.1f, %.1f)  size %.1f x %.1f%s%n",
                    p.itemId(), p.x(), p.y(), p.width(), p.height(), p.fitted() ? "" : "  (overflow)");
        }
        return 0;
    }

    private int handleWindow(String[] args) throws StorageException, IOException {
        if (args.length == 0 || hasFlag(args, "--help")) {
            out.println("Usage: zither window <x,y> [--radius <n>] [--storage <file>] [--config <file>] [--json]");
            out.println();
            out.println("Show the chunks a viewport at <x,y> would load, nearest first.");
            return args.length == 0 ? 1 : 0;
        }
        ChunkCoord origin = parseCoord(args[0]);
        CanvasConfig config = loadConfig(args);
        boolean json = hasFlag(args, "--json");
        String radiusStr = getFlagValue(args, "--radius");
        int radius = radiusStr != null ? parseInt("--radius", radiusStr) : config.renderDistance();
        if (radius < 0) {
            throw new IllegalArgumentException("--radius cannot be negative: " + radius);
        }

        ArrayNode array = JSON.createArrayNode();
        List<String> lines = new ArrayList<>();
        try (SpatialStorageAdapter storage = SpatialStorageAdapter.jsonFile(config.storageFile())) {
            int order = 0;
            for (ChunkCoord coord : SpiralTraversal.around(origin, radius)) {
                boolean stored = storage.hasChunk(coord);
                long distance = coord.chebyshevDistance(origin);
                ObjectNode node = array.addObject();
                node.put("order", order);
                node.put("chunk", coord.toKey());
                node.put("distance", distance);
                node.put("stored", stored);
                lines.add(String.format("%5d  %-12s  %8d  %s", order, coord.toKey(), distance, stored ? "stored" : "new"));
                order++;
            }
        }

        if (json) {
            out.println(JSON.writeValueAsString(array));
        } else {
            out.printf("%5s  %-12s  %8s  %s%n", "ORDER", "CHUNK", "DISTANCE", "STATE");
            out.println("-".repeat(40));
            lines.forEach(out::println);
        }
        return 0;
    }

    private int handleDelete(String[] args) throws StorageException {
        if (args.length == 0 || hasFlag(args, "--help")) {
            out.println("Usage: zither delete <x,y> [--storage <file>] [--config <file>]");
            return args.length == 0 ? 1 : 0;
        }
        ChunkCoord coord = parseCoord(args[0]);
        CanvasConfig config = loadConfig(args);

        boolean deleted;
        try (SpatialStorageAdapter storage = SpatialStorageAdapter.jsonFile(config.storageFile())) {
            deleted = storage.deleteChunk(coord);
        }
        if (deleted) {
            out.println("Deleted chunk " + coord.toKey());
        } else {
            out.println("No chunk stored at " + coord.toKey());
        }
        return 0;
    }

    private int handleConfig(String[] args) throws IOException {
        if (hasFlag(args, "--help")) {
            out.println("Usage: zither config [--config <file>] [--set key=value] [--json]");
            out.println();
            out.println("Keys: storageFile, renderDistance, chunkWidth, chunkHeight, padding, margin,");
            out.println("      minPaneWidth, minPaneHeight, overflowPolicy");
            return 0;
        }
        Path configFile = configFile(args);
        CanvasConfig config = CanvasConfigLoader.load(configFile);
        boolean json = hasFlag(args, "--json");

        String setValue = getFlagValue(args, "--set");
        if (setValue != null) {
            String[] parts = setValue.split("=", 2);
            if (parts.length != 2) {
                err.println("Invalid format. Use --set key=value");
                return 1;
            }
            config = CanvasConfigLoader.set(config, parts[0], parts[1]);
            CanvasConfigLoader.save(config, configFile);
            out.println("Configuration updated.");
        }

        if (json) {
            out.println(JSON.writeValueAsString(CanvasConfigLoader.toJson(config)));
        } else {
            out.println("Configuration:");
            out.println("-".repeat(40));
            out.println("Storage File: " + config.storageFile());
            out.println("Render Distance: " + config.renderDistance());
            out.println("Chunk Size: " + config.chunkDimensions().width() + " x " + config.chunkDimensions().height());
            out.println("Padding: " + config.padding());
            out.println("Margin: " + config.margin());
            out.println("Minimum Pane Size: " + config.minimumPaneSize().width() + " x " + config.minimumPaneSize().height());
            out.println("Overflow Policy: " + config.overflowPolicy());
        }
        return 0;
    }

    // ===== Helper methods =====

    private static void configureLogging(boolean verbose) {
        try (InputStream in = ZitherCli.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Cannot read logging configuration: " + e.getMessage());
        }
        if (verbose) {
            Logger.getLogger("io.zither.canvas").setLevel(Level.FINE);
        }
    }

    static CanvasConfig loadConfig(String[] args) {
        CanvasConfig config = CanvasConfigLoader.load(configFile(args));
        String storage = getFlagValue(args, "--storage");
        if (storage != null) {
            config = config.withStorageFile(Path.of(storage));
        }
        return config;
    }

    static Path configFile(String[] args) {
        String path = getFlagValue(args, "--config");
        return path != null ? Path.of(path) : CanvasConfig.configFile();
    }

    static PackOptions packOptions(String[] args, CanvasConfig config) {
        PackOptions options = config.packOptions();
        String policy = getFlagValue(args, "--policy");
        if (policy != null) {
            options = options.withOverflowPolicy(OverflowPolicy.fromName(policy));
        }
        String padding = getFlagValue(args, "--padding");
        if (padding != null) {
            options = options.withPadding(parseDouble("--padding", padding));
        }
        String margin = getFlagValue(args, "--margin");
        if (margin != null) {
            options = options.withMargin(parseDouble("--margin", margin));
        }
        return options;
    }

    static ChunkCoord parseCoord(String value) {
        if (!CoordinateKey.isKey(value)) {
            throw new IllegalArgumentException("Expected chunk coordinates as x,y but got: " + value);
        }
        return CoordinateKey.fromKey(value);
    }

    private static int parseInt(String flag, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(flag + " expects an integer: " + value, e);
        }
    }

    private static double parseDouble(String flag, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(flag + " expects a number: " + value, e);
        }
    }

    private static ObjectNode chunkSummary(ChunkRecord chunk) {
        ObjectNode node = JSON.createObjectNode();
        node.put("chunk", chunk.key());
        node.put("uuid", chunk.id());
        node.put("panes", chunk.panes().size());
        chunk.dimensionsIfPresent().ifPresent(d -> {
            ArrayNode dims = node.putArray("dimensions");
            dims.add(d.width());
            dims.add(d.height());
        });
        chunk.lastAccessedIfPresent().ifPresent(t -> node.put("lastAccessed", t.toString()));
        return node;
    }

    private static ObjectNode paneJson(PaneRecord pane) throws IOException {
        ObjectNode node = JSON.createObjectNode();
        node.put("uuid", pane.id());
        node.put("paneType", pane.paneType());
        node.put("x", pane.position().x());
        node.put("y", pane.position().y());
        node.put("width", pane.size().width());
        node.put("height", pane.size().height());
        node.put("semanticTags", pane.semanticTags());
        node.set("data", JSON.readTree(pane.data().toString()));
        return node;
    }

    private static ObjectNode packResultJson(PackResult result) {
        ObjectNode root = JSON.createObjectNode();
        root.put("allFit", result.allFit());
        root.put("utilization", result.utilization());
        ArrayNode placements = root.putArray("placements");
        for (Placement p : result.placements()) {
            ObjectNode node = placements.addObject();
            node.put("uuid", p.itemId());
            node.put("x", p.x());
            node.put("y", p.y());
            node.put("width", p.width());
            node.put("height", p.height());
            node.put("fitted", p.fitted());
        }
        return root;
    }

    static boolean hasFlag(String[] args, String flag) {
        return Arrays.asList(args).contains(flag);
    }

    static String getFlagValue(String[] args, String flag) {
        List<String> argList = Arrays.asList(args);
        int index = argList.indexOf(flag);
        if (index >= 0 && index < args.length - 1) {
            return args[index + 1];
        }
        return null;
    }

    // ===== Help output =====

    private void printHelp() {
        out.println("Zither CLI - canvas chunk store tool");
        out.println();
        out.println("Usage: zither <command> [options]");
        out.println();
        out.println("Commands:");
        out.println("  list          List stored chunks");
        out.println("  show          Show the panes of a chunk");
        out.println("  arrange       Pack the panes of a chunk and save the result");
        out.println("  window        Show the load order of a viewport window");
        out.println("  delete        Delete a stored chunk");
        out.println("  config        Show/set configuration");
        out.println();
        out.println("Options:");
        out.println("  -h, --help         Show help for a command");
        out.println("  -v, --version      Show version");
        out.println("  --storage <file>   Chunk store file (default: from config)");
        out.println("  --config <file>    Config file (default: ~/.config/zither/canvas.json)");
        out.println("  --verbose          Log chunk lifecycle events");
        out.println();
        out.println("Examples:");
        out.println("  zither list");
        out.println("  zither show 0,-1 --json");
        out.println("  zither arrange 2,3 --policy shelf");
        out.println("  zither window 0,0 --radius 1");
    }

    private void printArrangeHelp() {
        out.println("Usage: zither arrange <x,y> [options]");
        out.println();
        out.println("Pack the panes of a stored chunk and save the new positions.");
        out.println();
        out.println("Options:");
        out.println("  --policy <name>       Overflow policy: STACK_BELOW, SHELF (default: from config)");
        out.println("  --padding <px>        Gap between panes (default: from config)");
        out.println("  --margin <px>         Gap to the chunk edge (default: from config)");
        out.println("  --json                Output as JSON");
    }
}

package io.zither.canvas.cli;

import io.zither.canvas.config.CanvasConfig;
import io.zither.canvas.config.CanvasConfigLoader;
import io.zither.canvas.coord.ChunkCoord;
import io.zither.canvas.layout.OverflowPolicy;
import io.zither.canvas.layout.PackOptions;
import io.zither.canvas.model.ChunkRecord;
import io.zither.canvas.model.PaneRecord;
import io.zither.canvas.model.Position;
import io.zither.canvas.storage.SpatialStorageAdapter;
import io.zither.canvas.storage.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the zither command line.
 */
class ZitherCliTest {

    @TempDir
    Path tempDir;

    private Path storageFile;
    private Path configFile;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        storageFile = tempDir.resolve("chunks.json");
        configFile = tempDir.resolve("canvas.json");
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int run(String... args) {
        List<String> all = new ArrayList<>(Arrays.asList(args));
        all.add("--storage");
        all.add(storageFile.toString());
        all.add("--config");
        all.add(configFile.toString());
        ZitherCli cli = new ZitherCli(
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        return cli.run(all.toArray(new String[0]));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private void seed(ChunkRecord... records) throws StorageException {
        try (SpatialStorageAdapter storage = SpatialStorageAdapter.jsonFile(storageFile)) {
            for (ChunkRecord record : records) {
                storage.saveChunk(record);
            }
        }
    }

    private static PaneRecord pane(String id, ChunkCoord coord, double width, double height) {
        return PaneRecord.builder(id)
                .paneType("text")
                .chunkCoords(coord)
                .position(0, 0)
                .size(width, height)
                .build();
    }

    // ===== Top level =====

    @Test
    void helpAndVersion() {
        ZitherCli cli = new ZitherCli(
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));

        assertEquals(0, cli.run(new String[]{"--help"}));
        assertTrue(stdout().contains("Usage: zither <command>"));

        assertEquals(0, cli.run(new String[]{"--version"}));
        assertTrue(stdout().contains("zither 0.1.0"));
    }

    @Test
    void unknownCommandFails() {
        assertEquals(1, run("frobnicate"));
        assertTrue(stderr().contains("Unknown command: frobnicate"));
    }

    @Test
    void malformedCoordinateFails() {
        assertEquals(1, run("show", "1;2"));
        assertTrue(stderr().contains("Expected chunk coordinates as x,y"));
    }

    // ===== Commands =====

    @Test
    void listEmptyStore() {
        assertEquals(0, run("list"));
        assertTrue(stdout().contains("No chunks stored"));
    }

    @Test
    void listShowsStoredChunks() throws StorageException {
        ChunkCoord coord = new ChunkCoord(-1, 2);
        seed(ChunkRecord.empty(coord, "chunk-a").withPanes(List.of(pane("p1", coord, 200, 100))));

        assertEquals(0, run("list"));
        assertTrue(stdout().contains("-1,2"));
        assertTrue(stdout().contains("chunk-a"));
    }

    @Test
    void listSkipsUnreadableChunk() throws IOException {
        Files.writeString(storageFile, "{\"0,0\": {\"uuid\": \"healthy\", \"panes\": []}, \"1,0\": {\"panes\": []}}");

        assertEquals(0, run("list"));
        assertTrue(stdout().contains("healthy"));
        assertFalse(stdout().contains("1,0"));
    }

    @Test
    void listAsJson() throws StorageException {
        seed(ChunkRecord.empty(new ChunkCoord(0, 0), "chunk-a"));

        assertEquals(0, run("list", "--json"));
        assertTrue(stdout().contains("\"chunk\" : \"0,0\""));
        assertTrue(stdout().contains("\"uuid\" : \"chunk-a\""));
    }

    @Test
    void showListsPanes() throws StorageException {
        ChunkCoord coord = new ChunkCoord(3, -4);
        seed(ChunkRecord.empty(coord, "chunk-b").withPanes(List.of(pane("note-1", coord, 320, 240))));

        assertEquals(0, run("show", "3,-4"));
        assertTrue(stdout().contains("Chunk 3,-4"));
        assertTrue(stdout().contains("note-1"));
        assertTrue(stdout().contains("default 1470 x 735"));
    }

    @Test
    void showMissingChunkFails() {
        assertEquals(1, run("show", "9,9"));
        assertTrue(stderr().contains("No chunk stored at 9,9"));
    }

    @Test
    void arrangePacksAndSaves() throws StorageException {
        ChunkCoord coord = new ChunkCoord(1, 1);
        seed(ChunkRecord.empty(coord, "chunk-c").withPanes(List.of(
                pane("small", coord, 200, 100),
                pane("large", coord, 400, 300))));

        assertEquals(0, run("arrange", "1,1"));
        assertTrue(stdout().contains("Arranged 2 panes in chunk 1,1"));
        assertTrue(stdout().contains("All Fit: true"));

        try (SpatialStorageAdapter storage = SpatialStorageAdapter.jsonFile(storageFile)) {
            ChunkRecord saved = storage.loadChunk(coord).orElseThrow();
            PaneRecord large = saved.panes().stream()
                    .filter(p -> p.id().equals("large"))
                    .findFirst()
                    .orElseThrow();
            assertEquals(new Position(PackOptions.DEFAULT_MARGIN, PackOptions.DEFAULT_MARGIN), large.position());
            assertFalse(saved.loaded());
        }
    }

    @Test
    void arrangeMissingChunkFails() {
        assertEquals(1, run("arrange", "5,5"));
        assertTrue(stderr().contains("No chunk stored at 5,5"));
    }

    @Test
    void arrangeRejectsBadPadding() throws StorageException {
        seed(ChunkRecord.empty(new ChunkCoord(0, 0), "chunk-d"));

        assertEquals(1, run("arrange", "0,0", "--padding", "lots"));
        assertTrue(stderr().contains("--padding expects a number"));
    }

    @Test
    void windowListsSpiralOrder() throws StorageException {
        seed(ChunkRecord.empty(new ChunkCoord(1, 0), "chunk-e"));

        assertEquals(0, run("window", "0,0", "--radius", "1"));
        String[] lines = stdout().split("\\R");
        // header, rule, then nine chunks
        assertEquals(11, lines.length);
        assertTrue(lines[2].contains("0,0"));
        assertTrue(lines[3].contains("1,0"));
        assertTrue(lines[3].contains("stored"));
        assertTrue(lines[4].contains("0,1"));
        assertTrue(lines[4].contains("new"));
    }

    @Test
    void windowRejectsNegativeRadius() {
        assertEquals(1, run("window", "0,0", "--radius", "-1"));
        assertTrue(stderr().contains("--radius cannot be negative"));
    }

    @Test
    void deleteRemovesChunk() throws StorageException {
        ChunkCoord coord = new ChunkCoord(2, 2);
        seed(ChunkRecord.empty(coord, "chunk-f"));

        assertEquals(0, run("delete", "2,2"));
        assertTrue(stdout().contains("Deleted chunk 2,2"));

        try (SpatialStorageAdapter storage = SpatialStorageAdapter.jsonFile(storageFile)) {
            assertFalse(storage.hasChunk(coord));
        }
    }

    @Test
    void configSetPersistsValue() {
        assertEquals(0, run("config", "--set", "renderDistance=4"));
        assertTrue(stdout().contains("Configuration updated."));
        assertTrue(stdout().contains("Render Distance: 4"));

        assertEquals(4, CanvasConfigLoader.load(configFile).renderDistance());
    }

    @Test
    void configSetRejectsMissingEquals() {
        assertEquals(1, run("config", "--set", "renderDistance"));
        assertTrue(stderr().contains("Use --set key=value"));
    }

    @Test
    void configSetRejectsUnknownKey() {
        assertEquals(1, run("config", "--set", "colour=red"));
        assertTrue(stderr().contains("Unknown config key: colour"));
    }

    // ===== Helpers =====

    @Test
    void flagHelpers() {
        String[] args = {"arrange", "0,0", "--policy", "shelf", "--json"};

        assertTrue(ZitherCli.hasFlag(args, "--json"));
        assertFalse(ZitherCli.hasFlag(args, "--verbose"));
        assertEquals("shelf", ZitherCli.getFlagValue(args, "--policy"));
        assertNull(ZitherCli.getFlagValue(args, "--json"));
        assertNull(ZitherCli.getFlagValue(args, "--margin"));
    }

    @Test
    void packOptionsMergeFlagsOverConfig() {
        String[] args = {"--policy", "shelf", "--padding", "2"};
        PackOptions options = ZitherCli.packOptions(args, CanvasConfig.defaults());

        assertEquals(OverflowPolicy.SHELF, options.overflowPolicy());
        assertEquals(2.0, options.padding());
        assertEquals(PackOptions.DEFAULT_MARGIN, options.margin());
    }

    @Test
    void parseCoordAcceptsNegativeComponents() {
        assertEquals(new ChunkCoord(-3, 7), ZitherCli.parseCoord("-3,7"));
        assertThrows(IllegalArgumentException.class, () -> ZitherCli.parseCoord("3"));
    }
}

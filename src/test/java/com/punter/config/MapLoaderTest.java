package com.punter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MapLoader: classpath maps, map files and name resolution.
 */
class MapLoaderTest {

    private MapLoader loader;

    @BeforeEach
    void setUp() {
        loader = new MapLoader(new ObjectMapper());
        loader.loadMaps();
    }

    // ── getMap / getAvailableMaps ────────────────────────────────────────

    @Test
    @DisplayName("loadMaps() should load built-in maps from every classpath root")
    void shouldLoadClasspathMaps() {
        assertTrue(loader.getAvailableMaps().containsAll(List.of("sample", "sparse-line")));
    }

    @Test
    @DisplayName("getAvailableMaps() should return an unmodifiable list")
    void shouldReturnUnmodifiableNames() {
        List<String> names = loader.getAvailableMaps();

        assertThrows(UnsupportedOperationException.class, () -> names.add("other"));
    }

    @Test
    @DisplayName("getMap() should return the sample map with its sites, rivers and mines")
    void shouldReturnSampleMap() {
        MapDefinition map = loader.getMap("sample");

        assertEquals(8, map.sites().size());
        assertEquals(12, map.rivers().size());
        assertEquals(List.of(1, 5), map.mines());
        assertEquals(new SiteDefinition(4, 2.0, -2.0), map.sites().get(0));
        assertEquals(new RiverDefinition(3, 4), map.rivers().get(0));
    }

    @Test
    @DisplayName("sites without coordinates should load with null coordinates")
    void shouldAllowMissingCoordinates() {
        SiteDefinition site = loader.getMap("sparse-line").sites().get(0);

        assertEquals(10, site.id());
        assertNull(site.x());
        assertNull(site.y());
    }

    @Test
    @DisplayName("getMap() should throw for an unknown map name")
    void shouldThrowForUnknownMap() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> loader.getMap("nonexistent-map"));

        assertTrue(ex.getMessage().contains("Unknown map"));
        assertTrue(ex.getMessage().contains("nonexistent-map"));
    }

    // ── resolve / map files ─────────────────────────────────────────────

    @Test
    @DisplayName("resolve() should prefer a loaded map name")
    void shouldResolveLoadedName() {
        assertSame(loader.getMap("sample"), loader.resolve("sample"));
    }

    @Test
    @DisplayName("resolve() should read a map file path and ignore unknown fields")
    void shouldResolveFilePath(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("pair.json");
        Files.writeString(file, """
                {
                  "sites": [{"id": 1}, {"id": 2, "x": 3.0, "y": 4.0}],
                  "rivers": [{"source": 1, "target": 2}],
                  "mines": [2],
                  "comment": "ignored"
                }
                """);

        MapDefinition map = loader.resolve(file.toString());

        assertEquals(2, map.sites().size());
        assertEquals(List.of(new RiverDefinition(1, 2)), map.rivers());
        assertEquals(List.of(2), map.mines());
    }

    @Test
    @DisplayName("missing lists in a map file should read as empty")
    void shouldDefaultMissingLists(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("empty.json");
        Files.writeString(file, "{}");

        MapDefinition map = loader.readMapFile(file);

        assertTrue(map.sites().isEmpty());
        assertTrue(map.rivers().isEmpty());
        assertTrue(map.mines().isEmpty());
    }

    @Test
    @DisplayName("resolve() should throw for a name that is neither loaded nor a file")
    void shouldThrowForUnknownPath() {
        assertThrows(IllegalArgumentException.class, () -> loader.resolve("no/such/map.json"));
        assertThrows(IllegalArgumentException.class, () -> loader.resolve(null));
    }

    @Test
    @DisplayName("malformed map files should be reported, not half-loaded")
    void shouldRejectMalformedFile(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("bad.json");
        Files.writeString(file, "{ invalid json }}");

        assertThrows(UncheckedIOException.class, () -> loader.readMapFile(file));
        assertThrows(IllegalArgumentException.class, () -> loader.resolve(file.toString()));
    }

    @Test
    @DisplayName("loadMaps() should handle a missing external maps directory gracefully")
    void shouldHandleMissingExternalDir() {
        MapLoader fresh = new MapLoader(new ObjectMapper());

        assertDoesNotThrow(fresh::loadMaps);
    }
}

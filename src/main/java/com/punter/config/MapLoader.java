package com.punter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Loads all available map definitions at startup.
 * <p>
 * Maps are loaded from two locations (in order):
 * <ol>
 *   <li>Classpath: {@code classpath*:maps/*.json} – built-in maps shipped with the app</li>
 *   <li>External folder: {@code ./maps/} next to the running jar – user-supplied maps</li>
 * </ol>
 * A map is named after its file without the {@code .json} extension. If an external map has
 * the same name as a built-in map, the external one wins.
 */
@Component
@Slf4j
public class MapLoader {

    private static final String EXTENSION = ".json";

    private final ObjectMapper objectMapper;

    /** All loaded maps keyed by their name. */
    @Getter
    private final Map<String, MapDefinition> maps = new LinkedHashMap<>();

    public MapLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void loadMaps() {
        loadClasspathMaps();
        loadExternalMaps();

        if (maps.isEmpty()) {
            log.warn("No map definitions found! Simulations need a map name or a map file path.");
        } else {
            log.info("Loaded {} map(s): {}", maps.size(), maps.keySet());
        }
    }

    /**
     * Returns an unmodifiable list of every loaded map name.
     */
    public List<String> getAvailableMaps() {
        return List.copyOf(maps.keySet());
    }

    /**
     * Get a loaded map by its name.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public MapDefinition getMap(String name) {
        MapDefinition map = maps.get(name);
        if (map == null) {
            throw new IllegalArgumentException("Unknown map: " + name
                    + ". Available maps: " + maps.keySet());
        }
        return map;
    }

    /**
     * Resolve a loaded map name, or else read the argument as a path to a map file.
     *
     * @throws IllegalArgumentException if it is neither a loaded map nor a readable file
     */
    public MapDefinition resolve(String nameOrPath) {
        if (nameOrPath != null && maps.containsKey(nameOrPath)) {
            return maps.get(nameOrPath);
        }
        Path path = nameOrPath == null ? null : Paths.get(nameOrPath);
        if (path == null || !Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Unknown map: " + nameOrPath
                    + ". Available maps: " + maps.keySet());
        }
        try {
            return readMapFile(path);
        } catch (UncheckedIOException e) {
            throw new IllegalArgumentException("Could not read map file " + path + ": "
                    + e.getCause().getMessage(), e);
        }
    }

    /**
     * Read a single map file.
     *
     * @throws UncheckedIOException if the file cannot be read or parsed
     */
    public MapDefinition readMapFile(Path path) {
        try {
            return objectMapper.readValue(path.toFile(), MapDefinition.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    // ── classpath maps ──────────────────────────────────────────────────

    private void loadClasspathMaps() {
        try {
            var resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources("classpath*:maps/*.json");

            for (Resource resource : resources) {
                try (InputStream is = resource.getInputStream()) {
                    MapDefinition map = objectMapper.readValue(is, MapDefinition.class);
                    String name = mapName(resource.getFilename());
                    maps.put(name, map);
                    log.info("Loaded built-in map '{}' ({} sites, {} rivers) from classpath",
                            name, map.sites().size(), map.rivers().size());
                } catch (IOException e) {
                    log.error("Failed to load classpath map: {}", resource.getFilename(), e);
                }
            }
        } catch (IOException e) {
            log.warn("Could not scan classpath for maps: {}", e.getMessage());
        }
    }

    // ── external maps (./maps/ folder) ──────────────────────────────────

    private void loadExternalMaps() {
        Path externalDir = Paths.get("maps");
        if (!Files.isDirectory(externalDir)) {
            log.debug("No external maps directory found at '{}'", externalDir.toAbsolutePath());
            return;
        }

        try (Stream<Path> files = Files.list(externalDir)) {
            files.filter(p -> p.toString().endsWith(EXTENSION))
                 .sorted()
                 .forEach(this::loadExternalMapFile);
        } catch (IOException e) {
            log.error("Error reading external maps directory", e);
        }
    }

    private void loadExternalMapFile(Path path) {
        try {
            MapDefinition map = readMapFile(path);
            String name = mapName(path.getFileName().toString());
            maps.put(name, map);
            log.info("Loaded custom map '{}' from {}", name, path);
        } catch (UncheckedIOException e) {
            log.error("Failed to load custom map: {}", path, e);
        }
    }

    private static String mapName(String fileName) {
        if (fileName == null) {
            return "";
        }
        return fileName.endsWith(EXTENSION)
                ? fileName.substring(0, fileName.length() - EXTENSION.length())
                : fileName;
    }
}

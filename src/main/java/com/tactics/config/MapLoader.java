package com.tactics.config;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;
import java.util.*;
import java.util.stream.Stream;

/**
 * Registry of terrain maps, filled once at startup.
 * <p>
 * Built-in maps ({@code classpath:maps/*.json}) are read first, then any
 * {@code *.json} in the custom map directory, in file name order. A later
 * definition replaces an earlier one with the same id. Definitions without an
 * id or without terrain rows are skipped.
 */
@Component
@Slf4j
public class MapLoader {

    static final String BUILT_IN_PATTERN = "classpath:maps/*.json";

    private final ObjectMapper objectMapper;

    private final Path customMapDir;

    /** Registered maps by id, in registration order. */
    @Getter
    private final Map<String, MapDefinition> maps = new LinkedHashMap<>();

    @Autowired
    public MapLoader(ObjectMapper objectMapper) {
        this(objectMapper, Paths.get("maps"));
    }

    /**
     * @param customMapDir directory scanned for map files after the built-in ones
     */
    public MapLoader(ObjectMapper objectMapper, Path customMapDir) {
        this.objectMapper = objectMapper;
        this.customMapDir = customMapDir;
    }

    @PostConstruct
    public void loadMaps() {
        readBuiltInMaps();
        readCustomMaps();

        if (maps.isEmpty()) {
            log.warn("No terrain maps registered, navigation sessions cannot be opened");
            return;
        }
        log.info("{} terrain map(s) available: {}", maps.size(), maps.keySet());
    }

    public List<MapDefinition> getAvailableMaps() {
        return List.copyOf(maps.values());
    }

    /**
     * @throws IllegalArgumentException if no map with this id is registered
     */
    public MapDefinition getMap(String mapId) {
        MapDefinition map = maps.get(mapId);
        if (map == null) {
            throw new IllegalArgumentException("Unknown map: " + mapId
                    + ". Available maps: " + maps.keySet());
        }
        return map;
    }

    // ── built-in maps ───────────────────────────────────────────────────

    private void readBuiltInMaps() {
        Resource[] resources;
        try {
            resources = new PathMatchingResourcePatternResolver().getResources(BUILT_IN_PATTERN);
        } catch (IOException e) {
            log.warn("Built-in maps unavailable: {}", e.getMessage());
            return;
        }
        for (Resource resource : resources) {
            String origin = "classpath:maps/" + resource.getFilename();
            try (InputStream in = resource.getInputStream()) {
                accept(objectMapper.readValue(in, MapDefinition.class), origin);
            } catch (IOException | JacksonException e) {
                log.error("Unreadable map {}", origin, e);
            }
        }
    }

    // ── custom maps ─────────────────────────────────────────────────────

    private void readCustomMaps() {
        if (!Files.isDirectory(customMapDir)) {
            log.debug("Custom map directory {} does not exist", customMapDir.toAbsolutePath());
            return;
        }
        try (Stream<Path> files = Files.list(customMapDir)) {
            files.filter(file -> file.getFileName().toString().endsWith(".json"))
                 .sorted()
                 .forEach(this::readMapFile);
        } catch (IOException e) {
            log.error("Cannot list custom map directory {}", customMapDir, e);
        }
    }

    private void readMapFile(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            accept(objectMapper.readValue(in, MapDefinition.class), file.toString());
        } catch (IOException | JacksonException e) {
            log.error("Unreadable map {}", file, e);
        }
    }

    private void accept(MapDefinition map, String origin) {
        if (map.id() == null || map.id().isBlank()) {
            log.error("Map from {} has no id, skipped", origin);
            return;
        }
        if (map.terrain() == null || map.terrain().isEmpty()) {
            log.error("Map '{}' from {} has no terrain rows, skipped", map.id(), origin);
            return;
        }
        MapDefinition replaced = maps.put(map.id(), map);
        if (replaced != null) {
            log.info("Map '{}' from {} replaces the earlier definition", map.id(), origin);
        } else {
            log.info("Registered map '{}' ({}x{}) from {}", map.id(), map.width(), map.height(), origin);
        }
    }
}

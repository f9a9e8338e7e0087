package com.tactics.service;

import com.tactics.config.MapDefinition;
import com.tactics.config.MapLoader;
import com.tactics.config.NavigationProperties;
import com.tactics.config.PointDefinition;
import com.tactics.dto.MapConnectivityValidation;
import com.tactics.model.CellType;
import com.tactics.model.Grid;
import com.tactics.model.Vector2;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Builds navigation sessions from {@link MapDefinition}s and tracks the one in use.
 * Opening a map replaces the previous session and all of its cached state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NavigationSessionService {

    private final MapLoader mapLoader;
    private final NavigationProperties properties;

    private NavigationSession activeSession;

    /**
     * Opens the map identified by {@code mapId} and makes it the active session.
     *
     * @throws IllegalArgumentException if the map is unknown or its terrain is malformed
     */
    public NavigationSession openSession(String mapId) {
        MapDefinition mapDef = mapLoader.getMap(mapId);
        NavigationSession session = createSession(mapDef);

        closeSession();
        activeSession = session;
        log.info("Opened navigation session for map '{}' ({}x{})", mapDef.name(),
                session.getGrid().getWidth(), session.getGrid().getHeight());
        return session;
    }

    /**
     * @throws IllegalStateException if no map is open
     */
    public NavigationSession getActiveSession() {
        if (activeSession == null) {
            throw new IllegalStateException("No active navigation session");
        }
        return activeSession;
    }

    public Optional<NavigationSession> findActiveSession() {
        return Optional.ofNullable(activeSession);
    }

    public void closeSession() {
        if (activeSession != null) {
            activeSession.close();
            log.info("Closed navigation session for map '{}'", activeSession.getMapId());
            activeSession = null;
        }
    }

    /**
     * Checks a map's spawn connectivity on a throwaway session; the active session is untouched.
     */
    public MapConnectivityValidation validateMap(String mapId) {
        return createSession(mapLoader.getMap(mapId)).validateSpawnPoints();
    }

    public NavigationSession createSession(MapDefinition mapDef) {
        Grid grid = buildGrid(mapDef);
        List<Vector2> spawns = mapDef.spawnPoints() == null ? List.of()
                : mapDef.spawnPoints().stream().map(p -> grid.gridToWorld(p.toGridPoint())).toList();
        PointDefinition target = mapDef.target();
        return new NavigationSession(mapDef.id(), grid, spawns,
                target != null ? grid.gridToWorld(target.toGridPoint()) : null,
                mapDef.movementType(), properties);
    }

    /**
     * Parses the terrain rows of a map definition into a grid.
     *
     * @throws IllegalArgumentException if rows are missing, ragged, or use an unknown symbol
     */
    static Grid buildGrid(MapDefinition mapDef) {
        List<String> rows = mapDef.terrain();
        if (rows == null || rows.isEmpty() || rows.get(0).isEmpty()) {
            throw new IllegalArgumentException("Map '" + mapDef.id() + "' has no terrain");
        }

        int width = mapDef.width();
        Grid grid = new Grid(width, rows.size(), mapDef.cellSizeOrDefault());
        for (int y = 0; y < rows.size(); y++) {
            String row = rows.get(y);
            if (row.length() != width) {
                throw new IllegalArgumentException("Map '" + mapDef.id() + "' row " + y
                        + " has width " + row.length() + ", expected " + width);
            }
            for (int x = 0; x < width; x++) {
                grid.setCellType(x, y, CellType.fromSymbol(row.charAt(x)));
            }
        }

        grid.setBiome(mapDef.biome());
        if (mapDef.borders()) {
            grid.setBorders();
        }
        return grid;
    }
}

package com.tactics.service;

import com.tactics.config.NavigationProperties;
import com.tactics.dto.MapConnectivityValidation;
import com.tactics.model.Grid;
import com.tactics.model.MovementType;
import com.tactics.model.Vector2;
import com.tactics.movement.MovementSystem;
import com.tactics.navigation.NavigationGrid;
import com.tactics.pathfinding.ConnectivityValidator;
import com.tactics.pathfinding.PathfindingOptions;
import com.tactics.pathfinding.PathfindingResult;
import com.tactics.pathfinding.Pathfinder;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Navigation state of one open map: terrain, overlay, movement rules, the
 * search engine and its cache. Nothing here is shared between sessions.
 */
@Slf4j
@Getter
public class NavigationSession {

    private final String mapId;
    private final Grid grid;
    private final MovementSystem movementSystem;
    private final NavigationGrid navigationGrid;
    private final Pathfinder pathfinder;
    private final ConnectivityValidator connectivityValidator;

    /** Spawn points from the map definition, as cell centers. */
    private final List<Vector2> spawnPoints;

    /** Cell center every spawn point must reach, {@code null} if the map defines none. */
    private final Vector2 target;

    private final MovementType movementType;

    @Getter(AccessLevel.NONE)
    private final NavigationProperties properties;

    public NavigationSession(String mapId, Grid grid, List<Vector2> spawnPoints, Vector2 target,
                             MovementType movementType, NavigationProperties properties) {
        this.mapId = mapId;
        this.grid = grid;
        this.spawnPoints = List.copyOf(spawnPoints);
        this.target = target;
        this.movementType = MovementType.orDefault(movementType);
        this.properties = properties;
        this.movementSystem = new MovementSystem(grid, Map.of(), properties.speedCacheCapacity());
        this.navigationGrid = new NavigationGrid(grid, properties.obstacleBuffer(), properties.safePositionMaxRadius());
        this.pathfinder = new Pathfinder(grid, navigationGrid, properties);
        this.navigationGrid.addObstacleListener(pathfinder);
        this.connectivityValidator = new ConnectivityValidator(pathfinder, properties);
    }

    // ── path queries ────────────────────────────────────────────────────

    /**
     * @param options query options, or {@code null} for the configured defaults
     */
    public PathfindingResult findPath(Vector2 start, Vector2 goal, PathfindingOptions options) {
        return pathfinder.findPath(start, goal, options);
    }

    public PathfindingResult findPath(Vector2 start, Vector2 goal, MovementType movementType) {
        return pathfinder.findPath(start, goal, movementType);
    }

    public PathfindingResult findAlternativePath(Vector2 start, Vector2 goal, PathfindingOptions options) {
        return pathfinder.findAlternativePath(start, goal, options);
    }

    public boolean validatePath(List<Vector2> path, MovementType movementType) {
        return pathfinder.validatePath(path, movementType);
    }

    public PathfindingOptions defaultOptions() {
        return properties.toOptions();
    }

    // ── structure hooks ─────────────────────────────────────────────────

    /**
     * Blocks the footprint of a structure; cached routes through it are dropped.
     *
     * @param radius footprint radius in world units
     */
    public void onStructurePlaced(Vector2 worldPos, double radius) {
        navigationGrid.addDynamicObstacle(worldPos, radius);
    }

    public void onStructureRemoved(Vector2 worldPos) {
        navigationGrid.removeDynamicObstacle(worldPos);
    }

    /**
     * Recomputes the overlay from the current terrain and drops every cached
     * path and speed lookup. Call after editing the grid directly.
     */
    public void rebuild() {
        navigationGrid.rebuild();
        pathfinder.clearCache();
        movementSystem.clearCache();
        log.debug("Navigation session for map '{}' rebuilt", mapId);
    }

    // ── validation ──────────────────────────────────────────────────────

    /**
     * Validates the map's own spawn points against its target.
     *
     * @throws IllegalStateException if the map defines no target
     */
    public MapConnectivityValidation validateSpawnPoints() {
        if (target == null) {
            throw new IllegalStateException("Map '" + mapId + "' defines no target");
        }
        return validateSpawnPoints(spawnPoints, target, movementType);
    }

    public MapConnectivityValidation validateSpawnPoints(List<Vector2> spawns, Vector2 goal, MovementType type) {
        return connectivityValidator.validateAllSpawnPoints(spawns, goal, type);
    }

    /**
     * Detaches the engine from the overlay and drops all cached state.
     */
    public void close() {
        navigationGrid.removeObstacleListener(pathfinder);
        pathfinder.clearCache();
        movementSystem.clearCache();
    }
}

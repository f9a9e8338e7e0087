package com.tactics.pathfinding;

import com.tactics.config.NavigationProperties;
import com.tactics.dto.MapConnectivityValidation;
import com.tactics.dto.SpawnPointValidation;
import com.tactics.model.Grid;
import com.tactics.model.GridPoint;
import com.tactics.model.MovementType;
import com.tactics.model.Vector2;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks that spawn points can reach a target, for map authoring.
 * Findings are advisory and never block a map from loading.
 */
@Slf4j
@RequiredArgsConstructor
public class ConnectivityValidator {

    static final String SPAWN_OUT_OF_BOUNDS = "Spawn point is out of bounds";
    static final String TARGET_OUT_OF_BOUNDS = "Target is out of bounds";
    static final String SPAWN_NOT_WALKABLE = "Spawn point is not walkable";
    static final String TARGET_NOT_WALKABLE = "Target is not walkable";
    static final String NO_PATH = "No valid path from spawn point to target";
    static final String NO_SPAWN_POINTS = "No spawn points defined";

    private final Pathfinder pathfinder;
    private final NavigationProperties properties;

    public SpawnPointValidation validateSpawnPointConnectivity(Vector2 spawnPoint, Vector2 target,
                                                              MovementType movementType) {
        Grid grid = pathfinder.getGrid();
        MovementType type = MovementType.orDefault(movementType);
        GridPoint spawnCell = grid.worldToGrid(spawnPoint);
        GridPoint targetCell = grid.worldToGrid(target);

        String issue = null;
        if (!grid.isInBounds(spawnCell)) {
            issue = SPAWN_OUT_OF_BOUNDS;
        } else if (!grid.isInBounds(targetCell)) {
            issue = TARGET_OUT_OF_BOUNDS;
        } else if (!pathfinder.isTraversable(spawnCell, type)) {
            issue = SPAWN_NOT_WALKABLE;
        } else if (!pathfinder.isTraversable(targetCell, type)) {
            issue = TARGET_NOT_WALKABLE;
        }
        if (issue != null) {
            return invalid(spawnPoint, issue);
        }

        PathfindingOptions options = PathfindingOptions.builder()
                .movementType(type)
                .maxIterations(properties.validationMaxIterations())
                .allowDiagonal(properties.allowDiagonal())
                .smoothPath(false)
                .useCache(false)
                .build();
        PathfindingResult result = pathfinder.findPath(spawnPoint, target, options);
        if (!result.success()) {
            return invalid(spawnPoint, NO_PATH);
        }

        return SpawnPointValidation.builder()
                .spawnPoint(spawnPoint)
                .valid(true)
                .path(new ArrayList<>(result.path()))
                .pathCost(result.cost())
                .distance(spawnCell.distanceTo(targetCell))
                .build();
    }

    public MapConnectivityValidation validateAllSpawnPoints(List<Vector2> spawnPoints, Vector2 target,
                                                            MovementType movementType) {
        MapConnectivityValidation report = MapConnectivityValidation.builder().build();
        if (spawnPoints == null || spawnPoints.isEmpty()) {
            report.getErrors().add(NO_SPAWN_POINTS);
            log.warn("Connectivity check skipped: no spawn points defined");
            return report;
        }

        Grid grid = pathfinder.getGrid();
        for (int i = 0; i < spawnPoints.size(); i++) {
            Vector2 spawn = spawnPoints.get(i);
            SpawnPointValidation validation = validateSpawnPointConnectivity(spawn, target, movementType);
            report.getSpawnValidations().add(validation);

            if (validation.isValid()) {
                report.getValidSpawnPoints().add(spawn);
                if (validation.getPathRatio() > properties.longPathRatio()) {
                    report.getWarnings().add(String.format(
                            "Spawn point %d has an unusually long path (%.1fx the straight-line distance)",
                            i, validation.getPathRatio()));
                }
            } else {
                report.getInvalidSpawnPoints().add(spawn);
                report.getErrors().add("Spawn point " + i + " at grid " + grid.worldToGrid(spawn)
                        + " is unreachable: " + validation.getIssue());
            }
        }

        int invalid = report.getInvalidSpawnPoints().size();
        if (invalid > 0) {
            report.getWarnings().add(invalid + " of " + spawnPoints.size()
                    + " spawn points cannot reach the target");
        }
        if (report.getValidSpawnPoints().size() < properties.minValidSpawnPoints()) {
            report.getWarnings().add("Less than " + properties.minValidSpawnPoints()
                    + " valid spawn points available - gameplay may be too predictable");
        }
        report.setAllSpawnPointsValid(invalid == 0);

        if (report.isAllSpawnPointsValid()) {
            log.debug("All {} spawn points reach the target", spawnPoints.size());
        } else {
            log.warn("{} of {} spawn points cannot reach the target", invalid, spawnPoints.size());
        }
        return report;
    }

    private static SpawnPointValidation invalid(Vector2 spawnPoint, String issue) {
        return SpawnPointValidation.builder()
                .spawnPoint(spawnPoint)
                .valid(false)
                .issue(issue)
                .build();
    }
}

package com.tactics.pathfinding;

import com.tactics.config.NavigationProperties;
import com.tactics.model.CellType;
import com.tactics.model.Grid;
import com.tactics.model.GridPoint;
import com.tactics.model.MovementType;
import com.tactics.model.Vector2;
import com.tactics.movement.MovementSystem;
import com.tactics.navigation.NavigationGrid;
import com.tactics.navigation.ObstacleChangeListener;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * A* route search over one map's terrain.
 * <p>
 * Traversability combines the static terrain rules of {@link MovementSystem}
 * with the navigation overlay when one is attached, so runtime structures
 * block routes as soon as they are registered. Successful results are cached
 * per session and dropped when the overlay reports a change on any cell the
 * route touches.
 */
@Slf4j
public class Pathfinder implements ObstacleChangeListener {

    // Cardinal first (up, right, down, left), then diagonals
    private static final int[][] DIRECTIONS = {
            {0, -1}, {1, 0}, {0, 1}, {-1, 0},
            {-1, -1}, {1, -1}, {1, 1}, {-1, 1}
    };

    private static final double DIAGONAL_STEP = Math.sqrt(2);

    // Step cost factor for cells with no usable speed
    private static final double STALLED_TERRAIN_FACTOR = 10.0;

    @Getter
    private final Grid grid;

    private final NavigationGrid navigationGrid;

    private final NavigationProperties properties;

    private final PathCache cache;

    public Pathfinder(Grid grid) {
        this(grid, null, NavigationProperties.defaults());
    }

    public Pathfinder(Grid grid, NavigationGrid navigationGrid) {
        this(grid, navigationGrid, NavigationProperties.defaults());
    }

    /**
     * @param navigationGrid overlay consulted for runtime obstacles, or {@code null} for terrain only
     */
    public Pathfinder(Grid grid, NavigationGrid navigationGrid, NavigationProperties properties) {
        this.grid = grid;
        this.navigationGrid = navigationGrid;
        this.properties = properties;
        this.cache = new PathCache(properties.cacheCapacity());
    }

    // ── queries ─────────────────────────────────────────────────────────

    /**
     * Finds a route between two world positions. Never throws for unreachable,
     * out-of-bounds or degenerate requests; the result says what happened.
     *
     * @param options query options, or {@code null} for the configured defaults
     */
    public PathfindingResult findPath(Vector2 start, Vector2 goal, PathfindingOptions options) {
        PathfindingOptions opts = options != null ? options : properties.toOptions();
        GridPoint startCell = grid.worldToGrid(start);
        GridPoint goalCell = resolveGoal(goal, opts);

        if (!grid.isInBounds(startCell) || !grid.isInBounds(goalCell)) {
            log.debug("Path request {} -> {} is out of bounds", startCell, goalCell);
            return PathfindingResult.failure(0);
        }
        if (startCell.equals(goalCell)) {
            return PathfindingResult.trivial(grid.gridToWorld(startCell));
        }
        if (!isTraversable(goalCell, opts)) {
            log.debug("Goal {} is not traversable for {}", goalCell, opts.getMovementType());
            return PathfindingResult.failure(0);
        }

        PathCacheKey key = PathCacheKey.of(startCell, goalCell, opts);
        if (opts.isUseCache()) {
            PathfindingResult cached = cache.get(key);
            if (cached != null) {
                return cached;
            }
        }

        SearchOutcome outcome = search(startCell, goalCell, opts);
        if (outcome.cells() == null) {
            log.debug("No path {} -> {} for {} after {} iterations",
                    startCell, goalCell, opts.getMovementType(), outcome.iterations());
            return PathfindingResult.failure(outcome.iterations());
        }

        List<GridPoint> waypoints = opts.isSmoothPath() ? smooth(outcome.cells(), opts) : outcome.cells();
        PathfindingResult result = PathfindingResult.found(
                toWorld(waypoints), outcome.iterations(), outcome.cost(), PathStrategy.DIRECT);

        if (opts.isUseCache()) {
            cache.put(key, result, routeCells(outcome.cells(), waypoints, opts));
        }
        return result;
    }

    public PathfindingResult findPath(Vector2 start, Vector2 goal, MovementType movementType) {
        return findPath(start, goal, properties.toOptions().toBuilder()
                .movementType(MovementType.orDefault(movementType))
                .build());
    }

    /**
     * Like {@link #findPath}, but degrades step by step instead of failing:
     * the normal search, then one without clearance constraints and a larger
     * budget, then reachable cells on rings around the goal (nearest ring first,
     * preferring the side facing the start), and finally a greedy walk toward
     * the goal that may stop short of it.
     */
    public PathfindingResult findAlternativePath(Vector2 start, Vector2 goal, PathfindingOptions options) {
        PathfindingOptions opts = options != null ? options : properties.toOptions();
        PathfindingResult primary = findPath(start, goal, opts);
        if (primary.success()) {
            return primary;
        }

        GridPoint startCell = grid.worldToGrid(start);
        if (!grid.isInBounds(startCell)) {
            return primary;
        }

        PathfindingOptions relaxed = opts.toBuilder()
                .minDistanceFromObstacles(0)
                .obstacleProximityPenalty(0)
                .maxIterations(opts.getMaxIterations() * properties.fallbackIterationMultiplier())
                .build();
        PathfindingResult relaxedResult = findPath(start, goal, relaxed);
        if (relaxedResult.success()) {
            log.debug("Relaxed search found a path {} -> {}", startCell, grid.worldToGrid(goal));
            return relaxedResult.withStrategy(PathStrategy.RELAXED);
        }

        GridPoint goalCell = resolveGoal(goal, opts);
        PathfindingOptions fixedGoal = relaxed.toBuilder().predictiveTarget(false).build();
        for (GridPoint candidate : alternativeGoals(startCell, goalCell, fixedGoal)) {
            PathfindingResult alternative = findPath(start, grid.gridToWorld(candidate), fixedGoal);
            if (alternative.success()) {
                log.debug("Goal {} unreachable, using nearby cell {}", goalCell, candidate);
                return alternative.withStrategy(PathStrategy.ALTERNATIVE_GOAL);
            }
        }

        PathfindingResult emergency = emergencyPath(startCell, goalCell, fixedGoal);
        log.debug("Emergency walk {} -> {}: {} waypoints, reached={}",
                startCell, goalCell, emergency.path().size(), emergency.success());
        return emergency;
    }

    /**
     * Whether every waypoint is traversable and every leg has a clear line.
     */
    public boolean validatePath(List<Vector2> path, MovementType movementType) {
        if (path == null || path.isEmpty()) {
            return false;
        }
        PathfindingOptions opts = PathfindingOptions.builder()
                .movementType(MovementType.orDefault(movementType))
                .build();
        for (Vector2 waypoint : path) {
            if (!isTraversable(grid.worldToGrid(waypoint), opts)) {
                return false;
            }
        }
        for (int i = 1; i < path.size(); i++) {
            if (!hasLineOfSight(grid.worldToGrid(path.get(i - 1)), grid.worldToGrid(path.get(i)), opts)) {
                return false;
            }
        }
        return true;
    }

    public boolean arePointsConnected(Vector2 a, Vector2 b, MovementType movementType) {
        PathfindingOptions opts = PathfindingOptions.builder()
                .movementType(MovementType.orDefault(movementType))
                .maxIterations(properties.validationMaxIterations())
                .allowDiagonal(properties.allowDiagonal())
                .smoothPath(false)
                .useCache(false)
                .build();
        return findPath(a, b, opts).success();
    }

    /**
     * Whether an agent with the given capability can stand on a cell, ignoring clearance options.
     */
    public boolean isTraversable(GridPoint cell, MovementType movementType) {
        return isPassable(cell.x(), cell.y(), MovementType.orDefault(movementType));
    }

    // ── cache ───────────────────────────────────────────────────────────

    @Override
    public void onCellsChanged(Set<GridPoint> cells) {
        int removed = cache.invalidate(cells);
        if (removed > 0) {
            log.debug("Invalidated {} cached path(s) after {} cell(s) changed", removed, cells.size());
        }
    }

    public void invalidateCacheAt(GridPoint cell) {
        cache.invalidate(Set.of(cell));
    }

    public void clearCache() {
        cache.clear();
    }

    public int getCacheSize() {
        return cache.size();
    }

    // ── A* ──────────────────────────────────────────────────────────────

    private SearchOutcome search(GridPoint start, GridPoint goal, PathfindingOptions opts) {
        PriorityQueue<PathNode> open = new PriorityQueue<>(PathNode.BY_PRIORITY);
        Map<GridPoint, PathNode> best = new HashMap<>();
        Set<GridPoint> closed = new HashSet<>();
        long sequence = 0;

        PathNode startNode = new PathNode(start, 0, heuristic(start, goal), null, sequence++);
        open.add(startNode);
        best.put(start, startNode);

        int iterations = 0;
        while (!open.isEmpty() && iterations < opts.getMaxIterations()) {
            PathNode current = open.poll();
            GridPoint position = current.position();
            if (closed.contains(position) || best.get(position) != current) {
                continue;
            }
            iterations++;

            if (position.equals(goal)) {
                return new SearchOutcome(reconstruct(current), iterations, current.g());
            }
            closed.add(position);

            for (int[] dir : DIRECTIONS) {
                int dx = dir[0];
                int dy = dir[1];
                GridPoint next = position.offset(dx, dy);
                if (closed.contains(next) || !isTraversable(next, opts)) {
                    continue;
                }
                if (dx != 0 && dy != 0 && !canMoveDiagonally(position, dx, dy, opts)) {
                    continue;
                }

                double g = current.g() + stepCost(position, next, opts);
                PathNode known = best.get(next);
                if (known != null && g >= known.g()) {
                    continue;
                }
                PathNode node = new PathNode(next, g, heuristic(next, goal), current, sequence++);
                best.put(next, node);
                open.add(node);
            }
        }
        return new SearchOutcome(null, iterations, 0);
    }

    private static double heuristic(GridPoint a, GridPoint b) {
        return a.distanceTo(b);
    }

    private static List<GridPoint> reconstruct(PathNode goalNode) {
        List<GridPoint> cells = new ArrayList<>();
        for (PathNode node = goalNode; node != null; node = node.parent()) {
            cells.add(0, node.position());
        }
        return cells;
    }

    private double stepCost(GridPoint from, GridPoint to, PathfindingOptions opts) {
        boolean diagonal = from.x() != to.x() && from.y() != to.y();
        double distance = diagonal ? DIAGONAL_STEP : 1.0;
        return distance * terrainFactor(to, opts.getMovementType()) * opts.getTerrainCostMultiplier()
                + proximityPenalty(to, opts);
    }

    /**
     * Inverse of the agent's speed on the cell, doubled inside the overlay's
     * obstacle buffer for agents on the ground.
     */
    private double terrainFactor(GridPoint cell, MovementType movementType) {
        double speed = MovementSystem.getEffectiveSpeed(movementType, grid, cell.x(), cell.y());
        double factor = speed > 0 ? 1.0 / speed : STALLED_TERRAIN_FACTOR;
        if (navigationGrid != null && movementType != MovementType.FLYING
                && navigationGrid.getDistanceToObstacle(cell.x(), cell.y()) < navigationGrid.getObstacleBuffer()) {
            factor *= 2.0;
        }
        return factor;
    }

    private double proximityPenalty(GridPoint cell, PathfindingOptions opts) {
        double penalty = opts.getObstacleProximityPenalty();
        double range = opts.getObstacleProximityRange();
        if (penalty <= 0 || range <= 0) {
            return 0;
        }
        double distance = nearestBlockedDistance(cell, range, opts.getMovementType());
        return distance < range ? penalty * (range - distance) / range : 0;
    }

    // ── traversability ──────────────────────────────────────────────────

    private boolean isPassable(int x, int y, MovementType movementType) {
        if (!grid.isInBounds(x, y) || !MovementSystem.canMoveOnTerrain(movementType, grid.getCellType(x, y))) {
            return false;
        }
        return navigationGrid == null || navigationGrid.isWalkable(x, y, movementType);
    }

    private boolean isTraversable(GridPoint cell, PathfindingOptions opts) {
        MovementType type = opts.getMovementType();
        if (!isPassable(cell.x(), cell.y(), type)) {
            return false;
        }
        double minDistance = opts.getMinDistanceFromObstacles();
        return minDistance <= 0 || nearestBlockedDistance(cell, minDistance, type) >= minDistance;
    }

    /**
     * Euclidean distance, in cells, to the closest in-bounds cell the agent
     * cannot enter within {@code radius}; infinity if there is none.
     */
    private double nearestBlockedDistance(GridPoint cell, double radius, MovementType movementType) {
        int r = (int) Math.ceil(radius);
        double nearest = Double.POSITIVE_INFINITY;
        for (int dy = -r; dy <= r; dy++) {
            for (int dx = -r; dx <= r; dx++) {
                int x = cell.x() + dx;
                int y = cell.y() + dy;
                if ((dx == 0 && dy == 0) || !grid.isInBounds(x, y) || isPassable(x, y, movementType)) {
                    continue;
                }
                nearest = Math.min(nearest, Math.sqrt(dx * dx + dy * dy));
            }
        }
        return nearest;
    }

    /**
     * Diagonal steps may not cut a blocked corner, except on and beside bridges
     * where the crossing is one cell wide.
     */
    private boolean canMoveDiagonally(GridPoint from, int dx, int dy, PathfindingOptions opts) {
        if (!opts.isAllowDiagonal()) {
            return false;
        }
        GridPoint horizontal = from.offset(dx, 0);
        GridPoint vertical = from.offset(0, dy);
        if (isBridge(from.offset(dx, dy)) || isBridge(horizontal) || isBridge(vertical)) {
            return true;
        }
        MovementType type = opts.getMovementType();
        return isPassable(horizontal.x(), horizontal.y(), type) && isPassable(vertical.x(), vertical.y(), type);
    }

    private boolean isBridge(GridPoint cell) {
        return grid.getCellType(cell) == CellType.BRIDGE;
    }

    // ── smoothing ───────────────────────────────────────────────────────

    /**
     * Greedy string pulling: from each kept waypoint, jump to the furthest
     * later cell with a clear line.
     */
    List<GridPoint> smooth(List<GridPoint> cells, PathfindingOptions opts) {
        if (cells.size() < 3) {
            return cells;
        }
        List<GridPoint> smoothed = new ArrayList<>();
        smoothed.add(cells.get(0));
        int current = 0;
        while (current < cells.size() - 1) {
            int furthest = current + 1;
            for (int i = current + 2; i < cells.size(); i++) {
                if (hasLineOfSight(cells.get(current), cells.get(i), opts)) {
                    furthest = i;
                }
            }
            smoothed.add(cells.get(furthest));
            current = furthest;
        }
        return smoothed;
    }

    /**
     * Walks the Bresenham line and applies the same rules as a search step to
     * every cell after the first.
     */
    private boolean hasLineOfSight(GridPoint from, GridPoint to, PathfindingOptions opts) {
        List<GridPoint> line = GridLine.between(from, to);
        for (int i = 1; i < line.size(); i++) {
            GridPoint previous = line.get(i - 1);
            GridPoint cell = line.get(i);
            if (!isTraversable(cell, opts)) {
                return false;
            }
            int dx = cell.x() - previous.x();
            int dy = cell.y() - previous.y();
            if (dx != 0 && dy != 0 && !canMoveDiagonally(previous, dx, dy, opts)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Every cell whose state can change the route: the cells it occupies, the
     * flank cells of its diagonal steps, and everything within the clearance
     * and proximity range of those.
     */
    private Set<GridPoint> routeCells(List<GridPoint> searched, List<GridPoint> waypoints,
                                      PathfindingOptions opts) {
        Set<GridPoint> cells = new LinkedHashSet<>();
        addSteps(cells, searched);
        for (int i = 1; i < waypoints.size(); i++) {
            addSteps(cells, GridLine.between(waypoints.get(i - 1), waypoints.get(i)));
        }

        double reach = opts.getMinDistanceFromObstacles();
        if (opts.getObstacleProximityPenalty() > 0) {
            reach = Math.max(reach, opts.getObstacleProximityRange());
        }
        int margin = (int) Math.ceil(reach);
        if (margin <= 0) {
            return cells;
        }
        Set<GridPoint> widened = new LinkedHashSet<>(cells);
        for (GridPoint cell : cells) {
            for (int dy = -margin; dy <= margin; dy++) {
                for (int dx = -margin; dx <= margin; dx++) {
                    GridPoint near = cell.offset(dx, dy);
                    if (dx * dx + dy * dy <= margin * margin && grid.isInBounds(near)) {
                        widened.add(near);
                    }
                }
            }
        }
        return widened;
    }

    private static void addSteps(Set<GridPoint> cells, List<GridPoint> steps) {
        for (int i = 0; i < steps.size(); i++) {
            GridPoint cell = steps.get(i);
            cells.add(cell);
            if (i == 0) {
                continue;
            }
            GridPoint previous = steps.get(i - 1);
            if (previous.x() != cell.x() && previous.y() != cell.y()) {
                cells.add(new GridPoint(cell.x(), previous.y()));
                cells.add(new GridPoint(previous.x(), cell.y()));
            }
        }
    }

    private List<Vector2> toWorld(List<GridPoint> cells) {
        return cells.stream().map(grid::gridToWorld).toList();
    }

    // ── goal resolution and fallbacks ───────────────────────────────────

    /**
     * The goal cell, projected along the target's velocity when predictive
     * targeting is on and the projected cell is usable.
     */
    private GridPoint resolveGoal(Vector2 goal, PathfindingOptions opts) {
        GridPoint goalCell = grid.worldToGrid(goal);
        if (!opts.isPredictiveTarget() || opts.getTargetVelocity() == null) {
            return goalCell;
        }
        Vector2 projected = goal.add(opts.getTargetVelocity().scale(opts.getPredictionTime()));
        GridPoint projectedCell = grid.worldToGrid(projected);
        if (grid.isInBounds(projectedCell) && isTraversable(projectedCell, opts)) {
            return projectedCell;
        }
        return goalCell;
    }

    private List<GridPoint> alternativeGoals(GridPoint start, GridPoint goal, PathfindingOptions opts) {
        double approach = Math.atan2(start.y() - goal.y(), start.x() - goal.x());
        int angles = Math.max(1, properties.alternativeGoalAngles());
        List<Candidate> candidates = new ArrayList<>();
        Set<GridPoint> seen = new HashSet<>();

        for (int radius : properties.alternativeGoalRadii()) {
            for (int i = 0; i < angles; i++) {
                double angle = 2 * Math.PI * i / angles;
                GridPoint cell = goal.offset(
                        (int) Math.round(Math.cos(angle) * radius),
                        (int) Math.round(Math.sin(angle) * radius));
                if (cell.equals(goal) || !seen.add(cell) || !isTraversable(cell, opts)) {
                    continue;
                }
                candidates.add(new Candidate(cell, radius, angularDistance(angle, approach)));
            }
        }

        candidates.sort(Comparator.comparingInt(Candidate::radius)
                .thenComparingDouble(Candidate::angleFromApproach));
        return candidates.stream().map(Candidate::cell).toList();
    }

    private static double angularDistance(double a, double b) {
        double diff = Math.abs(a - b) % (2 * Math.PI);
        return Math.min(diff, 2 * Math.PI - diff);
    }

    /**
     * Steps greedily toward the goal, sidestepping perpendicular when the direct
     * step is blocked and never revisiting a cell.
     */
    private PathfindingResult emergencyPath(GridPoint start, GridPoint goal, PathfindingOptions opts) {
        List<GridPoint> cells = new ArrayList<>();
        Set<GridPoint> visited = new HashSet<>();
        cells.add(start);
        visited.add(start);

        GridPoint current = start;
        double cost = 0;
        int steps = 0;
        while (!current.equals(goal) && steps < properties.emergencyMaxSteps()) {
            GridPoint next = nextEmergencyStep(current, goal, visited, opts);
            if (next == null) {
                break;
            }
            cost += stepCost(current, next, opts);
            cells.add(next);
            visited.add(next);
            current = next;
            steps++;
        }

        if (cells.size() < 2) {
            return PathfindingResult.failure(steps);
        }
        return new PathfindingResult(toWorld(cells), current.equals(goal), steps, cost, PathStrategy.EMERGENCY);
    }

    private GridPoint nextEmergencyStep(GridPoint current, GridPoint goal, Set<GridPoint> visited,
                                        PathfindingOptions opts) {
        int sx = Integer.signum(goal.x() - current.x());
        int sy = Integer.signum(goal.y() - current.y());
        int[][] moves = {
                {sx, sy},
                {sx, 0},
                {0, sy},
                {-sy, sx},
                {sy, -sx}
        };
        for (int[] move : moves) {
            int dx = move[0];
            int dy = move[1];
            if (dx == 0 && dy == 0) {
                continue;
            }
            GridPoint next = current.offset(dx, dy);
            if (visited.contains(next) || !isTraversable(next, opts)) {
                continue;
            }
            if (dx != 0 && dy != 0 && !canMoveDiagonally(current, dx, dy, opts)) {
                continue;
            }
            return next;
        }
        return null;
    }

    private record SearchOutcome(List<GridPoint> cells, int iterations, double cost) {}

    private record Candidate(GridPoint cell, int radius, double angleFromApproach) {}
}

package com.tactics.navigation;

import com.tactics.model.CellType;
import com.tactics.model.Grid;
import com.tactics.model.GridPoint;
import com.tactics.model.MovementType;
import com.tactics.model.NavigationCell;
import com.tactics.model.Vector2;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Navigation overlay derived from a {@link Grid} and the structures placed on it at runtime.
 * <p>
 * {@link #rebuild()} recomputes every cell, including the obstacle distance field.
 * Adding or removing a dynamic obstacle only touches the cells of its footprint:
 * flags and cost are exact afterwards, but {@code distanceToNearestObstacle} is
 * stale until the next rebuild. Cells freed by a removal keep their old distance
 * (0), so the field overstates obstacle proximity rather than understating it.
 */
@Slf4j
public class NavigationGrid {

    public static final double DEFAULT_OBSTACLE_BUFFER = 0.5;
    public static final int DEFAULT_SAFE_POSITION_RADIUS = 10;

    private static final int[][] CARDINAL = {{0, -1}, {1, 0}, {0, 1}, {-1, 0}};

    @Getter
    private final Grid grid;

    @Getter
    private final double obstacleBuffer;

    private final int safePositionMaxRadius;

    private final NavigationCell[][] cells;

    /** Structure center cell to footprint radius in grid cells. */
    private final Map<GridPoint, Integer> dynamicObstacles = new LinkedHashMap<>();

    private final List<ObstacleChangeListener> listeners = new CopyOnWriteArrayList<>();

    private boolean dirty = true;

    public NavigationGrid(Grid grid) {
        this(grid, DEFAULT_OBSTACLE_BUFFER, DEFAULT_SAFE_POSITION_RADIUS);
    }

    public NavigationGrid(Grid grid, double obstacleBuffer, int safePositionMaxRadius) {
        this.grid = grid;
        this.obstacleBuffer = obstacleBuffer;
        this.safePositionMaxRadius = safePositionMaxRadius;
        this.cells = new NavigationCell[grid.getHeight()][grid.getWidth()];
        for (int y = 0; y < grid.getHeight(); y++) {
            for (int x = 0; x < grid.getWidth(); x++) {
                cells[y][x] = new NavigationCell();
            }
        }
        rebuild();
    }

    public void addObstacleListener(ObstacleChangeListener listener) {
        listeners.add(listener);
    }

    public void removeObstacleListener(ObstacleChangeListener listener) {
        listeners.remove(listener);
    }

    // ── full rebuild ────────────────────────────────────────────────────

    /**
     * Recomputes flags, cost and obstacle distance for every cell from the grid
     * and the currently registered dynamic obstacles.
     */
    public void rebuild() {
        for (int y = 0; y < grid.getHeight(); y++) {
            for (int x = 0; x < grid.getWidth(); x++) {
                applyBaseTerrain(x, y);
            }
        }

        Set<GridPoint> structureCells = new HashSet<>();
        for (Map.Entry<GridPoint, Integer> obstacle : dynamicObstacles.entrySet()) {
            for (GridPoint p : footprint(obstacle.getKey(), obstacle.getValue())) {
                blockCell(p);
                structureCells.add(p);
            }
        }

        calculateObstacleDistances(structureCells);
        applyObstacleBuffers();

        dirty = false;
        log.debug("Navigation grid rebuilt ({}x{}, {} dynamic obstacles)",
                grid.getWidth(), grid.getHeight(), dynamicObstacles.size());
    }

    private void applyBaseTerrain(int x, int y) {
        NavigationCell cell = cells[y][x];
        switch (grid.getCellType(x, y)) {
            case WATER -> set(cell, false, true, true, 1.0);
            case OBSTACLE, BLOCKED, BORDER, TOWER -> set(cell, false, false, false, Double.POSITIVE_INFINITY);
            case ROUGH_TERRAIN -> set(cell, true, true, false, 2.0);
            case BRIDGE -> set(cell, true, true, true, 1.0);
            default -> set(cell, true, true, false, 1.0);
        }
    }

    private static void set(NavigationCell cell, boolean walkable, boolean flyable, boolean swimmable, double cost) {
        cell.setWalkable(walkable);
        cell.setFlyable(flyable);
        cell.setSwimmable(swimmable);
        cell.setCost(cost);
    }

    /**
     * Multi-source breadth-first flood fill from every obstacle cell.
     */
    private void calculateObstacleDistances(Set<GridPoint> structureCells) {
        Deque<GridPoint> queue = new ArrayDeque<>();

        for (int y = 0; y < grid.getHeight(); y++) {
            for (int x = 0; x < grid.getWidth(); x++) {
                CellType type = grid.getCellType(x, y);
                if (type.isObstacleSeed() || structureCells.contains(new GridPoint(x, y))) {
                    cells[y][x].setDistanceToNearestObstacle(0);
                    queue.add(new GridPoint(x, y));
                } else {
                    cells[y][x].setDistanceToNearestObstacle(Double.POSITIVE_INFINITY);
                }
            }
        }

        while (!queue.isEmpty()) {
            GridPoint current = queue.poll();
            double next = cells[current.y()][current.x()].getDistanceToNearestObstacle() + 1;
            for (int[] dir : CARDINAL) {
                int nx = current.x() + dir[0];
                int ny = current.y() + dir[1];
                if (grid.isInBounds(nx, ny) && next < cells[ny][nx].getDistanceToNearestObstacle()) {
                    cells[ny][nx].setDistanceToNearestObstacle(next);
                    queue.add(new GridPoint(nx, ny));
                }
            }
        }
    }

    private void applyObstacleBuffers() {
        for (int y = 0; y < grid.getHeight(); y++) {
            for (int x = 0; x < grid.getWidth(); x++) {
                NavigationCell cell = cells[y][x];
                if (cell.getDistanceToNearestObstacle() < obstacleBuffer) {
                    cell.setCost(cell.getCost() * 2.0);
                    if (cell.getDistanceToNearestObstacle() == 0) {
                        cell.setWalkable(false);
                    }
                }
            }
        }
    }

    // ── dynamic obstacles ───────────────────────────────────────────────

    /**
     * Blocks the disk of cells covered by a structure placed at {@code worldPos}.
     * A second structure on the same center cell is ignored.
     *
     * @param radius footprint radius in world units
     */
    public void addDynamicObstacle(Vector2 worldPos, double radius) {
        GridPoint center = grid.worldToGrid(worldPos);
        if (!grid.isInBounds(center) || dynamicObstacles.containsKey(center)) {
            return;
        }
        int gridRadius = (int) Math.ceil(Math.max(0, radius) / grid.getCellSize());
        dynamicObstacles.put(center, gridRadius);

        Set<GridPoint> affected = new LinkedHashSet<>(footprint(center, gridRadius));
        affected.forEach(this::blockCell);
        dirty = true;

        log.debug("Dynamic obstacle added at {} (radius {} cells, {} cells blocked)",
                center, gridRadius, affected.size());
        notifyListeners(affected);
    }

    /**
     * Frees the cells of the structure centered on {@code worldPos}'s cell.
     * Cells still covered by another structure stay blocked.
     */
    public void removeDynamicObstacle(Vector2 worldPos) {
        GridPoint center = grid.worldToGrid(worldPos);
        Integer gridRadius = dynamicObstacles.remove(center);
        if (gridRadius == null) {
            return;
        }

        Set<GridPoint> affected = new LinkedHashSet<>(footprint(center, gridRadius));
        for (GridPoint p : affected) {
            if (!isCoveredByStructure(p)) {
                applyBaseTerrain(p.x(), p.y());
            }
        }
        dirty = true;

        log.debug("Dynamic obstacle removed at {}", center);
        notifyListeners(affected);
    }

    public Set<GridPoint> getDynamicObstacles() {
        return Set.copyOf(dynamicObstacles.keySet());
    }

    public boolean isCoveredByStructure(GridPoint cell) {
        for (Map.Entry<GridPoint, Integer> obstacle : dynamicObstacles.entrySet()) {
            GridPoint c = obstacle.getKey();
            int r = obstacle.getValue();
            int dx = cell.x() - c.x();
            int dy = cell.y() - c.y();
            if (dx * dx + dy * dy <= r * r) {
                return true;
            }
        }
        return false;
    }

    private void blockCell(GridPoint p) {
        NavigationCell cell = cells[p.y()][p.x()];
        set(cell, false, false, false, Double.POSITIVE_INFINITY);
        cell.setDistanceToNearestObstacle(0);
    }

    private List<GridPoint> footprint(GridPoint center, int gridRadius) {
        List<GridPoint> result = new ArrayList<>();
        for (int dy = -gridRadius; dy <= gridRadius; dy++) {
            for (int dx = -gridRadius; dx <= gridRadius; dx++) {
                if (dx * dx + dy * dy <= gridRadius * gridRadius && grid.isInBounds(center.x() + dx, center.y() + dy)) {
                    result.add(center.offset(dx, dy));
                }
            }
        }
        return result;
    }

    private void notifyListeners(Set<GridPoint> affected) {
        Set<GridPoint> view = Set.copyOf(affected);
        for (ObstacleChangeListener listener : listeners) {
            listener.onCellsChanged(view);
        }
    }

    // ── queries ─────────────────────────────────────────────────────────

    public boolean isWalkable(int x, int y, MovementType movementType) {
        return grid.isInBounds(x, y) && cells[y][x].allows(movementType);
    }

    public double getMovementCost(int x, int y) {
        return grid.isInBounds(x, y) ? cells[y][x].getCost() : Double.POSITIVE_INFINITY;
    }

    public double getDistanceToObstacle(int x, int y) {
        return grid.isInBounds(x, y) ? cells[y][x].getDistanceToNearestObstacle() : 0;
    }

    /**
     * Whether every cell of an entity's circular footprint is walkable.
     *
     * @param entityRadius footprint radius in world units
     */
    public boolean hasEnoughClearance(Vector2 worldPos, double entityRadius) {
        GridPoint center = grid.worldToGrid(worldPos);
        int gridRadius = (int) Math.ceil(Math.max(0, entityRadius) / grid.getCellSize());
        for (int dy = -gridRadius; dy <= gridRadius; dy++) {
            for (int dx = -gridRadius; dx <= gridRadius; dx++) {
                if (dx * dx + dy * dy > gridRadius * gridRadius) {
                    continue;
                }
                int x = center.x() + dx;
                int y = center.y() + dy;
                if (!grid.isInBounds(x, y) || !cells[y][x].isWalkable()) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Finds the position closest to {@code target} where an entity of the given
     * radius fits, searching ring by ring outward.
     *
     * @return the target itself if it is already clear, empty if no ring has a candidate
     */
    public Optional<Vector2> getNearestSafePosition(Vector2 target, double entityRadius, MovementType movementType) {
        if (hasEnoughClearance(target, entityRadius)) {
            return Optional.of(target);
        }

        GridPoint origin = grid.worldToGrid(target);
        for (int radius = 1; radius <= safePositionMaxRadius; radius++) {
            Vector2 best = null;
            double bestDistance = Double.POSITIVE_INFINITY;
            double step = Math.PI / (4 * radius);

            for (int i = 0; i < 8 * radius; i++) {
                double angle = i * step;
                int x = origin.x() + (int) Math.round(Math.cos(angle) * radius);
                int y = origin.y() + (int) Math.round(Math.sin(angle) * radius);
                if (!isWalkable(x, y, movementType)) {
                    continue;
                }
                Vector2 candidate = grid.gridToWorld(x, y);
                if (!hasEnoughClearance(candidate, entityRadius)) {
                    continue;
                }
                double distance = candidate.distanceTo(target);
                if (distance < bestDistance) {
                    bestDistance = distance;
                    best = candidate;
                }
            }
            if (best != null) {
                return Optional.of(best);
            }
        }
        return Optional.empty();
    }

    public boolean needsRebuild() {
        return dirty;
    }

    /**
     * Snapshot of a cell's navigation state, for debugging overlays.
     */
    public Optional<NavigationCell> getDebugInfo(int x, int y) {
        if (!grid.isInBounds(x, y)) {
            return Optional.empty();
        }
        return Optional.of(cells[y][x].toBuilder().build());
    }
}

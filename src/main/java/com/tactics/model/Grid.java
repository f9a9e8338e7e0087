package com.tactics.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Canonical terrain storage for one map.
 * <p>
 * Dimensions are fixed at construction. Queries outside the grid never fail:
 * reads return a BLOCKED sentinel and writes are ignored.
 */
public class Grid {

    public static final int DEFAULT_CELL_SIZE = 32;

    // Up, right, down, left
    private static final int[][] CARDINAL = {{0, -1}, {1, 0}, {0, 1}, {-1, 0}};

    @Getter
    private final int width;

    @Getter
    private final int height;

    @Getter
    private final int cellSize;

    private final CellData[][] cells;

    private final List<GridPoint> pathCells = new ArrayList<>();

    @Getter
    private BiomeType biome = BiomeType.GRASSLAND;

    public Grid(int width, int height) {
        this(width, height, DEFAULT_CELL_SIZE);
    }

    public Grid(int width, int height, int cellSize) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive: " + width + "x" + height);
        }
        if (cellSize <= 0) {
            throw new IllegalArgumentException("Cell size must be positive: " + cellSize);
        }
        this.width = width;
        this.height = height;
        this.cellSize = cellSize;
        this.cells = new CellData[height][width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                cells[y][x] = CellData.of(CellType.EMPTY);
            }
        }
    }

    public boolean isInBounds(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    public boolean isInBounds(GridPoint point) {
        return isInBounds(point.x(), point.y());
    }

    // ── cell access ─────────────────────────────────────────────────────

    public CellType getCellType(int x, int y) {
        return isInBounds(x, y) ? cells[y][x].getType() : CellType.BLOCKED;
    }

    public CellType getCellType(GridPoint point) {
        return getCellType(point.x(), point.y());
    }

    public void setCellType(int x, int y, CellType type) {
        if (isInBounds(x, y)) {
            cells[y][x].setType(type);
        }
    }

    /**
     * Returns the live cell data, or a BLOCKED sentinel outside the grid.
     */
    public CellData getCellData(int x, int y) {
        return isInBounds(x, y) ? cells[y][x] : CellData.of(CellType.BLOCKED);
    }

    public void setCellData(int x, int y, CellData data) {
        if (isInBounds(x, y) && data != null) {
            cells[y][x] = data;
        }
    }

    public double getHeight(int x, int y) {
        if (!isInBounds(x, y)) {
            return 0;
        }
        Double h = cells[y][x].getHeight();
        return h != null ? h : 0;
    }

    public void setHeight(int x, int y, double height) {
        if (isInBounds(x, y)) {
            cells[y][x].setHeight(Math.max(0, Math.min(1, height)));
        }
    }

    public void setBiome(BiomeType biome) {
        if (biome != null) {
            this.biome = biome;
        }
    }

    /**
     * Speed multiplier for a walking agent on this cell.
     * Returns the per-cell override when one is set, otherwise the type default.
     */
    public double getMovementSpeed(int x, int y) {
        if (!isInBounds(x, y)) {
            return 0;
        }
        CellData data = cells[y][x];
        if (data.hasSpeedOverride()) {
            return data.getMovementSpeed();
        }
        return data.getType().getWalkSpeed();
    }

    public boolean isWalkable(int x, int y) {
        return getMovementSpeed(x, y) > 0;
    }

    public boolean canPlaceTower(int x, int y) {
        if (!isInBounds(x, y)) {
            return false;
        }
        CellType type = cells[y][x].getType();
        return type == CellType.EMPTY || type == CellType.DECORATIVE;
    }

    // ── coordinate transforms ───────────────────────────────────────────

    public GridPoint worldToGrid(Vector2 world) {
        return new GridPoint(
                (int) Math.floor(world.x() / cellSize),
                (int) Math.floor(world.y() / cellSize));
    }

    /**
     * Returns the world position of the cell's center.
     */
    public Vector2 gridToWorld(int x, int y) {
        return new Vector2(x * cellSize + cellSize / 2.0, y * cellSize + cellSize / 2.0);
    }

    public Vector2 gridToWorld(GridPoint point) {
        return gridToWorld(point.x(), point.y());
    }

    // ── neighbors ───────────────────────────────────────────────────────

    /**
     * The in-bounds cardinal neighbors, in up/right/down/left order.
     */
    public List<GridPoint> getNeighbors(int x, int y) {
        List<GridPoint> neighbors = new ArrayList<>(4);
        for (int[] dir : CARDINAL) {
            int nx = x + dir[0];
            int ny = y + dir[1];
            if (isInBounds(nx, ny)) {
                neighbors.add(new GridPoint(nx, ny));
            }
        }
        return neighbors;
    }

    public List<GridPoint> getWalkableNeighbors(int x, int y) {
        return getNeighbors(x, y).stream()
                .filter(p -> isWalkable(p.x(), p.y()))
                .toList();
    }

    // ── generation helpers ──────────────────────────────────────────────

    /**
     * Marks the given cells as PATH, restoring the previous path to EMPTY first.
     */
    public void setPath(List<GridPoint> path) {
        for (GridPoint old : pathCells) {
            if (getCellType(old) == CellType.PATH) {
                setCellType(old.x(), old.y(), CellType.EMPTY);
            }
        }
        pathCells.clear();
        for (GridPoint p : path) {
            if (isInBounds(p)) {
                setCellType(p.x(), p.y(), CellType.PATH);
                pathCells.add(p);
            }
        }
    }

    public List<GridPoint> getPath() {
        return List.copyOf(pathCells);
    }

    /**
     * Places obstacles on the given cells, skipping any cell that is not EMPTY.
     */
    public void addObstacles(List<GridPoint> obstacles) {
        for (GridPoint p : obstacles) {
            if (getCellType(p) == CellType.EMPTY) {
                setCellType(p.x(), p.y(), CellType.OBSTACLE);
            }
        }
    }

    /**
     * Scatters up to {@code count} obstacles on empty cells at least three cells from every edge.
     */
    public void generateRandomObstacles(int count, Random random) {
        int minX = 3;
        int maxX = width - 3;
        int minY = 3;
        int maxY = height - 3;
        if (maxX <= minX || maxY <= minY) {
            return;
        }
        int placed = 0;
        int attempts = count * 10;
        while (placed < count && attempts-- > 0) {
            int x = minX + random.nextInt(maxX - minX);
            int y = minY + random.nextInt(maxY - minY);
            if (getCellType(x, y) == CellType.EMPTY) {
                setCellType(x, y, CellType.OBSTACLE);
                placed++;
            }
        }
    }

    public void setBorders() {
        for (int x = 0; x < width; x++) {
            setCellType(x, 0, CellType.BORDER);
            setCellType(x, height - 1, CellType.BORDER);
        }
        for (int y = 0; y < height; y++) {
            setCellType(0, y, CellType.BORDER);
            setCellType(width - 1, y, CellType.BORDER);
        }
    }

    public void setSpawnZones(List<GridPoint> spawnZones) {
        for (GridPoint p : spawnZones) {
            setCellType(p.x(), p.y(), CellType.SPAWN_ZONE);
        }
    }

    public List<GridPoint> getCellsOfType(CellType type) {
        List<GridPoint> result = new ArrayList<>();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (cells[y][x].getType() == type) {
                    result.add(new GridPoint(x, y));
                }
            }
        }
        return result;
    }

    public int countCellsOfType(CellType type) {
        int count = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (cells[y][x].getType() == type) {
                    count++;
                }
            }
        }
        return count;
    }
}

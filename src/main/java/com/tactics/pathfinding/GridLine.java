package com.tactics.pathfinding;

import com.tactics.model.GridPoint;

import java.util.ArrayList;
import java.util.List;

/**
 * Bresenham rasterization between two cells.
 */
final class GridLine {

    private GridLine() {
    }

    /**
     * Cells visited walking from {@code from} to {@code to}, both included.
     * Consecutive cells differ by at most one on each axis.
     */
    static List<GridPoint> between(GridPoint from, GridPoint to) {
        List<GridPoint> cells = new ArrayList<>();
        int dx = Math.abs(to.x() - from.x());
        int dy = Math.abs(to.y() - from.y());
        int sx = from.x() < to.x() ? 1 : -1;
        int sy = from.y() < to.y() ? 1 : -1;
        int err = dx - dy;

        int x = from.x();
        int y = from.y();
        cells.add(from);
        while (x != to.x() || y != to.y()) {
            int e2 = 2 * err;
            if (e2 > -dy) {
                err -= dy;
                x += sx;
            }
            if (e2 < dx) {
                err += dx;
                y += sy;
            }
            cells.add(new GridPoint(x, y));
        }
        return cells;
    }
}

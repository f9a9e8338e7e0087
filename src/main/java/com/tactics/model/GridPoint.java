package com.tactics.model;

/**
 * Integer cell coordinates on a {@link Grid}.
 *
 * @param x column index
 * @param y row index
 */
public record GridPoint(int x, int y) {

    public GridPoint offset(int dx, int dy) {
        return new GridPoint(x + dx, y + dy);
    }

    public double distanceTo(GridPoint other) {
        return Math.hypot(other.x - x, other.y - y);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}

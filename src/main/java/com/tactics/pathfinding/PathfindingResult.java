package com.tactics.pathfinding;

import com.tactics.model.Vector2;

import java.util.List;

/**
 * Outcome of a path query. Failures carry an empty path and are never thrown.
 *
 * @param path       waypoints in world space, cell centers, start first
 * @param success    whether the goal cell was reached
 * @param iterations search nodes expanded
 * @param cost       accumulated cost of the unsmoothed route
 * @param strategy   stage that produced the path, {@code null} on failure
 */
public record PathfindingResult(
        List<Vector2> path,
        boolean success,
        int iterations,
        double cost,
        PathStrategy strategy
) {

    public PathfindingResult {
        path = List.copyOf(path);
    }

    public static PathfindingResult failure(int iterations) {
        return new PathfindingResult(List.of(), false, iterations, 0, null);
    }

    public static PathfindingResult trivial(Vector2 point) {
        return new PathfindingResult(List.of(point), true, 0, 0, PathStrategy.TRIVIAL);
    }

    public static PathfindingResult found(List<Vector2> path, int iterations, double cost, PathStrategy strategy) {
        return new PathfindingResult(path, true, iterations, cost, strategy);
    }

    public PathfindingResult withStrategy(PathStrategy newStrategy) {
        return new PathfindingResult(path, success, iterations, cost, newStrategy);
    }

    public boolean isEmpty() {
        return path.isEmpty();
    }
}

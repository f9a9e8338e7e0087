package com.tactics.pathfinding;

import com.tactics.model.MovementType;
import com.tactics.model.Vector2;
import lombok.Builder;
import lombok.Value;

/**
 * Tunables for a single path query.
 */
@Value
@Builder(toBuilder = true)
public class PathfindingOptions {

    @Builder.Default
    int maxIterations = 1000;

    @Builder.Default
    boolean allowDiagonal = true;

    @Builder.Default
    boolean smoothPath = true;

    @Builder.Default
    MovementType movementType = MovementType.WALKING;

    /** Cells closer than this (in cells) to untraversable terrain are rejected. */
    @Builder.Default
    double minDistanceFromObstacles = 0;

    @Builder.Default
    double terrainCostMultiplier = 1.0;

    /** Extra step cost at an obstacle's edge, fading linearly to 0 at {@link #obstacleProximityRange}. */
    @Builder.Default
    double obstacleProximityPenalty = 0;

    @Builder.Default
    double obstacleProximityRange = 0;

    @Builder.Default
    boolean predictiveTarget = false;

    Vector2 targetVelocity;

    /** Seconds to project the goal along {@link #targetVelocity}. */
    @Builder.Default
    double predictionTime = 1.0;

    @Builder.Default
    boolean useCache = true;

    public static PathfindingOptions defaults() {
        return builder().build();
    }

    public MovementType getMovementType() {
        return MovementType.orDefault(movementType);
    }
}

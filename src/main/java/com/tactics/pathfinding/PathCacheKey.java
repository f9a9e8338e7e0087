package com.tactics.pathfinding;

import com.tactics.model.GridPoint;
import com.tactics.model.MovementType;

/**
 * Identity of a cached path: endpoints, capability and every option that shapes the route.
 */
record PathCacheKey(
        GridPoint start,
        GridPoint goal,
        MovementType movementType,
        boolean allowDiagonal,
        boolean smoothPath,
        int maxIterations,
        double minDistanceFromObstacles,
        double terrainCostMultiplier,
        double obstacleProximityPenalty,
        double obstacleProximityRange
) {

    static PathCacheKey of(GridPoint start, GridPoint goal, PathfindingOptions options) {
        return new PathCacheKey(start, goal,
                options.getMovementType(),
                options.isAllowDiagonal(),
                options.isSmoothPath(),
                options.getMaxIterations(),
                options.getMinDistanceFromObstacles(),
                options.getTerrainCostMultiplier(),
                options.getObstacleProximityPenalty(),
                options.getObstacleProximityRange());
    }
}

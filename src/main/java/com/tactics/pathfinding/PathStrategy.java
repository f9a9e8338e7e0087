package com.tactics.pathfinding;

/**
 * Which stage of the search produced a path.
 */
public enum PathStrategy {
    TRIVIAL,            // Start and goal share a cell
    DIRECT,
    RELAXED,            // Clearance constraints dropped
    ALTERNATIVE_GOAL,
    EMERGENCY           // Greedy walk, may stop short of the goal
}

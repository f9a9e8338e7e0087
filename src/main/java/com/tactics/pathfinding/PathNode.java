package com.tactics.pathfinding;

import com.tactics.model.GridPoint;

import java.util.Comparator;

/**
 * Open-set entry of one A* search. Nodes are immutable; a cheaper route to a
 * cell pushes a new node and the old one is skipped when popped.
 */
record PathNode(GridPoint position, double g, double h, PathNode parent, long sequence) {

    static final Comparator<PathNode> BY_PRIORITY = Comparator
            .comparingDouble(PathNode::f)
            .thenComparingDouble(PathNode::h)
            .thenComparingLong(PathNode::sequence);

    double f() {
        return g + h;
    }
}

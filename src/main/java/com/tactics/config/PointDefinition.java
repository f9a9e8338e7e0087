package com.tactics.config;

import com.tactics.model.GridPoint;

/**
 * A cell reference in a map file.
 */
public record PointDefinition(int x, int y) {

    public GridPoint toGridPoint() {
        return new GridPoint(x, y);
    }
}

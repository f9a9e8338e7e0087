package com.tactics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Derived navigation summary of one cell, owned by the navigation overlay.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class NavigationCell {

    @Builder.Default
    private boolean walkable = true;

    @Builder.Default
    private boolean flyable = true;

    @Builder.Default
    private boolean swimmable = false;

    @Builder.Default
    private double cost = 1.0;

    @Builder.Default
    private double distanceToNearestObstacle = Double.POSITIVE_INFINITY;

    public boolean allows(MovementType movementType) {
        return switch (MovementType.orDefault(movementType)) {
            case WALKING -> walkable;
            case FLYING -> flyable;
            case SWIMMING -> swimmable;
            case AMPHIBIOUS -> walkable || swimmable;
            case ALL_TERRAIN -> walkable || flyable || swimmable;
        };
    }
}

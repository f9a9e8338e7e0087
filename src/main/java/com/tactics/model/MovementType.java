package com.tactics.model;

/**
 * How an agent interacts with terrain.
 */
public enum MovementType {
    WALKING,
    FLYING,
    SWIMMING,
    AMPHIBIOUS,     // Can walk and swim
    ALL_TERRAIN;    // Anything walkable, flyable or swimmable

    /**
     * Resolves a possibly missing capability; agents without one walk.
     */
    public static MovementType orDefault(MovementType type) {
        return type != null ? type : WALKING;
    }
}

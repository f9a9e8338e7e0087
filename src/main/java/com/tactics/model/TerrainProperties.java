package com.tactics.model;

/**
 * Movement rules for one terrain type.
 *
 * @param walkable        ground agents may enter
 * @param flyable         flying agents may pass over
 * @param swimmable       swimming agents may enter
 * @param speedMultiplier speed factor while on this terrain (0 for impassable)
 * @param damagePerSecond damage dealt to agents standing here, 0 for none
 * @param statusEffect    effect applied to agents standing here, may be null
 */
public record TerrainProperties(
        boolean walkable,
        boolean flyable,
        boolean swimmable,
        double speedMultiplier,
        double damagePerSecond,
        StatusEffect statusEffect
) {

    public TerrainProperties(boolean walkable, boolean flyable, boolean swimmable, double speedMultiplier) {
        this(walkable, flyable, swimmable, speedMultiplier, 0, null);
    }

    public boolean allows(MovementType movementType) {
        return switch (MovementType.orDefault(movementType)) {
            case WALKING -> walkable;
            case FLYING -> flyable;
            case SWIMMING -> swimmable;
            case AMPHIBIOUS -> walkable || swimmable;
            case ALL_TERRAIN -> walkable || flyable || swimmable;
        };
    }

    public boolean hasEffects() {
        return damagePerSecond > 0 || statusEffect != null;
    }
}

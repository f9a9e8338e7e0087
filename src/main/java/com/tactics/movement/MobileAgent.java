package com.tactics.movement;

import com.tactics.model.MovementType;
import com.tactics.model.StatusEffect;
import com.tactics.model.Vector2;

/**
 * An entity that moves across the terrain.
 * <p>
 * The movement capability is assigned when the entity is created and is read
 * as-is; it is never inferred from the entity's class.
 */
public interface MobileAgent {

    Vector2 getPosition();

    MovementType getMovementType();

    default void takeDamage(double amount) {
    }

    default void applyStatusEffect(StatusEffect effect) {
    }
}

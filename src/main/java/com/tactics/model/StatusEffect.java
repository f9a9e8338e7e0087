package com.tactics.model;

/**
 * A status applied to an agent standing on special terrain.
 *
 * @param type     kind of effect
 * @param duration effect duration in milliseconds
 * @param strength effect magnitude, interpretation depends on the type
 */
public record StatusEffect(Type type, double duration, double strength) {

    public enum Type {
        BURN,
        SLOW,
        FREEZE,
        POISON
    }
}

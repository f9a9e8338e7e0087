package com.tactics.model;

/**
 * A position or velocity in world space.
 */
public record Vector2(double x, double y) {

    public static final Vector2 ZERO = new Vector2(0, 0);

    public Vector2 add(Vector2 other) {
        return new Vector2(x + other.x, y + other.y);
    }

    public Vector2 scale(double factor) {
        return new Vector2(x * factor, y * factor);
    }

    public double distanceTo(Vector2 other) {
        return Math.hypot(other.x - x, other.y - y);
    }
}

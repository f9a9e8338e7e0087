package com.tactics.model;

/**
 * Terrain classification of a single grid cell.
 * <p>
 * Each type carries the walking speed used when a cell has no override, and
 * the symbol that represents it in JSON map files.
 */
public enum CellType {
    EMPTY('.', 1.0),
    PATH('=', 1.2),
    TOWER('T', 0.0),
    BLOCKED('X', 0.0),
    OBSTACLE('#', 0.0),
    DECORATIVE('*', 1.0),
    ROUGH_TERRAIN(':', 0.5),
    WATER('~', 0.0),
    BRIDGE('B', 1.0),
    SPAWN_ZONE('S', 1.0),
    BORDER('+', 0.0);

    private final char symbol;
    private final double walkSpeed;

    CellType(char symbol, double walkSpeed) {
        this.symbol = symbol;
        this.walkSpeed = walkSpeed;
    }

    public char getSymbol() {
        return symbol;
    }

    public double getWalkSpeed() {
        return walkSpeed;
    }

    /**
     * Types that seed the obstacle distance field.
     */
    public boolean isObstacleSeed() {
        return this == OBSTACLE || this == BLOCKED || this == BORDER || this == WATER;
    }

    /**
     * Look up a type by its map-file symbol.
     *
     * @throws IllegalArgumentException if the symbol is unknown
     */
    public static CellType fromSymbol(char symbol) {
        for (CellType type : values()) {
            if (type.symbol == symbol) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown terrain symbol: '" + symbol + "'");
    }
}

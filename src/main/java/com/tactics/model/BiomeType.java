package com.tactics.model;

/**
 * Visual and thematic biome of a map.
 */
public enum BiomeType {
    FOREST,
    DESERT,
    ARCTIC,
    VOLCANIC,
    GRASSLAND
}

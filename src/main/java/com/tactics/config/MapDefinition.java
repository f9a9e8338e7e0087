package com.tactics.config;

import com.tactics.model.BiomeType;
import com.tactics.model.Grid;
import com.tactics.model.MovementType;

import java.util.List;

/**
 * Root definition of a terrain map, loaded from a JSON file.
 *
 * @param id           unique slug, e.g. "river-crossing"
 * @param name         human-readable name
 * @param description  short description of the map
 * @param author       map author / credit
 * @param biome        biome of the whole map, GRASSLAND when absent
 * @param cellSize     world units per cell, {@link Grid#DEFAULT_CELL_SIZE} when absent
 * @param borders      whether the outermost ring is turned into BORDER cells
 * @param terrain      one string per row, top row first, one symbol per cell
 * @param spawnPoints  cells enemies enter from
 * @param target       cell every spawn point must reach
 * @param movementType capability used to validate spawn connectivity, WALKING when absent
 */
public record MapDefinition(
        String id,
        String name,
        String description,
        String author,
        BiomeType biome,
        Integer cellSize,
        boolean borders,
        List<String> terrain,
        List<PointDefinition> spawnPoints,
        PointDefinition target,
        MovementType movementType
) {

    public int width() {
        return terrain == null || terrain.isEmpty() ? 0 : terrain.get(0).length();
    }

    public int height() {
        return terrain == null ? 0 : terrain.size();
    }

    public int cellSizeOrDefault() {
        return cellSize != null ? cellSize : Grid.DEFAULT_CELL_SIZE;
    }
}

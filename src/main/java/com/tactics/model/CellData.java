package com.tactics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Contents of one grid cell: its terrain type plus optional per-cell overrides.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CellData {

    @Builder.Default
    private CellType type = CellType.EMPTY;

    /** Overrides the type's default speed when set. */
    private Double movementSpeed;

    /** Terrain height in [0, 1]. */
    private Double height;

    private String biomeVariant;

    private String decoration;

    public static CellData of(CellType type) {
        return CellData.builder().type(type).build();
    }

    public boolean hasSpeedOverride() {
        return movementSpeed != null;
    }
}

package com.tactics.dto;

import com.tactics.model.Vector2;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Reachability of the target from one spawn point.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SpawnPointValidation {

    private Vector2 spawnPoint;
    private boolean valid;

    @Builder.Default
    private List<Vector2> path = new ArrayList<>();

    private double pathCost;

    /** Straight-line distance to the target, in cells. */
    private double distance;

    /** Why the spawn point is invalid; {@code null} when valid. */
    private String issue;

    /**
     * Route cost relative to the straight-line distance, 1 for a spawn on the target cell.
     */
    public double getPathRatio() {
        return distance > 0 ? pathCost / distance : 1.0;
    }
}

package com.tactics.dto;

import com.tactics.model.Vector2;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Advisory reachability report for all spawn points of a map.
 * Errors name unreachable spawns; warnings flag weak but playable layouts.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MapConnectivityValidation {

    private boolean allSpawnPointsValid;

    @Builder.Default
    private List<Vector2> validSpawnPoints = new ArrayList<>();

    @Builder.Default
    private List<Vector2> invalidSpawnPoints = new ArrayList<>();

    @Builder.Default
    private List<SpawnPointValidation> spawnValidations = new ArrayList<>();

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}

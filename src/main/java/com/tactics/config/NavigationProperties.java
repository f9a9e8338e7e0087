package com.tactics.config;

import com.tactics.pathfinding.PathfindingOptions;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Navigation tunables bound from {@code navigation.*} in application.properties.
 *
 * @param maxIterations               A* expansion budget for ordinary queries
 * @param allowDiagonal               default for {@link PathfindingOptions#isAllowDiagonal()}
 * @param smoothPath                  default for {@link PathfindingOptions#isSmoothPath()}
 * @param cacheCapacity               path cache entries per session
 * @param obstacleBuffer              cells closer than this to an obstacle cost double
 * @param validationMaxIterations     expansion budget for spawn reachability checks
 * @param fallbackIterationMultiplier budget multiplier for the relaxed fallback search
 * @param alternativeGoalRadii        ring radii, in cells, tried around an unreachable goal
 * @param alternativeGoalAngles       candidates per ring
 * @param emergencyMaxSteps           step limit of the greedy last-resort walk
 * @param safePositionMaxRadius       ring limit when looking for a clear spot
 * @param speedCacheCapacity          terrain speed lookups kept per session
 * @param longPathRatio               path cost over straight distance above which a spawn is flagged
 * @param minValidSpawnPoints         fewer reachable spawns than this is flagged
 * @param validateMapsOnStartup       run the connectivity report when the application starts
 */
@Validated
@ConfigurationProperties("navigation")
public record NavigationProperties(
        @DefaultValue("1000") @Positive int maxIterations,
        @DefaultValue("true") boolean allowDiagonal,
        @DefaultValue("true") boolean smoothPath,
        @DefaultValue("50") @PositiveOrZero int cacheCapacity,
        @DefaultValue("0.5") @PositiveOrZero double obstacleBuffer,
        @DefaultValue("10000") @Positive int validationMaxIterations,
        @DefaultValue("2") @Min(1) int fallbackIterationMultiplier,
        @DefaultValue({"1", "2", "3", "5"}) @NotEmpty List<@Positive Integer> alternativeGoalRadii,
        @DefaultValue("8") @Positive int alternativeGoalAngles,
        @DefaultValue("200") @PositiveOrZero int emergencyMaxSteps,
        @DefaultValue("10") @PositiveOrZero int safePositionMaxRadius,
        @DefaultValue("100") @PositiveOrZero int speedCacheCapacity,
        @DefaultValue("3.0") @Positive double longPathRatio,
        @DefaultValue("2") @PositiveOrZero int minValidSpawnPoints,
        @DefaultValue("true") boolean validateMapsOnStartup
) {

    public NavigationProperties {
        alternativeGoalRadii = List.copyOf(alternativeGoalRadii);
    }

    /**
     * The values used when no property overrides them, for use outside a Spring context.
     */
    public static NavigationProperties defaults() {
        return new NavigationProperties(1000, true, true, 50, 0.5, 10000, 2,
                List.of(1, 2, 3, 5), 8, 200, 10, 100, 3.0, 2, true);
    }

    /**
     * Query options seeded with the configured defaults.
     */
    public PathfindingOptions toOptions() {
        return PathfindingOptions.builder()
                .maxIterations(maxIterations)
                .allowDiagonal(allowDiagonal)
                .smoothPath(smoothPath)
                .build();
    }
}

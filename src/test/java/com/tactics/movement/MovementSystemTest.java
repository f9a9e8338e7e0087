package com.tactics.movement;

import com.tactics.model.CellData;
import com.tactics.model.CellType;
import com.tactics.model.Grid;
import com.tactics.model.MovementType;
import com.tactics.model.StatusEffect;
import com.tactics.model.TerrainProperties;
import com.tactics.model.Vector2;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.*;

/**
 * Unit tests for MovementSystem rule lookups, costs and terrain effects.
 */
@ExtendWith(MockitoExtension.class)
class MovementSystemTest {

    private static final int CELL = 32;

    @Mock private MobileAgent agent;

    private Grid grid;
    private MovementSystem movementSystem;

    @BeforeEach
    void setUp() {
        grid = new Grid(10, 10, CELL);
        movementSystem = new MovementSystem(grid);
    }

    private Vector2 center(int x, int y) {
        return grid.gridToWorld(x, y);
    }

    @Nested
    @DisplayName("canMoveOnTerrain()")
    class CanMoveOnTerrainTests {

        @ParameterizedTest(name = "{0} on {1} -> {2}")
        @CsvSource({
                "WALKING, EMPTY, true",
                "WALKING, WATER, false",
                "WALKING, BRIDGE, true",
                "WALKING, TOWER, false",
                "FLYING, WATER, true",
                "FLYING, OBSTACLE, false",
                "FLYING, BORDER, false",
                "SWIMMING, WATER, true",
                "SWIMMING, EMPTY, false",
                "AMPHIBIOUS, WATER, true",
                "AMPHIBIOUS, ROUGH_TERRAIN, true",
                "AMPHIBIOUS, BLOCKED, false",
                "ALL_TERRAIN, WATER, true",
                "ALL_TERRAIN, OBSTACLE, false"
        })
        void shouldFollowRuleTable(MovementType type, CellType cell, boolean expected) {
            assertEquals(expected, MovementSystem.canMoveOnTerrain(type, cell));
        }

        @Test
        @DisplayName("should treat a missing capability as walking")
        void shouldDefaultToWalking() {
            assertTrue(MovementSystem.canMoveOnTerrain(null, CellType.EMPTY));
            assertFalse(MovementSystem.canMoveOnTerrain(null, CellType.WATER));
        }
    }

    @Nested
    @DisplayName("getMovementCost()")
    class MovementCostTests {

        @Test
        @DisplayName("should be infinite onto untraversable terrain")
        void shouldBeInfiniteWhenBlocked() {
            grid.setCellType(1, 0, CellType.OBSTACLE);
            assertEquals(Double.POSITIVE_INFINITY,
                    MovementSystem.getMovementCost(center(0, 0), center(1, 0), grid, MovementType.WALKING));
        }

        @Test
        @DisplayName("should make slow terrain more expensive")
        void shouldScaleInverselyWithSpeed() {
            grid.setCellType(1, 0, CellType.ROUGH_TERRAIN);
            grid.setCellType(1, 1, CellType.PATH);

            double rough = MovementSystem.getMovementCost(center(0, 0), center(1, 0), grid, MovementType.WALKING);
            double road = MovementSystem.getMovementCost(center(0, 1), center(1, 1), grid, MovementType.WALKING);

            assertEquals(2.0, rough, 1e-9);
            assertEquals(1.0 / 1.2, road, 1e-9);
        }

        @Test
        @DisplayName("flying should ignore terrain speed")
        void flyingShouldIgnoreSpeed() {
            grid.setCellType(1, 0, CellType.ROUGH_TERRAIN);
            grid.setCellType(2, 0, CellType.WATER);

            assertEquals(1.0, MovementSystem.getMovementCost(center(0, 0), center(1, 0), grid, MovementType.FLYING), 1e-9);
            assertEquals(1.0, MovementSystem.getMovementCost(center(1, 0), center(2, 0), grid, MovementType.FLYING), 1e-9);
        }

        @Test
        @DisplayName("swimming should use the water speed")
        void swimmingShouldUseWaterSpeed() {
            grid.setCellType(0, 0, CellType.WATER);
            grid.setCellType(1, 0, CellType.WATER);

            assertEquals(1.0 / 0.8,
                    MovementSystem.getMovementCost(center(0, 0), center(1, 0), grid, MovementType.SWIMMING), 1e-9);
        }
    }

    @Nested
    @DisplayName("getEffectiveSpeed()")
    class EffectiveSpeedTests {

        @Test
        @DisplayName("should prefer a cell override for ground movement")
        void shouldUseOverride() {
            grid.setCellData(2, 2, CellData.builder().type(CellType.EMPTY).movementSpeed(0.25).build());

            assertEquals(0.25, MovementSystem.getEffectiveSpeed(MovementType.WALKING, grid, 2, 2));
            assertEquals(1.0, MovementSystem.getEffectiveSpeed(MovementType.FLYING, grid, 2, 2));
        }

        @Test
        @DisplayName("should be zero outside the grid")
        void shouldBeZeroOutOfBounds() {
            assertEquals(0, MovementSystem.getEffectiveSpeed(MovementType.FLYING, grid, -1, 0));
        }
    }

    @Nested
    @DisplayName("agent helpers")
    class AgentTests {

        @Test
        @DisplayName("should use the agent's declared capability")
        void shouldUseDeclaredCapability() {
            grid.setCellType(3, 3, CellType.WATER);
            when(agent.getMovementType()).thenReturn(MovementType.FLYING);

            assertTrue(movementSystem.canEntityMoveTo(agent, center(3, 3)));
            assertFalse(movementSystem.canEntityMoveTo(agent, new Vector2(-5, 0)));
        }

        @Test
        @DisplayName("should fall back to walking for agents without a capability")
        void shouldFallBackToWalking() {
            when(agent.getMovementType()).thenReturn(null);
            assertEquals(MovementType.WALKING, movementSystem.getEntityMovementType(agent));
        }

        @Test
        @DisplayName("getAdjustedSpeed should scale by terrain and cache lookups")
        void shouldScaleAndCacheSpeed() {
            grid.setCellType(4, 4, CellType.ROUGH_TERRAIN);
            when(agent.getPosition()).thenReturn(center(4, 4));
            when(agent.getMovementType()).thenReturn(MovementType.WALKING);

            assertEquals(50.0, movementSystem.getAdjustedSpeed(agent, 100.0), 1e-9);
            assertEquals(50.0, movementSystem.getAdjustedSpeed(agent, 100.0), 1e-9);
            assertEquals(1, movementSystem.getSpeedCacheSize());

            movementSystem.clearCache();
            assertEquals(0, movementSystem.getSpeedCacheSize());
        }

        @Test
        @DisplayName("getAdjustedSpeed should follow overridden rule speeds")
        void shouldUseOverriddenSpeed() {
            MovementSystem mud = new MovementSystem(grid,
                    Map.of(CellType.EMPTY, new TerrainProperties(true, true, false, 0.25)),
                    MovementSystem.DEFAULT_SPEED_CACHE_CAPACITY);
            when(agent.getPosition()).thenReturn(center(3, 3));
            when(agent.getMovementType()).thenReturn(MovementType.WALKING);

            assertTrue(mud.canEntityMoveTo(agent, center(3, 3)));
            assertEquals(25.0, mud.getAdjustedSpeed(agent, 100.0), 1e-9);
            assertEquals(0.25, mud.getEffectiveSpeed(MovementType.WALKING, 3, 3), 1e-9);
            assertEquals(1.0, MovementSystem.getEffectiveSpeed(MovementType.WALKING, grid, 3, 3), 1e-9);
        }

        @Test
        @DisplayName("overridden rules that forbid a capability should give zero speed")
        void shouldZeroSpeedWhenOverrideForbids() {
            MovementSystem closed = new MovementSystem(grid,
                    Map.of(CellType.EMPTY, new TerrainProperties(false, true, false, 0.0)),
                    MovementSystem.DEFAULT_SPEED_CACHE_CAPACITY);
            when(agent.getPosition()).thenReturn(center(3, 3));
            when(agent.getMovementType()).thenReturn(MovementType.WALKING);

            assertFalse(closed.canEntityMoveTo(agent, center(3, 3)));
            assertEquals(0.0, closed.getAdjustedSpeed(agent, 100.0), 1e-9);
        }

        @Test
        @DisplayName("speed cache should evict the oldest entry at capacity")
        void shouldBoundSpeedCache() {
            MovementSystem small = new MovementSystem(grid, Map.of(), 2);
            when(agent.getMovementType()).thenReturn(MovementType.WALKING);
            when(agent.getPosition()).thenReturn(center(0, 0), center(1, 0), center(2, 0));

            small.getAdjustedSpeed(agent, 1.0);
            small.getAdjustedSpeed(agent, 1.0);
            small.getAdjustedSpeed(agent, 1.0);

            assertEquals(2, small.getSpeedCacheSize());
        }
    }

    @Nested
    @DisplayName("applyTerrainEffects()")
    class TerrainEffectTests {

        @Test
        @DisplayName("should do nothing with the default rules")
        void shouldBeInertByDefault() {
            when(agent.getPosition()).thenReturn(center(1, 1));

            movementSystem.applyTerrainEffects(agent, 1000);

            verify(agent, never()).takeDamage(anyDouble());
            verify(agent, never()).applyStatusEffect(any());
        }

        @Test
        @DisplayName("should apply damage and effects from overridden rules")
        void shouldApplyOverriddenEffects() {
            StatusEffect burn = new StatusEffect(StatusEffect.Type.BURN, 2.0, 0.5);
            MovementSystem lava = new MovementSystem(grid,
                    Map.of(CellType.ROUGH_TERRAIN, new TerrainProperties(true, true, false, 0.5, 10.0, burn)),
                    MovementSystem.DEFAULT_SPEED_CACHE_CAPACITY);
            grid.setCellType(2, 2, CellType.ROUGH_TERRAIN);
            when(agent.getPosition()).thenReturn(center(2, 2));

            lava.applyTerrainEffects(agent, 500);

            verify(agent).takeDamage(5.0);
            verify(agent).applyStatusEffect(burn);
        }
    }

    @Test
    @DisplayName("getSmoothTransitionSpeed should limit the change per second")
    void shouldEaseSpeed() {
        assertEquals(1.5, MovementSystem.getSmoothTransitionSpeed(1.0, 3.0, 500, 1.0), 1e-9);
        assertEquals(3.0, MovementSystem.getSmoothTransitionSpeed(2.9, 3.0, 500, 1.0), 1e-9);
        assertEquals(0.5, MovementSystem.getSmoothTransitionSpeed(1.0, 0.0, 500, 1.0), 1e-9);
    }
}

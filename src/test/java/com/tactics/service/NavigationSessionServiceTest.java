package com.tactics.service;

import com.tactics.config.MapDefinition;
import com.tactics.config.MapLoader;
import com.tactics.config.NavigationProperties;
import com.tactics.config.PointDefinition;
import com.tactics.dto.MapConnectivityValidation;
import com.tactics.model.BiomeType;
import com.tactics.model.CellType;
import com.tactics.model.Grid;
import com.tactics.model.MovementType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for NavigationSessionService session lifecycle and terrain parsing.
 */
@ExtendWith(MockitoExtension.class)
class NavigationSessionServiceTest {

    @Mock private MapLoader mapLoader;

    private NavigationSessionService sessionService;

    private MapDefinition arena;

    @BeforeEach
    void setUp() {
        sessionService = new NavigationSessionService(mapLoader, NavigationProperties.defaults());
        arena = map("arena", List.of(
                "........",
                ".S..#...",
                "....#...",
                ".S..#..~",
                "........",
                "........"),
                List.of(new PointDefinition(1, 1), new PointDefinition(1, 3)),
                new PointDefinition(6, 2));
    }

    private static MapDefinition map(String id, List<String> terrain, List<PointDefinition> spawns,
                                     PointDefinition target) {
        return new MapDefinition(id, "Map " + id, "Test map", "Tester", BiomeType.DESERT, 16, true,
                terrain, spawns, target, MovementType.WALKING);
    }

    @Nested
    @DisplayName("openSession()")
    class OpenSessionTests {

        @Test
        @DisplayName("should build the grid from the terrain rows")
        void shouldParseTerrain() {
            when(mapLoader.getMap("arena")).thenReturn(arena);

            NavigationSession session = sessionService.openSession("arena");
            Grid grid = session.getGrid();

            assertEquals(8, grid.getWidth());
            assertEquals(6, grid.getHeight());
            assertEquals(16, grid.getCellSize());
            assertEquals(BiomeType.DESERT, grid.getBiome());
            assertEquals(CellType.OBSTACLE, grid.getCellType(4, 2));
            assertEquals(CellType.SPAWN_ZONE, grid.getCellType(1, 1));
            assertEquals(CellType.BORDER, grid.getCellType(7, 3), "borders overwrite the edge");
            assertEquals(List.of(grid.gridToWorld(1, 1), grid.gridToWorld(1, 3)), session.getSpawnPoints());
            assertSame(session, sessionService.getActiveSession());
        }

        @Test
        @DisplayName("should replace and close the previous session")
        void shouldReplaceSession() {
            when(mapLoader.getMap("arena")).thenReturn(arena);
            NavigationSession first = sessionService.openSession("arena");
            first.findPath(first.getGrid().gridToWorld(1, 1), first.getGrid().gridToWorld(6, 2), (MovementType) null);
            assertEquals(1, first.getPathfinder().getCacheSize());

            NavigationSession second = sessionService.openSession("arena");

            assertNotSame(first, second);
            assertSame(second, sessionService.getActiveSession());
            assertEquals(0, first.getPathfinder().getCacheSize());
        }

        @Test
        @DisplayName("should propagate unknown map ids")
        void shouldRejectUnknownMap() {
            when(mapLoader.getMap("missing")).thenThrow(new IllegalArgumentException("Unknown map: missing"));

            assertThrows(IllegalArgumentException.class, () -> sessionService.openSession("missing"));
            assertTrue(sessionService.findActiveSession().isEmpty());
        }

        @Test
        @DisplayName("should reject ragged terrain rows")
        void shouldRejectRaggedRows() {
            when(mapLoader.getMap("ragged")).thenReturn(map("ragged", List.of("....", "..."), List.of(), null));

            IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                    () -> sessionService.openSession("ragged"));
            assertTrue(ex.getMessage().contains("row 1"));
        }

        @Test
        @DisplayName("should reject unknown terrain symbols and empty terrain")
        void shouldRejectBadTerrain() {
            when(mapLoader.getMap("symbols")).thenReturn(map("symbols", List.of("..?."), List.of(), null));
            when(mapLoader.getMap("empty")).thenReturn(map("empty", List.of(), List.of(), null));

            assertThrows(IllegalArgumentException.class, () -> sessionService.openSession("symbols"));
            assertThrows(IllegalArgumentException.class, () -> sessionService.openSession("empty"));
        }
    }

    @Nested
    @DisplayName("active session")
    class ActiveSessionTests {

        @Test
        @DisplayName("getActiveSession() should throw when nothing is open")
        void shouldThrowWithoutSession() {
            IllegalStateException ex = assertThrows(IllegalStateException.class,
                    () -> sessionService.getActiveSession());
            assertEquals("No active navigation session", ex.getMessage());
        }

        @Test
        @DisplayName("closeSession() should clear the active session")
        void shouldCloseSession() {
            when(mapLoader.getMap("arena")).thenReturn(arena);
            sessionService.openSession("arena");

            sessionService.closeSession();

            assertTrue(sessionService.findActiveSession().isEmpty());
            assertDoesNotThrow(() -> sessionService.closeSession());
        }
    }

    @Nested
    @DisplayName("validateMap()")
    class ValidateMapTests {

        @Test
        @DisplayName("should report every spawn reachable on a connected map")
        void shouldValidateConnectedMap() {
            when(mapLoader.getMap("arena")).thenReturn(arena);

            MapConnectivityValidation report = sessionService.validateMap("arena");

            assertTrue(report.isAllSpawnPointsValid());
            assertEquals(2, report.getValidSpawnPoints().size());
            assertTrue(sessionService.findActiveSession().isEmpty(), "validation must not open a session");
        }

        @Test
        @DisplayName("should flag a walled-off spawn point")
        void shouldFlagWalledSpawn() {
            MapDefinition walled = map("walled", List.of(
                    "........",
                    ".S.#....",
                    "####....",
                    ".S......",
                    "........",
                    "........"),
                    List.of(new PointDefinition(1, 1), new PointDefinition(1, 3)),
                    new PointDefinition(6, 3));
            when(mapLoader.getMap("walled")).thenReturn(walled);

            MapConnectivityValidation report = sessionService.validateMap("walled");

            assertFalse(report.isAllSpawnPointsValid());
            assertEquals(1, report.getErrors().size());
            assertTrue(report.getErrors().get(0).startsWith("Spawn point 0 at grid (1, 1)"));
            verify(mapLoader).getMap("walled");
        }

        @Test
        @DisplayName("should refuse maps without a target")
        void shouldRequireTarget() {
            when(mapLoader.getMap("no-target")).thenReturn(map("no-target", List.of("...."),
                    List.of(new PointDefinition(0, 0)), null));

            assertThrows(IllegalStateException.class, () -> sessionService.validateMap("no-target"));
        }
    }
}

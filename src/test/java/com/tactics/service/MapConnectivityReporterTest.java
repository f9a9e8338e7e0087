package com.tactics.service;

import com.tactics.config.MapDefinition;
import com.tactics.config.MapLoader;
import com.tactics.config.NavigationProperties;
import com.tactics.dto.MapConnectivityValidation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MapConnectivityReporterTest {

    @Mock private MapLoader mapLoader;
    @Mock private NavigationSessionService sessionService;

    private static MapDefinition definition(String id) {
        return new MapDefinition(id, id, null, null, null, null, false, List.of("."), List.of(), null, null);
    }

    @Test
    @DisplayName("should validate every loaded map and keep going after a broken one")
    void shouldReportAllMaps() {
        MapConnectivityValidation ok = MapConnectivityValidation.builder().allSpawnPointsValid(true).build();
        when(mapLoader.getAvailableMaps()).thenReturn(List.of(definition("a"), definition("b"), definition("c")));
        when(sessionService.validateMap("a")).thenReturn(ok);
        when(sessionService.validateMap("b")).thenThrow(new IllegalStateException("Map 'b' defines no target"));
        when(sessionService.validateMap("c")).thenReturn(MapConnectivityValidation.builder()
                .errors(List.of("Spawn point 0 at grid (1, 1) is unreachable: No valid path from spawn point to target"))
                .build());

        MapConnectivityReporter reporter = new MapConnectivityReporter(mapLoader, sessionService,
                NavigationProperties.defaults());
        Map<String, MapConnectivityValidation> reports = reporter.reportAll();

        assertEquals(List.of("a", "c"), List.copyOf(reports.keySet()));
        assertSame(ok, reports.get("a"));
    }

    @Test
    @DisplayName("should do nothing at startup when disabled")
    void shouldSkipWhenDisabled() {
        NavigationProperties disabled = new NavigationProperties(1000, true, true, 50, 0.5, 10000, 2,
                List.of(1, 2, 3, 5), 8, 200, 10, 100, 3.0, 2, false);
        MapConnectivityReporter reporter = new MapConnectivityReporter(mapLoader, sessionService, disabled);

        reporter.run(new DefaultApplicationArguments());

        verifyNoInteractions(mapLoader, sessionService);
    }
}

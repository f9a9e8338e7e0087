package com.tactics.service;

import com.tactics.config.MapDefinition;
import com.tactics.config.MapLoader;
import com.tactics.config.NavigationProperties;
import com.tactics.dto.MapConnectivityValidation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Logs a spawn connectivity report for every loaded map when the application starts.
 * Findings never stop startup.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MapConnectivityReporter implements ApplicationRunner {

    private final MapLoader mapLoader;
    private final NavigationSessionService sessionService;
    private final NavigationProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.validateMapsOnStartup()) {
            log.debug("Startup map validation disabled");
            return;
        }
        reportAll();
    }

    /**
     * Validates every loaded map. Maps that cannot be built are logged and left out.
     */
    public Map<String, MapConnectivityValidation> reportAll() {
        Map<String, MapConnectivityValidation> reports = new LinkedHashMap<>();
        for (MapDefinition map : mapLoader.getAvailableMaps()) {
            try {
                MapConnectivityValidation report = sessionService.validateMap(map.id());
                reports.put(map.id(), report);
                log(map, report);
            } catch (IllegalArgumentException | IllegalStateException e) {
                log.error("Cannot validate map '{}': {}", map.id(), e.getMessage());
            }
        }
        return reports;
    }

    private void log(MapDefinition map, MapConnectivityValidation report) {
        if (report.isAllSpawnPointsValid() && report.getWarnings().isEmpty()) {
            log.info("Map '{}': all {} spawn point(s) reach the target", map.name(),
                    report.getValidSpawnPoints().size());
            return;
        }
        report.getErrors().forEach(error -> log.warn("Map '{}': {}", map.name(), error));
        report.getWarnings().forEach(warning -> log.warn("Map '{}': {}", map.name(), warning));
    }
}

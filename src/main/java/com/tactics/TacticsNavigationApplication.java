package com.tactics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main entry point for the Tactics navigation core.
 *
 * Features:
 * - Terrain maps loaded from JSON definitions
 * - Navigation overlay with dynamic obstacles
 * - A* pathfinding for walking, flying, swimming and amphibious agents
 * - Spawn point connectivity reports for map authoring
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class TacticsNavigationApplication {

    public static void main(String[] args) {
        SpringApplication.run(TacticsNavigationApplication.class, args);
    }
}

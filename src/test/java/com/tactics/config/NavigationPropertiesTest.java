package com.tactics.config;

import com.tactics.pathfinding.PathfindingOptions;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class NavigationPropertiesTest {

    @Test
    @DisplayName("defaults() should match the documented tunables")
    void shouldExposeDefaults() {
        NavigationProperties props = NavigationProperties.defaults();

        assertEquals(1000, props.maxIterations());
        assertEquals(50, props.cacheCapacity());
        assertEquals(0.5, props.obstacleBuffer());
        assertEquals(10000, props.validationMaxIterations());
        assertEquals(List.of(1, 2, 3, 5), props.alternativeGoalRadii());
        assertEquals(8, props.alternativeGoalAngles());
        assertEquals(3.0, props.longPathRatio());
        assertEquals(2, props.minValidSpawnPoints());
    }

    @Test
    @DisplayName("toOptions() should carry the configured search defaults")
    void shouldSeedOptions() {
        NavigationProperties props = new NavigationProperties(250, false, false, 10, 0.5, 500, 3,
                List.of(2), 4, 50, 5, 10, 2.0, 1, false);

        PathfindingOptions options = props.toOptions();

        assertEquals(250, options.getMaxIterations());
        assertFalse(options.isAllowDiagonal());
        assertFalse(options.isSmoothPath());
        assertTrue(options.isUseCache());
    }

    @Test
    @DisplayName("should reject a zero search budget and empty goal rings")
    void shouldRejectInvalidTunables() {
        NavigationProperties props = new NavigationProperties(0, true, true, 50, 0.5, 10000, 2,
                List.of(), 8, 200, 10, 100, 3.0, 2, true);

        try (ValidatorFactory factory = Validation.buildDefaultValidatorFactory()) {
            Validator validator = factory.getValidator();
            Set<String> invalid = validator.validate(props).stream()
                    .map(ConstraintViolation::getPropertyPath)
                    .map(Object::toString)
                    .collect(Collectors.toSet());

            assertEquals(Set.of("maxIterations", "alternativeGoalRadii"), invalid);
        }
    }

    @Test
    @DisplayName("defaults() should pass validation")
    void shouldAcceptDefaults() {
        try (ValidatorFactory factory = Validation.buildDefaultValidatorFactory()) {
            assertTrue(factory.getValidator().validate(NavigationProperties.defaults()).isEmpty());
        }
    }
}

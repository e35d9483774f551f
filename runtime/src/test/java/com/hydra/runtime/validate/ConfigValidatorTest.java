package com.hydra.runtime.validate;

import com.hydra.config.HydraConfig;
import com.hydra.config.HydraConfigException;
import com.hydra.config.Location;
import com.hydra.runtime.event.HydraEvents;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigValidatorTest {

    private final List<String> errors = new ArrayList<>();
    private ConfigValidator validator;

    @BeforeEach
    void setUp() {
        HydraEvents events = new HydraEvents(Location.SERVER);
        events.addErrorListener((source, message, side) -> errors.add(source + ": " + message));
        validator = new ConfigValidator(events);
    }

    private static HydraConfig parse(String hocon) {
        return HydraConfig.fromConfig(ConfigFactory.parseString(hocon));
    }

    @Test
    void validGraphPasses() {
        HydraConfig config = parse("""
            hydra.modules {
              "Core.Log" {}
              "Data.Profiles" { location = server, dependencies = ["Core.Log"] }
              "Data.Manager" { location = server, dependencies = ["Data.Profiles", "Core.Log"] }
            }
            """);

        assertTrue(validator.validate(config).isEmpty());
        assertTrue(errors.isEmpty());
    }

    @Test
    void lenientValidationReportsEveryProblem() {
        HydraConfig config = parse("""
            hydra.strict-validation = false
            hydra.modules {
              "A" { dependencies = ["Ghost"] }
              "B" { location = server }
              "C" { dependencies = ["B"] }
              "D" { location = server, dependencies = ["E"] }
              "E" { location = client }
            }
            """);

        List<String> problems = validator.validate(config);

        assertEquals(List.of(
                "Missing dependency config 'Ghost' for A",
                "Side mismatch: Shared module C depends on SERVER-only B",
                "Side mismatch: SERVER module D depends on CLIENT E"), problems);
        assertEquals(List.of("Hydra: Validate: " + String.join("; ", problems)), errors);
    }

    @Test
    void cycleIsDetected() {
        HydraConfig config = parse("""
            hydra.strict-validation = false
            hydra.modules {
              "X" { dependencies = ["Y"] }
              "Y" { dependencies = ["X"] }
              "Z" {}
            }
            """);

        assertEquals(List.of("Cycle detected in dependencies: [X, Y]"), validator.validate(config));
    }

    @Test
    void strictValidationThrowsAggregatedMessage() {
        HydraConfig config = parse("""
            hydra.modules {
              "A" { dependencies = ["Ghost", "Phantom"] }
            }
            """);

        HydraConfigException e = assertThrows(HydraConfigException.class, () -> validator.validate(config));
        assertEquals("Config validation failed: Missing dependency config 'Ghost' for A; "
                     + "Missing dependency config 'Phantom' for A", e.getMessage());
        assertTrue(errors.isEmpty());
    }

    @Test
    void malformedDescriptorsAreProblems() {
        HydraConfig config = parse("""
            hydra.strict-validation = false
            hydra.modules {
              "Bad" { location = moon }
            }
            """);

        List<String> problems = validator.validate(config);

        assertEquals(1, problems.size());
        assertTrue(problems.get(0).startsWith("Invalid descriptor for module 'Bad'"), problems.get(0));
    }

    @Test
    void disabledAndInvisibleModulesAreIgnored() {
        HydraConfig config = parse("""
            hydra.modules {
              "Off" { enabled = false, dependencies = ["Ghost"] }
              "Hud" { location = client, dependencies = ["Ghost"] }
            }
            """);

        assertTrue(validator.validate(config).isEmpty());
    }
}

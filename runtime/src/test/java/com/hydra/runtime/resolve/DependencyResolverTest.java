package com.hydra.runtime.resolve;

import com.hydra.config.HydraConfigException;
import com.hydra.runtime.DependencyCycleException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DependencyResolverTest {

    private static ResolutionResult resolve(boolean strict, List<String> names, Map<String, List<String>> deps) {
        return new DependencyResolver(strict).resolve(names, name -> deps.getOrDefault(name, List.of()));
    }

    @Test
    void dependenciesComeFirst() {
        ResolutionResult result = resolve(true, List.of("Data.Manager", "Core.Log", "Data.Profiles"),
                Map.of("Data.Manager", List.of("Data.Profiles"),
                       "Data.Profiles", List.of("Core.Log")));

        assertFalse(result.isCyclic());
        assertEquals(List.of("Core.Log", "Data.Profiles", "Data.Manager"), result.getOrder());
    }

    @Test
    void independentModulesKeepDiscoveryOrder() {
        ResolutionResult result = resolve(true, List.of("C", "A", "B", "D"),
                Map.of("D", List.of("A")));

        assertEquals(List.of("C", "A", "B", "D"), result.getOrder());
    }

    @Test
    void diamondIsOrderedOnce() {
        ResolutionResult result = resolve(true, List.of("Top", "Left", "Right", "Base"),
                Map.of("Top", List.of("Left", "Right", "Left"),
                       "Left", List.of("Base"),
                       "Right", List.of("Base")));

        assertEquals(List.of("Base", "Left", "Right", "Top"), result.getOrder());
    }

    @Test
    void cycleIsReportedInLenientMode() {
        ResolutionResult result = resolve(false, List.of("Free", "A", "B", "AfterCycle"),
                Map.of("A", List.of("B"), "B", List.of("A"), "AfterCycle", List.of("A")));

        assertTrue(result.isCyclic());
        assertEquals(Set.of("A", "B", "AfterCycle"), result.getUnresolved());
        assertEquals(List.of("Free"), result.getOrder());
    }

    @Test
    void cycleThrowsInStrictMode() {
        DependencyCycleException e = assertThrows(DependencyCycleException.class,
                () -> resolve(true, List.of("A", "B"), Map.of("A", List.of("B"), "B", List.of("A"))));

        assertEquals(Set.of("A", "B"), e.getModules());
    }

    @Test
    void selfDependencyIsACycle() {
        ResolutionResult result = resolve(false, List.of("Self"), Map.of("Self", List.of("Self")));

        assertTrue(result.isCyclic());
        assertEquals(Set.of("Self"), result.getUnresolved());
    }

    @Test
    void unknownDependencyIsIgnoredInLenientMode() {
        ResolutionResult result = resolve(false, List.of("A"), Map.of("A", List.of("Elsewhere")));

        assertEquals(List.of("A"), result.getOrder());
    }

    @Test
    void unknownDependencyFailsInStrictMode() {
        HydraConfigException e = assertThrows(HydraConfigException.class,
                () -> resolve(true, List.of("A"), Map.of("A", List.of("Elsewhere"))));

        assertEquals("Module 'A' depends on unknown module 'Elsewhere'", e.getMessage());
    }

    @Test
    void emptyInputGivesEmptyOrder() {
        ResolutionResult result = resolve(true, List.of(), Map.of());

        assertFalse(result.isCyclic());
        assertTrue(result.getOrder().isEmpty());
    }
}

package com.autods.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DatasetProfileTest {

    private static DatasetProfile profile(FeatureTypes types) {
        return new DatasetProfile(new DatasetShape(10, 3), List.of("a", "b", "y"), Map.of(), "y", "nominal",
                true, types, Map.of(), Map.of("p", 6, "q", 4), 1.5, List.of());
    }

    @Nested
    @DisplayName("feature partition")
    class Partition {

        @Test
        @DisplayName("accepts a disjoint cover of the non-target columns")
        void valid() {
            var p = profile(new FeatureTypes(List.of("a"), List.of("b")));
            assertEquals(List.of("a"), p.featureTypes().numeric());
        }

        @Test
        @DisplayName("rejects overlapping types")
        void overlap() {
            assertThrows(IllegalArgumentException.class,
                    () -> profile(new FeatureTypes(List.of("a", "b"), List.of("b"))));
        }

        @Test
        @DisplayName("rejects a missing column or the target as a feature")
        void incomplete() {
            assertThrows(IllegalArgumentException.class,
                    () -> profile(new FeatureTypes(List.of("a"), List.of())));
            assertThrows(IllegalArgumentException.class,
                    () -> profile(new FeatureTypes(List.of("a", "y"), List.of("b"))));
        }
    }

    @Test
    @DisplayName("withNotes returns a copy and leaves the original untouched")
    void withNotes() {
        var original = profile(new FeatureTypes(List.of("a"), List.of("b")));
        var noted = original.withNotes(List.of("note"));

        assertEquals(List.of(), original.notes());
        assertEquals(List.of("note"), noted.notes());
        assertEquals(original.classCounts(), noted.classCounts());
    }

    @Test
    @DisplayName("maps keep insertion order")
    void orderedMaps() {
        var counts = new java.util.LinkedHashMap<String, Integer>();
        counts.put("z", 1);
        counts.put("a", 2);
        var p = new DatasetProfile(new DatasetShape(3, 2), List.of("x", "y"), Map.of(), "y", "nominal", true,
                new FeatureTypes(List.of("x"), List.of()), Map.of(), counts, 2.0, null);

        assertEquals(List.of("z", "a"), List.copyOf(p.classCounts().keySet()));
        assertEquals(List.of(), p.notes());
    }

    @Nested
    @DisplayName("RunContext")
    class Context {

        private RunContext context(String target) {
            return new RunContext("r", "t", "d.csv", target, "out/r", 42, 0.2, 1);
        }

        @Test
        @DisplayName("auto is recognised case-insensitively")
        void auto() {
            assertTrue(context("auto").targetIsAuto());
            assertTrue(context(" AUTO ").targetIsAuto());
            assertTrue(context(null).targetIsAuto());
            assertFalse(context("churn").targetIsAuto());
        }

        @Test
        @DisplayName("withTarget changes only the target")
        void withTarget() {
            var resolved = context("auto").withTarget("churn");
            assertEquals("churn", resolved.target());
            assertEquals("r", resolved.runId());
            assertEquals(42, resolved.seed());
        }
    }

    @Test
    @DisplayName("reflection status labels round-trip")
    void reflectionStatus() {
        assertEquals("needs_attention", ReflectionStatus.NEEDS_ATTENTION.label());
        assertEquals(ReflectionStatus.OK, ReflectionStatus.fromLabel("ok"));
        assertEquals(ReflectionStatus.NEEDS_ATTENTION, ReflectionStatus.fromLabel("NEEDS_ATTENTION"));
        assertThrows(IllegalArgumentException.class, () -> ReflectionStatus.fromLabel("bad"));
    }
}

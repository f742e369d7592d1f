package com.autods.core.reflection;

import com.autods.core.model.DatasetProfile;
import com.autods.core.model.DatasetShape;
import com.autods.core.model.FeatureTypes;
import com.autods.core.model.ModelMetrics;
import com.autods.core.model.Reflection;
import com.autods.core.model.ReflectionStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ThresholdReflectorTest {

    private final ThresholdReflector reflector = new ThresholdReflector(0.60, 0.05, 3.0);

    private static DatasetProfile profile(double imbalance) {
        return new DatasetProfile(new DatasetShape(100, 2), List.of("a", "y"), Map.of(), "y", "nominal", true,
                new FeatureTypes(List.of("a"), List.of()), Map.of(), Map.of(), imbalance, List.of());
    }

    private static ModelMetrics metrics(String model, double balancedAccuracy, double f1) {
        return new ModelMetrics(model, 0.9, balancedAccuracy, f1, f1, balancedAccuracy);
    }

    @Test
    @DisplayName("strong model over a weak baseline is ok")
    void ok() {
        var best = metrics("RandomForest", 0.90, 0.88);
        var baseline = metrics(ModelMetrics.BASELINE_MODEL, 0.50, 0.45);

        Reflection r = reflector.reflect(profile(1.0), best, List.of(best, baseline));

        assertEquals(ReflectionStatus.OK, r.status());
        assertTrue(r.issues().isEmpty());
        assertTrue(r.suggestions().isEmpty());
        assertFalse(r.replanRecommended());
        assertEquals("RandomForest", r.bestModel());
    }

    @Test
    @DisplayName("low macro-F1 raises an issue and recommends a replan")
    void lowF1() {
        var best = metrics("Logistic", 0.70, 0.55);
        var baseline = metrics(ModelMetrics.BASELINE_MODEL, 0.50, 0.47);

        Reflection r = reflector.reflect(profile(1.0), best, List.of(best, baseline));

        assertEquals(ReflectionStatus.NEEDS_ATTENTION, r.status());
        assertEquals(List.of("Macro F1 score is modest (<0.60)."), r.issues());
        assertTrue(r.replanRecommended());
        assertTrue(reflector.shouldReplan(r));
    }

    @Test
    @DisplayName("small lift alone needs attention but does not replan")
    void smallLift() {
        var best = metrics("Logistic", 0.82, 0.80);
        var baseline = metrics(ModelMetrics.BASELINE_MODEL, 0.80, 0.78);

        Reflection r = reflector.reflect(profile(1.0), best, List.of(best, baseline));

        assertEquals(ReflectionStatus.NEEDS_ATTENTION, r.status());
        assertEquals(1, r.issues().size());
        assertTrue(r.issues().get(0).startsWith("Best model only 0.020 better than baseline"));
        assertFalse(r.replanRecommended());
    }

    @Test
    @DisplayName("imbalance adds a suggestion without an issue")
    void imbalanceSuggestion() {
        var best = metrics("RandomForest", 0.90, 0.88);
        var baseline = metrics(ModelMetrics.BASELINE_MODEL, 0.50, 0.45);

        Reflection r = reflector.reflect(profile(9.0), best, List.of(best, baseline));

        assertEquals(ReflectionStatus.OK, r.status());
        assertEquals(1, r.suggestions().size());
        assertTrue(r.suggestions().get(0).startsWith("Imbalance detected"));
    }

    @Test
    @DisplayName("missing baseline skips the lift check")
    void noBaseline() {
        var best = metrics("RandomForest", 0.51, 0.90);

        Reflection r = reflector.reflect(profile(1.0), best, List.of(best));

        assertEquals(ReflectionStatus.OK, r.status());
    }

    @Test
    @DisplayName("status needs_attention exactly when issues exist")
    void statusMatchesIssues() {
        for (double f1 : new double[] {0.2, 0.59, 0.6, 0.9}) {
            for (double lift : new double[] {0.0, 0.04, 0.05, 0.3}) {
                var best = metrics("Logistic", 0.5 + lift, f1);
                var baseline = metrics(ModelMetrics.BASELINE_MODEL, 0.5, 0.4);
                Reflection r = reflector.reflect(profile(1.0), best, List.of(best, baseline));
                assertEquals(!r.issues().isEmpty(), r.status() == ReflectionStatus.NEEDS_ATTENTION);
                assertEquals(!r.issues().isEmpty() && f1 < 0.60, r.replanRecommended());
            }
        }
    }
}

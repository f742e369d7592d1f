package com.autods.core.training;

import com.autods.core.config.AutodsProperties;
import com.autods.core.model.DatasetProfile;
import com.autods.core.model.DatasetShape;
import com.autods.core.model.FeatureTypes;
import com.autods.core.model.ModelMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import weka.classifiers.functions.SMO;
import weka.classifiers.functions.supportVector.RBFKernel;
import weka.classifiers.trees.RandomForest;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelSelectorTest {

    private final ModelSelector selector = new ModelSelector(new AutodsProperties());

    private static DatasetProfile profile(int rows, int cols, double imbalance) {
        List<String> columns = new java.util.ArrayList<>();
        for (int i = 0; i < cols - 1; i++) {
            columns.add("f" + i);
        }
        List<String> features = List.copyOf(columns);
        columns.add("y");
        return new DatasetProfile(new DatasetShape(rows, cols), columns, Map.of(), "y", "nominal", true,
                new FeatureTypes(features, List.of()), Map.of(), Map.of(), imbalance, List.of());
    }

    private static List<String> names(List<CandidateSpec> candidates) {
        return candidates.stream().map(CandidateSpec::name).toList();
    }

    @Test
    @DisplayName("small data gets every candidate, baseline first")
    void smallData() {
        var names = names(selector.select(profile(500, 5, 1.0), 42));
        assertEquals(List.of(ModelMetrics.BASELINE_MODEL, ModelSelector.LOGISTIC, ModelSelector.RANDOM_FOREST,
                ModelSelector.LOGIT_BOOST, ModelSelector.SMO_RBF), names);
    }

    @Test
    @DisplayName("SVM is dropped for many rows or many columns")
    void svmLimits() {
        assertFalse(names(selector.select(profile(20_001, 5, 1.0), 42)).contains(ModelSelector.SMO_RBF));
        assertFalse(names(selector.select(profile(500, 201, 1.0), 42)).contains(ModelSelector.SMO_RBF));
        assertTrue(names(selector.select(profile(20_000, 200, 1.0), 42)).contains(ModelSelector.SMO_RBF));
    }

    @Test
    @DisplayName("boosting is dropped above 50000 rows")
    void boostingLimit() {
        assertFalse(names(selector.select(profile(50_001, 5, 1.0), 42)).contains(ModelSelector.LOGIT_BOOST));
    }

    @Test
    @DisplayName("imbalance balances every candidate except baseline and boosting")
    void classBalancing() {
        var candidates = selector.select(profile(500, 5, 9.0), 42);
        for (CandidateSpec c : candidates) {
            boolean expected = !c.name().equals(ModelMetrics.BASELINE_MODEL)
                    && !c.name().equals(ModelSelector.LOGIT_BOOST);
            assertEquals(expected, c.classBalanced(), c.name());
        }
        assertTrue(selector.select(profile(500, 5, 1.0), 42).stream().noneMatch(CandidateSpec::classBalanced));
    }

    @Test
    @DisplayName("factories build fresh, configured classifiers")
    void factories() {
        var properties = new AutodsProperties();
        properties.getTraining().setForestTrees(17);
        var candidates = new ModelSelector(properties).select(profile(500, 5, 1.0), 7);

        var forestSpec = candidates.stream().filter(c -> c.name().equals(ModelSelector.RANDOM_FOREST)).findFirst().orElseThrow();
        var forest = (RandomForest) forestSpec.newClassifier();
        assertEquals(17, forest.getNumIterations());
        assertEquals(7, forest.getSeed());
        assertNotSame(forest, forestSpec.newClassifier());

        var smo = (SMO) candidates.stream().filter(c -> c.name().equals(ModelSelector.SMO_RBF))
                .findFirst().orElseThrow().newClassifier();
        assertInstanceOf(RBFKernel.class, smo.getKernel());
    }
}

package com.autods.core.training;

import weka.classifiers.Classifier;

import java.util.function.Supplier;

/**
 * A named model to fit in one iteration.
 *
 * @param name          candidate name, reported in metrics
 * @param factory       creates a fresh, unfitted classifier
 * @param classBalanced whether the training split is reweighted so every class carries equal total weight
 */
public record CandidateSpec(String name, Supplier<Classifier> factory, boolean classBalanced) {

    public Classifier newClassifier() {
        return factory.get();
    }
}

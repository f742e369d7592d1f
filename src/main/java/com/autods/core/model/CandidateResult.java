package com.autods.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Outcome of fitting one candidate and scoring it on the held-out split.
 *
 * @param name            candidate name
 * @param metrics         the candidate's metric set
 * @param classLabels     class labels in attribute order
 * @param confusionMatrix counts indexed [actual][predicted], in {@code classLabels} order
 */
public record CandidateResult(
    String name,
    ModelMetrics metrics,
    List<String> classLabels,
    List<List<Integer>> confusionMatrix
) implements Serializable {

    public CandidateResult {
        classLabels = List.copyOf(classLabels);
        confusionMatrix = confusionMatrix.stream().map(List::copyOf).toList();
    }
}

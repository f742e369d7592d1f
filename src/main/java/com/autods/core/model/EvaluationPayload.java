package com.autods.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Comparative metrics for one iteration, written to {@code metrics.json}.
 *
 * @param bestMetrics           metrics of the top-ranked candidate
 * @param allMetrics            metrics of every candidate, in ranking order
 * @param confusionMatrixPath   rendered confusion matrix of the top candidate
 * @param classificationReport  per-class precision/recall/F1 table as text
 */
public record EvaluationPayload(
    @JsonProperty("best_metrics") ModelMetrics bestMetrics,
    @JsonProperty("all_metrics") List<ModelMetrics> allMetrics,
    @JsonProperty("confusion_matrix_path") String confusionMatrixPath,
    @JsonProperty("classification_report") String classificationReport
) implements Serializable {

    public EvaluationPayload {
        allMetrics = List.copyOf(allMetrics);
    }
}

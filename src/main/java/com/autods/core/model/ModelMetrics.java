package com.autods.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * The fixed metric set computed for every trained candidate.
 *
 * @param model            candidate name
 * @param accuracy         fraction of correct predictions
 * @param balancedAccuracy mean per-class recall over the classes present in the held-out labels
 * @param f1Macro          unweighted mean F1 over observed classes
 * @param precisionMacro   unweighted mean precision over observed classes
 * @param recallMacro      unweighted mean recall over observed classes
 */
public record ModelMetrics(
    @JsonProperty("model") String model,
    @JsonProperty("accuracy") double accuracy,
    @JsonProperty("balanced_accuracy") double balancedAccuracy,
    @JsonProperty("f1_macro") double f1Macro,
    @JsonProperty("precision_macro") double precisionMacro,
    @JsonProperty("recall_macro") double recallMacro
) implements Serializable {

    /** Name of the no-signal candidate that always predicts the majority class. */
    public static final String BASELINE_MODEL = "MajorityBaseline";

    public static final List<String> METRIC_NAMES = List.of(
            "accuracy", "balanced_accuracy", "f1_macro", "precision_macro", "recall_macro");

    @JsonIgnore
    public boolean isBaseline() {
        return BASELINE_MODEL.equals(model);
    }
}

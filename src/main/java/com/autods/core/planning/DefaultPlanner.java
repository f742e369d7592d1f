package com.autods.core.planning;

import com.autods.core.model.DatasetProfile;
import com.autods.core.model.MemoryRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Reference planner: the base stage sequence, with an imbalance task ahead of
 * training when the class ratio reaches the threshold, and a model-priority task
 * ahead of selection when memory remembers a winner for this dataset.
 */
public class DefaultPlanner implements Planner {

    public static final String IMBALANCE_TASK = "consider_imbalance_strategy";
    public static final String PRIORITIZE_PREFIX = "prioritize_model:";

    private final double imbalanceThreshold;

    public DefaultPlanner(double imbalanceThreshold) {
        this.imbalanceThreshold = imbalanceThreshold;
    }

    @Override
    public List<String> createPlan(DatasetProfile profile, MemoryRecord memoryHint) {
        List<String> plan = new ArrayList<>(BASE_PLAN);

        if (memoryHint != null && memoryHint.bestModel() != null && !memoryHint.bestModel().isBlank()) {
            plan.add(plan.indexOf(SELECT_MODELS), PRIORITIZE_PREFIX + memoryHint.bestModel());
        }

        if (profile.imbalanceRatio() >= imbalanceThreshold) {
            plan.add(plan.indexOf(TRAIN_MODELS), IMBALANCE_TASK);
        }
        return plan;
    }
}

package com.autods.core.planning;

import com.autods.core.model.DatasetProfile;
import com.autods.core.model.MemoryRecord;

import java.util.List;

/**
 * Turns a dataset profile into an ordered task list.
 * <p>
 * Implementations must be pure and deterministic. Stage labels must keep their
 * dependency order: profile, preprocess, select, train, evaluate, reflect, report.
 */
public interface Planner {

    String PROFILE_DATASET = "profile_dataset";
    String BUILD_PREPROCESSOR = "build_preprocessor";
    String SELECT_MODELS = "select_models";
    String TRAIN_MODELS = "train_models";
    String EVALUATE = "evaluate";
    String REFLECT = "reflect";
    String WRITE_REPORT = "write_report";

    List<String> BASE_PLAN = List.of(
            PROFILE_DATASET, BUILD_PREPROCESSOR, SELECT_MODELS, TRAIN_MODELS, EVALUATE, REFLECT, WRITE_REPORT);

    /**
     * @param profile    profile of the dataset being modelled
     * @param memoryHint best outcome of a previous run on the same fingerprint, or {@code null}
     * @return a new, independent task list
     */
    List<String> createPlan(DatasetProfile profile, MemoryRecord memoryHint);
}

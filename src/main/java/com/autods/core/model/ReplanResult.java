package com.autods.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Revised plan and profile produced by a replan strategy.
 */
public record ReplanResult(List<String> plan, DatasetProfile profile) implements Serializable {

    public ReplanResult {
        plan = List.copyOf(plan);
    }
}

package com.autods.core.reflection;

import com.autods.core.model.DatasetProfile;
import com.autods.core.model.ModelMetrics;
import com.autods.core.model.Reflection;

import java.util.List;

/**
 * Judges an iteration's evaluation. Implementations must be pure and deterministic.
 * <p>
 * Contract: status is {@code needs_attention} iff at least one issue was raised.
 */
public interface Reflector {

    Reflection reflect(DatasetProfile profile, ModelMetrics bestMetrics, List<ModelMetrics> allMetrics);

    /**
     * Whether the loop should replan after this reflection, budget permitting.
     */
    default boolean shouldReplan(Reflection reflection) {
        return reflection.replanRecommended();
    }
}

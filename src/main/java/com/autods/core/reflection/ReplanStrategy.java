package com.autods.core.reflection;

import com.autods.core.model.DatasetProfile;
import com.autods.core.model.Reflection;
import com.autods.core.model.ReplanResult;

import java.util.List;

/**
 * Revises the plan and profile after a reflection asked for another attempt.
 * <p>
 * Inputs are never mutated. The returned plan extends {@code plan} (same prefix,
 * never shorter) and the returned profile's notes extend the original notes.
 */
public interface ReplanStrategy {

    ReplanResult apply(List<String> plan, DatasetProfile profile, Reflection reflection);
}

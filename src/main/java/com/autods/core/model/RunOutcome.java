package com.autods.core.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Summary of a finished run.
 *
 * @param outputDir   directory holding the latest iteration's artifacts
 * @param runId       run identifier
 * @param fingerprint dataset fingerprint used as memory key
 * @param target      resolved target column
 * @param initialPlan plan produced by the planner before the first iteration
 * @param finalPlan   plan in effect during the last iteration
 * @param iterations  number of train/evaluate/reflect cycles executed
 * @param replans     number of replan transitions taken
 * @param reflection  reflection of the last iteration
 * @param evaluation  evaluation payload of the last iteration
 */
public record RunOutcome(
    Path outputDir,
    String runId,
    String fingerprint,
    String target,
    List<String> initialPlan,
    List<String> finalPlan,
    int iterations,
    int replans,
    Reflection reflection,
    EvaluationPayload evaluation
) {}

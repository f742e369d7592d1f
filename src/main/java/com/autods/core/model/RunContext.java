package com.autods.core.model;

import java.io.Serializable;

/**
 * Identifies one execution of the pipeline.
 * <p>
 * Only the target may change after creation, and only once, when {@code auto}
 * is resolved by target inference; {@link #withTarget(String)} returns the replacement.
 *
 * @param runId      unique run identifier, also the output directory name
 * @param startedAt  UTC start timestamp, ISO-8601 with a Z suffix
 * @param dataPath   dataset location as given by the caller
 * @param target     resolved target column name (or {@code auto} before resolution)
 * @param outputDir  run output directory
 * @param seed       random seed for splitting and model fitting
 * @param testSize   held-out fraction, in (0, 1)
 * @param maxReplans maximum number of replan transitions
 */
public record RunContext(
    String runId,
    String startedAt,
    String dataPath,
    String target,
    String outputDir,
    long seed,
    double testSize,
    int maxReplans
) implements Serializable {

    public static final String AUTO_TARGET = "auto";

    public boolean targetIsAuto() {
        return target == null || AUTO_TARGET.equalsIgnoreCase(target.trim());
    }

    public RunContext withTarget(String resolvedTarget) {
        return new RunContext(runId, startedAt, dataPath, resolvedTarget, outputDir, seed, testSize, maxReplans);
    }
}

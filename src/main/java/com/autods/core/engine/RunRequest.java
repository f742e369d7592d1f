package com.autods.core.engine;

/**
 * Parameters of one run.
 *
 * @param dataPath   CSV or ARFF dataset location
 * @param target     target column name, or {@code auto} to infer it
 * @param outputRoot directory under which the run directory is created
 * @param seed       random seed for splitting and model fitting
 * @param testSize   held-out fraction, strictly between 0 and 1
 * @param maxReplans maximum number of replans, 0 or more
 */
public record RunRequest(
    String dataPath,
    String target,
    String outputRoot,
    long seed,
    double testSize,
    int maxReplans
) {

    public static final String DEFAULT_OUTPUT_ROOT = "outputs";
    public static final long DEFAULT_SEED = 42;
    public static final double DEFAULT_TEST_SIZE = 0.2;
    public static final int DEFAULT_MAX_REPLANS = 1;
}

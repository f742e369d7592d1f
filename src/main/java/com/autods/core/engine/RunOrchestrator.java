package com.autods.core.engine;

import com.autods.core.error.PipelineException;
import com.autods.core.error.PlanningException;
import com.autods.core.error.StorageException;
import com.autods.core.events.EventBus;
import com.autods.core.events.RunEvent;
import com.autods.core.graph.RunGraph;
import com.autods.core.logging.MdcContext;
import com.autods.core.metrics.AutodsMetrics;
import com.autods.core.model.RunContext;
import com.autods.core.model.RunOutcome;
import com.autods.core.model.Timestamps;
import com.autods.core.state.RunDatasets;
import com.autods.core.state.RunState;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Runs the pipeline end to end by bridging callers to the LangGraph4j graph.
 * <p>
 * Creates the run directory, seeds the graph state and invokes the compiled graph.
 * The first pipeline error raised by any stage is rethrown unchanged; artifacts
 * already written stay on disk.
 */
@Service
public class RunOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RunOrchestrator.class);

    private static final DateTimeFormatter RUN_ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final RunGraph runGraph;
    private final RunDatasets datasets;
    private final EventBus eventBus;
    private final AutodsMetrics metrics;
    private final Clock clock;

    public RunOrchestrator(RunGraph runGraph, RunDatasets datasets, EventBus eventBus, AutodsMetrics metrics) {
        this(runGraph, datasets, eventBus, metrics, Clock.systemUTC());
    }

    RunOrchestrator(RunGraph runGraph, RunDatasets datasets, EventBus eventBus, AutodsMetrics metrics,
                    Clock clock) {
        this.runGraph = runGraph;
        this.datasets = datasets;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Runs the pipeline and returns the run's output directory.
     */
    public Path run(String dataPath, String target, String outputRoot, long seed, double testSize, int maxReplans) {
        return execute(new RunRequest(dataPath, target, outputRoot, seed, testSize, maxReplans)).outputDir();
    }

    /**
     * Runs the pipeline and returns the output directory with the run details.
     *
     * @throws PipelineException the first error raised by any stage
     */
    public RunOutcome execute(RunRequest request) {
        validate(request);
        String runId = generateRunId();
        Path outputDir = createOutputDir(request.outputRoot(), runId);
        RunContext ctx = new RunContext(runId, Timestamps.nowIso(clock), request.dataPath(), request.target(),
                outputDir.toString(), request.seed(), request.testSize(), request.maxReplans());

        long start = System.currentTimeMillis();
        MdcContext.setRun(runId);
        try {
            log.info("Starting run {} on {} (target={}, seed={}, test_size={}, max_replans={})", runId,
                    request.dataPath(), request.target(), request.seed(), request.testSize(), request.maxReplans());
            eventBus.publish(RunEvent.of(RunEvent.RUN_CREATED, runId, 0,
                    Map.of("data", request.dataPath(), "outputDir", outputDir.toString())));

            var stateMap = new HashMap<String, Object>();
            stateMap.put(RunState.CONTEXT, ctx);
            var config = RunnableConfig.builder()
                    .threadId(runId)
                    .build();

            RunState state;
            try {
                state = runGraph.compile(request.maxReplans())
                        .invoke(Map.copyOf(stateMap), config)
                        .orElseThrow(() -> new IllegalStateException("Graph execution returned empty state for run " + runId));
            } catch (RuntimeException e) {
                RuntimeException cause = unwrap(e);
                metrics.recordRunResult(cause.getClass().getSimpleName());
                log.error("Run {} failed: {}", runId, cause.getMessage());
                throw cause;
            }

            RunOutcome outcome = new RunOutcome(
                    outputDir,
                    runId,
                    state.fingerprint(),
                    state.context().target(),
                    state.initialPlan(),
                    state.plan(),
                    state.iterations(),
                    state.replans(),
                    state.reflection().orElse(null),
                    state.evaluation().orElse(null));

            metrics.recordRunDuration(System.currentTimeMillis() - start);
            metrics.recordIterations(outcome.iterations());
            metrics.recordRunResult("success");
            eventBus.publish(RunEvent.of(RunEvent.RUN_COMPLETED, runId, outcome.iterations(), Map.of(
                    "outputDir", outputDir.toString(),
                    "replans", outcome.replans(),
                    "budgetExhausted", state.budgetExhausted())));
            log.info("Run {} finished after {} iteration(s), {} replan(s): {}", runId,
                    outcome.iterations(), outcome.replans(), outputDir);
            return outcome;
        } finally {
            datasets.release(runId);
            MdcContext.clear();
        }
    }

    /**
     * Generates a run id in the format yyyyMMdd_HHmmss_xxxxxxxx (UTC, 8 hex chars).
     */
    public String generateRunId() {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return RUN_ID_FORMAT.format(clock.instant()) + "_" + suffix;
    }

    private static void validate(RunRequest request) {
        if (request.dataPath() == null || request.dataPath().isBlank()) {
            throw new PlanningException("A dataset path is required.");
        }
        if (request.target() == null || request.target().isBlank()) {
            throw new PlanningException("A target column (or 'auto') is required.");
        }
        if (!(request.testSize() > 0.0 && request.testSize() < 1.0)) {
            throw new PlanningException("test_size must be strictly between 0 and 1, got " + request.testSize());
        }
        if (request.maxReplans() < 0) {
            throw new PlanningException("max_replans must be 0 or more, got " + request.maxReplans());
        }
    }

    private static Path createOutputDir(String outputRoot, String runId) {
        String root = outputRoot == null || outputRoot.isBlank() ? RunRequest.DEFAULT_OUTPUT_ROOT : outputRoot;
        Path dir = Path.of(root).resolve(runId);
        try {
            return Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageException("Cannot create output directory " + dir, e);
        }
    }

    /**
     * Finds the pipeline error inside the graph engine's wrappers; other failures pass through.
     */
    static RuntimeException unwrap(RuntimeException e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof PipelineException pipeline) {
                return pipeline;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return e;
    }
}

package com.autods.core.nodes;

import com.autods.core.events.EventBus;
import com.autods.core.events.RunEvent;
import com.autods.core.memory.MemoryStore;
import com.autods.core.model.DatasetProfile;
import com.autods.core.model.EvaluationPayload;
import com.autods.core.model.MemoryRecord;
import com.autods.core.model.Reflection;
import com.autods.core.model.RunContext;
import com.autods.core.model.Timestamps;
import com.autods.core.report.ArtifactWriter;
import com.autods.core.report.MarkdownReportWriter;
import com.autods.core.state.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Map;

/**
 * Writes the iteration's artifacts, then records the outcome in memory.
 * <p>
 * Artifacts are overwritten each iteration, so the run directory always holds
 * the latest one. The memory record is upserted on every iteration.
 */
@Component
public class PersistArtifactsNode {

    private static final Logger log = LoggerFactory.getLogger(PersistArtifactsNode.class);

    private final ArtifactWriter artifactWriter;
    private final MarkdownReportWriter reportWriter;
    private final MemoryStore memory;
    private final EventBus eventBus;

    public PersistArtifactsNode(ArtifactWriter artifactWriter, MarkdownReportWriter reportWriter,
                                MemoryStore memory, EventBus eventBus) {
        this.artifactWriter = artifactWriter;
        this.reportWriter = reportWriter;
        this.memory = memory;
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(RunState state) {
        RunContext ctx = state.context();
        Path outputDir = Path.of(ctx.outputDir());
        DatasetProfile profile = state.profile();
        EvaluationPayload evaluation = state.evaluation()
                .orElseThrow(() -> new IllegalStateException("Evaluation missing from state"));
        Reflection reflection = state.reflection()
                .orElseThrow(() -> new IllegalStateException("Reflection missing from state"));

        artifactWriter.write(outputDir, profile, state.plan(), evaluation, reflection);
        reportWriter.write(outputDir, ctx, state.fingerprint(), profile, state.plan(), evaluation, reflection);

        memory.upsert(state.fingerprint(), new MemoryRecord(
                Timestamps.nowIso(),
                ctx.target(),
                profile.shape(),
                evaluation.bestMetrics().model(),
                evaluation.bestMetrics()));

        int iteration = state.iterations() + 1;
        log.info("Iteration {} complete: best model {}", iteration, evaluation.bestMetrics().model());
        eventBus.publish(RunEvent.of(RunEvent.ITERATION_COMPLETED, ctx.runId(), iteration, Map.of(
                "bestModel", evaluation.bestMetrics().model(),
                "balancedAccuracy", evaluation.bestMetrics().balancedAccuracy(),
                "f1Macro", evaluation.bestMetrics().f1Macro(),
                "status", reflection.status().label())));
        return Map.of(RunState.ITERATIONS, iteration);
    }
}

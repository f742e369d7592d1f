package com.autods.core.report;

import com.autods.core.config.JsonSupport;
import com.autods.core.error.StorageException;
import com.autods.core.model.DatasetProfile;
import com.autods.core.model.EvaluationPayload;
import com.autods.core.model.ModelMetrics;
import com.autods.core.model.Reflection;
import com.autods.core.model.RunContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Renders the human-readable {@code report.md} for an iteration.
 */
@Component
public class MarkdownReportWriter {

    private static final int SHORT_LIST_LIMIT = 12;

    private final ObjectMapper mapper = JsonSupport.mapper();

    public Path write(Path outputDir, RunContext ctx, String fingerprint, DatasetProfile profile,
                      List<String> plan, EvaluationPayload evaluation, Reflection reflection) {
        Path file = outputDir.resolve(ArtifactWriter.REPORT);
        try {
            Files.writeString(file, render(ctx, fingerprint, profile, plan, evaluation, reflection),
                    StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageException("Cannot write " + file, e);
        }
        return file;
    }

    String render(RunContext ctx, String fingerprint, DatasetProfile profile, List<String> plan,
                  EvaluationPayload evaluation, Reflection reflection) {
        ModelMetrics best = evaluation.bestMetrics();
        StringBuilder md = new StringBuilder();
        md.append("# Agentic Data Scientist Report\n\n");
        md.append("**Run ID:** `").append(ctx.runId()).append("`  \n");
        md.append("**Started (UTC):** ").append(ctx.startedAt()).append("  \n");
        md.append("**Dataset:** `").append(ctx.dataPath()).append("`  \n");
        md.append("**Target:** `").append(ctx.target()).append("`  \n");
        md.append("**Fingerprint:** `").append(fingerprint).append("`  \n\n");

        md.append("## Dataset Profile\n");
        md.append("- Rows: **").append(profile.shape().rows()).append("**\n");
        md.append("- Columns: **").append(profile.shape().cols()).append("**\n");
        md.append("- Classification: **").append(profile.classification()).append("**\n");
        md.append("- Imbalance ratio: **").append(profile.imbalanceRatio()).append("**\n\n");

        List<String> numeric = profile.featureTypes().numeric();
        List<String> categorical = profile.featureTypes().categorical();
        md.append("**Feature Types**\n");
        md.append("- Numeric (").append(numeric.size()).append("): ").append(shortList(numeric)).append('\n');
        md.append("- Categorical (").append(categorical.size()).append("): ")
                .append(shortList(categorical)).append("\n\n");

        md.append("**Notes**\n");
        bullets(md, profile.notes());
        md.append('\n');

        md.append("## Plan\n");
        bullets(md, plan);
        md.append('\n');

        md.append("## Results (Best Model)\n");
        md.append("**Model:** `").append(best.model()).append("`\n\n");
        md.append("- Accuracy: **").append(fixed(best.accuracy())).append("**\n");
        md.append("- Balanced accuracy: **").append(fixed(best.balancedAccuracy())).append("**\n");
        md.append("- Macro F1: **").append(fixed(best.f1Macro())).append("**\n");
        md.append("- Macro Precision: **").append(fixed(best.precisionMacro())).append("**\n");
        md.append("- Macro Recall: **").append(fixed(best.recallMacro())).append("**\n\n");

        md.append("Top metrics (all candidates):\n```json\n")
                .append(json(evaluation.allMetrics()))
                .append("\n```\n\n");

        md.append("## Reflection\n");
        bullets(md, reflection == null ? List.of() : reflection.suggestions());
        md.append('\n');

        md.append("# Artefacts\n");
        md.append("- Confusion matrix: ").append(evaluation.confusionMatrixPath()).append('\n');
        md.append("- Metrics: ").append(ArtifactWriter.METRICS).append('\n');
        md.append("- Reflection: ").append(ArtifactWriter.REFLECTION).append('\n');
        return md.toString();
    }

    private String json(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StorageException("Cannot serialise metrics for report", e);
        }
    }

    private static void bullets(StringBuilder md, List<String> items) {
        if (items.isEmpty()) {
            md.append("- (none)\n");
            return;
        }
        items.forEach(item -> md.append("- ").append(item).append('\n'));
    }

    private static String shortList(List<String> items) {
        if (items.size() <= SHORT_LIST_LIMIT) {
            return String.join(", ", items);
        }
        return String.join(", ", items.subList(0, SHORT_LIST_LIMIT)) + " ...";
    }

    private static String fixed(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }
}

package com.autods.core.report;

import com.autods.core.config.JsonSupport;
import com.autods.core.model.ModelMetrics;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Checks that a run directory holds a complete, readable artifact set.
 */
@Component
public class RunDirectoryVerifier {

    private final ObjectMapper mapper = JsonSupport.mapper();

    /**
     * @return problems found, empty when the directory is complete
     */
    public List<String> verify(Path runDir) {
        List<String> problems = new ArrayList<>();
        if (!Files.isDirectory(runDir)) {
            problems.add("Not a directory: " + runDir);
            return problems;
        }
        for (String file : ArtifactWriter.REQUIRED_FILES) {
            Path path = runDir.resolve(file);
            try {
                if (!Files.isRegularFile(path) || Files.size(path) == 0) {
                    problems.add("Missing or empty: " + file);
                }
            } catch (IOException e) {
                problems.add("Unreadable: " + file + " (" + e.getMessage() + ")");
            }
        }
        if (!problems.isEmpty()) {
            return problems;
        }

        readJson(runDir.resolve(ArtifactWriter.PLAN), problems).ifPresent(plan -> {
            if (!plan.path("plan").isArray() || plan.path("plan").isEmpty()) {
                problems.add(ArtifactWriter.PLAN + " has no plan steps");
            }
        });
        readJson(runDir.resolve(ArtifactWriter.METRICS), problems).ifPresent(metrics -> {
            JsonNode best = metrics.path("best_metrics");
            for (String name : ModelMetrics.METRIC_NAMES) {
                if (!best.path(name).isNumber()) {
                    problems.add(ArtifactWriter.METRICS + " lacks best_metrics." + name);
                }
            }
        });
        readJson(runDir.resolve(ArtifactWriter.REFLECTION), problems).ifPresent(reflection -> {
            if (!reflection.path("status").isTextual()) {
                problems.add(ArtifactWriter.REFLECTION + " has no status");
            }
        });
        return problems;
    }

    private Optional<JsonNode> readJson(Path file, List<String> problems) {
        try {
            return Optional.of(mapper.readTree(file.toFile()));
        } catch (IOException e) {
            problems.add("Invalid JSON in " + file.getFileName() + ": " + e.getMessage());
            return Optional.empty();
        }
    }
}

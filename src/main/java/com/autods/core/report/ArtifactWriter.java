package com.autods.core.report;

import com.autods.core.config.JsonSupport;
import com.autods.core.error.StorageException;
import com.autods.core.evaluation.Evaluator;
import com.autods.core.model.DatasetProfile;
import com.autods.core.model.EvaluationPayload;
import com.autods.core.model.Reflection;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Writes the JSON artifacts of an iteration, overwriting the previous iteration's files.
 */
@Component
public class ArtifactWriter {

    public static final String EDA_SUMMARY = "eda_summary.json";
    public static final String PLAN = "plan.json";
    public static final String METRICS = "metrics.json";
    public static final String REFLECTION = "reflection.json";
    public static final String REPORT = "report.md";

    /** Files every completed iteration leaves in its run directory. */
    public static final List<String> REQUIRED_FILES = List.of(
            EDA_SUMMARY, PLAN, METRICS, REFLECTION, REPORT, Evaluator.CONFUSION_MATRIX_FILE);

    private final ObjectMapper mapper = JsonSupport.mapper();

    public void write(Path outputDir, DatasetProfile profile, List<String> plan,
                      EvaluationPayload evaluation, Reflection reflection) {
        writeJson(outputDir.resolve(EDA_SUMMARY), profile);
        writeJson(outputDir.resolve(PLAN), Map.of("plan", plan));
        writeJson(outputDir.resolve(METRICS), evaluation);
        writeJson(outputDir.resolve(REFLECTION), reflection);
    }

    private void writeJson(Path file, Object value) {
        try {
            mapper.writeValue(file.toFile(), value);
        } catch (IOException e) {
            throw new StorageException("Cannot write " + file, e);
        }
    }
}

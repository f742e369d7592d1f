package com.autods.core.evaluation;

import com.autods.core.model.CandidateResult;
import com.autods.core.model.EvaluationPayload;
import com.autods.core.model.RankedResults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Builds the comparative evaluation of an iteration and renders the top
 * candidate's confusion matrix into the run directory.
 */
@Component
public class Evaluator {

    private static final Logger log = LoggerFactory.getLogger(Evaluator.class);

    public static final String CONFUSION_MATRIX_FILE = "confusion_matrix.png";

    private final ConfusionMatrixRenderer renderer;

    public Evaluator(ConfusionMatrixRenderer renderer) {
        this.renderer = renderer;
    }

    public EvaluationPayload evaluate(RankedResults ranked, Path outputDir) {
        CandidateResult best = ranked.best();
        Path chart = outputDir.resolve(CONFUSION_MATRIX_FILE);
        renderer.render("Confusion Matrix - " + best.name(), best.classLabels(), best.confusionMatrix(), chart);
        log.debug("Wrote {}", chart);

        String report = ClassificationReport.format(best.classLabels(), best.confusionMatrix());
        return new EvaluationPayload(best.metrics(), ranked.allMetrics(), chart.toString(), report);
    }
}

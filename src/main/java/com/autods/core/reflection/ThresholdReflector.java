package com.autods.core.reflection;

import com.autods.core.model.DatasetProfile;
import com.autods.core.model.ModelMetrics;
import com.autods.core.model.Reflection;
import com.autods.core.model.ReflectionStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reference reflector built on two checks: lift of the best candidate over the
 * majority baseline, and an absolute macro-F1 floor.
 * <p>
 * A replan is recommended only when an issue exists and macro-F1 is under the floor.
 */
public class ThresholdReflector implements Reflector {

    private final double f1Threshold;
    private final double minLift;
    private final double imbalanceThreshold;

    public ThresholdReflector(double f1Threshold, double minLift, double imbalanceThreshold) {
        this.f1Threshold = f1Threshold;
        this.minLift = minLift;
        this.imbalanceThreshold = imbalanceThreshold;
    }

    @Override
    public Reflection reflect(DatasetProfile profile, ModelMetrics bestMetrics, List<ModelMetrics> allMetrics) {
        List<String> issues = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();

        allMetrics.stream()
                .filter(ModelMetrics::isBaseline)
                .findFirst()
                .ifPresent(baseline -> {
                    double lift = bestMetrics.balancedAccuracy() - baseline.balancedAccuracy();
                    if (lift < minLift) {
                        issues.add(String.format(Locale.ROOT,
                                "Best model only %.3f better than baseline. Weak signal or pipeline issues.", lift));
                        suggestions.add("Check for target leakage, verify target quality, "
                                + "or improve feature engineering.");
                    }
                });

        if (bestMetrics.f1Macro() < f1Threshold) {
            issues.add(String.format(Locale.ROOT, "Macro F1 score is modest (<%.2f).", f1Threshold));
            suggestions.add("Try different models, tune hyperparameters, or improve preprocessing.");
        }

        if (profile.imbalanceRatio() >= imbalanceThreshold) {
            suggestions.add("Imbalance detected: consider class weighting, threshold tuning, or SMOTE.");
        }

        ReflectionStatus status = issues.isEmpty() ? ReflectionStatus.OK : ReflectionStatus.NEEDS_ATTENTION;
        boolean replan = !issues.isEmpty() && bestMetrics.f1Macro() < f1Threshold;
        return new Reflection(status, bestMetrics.model(), issues, suggestions, replan);
    }
}

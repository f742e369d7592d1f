package com.autods.core.evaluation;

import com.autods.core.training.ClassificationMetrics;

import java.util.List;
import java.util.Locale;

/**
 * Plain-text per-class precision, recall, F1 and support table with accuracy,
 * macro and weighted averages. Only classes seen in the actual or predicted
 * labels are listed.
 */
public final class ClassificationReport {

    private ClassificationReport() {}

    public static String format(List<String> labels, List<List<Integer>> confusionRows) {
        int[][] confusion = toArray(confusionRows);
        long[] actualTotals = ClassificationMetrics.actualTotals(confusion);
        long[] predictedTotals = ClassificationMetrics.predictedTotals(confusion);
        List<Integer> classes = ClassificationMetrics.observedClasses(confusion);

        int width = "weighted avg".length();
        for (int c : classes) {
            width = Math.max(width, labels.get(c).length());
        }
        String rowFormat = "%" + width + "s %9s %9s %9s %9s%n";
        String lineFormat = "%" + width + "s %9.2f %9.2f %9.2f %9d%n";

        StringBuilder out = new StringBuilder();
        out.append(String.format(Locale.ROOT, rowFormat, "", "precision", "recall", "f1-score", "support"));
        out.append(System.lineSeparator());

        long total = 0;
        long correct = 0;
        double[] macro = new double[3];
        double[] weighted = new double[3];
        for (int c : classes) {
            double precision = ClassificationMetrics.precision(confusion, predictedTotals, c);
            double recall = ClassificationMetrics.recall(confusion, actualTotals, c);
            double f1 = ClassificationMetrics.f1(confusion, actualTotals, predictedTotals, c);
            long support = actualTotals[c];
            out.append(String.format(Locale.ROOT, lineFormat, labels.get(c), precision, recall, f1, support));

            macro[0] += precision;
            macro[1] += recall;
            macro[2] += f1;
            weighted[0] += precision * support;
            weighted[1] += recall * support;
            weighted[2] += f1 * support;
            total += support;
            correct += confusion[c][c];
        }
        out.append(System.lineSeparator());

        int n = Math.max(classes.size(), 1);
        double accuracy = total == 0 ? 0.0 : (double) correct / total;
        out.append(String.format(Locale.ROOT, "%" + width + "s %9s %9s %9.2f %9d%n", "accuracy", "", "", accuracy, total));
        out.append(String.format(Locale.ROOT, lineFormat, "macro avg",
                macro[0] / n, macro[1] / n, macro[2] / n, total));
        double denominator = Math.max(total, 1);
        out.append(String.format(Locale.ROOT, lineFormat, "weighted avg",
                weighted[0] / denominator, weighted[1] / denominator, weighted[2] / denominator, total));
        return out.toString();
    }

    static int[][] toArray(List<List<Integer>> rows) {
        int[][] confusion = new int[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {
            confusion[i] = rows.get(i).stream().mapToInt(Integer::intValue).toArray();
        }
        return confusion;
    }
}

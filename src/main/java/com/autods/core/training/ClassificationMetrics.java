package com.autods.core.training;

import com.autods.core.model.ModelMetrics;

import java.util.ArrayList;
import java.util.List;

/**
 * Metric arithmetic over a confusion matrix indexed [actual][predicted].
 * <p>
 * Macro averages run over every class that occurs in the held-out labels or in
 * the predictions; an undefined ratio counts as 0. Balanced accuracy averages
 * recall over the classes present in the held-out labels only.
 */
public final class ClassificationMetrics {

    private ClassificationMetrics() {}

    public static ModelMetrics compute(String model, int[][] confusion) {
        int n = confusion.length;
        long total = 0;
        long correct = 0;
        long[] actualTotals = new long[n];
        long[] predictedTotals = new long[n];
        for (int a = 0; a < n; a++) {
            for (int p = 0; p < n; p++) {
                int count = confusion[a][p];
                total += count;
                actualTotals[a] += count;
                predictedTotals[p] += count;
                if (a == p) {
                    correct += count;
                }
            }
        }

        double precisionSum = 0;
        double recallSum = 0;
        double f1Sum = 0;
        int observed = 0;
        double presentRecallSum = 0;
        int present = 0;
        for (int c = 0; c < n; c++) {
            if (actualTotals[c] == 0 && predictedTotals[c] == 0) {
                continue;
            }
            observed++;
            double recall = recall(confusion, actualTotals, c);
            precisionSum += precision(confusion, predictedTotals, c);
            recallSum += recall;
            f1Sum += f1(confusion, actualTotals, predictedTotals, c);
            if (actualTotals[c] > 0) {
                presentRecallSum += recall;
                present++;
            }
        }

        return new ModelMetrics(
                model,
                ratio(correct, total),
                present == 0 ? 0.0 : presentRecallSum / present,
                observed == 0 ? 0.0 : f1Sum / observed,
                observed == 0 ? 0.0 : precisionSum / observed,
                observed == 0 ? 0.0 : recallSum / observed);
    }

    /**
     * Indices of classes that occur in the actual or predicted labels, in class order.
     */
    public static List<Integer> observedClasses(int[][] confusion) {
        List<Integer> observed = new ArrayList<>();
        for (int c = 0; c < confusion.length; c++) {
            long support = 0;
            long predicted = 0;
            for (int k = 0; k < confusion.length; k++) {
                support += confusion[c][k];
                predicted += confusion[k][c];
            }
            if (support > 0 || predicted > 0) {
                observed.add(c);
            }
        }
        return observed;
    }

    public static double precision(int[][] confusion, long[] predictedTotals, int c) {
        return ratio(confusion[c][c], predictedTotals[c]);
    }

    public static double recall(int[][] confusion, long[] actualTotals, int c) {
        return ratio(confusion[c][c], actualTotals[c]);
    }

    public static double f1(int[][] confusion, long[] actualTotals, long[] predictedTotals, int c) {
        long tp = confusion[c][c];
        long fp = predictedTotals[c] - tp;
        long fn = actualTotals[c] - tp;
        return ratio(2 * tp, 2 * tp + fp + fn);
    }

    public static long[] actualTotals(int[][] confusion) {
        long[] totals = new long[confusion.length];
        for (int a = 0; a < confusion.length; a++) {
            for (int p = 0; p < confusion.length; p++) {
                totals[a] += confusion[a][p];
            }
        }
        return totals;
    }

    public static long[] predictedTotals(int[][] confusion) {
        long[] totals = new long[confusion.length];
        for (int a = 0; a < confusion.length; a++) {
            for (int p = 0; p < confusion.length; p++) {
                totals[p] += confusion[a][p];
            }
        }
        return totals;
    }

    private static double ratio(long numerator, long denominator) {
        return denominator == 0 ? 0.0 : (double) numerator / denominator;
    }
}

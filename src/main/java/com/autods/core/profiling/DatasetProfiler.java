package com.autods.core.profiling;

import com.autods.core.error.DataException;
import com.autods.core.model.DatasetProfile;
import com.autods.core.model.DatasetShape;
import com.autods.core.model.FeatureTypes;
import org.springframework.stereotype.Component;
import weka.core.Attribute;
import weka.core.AttributeStats;
import weka.core.Instances;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes the structural profile of a dataset and its fingerprint.
 */
@Component
public class DatasetProfiler {

    static final int SMALL_DATASET_ROWS = 1000;
    static final int HIGH_DIMENSION_COLS = 100;
    static final int MAX_CLASSIFICATION_DISTINCT = 50;
    static final double IMBALANCE_NOTE_THRESHOLD = 3.0;

    /**
     * Profiles {@code data} for the given target column.
     *
     * @throws DataException if the target column does not exist
     */
    public DatasetProfile profile(Instances data, String target) {
        Attribute targetAttr = data.attribute(target);
        if (targetAttr == null) {
            throw new DataException("Target column '" + target + "' not found in dataset columns.");
        }

        int rows = data.numInstances();
        int cols = data.numAttributes();
        List<String> columns = columnNames(data);

        Map<String, Double> missingPct = new LinkedHashMap<>();
        Map<String, Integer> uniqueCounts = new LinkedHashMap<>();
        List<String> numeric = new ArrayList<>();
        List<String> categorical = new ArrayList<>();
        for (int i = 0; i < cols; i++) {
            Attribute attribute = data.attribute(i);
            AttributeStats stats = data.attributeStats(i);
            double pct = rows == 0 ? 0.0 : stats.missingCount * 100.0 / rows;
            missingPct.put(attribute.name(), round(pct, 2));
            uniqueCounts.put(attribute.name(), stats.distinctCount);
            if (i == targetAttr.index()) {
                continue;
            }
            if (attribute.type() == Attribute.NUMERIC) {
                numeric.add(attribute.name());
            } else {
                categorical.add(attribute.name());
            }
        }

        boolean classification = isClassificationTarget(data, targetAttr);

        List<String> notes = new ArrayList<>();
        if (rows < SMALL_DATASET_ROWS) {
            notes.add("Small dataset (<1000 rows): prefer simpler models / guard against overfitting.");
        }
        if (cols > HIGH_DIMENSION_COLS) {
            notes.add("High dimensionality (>100 columns): watch one-hot expansion and overfitting.");
        }

        Map<String, Integer> classCounts = Map.of();
        double imbalanceRatio = 1.0;
        if (classification) {
            classCounts = classCounts(data, targetAttr);
            if (classCounts.size() >= 2) {
                int max = classCounts.values().stream().mapToInt(Integer::intValue).max().orElse(1);
                int min = classCounts.values().stream().mapToInt(Integer::intValue).min().orElse(1);
                imbalanceRatio = round((double) max / Math.max(min, 1), 3);
            }
            if (imbalanceRatio >= IMBALANCE_NOTE_THRESHOLD) {
                notes.add("Imbalance detected (ratio >= 3.0): prioritise macro metrics / balanced accuracy.");
            }
        } else {
            notes.add("Non-classification target detected: this template focuses on classification.");
        }

        return new DatasetProfile(
                new DatasetShape(rows, cols),
                columns,
                missingPct,
                target,
                Attribute.typeToString(targetAttr),
                classification,
                new FeatureTypes(numeric, categorical),
                uniqueCounts,
                classCounts,
                imbalanceRatio,
                notes);
    }

    /**
     * Deterministic key for the memory store, derived from shape, target and the
     * ordered column names. Structurally different datasets are expected, but not
     * guaranteed, to get different fingerprints.
     */
    public String fingerprint(Instances data, String target) {
        String base = data.numInstances() + "x" + data.numAttributes()
                + "|" + target
                + "|" + String.join(",", columnNames(data));
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(base.getBytes(StandardCharsets.UTF_8));
            return "fp_" + HexFormat.of().formatHex(digest).substring(0, 12);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static boolean isClassificationTarget(Instances data, Attribute target) {
        if (target.isNominal() || target.isString()) {
            return true;
        }
        return data.attributeStats(target.index()).distinctCount <= MAX_CLASSIFICATION_DISTINCT;
    }

    /**
     * Observed class counts, most frequent first. Missing target values are not counted.
     */
    static Map<String, Integer> classCounts(Instances data, Attribute target) {
        Map<String, Integer> counts = new TreeMap<>();
        for (int i = 0; i < data.numInstances(); i++) {
            var instance = data.instance(i);
            if (instance.isMissing(target)) {
                continue;
            }
            double value = instance.value(target);
            String label = target.isNumeric() ? formatNumber(value) : target.value((int) value);
            counts.merge(label, 1, Integer::sum);
        }
        Map<String, Integer> ordered = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                .forEachOrdered(e -> ordered.put(e.getKey(), e.getValue()));
        return ordered;
    }

    static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    private static List<String> columnNames(Instances data) {
        List<String> names = new ArrayList<>(data.numAttributes());
        for (int i = 0; i < data.numAttributes(); i++) {
            names.add(data.attribute(i).name());
        }
        return names;
    }

    private static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }
}

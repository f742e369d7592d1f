package com.autods.core.training;

import com.autods.core.error.DataException;
import com.autods.core.error.ModelException;
import com.autods.core.model.CandidateResult;
import com.autods.core.model.ModelMetrics;
import com.autods.core.model.RankedResults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import weka.classifiers.Evaluation;
import weka.classifiers.meta.FilteredClassifier;
import weka.core.Attribute;
import weka.core.Instances;
import weka.filters.Filter;
import weka.filters.supervised.instance.ClassBalancer;
import weka.filters.unsupervised.attribute.NumericToNominal;
import weka.filters.unsupervised.attribute.StringToNominal;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Splits the data, fits every candidate behind the shared preprocessing filter
 * and ranks the candidates on the held-out split.
 */
@Component
public class TrainingStage {

    private static final Logger log = LoggerFactory.getLogger(TrainingStage.class);

    /** Best first: balanced accuracy, then macro-F1, then declaration order. */
    static final Comparator<CandidateResult> RANKING = Comparator
            .comparingDouble((CandidateResult r) -> r.metrics().balancedAccuracy())
            .thenComparingDouble(r -> r.metrics().f1Macro())
            .reversed();

    /**
     * @throws DataException  if the target is absent or no row has a target value
     * @throws ModelException if a candidate fails to fit or predict
     */
    public RankedResults train(Instances data, String target, List<CandidateSpec> candidates,
                               long seed, double testSize) {
        Instances prepared = prepare(data, target);
        Split split = split(prepared, testSize, seed);
        log.info("Split {} rows into {} train / {} test ({})", prepared.numInstances(),
                split.train().numInstances(), split.test().numInstances(),
                split.stratified() ? "stratified" : "shuffled");

        List<CandidateResult> results = new ArrayList<>();
        for (CandidateSpec candidate : candidates) {
            results.add(fitAndScore(candidate, split));
        }
        results.sort(RANKING);
        log.info("Best candidate: {} (balanced_accuracy={}, f1_macro={})", results.get(0).name(),
                String.format("%.3f", results.get(0).metrics().balancedAccuracy()),
                String.format("%.3f", results.get(0).metrics().f1Macro()));
        return new RankedResults(results);
    }

    /**
     * Copies the data, sets the class, drops rows with no target value and makes the class nominal.
     */
    Instances prepare(Instances data, String target) {
        Attribute targetAttr = data.attribute(target);
        if (targetAttr == null) {
            throw new DataException("Target column '" + target + "' not found in dataset columns.");
        }
        Instances copy = new Instances(data);
        copy.setClassIndex(targetAttr.index());
        copy.deleteWithMissingClass();
        if (copy.numInstances() == 0) {
            throw new DataException("No rows with a value for target '" + target + "'.");
        }

        try {
            if (copy.classAttribute().isNumeric()) {
                NumericToNominal convert = new NumericToNominal();
                convert.setAttributeIndices(String.valueOf(copy.classIndex() + 1));
                convert.setInputFormat(copy);
                copy = Filter.useFilter(copy, convert);
            } else if (copy.classAttribute().isString()) {
                StringToNominal convert = new StringToNominal();
                convert.setAttributeRange(String.valueOf(copy.classIndex() + 1));
                convert.setInputFormat(copy);
                copy = Filter.useFilter(copy, convert);
            }
        } catch (Exception e) {
            throw new DataException("Cannot convert target '" + target + "' to classes: " + e.getMessage(), e);
        }
        copy.setClassIndex(copy.attribute(target).index());
        return copy;
    }

    /**
     * Stratified split when there are at least two classes and every observed class
     * has two or more rows; a shuffled split otherwise. Never fails.
     */
    static Split split(Instances data, double testSize, long seed) {
        Random random = new Random(seed);
        int classes = data.numClasses();
        List<List<Integer>> byClass = new ArrayList<>();
        for (int c = 0; c < classes; c++) {
            byClass.add(new ArrayList<>());
        }
        for (int i = 0; i < data.numInstances(); i++) {
            byClass.get((int) data.instance(i).classValue()).add(i);
        }

        List<List<Integer>> observed = byClass.stream().filter(rows -> !rows.isEmpty()).toList();
        boolean stratify = observed.size() > 1 && observed.stream().allMatch(rows -> rows.size() >= 2);

        List<Integer> trainRows = new ArrayList<>();
        List<Integer> testRows = new ArrayList<>();
        if (stratify) {
            for (List<Integer> rows : observed) {
                List<Integer> shuffled = new ArrayList<>(rows);
                Collections.shuffle(shuffled, random);
                int nTest = clamp((int) Math.round(shuffled.size() * testSize), 1, shuffled.size() - 1);
                testRows.addAll(shuffled.subList(0, nTest));
                trainRows.addAll(shuffled.subList(nTest, shuffled.size()));
            }
        } else {
            List<Integer> all = new ArrayList<>();
            for (int i = 0; i < data.numInstances(); i++) {
                all.add(i);
            }
            Collections.shuffle(all, random);
            if (all.size() < 2) {
                trainRows.addAll(all);
                testRows.addAll(all);
            } else {
                int nTest = clamp((int) Math.ceil(all.size() * testSize), 1, all.size() - 1);
                testRows.addAll(all.subList(0, nTest));
                trainRows.addAll(all.subList(nTest, all.size()));
            }
        }
        Collections.sort(trainRows);
        Collections.sort(testRows);
        return new Split(subset(data, trainRows), subset(data, testRows), stratify);
    }

    private CandidateResult fitAndScore(CandidateSpec candidate, Split split) {
        long start = System.currentTimeMillis();
        Instances train = split.train();
        int[][] confusion;
        try {
            if (candidate.classBalanced()) {
                ClassBalancer balancer = new ClassBalancer();
                balancer.setInputFormat(train);
                train = Filter.useFilter(train, balancer);
            }
            FilteredClassifier model = new FilteredClassifier();
            model.setFilter(Preprocessing.newFilter());
            model.setClassifier(candidate.newClassifier());
            model.buildClassifier(train);

            Evaluation eval = new Evaluation(train);
            eval.evaluateModel(model, split.test());
            confusion = toCounts(eval.confusionMatrix());
        } catch (Exception e) {
            throw new ModelException("Candidate " + candidate.name() + " failed: " + e.getMessage(), e);
        }

        ModelMetrics metrics = ClassificationMetrics.compute(candidate.name(), confusion);
        log.info("Trained {} in {}ms{} -> balanced_accuracy={}", candidate.name(),
                System.currentTimeMillis() - start, candidate.classBalanced() ? " (class-balanced)" : "",
                String.format("%.3f", metrics.balancedAccuracy()));
        return new CandidateResult(candidate.name(), metrics, classLabels(train.classAttribute()),
                toLists(confusion));
    }

    /** Held-out rows carry unit weight, so the weighted matrix holds whole counts. */
    private static int[][] toCounts(double[][] weighted) {
        int[][] counts = new int[weighted.length][];
        for (int i = 0; i < weighted.length; i++) {
            counts[i] = Arrays.stream(weighted[i]).mapToInt(v -> (int) Math.round(v)).toArray();
        }
        return counts;
    }

    private static List<String> classLabels(Attribute classAttribute) {
        List<String> labels = new ArrayList<>(classAttribute.numValues());
        for (int i = 0; i < classAttribute.numValues(); i++) {
            labels.add(classAttribute.value(i));
        }
        return labels;
    }

    private static List<List<Integer>> toLists(int[][] confusion) {
        List<List<Integer>> rows = new ArrayList<>(confusion.length);
        for (int[] row : confusion) {
            rows.add(Arrays.stream(row).boxed().toList());
        }
        return rows;
    }

    private static Instances subset(Instances data, List<Integer> rows) {
        Instances subset = new Instances(data, rows.size());
        for (int row : rows) {
            subset.add(data.instance(row));
        }
        return subset;
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    record Split(Instances train, Instances test, boolean stratified) {}
}

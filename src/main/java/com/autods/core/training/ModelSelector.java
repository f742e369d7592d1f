package com.autods.core.training;

import com.autods.core.config.AutodsProperties;
import com.autods.core.model.DatasetProfile;
import com.autods.core.model.ModelMetrics;
import org.springframework.stereotype.Component;
import weka.classifiers.functions.Logistic;
import weka.classifiers.functions.SMO;
import weka.classifiers.functions.supportVector.RBFKernel;
import weka.classifiers.meta.LogitBoost;
import weka.classifiers.rules.ZeroR;
import weka.classifiers.trees.RandomForest;

import java.util.ArrayList;
import java.util.List;

/**
 * Picks the candidate set for a dataset profile. Declaration order is the
 * tie-break order used when ranking.
 */
@Component
public class ModelSelector {

    public static final String LOGISTIC = "Logistic";
    public static final String RANDOM_FOREST = "RandomForest";
    public static final String LOGIT_BOOST = "LogitBoost";
    public static final String SMO_RBF = "SMO_RBF";

    static final int BOOSTING_MAX_ROWS = 50_000;
    static final int SVM_MAX_ROWS = 20_000;
    static final int SVM_MAX_COLS = 200;

    private final AutodsProperties properties;

    public ModelSelector(AutodsProperties properties) {
        this.properties = properties;
    }

    public List<CandidateSpec> select(DatasetProfile profile, long seed) {
        boolean balance = profile.imbalanceRatio() >= properties.getPlanning().getImbalanceThreshold();
        int rows = profile.shape().rows();
        int cols = profile.shape().cols();
        int trees = properties.getTraining().getForestTrees();

        List<CandidateSpec> candidates = new ArrayList<>();
        candidates.add(new CandidateSpec(ModelMetrics.BASELINE_MODEL, ZeroR::new, false));
        candidates.add(new CandidateSpec(LOGISTIC, ModelSelector::logistic, balance));
        candidates.add(new CandidateSpec(RANDOM_FOREST, () -> randomForest(trees, seed), balance));
        if (rows <= BOOSTING_MAX_ROWS) {
            candidates.add(new CandidateSpec(LOGIT_BOOST, () -> logitBoost(seed), false));
        }
        if (rows <= SVM_MAX_ROWS && cols <= SVM_MAX_COLS) {
            candidates.add(new CandidateSpec(SMO_RBF, () -> smoRbf(seed), balance));
        }
        return candidates;
    }

    private static Logistic logistic() {
        Logistic logistic = new Logistic();
        logistic.setMaxIts(2000);
        return logistic;
    }

    private static RandomForest randomForest(int trees, long seed) {
        RandomForest forest = new RandomForest();
        forest.setNumIterations(trees);
        forest.setSeed((int) seed);
        return forest;
    }

    private static LogitBoost logitBoost(long seed) {
        LogitBoost boost = new LogitBoost();
        boost.setSeed((int) seed);
        return boost;
    }

    private static SMO smoRbf(long seed) {
        SMO smo = new SMO();
        smo.setKernel(new RBFKernel());
        smo.setRandomSeed((int) seed);
        return smo;
    }
}

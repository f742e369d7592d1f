package com.autods.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "autods")
public class AutodsProperties {

    private String memoryPath = "agent_memory.json";
    private final Reflection reflection = new Reflection();
    private final Planning planning = new Planning();
    private final Training training = new Training();

    public String getMemoryPath() {
        return memoryPath;
    }

    public void setMemoryPath(String memoryPath) {
        this.memoryPath = memoryPath;
    }

    public Reflection getReflection() {
        return reflection;
    }

    public Planning getPlanning() {
        return planning;
    }

    public Training getTraining() {
        return training;
    }

    public static class Reflection {

        /** Macro-F1 below this is an issue and, with any issue present, triggers a replan. */
        private double f1Threshold = 0.60;

        /** Minimum balanced-accuracy gain over the majority baseline. */
        private double minLift = 0.05;

        public double getF1Threshold() {
            return f1Threshold;
        }

        public void setF1Threshold(double f1Threshold) {
            this.f1Threshold = f1Threshold;
        }

        public double getMinLift() {
            return minLift;
        }

        public void setMinLift(double minLift) {
            this.minLift = minLift;
        }
    }

    public static class Planning {

        private double imbalanceThreshold = 3.0;

        public double getImbalanceThreshold() {
            return imbalanceThreshold;
        }

        public void setImbalanceThreshold(double imbalanceThreshold) {
            this.imbalanceThreshold = imbalanceThreshold;
        }
    }

    public static class Training {

        private int forestTrees = 100;

        public int getForestTrees() {
            return forestTrees;
        }

        public void setForestTrees(int forestTrees) {
            this.forestTrees = forestTrees;
        }
    }
}

package com.costsentinel.core.config;

import java.util.List;

/**
 * Parameters of the isolation-forest detector.
 *
 * @since 1.0.0
 */
public class IsolationSettings {

    private int minObservations = 14;
    private int numTrees = 100;
    private int maxSubsampleSize = 256;
    private int maxDepth = 10;

    /** Points scoring strictly above this are anomalies. */
    private double scoreThreshold = 0.6;

    /** Points scoring strictly above this are HIGH severity. */
    private double highScoreThreshold = 0.8;

    /** Number of prior days averaged into the expected cost. */
    private int expectedCostWindow = 7;

    private double confidence = 0.85;
    private double highConfidence = 0.95;

    /** A service is "affected" when it exceeds this share of the day's cost. */
    private double serviceShareThreshold = 0.1;

    void validate(List<String> errors) {
        if (minObservations < 2) {
            errors.add("isolation.minObservations must be >= 2");
        }
        if (numTrees <= 0) {
            errors.add("isolation.numTrees must be > 0");
        }
        if (maxSubsampleSize < 2) {
            errors.add("isolation.maxSubsampleSize must be >= 2");
        }
        if (maxDepth <= 0) {
            errors.add("isolation.maxDepth must be > 0");
        }
        if (scoreThreshold <= 0 || scoreThreshold >= 1) {
            errors.add("isolation.scoreThreshold must be in (0, 1)");
        }
        if (highScoreThreshold < scoreThreshold || highScoreThreshold >= 1) {
            errors.add("isolation.highScoreThreshold must be in [scoreThreshold, 1)");
        }
        if (expectedCostWindow <= 0) {
            errors.add("isolation.expectedCostWindow must be > 0");
        }
        Validation.requireUnit(errors, "isolation.confidence", confidence);
        Validation.requireUnit(errors, "isolation.highConfidence", highConfidence);
        Validation.requireUnit(errors, "isolation.serviceShareThreshold", serviceShareThreshold);
    }

    public int getMinObservations() {
        return minObservations;
    }

    public void setMinObservations(int minObservations) {
        this.minObservations = minObservations;
    }

    public int getNumTrees() {
        return numTrees;
    }

    public void setNumTrees(int numTrees) {
        this.numTrees = numTrees;
    }

    public int getMaxSubsampleSize() {
        return maxSubsampleSize;
    }

    public void setMaxSubsampleSize(int maxSubsampleSize) {
        this.maxSubsampleSize = maxSubsampleSize;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public double getScoreThreshold() {
        return scoreThreshold;
    }

    public void setScoreThreshold(double scoreThreshold) {
        this.scoreThreshold = scoreThreshold;
    }

    public double getHighScoreThreshold() {
        return highScoreThreshold;
    }

    public void setHighScoreThreshold(double highScoreThreshold) {
        this.highScoreThreshold = highScoreThreshold;
    }

    public int getExpectedCostWindow() {
        return expectedCostWindow;
    }

    public void setExpectedCostWindow(int expectedCostWindow) {
        this.expectedCostWindow = expectedCostWindow;
    }

    public double getConfidence() {
        return confidence;
    }

    public void setConfidence(double confidence) {
        this.confidence = confidence;
    }

    public double getHighConfidence() {
        return highConfidence;
    }

    public void setHighConfidence(double highConfidence) {
        this.highConfidence = highConfidence;
    }

    public double getServiceShareThreshold() {
        return serviceShareThreshold;
    }

    public void setServiceShareThreshold(double serviceShareThreshold) {
        this.serviceShareThreshold = serviceShareThreshold;
    }
}

package com.costsentinel.core.config;

import java.util.List;

/**
 * Parameters of the mean + N·σ fallback detector.
 *
 * @since 1.0.0
 */
public class StatisticalSettings {

    private int minObservations = 8;
    private double deviationFactor = 2.0;
    private double highThresholdMultiplier = 1.5;
    private double confidence = 0.75;

    /** A service is "affected" when it exceeds this share of the mean daily cost. */
    private double serviceShareThreshold = 0.1;

    void validate(List<String> errors) {
        if (minObservations < 2) {
            errors.add("statistical.minObservations must be >= 2");
        }
        if (deviationFactor <= 0) {
            errors.add("statistical.deviationFactor must be > 0");
        }
        if (highThresholdMultiplier < 1) {
            errors.add("statistical.highThresholdMultiplier must be >= 1");
        }
        Validation.requireUnit(errors, "statistical.confidence", confidence);
        Validation.requireUnit(errors, "statistical.serviceShareThreshold", serviceShareThreshold);
    }

    public int getMinObservations() {
        return minObservations;
    }

    public void setMinObservations(int minObservations) {
        this.minObservations = minObservations;
    }

    public double getDeviationFactor() {
        return deviationFactor;
    }

    public void setDeviationFactor(double deviationFactor) {
        this.deviationFactor = deviationFactor;
    }

    public double getHighThresholdMultiplier() {
        return highThresholdMultiplier;
    }

    public void setHighThresholdMultiplier(double highThresholdMultiplier) {
        this.highThresholdMultiplier = highThresholdMultiplier;
    }

    public double getConfidence() {
        return confidence;
    }

    public void setConfidence(double confidence) {
        this.confidence = confidence;
    }

    public double getServiceShareThreshold() {
        return serviceShareThreshold;
    }

    public void setServiceShareThreshold(double serviceShareThreshold) {
        this.serviceShareThreshold = serviceShareThreshold;
    }
}

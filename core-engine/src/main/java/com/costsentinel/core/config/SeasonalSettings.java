package com.costsentinel.core.config;

import java.util.List;

/**
 * Parameters of the seasonal-decomposition detector.
 *
 * @since 1.0.0
 */
public class SeasonalSettings {

    private int minObservations = 28;

    /** Length of the repeating profile, in days. */
    private int period = 7;

    private double madMultiplier = 3.0;
    private double highThresholdMultiplier = 1.5;
    private double confidence = 0.88;
    private int topServices = 3;

    void validate(List<String> errors) {
        if (period < 2) {
            errors.add("seasonal.period must be >= 2");
        }
        if (minObservations < period) {
            errors.add("seasonal.minObservations must be >= period");
        }
        if (madMultiplier < 0) {
            errors.add("seasonal.madMultiplier must be >= 0");
        }
        if (highThresholdMultiplier < 1) {
            errors.add("seasonal.highThresholdMultiplier must be >= 1");
        }
        if (topServices < 0) {
            errors.add("seasonal.topServices must be >= 0");
        }
        Validation.requireUnit(errors, "seasonal.confidence", confidence);
    }

    public int getMinObservations() {
        return minObservations;
    }

    public void setMinObservations(int minObservations) {
        this.minObservations = minObservations;
    }

    public int getPeriod() {
        return period;
    }

    public void setPeriod(int period) {
        this.period = period;
    }

    public double getMadMultiplier() {
        return madMultiplier;
    }

    public void setMadMultiplier(double madMultiplier) {
        this.madMultiplier = madMultiplier;
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

    public int getTopServices() {
        return topServices;
    }

    public void setTopServices(int topServices) {
        this.topServices = topServices;
    }
}

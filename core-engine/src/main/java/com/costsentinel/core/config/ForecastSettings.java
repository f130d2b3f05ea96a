package com.costsentinel.core.config;

import java.util.List;

/**
 * Parameters of the rolling-forecast detector.
 *
 * @since 1.0.0
 */
public class ForecastSettings {

    private int minObservations = 30;
    private int windowSize = 30;

    /** Normal quantile of the confidence band (1.96 for 95%). */
    private double confidenceQuantile = 1.96;

    /** A residual beyond this many band half-widths is an anomaly. */
    private double bandMultiplier = 2.0;

    /** A residual beyond this many band half-widths is HIGH severity. */
    private double highBandMultiplier = 3.0;

    private double confidence = 0.92;
    private int topServices = 3;

    void validate(List<String> errors) {
        if (minObservations < 2) {
            errors.add("forecast.minObservations must be >= 2");
        }
        if (windowSize < 2) {
            errors.add("forecast.windowSize must be >= 2");
        }
        if (confidenceQuantile <= 0) {
            errors.add("forecast.confidenceQuantile must be > 0");
        }
        if (bandMultiplier <= 0) {
            errors.add("forecast.bandMultiplier must be > 0");
        }
        if (highBandMultiplier < bandMultiplier) {
            errors.add("forecast.highBandMultiplier must be >= bandMultiplier");
        }
        if (topServices < 0) {
            errors.add("forecast.topServices must be >= 0");
        }
        Validation.requireUnit(errors, "forecast.confidence", confidence);
    }

    public int getMinObservations() {
        return minObservations;
    }

    public void setMinObservations(int minObservations) {
        this.minObservations = minObservations;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(int windowSize) {
        this.windowSize = windowSize;
    }

    public double getConfidenceQuantile() {
        return confidenceQuantile;
    }

    public void setConfidenceQuantile(double confidenceQuantile) {
        this.confidenceQuantile = confidenceQuantile;
    }

    public double getBandMultiplier() {
        return bandMultiplier;
    }

    public void setBandMultiplier(double bandMultiplier) {
        this.bandMultiplier = bandMultiplier;
    }

    public double getHighBandMultiplier() {
        return highBandMultiplier;
    }

    public void setHighBandMultiplier(double highBandMultiplier) {
        this.highBandMultiplier = highBandMultiplier;
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

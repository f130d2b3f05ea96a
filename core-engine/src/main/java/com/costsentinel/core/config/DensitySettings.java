package com.costsentinel.core.config;

import java.util.List;

/**
 * Parameters of the density-clustering detector.
 *
 * @since 1.0.0
 */
public class DensitySettings {

    private int minObservations = 20;

    /** Neighbourhood radius as a multiple of the series standard deviation. */
    private double epsilonFactor = 0.5;

    private int minPoints = 5;

    /** Relative deviation above which a noise point is HIGH severity. */
    private double highDeviation = 0.5;

    private double confidence = 0.90;
    private int topServices = 3;

    void validate(List<String> errors) {
        if (minObservations < 1) {
            errors.add("density.minObservations must be >= 1");
        }
        if (epsilonFactor <= 0) {
            errors.add("density.epsilonFactor must be > 0");
        }
        if (minPoints < 1) {
            errors.add("density.minPoints must be >= 1");
        }
        if (highDeviation <= 0) {
            errors.add("density.highDeviation must be > 0");
        }
        if (topServices < 0) {
            errors.add("density.topServices must be >= 0");
        }
        Validation.requireUnit(errors, "density.confidence", confidence);
    }

    public int getMinObservations() {
        return minObservations;
    }

    public void setMinObservations(int minObservations) {
        this.minObservations = minObservations;
    }

    public double getEpsilonFactor() {
        return epsilonFactor;
    }

    public void setEpsilonFactor(double epsilonFactor) {
        this.epsilonFactor = epsilonFactor;
    }

    public int getMinPoints() {
        return minPoints;
    }

    public void setMinPoints(int minPoints) {
        this.minPoints = minPoints;
    }

    public double getHighDeviation() {
        return highDeviation;
    }

    public void setHighDeviation(double highDeviation) {
        this.highDeviation = highDeviation;
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

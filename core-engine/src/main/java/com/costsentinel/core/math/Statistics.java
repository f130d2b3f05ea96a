package com.costsentinel.core.math;

import java.util.Arrays;

/**
 * Descriptive statistics over {@code double} arrays.
 *
 * <p>
 * Standard deviations are population (divide by {@code n}). Every method returns
 * {@code 0} for an empty input instead of {@code NaN}.
 * </p>
 *
 * @since 1.0.0
 */
public final class Statistics {

    private Statistics() {
        // utility class; not instantiable
    }

    public static double mean(double[] values) {
        return mean(values, 0, values.length);
    }

    /**
     * Mean of {@code values[from, to)}.
     *
     * @param values source array
     * @param from   inclusive start index
     * @param to     exclusive end index
     * @return mean, or {@code 0} for an empty range
     */
    public static double mean(double[] values, int from, int to) {
        if (to <= from) {
            return 0;
        }
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }

    public static double standardDeviation(double[] values) {
        return standardDeviation(values, 0, values.length);
    }

    /**
     * Population standard deviation of {@code values[from, to)}.
     *
     * @param values source array
     * @param from   inclusive start index
     * @param to     exclusive end index
     * @return standard deviation, or {@code 0} for an empty range
     */
    public static double standardDeviation(double[] values, int from, int to) {
        if (to <= from) {
            return 0;
        }
        double mean = mean(values, from, to);
        double sumSquaredDiff = 0;
        for (int i = from; i < to; i++) {
            double diff = values[i] - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / (to - from));
    }

    /**
     * Median; the mean of the two middle values for an even-sized input.
     *
     * @param values source values, not modified
     * @return median, or {@code 0} for an empty input
     */
    public static double median(double[] values) {
        int n = values.length;
        if (n == 0) {
            return 0;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        if (n % 2 == 0) {
            return (sorted[n / 2 - 1] + sorted[n / 2]) / 2;
        }
        return sorted[n / 2];
    }

    /**
     * Median absolute deviation from the median.
     *
     * @param values source values, not modified
     * @return MAD, or {@code 0} for an empty input
     */
    public static double medianAbsoluteDeviation(double[] values) {
        double median = median(values);
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - median);
        }
        return median(deviations);
    }

    public static double[] absolute(double[] values) {
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = Math.abs(values[i]);
        }
        return result;
    }
}

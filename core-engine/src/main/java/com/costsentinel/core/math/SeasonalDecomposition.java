package com.costsentinel.core.math;

/**
 * Additive decomposition {@code value = trend + seasonal + residual}.
 *
 * <ul>
 * <li><b>trend</b>: centred moving average over {@code period} points. Near the
 * edges the window is shifted inward so it keeps its full width; it only shrinks
 * when the series is shorter than one period.</li>
 * <li><b>seasonal</b>: mean detrended value of every index sharing the same
 * {@code index mod period} slot. Slots are positional, not calendar-aligned.</li>
 * <li><b>residual</b>: whatever is left.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class SeasonalDecomposition {

    private final double[] trend;
    private final double[] seasonal;
    private final double[] residual;

    private SeasonalDecomposition(double[] trend, double[] seasonal, double[] residual) {
        this.trend = trend;
        this.seasonal = seasonal;
        this.residual = residual;
    }

    /**
     * @param values series to decompose; not modified
     * @param period length of the repeating profile; must be {@code >= 1}
     * @return decomposition with arrays the same length as {@code values}
     */
    public static SeasonalDecomposition decompose(double[] values, int period) {
        if (period < 1) {
            throw new IllegalArgumentException("period must be >= 1, got: " + period);
        }
        int n = values.length;
        double[] trend = new double[n];
        int half = period / 2;
        for (int i = 0; i < n; i++) {
            int start;
            int end;
            if (n >= period) {
                start = Math.max(0, Math.min(i - half, n - period));
                end = start + period;
            } else {
                start = Math.max(0, i - half);
                end = Math.min(n, i + half + 1);
            }
            trend[i] = Statistics.mean(values, start, end);
        }

        double[] seasonal = new double[n];
        for (int slot = 0; slot < period && slot < n; slot++) {
            double sum = 0;
            int count = 0;
            for (int j = slot; j < n; j += period) {
                sum += values[j] - trend[j];
                count++;
            }
            double profile = sum / count;
            for (int j = slot; j < n; j += period) {
                seasonal[j] = profile;
            }
        }

        double[] residual = new double[n];
        for (int i = 0; i < n; i++) {
            residual[i] = values[i] - trend[i] - seasonal[i];
        }
        return new SeasonalDecomposition(trend, seasonal, residual);
    }

    public double trendAt(int index) {
        return trend[index];
    }

    public double seasonalAt(int index) {
        return seasonal[index];
    }

    public double residualAt(int index) {
        return residual[index];
    }

    /**
     * @return copy of the residual series
     */
    public double[] residuals() {
        return residual.clone();
    }

    public int size() {
        return residual.length;
    }
}

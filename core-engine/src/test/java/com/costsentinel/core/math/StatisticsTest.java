package com.costsentinel.core.math;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link Statistics}.
 */
class StatisticsTest {

    @Test
    @DisplayName("Should compute mean and population standard deviation")
    void shouldComputeMeanAndStdDev() {
        double[] values = { 2, 4, 4, 4, 5, 5, 7, 9 };

        assertThat(Statistics.mean(values)).isEqualTo(5.0);
        assertThat(Statistics.standardDeviation(values)).isCloseTo(2.0, within(1e-12));
    }

    @Test
    @DisplayName("Should restrict mean and standard deviation to a range")
    void shouldComputeOverRange() {
        double[] values = { 100, 1, 3, 100 };

        assertThat(Statistics.mean(values, 1, 3)).isEqualTo(2.0);
        assertThat(Statistics.standardDeviation(values, 1, 3)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should return zero for empty input")
    void shouldHandleEmptyInput() {
        double[] empty = {};

        assertThat(Statistics.mean(empty)).isZero();
        assertThat(Statistics.standardDeviation(empty)).isZero();
        assertThat(Statistics.median(empty)).isZero();
        assertThat(Statistics.medianAbsoluteDeviation(empty)).isZero();
    }

    @Test
    @DisplayName("Should compute median for odd and even sizes without reordering input")
    void shouldComputeMedian() {
        double[] odd = { 9, 1, 5 };
        double[] even = { 4, 1, 3, 2 };

        assertThat(Statistics.median(odd)).isEqualTo(5.0);
        assertThat(Statistics.median(even)).isEqualTo(2.5);
        assertThat(odd).containsExactly(9, 1, 5);
    }

    @Test
    @DisplayName("Should compute the median absolute deviation")
    void shouldComputeMad() {
        // median 2, deviations {1, 1, 0, 0, 2, 4, 7} -> median 1
        double[] values = { 1, 1, 2, 2, 4, 6, 9 };

        assertThat(Statistics.medianAbsoluteDeviation(values)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should take absolute values")
    void shouldTakeAbsoluteValues() {
        assertThat(Statistics.absolute(new double[] { -1.5, 0, 2 })).containsExactly(1.5, 0, 2);
    }
}

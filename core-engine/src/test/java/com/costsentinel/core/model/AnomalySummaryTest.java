package com.costsentinel.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link AnomalySummary}.
 */
class AnomalySummaryTest {

    @Test
    @DisplayName("Should count anomalies, high severities and methods")
    void shouldSummarize() {
        AnomalySummary summary = AnomalySummary.of(List.of(
                anomaly(1, AnomalySeverity.HIGH, "Isolation Forest", 100, 300),
                anomaly(2, AnomalySeverity.MEDIUM, "DBSCAN Clustering", 100, 140),
                anomaly(3, AnomalySeverity.HIGH, "Isolation Forest", 100, 20)));

        assertThat(summary.getAnomalyCount()).isEqualTo(3);
        assertThat(summary.getHighSeverityCount()).isEqualTo(2);
        assertThat(summary.getTotalAnomalousCost()).isCloseTo(160.0, within(1e-9));
        assertThat(summary.getCountByMethod())
                .containsExactly(
                        Map.entry("Isolation Forest", 2),
                        Map.entry("DBSCAN Clustering", 1));
    }

    @Test
    @DisplayName("Should report zeros for no anomalies")
    void shouldSummarizeEmptyList() {
        AnomalySummary summary = AnomalySummary.of(List.of());

        assertThat(summary.getAnomalyCount()).isZero();
        assertThat(summary.getHighSeverityCount()).isZero();
        assertThat(summary.getTotalAnomalousCost()).isZero();
        assertThat(summary.getCountByMethod()).isEmpty();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static CostAnomaly anomaly(int day, AnomalySeverity severity, String method,
                                       double expected, double actual) {
        return CostAnomaly.builder()
                .anomalyDate(LocalDate.of(2024, 1, day))
                .detectedAt(Instant.EPOCH)
                .type(AnomalyType.SPIKE_COST)
                .severity(severity)
                .expectedCost(expected)
                .actualCost(actual)
                .detectionMethod(method)
                .build();
    }
}

package com.costsentinel.core.detection;

import com.costsentinel.core.CostSeries;
import com.costsentinel.core.config.IsolationSettings;
import com.costsentinel.core.math.SeedStrategy;
import com.costsentinel.core.model.AnomalySeverity;
import com.costsentinel.core.model.AnomalyType;
import com.costsentinel.core.model.CostAnomaly;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link IsolationOutlierDetector}.
 */
class IsolationOutlierDetectorTest {

    private IsolationOutlierDetector detector;

    @BeforeEach
    void setUp() {
        detector = new IsolationOutlierDetector(new IsolationSettings(), SeedStrategy.offset(0));
    }

    @Test
    @DisplayName("Should return nothing for fewer than 14 observations")
    void shouldNotFireWithInsufficientData() {
        assertThat(detector.getMinimumObservations()).isEqualTo(14);
        assertThat(detector.detect(CostSeries.withSpike(13, 100, 12, 5000), CostSeries.context())).isEmpty();
    }

    @Test
    @DisplayName("Should flag a spike as soon as 14 observations are present")
    void shouldFireAtMinimumLength() {
        List<CostAnomaly> anomalies = detector.detect(CostSeries.withSpike(14, 100, 13, 900), CostSeries.context());

        assertThat(anomalies).hasSize(1);
        assertThat(anomalies.get(0).getAnomalyDate()).isEqualTo(CostSeries.START.plusDays(13));
        assertThat(anomalies.get(0).getAnomalyScore()).isCloseTo(0.855, within(1e-3));
    }

    @Test
    @DisplayName("Should flag only the spike of an otherwise flat series")
    void shouldFlagSpike() {
        List<CostAnomaly> anomalies = detector.detect(CostSeries.withSpike(30, 100, 20, 1000), CostSeries.context());

        assertThat(anomalies).hasSize(1);
        CostAnomaly anomaly = anomalies.get(0);
        assertThat(anomaly.getAnomalyDate()).isEqualTo(CostSeries.START.plusDays(20));
        assertThat(anomaly.getDetectedAt()).isEqualTo(CostSeries.EVALUATED_AT);
        assertThat(anomaly.getDetectionMethod()).isEqualTo("Isolation Forest");
        assertThat(anomaly.getTitle()).isEqualTo("Isolation Forest: Cost anomaly on 2024-01-21");
        assertThat(anomaly.getType()).isEqualTo(AnomalyType.SPIKE_COST);
        assertThat(anomaly.getSeverity()).isEqualTo(AnomalySeverity.HIGH);
        assertThat(anomaly.getConfidence()).isEqualTo(0.95);
        assertThat(anomaly.getAnomalyScore()).isCloseTo(0.8901, within(1e-3));
        assertThat(anomaly.getExpectedCost()).isCloseTo(100.0, within(1e-9));
        assertThat(anomaly.getActualCost()).isEqualTo(1000.0);
        assertThat(anomaly.getDescription()).contains("isolation score: 0.890");
        assertThat(anomaly.getAffectedServices()).containsExactly("compute", "storage");
        assertThat(anomaly.getPossibleCauses()).containsExactly(
                "Major infrastructure change or deployment",
                "High usage in compute service",
                "Unexpected resource scaling event",
                "Change in usage patterns or workload");
    }

    @Test
    @DisplayName("Should mention the Monday catch-up for a Monday spike")
    void shouldAddMondayCause() {
        List<CostAnomaly> anomalies = detector.detect(CostSeries.withSpike(30, 100, 21, 1000), CostSeries.context());

        assertThat(anomalies).hasSize(1);
        assertThat(anomalies.get(0).getAnomalyDate().getDayOfWeek()).isEqualTo(DayOfWeek.MONDAY);
        assertThat(anomalies.get(0).getPossibleCauses())
                .hasSize(4)
                .contains("Monday spike (weekend catch-up workload)");
    }

    @Test
    @DisplayName("Should type an isolated drop as an unexpected increase")
    void shouldTypeDropAsUnexpectedIncrease() {
        List<CostAnomaly> anomalies = detector.detect(CostSeries.withSpike(30, 100, 20, 0), CostSeries.context());

        assertThat(anomalies).hasSize(1);
        assertThat(anomalies.get(0).getType()).isEqualTo(AnomalyType.UNEXPECTED_INCREASE);
        assertThat(anomalies.get(0).getExpectedCost()).isCloseTo(100.0, within(1e-9));
    }

    @Test
    @DisplayName("Should flag nothing in a constant series")
    void shouldIgnoreFlatSeries() {
        assertThat(detector.detect(CostSeries.flat(40, 100), CostSeries.context())).isEmpty();
    }

    @Test
    @DisplayName("Should be reproducible across runs")
    void shouldBeDeterministic() {
        List<CostAnomaly> first = detector.detect(CostSeries.withSpike(30, 100, 20, 1000), CostSeries.context());
        List<CostAnomaly> second = new IsolationOutlierDetector(new IsolationSettings(), SeedStrategy.offset(0))
                .detect(CostSeries.withSpike(30, 100, 20, 1000), CostSeries.context());

        assertThat(second.get(0).getAnomalyScore()).isEqualTo(first.get(0).getAnomalyScore());
    }
}

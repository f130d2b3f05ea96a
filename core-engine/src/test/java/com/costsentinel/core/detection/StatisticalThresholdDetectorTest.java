package com.costsentinel.core.detection;

import com.costsentinel.core.CostSeries;
import com.costsentinel.core.config.StatisticalSettings;
import com.costsentinel.core.model.AnomalySeverity;
import com.costsentinel.core.model.AnomalyType;
import com.costsentinel.core.model.CostAnomaly;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link StatisticalThresholdDetector}.
 */
class StatisticalThresholdDetectorTest {

    private StatisticalThresholdDetector detector;

    @BeforeEach
    void setUp() {
        detector = new StatisticalThresholdDetector(new StatisticalSettings());
    }

    @Test
    @DisplayName("Should name the method after its deviation factor")
    void shouldNameMethod() {
        StatisticalSettings settings = new StatisticalSettings();
        settings.setDeviationFactor(2.5);

        assertThat(detector.getMethodName()).isEqualTo("Statistical (2 Std Dev)");
        assertThat(new StatisticalThresholdDetector(settings).getMethodName()).isEqualTo("Statistical (2.5 Std Dev)");
    }

    @Test
    @DisplayName("Should return nothing for fewer than 8 observations")
    void shouldNotFireWithInsufficientData() {
        assertThat(detector.detect(CostSeries.withSpike(7, 100, 6, 10_000), CostSeries.context())).isEmpty();
    }

    @Test
    @DisplayName("Should flag a day above mean + 2σ as MEDIUM spike")
    void shouldFlagModerateSpike() {
        // mean 120, σ 60, threshold 240
        List<CostAnomaly> anomalies = detector.detect(CostSeries.withSpike(10, 100, 4, 300), CostSeries.context());

        assertThat(anomalies).hasSize(1);
        CostAnomaly anomaly = anomalies.get(0);
        assertThat(anomaly.getType()).isEqualTo(AnomalyType.SPIKE_COST);
        assertThat(anomaly.getSeverity()).isEqualTo(AnomalySeverity.MEDIUM);
        assertThat(anomaly.getExpectedCost()).isCloseTo(120.0, within(1e-9));
        assertThat(anomaly.getAnomalyScore()).isCloseTo(0.25, within(1e-9));
        assertThat(anomaly.getConfidence()).isEqualTo(0.75);
        assertThat(anomaly.getDescription()).isEqualTo("Daily cost of $300.00 significantly exceeds normal pattern");
        assertThat(anomaly.getAffectedServices()).containsExactly("compute", "storage", "network");
    }

    @Test
    @DisplayName("Should flag a day beyond 1.5 × threshold as HIGH")
    void shouldFlagHighSpike() {
        List<CostAnomaly> anomalies = detector.detect(CostSeries.withSpike(20, 100, 5, 2000), CostSeries.context());

        assertThat(anomalies).hasSize(1);
        assertThat(anomalies.get(0).getSeverity()).isEqualTo(AnomalySeverity.HIGH);
    }

    @Test
    @DisplayName("Should ignore drops and constant series")
    void shouldIgnoreDropsAndFlatSeries() {
        assertThat(detector.detect(CostSeries.withSpike(20, 100, 5, 0), CostSeries.context())).isEmpty();
        assertThat(detector.detect(CostSeries.flat(20, 100), CostSeries.context())).isEmpty();
    }
}

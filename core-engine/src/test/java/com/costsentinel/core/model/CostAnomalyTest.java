package com.costsentinel.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link CostAnomaly}.
 */
class CostAnomalyTest {

    private static final LocalDate DAY = LocalDate.of(2024, 1, 25);
    private static final Instant NOW = Instant.parse("2024-02-01T10:00:00Z");

    @Test
    @DisplayName("Should derive cost difference and percentage deviation")
    void shouldDeriveDeviation() {
        CostAnomaly anomaly = anomaly().expectedCost(100).actualCost(150).build();

        assertThat(anomaly.getCostDifference()).isEqualTo(50.0);
        assertThat(anomaly.getPercentageDeviation()).isCloseTo(50.0, within(1e-9));
    }

    @Test
    @DisplayName("Should report zero percentage deviation when nothing was expected")
    void shouldHandleZeroExpectedCost() {
        CostAnomaly anomaly = anomaly().expectedCost(0).actualCost(80).build();

        assertThat(anomaly.getCostDifference()).isEqualTo(80.0);
        assertThat(anomaly.getPercentageDeviation()).isZero();
    }

    @Test
    @DisplayName("Should clamp score and confidence into [0, 1]")
    void shouldClampScoreAndConfidence() {
        CostAnomaly high = anomaly().anomalyScore(3.2).confidence(1.04).build();
        CostAnomaly low = anomaly().anomalyScore(-0.5).confidence(Double.NaN).build();

        assertThat(high.getAnomalyScore()).isEqualTo(1.0);
        assertThat(high.getConfidence()).isEqualTo(1.0);
        assertThat(low.getAnomalyScore()).isZero();
        assertThat(low.getConfidence()).isZero();
    }

    @Test
    @DisplayName("Should require date, timestamp, type, severity and method")
    void shouldRequireMandatoryFields() {
        assertThatThrownBy(() -> anomaly().anomalyDate(null).build())
                .isInstanceOf(NullPointerException.class).hasMessageContaining("anomalyDate");
        assertThatThrownBy(() -> anomaly().detectedAt(null).build())
                .isInstanceOf(NullPointerException.class).hasMessageContaining("detectedAt");
        assertThatThrownBy(() -> anomaly().type(null).build())
                .isInstanceOf(NullPointerException.class).hasMessageContaining("type");
        assertThatThrownBy(() -> anomaly().severity(null).build())
                .isInstanceOf(NullPointerException.class).hasMessageContaining("severity");
        assertThatThrownBy(() -> anomaly().detectionMethod(null).build())
                .isInstanceOf(NullPointerException.class).hasMessageContaining("detectionMethod");
    }

    @Test
    @DisplayName("Should derive a stable id from date and method")
    void shouldDeriveStableId() {
        CostAnomaly first = anomaly().build();
        CostAnomaly again = anomaly().actualCost(999).build();
        CostAnomaly otherMethod = anomaly().detectionMethod("DBSCAN Clustering").build();

        assertThat(first.getAnomalyId()).isEqualTo(again.getAnomalyId());
        assertThat(first.getAnomalyId()).isNotEqualTo(otherMethod.getAnomalyId());
    }

    @Test
    @DisplayName("Should copy every field through toBuilder")
    void shouldCopyThroughToBuilder() {
        CostAnomaly original = anomaly()
                .forecastedRange("$90.00 - $110.00")
                .seasonalComponent(4.0)
                .trendComponent(100.0)
                .build();

        CostAnomaly copy = original.toBuilder().build();

        assertThat(copy).isEqualTo(original);
        assertThat(copy).usingRecursiveComparison().isEqualTo(original);
    }

    @Test
    @DisplayName("Should omit absent optional fields from JSON")
    void shouldSerializeToJson() throws Exception {
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        JsonNode json = mapper.valueToTree(anomaly().build());

        assertThat(json.get("anomalyDate").asText()).isEqualTo("2024-01-25");
        assertThat(json.get("type").asText()).isEqualTo("SPIKE_COST");
        assertThat(json.get("costDifference").asDouble()).isEqualTo(400.0);
        assertThat(json.get("affectedServices").get(0).asText()).isEqualTo("compute");
        assertThat(json.has("forecastedRange")).isFalse();
        assertThat(json.has("seasonalComponent")).isFalse();
        assertThat(json.has("trendComponent")).isFalse();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static CostAnomaly.Builder anomaly() {
        return CostAnomaly.builder()
                .anomalyDate(DAY)
                .detectedAt(NOW)
                .type(AnomalyType.SPIKE_COST)
                .severity(AnomalySeverity.HIGH)
                .title("Isolation Forest: Cost anomaly on 2024-01-25")
                .expectedCost(100)
                .actualCost(500)
                .anomalyScore(0.9)
                .detectionMethod("Isolation Forest")
                .confidence(0.95)
                .affectedServices(List.of("compute"))
                .possibleCauses(List.of("Major infrastructure change or deployment"));
    }
}

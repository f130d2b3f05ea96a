package com.costsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A single anomalous day, as reported by one detector or by the consolidation stage.
 *
 * <p>
 * Instances are immutable and serialise to JSON through their getters; optional,
 * detector-specific fields are omitted when absent.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code anomalyDate}, {@code detectedAt}, {@code type},
 * {@code severity} and {@code detectionMethod} are required. The builder derives
 * {@code costDifference}, {@code percentageDeviation} and {@code anomalyId}, and clamps
 * {@code anomalyScore} and {@code confidence} into {@code [0, 1]}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CostAnomaly {

    private final String anomalyId;
    private final LocalDate anomalyDate;
    private final Instant detectedAt;
    private final AnomalyType type;
    private final AnomalySeverity severity;
    private final String title;
    private final String description;
    private final double expectedCost;
    private final double actualCost;
    private final double costDifference;
    private final double percentageDeviation;
    private final double anomalyScore;
    private final String detectionMethod;
    private final double confidence;
    private final List<String> affectedServices;
    private final List<String> possibleCauses;

    /** Textual 95% interval, forecast detector only. */
    private final String forecastedRange;

    /** Seasonal profile value for the day, seasonal detector only. */
    private final Double seasonalComponent;

    /** Trend value for the day, seasonal detector only. */
    private final Double trendComponent;

    private CostAnomaly(Builder builder) {
        this.anomalyDate = Objects.requireNonNull(builder.anomalyDate, "anomalyDate must not be null");
        this.detectedAt = Objects.requireNonNull(builder.detectedAt, "detectedAt must not be null");
        this.type = Objects.requireNonNull(builder.type, "type must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.detectionMethod = Objects.requireNonNull(builder.detectionMethod, "detectionMethod must not be null");
        this.title = builder.title != null ? builder.title : "";
        this.description = builder.description != null ? builder.description : "";
        this.expectedCost = builder.expectedCost;
        this.actualCost = builder.actualCost;
        this.costDifference = actualCost - expectedCost;
        this.percentageDeviation = expectedCost == 0 ? 0 : costDifference / expectedCost * 100;
        this.anomalyScore = clampUnit(builder.anomalyScore);
        this.confidence = clampUnit(builder.confidence);
        this.affectedServices = builder.affectedServices != null ? List.copyOf(builder.affectedServices) : List.of();
        this.possibleCauses = builder.possibleCauses != null ? List.copyOf(builder.possibleCauses) : List.of();
        this.forecastedRange = builder.forecastedRange;
        this.seasonalComponent = builder.seasonalComponent;
        this.trendComponent = builder.trendComponent;
        this.anomalyId = UUID.nameUUIDFromBytes(
                (anomalyDate + "|" + detectionMethod).getBytes(StandardCharsets.UTF_8)).toString();
    }

    private static double clampUnit(double value) {
        if (Double.isNaN(value)) {
            return 0;
        }
        return Math.max(0, Math.min(1, value));
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder pre-populated with every field of this anomaly.
     *
     * @return new builder
     */
    public Builder toBuilder() {
        return new Builder()
                .anomalyDate(anomalyDate)
                .detectedAt(detectedAt)
                .type(type)
                .severity(severity)
                .title(title)
                .description(description)
                .expectedCost(expectedCost)
                .actualCost(actualCost)
                .anomalyScore(anomalyScore)
                .detectionMethod(detectionMethod)
                .confidence(confidence)
                .affectedServices(affectedServices)
                .possibleCauses(possibleCauses)
                .forecastedRange(forecastedRange)
                .seasonalComponent(seasonalComponent)
                .trendComponent(trendComponent);
    }

    /**
     * Fluent builder for {@link CostAnomaly} instances.
     */
    public static class Builder {
        private LocalDate anomalyDate;
        private Instant detectedAt;
        private AnomalyType type;
        private AnomalySeverity severity;
        private String title;
        private String description;
        private double expectedCost;
        private double actualCost;
        private double anomalyScore;
        private String detectionMethod;
        private double confidence;
        private List<String> affectedServices;
        private List<String> possibleCauses;
        private String forecastedRange;
        private Double seasonalComponent;
        private Double trendComponent;

        public Builder anomalyDate(LocalDate anomalyDate) {
            this.anomalyDate = anomalyDate;
            return this;
        }

        public Builder detectedAt(Instant detectedAt) {
            this.detectedAt = detectedAt;
            return this;
        }

        public Builder type(AnomalyType type) {
            this.type = type;
            return this;
        }

        public Builder severity(AnomalySeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder expectedCost(double expectedCost) {
            this.expectedCost = expectedCost;
            return this;
        }

        public Builder actualCost(double actualCost) {
            this.actualCost = actualCost;
            return this;
        }

        public Builder anomalyScore(double anomalyScore) {
            this.anomalyScore = anomalyScore;
            return this;
        }

        public Builder detectionMethod(String detectionMethod) {
            this.detectionMethod = detectionMethod;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder affectedServices(List<String> affectedServices) {
            this.affectedServices = affectedServices;
            return this;
        }

        public Builder possibleCauses(List<String> possibleCauses) {
            this.possibleCauses = possibleCauses;
            return this;
        }

        public Builder forecastedRange(String forecastedRange) {
            this.forecastedRange = forecastedRange;
            return this;
        }

        public Builder seasonalComponent(Double seasonalComponent) {
            this.seasonalComponent = seasonalComponent;
            return this;
        }

        public Builder trendComponent(Double trendComponent) {
            this.trendComponent = trendComponent;
            return this;
        }

        /**
         * Build the anomaly.
         *
         * @return a new {@link CostAnomaly}
         * @throws NullPointerException if a required field is {@code null}
         */
        public CostAnomaly build() {
            return new CostAnomaly(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    /**
     * Stable identifier derived from the anomaly date and detection method.
     *
     * @return name-based UUID string
     */
    public String getAnomalyId() {
        return anomalyId;
    }

    public LocalDate getAnomalyDate() {
        return anomalyDate;
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    public AnomalyType getType() {
        return type;
    }

    public AnomalySeverity getSeverity() {
        return severity;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public double getExpectedCost() {
        return expectedCost;
    }

    public double getActualCost() {
        return actualCost;
    }

    public double getCostDifference() {
        return costDifference;
    }

    /**
     * @return {@code costDifference / expectedCost * 100}, or {@code 0} when the
     *         expected cost is zero
     */
    public double getPercentageDeviation() {
        return percentageDeviation;
    }

    public double getAnomalyScore() {
        return anomalyScore;
    }

    public String getDetectionMethod() {
        return detectionMethod;
    }

    public double getConfidence() {
        return confidence;
    }

    public List<String> getAffectedServices() {
        return affectedServices;
    }

    public List<String> getPossibleCauses() {
        return possibleCauses;
    }

    public String getForecastedRange() {
        return forecastedRange;
    }

    public Double getSeasonalComponent() {
        return seasonalComponent;
    }

    public Double getTrendComponent() {
        return trendComponent;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CostAnomaly that))
            return false;
        return Objects.equals(anomalyDate, that.anomalyDate)
                && Objects.equals(detectionMethod, that.detectionMethod)
                && Objects.equals(detectedAt, that.detectedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(anomalyDate, detectionMethod, detectedAt);
    }

    @Override
    public String toString() {
        return "CostAnomaly{" +
                "anomalyDate=" + anomalyDate +
                ", type=" + type +
                ", severity=" + severity +
                ", detectionMethod='" + detectionMethod + '\'' +
                ", expectedCost=" + expectedCost +
                ", actualCost=" + actualCost +
                ", anomalyScore=" + anomalyScore +
                ", confidence=" + confidence +
                '}';
    }
}

package com.costsentinel.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregate view over a list of detected anomalies, for reports and alert headers.
 *
 * @since 1.0.0
 */
public final class AnomalySummary {

    private final int anomalyCount;
    private final int highSeverityCount;
    private final double totalAnomalousCost;
    private final Map<String, Integer> countByMethod;

    private AnomalySummary(int anomalyCount, int highSeverityCount, double totalAnomalousCost,
                           Map<String, Integer> countByMethod) {
        this.anomalyCount = anomalyCount;
        this.highSeverityCount = highSeverityCount;
        this.totalAnomalousCost = totalAnomalousCost;
        this.countByMethod = Collections.unmodifiableMap(countByMethod);
    }

    /**
     * Summarise the given anomalies.
     *
     * @param anomalies detected anomalies; must not be {@code null}
     * @return summary; all counts are zero for an empty list
     */
    public static AnomalySummary of(List<CostAnomaly> anomalies) {
        Objects.requireNonNull(anomalies, "anomalies must not be null");
        int high = 0;
        double total = 0;
        Map<String, Integer> byMethod = new LinkedHashMap<>();
        for (CostAnomaly anomaly : anomalies) {
            if (anomaly.getSeverity() == AnomalySeverity.HIGH) {
                high++;
            }
            total += anomaly.getCostDifference();
            byMethod.merge(anomaly.getDetectionMethod(), 1, Integer::sum);
        }
        return new AnomalySummary(anomalies.size(), high, total, byMethod);
    }

    public int getAnomalyCount() {
        return anomalyCount;
    }

    public int getHighSeverityCount() {
        return highSeverityCount;
    }

    /**
     * @return sum of {@code actual - expected} over all anomalies (negative for dips)
     */
    public double getTotalAnomalousCost() {
        return totalAnomalousCost;
    }

    /**
     * @return unmodifiable map of detection method to anomaly count, in first-seen order
     */
    public Map<String, Integer> getCountByMethod() {
        return countByMethod;
    }

    @Override
    public String toString() {
        return "AnomalySummary{" +
                "anomalyCount=" + anomalyCount +
                ", highSeverityCount=" + highSeverityCount +
                ", totalAnomalousCost=" + totalAnomalousCost +
                ", countByMethod=" + countByMethod +
                '}';
    }
}

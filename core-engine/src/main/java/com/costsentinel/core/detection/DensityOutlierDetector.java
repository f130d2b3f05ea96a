package com.costsentinel.core.detection;

import com.costsentinel.core.config.DensitySettings;
import com.costsentinel.core.math.DensityClustering;
import com.costsentinel.core.math.Statistics;
import com.costsentinel.core.model.AnomalySeverity;
import com.costsentinel.core.model.AnomalyType;
import com.costsentinel.core.model.CostAnomaly;
import com.costsentinel.core.model.CostObservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * DBSCAN detector.
 *
 * <p>
 * Clusters daily costs with a radius of {@code epsilonFactor × σ}. Days left as
 * noise are anomalies; their expected cost is the mean of the largest cluster,
 * or of the whole series when nothing clusters.
 * </p>
 *
 * @since 1.0.0
 */
public class DensityOutlierDetector extends AbstractCostDetector {

    private static final Logger LOG = LoggerFactory.getLogger(DensityOutlierDetector.class);

    public static final String METHOD = "DBSCAN Clustering";

    private final DensitySettings settings;

    /**
     * @param settings detector parameters; must not be {@code null}
     */
    public DensityOutlierDetector(DensitySettings settings) {
        super(METHOD, Objects.requireNonNull(settings, "DensitySettings must not be null").getMinObservations());
        this.settings = settings;
    }

    @Override
    List<CostAnomaly> findAnomalies(List<CostObservation> series, double[] costs, DetectionContext context) {
        double epsilon = settings.getEpsilonFactor() * Statistics.standardDeviation(costs);
        DensityClustering.Assignment assignment =
                new DensityClustering(epsilon, settings.getMinPoints()).cluster(costs);
        double expected = expectedCost(costs, assignment);

        LOG.debug("DBSCAN epsilon={} clusters={} expected={}", epsilon, assignment.clusterCount(), expected);

        if (expected == 0) {
            return List.of();
        }

        List<CostAnomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < costs.length; i++) {
            if (!assignment.isNoise(i)) {
                continue;
            }
            CostObservation day = series.get(i);
            double deviation = Math.abs(day.getDailyCost() - expected) / expected;

            anomalies.add(CostAnomaly.builder()
                    .anomalyDate(day.getDate())
                    .detectedAt(context.getDetectedAt())
                    .type(AnomalyType.UNEXPECTED_INCREASE)
                    .severity(deviation > settings.getHighDeviation() ? AnomalySeverity.HIGH : AnomalySeverity.MEDIUM)
                    .title("DBSCAN: Outlier detected on " + DAY.format(day.getDate()))
                    .description("Density-based clustering identified this as an outlier point")
                    .expectedCost(expected)
                    .actualCost(day.getDailyCost())
                    .anomalyScore(Math.min(1.0, deviation))
                    .detectionMethod(METHOD)
                    .confidence(settings.getConfidence())
                    .affectedServices(topServices(day, settings.getTopServices()))
                    .possibleCauses(PossibleCauses.forDeviation(day, expected))
                    .build());
        }
        return anomalies;
    }

    private static double expectedCost(double[] costs, DensityClustering.Assignment assignment) {
        int largest = assignment.largestCluster();
        if (largest == DensityClustering.NOISE) {
            return Statistics.mean(costs);
        }
        double sum = 0;
        int count = 0;
        for (int i = 0; i < costs.length; i++) {
            if (assignment.labelOf(i) == largest) {
                sum += costs[i];
                count++;
            }
        }
        return sum / count;
    }
}

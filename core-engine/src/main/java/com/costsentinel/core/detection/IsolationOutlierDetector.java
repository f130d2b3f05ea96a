package com.costsentinel.core.detection;

import com.costsentinel.core.config.IsolationSettings;
import com.costsentinel.core.math.IsolationForest;
import com.costsentinel.core.math.SeedStrategy;
import com.costsentinel.core.math.Statistics;
import com.costsentinel.core.model.AnomalySeverity;
import com.costsentinel.core.model.AnomalyType;
import com.costsentinel.core.model.CostAnomaly;
import com.costsentinel.core.model.CostObservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Isolation-forest detector.
 *
 * <p>
 * Days whose cost is easy to separate from the rest of the series by random
 * splits score close to {@code 1}. Days above the configured score threshold are
 * reported, with the mean of the preceding week as the expected cost.
 * </p>
 *
 * <p>
 * Scores are reproducible: every tree is seeded through the injected
 * {@link SeedStrategy}.
 * </p>
 *
 * @since 1.0.0
 */
public class IsolationOutlierDetector extends AbstractCostDetector {

    private static final Logger LOG = LoggerFactory.getLogger(IsolationOutlierDetector.class);

    public static final String METHOD = "Isolation Forest";

    private final IsolationSettings settings;
    private final IsolationForest forest;

    /**
     * @param settings     detector parameters; must not be {@code null}
     * @param seedStrategy per-tree seed source; must not be {@code null}
     */
    public IsolationOutlierDetector(IsolationSettings settings, SeedStrategy seedStrategy) {
        super(METHOD, Objects.requireNonNull(settings, "IsolationSettings must not be null").getMinObservations());
        this.settings = settings;
        this.forest = new IsolationForest(settings.getNumTrees(), settings.getMaxSubsampleSize(),
                settings.getMaxDepth(), Objects.requireNonNull(seedStrategy, "SeedStrategy must not be null"));
    }

    @Override
    List<CostAnomaly> findAnomalies(List<CostObservation> series, double[] costs, DetectionContext context) {
        double[] scores = forest.score(costs);
        List<CostAnomaly> anomalies = new ArrayList<>();

        for (int i = 0; i < costs.length; i++) {
            double score = scores[i];
            if (score <= settings.getScoreThreshold()) {
                continue;
            }
            CostObservation day = series.get(i);
            double expected = expectedCost(costs, i);
            boolean high = score > settings.getHighScoreThreshold();

            LOG.debug("Isolation score {} on {} (expected={}, actual={})",
                    score, day.getDate(), expected, day.getDailyCost());

            anomalies.add(CostAnomaly.builder()
                    .anomalyDate(day.getDate())
                    .detectedAt(context.getDetectedAt())
                    .type(day.getDailyCost() > expected ? AnomalyType.SPIKE_COST : AnomalyType.UNEXPECTED_INCREASE)
                    .severity(high ? AnomalySeverity.HIGH : AnomalySeverity.MEDIUM)
                    .title("Isolation Forest: Cost anomaly on " + DAY.format(day.getDate()))
                    .description(String.format(Locale.ROOT,
                            "ML algorithm detected unusual cost pattern (isolation score: %.3f)", score))
                    .expectedCost(expected)
                    .actualCost(day.getDailyCost())
                    .anomalyScore(score)
                    .detectionMethod(METHOD)
                    .confidence(high ? settings.getHighConfidence() : settings.getConfidence())
                    .affectedServices(servicesAbove(day, settings.getServiceShareThreshold(), day.getDailyCost()))
                    .possibleCauses(PossibleCauses.forDeviation(day, expected))
                    .build());
        }
        return anomalies;
    }

    /** Mean of up to {@code expectedCostWindow} preceding days; the day itself for the first one. */
    private double expectedCost(double[] costs, int index) {
        int window = Math.min(settings.getExpectedCostWindow(), index);
        if (window == 0) {
            return costs[index];
        }
        return Statistics.mean(costs, index - window, index);
    }
}

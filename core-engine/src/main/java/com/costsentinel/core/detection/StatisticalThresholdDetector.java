package com.costsentinel.core.detection;

import com.costsentinel.core.config.StatisticalSettings;
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
 * Statistical threshold detector.
 *
 * <p>
 * Flags days whose cost exceeds {@code mean + deviationFactor × σ} of the whole
 * series. Only spikes are reported. A constant series has no spread and yields
 * nothing.
 * </p>
 *
 * @since 1.0.0
 */
public class StatisticalThresholdDetector extends AbstractCostDetector {

    private static final Logger LOG = LoggerFactory.getLogger(StatisticalThresholdDetector.class);

    private final StatisticalSettings settings;

    /**
     * @param settings detector parameters; must not be {@code null}
     */
    public StatisticalThresholdDetector(StatisticalSettings settings) {
        super(methodName(Objects.requireNonNull(settings, "StatisticalSettings must not be null")),
                settings.getMinObservations());
        this.settings = settings;
    }

    private static String methodName(StatisticalSettings settings) {
        double factor = settings.getDeviationFactor();
        String formatted = factor == Math.rint(factor)
                ? Long.toString((long) factor)
                : String.format(Locale.ROOT, "%.1f", factor);
        return "Statistical (" + formatted + " Std Dev)";
    }

    @Override
    List<CostAnomaly> findAnomalies(List<CostObservation> series, double[] costs, DetectionContext context) {
        double mean = Statistics.mean(costs);
        double stdDev = Statistics.standardDeviation(costs);
        if (stdDev == 0) {
            LOG.debug("Constant series, no statistical outliers");
            return List.of();
        }
        double threshold = mean + settings.getDeviationFactor() * stdDev;

        List<CostAnomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < costs.length; i++) {
            CostObservation day = series.get(i);
            double cost = day.getDailyCost();
            if (cost <= threshold) {
                continue;
            }
            anomalies.add(CostAnomaly.builder()
                    .anomalyDate(day.getDate())
                    .detectedAt(context.getDetectedAt())
                    .type(AnomalyType.SPIKE_COST)
                    .severity(cost > threshold * settings.getHighThresholdMultiplier()
                            ? AnomalySeverity.HIGH
                            : AnomalySeverity.MEDIUM)
                    .title("Cost spike detected on " + DAY.format(day.getDate()))
                    .description(String.format(Locale.ROOT,
                            "Daily cost of $%.2f significantly exceeds normal pattern", cost))
                    .expectedCost(mean)
                    .actualCost(cost)
                    .anomalyScore(Math.min(1.0, (cost - threshold) / threshold))
                    .detectionMethod(getMethodName())
                    .confidence(settings.getConfidence())
                    .affectedServices(servicesAbove(day, settings.getServiceShareThreshold(), mean))
                    .possibleCauses(PossibleCauses.STATISTICAL)
                    .build());
        }
        return anomalies;
    }
}

package com.costsentinel.core.detection;

import com.costsentinel.core.config.SeasonalSettings;
import com.costsentinel.core.math.SeasonalDecomposition;
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
 * Seasonal-decomposition detector.
 *
 * <p>
 * Splits the series into trend, a repeating {@code period}-slot profile and a
 * residual, then flags residuals beyond the robust threshold
 * {@code median(|r|) + madMultiplier × MAD(r)}.
 * </p>
 *
 * <p>
 * Residuals within {@value #TOLERANCE} of zero (scaled by the mean daily cost)
 * are rounding noise and never flagged, so an exactly repeating pattern yields no
 * anomalies.
 * </p>
 *
 * @since 1.0.0
 */
public class SeasonalResidualDetector extends AbstractCostDetector {

    private static final Logger LOG = LoggerFactory.getLogger(SeasonalResidualDetector.class);

    public static final String METHOD = "Seasonal Decomposition";

    static final double TOLERANCE = 1e-9;

    private final SeasonalSettings settings;

    /**
     * @param settings detector parameters; must not be {@code null}
     */
    public SeasonalResidualDetector(SeasonalSettings settings) {
        super(METHOD, Objects.requireNonNull(settings, "SeasonalSettings must not be null").getMinObservations());
        this.settings = settings;
    }

    @Override
    List<CostAnomaly> findAnomalies(List<CostObservation> series, double[] costs, DetectionContext context) {
        SeasonalDecomposition decomposition = SeasonalDecomposition.decompose(costs, settings.getPeriod());
        double[] residuals = decomposition.residuals();
        double threshold = Statistics.median(Statistics.absolute(residuals))
                + settings.getMadMultiplier() * Statistics.medianAbsoluteDeviation(residuals);
        double noiseFloor = TOLERANCE * Math.max(1.0, Statistics.mean(costs));

        LOG.debug("Seasonal residual threshold={} noiseFloor={}", threshold, noiseFloor);

        List<CostAnomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < costs.length; i++) {
            double residual = residuals[i];
            double magnitude = Math.abs(residual);
            if (magnitude <= threshold || magnitude <= noiseFloor) {
                continue;
            }

            CostObservation day = series.get(i);
            double expected = day.getDailyCost() - residual;

            anomalies.add(CostAnomaly.builder()
                    .anomalyDate(day.getDate())
                    .detectedAt(context.getDetectedAt())
                    .type(residual > 0 ? AnomalyType.SEASONAL_DEVIATION : AnomalyType.UNEXPECTED_DECREASE)
                    .severity(magnitude > settings.getHighThresholdMultiplier() * threshold
                            ? AnomalySeverity.HIGH
                            : AnomalySeverity.MEDIUM)
                    .title("Seasonal: Pattern deviation on " + DAY.format(day.getDate()))
                    .description("Cost deviates from expected seasonal pattern")
                    .expectedCost(expected)
                    .actualCost(day.getDailyCost())
                    .anomalyScore(threshold > 0 ? Math.min(1.0, magnitude / threshold) : 1.0)
                    .detectionMethod(METHOD)
                    .confidence(settings.getConfidence())
                    .seasonalComponent(decomposition.seasonalAt(i))
                    .trendComponent(decomposition.trendAt(i))
                    .affectedServices(topServices(day, settings.getTopServices()))
                    .possibleCauses(PossibleCauses.SEASONAL)
                    .build());
        }
        return anomalies;
    }
}

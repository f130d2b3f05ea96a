package com.costsentinel.core.detection;

import com.costsentinel.core.config.ForecastSettings;
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
 * Rolling-forecast detector.
 *
 * <p>
 * For every day after the first full window, forecasts the cost as the window
 * mean plus its linear drift {@code (last - first) / window}, with a normal band
 * of {@code confidenceQuantile × σ} on either side. A day is anomalous when its
 * residual exceeds {@code bandMultiplier} band half-widths.
 * </p>
 *
 * <p>
 * A window with zero variance has no band; days following it are skipped.
 * </p>
 *
 * @since 1.0.0
 */
public class ForecastDeviationDetector extends AbstractCostDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ForecastDeviationDetector.class);

    public static final String METHOD = "ARIMA Time Series";

    private final ForecastSettings settings;

    /**
     * @param settings detector parameters; must not be {@code null}
     */
    public ForecastDeviationDetector(ForecastSettings settings) {
        super(METHOD, Objects.requireNonNull(settings, "ForecastSettings must not be null").getMinObservations());
        this.settings = settings;
    }

    @Override
    List<CostAnomaly> findAnomalies(List<CostObservation> series, double[] costs, DetectionContext context) {
        int window = Math.min(settings.getWindowSize(), costs.length);
        List<CostAnomaly> anomalies = new ArrayList<>();

        for (int i = window; i < costs.length; i++) {
            int from = i - window;
            double mean = Statistics.mean(costs, from, i);
            double drift = (costs[i - 1] - costs[from]) / window;
            double stdDev = Statistics.standardDeviation(costs, from, i);
            if (stdDev == 0) {
                LOG.trace("Forecast window ending {} has zero variance, skipping", series.get(i).getDate());
                continue;
            }

            double forecast = mean + drift;
            double halfWidth = settings.getConfidenceQuantile() * stdDev;
            double threshold = settings.getBandMultiplier() * halfWidth;
            double residual = Math.abs(costs[i] - forecast);
            if (residual <= threshold) {
                continue;
            }

            CostObservation day = series.get(i);
            LOG.debug("Forecast residual {} > {} on {}", residual, threshold, day.getDate());

            anomalies.add(CostAnomaly.builder()
                    .anomalyDate(day.getDate())
                    .detectedAt(context.getDetectedAt())
                    .type(day.getDailyCost() > forecast ? AnomalyType.SPIKE_COST : AnomalyType.UNEXPECTED_DECREASE)
                    .severity(residual > settings.getHighBandMultiplier() * halfWidth
                            ? AnomalySeverity.HIGH
                            : AnomalySeverity.MEDIUM)
                    .title("ARIMA: Forecasting anomaly on " + DAY.format(day.getDate()))
                    .description("Actual cost deviates significantly from time series forecast")
                    .expectedCost(forecast)
                    .actualCost(day.getDailyCost())
                    .anomalyScore(Math.min(1.0, residual / threshold))
                    .detectionMethod(METHOD)
                    .confidence(settings.getConfidence())
                    .forecastedRange(String.format(Locale.ROOT, "$%.2f - $%.2f",
                            forecast - halfWidth, forecast + halfWidth))
                    .affectedServices(topServices(day, settings.getTopServices()))
                    .possibleCauses(PossibleCauses.forDeviation(day, forecast))
                    .build());
        }
        return anomalies;
    }
}

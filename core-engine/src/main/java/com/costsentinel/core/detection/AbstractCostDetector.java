package com.costsentinel.core.detection;

import com.costsentinel.core.model.CostAnomaly;
import com.costsentinel.core.model.CostObservation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base class handling what every detector shares: the minimum-length gate,
 * count logging and the affected-service selection.
 *
 * @since 1.0.0
 */
abstract class AbstractCostDetector implements CostAnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractCostDetector.class);

    static final DateTimeFormatter DAY = DateTimeFormatter.ISO_LOCAL_DATE;

    private final String methodName;
    private final int minimumObservations;

    AbstractCostDetector(String methodName, int minimumObservations) {
        this.methodName = Objects.requireNonNull(methodName, "methodName must not be null");
        this.minimumObservations = minimumObservations;
    }

    @Override
    public final List<CostAnomaly> detect(List<CostObservation> series, DetectionContext context) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(context, "context must not be null");

        if (series.size() < minimumObservations) {
            LOG.debug("[{}] skipped: {} observation(s), needs {}",
                    methodName, series.size(), minimumObservations);
            return List.of();
        }

        double[] costs = new double[series.size()];
        for (int i = 0; i < costs.length; i++) {
            costs[i] = series.get(i).getDailyCost();
        }

        List<CostAnomaly> anomalies = findAnomalies(series, costs, context);
        LOG.info("{} detected {} anomalies", methodName, anomalies.size());
        return anomalies;
    }

    /**
     * Run the detector on a series that is long enough.
     *
     * @param series  observations
     * @param costs   daily costs, index-aligned with {@code series}
     * @param context run context
     * @return anomalies in series order
     */
    abstract List<CostAnomaly> findAnomalies(List<CostObservation> series, double[] costs, DetectionContext context);

    @Override
    public String getMethodName() {
        return methodName;
    }

    @Override
    public int getMinimumObservations() {
        return minimumObservations;
    }

    // ---------------------------------------------------------------
    // Affected services
    // ---------------------------------------------------------------

    /**
     * @return the {@code limit} most expensive services of the day, descending
     */
    static List<String> topServices(CostObservation observation, int limit) {
        return observation.getServiceCosts().entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder()))
                .limit(limit)
                .map(Map.Entry::getKey)
                .toList();
    }

    /**
     * @return services costing more than {@code share × base}, descending
     */
    static List<String> servicesAbove(CostObservation observation, double share, double base) {
        double floor = base * share;
        return observation.getServiceCosts().entrySet().stream()
                .filter(e -> e.getValue() > floor)
                .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder()))
                .map(Map.Entry::getKey)
                .toList();
    }
}

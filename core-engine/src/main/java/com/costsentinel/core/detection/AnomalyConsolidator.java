package com.costsentinel.core.detection;

import com.costsentinel.core.config.ConsolidationSettings;
import com.costsentinel.core.model.CostAnomaly;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Merges the findings of several detectors into one anomaly per date.
 *
 * <p>
 * A date reported once passes through untouched. A date reported by {@code k > 1}
 * detectors is represented by its most confident finding, relabelled as a
 * multi-algorithm finding, with confidence raised by
 * {@code agreementBoost × (k - 1)} (capped at {@code maxConfidence}) and the
 * anomaly score replaced by the mean of all {@code k} scores.
 * </p>
 *
 * <p>
 * Nothing is filtered. The result is ordered by confidence, highest first; ties
 * keep the order in which dates were first reported.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyConsolidator {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyConsolidator.class);

    public static final String METHOD_PREFIX = "Multi-algorithm";

    private final ConsolidationSettings settings;

    /**
     * @param settings merge parameters; must not be {@code null}
     */
    public AnomalyConsolidator(ConsolidationSettings settings) {
        this.settings = Objects.requireNonNull(settings, "ConsolidationSettings must not be null");
    }

    /**
     * @param anomalies concatenated detector output; must not be {@code null}
     * @return one anomaly per date, highest confidence first
     */
    public List<CostAnomaly> consolidate(List<CostAnomaly> anomalies) {
        Objects.requireNonNull(anomalies, "anomalies must not be null");

        Map<LocalDate, List<CostAnomaly>> byDate = new LinkedHashMap<>();
        for (CostAnomaly anomaly : anomalies) {
            byDate.computeIfAbsent(anomaly.getAnomalyDate(), d -> new ArrayList<>()).add(anomaly);
        }

        List<CostAnomaly> consolidated = new ArrayList<>(byDate.size());
        for (List<CostAnomaly> findings : byDate.values()) {
            consolidated.add(findings.size() == 1 ? findings.get(0) : merge(findings));
        }
        consolidated.sort(Comparator.comparingDouble(CostAnomaly::getConfidence).reversed());

        LOG.debug("Consolidated {} finding(s) into {} anomalies", anomalies.size(), consolidated.size());
        return consolidated;
    }

    private CostAnomaly merge(List<CostAnomaly> findings) {
        CostAnomaly best = findings.get(0);
        double scoreSum = 0;
        for (CostAnomaly finding : findings) {
            if (finding.getConfidence() > best.getConfidence()) {
                best = finding;
            }
            scoreSum += finding.getAnomalyScore();
        }

        List<String> methods = findings.stream().map(CostAnomaly::getDetectionMethod).toList();
        String methodList = String.join(", ", methods);
        int agreement = findings.size();
        double confidence = Math.min(settings.getMaxConfidence(),
                best.getConfidence() + settings.getAgreementBoost() * (agreement - 1));

        return best.toBuilder()
                .title(METHOD_PREFIX + ": Anomaly on " + AbstractCostDetector.DAY.format(best.getAnomalyDate()))
                .description("Detected by " + agreement + " algorithms: " + methodList)
                .detectionMethod(METHOD_PREFIX + " (" + methodList + ")")
                .confidence(confidence)
                .anomalyScore(scoreSum / agreement)
                .build();
    }
}

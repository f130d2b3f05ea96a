package com.costsentinel.core.detection;

import com.costsentinel.core.model.CostAnomaly;
import com.costsentinel.core.model.CostObservation;

import java.util.List;

/**
 * Contract for all cost-anomaly detectors.
 *
 * <p>
 * Implementations are <strong>stateless</strong> with respect to the analysed
 * series: every call to {@link #detect(List, DetectionContext)} looks at the whole
 * series afresh and only reads it, so one instance may serve concurrent calls.
 * </p>
 *
 * <p>
 * A series shorter than {@link #getMinimumObservations()} is not an error; the
 * detector simply reports nothing.
 * </p>
 */
public interface CostAnomalyDetector {

    /**
     * Analyse a date-ordered series and report the anomalous days.
     *
     * @param series  strictly date-ordered observations; not modified
     * @param context evaluation time and window of this run
     * @return anomalies in series order, possibly empty; never {@code null}
     */
    List<CostAnomaly> detect(List<CostObservation> series, DetectionContext context);

    /**
     * Return the human-readable name of the detection method, as written to
     * {@link CostAnomaly#getDetectionMethod()}.
     *
     * @return method name
     */
    String getMethodName();

    /**
     * @return smallest series length this detector analyses
     */
    int getMinimumObservations();
}

package com.costsentinel.core.model;

/**
 * Severity of a cost anomaly, relative to the threshold of the detector that raised it.
 *
 * @since 1.0.0
 */
public enum AnomalySeverity {
    MEDIUM,
    HIGH
}

package com.costsentinel.core.model;

/**
 * Classification of a detected cost anomaly.
 *
 * @since 1.0.0
 */
public enum AnomalyType {

    /** Cost jumped well above what the detector expected. */
    SPIKE_COST,

    /** Cost is higher than expected without a dedicated spike classification. */
    UNEXPECTED_INCREASE,

    /** Cost fell below what the detector expected. */
    UNEXPECTED_DECREASE,

    /** Cost does not match the repeating weekly profile. */
    SEASONAL_DEVIATION
}

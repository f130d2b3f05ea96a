/**
 * Numerical building blocks shared by the detectors: descriptive statistics,
 * isolation forest scoring, DBSCAN clustering and seasonal decomposition.
 *
 * @since 1.0.0
 */
package com.costsentinel.core.math;

/**
 * Domain model classes for Cost Sentinel.
 *
 * <ul>
 * <li>{@link com.costsentinel.core.model.CostObservation}: one day of spend
 * with its per-service breakdown</li>
 * <li>{@link com.costsentinel.core.model.CostAnomaly}: an anomalous day
 * reported by a detector or by consolidation</li>
 * <li>{@link com.costsentinel.core.model.AnomalySummary}: aggregate counts
 * over a result list</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.costsentinel.core.model;

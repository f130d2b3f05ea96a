/**
 * Cost-anomaly detectors and the consolidation stage.
 *
 * <p>
 * All detectors implement the
 * {@link com.costsentinel.core.detection.CostAnomalyDetector}
 * interface and are instantiated via
 * {@link com.costsentinel.core.detection.DetectorFactory}.
 * Built-in detector types:
 * </p>
 * <ul>
 * <li>{@code isolation}: {@link com.costsentinel.core.detection.IsolationOutlierDetector},
 * isolation forest over daily cost</li>
 * <li>{@code density}: {@link com.costsentinel.core.detection.DensityOutlierDetector},
 * DBSCAN noise points</li>
 * <li>{@code forecast}: {@link com.costsentinel.core.detection.ForecastDeviationDetector},
 * rolling mean + drift with a 95% band</li>
 * <li>{@code seasonal}: {@link com.costsentinel.core.detection.SeasonalResidualDetector},
 * trend + weekly profile residuals</li>
 * <li>{@code statistical}: {@link com.costsentinel.core.detection.StatisticalThresholdDetector},
 * mean + N × σ</li>
 * </ul>
 *
 * <p>
 * {@link com.costsentinel.core.detection.AnomalyConsolidator} merges their
 * output into one anomaly per date.
 * </p>
 *
 * @since 1.0.0
 */
package com.costsentinel.core.detection;

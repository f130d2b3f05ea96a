/**
 * Detection engine entry point.
 *
 * <p>
 * {@link com.costsentinel.core.engine.CostAnomalyEngine} fans a cost series out
 * to every configured detector, joins their findings and consolidates them into
 * one ranked anomaly per date.
 * </p>
 *
 * @since 1.0.0
 */
package com.costsentinel.core.engine;

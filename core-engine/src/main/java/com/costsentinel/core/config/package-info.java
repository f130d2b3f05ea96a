/**
 * Configuration loading and validation for the detection engine.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.costsentinel.core.config.DetectionSettingsLoader} into a
 * {@link com.costsentinel.core.config.DetectionSettings} tree. Validation
 * runs automatically after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.costsentinel.core.config;

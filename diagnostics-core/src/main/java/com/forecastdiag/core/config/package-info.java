/**
 * Loading and validation of analysis defaults.
 *
 * <p>
 * Defaults are defined in YAML and loaded by
 * {@link com.forecastdiag.core.config.AnalysisConfigLoader} into an
 * {@link com.forecastdiag.core.config.AnalysisConfig} instance. Validation
 * runs automatically after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.forecastdiag.core.config;

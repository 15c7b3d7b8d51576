/**
 * Loading and validation of alert rule configuration.
 *
 * <p>
 * Rules are defined in YAML and loaded by
 * {@link com.millsentinel.core.config.RulesLoader} into a
 * {@link com.millsentinel.core.config.RulesConfig} instance. Validation runs
 * right after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.millsentinel.core.config;

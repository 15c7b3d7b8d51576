/**
 * Domain model classes for Mill Sentinel.
 *
 * <p>
 * This package contains the value types shared by every analysis:
 * </p>
 * <ul>
 * <li>{@link com.millsentinel.core.model.Reading} — one immutable mill
 * observation</li>
 * <li>{@link com.millsentinel.core.model.MillField} — the numeric sensor
 * channels</li>
 * <li>{@link com.millsentinel.core.model.AlertRule} and
 * {@link com.millsentinel.core.model.AlertCondition} — alert rule
 * configuration POJOs</li>
 * <li>{@link com.millsentinel.core.model.Alert} and
 * {@link com.millsentinel.core.model.AlertGroup} — alerting output</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.millsentinel.core.model;

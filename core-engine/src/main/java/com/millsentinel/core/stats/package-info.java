/**
 * Descriptive statistics over reading collections.
 *
 * <ul>
 * <li>{@link com.millsentinel.core.stats.QuantileEngine} — order-statistic
 * quartiles and median</li>
 * <li>{@link com.millsentinel.core.stats.MomentEngine} — mean, variance,
 * skewness and kurtosis</li>
 * <li>{@link com.millsentinel.core.stats.CorrelationAnalyzer} — Pearson
 * correlation</li>
 * <li>{@link com.millsentinel.core.stats.FieldGrouping} — grouped means</li>
 * </ul>
 *
 * <p>
 * Every entry point is a static, side-effect-free function of its arguments
 * and is safe to call from any number of threads on the same readings.
 * </p>
 *
 * @since 1.0.0
 */
package com.millsentinel.core.stats;

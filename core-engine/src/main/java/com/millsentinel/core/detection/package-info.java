/**
 * Outlier and alert detection over reading collections.
 *
 * <p>
 * Alert rules are turned into
 * {@link com.millsentinel.core.detection.AlertDetector}s by
 * {@link com.millsentinel.core.detection.AlertDetectorFactory}:
 * </p>
 * <ul>
 * <li>{@link com.millsentinel.core.detection.ThresholdAlertDetector} — one
 * alert per flagged reading</li>
 * <li>{@link com.millsentinel.core.detection.GroupedThresholdAlertDetector} —
 * flagged value combinations with occurrence counts</li>
 * </ul>
 *
 * <p>
 * {@link com.millsentinel.core.detection.IqrOutlierDetector} flags readings
 * outside interquartile fences and
 * {@link com.millsentinel.core.detection.RunningHoursMonitor} reports
 * operating points due for maintenance.
 * </p>
 *
 * @since 1.0.0
 */
package com.millsentinel.core.detection;

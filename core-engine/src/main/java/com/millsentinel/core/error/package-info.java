/**
 * Error taxonomy of the analysis engine.
 *
 * <p>
 * Every unchecked exception here extends
 * {@link com.millsentinel.core.error.AnalysisException} and is scoped to a
 * single statistic, field or bucket. Timestamp parse failures are checked and
 * handled internally by exclusion.
 * </p>
 *
 * @since 1.0.0
 */
package com.millsentinel.core.error;

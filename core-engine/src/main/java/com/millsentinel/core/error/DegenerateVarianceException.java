package com.millsentinel.core.error;

import com.millsentinel.core.model.MillField;

/**
 * Thrown when a statistic is undefined because a field has zero variance
 * (every value identical), e.g. skewness or kurtosis.
 *
 * @since 1.0.0
 */
public class DegenerateVarianceException extends AnalysisException {

    private static final long serialVersionUID = 1L;

    private final MillField field;

    public DegenerateVarianceException(MillField field, String message) {
        super(message);
        this.field = field;
    }

    /**
     * @return the field whose variance is zero
     */
    public MillField getField() {
        return field;
    }
}

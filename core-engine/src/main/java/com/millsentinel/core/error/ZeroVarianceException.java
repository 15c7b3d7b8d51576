package com.millsentinel.core.error;

import com.millsentinel.core.model.MillField;

/**
 * Thrown by correlation analysis when one of the two fields is constant, so
 * the Pearson denominator is zero.
 *
 * @since 1.0.0
 */
public class ZeroVarianceException extends DegenerateVarianceException {

    private static final long serialVersionUID = 1L;

    public ZeroVarianceException(MillField field, String message) {
        super(field, message);
    }
}

package com.millsentinel.core.error;

/**
 * Thrown when a period-over-period change is computed against a previous
 * value of exactly zero.
 *
 * @since 1.0.0
 */
public class DivisionByZeroException extends AnalysisException {

    private static final long serialVersionUID = 1L;

    public DivisionByZeroException(String message) {
        super(message);
    }
}

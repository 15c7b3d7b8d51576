package com.millsentinel.core.error;

/**
 * Thrown when there are no readings (or no values for the requested field)
 * to analyze.
 *
 * @since 1.0.0
 */
public class EmptyInputException extends AnalysisException {

    private static final long serialVersionUID = 1L;

    public EmptyInputException(String message) {
        super(message);
    }
}

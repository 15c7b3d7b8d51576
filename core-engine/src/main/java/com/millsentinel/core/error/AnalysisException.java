package com.millsentinel.core.error;

/**
 * Base class for conditions that make a single statistic, field or bucket
 * impossible to compute.
 *
 * <p>
 * These are local to one analysis: they are never retried and never abort
 * sibling computations. Callers must report them distinctly from a valid
 * zero or empty result.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class AnalysisException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected AnalysisException(String message) {
        super(message);
    }

    protected AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}

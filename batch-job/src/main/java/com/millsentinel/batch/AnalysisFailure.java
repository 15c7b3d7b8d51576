package com.millsentinel.batch;

import java.util.Objects;

/**
 * An analysis that did not produce a result, recorded in place of it.
 *
 * @since 1.0.0
 */
public final class AnalysisFailure {

    private final String analysis;
    private final String type;
    private final String message;

    public AnalysisFailure(String analysis, Throwable cause) {
        this.analysis = Objects.requireNonNull(analysis, "Analysis name must not be null");
        Objects.requireNonNull(cause, "Cause must not be null");
        this.type = cause.getClass().getSimpleName();
        this.message = cause.getMessage();
    }

    public String getAnalysis() {
        return analysis;
    }

    /**
     * @return simple class name of the exception, e.g.
     *         {@code EmptyInputException}
     */
    public String getType() {
        return type;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return analysis + ": " + type + ": " + message;
    }
}

package com.millsentinel.core.error;

/**
 * Thrown when a reading timestamp does not match the {@code MM/DD/YYYY HH:MM}
 * format.
 *
 * <p>
 * Checked on purpose: the only caller that sees it is
 * {@link com.millsentinel.core.model.MillTimestamps#tryParse(String)}, which
 * turns it into an exclusion. It never escapes an analysis.
 * </p>
 *
 * @since 1.0.0
 */
public class UnparsableTimestampException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String text;

    public UnparsableTimestampException(String text, Throwable cause) {
        super("Unparsable timestamp: '" + text + "'", cause);
        this.text = text;
    }

    /**
     * @return the offending timestamp text, possibly {@code null}
     */
    public String getText() {
        return text;
    }
}

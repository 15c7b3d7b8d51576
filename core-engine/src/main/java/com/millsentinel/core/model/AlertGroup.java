package com.millsentinel.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregated alert: one distinct combination of tested field values and the
 * number of readings that showed it.
 *
 * @since 1.0.0
 */
public final class AlertGroup {

    private final String ruleName;
    private final Map<MillField, Double> values;
    private final long occurrences;

    public AlertGroup(String ruleName, Map<MillField, Double> values, long occurrences) {
        this.ruleName = Objects.requireNonNull(ruleName, "ruleName must not be null");
        this.values = Collections.unmodifiableMap(new EnumMap<>(
                Objects.requireNonNull(values, "values must not be null")));
        if (occurrences < 1) {
            throw new IllegalArgumentException("occurrences must be >= 1, got: " + occurrences);
        }
        this.occurrences = occurrences;
    }

    public String getRuleName() {
        return ruleName;
    }

    public Map<MillField, Double> getValues() {
        return values;
    }

    public long getOccurrences() {
        return occurrences;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertGroup that))
            return false;
        return occurrences == that.occurrences
                && ruleName.equals(that.ruleName)
                && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ruleName, values, occurrences);
    }

    @Override
    public String toString() {
        return "AlertGroup{" +
                "ruleName='" + ruleName + '\'' +
                ", values=" + values +
                ", occurrences=" + occurrences +
                '}';
    }
}

package com.millsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Alert raised when a reading satisfies an alert rule.
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code ruleName} is required; omitting it throws
 * a {@link NullPointerException} at build time. The timestamp is the
 * reading's timestamp text and may be {@code null} for readings recorded
 * without one.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Alert {

    /** Name of the alert rule that fired. */
    private final String ruleName;

    /** Timestamp text of the flagged reading. */
    private final String timestamp;

    /** Human-readable description of what was detected. */
    private final String details;

    /** Copy of the tested field values of the flagged reading. */
    private final Map<MillField, Double> values;

    private Alert(Builder builder) {
        this.ruleName = Objects.requireNonNull(builder.ruleName, "ruleName must not be null");
        this.timestamp = builder.timestamp;
        this.details = builder.details;
        this.values = builder.values.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(builder.values));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Alert} instances.
     */
    public static class Builder {
        private String ruleName;
        private String timestamp;
        private String details;
        private Map<MillField, Double> values = Collections.emptyMap();

        public Builder ruleName(String ruleName) {
            this.ruleName = ruleName;
            return this;
        }

        public Builder timestamp(String timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder details(String details) {
            this.details = details;
            return this;
        }

        public Builder values(Map<MillField, Double> values) {
            this.values = values != null ? values : Collections.emptyMap();
            return this;
        }

        /**
         * @return a new {@link Alert}
         * @throws NullPointerException if {@code ruleName} is {@code null}
         */
        public Alert build() {
            return new Alert(this);
        }
    }

    public String getRuleName() {
        return ruleName;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public String getDetails() {
        return details;
    }

    /**
     * @return unmodifiable map of the tested field values
     */
    public Map<MillField, Double> getValues() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return Objects.equals(ruleName, alert.ruleName)
                && Objects.equals(timestamp, alert.timestamp)
                && Objects.equals(values, alert.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ruleName, timestamp, values);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "ruleName='" + ruleName + '\'' +
                ", timestamp='" + timestamp + '\'' +
                ", details='" + details + '\'' +
                '}';
    }
}

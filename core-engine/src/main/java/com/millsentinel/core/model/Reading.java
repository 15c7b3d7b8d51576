package com.millsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One timestamped observation of the cement mill.
 *
 * <p>
 * Readings are immutable. The timestamp text is kept verbatim; the parsed
 * {@link LocalDateTime} is absent when the text does not match the historian
 * format, in which case the reading still takes part in every analysis that
 * does not bucket by time.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}, or {@link #fromColumns(Map)} for a raw record keyed
 * by historian column name. Numeric values may arrive as any {@link Number}
 * or as numeric strings; blank, non-numeric and non-finite values are treated
 * as absent.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"timestamp", "values"})
public final class Reading {

    /**
     * Orders readings by parsed timestamp, oldest first. Readings without a
     * parsable timestamp sort last.
     */
    public static final Comparator<Reading> CHRONOLOGICAL = Comparator.comparing(
            Reading::getTimestamp, Comparator.nullsLast(Comparator.naturalOrder()));

    /** Newest first, unparsable timestamps last. */
    public static final Comparator<Reading> MOST_RECENT_FIRST = Comparator.comparing(
            Reading::getTimestamp, Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()));

    private final String rawTimestamp;
    private final LocalDateTime timestamp;
    private final Map<MillField, Double> values;

    private Reading(Builder builder) {
        this.rawTimestamp = builder.rawTimestamp;
        this.timestamp = builder.timestamp;
        this.values = Collections.unmodifiableMap(new EnumMap<>(builder.values));
    }

    // ---------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Build a reading from a record keyed by historian column name
     * ({@code "Date & Time"}, {@code "Mill TPH"}, ...). Constant names such as
     * {@code MILL_TPH} are accepted too. Unknown columns are ignored.
     *
     * @param columns raw column values; must not be {@code null}
     * @return the reading
     */
    public static Reading fromColumns(Map<String, ?> columns) {
        Objects.requireNonNull(columns, "Columns must not be null");
        Builder builder = builder();
        for (Map.Entry<String, ?> entry : columns.entrySet()) {
            String column = entry.getKey();
            if (column == null) {
                continue;
            }
            if (MillField.TIMESTAMP_COLUMN.equalsIgnoreCase(column.trim())) {
                Object raw = entry.getValue();
                builder.timestamp(raw == null ? null : raw.toString());
            } else if (MillField.isKnown(column)) {
                builder.value(MillField.fromName(column), toDouble(entry.getValue()));
            }
        }
        return builder.build();
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    /**
     * @return the timestamp text as recorded, possibly {@code null}
     */
    @JsonProperty("timestamp")
    public String getRawTimestamp() {
        return rawTimestamp;
    }

    /**
     * @return the parsed timestamp, or {@code null} if missing or unparsable
     */
    @JsonIgnore
    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    /**
     * @return unmodifiable map of the fields present on this reading
     */
    public Map<MillField, Double> getValues() {
        return values;
    }

    /**
     * @param field the field to read
     * @return the value, or empty if the field was not recorded
     */
    public Optional<Double> getNumericField(MillField field) {
        return Optional.ofNullable(values.get(field));
    }

    /**
     * @param field the field to check
     * @return {@code true} if a value is recorded for {@code field}
     */
    public boolean has(MillField field) {
        return values.containsKey(field);
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link Reading} instances. {@code null}, NaN and
     * infinite values are recorded as absent.
     */
    public static class Builder {
        private String rawTimestamp;
        private LocalDateTime timestamp;
        private final Map<MillField, Double> values = new EnumMap<>(MillField.class);

        /**
         * Set the timestamp from historian text. Unparsable text is kept
         * verbatim with no parsed timestamp.
         */
        public Builder timestamp(String text) {
            this.rawTimestamp = text;
            this.timestamp = MillTimestamps.tryParse(text).orElse(null);
            return this;
        }

        public Builder timestamp(LocalDateTime dateTime) {
            this.timestamp = dateTime;
            this.rawTimestamp = dateTime != null ? MillTimestamps.format(dateTime) : null;
            return this;
        }

        public Builder value(MillField field, Double value) {
            Objects.requireNonNull(field, "Field must not be null");
            if (value == null || !Double.isFinite(value)) {
                values.remove(field);
            } else {
                values.put(field, value);
            }
            return this;
        }

        public Reading build() {
            return new Reading(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static Double toDouble(Object raw) {
        if (raw instanceof Number n) {
            return n.doubleValue();
        }
        if (raw instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Reading that))
            return false;
        return Objects.equals(rawTimestamp, that.rawTimestamp) && Objects.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rawTimestamp, values);
    }

    @Override
    public String toString() {
        return "Reading{" +
                "timestamp='" + rawTimestamp + '\'' +
                ", values=" + values +
                '}';
    }
}

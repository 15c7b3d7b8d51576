package com.millsentinel.core.trend;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Trailing mean at one reading.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RollingPoint {

    private final String timestamp;
    private final Double mean;
    private final int windowSize;

    RollingPoint(String timestamp, Double mean, int windowSize) {
        this.timestamp = timestamp;
        this.mean = mean;
        this.windowSize = windowSize;
    }

    /**
     * @return timestamp text of the reading the window ends at
     */
    public String getTimestamp() {
        return timestamp;
    }

    /**
     * @return the window mean, or {@code null} if no reading in the window
     *         carried the field
     */
    public Double getMean() {
        return mean;
    }

    public OptionalDouble mean() {
        return mean == null ? OptionalDouble.empty() : OptionalDouble.of(mean);
    }

    /**
     * @return number of readings covered, smaller than the configured size at
     *         the start of the series
     */
    public int getWindowSize() {
        return windowSize;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RollingPoint that))
            return false;
        return windowSize == that.windowSize
                && Objects.equals(timestamp, that.timestamp)
                && Objects.equals(mean, that.mean);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, mean, windowSize);
    }

    @Override
    public String toString() {
        return "RollingPoint{" + timestamp + ", mean=" + mean + ", window=" + windowSize + '}';
    }
}

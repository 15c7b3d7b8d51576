package com.millsentinel.core.trend;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.YearMonth;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Month-over-month change of one metric.
 *
 * <p>
 * {@link #getGrowthPercent()} is {@code null} unless the status is
 * {@link GrowthStatus#DEFINED}; an absent growth is never reported as zero.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class MonthlyGrowth {

    private final YearMonth month;
    private final String metric;
    private final Double value;
    private final Double previousValue;
    private final Double growthPercent;
    private final GrowthStatus status;

    MonthlyGrowth(YearMonth month, String metric, Double value, Double previousValue,
            Double growthPercent, GrowthStatus status) {
        this.month = Objects.requireNonNull(month, "Month must not be null");
        this.metric = Objects.requireNonNull(metric, "Metric must not be null");
        this.value = value;
        this.previousValue = previousValue;
        this.growthPercent = growthPercent;
        this.status = Objects.requireNonNull(status, "Status must not be null");
    }

    public YearMonth getMonth() {
        return month;
    }

    public String getMetric() {
        return metric;
    }

    public Double getValue() {
        return value;
    }

    public Double getPreviousValue() {
        return previousValue;
    }

    public Double getGrowthPercent() {
        return growthPercent;
    }

    public OptionalDouble growthPercent() {
        return growthPercent == null ? OptionalDouble.empty() : OptionalDouble.of(growthPercent);
    }

    public GrowthStatus getStatus() {
        return status;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MonthlyGrowth that))
            return false;
        return month.equals(that.month)
                && metric.equals(that.metric)
                && Objects.equals(value, that.value)
                && Objects.equals(previousValue, that.previousValue)
                && Objects.equals(growthPercent, that.growthPercent)
                && status == that.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(month, metric, value, previousValue, growthPercent, status);
    }

    @Override
    public String toString() {
        return "MonthlyGrowth{" + month + " " + metric +
                ", value=" + value +
                ", previous=" + previousValue +
                ", growth=" + growthPercent +
                ", status=" + status +
                '}';
    }
}

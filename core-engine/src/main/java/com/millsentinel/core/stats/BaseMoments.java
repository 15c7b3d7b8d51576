package com.millsentinel.core.stats;

import com.millsentinel.core.model.MillField;

import java.util.Objects;

/**
 * Count, mean, extremes and population variance of one field.
 *
 * <p>
 * Produced by {@link MomentEngine#baseMoments} and handed to the shape
 * statistics so that the mean and variance are computed once per field.
 * </p>
 *
 * @since 1.0.0
 */
public final class BaseMoments {

    private final MillField field;
    private final long count;
    private final double mean;
    private final double min;
    private final double max;
    private final double variance;

    public BaseMoments(MillField field, long count, double mean, double min, double max, double variance) {
        this.field = Objects.requireNonNull(field, "Field must not be null");
        if (count < 1) {
            throw new IllegalArgumentException("count must be >= 1, got: " + count);
        }
        if (variance < 0) {
            throw new IllegalArgumentException("variance must be >= 0, got: " + variance);
        }
        this.count = count;
        this.mean = mean;
        this.min = min;
        this.max = max;
        this.variance = variance;
    }

    public MillField getField() {
        return field;
    }

    public long getCount() {
        return count;
    }

    public double getMean() {
        return mean;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    /** Population variance (divided by N). */
    public double getVariance() {
        return variance;
    }

    public double getStdDev() {
        return Math.sqrt(variance);
    }

    public boolean isDegenerate() {
        return variance == 0;
    }

    @Override
    public String toString() {
        return "BaseMoments{" +
                "field=" + field +
                ", count=" + count +
                ", mean=" + mean +
                ", min=" + min +
                ", max=" + max +
                ", variance=" + variance +
                '}';
    }
}

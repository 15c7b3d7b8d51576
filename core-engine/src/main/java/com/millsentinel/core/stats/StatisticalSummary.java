package com.millsentinel.core.stats;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.millsentinel.core.error.DegenerateVarianceException;
import com.millsentinel.core.model.MillField;

import java.util.Objects;

/**
 * Descriptive statistics of one field over one reading collection.
 *
 * <p>
 * Skewness and kurtosis are {@code null} when the field has zero variance.
 * Use {@link #requireSkewness()} / {@link #requireKurtosis()} to have that
 * case raised as a {@link DegenerateVarianceException} instead.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"field", "count", "mean", "min", "max", "variance", "stdDev",
        "skewness", "kurtosis", "degenerate"})
public final class StatisticalSummary {

    private final BaseMoments moments;
    private final Double skewness;
    private final Double kurtosis;

    StatisticalSummary(BaseMoments moments, Double skewness, Double kurtosis) {
        this.moments = Objects.requireNonNull(moments, "Moments must not be null");
        this.skewness = skewness;
        this.kurtosis = kurtosis;
    }

    public MillField getField() {
        return moments.getField();
    }

    public long getCount() {
        return moments.getCount();
    }

    public double getMean() {
        return moments.getMean();
    }

    public double getMin() {
        return moments.getMin();
    }

    public double getMax() {
        return moments.getMax();
    }

    public double getVariance() {
        return moments.getVariance();
    }

    public double getStdDev() {
        return moments.getStdDev();
    }

    /**
     * @return third standardized moment, or {@code null} if degenerate
     */
    public Double getSkewness() {
        return skewness;
    }

    /**
     * @return raw fourth standardized moment, or {@code null} if degenerate
     */
    public Double getKurtosis() {
        return kurtosis;
    }

    /**
     * @return {@code true} when the variance is zero and the shape
     *         statistics are undefined
     */
    public boolean isDegenerate() {
        return skewness == null;
    }

    public double requireSkewness() {
        if (skewness == null) {
            throw degenerate("skewness");
        }
        return skewness;
    }

    public double requireKurtosis() {
        if (kurtosis == null) {
            throw degenerate("kurtosis");
        }
        return kurtosis;
    }

    private DegenerateVarianceException degenerate(String statistic) {
        return new DegenerateVarianceException(getField(),
                statistic + " of " + getField() + " is undefined: variance is zero");
    }

    @Override
    public String toString() {
        return "StatisticalSummary{" +
                moments +
                ", skewness=" + skewness +
                ", kurtosis=" + kurtosis +
                '}';
    }
}

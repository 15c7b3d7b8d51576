package com.millsentinel.core.stats;

import com.millsentinel.core.model.MillField;

import java.util.Objects;

/**
 * First and third quartile of one field, with the derived IQR fences.
 *
 * @since 1.0.0
 */
public final class QuartileFrame {

    private final MillField field;
    private final double q1;
    private final double q3;

    public QuartileFrame(MillField field, double q1, double q3) {
        this.field = Objects.requireNonNull(field, "Field must not be null");
        this.q1 = q1;
        this.q3 = q3;
    }

    public MillField getField() {
        return field;
    }

    public double getQ1() {
        return q1;
    }

    public double getQ3() {
        return q3;
    }

    /**
     * @return {@code Q3 - Q1}
     */
    public double getIqr() {
        return q3 - q1;
    }

    /**
     * @param multiplier fence multiplier, conventionally 1.5
     * @return {@code Q1 - multiplier × IQR}
     */
    public double lowerFence(double multiplier) {
        return q1 - multiplier * getIqr();
    }

    /**
     * @param multiplier fence multiplier, conventionally 1.5
     * @return {@code Q3 + multiplier × IQR}
     */
    public double upperFence(double multiplier) {
        return q3 + multiplier * getIqr();
    }

    /**
     * @return {@code true} if {@code value} lies strictly outside the fences
     */
    public boolean isOutside(double value, double multiplier) {
        return value < lowerFence(multiplier) || value > upperFence(multiplier);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof QuartileFrame that))
            return false;
        return field == that.field
                && Double.compare(q1, that.q1) == 0
                && Double.compare(q3, that.q3) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, q1, q3);
    }

    @Override
    public String toString() {
        return "QuartileFrame{" + field + ": q1=" + q1 + ", q3=" + q3 + '}';
    }
}

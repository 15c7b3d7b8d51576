package com.millsentinel.core.stats;

import com.millsentinel.core.error.EmptyInputException;
import com.millsentinel.core.model.MillField;
import com.millsentinel.core.model.Reading;

import java.util.Arrays;
import java.util.List;

/**
 * Rank-based quantiles over one field of a reading collection.
 *
 * <p>
 * Quantiles are simple order statistics, not interpolated percentiles: the
 * present values are sorted ascending and the value at 1-based position
 * {@code floor(fraction × N)}, clamped to {@code [1, N]}, is returned. Fence
 * thresholds downstream were tuned against exactly this rule.
 * </p>
 *
 * @since 1.0.0
 */
public final class QuantileEngine {

    public static final double Q1_FRACTION = 0.25;
    public static final double MEDIAN_FRACTION = 0.5;
    public static final double Q3_FRACTION = 0.75;

    private QuantileEngine() {
        // utility class — not instantiable
    }

    /**
     * @param readings readings to rank
     * @param field    field to rank by
     * @param fraction rank fraction in {@code [0, 1]}
     * @return the value at the requested rank
     * @throws EmptyInputException      if no reading carries {@code field}
     * @throws IllegalArgumentException if {@code fraction} is outside {@code [0, 1]}
     */
    public static double valueAtRank(List<Reading> readings, MillField field, double fraction) {
        checkFraction(fraction);
        double[] sorted = sortedValues(readings, field);
        return sorted[rankIndex(sorted.length, fraction)];
    }

    /**
     * @return Q1 and Q3 of {@code field}, from a single ranking
     * @throws EmptyInputException if no reading carries {@code field}
     */
    public static QuartileFrame quartiles(List<Reading> readings, MillField field) {
        double[] sorted = sortedValues(readings, field);
        return new QuartileFrame(field,
                sorted[rankIndex(sorted.length, Q1_FRACTION)],
                sorted[rankIndex(sorted.length, Q3_FRACTION)]);
    }

    /**
     * @return the order-statistic median of {@code field}
     * @throws EmptyInputException if no reading carries {@code field}
     */
    public static double median(List<Reading> readings, MillField field) {
        return valueAtRank(readings, field, MEDIAN_FRACTION);
    }

    /**
     * Zero-based index of the element selected for {@code fraction} among
     * {@code n} sorted values.
     */
    static int rankIndex(int n, double fraction) {
        long position = (long) Math.floor(fraction * n);
        position = Math.max(1, Math.min(n, position));
        return (int) position - 1;
    }

    private static double[] sortedValues(List<Reading> readings, MillField field) {
        double[] values = FieldValues.of(readings, field);
        // ties are equal doubles, so stability cannot change the selected value
        Arrays.sort(values);
        return values;
    }

    private static void checkFraction(double fraction) {
        if (!(fraction >= 0 && fraction <= 1)) {
            throw new IllegalArgumentException("fraction must be in [0, 1], got: " + fraction);
        }
    }
}

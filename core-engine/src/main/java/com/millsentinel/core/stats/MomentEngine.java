package com.millsentinel.core.stats;

import com.millsentinel.core.error.DegenerateVarianceException;
import com.millsentinel.core.error.EmptyInputException;
import com.millsentinel.core.model.MillField;
import com.millsentinel.core.model.Reading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Moments of one field over a reading collection.
 *
 * <h3>Two phases</h3>
 * <ol>
 * <li>{@link #baseMoments} makes one Welford pass for count, mean, min, max
 * and population variance.</li>
 * <li>{@link #skewness} and {@link #kurtosis} make a second pass that takes
 * those base moments as a parameter.</li>
 * </ol>
 *
 * <p>
 * Variance divides by N. Kurtosis is the raw fourth standardized moment; no
 * 3 is subtracted.
 * </p>
 *
 * @since 1.0.0
 */
public final class MomentEngine {

    private static final Logger LOG = LoggerFactory.getLogger(MomentEngine.class);

    private MomentEngine() {
        // utility class — not instantiable
    }

    /**
     * @return base moments of {@code field}
     * @throws EmptyInputException if no reading carries {@code field}
     */
    public static BaseMoments baseMoments(List<Reading> readings, MillField field) {
        double[] values = FieldValues.of(readings, field);

        long n = 0;
        double mean = 0;
        double m2 = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double x : values) {
            n++;
            double delta = x - mean;
            mean += delta / n;
            m2 += delta * (x - mean);
            min = Math.min(min, x);
            max = Math.max(max, x);
        }
        // m2 can drift a hair below zero for near-constant input
        double variance = Math.max(0, m2 / n);
        return new BaseMoments(field, n, mean, min, max, variance);
    }

    /**
     * @return mean of the values of {@code field}
     * @throws EmptyInputException if no reading carries {@code field}
     */
    public static double mean(List<Reading> readings, MillField field) {
        return baseMoments(readings, field).getMean();
    }

    /**
     * {@code (1/N) Σ(x − mean)³ / stddev³}.
     *
     * @param moments base moments of the same field over the same readings
     * @throws DegenerateVarianceException if the variance is zero
     */
    public static double skewness(List<Reading> readings, MillField field, BaseMoments moments) {
        checkMoments(field, moments);
        if (moments.isDegenerate()) {
            throw new DegenerateVarianceException(field,
                    "Skewness of " + field + " is undefined: variance is zero");
        }
        double stdDev = moments.getStdDev();
        return centralMoment(readings, field, moments, 3) / (stdDev * stdDev * stdDev);
    }

    /**
     * {@code (1/N) Σ(x − mean)⁴ / variance²}.
     *
     * @param moments base moments of the same field over the same readings
     * @throws DegenerateVarianceException if the variance is zero
     */
    public static double kurtosis(List<Reading> readings, MillField field, BaseMoments moments) {
        checkMoments(field, moments);
        if (moments.isDegenerate()) {
            throw new DegenerateVarianceException(field,
                    "Kurtosis of " + field + " is undefined: variance is zero");
        }
        double variance = moments.getVariance();
        return centralMoment(readings, field, moments, 4) / (variance * variance);
    }

    /**
     * All statistics of {@code field}. Degeneracy is recorded on the summary
     * rather than thrown.
     *
     * @throws EmptyInputException if no reading carries {@code field}
     */
    public static StatisticalSummary summarize(List<Reading> readings, MillField field) {
        BaseMoments moments = baseMoments(readings, field);
        if (moments.isDegenerate()) {
            LOG.debug("{} is constant over {} value(s); shape statistics undefined",
                    field, moments.getCount());
            return new StatisticalSummary(moments, null, null);
        }
        return new StatisticalSummary(moments,
                skewness(readings, field, moments),
                kurtosis(readings, field, moments));
    }

    private static double centralMoment(List<Reading> readings, MillField field,
            BaseMoments moments, int order) {
        double mean = moments.getMean();
        double sum = 0;
        for (double x : FieldValues.of(readings, field)) {
            sum += Math.pow(x - mean, order);
        }
        return sum / moments.getCount();
    }

    private static void checkMoments(MillField field, BaseMoments moments) {
        Objects.requireNonNull(moments, "Base moments must not be null");
        if (moments.getField() != field) {
            throw new IllegalArgumentException(
                    "Base moments are for " + moments.getField() + ", not " + field);
        }
    }
}

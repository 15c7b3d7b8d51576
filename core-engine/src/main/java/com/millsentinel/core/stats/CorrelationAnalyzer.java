package com.millsentinel.core.stats;

import com.millsentinel.core.error.EmptyInputException;
import com.millsentinel.core.error.ZeroVarianceException;
import com.millsentinel.core.model.MillField;
import com.millsentinel.core.model.Reading;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Pearson product-moment correlation between two fields.
 *
 * <p>
 * Only readings carrying both fields take part. Means are computed first;
 * the cross and squared deviations are summed in a second pass.
 * </p>
 *
 * @since 1.0.0
 */
public final class CorrelationAnalyzer {

    private CorrelationAnalyzer() {
        // utility class — not instantiable
    }

    /**
     * @param readings readings to analyze
     * @param x        first field
     * @param y        second field
     * @return the correlation coefficient, in {@code [-1, 1]}
     * @throws EmptyInputException   if no reading carries both fields
     * @throws ZeroVarianceException if either field is constant over the pairs
     */
    public static double pearson(List<Reading> readings, MillField x, MillField y) {
        Objects.requireNonNull(readings, "Readings must not be null");
        Objects.requireNonNull(x, "Field x must not be null");
        Objects.requireNonNull(y, "Field y must not be null");

        double[][] pairs = readings.stream()
                .filter(r -> r.has(x) && r.has(y))
                .map(r -> new double[] {r.getNumericField(x).get(), r.getNumericField(y).get()})
                .toArray(double[][]::new);
        if (pairs.length == 0) {
            throw new EmptyInputException("No readings carry both " + x + " and " + y);
        }

        double sumX = 0;
        double sumY = 0;
        for (double[] p : pairs) {
            sumX += p[0];
            sumY += p[1];
        }
        double meanX = sumX / pairs.length;
        double meanY = sumY / pairs.length;

        double cross = 0;
        double squaresX = 0;
        double squaresY = 0;
        for (double[] p : pairs) {
            double dx = p[0] - meanX;
            double dy = p[1] - meanY;
            cross += dx * dy;
            squaresX += dx * dx;
            squaresY += dy * dy;
        }

        Optional<MillField> constant = squaresX == 0 ? Optional.of(x)
                : squaresY == 0 ? Optional.of(y) : Optional.empty();
        if (constant.isPresent()) {
            throw new ZeroVarianceException(constant.get(),
                    "Correlation of " + x + " and " + y + " is undefined: "
                            + constant.get() + " is constant");
        }

        double r = cross / (Math.sqrt(squaresX) * Math.sqrt(squaresY));
        // rounding can push a perfect correlation a few ulps past 1
        return Math.max(-1.0, Math.min(1.0, r));
    }
}

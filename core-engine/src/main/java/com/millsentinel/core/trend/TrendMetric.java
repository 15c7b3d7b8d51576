package com.millsentinel.core.trend;

import com.millsentinel.core.model.MillField;
import com.millsentinel.core.model.Reading;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Function;

/**
 * Aggregate computed over the readings of one month.
 *
 * @since 1.0.0
 */
public final class TrendMetric {

    private final String name;
    private final Function<List<Reading>, OptionalDouble> aggregate;

    private TrendMetric(String name, Function<List<Reading>, OptionalDouble> aggregate) {
        this.name = Objects.requireNonNull(name, "Metric name must not be null");
        this.aggregate = aggregate;
    }

    /**
     * Mean of the present values of {@code field}; undefined when the month
     * has none.
     */
    public static TrendMetric mean(MillField field) {
        Objects.requireNonNull(field, "Field must not be null");
        return new TrendMetric("mean(" + field + ")", readings -> readings.stream()
                .map(r -> r.getNumericField(field))
                .filter(Optional::isPresent)
                .mapToDouble(Optional::get)
                .average());
    }

    /**
     * {@code Σ numerator / Σ denominator}, each summed over the readings that
     * carry it; undefined when the denominator sum is zero or absent.
     */
    public static TrendMetric ratioOfSums(MillField numerator, MillField denominator) {
        Objects.requireNonNull(numerator, "Numerator must not be null");
        Objects.requireNonNull(denominator, "Denominator must not be null");
        return new TrendMetric("sum(" + numerator + ")/sum(" + denominator + ")", readings -> {
            double num = 0;
            double den = 0;
            boolean anyNum = false;
            boolean anyDen = false;
            for (Reading reading : readings) {
                Optional<Double> n = reading.getNumericField(numerator);
                Optional<Double> d = reading.getNumericField(denominator);
                if (n.isPresent()) {
                    num += n.get();
                    anyNum = true;
                }
                if (d.isPresent()) {
                    den += d.get();
                    anyDen = true;
                }
            }
            return anyNum && anyDen && den != 0 ? OptionalDouble.of(num / den) : OptionalDouble.empty();
        });
    }

    /**
     * @return this metric under a different report name
     */
    public TrendMetric named(String newName) {
        return new TrendMetric(newName, aggregate);
    }

    public String getName() {
        return name;
    }

    OptionalDouble compute(List<Reading> readings) {
        return aggregate.apply(readings);
    }

    @Override
    public String toString() {
        return name;
    }
}

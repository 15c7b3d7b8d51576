package com.millsentinel.core.trend;

import com.millsentinel.core.error.DivisionByZeroException;
import com.millsentinel.core.model.Reading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Calendar-month aggregates and month-over-month growth.
 *
 * <p>
 * Readings are bucketed by the {@link YearMonth} of their parsed timestamp.
 * Readings without one are left out of every bucket. Growth compares each
 * month with the preceding month present in the data, so a gap month is
 * skipped rather than treated as zero.
 * </p>
 *
 * @since 1.0.0
 */
public class MonthlyTrendAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(MonthlyTrendAggregator.class);

    /**
     * @return readings grouped by month, oldest month first, input order kept
     *         within each month
     */
    public SortedMap<YearMonth, List<Reading>> buckets(List<Reading> readings) {
        Objects.requireNonNull(readings, "Readings must not be null");
        SortedMap<YearMonth, List<Reading>> buckets = new TreeMap<>();
        int skipped = 0;
        for (Reading reading : readings) {
            LocalDateTime timestamp = reading.getTimestamp();
            if (timestamp == null) {
                skipped++;
                continue;
            }
            buckets.computeIfAbsent(YearMonth.from(timestamp), m -> new ArrayList<>()).add(reading);
        }
        if (skipped > 0) {
            LOG.debug("{} reading(s) without a parsable timestamp left out of monthly buckets", skipped);
        }
        return buckets;
    }

    /**
     * @param metrics metrics to compute for every month
     * @return one bucket per month present, oldest first
     */
    public List<MonthlyBucket> aggregate(List<Reading> readings, TrendMetric... metrics) {
        List<MonthlyBucket> result = new ArrayList<>();
        for (Map.Entry<YearMonth, List<Reading>> entry : buckets(readings).entrySet()) {
            Map<String, Double> values = new LinkedHashMap<>();
            for (TrendMetric metric : metrics) {
                OptionalDouble value = metric.compute(entry.getValue());
                if (value.isPresent()) {
                    values.put(metric.getName(), value.getAsDouble());
                }
            }
            result.add(new MonthlyBucket(entry.getKey(), entry.getValue().size(), values));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * @return growth of {@code metric} for every month present, oldest first;
     *         the first month has status {@link GrowthStatus#NO_PREVIOUS}
     */
    public List<MonthlyGrowth> growth(List<Reading> readings, TrendMetric metric) {
        Objects.requireNonNull(metric, "Metric must not be null");
        List<MonthlyGrowth> result = new ArrayList<>();
        boolean first = true;
        OptionalDouble previous = OptionalDouble.empty();

        for (Map.Entry<YearMonth, List<Reading>> entry : buckets(readings).entrySet()) {
            YearMonth month = entry.getKey();
            OptionalDouble current = metric.compute(entry.getValue());
            Double value = boxed(current);
            Double previousValue = boxed(previous);

            if (first) {
                result.add(new MonthlyGrowth(month, metric.getName(), value, null, null,
                        GrowthStatus.NO_PREVIOUS));
                first = false;
            } else if (current.isEmpty() || previous.isEmpty()) {
                result.add(new MonthlyGrowth(month, metric.getName(), value, previousValue, null,
                        GrowthStatus.UNDEFINED_VALUE));
            } else {
                try {
                    double growth = percentChange(current.getAsDouble(), previous.getAsDouble());
                    result.add(new MonthlyGrowth(month, metric.getName(), value, previousValue, growth,
                            GrowthStatus.DEFINED));
                } catch (DivisionByZeroException e) {
                    LOG.debug("No growth for {} in {}: {}", metric, month, e.getMessage());
                    result.add(new MonthlyGrowth(month, metric.getName(), value, previousValue, null,
                            GrowthStatus.ZERO_BASE));
                }
            }
            previous = current;
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * {@code (current − previous) / previous × 100}.
     *
     * @throws DivisionByZeroException if {@code previous} is zero
     */
    public static double percentChange(double current, double previous) {
        if (previous == 0) {
            throw new DivisionByZeroException("Growth from a previous value of zero is undefined");
        }
        return (current - previous) / previous * 100;
    }

    private static Double boxed(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }
}

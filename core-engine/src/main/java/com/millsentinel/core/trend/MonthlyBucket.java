package com.millsentinel.core.trend;

import java.time.YearMonth;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregates of one calendar month.
 *
 * @since 1.0.0
 */
public final class MonthlyBucket {

    private final YearMonth month;
    private final int readingCount;
    private final Map<String, Double> values;

    MonthlyBucket(YearMonth month, int readingCount, Map<String, Double> values) {
        this.month = Objects.requireNonNull(month, "Month must not be null");
        this.readingCount = readingCount;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public YearMonth getMonth() {
        return month;
    }

    public int getReadingCount() {
        return readingCount;
    }

    /**
     * @return metric name to value; metrics undefined for the month are absent
     */
    public Map<String, Double> getValues() {
        return values;
    }

    @Override
    public String toString() {
        return "MonthlyBucket{" + month + ", readings=" + readingCount + ", values=" + values + '}';
    }
}

package com.millsentinel.core.stats;

import com.millsentinel.core.model.MillField;
import com.millsentinel.core.model.Reading;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Mean of one field per distinct value of another, e.g. mean throughput at
 * each separator speed setting.
 *
 * @since 1.0.0
 */
public final class FieldGrouping {

    private FieldGrouping() {
        // utility class — not instantiable
    }

    /**
     * @param readings   readings to group
     * @param keyField   field whose distinct values form the groups
     * @param valueField field averaged within each group
     * @return unmodifiable map from key value to mean, ordered by key; readings
     *         missing either field are skipped
     */
    public static SortedMap<Double, Double> meanBy(List<Reading> readings,
            MillField keyField, MillField valueField) {
        Objects.requireNonNull(readings, "Readings must not be null");
        Objects.requireNonNull(keyField, "Key field must not be null");
        Objects.requireNonNull(valueField, "Value field must not be null");

        Map<Double, double[]> sums = new TreeMap<>();
        for (Reading reading : readings) {
            if (!reading.has(keyField) || !reading.has(valueField)) {
                continue;
            }
            double[] acc = sums.computeIfAbsent(reading.getNumericField(keyField).get(),
                    k -> new double[2]);
            acc[0] += reading.getNumericField(valueField).get();
            acc[1]++;
        }

        SortedMap<Double, Double> means = new TreeMap<>();
        sums.forEach((key, acc) -> means.put(key, acc[0] / acc[1]));
        return Collections.unmodifiableSortedMap(means);
    }
}

package com.millsentinel.core.store;

import com.millsentinel.core.model.MillField;
import com.millsentinel.core.model.Reading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Cleans a raw reading collection before analysis.
 *
 * <ol>
 * <li>Readings without {@link MillField#MILL_TPH} are removed.</li>
 * <li>Readings whose {@link MillField#DEDUP_KEY} values are all equal are
 * duplicates; only the one with the earliest timestamp survives. A missing
 * key value equals nothing, so a reading lacking any key field is never a
 * duplicate. An unparsable timestamp counts as the latest, and among equal
 * timestamps the first encountered wins.</li>
 * <li>Survivors are ordered by {@link Reading#CHRONOLOGICAL}; readings
 * without a parsed timestamp keep their input order at the end.</li>
 * </ol>
 *
 * <p>
 * The input list is never modified.
 * </p>
 *
 * @since 1.0.0
 */
public class ReadingCleaner {

    private static final Logger LOG = LoggerFactory.getLogger(ReadingCleaner.class);

    public CleaningResult clean(List<Reading> raw) {
        Objects.requireNonNull(raw, "Readings must not be null");

        List<Reading> withThroughput = new ArrayList<>(raw.size());
        for (Reading reading : raw) {
            if (reading.has(MillField.MILL_TPH)) {
                withThroughput.add(reading);
            } else {
                LOG.trace("Dropping reading without mill throughput: {}", reading);
            }
        }
        int missingThroughput = raw.size() - withThroughput.size();

        Map<List<Double>, Reading> earliest = new HashMap<>();
        Set<Reading> survivors = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Reading reading : withThroughput) {
            if (!MillField.DEDUP_KEY.stream().allMatch(reading::has)) {
                survivors.add(reading);
                continue;
            }
            earliest.merge(dedupKey(reading), reading,
                    (kept, candidate) -> Reading.CHRONOLOGICAL.compare(candidate, kept) < 0 ? candidate : kept);
        }
        survivors.addAll(earliest.values());

        List<Reading> cleaned = new ArrayList<>(survivors.size());
        for (Reading reading : withThroughput) {
            if (survivors.contains(reading)) {
                cleaned.add(reading);
            }
        }
        cleaned.sort(Reading.CHRONOLOGICAL);
        int duplicates = withThroughput.size() - cleaned.size();

        LOG.debug("Cleaned {} reading(s): {} without throughput, {} duplicate(s), {} kept",
                raw.size(), missingThroughput, duplicates, cleaned.size());
        return new CleaningResult(cleaned, missingThroughput, duplicates);
    }

    private static List<Double> dedupKey(Reading reading) {
        List<Double> key = new ArrayList<>(MillField.DEDUP_KEY.size());
        for (MillField field : MillField.DEDUP_KEY) {
            key.add(reading.getNumericField(field).orElseThrow());
        }
        return key;
    }
}

package com.millsentinel.core.store;

import com.millsentinel.core.model.Reading;

import java.util.List;
import java.util.Objects;

/**
 * Output of {@link ReadingCleaner#clean(List)}: the surviving readings and
 * how many each cleaning step removed.
 *
 * @since 1.0.0
 */
public final class CleaningResult {

    private final List<Reading> readings;
    private final int removedMissingThroughput;
    private final int removedDuplicates;

    CleaningResult(List<Reading> readings, int removedMissingThroughput, int removedDuplicates) {
        this.readings = List.copyOf(Objects.requireNonNull(readings, "Readings must not be null"));
        this.removedMissingThroughput = removedMissingThroughput;
        this.removedDuplicates = removedDuplicates;
    }

    /**
     * @return cleaned readings in timestamp order, unmodifiable
     */
    public List<Reading> getReadings() {
        return readings;
    }

    public int getRemovedMissingThroughput() {
        return removedMissingThroughput;
    }

    public int getRemovedDuplicates() {
        return removedDuplicates;
    }

    public int getRemovedTotal() {
        return removedMissingThroughput + removedDuplicates;
    }

    @Override
    public String toString() {
        return "CleaningResult{" +
                "kept=" + readings.size() +
                ", removedMissingThroughput=" + removedMissingThroughput +
                ", removedDuplicates=" + removedDuplicates +
                '}';
    }
}

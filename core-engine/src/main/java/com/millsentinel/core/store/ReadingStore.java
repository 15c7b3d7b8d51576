package com.millsentinel.core.store;

import com.millsentinel.core.model.Reading;

import java.util.List;

/**
 * Source of the reading snapshot an analysis run works on.
 *
 * <p>
 * Implementations return readings that are already cleaned: every reading
 * carries mill throughput, duplicates are removed and the list is in
 * timestamp order. The returned list is unmodifiable and does not change
 * between calls.
 * </p>
 *
 * @since 1.0.0
 */
public interface ReadingStore {

    /**
     * @return the cleaned, time-ordered, unmodifiable snapshot
     */
    List<Reading> readings();
}

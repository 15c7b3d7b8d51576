package com.millsentinel.core.store;

import com.millsentinel.core.model.Reading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * {@link ReadingStore} over readings already held in memory. The readings are
 * cleaned once, at construction.
 *
 * @since 1.0.0
 */
public class InMemoryReadingStore implements ReadingStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryReadingStore.class);

    private final List<Reading> readings;
    private final CleaningResult cleaning;

    public InMemoryReadingStore(List<Reading> raw) {
        this(raw, new ReadingCleaner());
    }

    public InMemoryReadingStore(List<Reading> raw, ReadingCleaner cleaner) {
        Objects.requireNonNull(cleaner, "Cleaner must not be null");
        this.cleaning = cleaner.clean(raw);
        this.readings = cleaning.getReadings();
        LOG.info("Reading store ready: {} reading(s), {} removed by cleaning",
                readings.size(), cleaning.getRemovedTotal());
    }

    @Override
    public List<Reading> readings() {
        return readings;
    }

    public CleaningResult getCleaning() {
        return cleaning;
    }
}

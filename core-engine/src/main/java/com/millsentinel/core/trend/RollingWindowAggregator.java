package com.millsentinel.core.trend;

import com.millsentinel.core.model.MillField;
import com.millsentinel.core.model.Reading;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Trailing moving average over a time-ordered reading collection.
 *
 * <p>
 * The window at position {@code i} covers readings {@code i − size + 1}
 * through {@code i}, fewer at the start of the series. A reading missing the
 * field still occupies its slot but contributes nothing to the mean.
 * </p>
 *
 * <p>
 * Results are computed lazily while iterating. Each call to
 * {@link Iterable#iterator()} starts over from the first reading; nothing is
 * cached between iterations.
 * </p>
 *
 * @since 1.0.0
 */
public class RollingWindowAggregator {

    /** Current reading plus the ten preceding it. */
    public static final int DEFAULT_WINDOW_SIZE = 11;

    private final int windowSize;

    public RollingWindowAggregator() {
        this(DEFAULT_WINDOW_SIZE);
    }

    /**
     * @param windowSize number of readings per window
     * @throws IllegalArgumentException if {@code windowSize} is less than 1
     */
    public RollingWindowAggregator(int windowSize) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be >= 1, got: " + windowSize);
        }
        this.windowSize = windowSize;
    }

    public int getWindowSize() {
        return windowSize;
    }

    /**
     * @param readings readings in timestamp order; the caller owns the order
     * @param field    field to average
     * @return one point per reading, in input order
     */
    public Iterable<RollingPoint> rollingMean(List<Reading> readings, MillField field) {
        Objects.requireNonNull(readings, "Readings must not be null");
        Objects.requireNonNull(field, "Field must not be null");
        return () -> new WindowIterator(readings.iterator(), field);
    }

    public Stream<RollingPoint> stream(List<Reading> readings, MillField field) {
        return StreamSupport.stream(rollingMean(readings, field).spliterator(), false);
    }

    private final class WindowIterator implements Iterator<RollingPoint> {

        private final Iterator<Reading> source;
        private final MillField field;
        private final Deque<Optional<Double>> window = new ArrayDeque<>();

        WindowIterator(Iterator<Reading> source, MillField field) {
            this.source = source;
            this.field = field;
        }

        @Override
        public boolean hasNext() {
            return source.hasNext();
        }

        @Override
        public RollingPoint next() {
            if (!source.hasNext()) {
                throw new NoSuchElementException();
            }
            Reading reading = source.next();
            window.addLast(reading.getNumericField(field));
            if (window.size() > windowSize) {
                window.pollFirst();
            }

            double sum = 0;
            int present = 0;
            for (Optional<Double> value : window) {
                if (value.isPresent()) {
                    sum += value.get();
                    present++;
                }
            }
            Double mean = present == 0 ? null : sum / present;
            return new RollingPoint(reading.getRawTimestamp(), mean, window.size());
        }
    }
}

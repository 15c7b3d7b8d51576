package com.millsentinel.core.detection;

import com.millsentinel.core.model.MillField;
import com.millsentinel.core.model.Reading;
import com.millsentinel.core.stats.QuantileEngine;
import com.millsentinel.core.stats.QuartileFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Interquartile-range outlier detector.
 *
 * <p>
 * For each tested field the fences are {@code Q1 − k × IQR} and
 * {@code Q3 + k × IQR}, with quartiles from {@link QuantileEngine}. A reading
 * is an outlier when <em>any</em> tested field lies strictly outside its
 * fences. A reading missing a field is never an outlier on that field.
 * </p>
 *
 * <p>
 * The detector only flags. Use {@link #removeOutliers(List, Collection)} to
 * drop the flagged readings explicitly.
 * </p>
 *
 * @since 1.0.0
 */
public class IqrOutlierDetector {

    private static final Logger LOG = LoggerFactory.getLogger(IqrOutlierDetector.class);

    /** Tukey's inner fence. */
    public static final double DEFAULT_FENCE_MULTIPLIER = 1.5;

    private final double fenceMultiplier;

    public IqrOutlierDetector() {
        this(DEFAULT_FENCE_MULTIPLIER);
    }

    /**
     * @param fenceMultiplier IQR multiple added beyond each quartile
     * @throws IllegalArgumentException if the multiplier is negative or not finite
     */
    public IqrOutlierDetector(double fenceMultiplier) {
        if (!Double.isFinite(fenceMultiplier) || fenceMultiplier < 0) {
            throw new IllegalArgumentException(
                    "fenceMultiplier must be a finite value >= 0, got: " + fenceMultiplier);
        }
        this.fenceMultiplier = fenceMultiplier;
    }

    public double getFenceMultiplier() {
        return fenceMultiplier;
    }

    /**
     * @return quartiles of every field, in the order given
     * @throws com.millsentinel.core.error.EmptyInputException if a field has
     *                                                          no values
     */
    public Map<MillField, QuartileFrame> fences(List<Reading> readings, Collection<MillField> fields) {
        Objects.requireNonNull(readings, "Readings must not be null");
        Objects.requireNonNull(fields, "Fields must not be null");
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("At least one field is required");
        }
        Map<MillField, QuartileFrame> frames = new LinkedHashMap<>();
        for (MillField field : fields) {
            QuartileFrame frame = QuantileEngine.quartiles(readings, field);
            frames.put(field, frame);
            LOG.debug("{}: q1={} q3={} fences=[{}, {}]", field, frame.getQ1(), frame.getQ3(),
                    frame.lowerFence(fenceMultiplier), frame.upperFence(fenceMultiplier));
        }
        return Collections.unmodifiableMap(frames);
    }

    /**
     * @return readings outside the fences of at least one field, newest first
     * @throws com.millsentinel.core.error.EmptyInputException if a field has
     *                                                          no values
     */
    public List<Reading> detect(List<Reading> readings, Collection<MillField> fields) {
        Map<MillField, QuartileFrame> frames = fences(readings, fields);
        List<Reading> outliers = readings.stream()
                .filter(reading -> isOutlier(reading, frames))
                .sorted(Reading.MOST_RECENT_FIRST)
                .toList();
        LOG.debug("Flagged {} outlier(s) of {} reading(s) on {}", outliers.size(), readings.size(),
                frames.keySet());
        return outliers;
    }

    public List<Reading> detect(List<Reading> readings, MillField... fields) {
        return detect(readings, Arrays.asList(fields));
    }

    /**
     * Return a new list holding {@code readings} without the given outliers.
     * Matching is by identity, so equal but distinct readings are kept.
     *
     * @param readings the full collection, unchanged
     * @param outliers readings to drop, typically from {@link #detect}
     * @return the remaining readings in their original order
     */
    public static List<Reading> removeOutliers(List<Reading> readings, Collection<Reading> outliers) {
        Objects.requireNonNull(readings, "Readings must not be null");
        Objects.requireNonNull(outliers, "Outliers must not be null");
        Set<Reading> drop = Collections.newSetFromMap(new IdentityHashMap<>());
        drop.addAll(outliers);
        return readings.stream().filter(r -> !drop.contains(r)).toList();
    }

    private boolean isOutlier(Reading reading, Map<MillField, QuartileFrame> frames) {
        for (Map.Entry<MillField, QuartileFrame> entry : frames.entrySet()) {
            Optional<Double> value = reading.getNumericField(entry.getKey());
            if (value.isPresent() && entry.getValue().isOutside(value.get(), fenceMultiplier)) {
                return true;
            }
        }
        return false;
    }
}

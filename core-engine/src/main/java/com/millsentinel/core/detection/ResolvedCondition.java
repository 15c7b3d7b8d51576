package com.millsentinel.core.detection;

import com.millsentinel.core.model.AlertCondition;
import com.millsentinel.core.model.AlertRule;
import com.millsentinel.core.model.MillField;
import com.millsentinel.core.model.Reading;
import com.millsentinel.core.stats.MomentEngine;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An {@link AlertCondition} with its threshold computed for one reading
 * collection.
 */
final class ResolvedCondition {

    private final MillField field;
    private final boolean above;
    private final double threshold;
    private final String description;

    private ResolvedCondition(MillField field, boolean above, double threshold, String description) {
        this.field = field;
        this.above = above;
        this.threshold = threshold;
        this.description = description;
    }

    /**
     * Resolve every condition of {@code rule}. Each referenced mean is
     * computed once, however many conditions share it.
     *
     * @throws com.millsentinel.core.error.EmptyInputException if a referenced
     *                                                          field has no values
     */
    static List<ResolvedCondition> resolveAll(AlertRule rule, List<Reading> readings) {
        Map<MillField, Double> means = new EnumMap<>(MillField.class);
        List<ResolvedCondition> resolved = new ArrayList<>();
        for (AlertCondition condition : rule.getConditions()) {
            MillField field = condition.resolveField();
            MillField referenceField = condition.resolveReferenceField();
            double reference;
            String referenceLabel;
            if (referenceField != null) {
                reference = means.computeIfAbsent(referenceField, f -> MomentEngine.mean(readings, f));
                referenceLabel = condition.getMultiplier() + " x mean(" + referenceField + ")";
            } else {
                reference = condition.getValue();
                referenceLabel = condition.getMultiplier() == 1.0
                        ? String.valueOf(reference)
                        : condition.getMultiplier() + " x " + reference;
            }
            double threshold = condition.getMultiplier() * reference;
            String description = String.format("%s %s %s = %.2f",
                    field, condition.isAbove() ? ">" : "<", referenceLabel, threshold);
            resolved.add(new ResolvedCondition(field, condition.isAbove(), threshold, description));
        }
        return resolved;
    }

    /**
     * @return {@code true} if the reading carries the field and its value is
     *         strictly beyond the threshold
     */
    boolean test(Reading reading) {
        Optional<Double> value = reading.getNumericField(field);
        if (value.isEmpty()) {
            return false;
        }
        return above ? value.get() > threshold : value.get() < threshold;
    }

    MillField getField() {
        return field;
    }

    double getThreshold() {
        return threshold;
    }

    String getDescription() {
        return description;
    }
}

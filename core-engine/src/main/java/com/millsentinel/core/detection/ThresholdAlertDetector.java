package com.millsentinel.core.detection;

import com.millsentinel.core.model.Alert;
import com.millsentinel.core.model.AlertRule;
import com.millsentinel.core.model.MillField;
import com.millsentinel.core.model.Reading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Threshold detector.
 *
 * <p>
 * Flags every reading that satisfies the rule's conditions, combined with OR
 * ({@code match: any}) or AND ({@code match: all}). Mean references are
 * computed over the readings passed to {@link #evaluate(List)}. Alerts are
 * ordered by timestamp, newest first; readings without a parsable timestamp
 * come last in input order.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdAlertDetector implements AlertDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ThresholdAlertDetector.class);

    protected final AlertRule rule;
    private final List<MillField> testedFields;

    /**
     * @param rule the alert rule configuration
     * @throws NullPointerException  if {@code rule} is {@code null}
     * @throws IllegalStateException if the rule is invalid
     */
    public ThresholdAlertDetector(AlertRule rule) {
        Objects.requireNonNull(rule, "AlertRule must not be null");
        rule.validate();
        this.rule = rule;
        Set<MillField> fields = new LinkedHashSet<>();
        rule.getConditions().forEach(c -> fields.add(c.resolveField()));
        this.testedFields = List.copyOf(fields);
    }

    @Override
    public AlertReport evaluate(List<Reading> readings) {
        Objects.requireNonNull(readings, "Readings must not be null");
        List<ResolvedCondition> conditions = ResolvedCondition.resolveAll(rule, readings);

        List<Alert> alerts = flagged(readings, conditions).stream()
                .map(reading -> toAlert(reading, conditions))
                .toList();

        LOG.debug("Rule [{}] flagged {} of {} reading(s)", rule.getName(), alerts.size(), readings.size());
        return new AlertReport(rule.getName(), rule.getDescription(), describe(conditions),
                alerts, Collections.emptyList());
    }

    @Override
    public String getRuleName() {
        return rule.getName();
    }

    // ---------------------------------------------------------------
    // Shared with the grouped detector
    // ---------------------------------------------------------------

    /**
     * @return readings matching the rule, newest first
     */
    List<Reading> flagged(List<Reading> readings, List<ResolvedCondition> conditions) {
        List<Reading> matches = new ArrayList<>();
        for (Reading reading : readings) {
            if (matches(reading, conditions)) {
                matches.add(reading);
            } else {
                LOG.trace("Rule [{}]: reading {} passes", rule.getName(), reading.getRawTimestamp());
            }
        }
        matches.sort(Reading.MOST_RECENT_FIRST);
        return matches;
    }

    List<MillField> getTestedFields() {
        return testedFields;
    }

    Map<MillField, Double> testedValues(Reading reading) {
        Map<MillField, Double> values = new EnumMap<>(MillField.class);
        for (MillField field : testedFields) {
            reading.getNumericField(field).ifPresent(v -> values.put(field, v));
        }
        return values;
    }

    static List<String> describe(List<ResolvedCondition> conditions) {
        return conditions.stream().map(ResolvedCondition::getDescription).toList();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private boolean matches(Reading reading, List<ResolvedCondition> conditions) {
        return rule.requiresAll()
                ? conditions.stream().allMatch(c -> c.test(reading))
                : conditions.stream().anyMatch(c -> c.test(reading));
    }

    private Alert toAlert(Reading reading, List<ResolvedCondition> conditions) {
        String held = conditions.stream()
                .filter(c -> c.test(reading))
                .map(c -> String.format("%s=%.2f (%s)", c.getField(),
                        reading.getNumericField(c.getField()).orElse(Double.NaN), c.getDescription()))
                .collect(Collectors.joining("; "));
        return Alert.builder()
                .ruleName(rule.getName())
                .timestamp(reading.getRawTimestamp())
                .details("Threshold exceeded: " + held)
                .values(testedValues(reading))
                .build();
    }
}

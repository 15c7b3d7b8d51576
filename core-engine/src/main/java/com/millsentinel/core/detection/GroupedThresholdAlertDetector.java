package com.millsentinel.core.detection;

import com.millsentinel.core.model.AlertGroup;
import com.millsentinel.core.model.AlertRule;
import com.millsentinel.core.model.MillField;
import com.millsentinel.core.model.Reading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Threshold detector that aggregates its matches.
 *
 * <p>
 * Matching readings are grouped by the values of the tested fields and each
 * distinct combination is reported once with its occurrence count, most
 * frequent first. Ties are broken by the tested values in ascending order so
 * the output is stable.
 * </p>
 *
 * @since 1.0.0
 */
public class GroupedThresholdAlertDetector extends ThresholdAlertDetector {

    private static final Logger LOG = LoggerFactory.getLogger(GroupedThresholdAlertDetector.class);

    public GroupedThresholdAlertDetector(AlertRule rule) {
        super(rule);
    }

    @Override
    public AlertReport evaluate(List<Reading> readings) {
        Objects.requireNonNull(readings, "Readings must not be null");
        List<ResolvedCondition> conditions = ResolvedCondition.resolveAll(rule, readings);

        Map<Map<MillField, Double>, Long> counts = new LinkedHashMap<>();
        for (Reading reading : flagged(readings, conditions)) {
            counts.merge(testedValues(reading), 1L, Long::sum);
        }

        List<AlertGroup> groups = counts.entrySet().stream()
                .map(e -> new AlertGroup(rule.getName(), e.getKey(), e.getValue()))
                .sorted(Comparator.comparingLong(AlertGroup::getOccurrences).reversed()
                        .thenComparing(this::compareValues))
                .toList();

        LOG.debug("Rule [{}] found {} distinct combination(s)", rule.getName(), groups.size());
        return new AlertReport(rule.getName(), rule.getDescription(), describe(conditions),
                Collections.emptyList(), groups);
    }

    private int compareValues(AlertGroup a, AlertGroup b) {
        for (MillField field : getTestedFields()) {
            int cmp = Comparator.nullsLast(Double::compare)
                    .compare(a.getValues().get(field), b.getValues().get(field));
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }
}

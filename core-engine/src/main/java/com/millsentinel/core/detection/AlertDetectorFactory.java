package com.millsentinel.core.detection;

import com.millsentinel.core.model.AlertRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Factory that creates {@link AlertDetector} instances from
 * {@link AlertRule} configurations.
 *
 * @since 1.0.0
 */
public final class AlertDetectorFactory {

    private static final Logger LOG = LoggerFactory.getLogger(AlertDetectorFactory.class);

    private AlertDetectorFactory() {
        // utility class — not instantiable
    }

    /**
     * Create a detector for the given rule.
     *
     * @param rule the alert rule configuration; must not be {@code null}
     * @return a grouping detector if the rule aggregates, a plain one otherwise
     * @throws NullPointerException  if {@code rule} is {@code null}
     * @throws IllegalStateException if the rule is invalid
     */
    public static AlertDetector create(AlertRule rule) {
        Objects.requireNonNull(rule, "AlertRule must not be null");
        return rule.isGroupByValues()
                ? new GroupedThresholdAlertDetector(rule)
                : new ThresholdAlertDetector(rule);
    }

    /**
     * Create detectors for every rule in the supplied list.
     *
     * @param rules list of rule configurations; must not be {@code null}
     * @return unmodifiable list of detectors (one per rule)
     */
    public static List<AlertDetector> createAll(List<AlertRule> rules) {
        Objects.requireNonNull(rules, "Rules list must not be null");
        LOG.info("Creating {} alert detector(s) from configuration", rules.size());
        List<AlertDetector> detectors = rules.stream()
                .map(AlertDetectorFactory::create)
                .toList();
        return Collections.unmodifiableList(detectors);
    }
}

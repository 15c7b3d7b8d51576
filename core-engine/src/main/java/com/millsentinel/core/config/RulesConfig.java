package com.millsentinel.core.config;

import com.millsentinel.core.model.AlertRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Top-level POJO for the alert rules YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * rules:
 *   - name: fan_failure
 *     match: all
 *     groupByValues: true
 *     conditions:
 *       - field: VENT_FAN_RPM
 *         comparison: below
 *         multiplier: 0.85
 *       - field: VENT_FAN_KW
 *         comparison: above
 *         multiplier: 1.1
 * </pre>
 *
 * @since 1.0.0
 */
public class RulesConfig {

    private List<AlertRule> rules = new ArrayList<>();

    /**
     * @return unmodifiable list of alert rules
     */
    public List<AlertRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * Set the rules list (used by SnakeYAML during deserialization).
     *
     * @param rules the alert rules
     */
    public void setRules(List<AlertRule> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    /**
     * Validate every rule and check that rule names are unique.
     *
     * <p>
     * Collects all errors and throws a single exception if any rule is invalid.
     * </p>
     *
     * @throws IllegalStateException if one or more rules are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        Set<String> names = new HashSet<>();

        for (int i = 0; i < rules.size(); i++) {
            AlertRule rule = Objects.requireNonNull(rules.get(i),
                    "Rule at index " + i + " is null");
            try {
                rule.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (rule.getName() != null && !names.add(rule.getName())) {
                errors.add("Duplicate rule name: '" + rule.getName() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Rules configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "RulesConfig{rules=" + rules + '}';
    }
}

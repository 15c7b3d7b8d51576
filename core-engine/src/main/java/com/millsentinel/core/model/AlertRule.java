package com.millsentinel.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Describes a single alert rule loaded from configuration.
 *
 * <p>
 * A rule combines one or more {@link AlertCondition}s:
 * </p>
 * <ul>
 * <li>{@code match: any} — a reading is flagged when at least one condition
 * holds (logical OR)</li>
 * <li>{@code match: all} — every condition must hold (logical AND); a reading
 * missing any tested field is never flagged</li>
 * </ul>
 *
 * <p>
 * With {@code groupByValues: true} the rule reports distinct combinations of
 * tested values with an occurrence count instead of individual readings.
 * </p>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertRule {

    public static final String MATCH_ANY = "any";
    public static final String MATCH_ALL = "all";

    /** Unique rule name used in alerts and reports. */
    private String name;

    /** Free-text explanation shown alongside the alerts. */
    private String description;

    /** {@code any} (OR) or {@code all} (AND). */
    private String match = MATCH_ANY;

    /** Aggregate flagged readings by their tested values. */
    private boolean groupByValues;

    private List<AlertCondition> conditions = new ArrayList<>();

    public AlertRule() {
    }

    /**
     * Programmatic constructor.
     *
     * @param name       rule name
     * @param match      {@code any} or {@code all}
     * @param conditions conditions of the rule
     * @return a new, unvalidated rule
     */
    public static AlertRule of(String name, String match, AlertCondition... conditions) {
        AlertRule rule = new AlertRule();
        rule.setName(name);
        rule.setMatch(match);
        rule.setConditions(Arrays.asList(conditions));
        return rule;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate the rule and all of its conditions.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Rule 'name' is required");
        }
        if (!MATCH_ANY.equals(match) && !MATCH_ALL.equals(match)) {
            errors.add("Rule '" + name + "': 'match' must be any or all, got: " + match);
        }
        if (conditions.isEmpty()) {
            errors.add("Rule '" + name + "' requires at least one condition");
        }
        for (int i = 0; i < conditions.size(); i++) {
            AlertCondition condition = conditions.get(i);
            if (condition == null) {
                errors.add("Rule '" + name + "': condition at index " + i + " is null");
            } else {
                condition.validate(name, errors);
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid AlertRule: " + String.join("; ", errors));
        }
    }

    public boolean requiresAll() {
        return MATCH_ALL.equals(match);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getMatch() {
        return match;
    }

    /**
     * Set the combination mode, normalised to lowercase.
     *
     * @param match {@code any} or {@code all}
     */
    public void setMatch(String match) {
        this.match = match != null ? match.toLowerCase(Locale.ROOT) : null;
    }

    public boolean isGroupByValues() {
        return groupByValues;
    }

    public void setGroupByValues(boolean groupByValues) {
        this.groupByValues = groupByValues;
    }

    /**
     * @return unmodifiable list of conditions
     */
    public List<AlertCondition> getConditions() {
        return Collections.unmodifiableList(conditions);
    }

    public void setConditions(List<AlertCondition> conditions) {
        this.conditions = conditions != null ? new ArrayList<>(conditions) : new ArrayList<>();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertRule that))
            return false;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "AlertRule{" +
                "name='" + name + '\'' +
                ", match='" + match + '\'' +
                ", groupByValues=" + groupByValues +
                ", conditions=" + conditions +
                '}';
    }
}

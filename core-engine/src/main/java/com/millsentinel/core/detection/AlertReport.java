package com.millsentinel.core.detection;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.millsentinel.core.model.Alert;
import com.millsentinel.core.model.AlertGroup;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one alert rule over one reading collection.
 *
 * <p>
 * Plain rules fill {@link #getAlerts()}, newest reading first. Aggregating
 * rules fill {@link #getGroups()}, most frequent combination first.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class AlertReport {

    private final String ruleName;
    private final String description;
    private final List<String> thresholds;
    private final List<Alert> alerts;
    private final List<AlertGroup> groups;

    AlertReport(String ruleName, String description, List<String> thresholds,
            List<Alert> alerts, List<AlertGroup> groups) {
        this.ruleName = Objects.requireNonNull(ruleName, "ruleName must not be null");
        this.description = description;
        this.thresholds = List.copyOf(thresholds);
        this.alerts = List.copyOf(alerts);
        this.groups = List.copyOf(groups);
    }

    public String getRuleName() {
        return ruleName;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return the resolved threshold of every condition, e.g.
     *         {@code "SEPARATOR_KW > 1.3 x mean(SEPARATOR_KW) = 152.10"}
     */
    public List<String> getThresholds() {
        return thresholds;
    }

    public List<Alert> getAlerts() {
        return alerts;
    }

    public List<AlertGroup> getGroups() {
        return groups;
    }

    /**
     * @return number of readings flagged by the rule
     */
    public long getFlaggedCount() {
        return groups.isEmpty()
                ? alerts.size()
                : groups.stream().mapToLong(AlertGroup::getOccurrences).sum();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertReport that))
            return false;
        return ruleName.equals(that.ruleName)
                && thresholds.equals(that.thresholds)
                && alerts.equals(that.alerts)
                && groups.equals(that.groups);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ruleName, thresholds, alerts, groups);
    }

    @Override
    public String toString() {
        return "AlertReport{" +
                "ruleName='" + ruleName + '\'' +
                ", alerts=" + alerts.size() +
                ", groups=" + groups.size() +
                '}';
    }
}

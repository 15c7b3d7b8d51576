package com.millsentinel.core.detection;

import com.millsentinel.core.model.MillField;
import com.millsentinel.core.model.Reading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Running-hours maintenance check.
 *
 * <p>
 * Readings are hourly, so the number of readings at one operating point (a
 * distinct value of the monitored field, by default {@link MillField#MILL_KW})
 * counts the hours run there. More than {@code maxRunningHours} marks the
 * operating point for maintenance.
 * </p>
 *
 * @since 1.0.0
 */
public class RunningHoursMonitor {

    private static final Logger LOG = LoggerFactory.getLogger(RunningHoursMonitor.class);

    public static final int DEFAULT_MAX_RUNNING_HOURS = 100;

    private final int maxRunningHours;

    public RunningHoursMonitor() {
        this(DEFAULT_MAX_RUNNING_HOURS);
    }

    public RunningHoursMonitor(int maxRunningHours) {
        if (maxRunningHours < 0) {
            throw new IllegalArgumentException("maxRunningHours must be >= 0, got: " + maxRunningHours);
        }
        this.maxRunningHours = maxRunningHours;
    }

    /**
     * @return one status per distinct value of {@code field}, by running hours
     *         descending then value ascending; readings missing the field are
     *         not counted
     */
    public List<RunningHoursStatus> evaluate(List<Reading> readings, MillField field) {
        Objects.requireNonNull(readings, "Readings must not be null");
        Objects.requireNonNull(field, "Field must not be null");

        Map<Double, Long> hours = new TreeMap<>();
        for (Reading reading : readings) {
            reading.getNumericField(field).ifPresent(v -> hours.merge(v, 1L, Long::sum));
        }

        List<RunningHoursStatus> statuses = hours.entrySet().stream()
                .map(e -> new RunningHoursStatus(field, e.getKey(), e.getValue(),
                        e.getValue() > maxRunningHours
                                ? RunningHoursStatus.Status.MAINTENANCE_REQUIRED
                                : RunningHoursStatus.Status.RUNNING_NORMALLY))
                .sorted(Comparator.comparingLong(RunningHoursStatus::getRunningHours).reversed())
                .toList();

        long due = statuses.stream().filter(RunningHoursStatus::isMaintenanceRequired).count();
        LOG.debug("{} of {} operating point(s) on {} exceed {} running hours",
                due, statuses.size(), field, maxRunningHours);
        return statuses;
    }

    public List<RunningHoursStatus> evaluate(List<Reading> readings) {
        return evaluate(readings, MillField.MILL_KW);
    }
}

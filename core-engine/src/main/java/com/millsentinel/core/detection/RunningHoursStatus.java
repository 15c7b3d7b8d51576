package com.millsentinel.core.detection;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.millsentinel.core.model.MillField;

import java.util.Objects;

/**
 * Running hours accumulated at one operating point.
 *
 * @since 1.0.0
 */
public final class RunningHoursStatus {

    public enum Status {
        MAINTENANCE_REQUIRED,
        RUNNING_NORMALLY
    }

    private final MillField field;
    private final double value;
    private final long runningHours;
    private final Status status;

    public RunningHoursStatus(MillField field, double value, long runningHours, Status status) {
        this.field = Objects.requireNonNull(field, "Field must not be null");
        this.value = value;
        this.runningHours = runningHours;
        this.status = Objects.requireNonNull(status, "Status must not be null");
    }

    public MillField getField() {
        return field;
    }

    public double getValue() {
        return value;
    }

    public long getRunningHours() {
        return runningHours;
    }

    public Status getStatus() {
        return status;
    }

    @JsonIgnore
    public boolean isMaintenanceRequired() {
        return status == Status.MAINTENANCE_REQUIRED;
    }

    @Override
    public String toString() {
        return "RunningHoursStatus{" + field + "=" + value +
                ", runningHours=" + runningHours +
                ", status=" + status +
                '}';
    }
}

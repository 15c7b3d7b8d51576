package com.millsentinel.core.detection;

import com.millsentinel.core.model.MillField;
import com.millsentinel.core.model.Reading;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RunningHoursMonitor}.
 */
class RunningHoursMonitorTest {

    @Test
    @DisplayName("Should count readings per operating point, busiest first")
    void shouldCountPerOperatingPoint() {
        List<Reading> readings = new ArrayList<>();
        add(readings, 1, 3200);
        add(readings, 3, 3000);
        add(readings, 2, 3100);

        List<RunningHoursStatus> statuses = new RunningHoursMonitor(2).evaluate(readings);

        assertThat(statuses).extracting(RunningHoursStatus::getValue).containsExactly(3000.0, 3100.0, 3200.0);
        assertThat(statuses).extracting(RunningHoursStatus::getRunningHours).containsExactly(3L, 2L, 1L);
        assertThat(statuses).extracting(RunningHoursStatus::getStatus).containsExactly(
                RunningHoursStatus.Status.MAINTENANCE_REQUIRED,
                RunningHoursStatus.Status.RUNNING_NORMALLY,
                RunningHoursStatus.Status.RUNNING_NORMALLY);
    }

    @Test
    @DisplayName("Should require maintenance only beyond 100 running hours by default")
    void shouldUseDefaultLimit() {
        List<Reading> readings = new ArrayList<>();
        add(readings, 101, 3000);
        add(readings, 100, 3100);

        List<RunningHoursStatus> statuses = new RunningHoursMonitor().evaluate(readings, MillField.MILL_KW);

        assertThat(statuses.get(0).isMaintenanceRequired()).isTrue();
        assertThat(statuses.get(1).isMaintenanceRequired()).isFalse();
    }

    @Test
    @DisplayName("Should reject a negative limit")
    void shouldRejectNegativeLimit() {
        assertThatThrownBy(() -> new RunningHoursMonitor(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static void add(List<Reading> readings, int times, double millKw) {
        for (int i = 0; i < times; i++) {
            readings.add(Reading.builder().value(MillField.MILL_KW, millKw).build());
        }
    }
}

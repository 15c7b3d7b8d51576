package com.millsentinel.core.trend;

import com.millsentinel.core.model.MillField;
import com.millsentinel.core.model.Reading;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RollingWindowAggregator}.
 */
class RollingWindowAggregatorTest {

    private static final MillField FIELD = MillField.RESIDUE;

    private final RollingWindowAggregator aggregator = new RollingWindowAggregator();

    @Test
    @DisplayName("Should average the current reading and the ten before it")
    void shouldAverageTrailingWindow() {
        List<RollingPoint> points = aggregator.stream(sequence(1, 15), FIELD).toList();

        assertThat(points).hasSize(15);
        // index 11 covers values 2..12
        assertThat(points.get(11).getMean()).isEqualTo(7.0);
        assertThat(points.get(11).getWindowSize()).isEqualTo(11);
        assertThat(points.get(10).getMean()).isEqualTo(6.0);
        assertThat(points.get(14).getMean()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("Should use partial windows at the start of the series")
    void shouldUsePartialWindows() {
        List<RollingPoint> points = aggregator.stream(sequence(1, 3), FIELD).toList();

        assertThat(points.get(0).getMean()).isEqualTo(1.0);
        assertThat(points.get(0).getWindowSize()).isEqualTo(1);
        assertThat(points.get(2).getMean()).isEqualTo(2.0);
        assertThat(points.get(2).getWindowSize()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should start over on every iteration")
    void shouldRestartOnEachIteration() {
        Iterable<RollingPoint> rolling = aggregator.rollingMean(sequence(1, 20), FIELD);

        List<RollingPoint> first = new ArrayList<>();
        rolling.forEach(first::add);
        List<RollingPoint> second = new ArrayList<>();
        rolling.forEach(second::add);

        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("Should skip missing values while keeping their window slot")
    void shouldSkipMissingValues() {
        List<Reading> readings = List.of(
                value(10.0), Reading.builder().value(MillField.MILL_TPH, 1.0).build(), value(20.0), value(30.0));

        List<RollingPoint> points = new RollingWindowAggregator(3).stream(readings, FIELD).toList();

        assertThat(points).extracting(RollingPoint::getMean).containsExactly(10.0, 10.0, 15.0, 25.0);
    }

    @Test
    @DisplayName("Should report an absent mean when the window holds no values")
    void shouldReportAbsentMean() {
        List<Reading> readings = List.of(Reading.builder().value(MillField.MILL_TPH, 1.0).build());

        RollingPoint point = aggregator.stream(readings, FIELD).findFirst().orElseThrow();

        assertThat(point.mean()).isEmpty();
        assertThat(point.getMean()).isNull();
    }

    @Test
    @DisplayName("Should reject a window smaller than one reading")
    void shouldRejectEmptyWindow() {
        assertThatThrownBy(() -> new RollingWindowAggregator(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("windowSize");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static List<Reading> sequence(int from, int to) {
        List<Reading> readings = new ArrayList<>();
        for (int i = from; i <= to; i++) {
            readings.add(value(i));
        }
        return readings;
    }

    private static Reading value(double residue) {
        return Reading.builder().value(FIELD, residue).build();
    }
}

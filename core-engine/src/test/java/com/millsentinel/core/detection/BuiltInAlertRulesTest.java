package com.millsentinel.core.detection;

import com.millsentinel.core.config.RulesLoader;
import com.millsentinel.core.model.Alert;
import com.millsentinel.core.model.AlertRule;
import com.millsentinel.core.model.MillField;
import com.millsentinel.core.model.Reading;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Behaviour of the rules shipped in {@code alert-rules.yml}.
 */
class BuiltInAlertRulesTest {

    private static final LocalDateTime START = LocalDateTime.of(2024, 4, 1, 0, 0);

    private List<AlertRule> rules;
    private final List<Reading> readings = new ArrayList<>();

    @BeforeEach
    void setUp() {
        rules = RulesLoader.fromClasspath(RulesLoader.DEFAULT_RESOURCE).getRules();
    }

    @Test
    @DisplayName("Should flag reject only above one and a half times its mean")
    void shouldFlagRejectRate() {
        // mean 1.333: 1.5x is 2.0, a 1.2x rule would also catch 1.7
        for (double reject : new double[] {1, 1, 1, 1, 1.7, 2.3}) {
            add(Map.of(MillField.REJECT, reject));
        }

        assertThat(alertValues("reject_rate", MillField.REJECT)).containsExactly(2.3);
    }

    @Test
    @DisplayName("Should flag outlet temperature strictly above 100 regardless of the mean")
    void shouldFlagHighTemperature() {
        for (double temp : new double[] {99, 100, 100.5, 150}) {
            add(Map.of(MillField.MILL_OUTLET_TEMP, temp));
        }

        assertThat(alertValues("high_temperature", MillField.MILL_OUTLET_TEMP)).containsExactly(150.0, 100.5);
    }

    @Test
    @DisplayName("Should flag a power spike on any one of the three drives")
    void shouldFlagPowerSpikeOnAnyField() {
        for (int i = 0; i < 9; i++) {
            add(drives(100, 100, 100));
        }
        add(drives(100, 100, 200));
        add(drives(200, 100, 100));

        AlertReport report = detector("power_spike").evaluate(readings);

        assertThat(report.getAlerts()).extracting(Alert::getTimestamp)
                .containsExactly(timestamp(10), timestamp(9));
    }

    @Test
    @DisplayName("Should group fan failures that show both low speed and high power")
    void shouldGroupFanFailures() {
        for (int i = 0; i < 9; i++) {
            add(Map.of(MillField.VENT_FAN_RPM, 1000.0, MillField.VENT_FAN_KW, 500.0));
        }
        add(Map.of(MillField.VENT_FAN_RPM, 500.0, MillField.VENT_FAN_KW, 800.0));
        add(Map.of(MillField.VENT_FAN_RPM, 500.0, MillField.VENT_FAN_KW, 800.0));
        // low speed only, and low speed with no power reading
        add(Map.of(MillField.VENT_FAN_RPM, 500.0, MillField.VENT_FAN_KW, 500.0));
        add(Map.of(MillField.VENT_FAN_RPM, 500.0));

        AlertReport report = detector("fan_failure").evaluate(readings);

        assertThat(report.getAlerts()).isEmpty();
        assertThat(report.getGroups()).singleElement().satisfies(group -> {
            assertThat(group.getValues()).containsOnly(
                    Map.entry(MillField.VENT_FAN_RPM, 500.0), Map.entry(MillField.VENT_FAN_KW, 800.0));
            assertThat(group.getOccurrences()).isEqualTo(2);
        });
    }

    @Test
    @DisplayName("Should require both slow separator and coarse residue for wear")
    void shouldRequireBothConditionsForWear() {
        for (int i = 0; i < 8; i++) {
            add(Map.of(MillField.SEPARATOR_RPM, 1000.0, MillField.RESIDUE, 10.0));
        }
        add(Map.of(MillField.SEPARATOR_RPM, 900.0, MillField.RESIDUE, 12.0));
        add(Map.of(MillField.SEPARATOR_RPM, 900.0, MillField.RESIDUE, 10.0));
        add(Map.of(MillField.SEPARATOR_RPM, 1000.0, MillField.RESIDUE, 12.0));

        AlertReport report = detector("separator_wear").evaluate(readings);

        assertThat(report.getAlerts()).extracting(Alert::getTimestamp).containsExactly(timestamp(8));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private AlertDetector detector(String name) {
        return AlertDetectorFactory.create(rules.stream()
                .filter(rule -> rule.getName().equals(name))
                .findFirst()
                .orElseThrow());
    }

    private List<Double> alertValues(String rule, MillField field) {
        return detector(rule).evaluate(readings).getAlerts().stream()
                .map(alert -> alert.getValues().get(field))
                .toList();
    }

    private void add(Map<MillField, Double> values) {
        Reading.Builder builder = Reading.builder().timestamp(START.plusHours(readings.size()));
        values.forEach(builder::value);
        readings.add(builder.build());
    }

    private static Map<MillField, Double> drives(double millKw, double separatorKw, double caFanKw) {
        return Map.of(MillField.MILL_KW, millKw, MillField.SEPARATOR_KW, separatorKw, MillField.CA_FAN_KW, caFanKw);
    }

    private static String timestamp(int index) {
        return Reading.builder().timestamp(START.plusHours(index)).build().getRawTimestamp();
    }
}

package com.millsentinel.core.stats;

import com.millsentinel.core.error.EmptyInputException;
import com.millsentinel.core.model.MillField;
import com.millsentinel.core.model.Reading;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link QuantileEngine}.
 */
class QuantileEngineTest {

    @Test
    @DisplayName("Should pick the floor-rank order statistic")
    void shouldPickFloorRank() {
        List<Reading> readings = readings(8, 3, 5, 1, 7, 2, 6, 4);

        QuartileFrame frame = QuantileEngine.quartiles(readings, MillField.MILL_TPH);

        // N = 8: Q1 at position 2, Q3 at position 6
        assertThat(frame.getQ1()).isEqualTo(2.0);
        assertThat(frame.getQ3()).isEqualTo(6.0);
        assertThat(frame.getIqr()).isEqualTo(4.0);
        assertThat(QuantileEngine.median(readings, MillField.MILL_TPH)).isEqualTo(4.0);
    }

    @Test
    @DisplayName("Should clamp the rank to the first element for small N")
    void shouldClampRank() {
        // N = 3: floor(0.75) = 0 is clamped to position 1
        assertThat(QuantileEngine.quartiles(readings(30, 10, 20), MillField.MILL_TPH).getQ1())
                .isEqualTo(10.0);
        assertThat(QuantileEngine.rankIndex(3, 0.0)).isZero();
        assertThat(QuantileEngine.rankIndex(3, 1.0)).isEqualTo(2);
    }

    @Test
    @DisplayName("Should return the single value for every quartile when N = 1")
    void shouldHandleSingleValue() {
        QuartileFrame frame = QuantileEngine.quartiles(readings(42), MillField.MILL_TPH);

        assertThat(frame.getQ1()).isEqualTo(42.0);
        assertThat(frame.getQ3()).isEqualTo(42.0);
    }

    @Test
    @DisplayName("Should ignore readings that do not carry the field")
    void shouldIgnoreMissingValues() {
        List<Reading> readings = new ArrayList<>(readings(1, 2, 3, 4));
        readings.add(Reading.builder().value(MillField.MILL_KW, 1000.0).build());

        assertThat(QuantileEngine.valueAtRank(readings, MillField.MILL_TPH, 1.0)).isEqualTo(4.0);
    }

    @Test
    @DisplayName("Should keep Q1 at or below Q3 for arbitrary data")
    void shouldOrderQuartiles() {
        Random random = new Random(7);
        for (int run = 0; run < 50; run++) {
            double[] values = new double[1 + random.nextInt(40)];
            for (int i = 0; i < values.length; i++) {
                values[i] = random.nextGaussian() * 100;
            }
            QuartileFrame frame = QuantileEngine.quartiles(readings(values), MillField.MILL_TPH);
            assertThat(frame.getQ1()).isLessThanOrEqualTo(frame.getQ3());
        }
    }

    @Test
    @DisplayName("Should throw EmptyInputException when no values are present")
    void shouldThrowOnEmptyInput() {
        assertThatThrownBy(() -> QuantileEngine.quartiles(List.of(), MillField.MILL_TPH))
                .isInstanceOf(EmptyInputException.class);

        List<Reading> noThroughput = List.of(Reading.builder().value(MillField.MILL_KW, 1.0).build());
        assertThatThrownBy(() -> QuantileEngine.median(noThroughput, MillField.MILL_TPH))
                .isInstanceOf(EmptyInputException.class)
                .hasMessageContaining("MILL_TPH");
    }

    @Test
    @DisplayName("Should reject fractions outside [0, 1]")
    void shouldRejectBadFraction() {
        assertThatThrownBy(() -> QuantileEngine.valueAtRank(readings(1, 2), MillField.MILL_TPH, 1.5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("fraction");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static List<Reading> readings(double... throughput) {
        List<Reading> readings = new ArrayList<>();
        for (double value : throughput) {
            readings.add(Reading.builder().value(MillField.MILL_TPH, value).build());
        }
        return readings;
    }
}

package com.millsentinel.core.store;

import com.millsentinel.core.model.MillField;
import com.millsentinel.core.model.Reading;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ReadingCleaner}.
 */
class ReadingCleanerTest {

    private final ReadingCleaner cleaner = new ReadingCleaner();

    @Test
    @DisplayName("Should keep the earliest of duplicate readings")
    void shouldKeepEarliestDuplicate() {
        Reading later = reading("01/02/2024 10:00", 180);
        Reading earlier = reading("01/01/2024 10:00", 180);

        CleaningResult result = cleaner.clean(List.of(later, earlier));

        assertThat(result.getReadings()).hasSize(1);
        assertThat(result.getReadings().get(0)).isSameAs(earlier);
        assertThat(result.getRemovedDuplicates()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should compare only the key fields when detecting duplicates")
    void shouldIgnoreNonKeyFields() {
        Reading first = keyed("01/01/2024 10:00", 180).value(MillField.RESIDUE, 10.0).build();
        Reading second = keyed("01/01/2024 11:00", 180).value(MillField.RESIDUE, 12.0).build();
        Reading different = keyed("01/01/2024 12:00", 180).value(MillField.MILL_KW, 3000.0).build();

        CleaningResult result = cleaner.clean(List.of(first, second, different));

        assertThat(result.getReadings()).containsExactly(first, different);
    }

    @Test
    @DisplayName("Should never treat readings with a missing key field as duplicates")
    void shouldKeepReadingsWithMissingKeyField() {
        Reading first = Reading.builder().timestamp("01/01/2024 00:00").value(MillField.MILL_TPH, 150.0).build();
        Reading second = Reading.builder().timestamp("01/01/2024 01:00").value(MillField.MILL_TPH, 150.0).build();
        Reading noClinker = keyed("01/01/2024 02:00", 150).value(MillField.CLINKER_TPH, null).build();
        Reading noClinkerAgain = keyed("01/01/2024 03:00", 150).value(MillField.CLINKER_TPH, null).build();

        CleaningResult result = cleaner.clean(List.of(first, second, noClinker, noClinkerAgain));

        assertThat(result.getReadings()).containsExactly(first, second, noClinker, noClinkerAgain);
        assertThat(result.getRemovedDuplicates()).isZero();
    }

    @Test
    @DisplayName("Should keep the first encountered of duplicates with equal timestamps")
    void shouldKeepFirstOnTie() {
        Reading first = reading("01/01/2024 10:00", 180);
        Reading second = reading("01/01/2024 10:00", 180);

        assertThat(cleaner.clean(List.of(first, second)).getReadings().get(0)).isSameAs(first);
    }

    @Test
    @DisplayName("Should prefer a parsable timestamp over an unparsable one among duplicates")
    void shouldTreatUnparsableAsLatest() {
        Reading unparsable = reading("sometime", 180);
        Reading parsed = reading("12/31/2024 23:00", 180);

        assertThat(cleaner.clean(List.of(unparsable, parsed)).getReadings()).containsExactly(parsed);
    }

    @Test
    @DisplayName("Should remove readings without mill throughput")
    void shouldRemoveMissingThroughput() {
        Reading noThroughput = Reading.builder().timestamp("01/01/2024 10:00")
                .value(MillField.MILL_KW, 3000.0).build();

        CleaningResult result = cleaner.clean(List.of(noThroughput, reading("01/01/2024 11:00", 170)));

        assertThat(result.getReadings()).hasSize(1);
        assertThat(result.getRemovedMissingThroughput()).isEqualTo(1);
        assertThat(result.getRemovedTotal()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should order by timestamp with unparsable timestamps last in input order")
    void shouldOrderChronologically() {
        Reading unparsableA = reading("a", 1);
        Reading march = reading("03/01/2024 00:00", 2);
        Reading unparsableB = reading("b", 3);
        Reading january = reading("01/01/2024 00:00", 4);
        List<Reading> raw = new ArrayList<>(List.of(unparsableA, march, unparsableB, january));

        CleaningResult result = cleaner.clean(raw);

        assertThat(result.getReadings()).containsExactly(january, march, unparsableA, unparsableB);
        assertThat(raw).containsExactly(unparsableA, march, unparsableB, january);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Reading reading(String timestamp, double throughput) {
        return keyed(timestamp, throughput).build();
    }

    /** Builder with every dedup key field set; throughput varies, the rest is fixed. */
    private static Reading.Builder keyed(String timestamp, double throughput) {
        Reading.Builder builder = Reading.builder().timestamp(timestamp);
        for (MillField field : MillField.DEDUP_KEY) {
            builder.value(field, 10.0);
        }
        return builder.value(MillField.MILL_TPH, throughput);
    }
}

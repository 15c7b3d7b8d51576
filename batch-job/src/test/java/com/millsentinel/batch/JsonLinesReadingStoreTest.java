package com.millsentinel.batch;

import com.millsentinel.core.model.MillField;
import com.millsentinel.core.model.Reading;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JsonLinesReadingStore}.
 */
class JsonLinesReadingStoreTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should load, clean and order the sample snapshot")
    void shouldLoadSample() throws IOException, URISyntaxException {
        JsonLinesReadingStore store = JsonLinesReadingStore.load(sample());

        InputSummary summary = store.getSummary();
        assertThat(summary.getLinesRead()).isEqualTo(25);
        assertThat(summary.getMalformedLines()).isEqualTo(1);
        assertThat(summary.getRemovedMissingThroughput()).isEqualTo(1);
        assertThat(summary.getRemovedDuplicates()).isEqualTo(1);
        assertThat(summary.getReadings()).isEqualTo(22);

        assertThat(store.readings()).hasSize(22);
        assertThat(store.readings().get(0).getTimestamp()).isEqualTo(LocalDateTime.of(2024, 1, 3, 6, 0));
        assertThat(store.readings()).isSortedAccordingTo(Reading.CHRONOLOGICAL);
        assertThat(store.readings()).noneMatch(r -> r.getNumericField(MillField.RESIDUE).orElse(0.0) == 99.0);
    }

    @Test
    @DisplayName("Should skip blank, malformed and non-object lines")
    void shouldSkipBadLines() throws IOException {
        Path file = tempDir.resolve("readings.jsonl");
        Files.writeString(file, String.join("\n",
                "{\"Date & Time\": \"01/01/2024 00:00\", \"Mill TPH\": 150}",
                "",
                "not json",
                "null",
                "[1, 2, 3]",
                "{\"Date & Time\": \"01/01/2024 01:00\", \"Mill TPH\": \"151.5\"}"));

        JsonLinesReadingStore store = JsonLinesReadingStore.load(file);

        assertThat(store.readings()).extracting(r -> r.getNumericField(MillField.MILL_TPH).orElseThrow())
                .containsExactly(150.0, 151.5);
        assertThat(store.getSummary().getLinesRead()).isEqualTo(5);
        assertThat(store.getSummary().getMalformedLines()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should drop a line that is not valid UTF-8 and keep its neighbours")
    void shouldSkipInvalidUtf8Line() throws IOException {
        Path file = tempDir.resolve("bad-bytes.jsonl");
        ByteArrayOutputStream content = new ByteArrayOutputStream();
        content.writeBytes("{\"Date & Time\": \"01/01/2024 00:00\", \"Mill TPH\": 150}\n"
                .getBytes(StandardCharsets.UTF_8));
        content.writeBytes(new byte[] {'{', '"', 'x', '"', ':', '"', (byte) 0xC3, 0x28, '"', '}', '\r', '\n'});
        content.writeBytes("{\"Date & Time\": \"01/01/2024 01:00\", \"Mill TPH\": 151}"
                .getBytes(StandardCharsets.UTF_8));
        Files.write(file, content.toByteArray());

        JsonLinesReadingStore store = JsonLinesReadingStore.load(file);

        assertThat(store.readings()).extracting(Reading::getRawTimestamp)
                .containsExactly("01/01/2024 00:00", "01/01/2024 01:00");
        assertThat(store.getSummary().getLinesRead()).isEqualTo(3);
        assertThat(store.getSummary().getMalformedLines()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should throw on a missing file")
    void shouldThrowOnMissingFile() {
        assertThatThrownBy(() -> JsonLinesReadingStore.load(tempDir.resolve("missing.jsonl")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static Path sample() throws URISyntaxException {
        return Path.of(JsonLinesReadingStoreTest.class.getClassLoader()
                .getResource("readings-sample.jsonl").toURI());
    }
}

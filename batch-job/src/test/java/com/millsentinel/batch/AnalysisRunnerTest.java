package com.millsentinel.batch;

import com.millsentinel.core.config.RulesLoader;
import com.millsentinel.core.detection.AlertDetector;
import com.millsentinel.core.detection.AlertDetectorFactory;
import com.millsentinel.core.model.MillField;
import com.millsentinel.core.model.Reading;
import com.millsentinel.core.trend.GrowthStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URISyntaxException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AnalysisRunner}.
 */
class AnalysisRunnerTest {

    private AnalysisRunner runner;

    @BeforeEach
    void setUp() {
        JobConfig config = JobConfig.builder().inputPath("unused").parallelism(3).build();
        List<AlertDetector> detectors = AlertDetectorFactory.createAll(
                RulesLoader.fromClasspath(RulesLoader.DEFAULT_RESOURCE).getRules());
        runner = new AnalysisRunner(config, detectors);
    }

    @Test
    @DisplayName("Should run every analysis over the sample snapshot")
    void shouldRunAllAnalyses() throws IOException, URISyntaxException {
        JsonLinesReadingStore store = JsonLinesReadingStore.load(JsonLinesReadingStoreTest.sample());

        AnalysisReport report = runner.run(store.readings(), store.getSummary());

        assertThat(report.getFailures()).isEmpty();
        assertThat(report.getInput().getReadings()).isEqualTo(22);
        assertThat(report.getSummaries()).containsOnlyKeys(MillField.MILL_TPH, MillField.MILL_KW);
        assertThat(report.getSummaries().get(MillField.MILL_TPH).getCount()).isEqualTo(22);

        assertThat(report.getOutliers().getOutliers())
                .extracting(Reading::getRawTimestamp)
                .containsExactly("02/10/2024 15:00");

        assertThat(report.getCorrelations()).containsOnlyKeys(
                "MILL_TPH~MILL_KW", "SEPARATOR_RPM~RESIDUE", "VENT_FAN_RPM~VENT_FAN_KW");
        assertThat(report.getCorrelations().values()).allMatch(r -> r >= -1 && r <= 1);

        assertThat(report.getAlerts()).hasSize(9);
        assertThat(report.getAlerts().get("high_temperature").getAlerts()).hasSize(1);
        assertThat(report.getAlerts().get("reject_rate").getAlerts()).hasSize(1);
        assertThat(report.getAlerts().get("underperformance").getAlerts()).hasSize(1);

        assertThat(report.getRollingMean()).hasSize(22);
        assertThat(report.getMonthly()).containsOnlyKeys(
                "production_efficiency", "separator_performance", "energy_per_ton");
        assertThat(report.getMonthly().get("energy_per_ton")).hasSize(3);
        assertThat(report.getProductionGrowth()).extracting(g -> g.getStatus())
                .containsExactly(GrowthStatus.NO_PREVIOUS, GrowthStatus.DEFINED, GrowthStatus.DEFINED);
        assertThat(report.getThroughputBy()).hasSize(3);
        assertThat(report.getRunningHours()).isNotEmpty();
    }

    @Test
    @DisplayName("Should record failing analyses and still complete the others")
    void shouldIsolateFailures() {
        // throughput only: every analysis of another field has no input
        List<Reading> readings = new ArrayList<>();
        for (int day = 1; day <= 5; day++) {
            readings.add(Reading.builder()
                    .timestamp(LocalDateTime.of(2024, 1, day, 8, 0))
                    .value(MillField.MILL_TPH, 150.0 + day)
                    .build());
        }

        AnalysisReport report = runner.run(readings, null);

        assertThat(report.getFailures())
                .extracting(AnalysisFailure::getAnalysis)
                .contains("summary:MILL_KW", "outliers", "correlation:MILL_TPH~MILL_KW", "alert:reject_rate")
                .doesNotContain("summary:MILL_TPH", "alert:underperformance", "growth:production");
        assertThat(report.getFailures())
                .filteredOn(f -> f.getAnalysis().equals("summary:MILL_KW"))
                .extracting(AnalysisFailure::getType)
                .containsExactly("EmptyInputException");

        assertThat(report.getSummaries()).containsOnlyKeys(MillField.MILL_TPH);
        assertThat(report.getAlerts()).containsKey("underperformance");
        assertThat(report.getProductionGrowth()).hasSize(1);
        assertThat(report.getRollingMean()).hasSize(5);
    }
}

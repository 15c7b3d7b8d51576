package com.millsentinel.batch;

import com.millsentinel.core.model.MillField;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Should apply defaults for everything but the input path")
    void shouldApplyDefaults() {
        JobConfig config = JobConfig.builder().inputPath("readings.jsonl").build();

        assertThat(config.getReportPath()).isEqualTo("mill-report.json");
        assertThat(config.getRulesConfigPath()).isEmpty();
        assertThat(config.getParallelism()).isEqualTo(4);
        assertThat(config.getRollingWindowSize()).isEqualTo(11);
        assertThat(config.getFenceMultiplier()).isEqualTo(1.5);
        assertThat(config.getMaxRunningHours()).isEqualTo(100);
        assertThat(config.getOutlierFields()).containsExactly(MillField.MILL_TPH, MillField.CLINKER_TPH);
        assertThat(config.getSummaryFields()).containsExactly(MillField.MILL_TPH, MillField.MILL_KW);
        assertThat(config.getRollingField()).isEqualTo(MillField.RESIDUE);
    }

    @Test
    @DisplayName("Should let command-line arguments override the paths")
    void shouldApplyArguments() {
        JobConfig config = JobConfig.builder()
                .inputPath("from-env.jsonl")
                .arguments("from-args.jsonl", "out/report.json")
                .build();

        assertThat(config.getInputPath()).isEqualTo("from-args.jsonl");
        assertThat(config.getReportPath()).isEqualTo("out/report.json");
    }

    @Test
    @DisplayName("Should reject more than two arguments")
    void shouldRejectExtraArguments() {
        assertThatThrownBy(() -> JobConfig.builder().arguments("a", "b", "c"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Usage");
    }

    @Test
    @DisplayName("Should require an input path")
    void shouldRequireInputPath() {
        assertThatThrownBy(() -> JobConfig.builder().build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("inputPath");
    }

    @Test
    @DisplayName("Should reject out-of-range analysis parameters")
    void shouldValidateRanges() {
        assertThatThrownBy(() -> JobConfig.builder().inputPath("x").parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism");
        assertThatThrownBy(() -> JobConfig.builder().inputPath("x").rollingWindowSize(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("rollingWindowSize");
        assertThatThrownBy(() -> JobConfig.builder().inputPath("x").fenceMultiplier(Double.NaN).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("fenceMultiplier");
        assertThatThrownBy(() -> JobConfig.builder().inputPath("x").outlierFields(List.of()).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("outlierFields");
    }

    @Test
    @DisplayName("Should parse field lists by constant or column name")
    void shouldParseFieldLists() {
        assertThat(JobConfig.parseFields("MILL_TPH, Sep KW,,residue"))
                .containsExactly(MillField.MILL_TPH, MillField.SEPARATOR_KW, MillField.RESIDUE);
        assertThatThrownBy(() -> JobConfig.parseFields("MILL_TPH,Kiln Speed"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

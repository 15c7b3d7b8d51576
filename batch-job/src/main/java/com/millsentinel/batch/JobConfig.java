package com.millsentinel.batch;

import com.millsentinel.core.detection.IqrOutlierDetector;
import com.millsentinel.core.detection.RunningHoursMonitor;
import com.millsentinel.core.model.MillField;
import com.millsentinel.core.trend.RollingWindowAggregator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Typed, immutable configuration of one Mill Sentinel batch run.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults. The
 * command line may override the input and report paths:
 * {@code <input> [report]}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment(String...)} for production, or the
 * {@link Builder} for programmatic / test scenarios. The builder validates
 * inputs at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig {

    // ---------------------------------------------------------------
    // Input / output
    // ---------------------------------------------------------------
    private final String inputPath;
    private final String reportPath;
    private final String rulesConfigPath;

    // ---------------------------------------------------------------
    // Execution
    // ---------------------------------------------------------------
    private final int parallelism;

    // ---------------------------------------------------------------
    // Analysis parameters
    // ---------------------------------------------------------------
    private final int rollingWindowSize;
    private final double fenceMultiplier;
    private final int maxRunningHours;
    private final List<MillField> outlierFields;
    private final List<MillField> summaryFields;
    private final MillField rollingField;

    private JobConfig(Builder b) {
        this.inputPath = b.inputPath;
        this.reportPath = b.reportPath;
        this.rulesConfigPath = b.rulesConfigPath;
        this.parallelism = b.parallelism;
        this.rollingWindowSize = b.rollingWindowSize;
        this.fenceMultiplier = b.fenceMultiplier;
        this.maxRunningHours = b.maxRunningHours;
        this.outlierFields = List.copyOf(b.outlierFields);
        this.summaryFields = List.copyOf(b.summaryFields);
        this.rollingField = b.rollingField;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Factory — resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables, with the paths
     * optionally overridden by command-line arguments.
     *
     * @param args {@code <input> [report]}, may be empty
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment(String... args) {
        try {
            return new Builder()
                    .inputPath(env("INPUT_PATH", ""))
                    .reportPath(env("REPORT_PATH", Builder.DEFAULT_REPORT_PATH))
                    .rulesConfigPath(env("RULES_CONFIG_PATH", ""))
                    .parallelism(parseIntEnv("ANALYSIS_PARALLELISM", "4"))
                    .rollingWindowSize(parseIntEnv("ROLLING_WINDOW_SIZE",
                            String.valueOf(RollingWindowAggregator.DEFAULT_WINDOW_SIZE)))
                    .fenceMultiplier(parseDoubleEnv("IQR_FENCE_MULTIPLIER",
                            String.valueOf(IqrOutlierDetector.DEFAULT_FENCE_MULTIPLIER)))
                    .maxRunningHours(parseIntEnv("MAX_RUNNING_HOURS",
                            String.valueOf(RunningHoursMonitor.DEFAULT_MAX_RUNNING_HOURS)))
                    .outlierFields(parseFields(env("OUTLIER_FIELDS", "MILL_TPH,CLINKER_TPH")))
                    .summaryFields(parseFields(env("SUMMARY_FIELDS", "MILL_TPH,MILL_KW")))
                    .rollingField(MillField.fromName(env("ROLLING_FIELD", "RESIDUE")))
                    .arguments(args)
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getInputPath() {
        return inputPath;
    }

    public String getReportPath() {
        return reportPath;
    }

    /**
     * @return rules file path, or an empty string for the built-in rules
     */
    public String getRulesConfigPath() {
        return rulesConfigPath;
    }

    public int getParallelism() {
        return parallelism;
    }

    public int getRollingWindowSize() {
        return rollingWindowSize;
    }

    public double getFenceMultiplier() {
        return fenceMultiplier;
    }

    public int getMaxRunningHours() {
        return maxRunningHours;
    }

    public List<MillField> getOutlierFields() {
        return outlierFields;
    }

    public List<MillField> getSummaryFields() {
        return summaryFields;
    }

    public MillField getRollingField() {
        return rollingField;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (non-blank paths, parallelism &gt; 0, window size &gt; 0,
     * non-negative fence multiplier and running-hours limit, at least one
     * outlier and summary field).
     * </p>
     */
    public static class Builder {
        static final String DEFAULT_REPORT_PATH = "mill-report.json";

        private String inputPath;
        private String reportPath = DEFAULT_REPORT_PATH;
        private String rulesConfigPath = "";
        private int parallelism = 4;
        private int rollingWindowSize = RollingWindowAggregator.DEFAULT_WINDOW_SIZE;
        private double fenceMultiplier = IqrOutlierDetector.DEFAULT_FENCE_MULTIPLIER;
        private int maxRunningHours = RunningHoursMonitor.DEFAULT_MAX_RUNNING_HOURS;
        private List<MillField> outlierFields = List.of(MillField.MILL_TPH, MillField.CLINKER_TPH);
        private List<MillField> summaryFields = List.of(MillField.MILL_TPH, MillField.MILL_KW);
        private MillField rollingField = MillField.RESIDUE;

        public Builder inputPath(String v) {
            this.inputPath = v;
            return this;
        }

        public Builder reportPath(String v) {
            this.reportPath = v;
            return this;
        }

        public Builder rulesConfigPath(String v) {
            this.rulesConfigPath = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder rollingWindowSize(int v) {
            this.rollingWindowSize = v;
            return this;
        }

        public Builder fenceMultiplier(double v) {
            this.fenceMultiplier = v;
            return this;
        }

        public Builder maxRunningHours(int v) {
            this.maxRunningHours = v;
            return this;
        }

        public Builder outlierFields(List<MillField> v) {
            this.outlierFields = v;
            return this;
        }

        public Builder summaryFields(List<MillField> v) {
            this.summaryFields = v;
            return this;
        }

        public Builder rollingField(MillField v) {
            this.rollingField = v;
            return this;
        }

        /**
         * Apply command-line arguments: the first overrides the input path,
         * the second the report path.
         *
         * @throws IllegalArgumentException if more than two arguments are given
         */
        public Builder arguments(String... args) {
            if (args == null || args.length == 0) {
                return this;
            }
            if (args.length > 2) {
                throw new IllegalArgumentException(
                        "Usage: MillAnalysisJob <input> [report], got " + args.length + " arguments");
            }
            inputPath(args[0]);
            if (args.length == 2) {
                reportPath(args[1]);
            }
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            requireNonBlank(inputPath, "inputPath");
            requireNonBlank(reportPath, "reportPath");
            Objects.requireNonNull(rulesConfigPath, "rulesConfigPath required");
            Objects.requireNonNull(rollingField, "rollingField required");
            requireNonEmpty(outlierFields, "outlierFields");
            requireNonEmpty(summaryFields, "summaryFields");

            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (rollingWindowSize < 1) {
                throw new IllegalArgumentException(
                        "rollingWindowSize must be >= 1, got: " + rollingWindowSize);
            }
            if (!Double.isFinite(fenceMultiplier) || fenceMultiplier < 0) {
                throw new IllegalArgumentException(
                        "fenceMultiplier must be a finite value >= 0, got: " + fenceMultiplier);
            }
            if (maxRunningHours < 0) {
                throw new IllegalArgumentException(
                        "maxRunningHours must be >= 0, got: " + maxRunningHours);
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }

        private static void requireNonEmpty(List<MillField> value, String name) {
            if (value == null || value.isEmpty()) {
                throw new IllegalArgumentException(name + " must name at least one field");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    private static double parseDoubleEnv(String name, String defaultValue) {
        return Double.parseDouble(env(name, defaultValue));
    }

    /**
     * @param names comma-separated constant or column names
     * @throws IllegalArgumentException if a name is not a known field
     */
    static List<MillField> parseFields(String names) {
        List<MillField> fields = new ArrayList<>();
        Arrays.stream(names.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(MillField::fromName)
                .forEach(fields::add);
        return fields;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "inputPath='" + inputPath + '\'' +
                ", reportPath='" + reportPath + '\'' +
                ", rulesConfigPath='" + rulesConfigPath + '\'' +
                ", parallelism=" + parallelism +
                ", rollingWindowSize=" + rollingWindowSize +
                ", fenceMultiplier=" + fenceMultiplier +
                ", maxRunningHours=" + maxRunningHours +
                ", outlierFields=" + outlierFields +
                ", summaryFields=" + summaryFields +
                ", rollingField=" + rollingField +
                '}';
    }
}

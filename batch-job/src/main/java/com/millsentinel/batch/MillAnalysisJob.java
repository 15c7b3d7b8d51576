package com.millsentinel.batch;

import com.millsentinel.core.config.RulesConfig;
import com.millsentinel.core.config.RulesLoader;
import com.millsentinel.core.detection.AlertDetector;
import com.millsentinel.core.detection.AlertDetectorFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Main entry point for a Mill Sentinel batch run.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   JSON-lines snapshot
 *     → parse → Reading
 *     → clean (drop missing throughput, dedupe, order by time)
 *     → AnalysisRunner (statistics, outliers, alerts, trends in parallel)
 *     → JSON report
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * All configuration is resolved from environment variables via
 * {@link JobConfig}; the command line {@code <input> [report]} overrides the
 * paths. Configuration and I/O errors end the run with a non-zero status. A
 * failing analysis does not: it is listed in the report.
 * </p>
 *
 * @since 1.0.0
 */
public final class MillAnalysisJob {

    private static final Logger LOG = LoggerFactory.getLogger(MillAnalysisJob.class);

    private MillAnalysisJob() {
        // entry-point class — not instantiable
    }

    public static void main(String[] args) throws IOException {
        // 1. Load configuration
        JobConfig config = JobConfig.fromEnvironment(args);
        LOG.info("Starting Mill Sentinel with config: {}", config);

        // 2. Run
        AnalysisReport report = run(config);

        // 3. Write the report
        new ReportWriter().write(report, Path.of(config.getReportPath()));
    }

    /**
     * Load rules and readings and run every analysis.
     *
     * @throws IllegalArgumentException if the input or rules file is missing
     * @throws IllegalStateException    if the rules are invalid
     * @throws IOException              if the input cannot be read
     */
    static AnalysisReport run(JobConfig config) throws IOException {
        List<AlertDetector> detectors = AlertDetectorFactory.createAll(loadRules(config).getRules());

        JsonLinesReadingStore store = JsonLinesReadingStore.load(Path.of(config.getInputPath()));
        if (store.readings().isEmpty()) {
            LOG.warn("No readings left after cleaning {}; every analysis will report empty input",
                    config.getInputPath());
        }

        return new AnalysisRunner(config, detectors).run(store.readings(), store.getSummary());
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static RulesConfig loadRules(JobConfig config) {
        String rulesPath = config.getRulesConfigPath();
        if (rulesPath != null && !rulesPath.isBlank()) {
            return RulesLoader.fromFile(Path.of(rulesPath));
        }
        return RulesLoader.load();
    }
}

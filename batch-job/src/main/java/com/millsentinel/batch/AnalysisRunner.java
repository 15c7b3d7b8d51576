package com.millsentinel.batch;

import com.millsentinel.core.detection.AlertDetector;
import com.millsentinel.core.detection.IqrOutlierDetector;
import com.millsentinel.core.detection.RunningHoursMonitor;
import com.millsentinel.core.model.MillField;
import com.millsentinel.core.model.Reading;
import com.millsentinel.core.stats.CorrelationAnalyzer;
import com.millsentinel.core.stats.FieldGrouping;
import com.millsentinel.core.stats.MomentEngine;
import com.millsentinel.core.stats.QuartileFrame;
import com.millsentinel.core.trend.MonthlyTrendAggregator;
import com.millsentinel.core.trend.RollingWindowAggregator;
import com.millsentinel.core.trend.TrendMetric;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs every analysis of a batch over one reading snapshot.
 *
 * <p>
 * Analyses are independent and run concurrently on a fixed pool of
 * {@link JobConfig#getParallelism()} threads. The snapshot is the only shared
 * state and is read-only. An analysis that throws is recorded as an
 * {@link AnalysisFailure}; the others still complete.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalysisRunner {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisRunner.class);

    /** Field pairs whose Pearson correlation is reported. */
    static final List<MillField[]> CORRELATION_PAIRS = List.of(
            new MillField[] {MillField.MILL_TPH, MillField.MILL_KW},
            new MillField[] {MillField.SEPARATOR_RPM, MillField.RESIDUE},
            new MillField[] {MillField.VENT_FAN_RPM, MillField.VENT_FAN_KW});

    /** Fields by which mean mill throughput is grouped. */
    static final List<MillField> THROUGHPUT_GROUPINGS = List.of(
            MillField.SEPARATOR_RPM, MillField.VENT_FAN_KW, MillField.RESIDUE);

    private final JobConfig config;
    private final List<AlertDetector> detectors;

    /**
     * @param config    analysis parameters
     * @param detectors one detector per alert rule, in report order
     */
    public AnalysisRunner(JobConfig config, List<AlertDetector> detectors) {
        this.config = Objects.requireNonNull(config, "JobConfig must not be null");
        this.detectors = List.copyOf(Objects.requireNonNull(detectors, "Detectors must not be null"));
    }

    /**
     * Run all analyses and wait for them to finish.
     *
     * @param readings cleaned, time-ordered snapshot
     * @param input    how the snapshot was obtained, may be {@code null}
     * @return the report, including any failures
     */
    public AnalysisReport run(List<Reading> readings, InputSummary input) {
        List<Reading> snapshot = Collections.unmodifiableList(
                Objects.requireNonNull(readings, "Readings must not be null"));
        AnalysisReport.Builder report = AnalysisReport.builder().input(input);

        ExecutorService pool = Executors.newFixedThreadPool(config.getParallelism(), new AnalysisThreadFactory());
        try {
            List<Pending<?>> pending = submitAll(pool, snapshot, report);
            LOG.info("Running {} analyses over {} reading(s) on {} thread(s)",
                    pending.size(), snapshot.size(), config.getParallelism());
            for (Pending<?> task : pending) {
                task.collect(report);
            }
        } finally {
            pool.shutdownNow();
        }

        AnalysisReport result = report.build();
        if (result.getFailures().isEmpty()) {
            LOG.info("All analyses completed");
        } else {
            LOG.warn("{} analysis(es) failed: {}", result.getFailures().size(), result.getFailures());
        }
        return result;
    }

    // ---------------------------------------------------------------
    // Analyses
    // ---------------------------------------------------------------

    private List<Pending<?>> submitAll(ExecutorService pool, List<Reading> readings,
            AnalysisReport.Builder report) {
        List<Pending<?>> pending = new ArrayList<>();

        for (MillField field : config.getSummaryFields()) {
            pending.add(submit(pool, "summary:" + field,
                    () -> MomentEngine.summarize(readings, field),
                    summary -> report.summary(field, summary)));
        }

        IqrOutlierDetector outlierDetector = new IqrOutlierDetector(config.getFenceMultiplier());
        pending.add(submit(pool, "outliers", () -> {
            Map<MillField, QuartileFrame> fences = outlierDetector.fences(readings, config.getOutlierFields());
            List<Reading> outliers = outlierDetector.detect(readings, config.getOutlierFields());
            return new OutlierReport(outlierDetector.getFenceMultiplier(), fences, outliers);
        }, report::outliers));

        for (MillField[] pair : CORRELATION_PAIRS) {
            String name = pair[0] + "~" + pair[1];
            pending.add(submit(pool, "correlation:" + name,
                    () -> CorrelationAnalyzer.pearson(readings, pair[0], pair[1]),
                    r -> report.correlation(name, r)));
        }

        for (AlertDetector detector : detectors) {
            pending.add(submit(pool, "alert:" + detector.getRuleName(),
                    () -> detector.evaluate(readings),
                    report::alerts));
        }

        RollingWindowAggregator rolling = new RollingWindowAggregator(config.getRollingWindowSize());
        pending.add(submit(pool, "rolling_mean:" + config.getRollingField(),
                () -> rolling.stream(readings, config.getRollingField()).toList(),
                report::rollingMean));

        MonthlyTrendAggregator monthly = new MonthlyTrendAggregator();
        pending.add(submit(pool, "monthly:production_efficiency",
                () -> monthly.aggregate(readings,
                        TrendMetric.mean(MillField.MILL_TPH), TrendMetric.mean(MillField.MILL_KW)),
                buckets -> report.monthly("production_efficiency", buckets)));
        pending.add(submit(pool, "monthly:separator_performance",
                () -> monthly.aggregate(readings,
                        TrendMetric.mean(MillField.SEPARATOR_RPM), TrendMetric.mean(MillField.RESIDUE)),
                buckets -> report.monthly("separator_performance", buckets)));
        pending.add(submit(pool, "monthly:energy_per_ton",
                () -> monthly.aggregate(readings,
                        TrendMetric.ratioOfSums(MillField.MILL_KW, MillField.MILL_TPH).named("energy_per_ton")),
                buckets -> report.monthly("energy_per_ton", buckets)));
        pending.add(submit(pool, "growth:production",
                () -> monthly.growth(readings, TrendMetric.mean(MillField.MILL_TPH)),
                report::productionGrowth));

        for (MillField key : THROUGHPUT_GROUPINGS) {
            pending.add(submit(pool, "throughput_by:" + key,
                    () -> FieldGrouping.meanBy(readings, key, MillField.MILL_TPH),
                    means -> report.throughputBy(key, means)));
        }

        RunningHoursMonitor monitor = new RunningHoursMonitor(config.getMaxRunningHours());
        pending.add(submit(pool, "running_hours",
                () -> monitor.evaluate(readings),
                report::runningHours));

        return pending;
    }

    private static <T> Pending<T> submit(ExecutorService pool, String name, Callable<T> analysis,
            Consumer<T> sink) {
        return new Pending<>(name, pool.submit(analysis), sink);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    /** A submitted analysis and where its result goes. */
    private static final class Pending<T> {
        private final String name;
        private final Future<T> future;
        private final Consumer<T> sink;

        Pending(String name, Future<T> future, Consumer<T> sink) {
            this.name = name;
            this.future = future;
            this.sink = sink;
        }

        void collect(AnalysisReport.Builder report) {
            try {
                T result = future.get();
                sink.accept(result);
                LOG.debug("Analysis [{}] completed", name);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                LOG.warn("Analysis [{}] failed - continuing with the others: {}", name, cause.toString());
                report.failure(new AnalysisFailure(name, cause));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for analysis " + name, e);
            }
        }
    }

    private static final class AnalysisThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "analysis-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}

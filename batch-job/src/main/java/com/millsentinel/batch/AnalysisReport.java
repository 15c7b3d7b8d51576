package com.millsentinel.batch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.millsentinel.core.detection.AlertReport;
import com.millsentinel.core.detection.RunningHoursStatus;
import com.millsentinel.core.model.MillField;
import com.millsentinel.core.stats.StatisticalSummary;
import com.millsentinel.core.trend.MonthlyBucket;
import com.millsentinel.core.trend.MonthlyGrowth;
import com.millsentinel.core.trend.RollingPoint;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;

/**
 * Everything one batch run produced, in a JSON-serializable shape.
 *
 * <p>
 * A section is absent when its analysis failed; the failure is listed in
 * {@link #getFailures()} instead.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"generatedAt", "input", "summaries", "outliers", "correlations", "alerts",
        "rollingMean", "monthly", "productionGrowth", "throughputBy", "runningHours", "failures"})
public final class AnalysisReport {

    private final Instant generatedAt;
    private final InputSummary input;
    private final Map<MillField, StatisticalSummary> summaries;
    private final OutlierReport outliers;
    private final Map<String, Double> correlations;
    private final Map<String, AlertReport> alerts;
    private final List<RollingPoint> rollingMean;
    private final Map<String, List<MonthlyBucket>> monthly;
    private final List<MonthlyGrowth> productionGrowth;
    private final Map<MillField, SortedMap<Double, Double>> throughputBy;
    private final List<RunningHoursStatus> runningHours;
    private final List<AnalysisFailure> failures;

    private AnalysisReport(Builder b) {
        this.generatedAt = Objects.requireNonNull(b.generatedAt, "generatedAt must not be null");
        this.input = b.input;
        this.summaries = Collections.unmodifiableMap(new LinkedHashMap<>(b.summaries));
        this.outliers = b.outliers;
        this.correlations = Collections.unmodifiableMap(new LinkedHashMap<>(b.correlations));
        this.alerts = Collections.unmodifiableMap(new LinkedHashMap<>(b.alerts));
        this.rollingMean = b.rollingMean;
        this.monthly = Collections.unmodifiableMap(new LinkedHashMap<>(b.monthly));
        this.productionGrowth = b.productionGrowth;
        this.throughputBy = Collections.unmodifiableMap(new LinkedHashMap<>(b.throughputBy));
        this.runningHours = b.runningHours;
        this.failures = List.copyOf(b.failures);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AnalysisReport}. Not thread-safe; results are
     * added from the thread collecting them.
     */
    public static class Builder {
        private Instant generatedAt = Instant.now();
        private InputSummary input;
        private final Map<MillField, StatisticalSummary> summaries = new LinkedHashMap<>();
        private OutlierReport outliers;
        private final Map<String, Double> correlations = new LinkedHashMap<>();
        private final Map<String, AlertReport> alerts = new LinkedHashMap<>();
        private List<RollingPoint> rollingMean;
        private final Map<String, List<MonthlyBucket>> monthly = new LinkedHashMap<>();
        private List<MonthlyGrowth> productionGrowth;
        private final Map<MillField, SortedMap<Double, Double>> throughputBy = new LinkedHashMap<>();
        private List<RunningHoursStatus> runningHours;
        private final List<AnalysisFailure> failures = new ArrayList<>();

        public Builder generatedAt(Instant v) {
            this.generatedAt = v;
            return this;
        }

        public Builder input(InputSummary v) {
            this.input = v;
            return this;
        }

        public Builder summary(MillField field, StatisticalSummary summary) {
            summaries.put(field, summary);
            return this;
        }

        public Builder outliers(OutlierReport v) {
            this.outliers = v;
            return this;
        }

        public Builder correlation(String pair, double r) {
            correlations.put(pair, r);
            return this;
        }

        public Builder alerts(AlertReport report) {
            alerts.put(report.getRuleName(), report);
            return this;
        }

        public Builder rollingMean(List<RollingPoint> v) {
            this.rollingMean = v;
            return this;
        }

        public Builder monthly(String name, List<MonthlyBucket> buckets) {
            monthly.put(name, buckets);
            return this;
        }

        public Builder productionGrowth(List<MonthlyGrowth> v) {
            this.productionGrowth = v;
            return this;
        }

        public Builder throughputBy(MillField key, SortedMap<Double, Double> means) {
            throughputBy.put(key, means);
            return this;
        }

        public Builder runningHours(List<RunningHoursStatus> v) {
            this.runningHours = v;
            return this;
        }

        public Builder failure(AnalysisFailure failure) {
            failures.add(failure);
            return this;
        }

        public AnalysisReport build() {
            return new AnalysisReport(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    public InputSummary getInput() {
        return input;
    }

    public Map<MillField, StatisticalSummary> getSummaries() {
        return summaries;
    }

    public OutlierReport getOutliers() {
        return outliers;
    }

    /**
     * @return Pearson coefficient per field pair, keyed {@code X~Y}
     */
    public Map<String, Double> getCorrelations() {
        return correlations;
    }

    /**
     * @return alert report per rule name, in rule order
     */
    public Map<String, AlertReport> getAlerts() {
        return alerts;
    }

    public List<RollingPoint> getRollingMean() {
        return rollingMean;
    }

    public Map<String, List<MonthlyBucket>> getMonthly() {
        return monthly;
    }

    public List<MonthlyGrowth> getProductionGrowth() {
        return productionGrowth;
    }

    /**
     * @return mean mill throughput per distinct value of each grouping field
     */
    public Map<MillField, SortedMap<Double, Double>> getThroughputBy() {
        return throughputBy;
    }

    public List<RunningHoursStatus> getRunningHours() {
        return runningHours;
    }

    public List<AnalysisFailure> getFailures() {
        return failures;
    }

    @Override
    public String toString() {
        return "AnalysisReport{" +
                "generatedAt=" + generatedAt +
                ", summaries=" + summaries.size() +
                ", alerts=" + alerts.size() +
                ", failures=" + failures.size() +
                '}';
    }
}

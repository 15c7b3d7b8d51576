/**
 * Command-line batch runner: loads a JSON-lines reading snapshot, runs every
 * analysis of the core engine in parallel and writes one JSON report.
 *
 * <ul>
 * <li>{@link com.millsentinel.batch.MillAnalysisJob} — entry point</li>
 * <li>{@link com.millsentinel.batch.JobConfig} — environment-driven
 * configuration</li>
 * <li>{@link com.millsentinel.batch.JsonLinesReadingStore} — snapshot
 * loading and cleaning</li>
 * <li>{@link com.millsentinel.batch.AnalysisRunner} — concurrent execution
 * with per-analysis failure isolation</li>
 * <li>{@link com.millsentinel.batch.ReportWriter} — JSON output</li>
 * </ul>
 */
package com.millsentinel.batch;

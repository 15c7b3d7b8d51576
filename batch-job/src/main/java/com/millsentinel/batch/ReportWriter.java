package com.millsentinel.batch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Serializes an {@link AnalysisReport} to indented JSON with ISO-8601 dates.
 *
 * @since 1.0.0
 */
public class ReportWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ReportWriter.class);

    private final ObjectMapper mapper;

    public ReportWriter() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @return the report as JSON text
     * @throws IllegalStateException if the report cannot be serialized
     */
    public String toJson(AnalysisReport report) {
        Objects.requireNonNull(report, "Report must not be null");
        try {
            return mapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize report: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Write the report to {@code path}, creating parent directories and
     * replacing any existing file.
     */
    public void write(AnalysisReport report, Path path) throws IOException {
        Objects.requireNonNull(report, "Report must not be null");
        Objects.requireNonNull(path, "Report path must not be null");
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(path)) {
            mapper.writeValue(out, report);
        }
        LOG.info("Report written to {}", path);
    }
}

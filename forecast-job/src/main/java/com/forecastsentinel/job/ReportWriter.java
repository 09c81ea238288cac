package com.forecastsentinel.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.forecastsentinel.core.model.ForecastReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Serializes a {@link ForecastReport}, or a batch of them keyed by series
 * name, to JSON with ISO-8601 timestamps.
 */
public class ReportWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ReportWriter.class);

    private final ObjectMapper mapper;

    /**
     * @param prettyPrint indent the output
     */
    public ReportWriter(boolean prettyPrint) {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(SerializationFeature.INDENT_OUTPUT, prettyPrint);
    }

    /**
     * @return the report as a JSON string
     * @throws IllegalStateException if the report cannot be serialized
     */
    public String toJson(ForecastReport report) {
        Objects.requireNonNull(report, "report must not be null");
        return serialize(report);
    }

    /**
     * @return the reports as one JSON object keyed by series name
     * @throws IllegalStateException if a report cannot be serialized
     */
    public String toJson(Map<String, ForecastReport> reports) {
        Objects.requireNonNull(reports, "reports must not be null");
        return serialize(reports);
    }

    /**
     * Write the report to {@code out}; the stream is flushed, not closed.
     */
    public void write(ForecastReport report, OutputStream out) throws IOException {
        emit(toJson(report), out);
    }

    /**
     * Write the reports to {@code out}; the stream is flushed, not closed.
     */
    public void write(Map<String, ForecastReport> reports, OutputStream out) throws IOException {
        emit(toJson(reports), out);
    }

    /**
     * Write the report to a file, replacing any previous content.
     */
    public void write(ForecastReport report, Path path) throws IOException {
        emit(toJson(report), path);
    }

    /**
     * Write the reports to a file, replacing any previous content.
     */
    public void write(Map<String, ForecastReport> reports, Path path) throws IOException {
        emit(toJson(reports), path);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private String serialize(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize report: " + e.getOriginalMessage(), e);
        }
    }

    private static void emit(String json, OutputStream out) throws IOException {
        Objects.requireNonNull(out, "out must not be null");
        out.write(json.getBytes(StandardCharsets.UTF_8));
        out.write('\n');
        out.flush();
    }

    private static void emit(String json, Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        try (OutputStream out = Files.newOutputStream(path)) {
            emit(json, out);
        }
        LOG.info("Wrote report to {}", path);
    }
}

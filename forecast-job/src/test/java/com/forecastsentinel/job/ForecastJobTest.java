package com.forecastsentinel.job;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forecastsentinel.core.model.ForecastReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests for {@link ForecastJob} and {@link ReportWriter}.
 */
class ForecastJobTest {

    @Test
    @DisplayName("Should run the pipeline on a series file with an explicit configuration")
    void shouldRunFromFiles() throws Exception {
        JobConfig config = new JobConfig.Builder()
                .seriesPath(SeriesReaderTest.resource("series-hourly.json").toString())
                .forecastConfigPath(SeriesReaderTest.resource("job-forecast.yml").toString())
                .build();

        ForecastReport report = ForecastJob.runAll(config).get("series-hourly");

        assertThat(report.getModelName()).isEqualTo("holt_winters");
        assertThat(report.getTrainSize()).isEqualTo(72);
        assertThat(report.getTestSize()).isEqualTo(24);
        assertThat(report.getForecast().size()).isEqualTo(6);
        assertThat(report.getFlags()).hasSize(24);
        assertThat(report.getRmse()).isNotNull();
    }

    @Test
    @DisplayName("Should write the report as JSON with ISO-8601 timestamps")
    void shouldWriteJsonReport(@TempDir Path dir) throws Exception {
        JobConfig config = new JobConfig.Builder()
                .seriesPath(SeriesReaderTest.resource("series-hourly.json").toString())
                .forecastConfigPath(SeriesReaderTest.resource("job-forecast.yml").toString())
                .build();
        ForecastReport report = ForecastJob.runAll(config).get("series-hourly");
        Path output = dir.resolve("report.json");

        new ReportWriter(false).write(report, output);

        JsonNode json = new ObjectMapper().readTree(Files.readString(output));
        assertThat(json.get("modelName").asText()).isEqualTo("holt_winters");
        assertThat(json.get("forecast").get("points")).hasSize(6);
        assertThat(json.get("forecast").get("points").get(0).get("timestamp").asText())
                .isEqualTo("2024-01-05T00:00:00Z");
        assertThat(json.get("forecast").get("intervals")).hasSize(6);
        assertThat(json.get("flags").get(0).has("zScore")).isTrue();
        assertThat(json.get("rmse").isNumber()).isTrue();
        assertThat(json.has("anomalyCount")).isTrue();
        assertThat(json.get("parameters").has("alpha")).isTrue();
    }

    @Test
    @DisplayName("Should forecast every series of a batch document")
    void shouldRunEverySeriesOfBatch() throws Exception {
        JobConfig config = new JobConfig.Builder()
                .seriesPath(SeriesReaderTest.resource("series-batch.json").toString())
                .forecastConfigPath(SeriesReaderTest.resource("job-forecast.yml").toString())
                .build();

        Map<String, ForecastReport> reports = ForecastJob.runAll(config);

        assertThat(reports.keySet()).containsExactly("cpu", "mem");
        for (ForecastReport report : reports.values()) {
            assertThat(report.getTrainSize()).isEqualTo(72);
            assertThat(report.getForecast().size()).isEqualTo(6);
            assertThat(report.getFlags()).hasSize(24);
        }
    }

    @Test
    @DisplayName("Should write a batch as one JSON object keyed by series name")
    void shouldWriteBatchReport(@TempDir Path dir) throws Exception {
        JobConfig config = new JobConfig.Builder()
                .seriesPath(SeriesReaderTest.resource("series-batch.json").toString())
                .forecastConfigPath(SeriesReaderTest.resource("job-forecast.yml").toString())
                .build();
        Path output = dir.resolve("reports.json");

        new ReportWriter(true).write(ForecastJob.runAll(config), output);

        JsonNode json = new ObjectMapper().readTree(Files.readString(output));
        assertThat(json.size()).isEqualTo(2);
        assertThat(json.get("cpu").get("modelName").asText()).isEqualTo("holt_winters");
        assertThat(json.get("mem").get("forecast").get("points")).hasSize(6);
    }

    @Test
    @DisplayName("Should name the series that cannot be forecast")
    void shouldNameFailingSeries(@TempDir Path dir) throws Exception {
        Path series = dir.resolve("short.json");
        Files.writeString(series, "{\"series\":[{\"name\":\"tiny\",\"step\":\"PT1H\",\"points\":["
                + "{\"timestamp\":\"2024-01-01T00:00:00Z\",\"value\":1.0},"
                + "{\"timestamp\":\"2024-01-01T01:00:00Z\",\"value\":2.0}]}]}");
        JobConfig config = new JobConfig.Builder()
                .seriesPath(series.toString())
                .forecastConfigPath(SeriesReaderTest.resource("job-forecast.yml").toString())
                .build();

        assertThatThrownBy(() -> ForecastJob.runAll(config))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("series 'tiny'");
    }
}

package com.forecastsentinel.job;

import com.forecastsentinel.core.model.Series;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SeriesReader}.
 */
class SeriesReaderTest {

    private final SeriesReader reader = new SeriesReader();

    @Test
    @DisplayName("Should read a series document with gaps")
    void shouldReadDocumentWithGaps() throws URISyntaxException {
        Series series = reader.read(resource("series-hourly.json"));

        assertThat(series.getStep()).isEqualTo(Duration.ofHours(1));
        assertThat(series.size()).isEqualTo(96);
        assertThat(series.knownCount()).isEqualTo(94);
        assertThat(series.get(30).isGap()).isTrue();
        assertThat(series.timestampAt(0)).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    @DisplayName("Should treat an absent value as a gap and ignore unknown fields")
    void shouldTreatAbsentValueAsGap() throws Exception {
        String json = "{\"step\":\"PT15M\",\"source\":\"rrd\",\"points\":["
                + "{\"timestamp\":\"2024-01-01T00:00:00Z\",\"value\":1.5},"
                + "{\"timestamp\":\"2024-01-01T00:15:00Z\"}]}";

        Series series = reader.read(stream(json));

        assertThat(series.getStep()).isEqualTo(Duration.ofMinutes(15));
        assertThat(series.get(0).getValue()).isEqualTo(1.5);
        assertThat(series.get(1).isGap()).isTrue();
    }

    @Test
    @DisplayName("Should reject timestamps that are not strictly increasing")
    void shouldRejectUnorderedTimestamps() {
        assertThatThrownBy(() -> reader.read(resource("series-unordered.json")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("strictly increasing");
    }

    @Test
    @DisplayName("Should reject a document without a step")
    void shouldRejectMissingStep() {
        assertThatThrownBy(() -> reader.read(stream("{\"points\":[]}")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("step");
    }

    @Test
    @DisplayName("Should reject malformed JSON")
    void shouldRejectMalformedJson() {
        assertThatThrownBy(() -> reader.read(stream("{\"step\": \"PT1H\", \"points\": [")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    @DisplayName("Should report a missing file")
    void shouldReportMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> reader.read(dir.resolve("absent.json")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should read every named series of a batch document in order")
    void shouldReadBatchDocument() throws URISyntaxException {
        Map<String, Series> all = reader.readAll(resource("series-batch.json"));

        assertThat(all).containsOnlyKeys("cpu", "mem");
        assertThat(all.keySet()).containsExactly("cpu", "mem");
        assertThat(all.get("cpu").size()).isEqualTo(96);
        assertThat(all.get("cpu").get(50).isGap()).isTrue();
        assertThat(all.get("mem").knownCount()).isEqualTo(96);
    }

    @Test
    @DisplayName("Should name a single unnamed series after its file")
    void shouldNameSingleSeriesAfterFile() throws URISyntaxException {
        Map<String, Series> all = reader.readAll(resource("series-hourly.json"));

        assertThat(all).containsOnlyKeys("series-hourly");
        assertThat(all.get("series-hourly").size()).isEqualTo(96);
    }

    @Test
    @DisplayName("Should keep the name a single series document carries")
    void shouldKeepNameOfSingleSeries() throws Exception {
        String json = "{\"name\":\"disk\",\"step\":\"PT1H\",\"points\":["
                + "{\"timestamp\":\"2024-01-01T00:00:00Z\",\"value\":1.0}]}";

        Map<String, Series> all = reader.readAll(stream(json), SeriesReader.DEFAULT_NAME);

        assertThat(all).containsOnlyKeys("disk");
    }

    @Test
    @DisplayName("Should reject a batch entry without a name")
    void shouldRejectUnnamedBatchEntry() {
        String json = "{\"series\":[{\"step\":\"PT1H\",\"points\":[]}]}";

        assertThatThrownBy(() -> reader.readAll(stream(json), SeriesReader.DEFAULT_NAME))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Series #0")
                .hasMessageContaining("name");
    }

    @Test
    @DisplayName("Should reject a batch that reuses a series name")
    void shouldRejectDuplicateBatchName() {
        String json = "{\"series\":["
                + "{\"name\":\"cpu\",\"step\":\"PT1H\",\"points\":[]},"
                + "{\"name\":\"cpu\",\"step\":\"PT1H\",\"points\":[]}]}";

        assertThatThrownBy(() -> reader.readAll(stream(json), SeriesReader.DEFAULT_NAME))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'cpu' appears more than once");
    }

    @Test
    @DisplayName("Should name the batch entry whose document is invalid")
    void shouldNameInvalidBatchEntry() {
        String json = "{\"series\":[{\"name\":\"mem\",\"points\":[]}]}";

        assertThatThrownBy(() -> reader.readAll(stream(json), SeriesReader.DEFAULT_NAME))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Series 'mem'")
                .hasMessageContaining("step");
    }

    @Test
    @DisplayName("Should reject an empty batch")
    void shouldRejectEmptyBatch() {
        assertThatThrownBy(() -> reader.readAll(stream("{\"series\":[]}"), SeriesReader.DEFAULT_NAME))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("non-empty array");
    }

    static Path resource(String name) throws URISyntaxException {
        return Path.of(SeriesReaderTest.class.getClassLoader().getResource(name).toURI());
    }

    private static InputStream stream(String json) {
        return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
    }
}

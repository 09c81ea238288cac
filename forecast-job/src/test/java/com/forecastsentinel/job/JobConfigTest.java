package com.forecastsentinel.job;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Should build with defaults when only the series path is set")
    void shouldBuildWithDefaults() {
        JobConfig config = new JobConfig.Builder()
                .seriesPath("/data/series.json")
                .build();

        assertThat(config.getSeriesPath()).isEqualTo("/data/series.json");
        assertThat(config.hasForecastConfigPath()).isFalse();
        assertThat(config.writesToStdout()).isTrue();
        assertThat(config.isPrettyPrint()).isTrue();
    }

    @Test
    @DisplayName("Should keep explicit paths")
    void shouldKeepExplicitPaths() {
        JobConfig config = new JobConfig.Builder()
                .seriesPath("series.json")
                .forecastConfigPath("forecast.yml")
                .outputPath("report.json")
                .prettyPrint(false)
                .build();

        assertThat(config.hasForecastConfigPath()).isTrue();
        assertThat(config.getForecastConfigPath()).isEqualTo("forecast.yml");
        assertThat(config.writesToStdout()).isFalse();
        assertThat(config.getOutputPath()).isEqualTo("report.json");
        assertThat(config.isPrettyPrint()).isFalse();
    }

    @Test
    @DisplayName("Should reject a missing series path")
    void shouldRejectMissingSeriesPath() {
        assertThatThrownBy(() -> new JobConfig.Builder().build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(JobConfig.ENV_SERIES_PATH);
        assertThatThrownBy(() -> new JobConfig.Builder().seriesPath("  ").build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject null optional paths")
    void shouldRejectNullOptionalPaths() {
        assertThatThrownBy(() -> new JobConfig.Builder().seriesPath("s.json").outputPath(null).build())
                .isInstanceOf(NullPointerException.class);
    }
}

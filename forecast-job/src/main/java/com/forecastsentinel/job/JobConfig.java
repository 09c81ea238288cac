package com.forecastsentinel.job;

import java.io.Serializable;
import java.util.Objects;

/**
 * Typed, immutable configuration object for the forecast job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job can be driven from a shell, a container {@code -e} flag or a
 * scheduler without command-line parsing.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String ENV_SERIES_PATH = "SERIES_PATH";
    public static final String ENV_FORECAST_CONFIG_PATH = "FORECAST_CONFIG_PATH";
    public static final String ENV_OUTPUT_PATH = "OUTPUT_PATH";
    public static final String ENV_PRETTY_PRINT = "PRETTY_PRINT";

    /** JSON series document to forecast. */
    private final String seriesPath;

    /** YAML forecast configuration; blank means the classpath default. */
    private final String forecastConfigPath;

    /** Report destination; blank means standard output. */
    private final String outputPath;

    private final boolean prettyPrint;

    private JobConfig(Builder b) {
        this.seriesPath = b.seriesPath;
        this.forecastConfigPath = b.forecastConfigPath;
        this.outputPath = b.outputPath;
        this.prettyPrint = b.prettyPrint;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalArgumentException if {@value #ENV_SERIES_PATH} is unset
     */
    public static JobConfig fromEnvironment() {
        return new Builder()
                .seriesPath(env(ENV_SERIES_PATH, ""))
                .forecastConfigPath(env(ENV_FORECAST_CONFIG_PATH, ""))
                .outputPath(env(ENV_OUTPUT_PATH, ""))
                .prettyPrint(Boolean.parseBoolean(env(ENV_PRETTY_PRINT, "true")))
                .build();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getSeriesPath() {
        return seriesPath;
    }

    public String getForecastConfigPath() {
        return forecastConfigPath;
    }

    public boolean hasForecastConfigPath() {
        return !forecastConfigPath.isBlank();
    }

    public String getOutputPath() {
        return outputPath;
    }

    public boolean writesToStdout() {
        return outputPath.isBlank();
    }

    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method requires a non-blank series path; the other
     * paths default to blank.
     * </p>
     */
    public static class Builder {
        private String seriesPath;
        private String forecastConfigPath = "";
        private String outputPath = "";
        private boolean prettyPrint = true;

        public Builder seriesPath(String v) {
            this.seriesPath = v;
            return this;
        }

        public Builder forecastConfigPath(String v) {
            this.forecastConfigPath = v;
            return this;
        }

        public Builder outputPath(String v) {
            this.outputPath = v;
            return this;
        }

        public Builder prettyPrint(boolean v) {
            this.prettyPrint = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if the series path is missing
         */
        public JobConfig build() {
            if (seriesPath == null || seriesPath.isBlank()) {
                throw new IllegalArgumentException(
                        "seriesPath must not be null or blank (set " + ENV_SERIES_PATH + ")");
            }
            Objects.requireNonNull(forecastConfigPath, "forecastConfigPath must not be null");
            Objects.requireNonNull(outputPath, "outputPath must not be null");
            return new JobConfig(this);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "seriesPath='" + seriesPath + '\'' +
                ", forecastConfigPath='" + forecastConfigPath + '\'' +
                ", outputPath='" + outputPath + '\'' +
                ", prettyPrint=" + prettyPrint +
                '}';
    }
}

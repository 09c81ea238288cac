package com.forecastsentinel.job;

import com.forecastsentinel.core.config.ForecastConfig;
import com.forecastsentinel.core.config.ForecastConfigLoader;
import com.forecastsentinel.core.model.ForecastReport;
import com.forecastsentinel.core.model.Series;
import com.forecastsentinel.core.pipeline.ForecastPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Main entry point for the forecast job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   JSON series document ({@code SERIES_PATH}), one series or a batch
 *     → per series: fill gaps, split, fit, evaluate, flag anomalies
 *     → per series: forecast the configured horizon
 *     → JSON report (stdout or {@code OUTPUT_PATH})
 * </pre>
 *
 * <p>
 * A document holding one series yields that series' report. A batch yields
 * one JSON object mapping each series name to its report. The first series
 * that cannot be forecast fails the run.
 * </p>
 *
 * <h3>Configuration</h3>
 * <p>
 * Job wiring comes from environment variables via {@link JobConfig}; model
 * and evaluation settings come from the YAML file named by
 * {@code FORECAST_CONFIG_PATH}, or the bundled {@code forecast.yml}.
 * </p>
 *
 * <p>
 * Logging goes to standard error so that standard output carries only the
 * report.
 * </p>
 *
 * @since 1.0.0
 */
public final class ForecastJob {

    private static final Logger LOG = LoggerFactory.getLogger(ForecastJob.class);

    private ForecastJob() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) throws IOException {
        // 1. Load configuration
        JobConfig config = JobConfig.fromEnvironment();
        LOG.info("Starting forecast job with config: {}", config);

        // 2. Run the pipeline on every series
        Map<String, ForecastReport> reports = runAll(config);

        // 3. Emit the reports
        ReportWriter writer = new ReportWriter(config.isPrettyPrint());
        if (reports.size() == 1) {
            ForecastReport report = reports.values().iterator().next();
            if (config.writesToStdout()) {
                writer.write(report, System.out);
            } else {
                writer.write(report, Path.of(config.getOutputPath()));
            }
        } else if (config.writesToStdout()) {
            writer.write(reports, System.out);
        } else {
            writer.write(reports, Path.of(config.getOutputPath()));
        }
    }

    /**
     * Load the forecast configuration and every series named by
     * {@code config} and run the pipeline once per series.
     *
     * @return the reports by series name, in document order
     * @throws IllegalStateException if a series cannot be forecast; the
     *                               message names the series
     */
    static Map<String, ForecastReport> runAll(JobConfig config) {
        ForecastConfig forecastConfig = loadForecastConfig(config);
        Map<String, Series> all = new SeriesReader().readAll(Path.of(config.getSeriesPath()));
        ForecastPipeline pipeline = new ForecastPipeline(forecastConfig);

        Map<String, ForecastReport> reports = new LinkedHashMap<>();
        for (Map.Entry<String, Series> entry : all.entrySet()) {
            ForecastReport report;
            try {
                report = pipeline.run(entry.getValue());
            } catch (RuntimeException e) {
                throw new IllegalStateException(
                        "Forecast failed for series '" + entry.getKey() + "': " + e.getMessage(), e);
            }
            LOG.info("Forecast complete for {}: model={} horizon={} rmse={} anomalies={}", entry.getKey(),
                    report.getModelName(), report.getForecast().size(), report.getRmse(), report.anomalyCount());
            reports.put(entry.getKey(), report);
        }
        return reports;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static ForecastConfig loadForecastConfig(JobConfig config) {
        if (config.hasForecastConfigPath()) {
            LOG.info("Loading forecast configuration from {}", config.getForecastConfigPath());
            return ForecastConfigLoader.fromFile(config.getForecastConfigPath());
        }
        return ForecastConfigLoader.load();
    }
}

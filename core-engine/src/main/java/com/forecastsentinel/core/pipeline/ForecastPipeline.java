package com.forecastsentinel.core.pipeline;

import com.forecastsentinel.core.config.AnomalySettings;
import com.forecastsentinel.core.config.ForecastConfig;
import com.forecastsentinel.core.detection.AnomalyDetector;
import com.forecastsentinel.core.evaluation.Evaluator;
import com.forecastsentinel.core.forecast.ForecastModel;
import com.forecastsentinel.core.forecast.ModelFactory;
import com.forecastsentinel.core.forecast.ModelState;
import com.forecastsentinel.core.model.AnomalyFlag;
import com.forecastsentinel.core.model.DataPoint;
import com.forecastsentinel.core.model.Forecast;
import com.forecastsentinel.core.model.ForecastReport;
import com.forecastsentinel.core.model.Residual;
import com.forecastsentinel.core.model.Series;
import com.forecastsentinel.core.preprocessing.Preprocessor;
import com.forecastsentinel.core.preprocessing.SplitSeries;
import com.forecastsentinel.core.preprocessing.Splitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * End-to-end run for one series: fill gaps, split, fit, evaluate on the
 * held-out segment, flag anomalous residuals and forecast the future.
 *
 * <h3>Data flow</h3>
 * <ol>
 * <li>{@link Preprocessor#fill(Series)} interpolates missing values.</li>
 * <li>{@link Splitter#split(Series, double)} separates the training prefix
 * from the evaluation suffix.</li>
 * <li>A model fit on the training prefix forecasts the evaluation suffix;
 * RMSE, MAE, residuals and anomaly flags are computed against it.</li>
 * <li>A fresh model fit on the whole filled series forecasts
 * {@code horizon} steps past its end. Without an evaluation suffix the
 * training fit is reused. Its in-sample one-step predictions are reported
 * alongside.</li>
 * </ol>
 *
 * <p>
 * The pipeline holds configuration only; every {@link #run(Series)} creates
 * its own model instances.
 * </p>
 *
 * @since 1.0.0
 */
public class ForecastPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(ForecastPipeline.class);

    private final ForecastConfig config;
    private final AnomalyDetector detector;

    /**
     * @param config validated configuration
     * @throws IllegalStateException if the configuration is invalid
     */
    public ForecastPipeline(ForecastConfig config) {
        this.config = Objects.requireNonNull(config, "ForecastConfig must not be null");
        config.validate();
        this.detector = new AnomalyDetector(config.getAnomaly().isStrict());
    }

    /**
     * @param raw the series as acquired, possibly with gaps
     * @return the report for this run
     * @throws com.forecastsentinel.core.error.ForecastingException if a stage
     *         fails; nothing is partially returned
     */
    public ForecastReport run(Series raw) {
        Objects.requireNonNull(raw, "Series must not be null");

        Series filled = Preprocessor.fill(raw);
        SplitSeries split = Splitter.split(filled, config.getTrainPercent());
        Series train = split.getTrain();
        Series test = split.getTest();
        List<Integer> levels = config.getConfidenceLevels();
        LOG.info("Running '{}' on {} points ({} train, {} test)",
                config.getModel().getType(), filled.size(), train.size(), test.size());

        ForecastModel model = ModelFactory.create(config.getModel(), filled.getStep());
        model.fit(train);

        ForecastReport.Builder report = ForecastReport.builder()
                .modelName(model.getModelName())
                .trainSize(train.size())
                .testSize(test.size());

        ForecastModel finalModel = model;
        if (split.hasTest()) {
            Forecast evaluation = model.forecast(test.size(), levels);
            List<Residual> residuals = Evaluator.residuals(test, evaluation);
            AnomalySettings anomaly = config.getAnomaly();
            List<AnomalyFlag> flags = detector.detect(residuals, anomaly.getWindowSize(), anomaly.getDelta());
            double rmse = Evaluator.rmse(evaluation, test);
            double mae = Evaluator.mae(evaluation, test);
            LOG.info("Evaluation over {} points: rmse={} mae={} anomalies={}",
                    test.size(), rmse, mae, flags.stream().filter(AnomalyFlag::isAnomalous).count());

            report.evaluationForecast(evaluation)
                    .rmse(rmse)
                    .mae(mae)
                    .residuals(residuals)
                    .flags(flags);

            finalModel = ModelFactory.create(config.getModel(), filled.getStep());
            finalModel.fit(filled);
        }

        int horizon = config.resolveHorizon(filled.getStep());
        Forecast future = finalModel.forecast(horizon, levels);
        ModelState state = finalModel.getState()
                .orElseThrow(() -> new IllegalStateException("Model has no fitted state"));

        return report.forecast(future)
                .fitted(inSample(state))
                .parameters(state.parameters())
                .build();
    }

    private static List<DataPoint> inSample(ModelState state) {
        double[] values = state.getFittedValues();
        List<DataPoint> points = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            Instant timestamp = state.getLastTimestamp()
                    .minus(state.getStep().multipliedBy(values.length - 1L - i));
            points.add(DataPoint.of(timestamp, values[i]));
        }
        return points;
    }

    public ForecastConfig getConfig() {
        return config;
    }
}

package com.forecastsentinel.core.forecast;

import com.forecastsentinel.core.config.ModelSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Factory that creates {@link ForecastModel} instances from
 * {@link ModelSettings}.
 *
 * <p>
 * This is the single point of extension when adding new model types:
 * register the new type string here and create the corresponding model.
 * </p>
 *
 * @since 1.0.0
 */
public final class ModelFactory {

    private static final Logger LOG = LoggerFactory.getLogger(ModelFactory.class);

    private ModelFactory() {
        // utility class, not instantiable
    }

    /**
     * Create an unfitted model for a series sampled every {@code step}.
     *
     * @param settings the model configuration; must not be {@code null}
     * @param step     sampling interval, used to resolve a seasonal period
     *                 given as a duration
     * @return a fresh model instance
     * @throws NullPointerException     if {@code settings} or its type is
     *                                  {@code null}
     * @throws IllegalArgumentException if the model type is unknown or the
     *                                  seasonal period cannot be resolved
     */
    public static ForecastModel create(ModelSettings settings, Duration step) {
        Objects.requireNonNull(settings, "ModelSettings must not be null");
        Objects.requireNonNull(settings.getType(), "Model type must not be null");
        Objects.requireNonNull(step, "step must not be null");

        int seasonalPeriod = settings.resolveSeasonalPeriod(step);
        String type = settings.getType().toLowerCase(Locale.ROOT);
        LOG.debug("Creating '{}' model with seasonal period {}", type, seasonalPeriod);
        return switch (type) {
            case ModelSettings.HOLT_WINTERS -> new HoltWintersModel(settings, seasonalPeriod);
            case ModelSettings.ARIMA -> new ArimaModel(settings, seasonalPeriod);
            default -> throw new IllegalArgumentException(
                    "Unknown model type: '" + settings.getType()
                            + "'. Supported types: " + ModelSettings.HOLT_WINTERS + ", " + ModelSettings.ARIMA);
        };
    }
}

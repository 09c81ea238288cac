package com.forecastsentinel.job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.forecastsentinel.core.model.DataPoint;
import com.forecastsentinel.core.model.Series;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of a series as handed over by the acquisition side.
 *
 * <pre>
 * {"step": "PT1H",
 *  "points": [{"timestamp": "2024-01-01T00:00:00Z", "value": 1.5},
 *             {"timestamp": "2024-01-01T01:00:00Z", "value": null}]}
 * </pre>
 *
 * <p>
 * A {@code null} or absent value is a gap. The optional {@code name} labels
 * the series in a batch, see {@link SeriesReader#readAll(java.nio.file.Path)}.
 * </p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SeriesDocument {

    private String name;
    private Duration step;
    private List<DataPoint> points = new ArrayList<>();

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Duration getStep() {
        return step;
    }

    public void setStep(Duration step) {
        this.step = step;
    }

    public List<DataPoint> getPoints() {
        return points;
    }

    public void setPoints(List<DataPoint> points) {
        this.points = points;
    }

    /**
     * @return the document as a {@link Series}
     * @throws IllegalArgumentException if the step is missing or not positive,
     *                                  or timestamps are not strictly
     *                                  increasing
     */
    public Series toSeries() {
        if (step == null) {
            throw new IllegalArgumentException("Series document has no 'step'");
        }
        return new Series(step, points != null ? points : List.of());
    }
}

package com.msp.forecast.forecast;

import com.msp.forecast.series.SeriesKey;
import lombok.Getter;

/**
 * No trained model exists for a key, in memory or in the backing store.
 */
@Getter
public class ModelUnavailableException extends ForecastException {

    private final String seriesKey;

    public ModelUnavailableException(SeriesKey key) {
        super("No trained model for " + key + "; train it first");
        this.seriesKey = key.asString();
    }
}

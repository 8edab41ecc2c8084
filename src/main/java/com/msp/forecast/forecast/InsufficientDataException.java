package com.msp.forecast.forecast;

import com.msp.forecast.series.SeriesKey;
import lombok.Getter;

@Getter
public class InsufficientDataException extends ForecastException {

    private final String seriesKey;
    private final int available;
    private final int required;

    public InsufficientDataException(SeriesKey key, int available, int required) {
        super(String.format("Insufficient data for %s: %d points, need at least %d", key, available, required));
        this.seriesKey = key.asString();
        this.available = available;
        this.required = required;
    }
}

package com.msp.forecast.forecast;

import com.msp.forecast.series.DailyPrice;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Complete, immutable forecasting artifact for one series key. A retrain builds a
 * new instance and swaps it in; instances are never modified.
 */
@Value
@Builder
@Jacksonized
public class TrainedModel {

    public static final int SCHEMA_VERSION = 1;

    int schemaVersion;

    String seriesKey;
    String commodity;
    String region;

    /**
     * Null when the model covers all markets of the region.
     */
    String market;

    /**
     * Null when the seasonal-trend member could not be fitted or is disabled.
     */
    SeasonalTrendModel seasonal;

    LinearTrendModel linear;
    MovingAverageModel movingAverage;

    List<DailyPrice> trainingSnapshot;
    LocalDate trainingStart;
    LocalDate trainingEnd;
    LocalDateTime trainedAt;

    public boolean hasSeasonal() {
        return seasonal != null;
    }

    public int dataPoints() {
        return trainingSnapshot.size();
    }
}

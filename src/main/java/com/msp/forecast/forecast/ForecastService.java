package com.msp.forecast.forecast;

import com.msp.forecast.series.DailyPrice;
import com.msp.forecast.series.SeriesKey;
import com.msp.forecast.series.TimeSeriesStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Name-addressed entry point to training and prediction. Builds the modeling series
 * from the price store and delegates to {@link EnsembleForecaster}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ForecastService {

    private final TimeSeriesStore timeSeriesStore;
    private final EnsembleForecaster forecaster;

    /**
     * Trains on the last year of daily prices for the series.
     *
     * @param market optional; blank trains on all markets of the region
     */
    public boolean train(String commodity, String region, String market) {
        SeriesKey key = SeriesKey.of(commodity, region, market);
        List<DailyPrice> series = timeSeriesStore.aggregateForModeling(commodity, region, market);
        log.debug("Training {} on {} daily prices", key, series.size());
        return forecaster.train(series, key);
    }

    public ForecastResult predict(String commodity, String region, String market, int horizonDays) {
        return forecaster.predict(SeriesKey.of(commodity, region, market), horizonDays);
    }

    /**
     * Like {@link #predict} but trains the series first when no model exists yet.
     *
     * @throws InsufficientDataException if training is needed and the history is too short
     */
    public ForecastResult predictOrTrain(String commodity, String region, String market, int horizonDays) {
        SeriesKey key = SeriesKey.of(commodity, region, market);
        if (!forecaster.isTrained(key)) {
            log.info("No model for {}, training on demand", key);
            train(commodity, region, market);
        }
        return forecaster.predict(key, horizonDays);
    }
}

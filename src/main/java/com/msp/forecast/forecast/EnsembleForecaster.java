package com.msp.forecast.forecast;

import com.msp.forecast.series.DailyPrice;
import com.msp.forecast.series.SeriesKey;
import com.msp.forecast.stats.StatisticsCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Trains and serves per-key blended forecasts.
 *
 * Members: seasonal-trend (0.6), linear trend (0.3), moving average (0.1). Weights are
 * renormalized over the members available for a model, so a model whose seasonal-trend
 * member could not be fitted blends linear 0.75 / moving average 0.25.
 */
@Service
@Slf4j
public class EnsembleForecaster {

    public static final int MIN_TRAINING_POINTS = 30;
    public static final int MAX_HORIZON_DAYS = 365;

    static final int MOVING_AVERAGE_WINDOW = 7;
    static final double FALLBACK_BAND = 0.05;

    private final ModelRegistry registry;
    private final ConfidenceEstimator confidenceEstimator;
    private final Clock clock;
    private final boolean seasonalEnabled;
    private final int fourierOrder;

    public EnsembleForecaster(ModelRegistry registry,
                              ConfidenceEstimator confidenceEstimator,
                              Clock clock,
                              @Value("${forecast.seasonal.enabled:true}") boolean seasonalEnabled,
                              @Value("${forecast.seasonal.fourier-order:3}") int fourierOrder) {
        this.registry = registry;
        this.confidenceEstimator = confidenceEstimator;
        this.clock = clock;
        this.seasonalEnabled = seasonalEnabled;
        this.fourierOrder = fourierOrder;
    }

    /**
     * Fits every member on the series and replaces the model of the key.
     *
     * @throws InsufficientDataException if the series has fewer than {@value #MIN_TRAINING_POINTS} points
     * @throws ModelStoreException if the model cannot be persisted; the previous model stays active
     */
    public boolean train(List<DailyPrice> series, SeriesKey key) {
        if (series.size() < MIN_TRAINING_POINTS) {
            throw new InsufficientDataException(key, series.size(), MIN_TRAINING_POINTS);
        }
        List<DailyPrice> sorted = series.stream()
                .sorted(Comparator.comparing(DailyPrice::getDate))
                .collect(Collectors.toUnmodifiableList());

        return registry.exclusively(key, () -> {
            long start = System.currentTimeMillis();
            TrainedModel model = fit(sorted, key);
            registry.publish(key, model);
            log.info("Trained model {} on {} points ({} - {}), seasonal={}, {} ms",
                    key, sorted.size(), model.getTrainingStart(), model.getTrainingEnd(),
                    model.hasSeasonal(), System.currentTimeMillis() - start);
            return true;
        });
    }

    /**
     * Forecast for the {@code horizonDays} days following the last training date.
     *
     * @throws ModelUnavailableException if the key has never been trained
     */
    public ForecastResult predict(SeriesKey key, int horizonDays) {
        if (horizonDays < 1 || horizonDays > MAX_HORIZON_DAYS) {
            throw new IllegalArgumentException("horizonDays must be between 1 and " + MAX_HORIZON_DAYS + ": " + horizonDays);
        }
        TrainedModel model = registry.find(key).orElseThrow(() -> new ModelUnavailableException(key));
        return forecast(model, horizonDays);
    }

    public boolean isTrained(SeriesKey key) {
        return registry.find(key).isPresent();
    }

    TrainedModel fit(List<DailyPrice> sorted, SeriesKey key) {
        SeasonalTrendModel seasonal = null;
        if (seasonalEnabled) {
            seasonal = SeasonalTrendModel.fit(sorted, fourierOrder).orElse(null);
            if (seasonal == null) {
                log.warn("Seasonal-trend member unavailable for {}; blending linear and moving average only", key);
            }
        }

        return TrainedModel.builder()
                .schemaVersion(TrainedModel.SCHEMA_VERSION)
                .seriesKey(key.asString())
                .commodity(key.getCommodityName())
                .region(key.getRegionName())
                .market(key.getMarketName())
                .seasonal(seasonal)
                .linear(LinearTrendModel.fit(sorted))
                .movingAverage(MovingAverageModel.fit(sorted, MOVING_AVERAGE_WINDOW))
                .trainingSnapshot(sorted)
                .trainingStart(sorted.get(0).getDate())
                .trainingEnd(sorted.get(sorted.size() - 1).getDate())
                .trainedAt(LocalDateTime.now(clock))
                .build();
    }

    ForecastResult forecast(TrainedModel model, int horizonDays) {
        List<ForecastPoint> points = new ArrayList<>(horizonDays);
        for (int step = 1; step <= horizonDays; step++) {
            points.add(blend(model, step));
        }

        double first = points.get(0).getPointEstimate();
        double last = points.get(points.size() - 1).getPointEstimate();
        double trendPercent = StatisticsCalculator.percentChange(first, last);

        Set<SubModel> contributing = EnumSet.noneOf(SubModel.class);
        points.forEach(p -> contributing.addAll(p.getWeights().keySet()));

        return ForecastResult.builder()
                .seriesKey(model.getSeriesKey())
                .commodity(model.getCommodity())
                .region(model.getRegion())
                .market(model.getMarket())
                .points(points)
                .trend(ForecastTrend.fromPercent(trendPercent))
                .trendPercent(StatisticsCalculator.round(trendPercent, 2))
                .confidence(confidenceEstimator.score(model.getTrainingSnapshot(), points))
                .contributingModels(contributing)
                .trainingPoints(model.dataPoints())
                .trainedAt(model.getTrainedAt())
                .build();
    }

    private ForecastPoint blend(TrainedModel model, int step) {
        LocalDate date = model.getTrainingEnd().plusDays(step);

        Map<SubModel, Double> candidates = new EnumMap<>(SubModel.class);
        if (model.hasSeasonal()) {
            candidates.put(SubModel.SEASONAL_TREND, model.getSeasonal().estimate(date));
        }
        candidates.put(SubModel.LINEAR_TREND, model.getLinear().estimate(step));
        candidates.put(SubModel.MOVING_AVERAGE, model.getMovingAverage().estimate());

        Map<SubModel, Double> weights = SubModel.normalizedWeights(candidates.keySet());
        double estimate = 0.0;
        for (Map.Entry<SubModel, Double> entry : candidates.entrySet()) {
            estimate += weights.get(entry.getKey()) * entry.getValue();
        }

        double lower;
        double upper;
        if (model.hasSeasonal()) {
            double seasonalEstimate = candidates.get(SubModel.SEASONAL_TREND);
            double halfWidth = model.getSeasonal().intervalHalfWidth();
            lower = Math.min(seasonalEstimate - halfWidth, estimate * (1 - FALLBACK_BAND));
            upper = Math.max(seasonalEstimate + halfWidth, estimate * (1 + FALLBACK_BAND));
        } else {
            lower = estimate * (1 - FALLBACK_BAND);
            upper = estimate * (1 + FALLBACK_BAND);
        }

        return ForecastPoint.builder()
                .date(date)
                .pointEstimate(StatisticsCalculator.round(estimate, 2))
                .lowerBound(StatisticsCalculator.round(lower, 2))
                .upperBound(StatisticsCalculator.round(upper, 2))
                .weights(Collections.unmodifiableMap(weights))
                .build();
    }
}

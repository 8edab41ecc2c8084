package com.msp.forecast.advisory;

import com.msp.forecast.analysis.MarketAnalytics;
import com.msp.forecast.analysis.VolatilityClass;
import com.msp.forecast.forecast.ForecastException;
import com.msp.forecast.forecast.ForecastResult;
import com.msp.forecast.forecast.ForecastService;
import com.msp.forecast.recommendation.Recommendation;
import com.msp.forecast.recommendation.RecommendationPolicy;
import com.msp.forecast.series.PricePoint;
import com.msp.forecast.series.TimeSeriesStore;
import com.msp.forecast.stats.StatisticsCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Sell/hold advice for a commodity in a region, combining the 7-day forecast with
 * the last 30 days of volatility.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AdvisoryService {

    public static final int ADVISORY_HORIZON_DAYS = 7;
    public static final int VOLATILITY_WINDOW_DAYS = 30;

    static final int FORECAST_PREVIEW_DAYS = 5;
    static final int LATEST_PRICE_MARKETS = 20;

    private final ForecastService forecastService;
    private final MarketAnalytics marketAnalytics;
    private final RecommendationPolicy recommendationPolicy;
    private final TimeSeriesStore timeSeriesStore;

    /**
     * Trains the region-wide model on demand when none exists yet.
     *
     * @param referencePrice optional benchmark (e.g. the minimum support price)
     * @throws com.msp.forecast.forecast.InsufficientDataException if no model exists and the history is too short
     */
    public AdvisoryReport recommend(String commodity, String region, double currentPrice, Double referencePrice) {
        ForecastResult forecast = forecastService.predictOrTrain(commodity, region, null, ADVISORY_HORIZON_DAYS);
        VolatilityClass volatility = marketAnalytics
                .volatility(commodity, region, VOLATILITY_WINDOW_DAYS)
                .getClassification();

        Recommendation recommendation = recommendationPolicy.recommend(
                currentPrice, forecast.getPoints(), volatility, referencePrice);
        log.debug("Advice for {}/{} at {}: {} ({}%)", commodity, region, currentPrice,
                recommendation.getAction(), recommendation.getConfidence());

        return AdvisoryReport.builder()
                .commodity(commodity)
                .region(region)
                .currentPrice(currentPrice)
                .referencePrice(referencePrice)
                .recommendation(recommendation)
                .volatility(volatility)
                .forecastTrend(forecast.getTrend())
                .forecastConfidence(forecast.getConfidence())
                .forecast(forecast.getPoints().subList(0, Math.min(FORECAST_PREVIEW_DAYS, forecast.getPoints().size())))
                .build();
    }

    /**
     * Advice for several commodities of a region, using the mean latest modal price across
     * markets as the current price. Every commodity yields one item, failed or not.
     *
     * @param commodities null or empty for every commodity traded in the region
     * @param referencePrices optional per-commodity benchmarks, matched case-insensitively
     */
    public BulkRecommendationReport bulkRecommendations(String region,
                                                        List<String> commodities,
                                                        Map<String, Double> referencePrices) {
        List<String> targets = commodities == null || commodities.isEmpty()
                ? timeSeriesStore.commodities(region)
                : commodities;

        List<BulkRecommendationItem> items = new ArrayList<>(targets.size());
        for (String commodity : targets) {
            items.add(recommendOne(region, commodity, referenceFor(referencePrices, commodity)));
        }

        int ok = (int) items.stream().filter(BulkRecommendationItem::isSuccess).count();
        log.info("Bulk recommendations for {}: {}/{} succeeded", region, ok, items.size());
        return BulkRecommendationReport.builder()
                .region(region)
                .succeeded(ok)
                .failed(items.size() - ok)
                .items(items)
                .build();
    }

    private BulkRecommendationItem recommendOne(String region, String commodity, Double referencePrice) {
        List<PricePoint> latest = timeSeriesStore.latestPrices(commodity, region, LATEST_PRICE_MARKETS);
        if (latest.isEmpty()) {
            return failed(commodity, "No prices for " + commodity + " in " + region);
        }
        double currentPrice = StatisticsCalculator.mean(latest.stream().mapToDouble(PricePoint::modalValue).toArray());

        try {
            AdvisoryReport advisory = recommend(commodity, region, StatisticsCalculator.round(currentPrice, 2), referencePrice);
            return BulkRecommendationItem.builder()
                    .commodity(commodity)
                    .success(true)
                    .advisory(advisory)
                    .build();
        } catch (ForecastException | IllegalArgumentException e) {
            log.warn("No recommendation for {}/{}: {}", commodity, region, e.getMessage());
            return failed(commodity, e.getMessage());
        }
    }

    private static BulkRecommendationItem failed(String commodity, String reason) {
        return BulkRecommendationItem.builder()
                .commodity(commodity)
                .success(false)
                .reason(reason)
                .build();
    }

    private static Double referenceFor(Map<String, Double> referencePrices, String commodity) {
        if (referencePrices == null) {
            return null;
        }
        String wanted = commodity.trim().toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Double> entry : referencePrices.entrySet()) {
            if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(wanted)) {
                return entry.getValue();
            }
        }
        return null;
    }
}

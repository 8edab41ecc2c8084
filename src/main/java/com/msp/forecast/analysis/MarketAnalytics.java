package com.msp.forecast.analysis;

import com.msp.forecast.series.PricePoint;
import com.msp.forecast.series.TimeSeriesStore;
import com.msp.forecast.stats.LinearFit;
import com.msp.forecast.stats.StatisticsCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.Month;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

import static com.msp.forecast.stats.StatisticsCalculator.round;

/**
 * Market analysis over the observations held by {@link TimeSeriesStore}.
 *
 * Every calculation sorts its input by date first. Windows with fewer observations
 * than a calculation needs produce an INSUFFICIENT_DATA sentinel (or an empty list),
 * never an exception.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MarketAnalytics {

    public static final double DEFAULT_SENSITIVITY = 2.0;
    public static final int SEASONAL_WINDOW_DAYS = 365;

    static final int MIN_VOLATILITY_POINTS = 5;
    static final int MIN_TREND_POINTS = 7;
    static final int MIN_ANOMALY_POINTS = 10;

    private static final double STABLE_CHANGE_PERCENT = 2.0;
    private static final double HIGH_SEVERITY_Z = 3.0;
    private static final int COMPARISON_WINDOW_DAYS = 30;
    private static final int REPORT_ANOMALIES = 3;
    private static final int REPORT_MARKETS = 5;

    private final TimeSeriesStore store;
    private final InsightsNarrator narrator;
    private final Clock clock;

    @Value("${analytics.default-window-days:30}")
    private int defaultWindowDays;

    // ==================== Volatility ====================

    public VolatilityProfile volatility(String commodity, String region, int windowDays) {
        return volatilityOf(store.query(commodity, region, null, windowDays));
    }

    public VolatilityProfile volatility(String commodity, String region) {
        return volatility(commodity, region, defaultWindowDays);
    }

    /**
     * Sample standard deviation and coefficient of variation of modal prices.
     * Needs at least {@value #MIN_VOLATILITY_POINTS} observations.
     */
    public static VolatilityProfile volatilityOf(List<PricePoint> points) {
        if (points.size() < MIN_VOLATILITY_POINTS) {
            return VolatilityProfile.insufficient(points.size());
        }
        double[] prices = modalPrices(points);
        double stdDev = StatisticsCalculator.sampleStdDev(prices);
        double mean = StatisticsCalculator.mean(prices);
        double cv = StatisticsCalculator.coefficientOfVariation(stdDev, mean);

        return VolatilityProfile.builder()
                .stdDev(round(stdDev, 2))
                .mean(round(mean, 2))
                .coefficientOfVariation(round(cv, 2))
                .classification(VolatilityClass.fromCoefficientOfVariation(cv))
                .sampleSize(points.size())
                .build();
    }

    // ==================== Trend ====================

    public TrendProfile trend(String commodity, String region, int windowDays) {
        return trendOf(store.query(commodity, region, null, windowDays));
    }

    public TrendProfile trend(String commodity, String region) {
        return trend(commodity, region, defaultWindowDays);
    }

    /**
     * Least-squares slope over the date-ordered series plus first-to-last percent change.
     * Needs at least {@value #MIN_TREND_POINTS} observations.
     */
    public static TrendProfile trendOf(List<PricePoint> points) {
        if (points.size() < MIN_TREND_POINTS) {
            return TrendProfile.insufficient(points.size());
        }
        double[] prices = modalPrices(points);
        LinearFit fit = StatisticsCalculator.linearFit(prices);

        double first = prices[0];
        double last = prices[prices.length - 1];
        double changePercent = StatisticsCalculator.percentChange(first, last);
        double strength = Math.abs(changePercent);

        TrendDirection direction;
        if (strength < STABLE_CHANGE_PERCENT) {
            direction = TrendDirection.STABLE;
        } else if (changePercent > 0) {
            direction = TrendDirection.UPWARD;
        } else {
            direction = TrendDirection.DOWNWARD;
        }

        return TrendProfile.builder()
                .direction(direction)
                .strength(round(strength, 2))
                .strengthLabel(TrendStrength.of(strength))
                .changePercent(round(changePercent, 2))
                .slope(round(fit.getSlope(), 2))
                .firstPrice(round(first, 2))
                .lastPrice(round(last, 2))
                .sampleSize(points.size())
                .build();
    }

    // ==================== Seasonality ====================

    public SeasonalProfile seasonality(String commodity, String region) {
        return seasonalityOf(store.query(commodity, region, null, SEASONAL_WINDOW_DAYS));
    }

    /**
     * Average modal price per calendar month, peak and trough months, and the spread
     * of monthly averages relative to their mean.
     */
    public static SeasonalProfile seasonalityOf(List<PricePoint> points) {
        if (points.isEmpty()) {
            return SeasonalProfile.none();
        }

        Map<Month, double[]> sums = new EnumMap<>(Month.class);
        for (PricePoint point : points) {
            double[] acc = sums.computeIfAbsent(point.getDate().getMonth(), m -> new double[2]);
            acc[0] += point.modalValue();
            acc[1]++;
        }

        Map<Month, Double> monthly = new LinkedHashMap<>();
        Month peak = null;
        Month trough = null;
        for (Map.Entry<Month, double[]> entry : sums.entrySet()) {
            double avg = entry.getValue()[0] / entry.getValue()[1];
            monthly.put(entry.getKey(), avg);
            if (peak == null || avg > monthly.get(peak)) {
                peak = entry.getKey();
            }
            if (trough == null || avg < monthly.get(trough)) {
                trough = entry.getKey();
            }
        }

        double[] averages = monthly.values().stream().mapToDouble(Double::doubleValue).toArray();
        double mean = StatisticsCalculator.mean(averages);
        double spread = StatisticsCalculator.populationStdDev(averages);
        double strength = mean > 0 ? spread / mean * 100 : 0.0;

        Map<Month, Double> rounded = new LinkedHashMap<>();
        monthly.forEach((month, avg) -> rounded.put(month, round(avg, 2)));

        return SeasonalProfile.builder()
                .hasPattern(true)
                .peakMonth(peak)
                .peakPrice(round(monthly.get(peak), 2))
                .troughMonth(trough)
                .troughPrice(round(monthly.get(trough), 2))
                .monthlyAverages(rounded)
                .seasonalStrength(round(strength, 2))
                .strengthLabel(SeasonalStrength.of(strength))
                .build();
    }

    // ==================== Anomalies ====================

    public List<AnomalyEvent> anomalies(String commodity, String region, int windowDays, double sensitivity) {
        return anomaliesOf(store.query(commodity, region, null, windowDays), sensitivity);
    }

    public List<AnomalyEvent> anomalies(String commodity, String region) {
        return anomalies(commodity, region, defaultWindowDays, DEFAULT_SENSITIVITY);
    }

    /**
     * Observations whose z-score against the window's population mean and standard
     * deviation exceeds {@code sensitivity} in absolute value, strongest first.
     * Needs at least {@value #MIN_ANOMALY_POINTS} observations and a non-zero deviation.
     */
    public static List<AnomalyEvent> anomaliesOf(List<PricePoint> points, double sensitivity) {
        if (points.size() < MIN_ANOMALY_POINTS) {
            return List.of();
        }
        List<PricePoint> sorted = sortedByDate(points);
        double[] prices = modalPrices(sorted);
        double mean = StatisticsCalculator.mean(prices);
        double std = StatisticsCalculator.populationStdDev(prices);
        if (std == 0) {
            return List.of();
        }

        List<AnomalyEvent> anomalies = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) {
            double z = (prices[i] - mean) / std;
            if (Math.abs(z) <= sensitivity) {
                continue;
            }
            anomalies.add(AnomalyEvent.builder()
                    .date(sorted.get(i).getDate())
                    .market(sorted.get(i).getMarket())
                    .price(round(prices[i], 2))
                    .mean(round(mean, 2))
                    .deviationPercent(round(mean != 0 ? (prices[i] - mean) / mean * 100 : 0.0, 2))
                    .zScore(round(z, 2))
                    .type(z > 0 ? AnomalyType.SPIKE : AnomalyType.DROP)
                    .severity(Math.abs(z) > HIGH_SEVERITY_Z ? AnomalySeverity.HIGH : AnomalySeverity.MODERATE)
                    .build());
        }

        anomalies.sort(Comparator.comparingDouble((AnomalyEvent a) -> Math.abs(a.getZScore())).reversed());
        return anomalies;
    }

    // ==================== Market comparison ====================

    /**
     * Latest price of each market over the last 30 days, highest first.
     */
    public List<MarketComparisonEntry> marketComparison(String commodity, String region, int topN) {
        List<PricePoint> points = store.query(commodity, region, null, COMPARISON_WINDOW_DAYS);
        if (points.isEmpty()) {
            return List.of();
        }

        Map<String, PricePoint> latestByMarket = new LinkedHashMap<>();
        for (PricePoint point : sortedByDate(points)) {
            latestByMarket.put(point.getMarket().trim().toLowerCase(Locale.ROOT), point);
        }

        List<PricePoint> latest = latestByMarket.values().stream()
                .sorted(Comparator.comparingDouble(PricePoint::modalValue).reversed())
                .collect(Collectors.toList());
        double avg = latest.stream().mapToDouble(PricePoint::modalValue).average().orElse(0.0);

        return latest.stream()
                .limit(topN)
                .map(p -> {
                    double diff = avg > 0 ? (p.modalValue() - avg) / avg * 100 : 0.0;
                    PriceStatus status = diff > 0 ? PriceStatus.ABOVE_AVG
                            : diff < 0 ? PriceStatus.BELOW_AVG : PriceStatus.AVERAGE;
                    return MarketComparisonEntry.builder()
                            .market(p.getMarket())
                            .district(p.getDistrict())
                            .modalPrice(round(p.modalValue(), 2))
                            .minPrice(p.getMinPrice() != null ? round(p.getMinPrice().doubleValue(), 2) : null)
                            .maxPrice(p.getMaxPrice() != null ? round(p.getMaxPrice().doubleValue(), 2) : null)
                            .date(p.getDate())
                            .diffFromAvgPercent(round(diff, 2))
                            .status(status)
                            .build();
                })
                .collect(Collectors.toList());
    }

    // ==================== Top performers ====================

    /**
     * Commodities of a region ranked by first-to-last modal price change over the window.
     */
    public TopPerformers topPerformers(String region, int windowDays, int topN) {
        List<PricePoint> points = store.queryRegion(region, windowDays);
        if (points.isEmpty()) {
            return TopPerformers.empty();
        }

        Map<String, List<PricePoint>> byCommodity = points.stream()
                .collect(Collectors.groupingBy(PricePoint::getCommodity, LinkedHashMap::new, Collectors.toList()));

        List<CommodityPerformance> performance = new ArrayList<>();
        for (Map.Entry<String, List<PricePoint>> entry : byCommodity.entrySet()) {
            List<PricePoint> series = sortedByDate(entry.getValue());
            if (series.size() < 2) {
                continue;
            }
            double first = series.get(0).modalValue();
            double last = series.get(series.size() - 1).modalValue();
            if (first <= 0) {
                continue;
            }
            performance.add(CommodityPerformance.builder()
                    .commodity(entry.getKey())
                    .firstPrice(round(first, 2))
                    .lastPrice(round(last, 2))
                    .changePercent(round((last - first) / first * 100, 2))
                    .changeAmount(round(last - first, 2))
                    .build());
        }

        List<CommodityPerformance> gainers = performance.stream()
                .sorted(Comparator.comparingDouble(CommodityPerformance::getChangePercent).reversed())
                .limit(topN)
                .collect(Collectors.toList());
        List<CommodityPerformance> losers = performance.stream()
                .sorted(Comparator.comparingDouble(CommodityPerformance::getChangePercent))
                .limit(topN)
                .collect(Collectors.toList());

        return TopPerformers.builder().gainers(gainers).losers(losers).build();
    }

    // ==================== Insights ====================

    /**
     * Full market report: every analysis above, a health score and narrative insights.
     */
    public MarketInsightsReport insights(String commodity, String region, int windowDays) {
        List<PricePoint> window = store.query(commodity, region, null, windowDays);

        VolatilityProfile volatility = volatilityOf(window);
        TrendProfile trend = trendOf(window);
        SeasonalProfile seasonal = seasonality(commodity, region);
        List<AnomalyEvent> anomalies = anomaliesOf(window, DEFAULT_SENSITIVITY);
        List<MarketComparisonEntry> comparison = marketComparison(commodity, region, REPORT_MARKETS);
        MarketHealth health = healthOf(volatility, trend, anomalies.size());

        double currentPrice = store.latestPrices(commodity, region, 1).stream()
                .findFirst()
                .map(PricePoint::modalValue)
                .orElse(volatility.getMean());

        MarketInsightsReport report = MarketInsightsReport.builder()
                .commodity(commodity)
                .region(region)
                .analysisPeriodDays(windowDays)
                .health(health)
                .volatility(volatility)
                .trend(trend)
                .seasonal(seasonal)
                .anomalies(anomalies.stream().limit(REPORT_ANOMALIES).collect(Collectors.toList()))
                .marketComparison(comparison)
                .generatedAt(LocalDateTime.now(clock))
                .build();
        report.setInsights(narrator.narrate(report, currentPrice));

        log.info("Insights for {}/{}: health={} ({}), volatility={}, trend={}, anomalies={}",
                commodity, region, health.getStatus(), health.getScore(),
                volatility.getClassification(), trend.getDirection(), anomalies.size());
        return report;
    }

    /**
     * Starts at 100: volatility costs 10/20/30 for MODERATE/HIGH/VERY_HIGH, a downward
     * trend costs 15, each anomaly 5 up to 20.
     */
    static MarketHealth healthOf(VolatilityProfile volatility, TrendProfile trend, int anomalyCount) {
        double score = 100;
        switch (volatility.getClassification()) {
            case VERY_HIGH:
                score -= 30;
                break;
            case HIGH:
                score -= 20;
                break;
            case MODERATE:
                score -= 10;
                break;
            default:
                break;
        }
        if (trend.getDirection() == TrendDirection.DOWNWARD) {
            score -= 15;
        }
        score -= Math.min(anomalyCount * 5, 20);
        score = Math.max(0, Math.min(100, score));

        return MarketHealth.builder()
                .score(score)
                .status(HealthStatus.of(score))
                .build();
    }

    private static List<PricePoint> sortedByDate(List<PricePoint> points) {
        List<PricePoint> sorted = new ArrayList<>(points);
        sorted.sort(Comparator.comparing(PricePoint::getDate));
        return sorted;
    }

    private static double[] modalPrices(List<PricePoint> points) {
        return sortedByDate(points).stream().mapToDouble(PricePoint::modalValue).toArray();
    }
}

package com.msp.forecast.analysis;

import org.springframework.stereotype.Component;

import java.time.Month;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns a {@link MarketInsightsReport} into short human-readable sentences.
 */
@Component
public class InsightsNarrator {

    private static final double STABLE_PRICE_PERCENT = 3.0;

    public List<String> narrate(MarketInsightsReport report, double currentPrice) {
        List<String> insights = new ArrayList<>();

        VolatilityProfile volatility = report.getVolatility();
        TrendProfile trend = report.getTrend();

        insights.add(priceInsight(report.getCommodity(), report.getRegion(), currentPrice,
                volatility.getMean(), report.getAnalysisPeriodDays()));
        insights.add(trendInsight(trend, report.getAnalysisPeriodDays()));
        insights.add(volatilityInsight(volatility));

        SeasonalProfile seasonal = report.getSeasonal();
        if (seasonal != null && seasonal.isHasPattern()) {
            insights.add(seasonalInsight(seasonal));
        }
        if (!report.getMarketComparison().isEmpty()) {
            insights.add(comparisonInsight(report.getMarketComparison()));
        }
        if (!report.getAnomalies().isEmpty()) {
            insights.add(anomalyInsight(report.getAnomalies().get(0)));
        }
        if (report.getHealth() != null) {
            insights.add(healthInsight(report.getHealth()));
        }
        return insights;
    }

    String priceInsight(String commodity, String region, double currentPrice, double meanPrice, int days) {
        double diff = meanPrice > 0 ? (currentPrice - meanPrice) / meanPrice * 100 : 0.0;
        if (Math.abs(diff) < STABLE_PRICE_PERCENT) {
            return String.format(Locale.ROOT, "%s prices in %s are stable around ₹%.0f/quintal",
                    commodity, region, currentPrice);
        }
        return String.format(Locale.ROOT, "%s prices in %s are %.1f%% %s than the %d-day average (₹%.0f/quintal)",
                commodity, region, Math.abs(diff), diff > 0 ? "higher" : "lower", days, meanPrice);
    }

    String trendInsight(TrendProfile trend, int days) {
        double change = trend.getChangePercent();
        double strength = trend.getStrength();
        switch (trend.getDirection()) {
            case INSUFFICIENT_DATA:
                return "Not enough data to determine price trend";
            case STABLE:
                return String.format(Locale.ROOT, "Prices are stable with minimal fluctuation (%.1f%% change)",
                        Math.abs(change));
            case UPWARD:
                return String.format(Locale.ROOT, "%s upward trend detected - prices rose %.1f%% in last %d days",
                        strength > 10 ? "Strong" : strength > 5 ? "Moderate" : "Slight", change, days);
            default:
                return String.format(Locale.ROOT, "%s downward trend detected - prices fell %.1f%% in last %d days",
                        strength > 10 ? "Sharp" : strength > 5 ? "Moderate" : "Slight", Math.abs(change), days);
        }
    }

    String volatilityInsight(VolatilityProfile volatility) {
        double cv = volatility.getCoefficientOfVariation();
        switch (volatility.getClassification()) {
            case LOW:
                return String.format(Locale.ROOT, "Market volatility is LOW (%.1f%%) - prices are stable and predictable", cv);
            case MODERATE:
                return String.format(Locale.ROOT, "Market volatility is MODERATE (%.1f%%) - expect some price fluctuations", cv);
            case HIGH:
                return String.format(Locale.ROOT, "Market volatility is HIGH (%.1f%%) - prices are fluctuating significantly", cv);
            case VERY_HIGH:
                return String.format(Locale.ROOT, "Market volatility is VERY HIGH (%.1f%%) - extreme price swings detected, high risk", cv);
            default:
                return "Unable to assess volatility";
        }
    }

    String seasonalInsight(SeasonalProfile seasonal) {
        return String.format(Locale.ROOT,
                "Seasonal pattern: Prices typically peak in %s (₹%.0f) and are lowest in %s (₹%.0f), a variation of %.1f%%",
                monthName(seasonal.getPeakMonth()), seasonal.getPeakPrice(),
                monthName(seasonal.getTroughMonth()), seasonal.getTroughPrice(),
                seasonal.getPeakToTroughPercent());
    }

    String comparisonInsight(List<MarketComparisonEntry> markets) {
        if (markets.size() < 2) {
            return "Insufficient data for market comparison";
        }
        MarketComparisonEntry highest = markets.get(0);
        MarketComparisonEntry lowest = markets.get(markets.size() - 1);
        double spread = highest.getModalPrice() - lowest.getModalPrice();
        double spreadPercent = lowest.getModalPrice() > 0 ? spread / lowest.getModalPrice() * 100 : 0.0;
        return String.format(Locale.ROOT,
                "Price varies by ₹%.0f (%.1f%%) across markets. Highest in %s (₹%.0f), lowest in %s (₹%.0f)",
                spread, spreadPercent, highest.getMarket(), highest.getModalPrice(),
                lowest.getMarket(), lowest.getModalPrice());
    }

    String anomalyInsight(AnomalyEvent anomaly) {
        return String.format(Locale.ROOT, "Recent %s: %s reported ₹%.0f (%+.1f%% from average)",
                anomaly.getType().name().toLowerCase(Locale.ROOT), anomaly.getMarket(),
                anomaly.getPrice(), anomaly.getDeviationPercent());
    }

    String healthInsight(MarketHealth health) {
        switch (health.getStatus()) {
            case EXCELLENT:
                return String.format(Locale.ROOT, "Market health is excellent (%.0f/100) - optimal selling conditions", health.getScore());
            case GOOD:
                return String.format(Locale.ROOT, "Market health is good (%.0f/100) - favorable conditions", health.getScore());
            case FAIR:
                return String.format(Locale.ROOT, "Market health is fair (%.0f/100) - exercise caution", health.getScore());
            default:
                return String.format(Locale.ROOT, "Market health is poor (%.0f/100) - high risk, consider waiting", health.getScore());
        }
    }

    private static String monthName(Month month) {
        return month == null ? "Unknown" : month.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }
}

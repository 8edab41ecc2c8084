package com.msp.forecast.recommendation;

import com.msp.forecast.analysis.VolatilityClass;
import com.msp.forecast.forecast.ForecastPoint;
import com.msp.forecast.stats.StatisticsCalculator;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Turns a forecast and the current volatility into sell/hold advice.
 *
 * Rules are evaluated in order and the first match wins:
 * <ol>
 *   <li>high or very high volatility with an expected move under 10% - hold</li>
 *   <li>peak gain above 7% - wait for the peak</li>
 *   <li>peak gain between 3% and 7% - sell before the peak</li>
 *   <li>expected drop beyond 5% - sell now</li>
 *   <li>current price at least 5% above the reference price - sell now, otherwise hold</li>
 * </ol>
 */
@Component
public class RecommendationPolicy {

    static final double HIGH_VOLATILITY_MOVE = 10.0;
    static final double WAIT_GAIN = 7.0;
    static final double SELL_BEFORE_GAIN = 3.0;
    static final double SELL_NOW_DROP = -5.0;
    static final double REFERENCE_MARGIN = 1.05;

    static final int MAX_CONFIDENCE = 90;

    /**
     * @param referencePrice optional benchmark such as the minimum support price
     */
    public Recommendation recommend(double currentPrice,
                                    List<ForecastPoint> forecast,
                                    VolatilityClass volatility,
                                    Double referencePrice) {
        if (forecast == null || forecast.isEmpty()) {
            return Recommendation.builder()
                    .action(RecommendationAction.HOLD_AND_MONITOR)
                    .reason("Insufficient data for a recommendation")
                    .confidence(0)
                    .currentPrice(currentPrice)
                    .build();
        }

        ForecastPoint peak = forecast.get(0);
        for (ForecastPoint point : forecast) {
            if (point.getPointEstimate() > peak.getPointEstimate()) {
                peak = point;
            }
        }
        double gain = currentPrice > 0 ? (peak.getPointEstimate() - currentPrice) / currentPrice * 100 : 0.0;

        if (volatility != null && volatility.isHigh() && Math.abs(gain) < HIGH_VOLATILITY_MOVE) {
            return Recommendation.builder()
                    .action(RecommendationAction.HOLD_AND_MONITOR)
                    .reason(String.format(Locale.ROOT,
                            "Market volatility is %s. Wait for prices to stabilize.", volatility.name()))
                    .confidence(50)
                    .currentPrice(currentPrice)
                    .volatilityWarning(true)
                    .build();
        }

        if (gain > WAIT_GAIN) {
            return Recommendation.builder()
                    .action(RecommendationAction.WAIT)
                    .reason(String.format(Locale.ROOT, "Price expected to rise %.1f%% by %s", gain, peak.getDate()))
                    .confidence(Math.min(MAX_CONFIDENCE, 60 + (int) Math.round(gain)))
                    .bestDate(peak.getDate())
                    .expectedPrice(StatisticsCalculator.round(peak.getPointEstimate(), 2))
                    .potentialGainPercent(StatisticsCalculator.round(gain, 2))
                    .currentPrice(currentPrice)
                    .build();
        }

        if (gain > SELL_BEFORE_GAIN) {
            return Recommendation.builder()
                    .action(RecommendationAction.SELL_BEFORE)
                    .reason(String.format(Locale.ROOT, "Moderate upside of %.1f%% expected", gain))
                    .confidence(70)
                    .bestDate(peak.getDate())
                    .expectedPrice(StatisticsCalculator.round(peak.getPointEstimate(), 2))
                    .potentialGainPercent(StatisticsCalculator.round(gain, 2))
                    .currentPrice(currentPrice)
                    .build();
        }

        if (gain < SELL_NOW_DROP) {
            return Recommendation.builder()
                    .action(RecommendationAction.SELL_NOW)
                    .reason(String.format(Locale.ROOT,
                            "Price expected to drop %.1f%%. Current price is favorable.", Math.abs(gain)))
                    .confidence(Math.min(MAX_CONFIDENCE, 60 + (int) Math.round(Math.abs(gain))))
                    .potentialGainPercent(StatisticsCalculator.round(gain, 2))
                    .currentPrice(currentPrice)
                    .build();
        }

        if (referencePrice != null && referencePrice > 0 && currentPrice >= referencePrice * REFERENCE_MARGIN) {
            return Recommendation.builder()
                    .action(RecommendationAction.SELL_NOW)
                    .reason(String.format(Locale.ROOT,
                            "Price (₹%.0f) is %.1f%% above the reference price. Good selling opportunity.",
                            currentPrice, (currentPrice / referencePrice - 1) * 100))
                    .confidence(80)
                    .currentPrice(currentPrice)
                    .build();
        }

        return Recommendation.builder()
                .action(RecommendationAction.HOLD_AND_MONITOR)
                .reason("Price expected to remain stable. Monitor for a better opportunity.")
                .confidence(65)
                .currentPrice(currentPrice)
                .build();
    }
}

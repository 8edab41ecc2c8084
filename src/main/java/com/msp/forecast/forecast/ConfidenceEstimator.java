package com.msp.forecast.forecast;

import com.msp.forecast.series.DailyPrice;
import com.msp.forecast.stats.StatisticsCalculator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Heuristic 0-100 confidence for a forecast: penalizes short history and volatile
 * history, rewards participation of the seasonal-trend member.
 */
@Component
public class ConfidenceEstimator {

    static final int BASE_SCORE = 100;

    public int score(List<DailyPrice> history, List<ForecastPoint> forecast) {
        int score = BASE_SCORE;

        int n = history.size();
        if (n < 30) {
            score -= 40;
        } else if (n < 60) {
            score -= 20;
        } else if (n < 90) {
            score -= 10;
        }

        double[] prices = history.stream().mapToDouble(DailyPrice::getPrice).toArray();
        double cv = StatisticsCalculator.coefficientOfVariation(
                StatisticsCalculator.sampleStdDev(prices), StatisticsCalculator.mean(prices));
        if (cv > 15) {
            score -= 30;
        } else if (cv > 10) {
            score -= 20;
        } else if (cv > 5) {
            score -= 10;
        }

        boolean seasonal = forecast.stream().anyMatch(p -> p.contributes(SubModel.SEASONAL_TREND));
        if (seasonal) {
            score += 10;
        }

        return Math.max(0, Math.min(100, score));
    }
}

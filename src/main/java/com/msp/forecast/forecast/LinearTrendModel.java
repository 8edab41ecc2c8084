package com.msp.forecast.forecast;

import com.msp.forecast.series.DailyPrice;
import com.msp.forecast.stats.LinearFit;
import com.msp.forecast.stats.StatisticsCalculator;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * OLS line over the training index 0..n-1. Step {@code h} past the end of the
 * training data is evaluated at index {@code n - 1 + h}.
 */
@Value
@Builder
@Jacksonized
public class LinearTrendModel {

    double slope;
    double intercept;
    int trainingSize;

    public static LinearTrendModel fit(List<DailyPrice> series) {
        double[] prices = series.stream().mapToDouble(DailyPrice::getPrice).toArray();
        LinearFit fit = StatisticsCalculator.linearFit(prices);
        return LinearTrendModel.builder()
                .slope(fit.getSlope())
                .intercept(fit.getIntercept())
                .trainingSize(prices.length)
                .build();
    }

    public double estimate(int stepsAhead) {
        return intercept + slope * (trainingSize - 1 + stepsAhead);
    }
}

package com.msp.forecast.forecast;

import com.msp.forecast.series.DailyPrice;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Flat forecast at the mean of the last {@code window} training prices.
 */
@Value
@Builder
@Jacksonized
public class MovingAverageModel {

    List<Double> window;

    public static MovingAverageModel fit(List<DailyPrice> series, int maxWindow) {
        int size = Math.min(maxWindow, series.size());
        List<Double> window = series.subList(series.size() - size, series.size()).stream()
                .map(DailyPrice::getPrice)
                .collect(Collectors.toUnmodifiableList());
        return MovingAverageModel.builder().window(window).build();
    }

    public double estimate() {
        return window.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }
}

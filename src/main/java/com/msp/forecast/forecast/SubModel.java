package com.msp.forecast.forecast;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Members of the forecasting ensemble and their base blend weights.
 */
public enum SubModel {

    /**
     * Trend plus yearly Fourier seasonality; best at seasonal structure.
     */
    SEASONAL_TREND(0.6),

    /**
     * Ordinary least squares over the time index.
     */
    LINEAR_TREND(0.3),

    /**
     * Mean of the most recent observations; stabilizes the blend.
     */
    MOVING_AVERAGE(0.1);

    private final double baseWeight;

    SubModel(double baseWeight) {
        this.baseWeight = baseWeight;
    }

    public double getBaseWeight() {
        return baseWeight;
    }

    /**
     * Base weights of the available members rescaled to sum to 1.0.
     * Absent members get no entry.
     */
    public static Map<SubModel, Double> normalizedWeights(Collection<SubModel> available) {
        double total = 0.0;
        for (SubModel model : available) {
            total += model.baseWeight;
        }
        Map<SubModel, Double> weights = new EnumMap<>(SubModel.class);
        for (SubModel model : available) {
            weights.put(model, model.baseWeight / total);
        }
        return weights;
    }
}

package com.msp.forecast.forecast;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;

/**
 * Blended estimate for one future day. {@code weights} holds only the members that
 * contributed, already renormalized.
 */
@Value
@Builder
public class ForecastPoint {

    LocalDate date;
    double pointEstimate;
    double lowerBound;
    double upperBound;
    Map<SubModel, Double> weights;

    public boolean contributes(SubModel model) {
        return weights.containsKey(model);
    }
}

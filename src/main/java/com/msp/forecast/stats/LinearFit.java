package com.msp.forecast.stats;

import lombok.Value;

/**
 * y = intercept + slope * x
 */
@Value
public class LinearFit {

    double slope;
    double intercept;

    public double valueAt(double x) {
        return intercept + slope * x;
    }
}

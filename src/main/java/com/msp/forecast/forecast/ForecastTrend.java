package com.msp.forecast.forecast;

public enum ForecastTrend {
    RISING,
    FALLING,
    STABLE;

    static final double THRESHOLD_PERCENT = 1.0;

    public static ForecastTrend fromPercent(double changePercent) {
        if (changePercent > THRESHOLD_PERCENT) {
            return RISING;
        }
        if (changePercent < -THRESHOLD_PERCENT) {
            return FALLING;
        }
        return STABLE;
    }
}

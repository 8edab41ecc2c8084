package com.msp.forecast.analysis;

/**
 * Label for the absolute percent change of a trend.
 */
public enum TrendStrength {

    WEAK,
    MODERATE,
    STRONG,
    VERY_STRONG;

    public static TrendStrength of(double strength) {
        if (strength < 3) {
            return WEAK;
        } else if (strength < 7) {
            return MODERATE;
        } else if (strength < 15) {
            return STRONG;
        }
        return VERY_STRONG;
    }
}

package com.msp.forecast.analysis;

public enum SeasonalStrength {

    WEAK,
    MODERATE,
    STRONG;

    /**
     * &lt;5 weak, &lt;10 moderate, otherwise strong.
     */
    public static SeasonalStrength of(double seasonalStrength) {
        if (seasonalStrength < 5) {
            return WEAK;
        } else if (seasonalStrength < 10) {
            return MODERATE;
        }
        return STRONG;
    }
}

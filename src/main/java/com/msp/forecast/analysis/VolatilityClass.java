package com.msp.forecast.analysis;

/**
 * Volatility bucket by coefficient of variation (percent).
 */
public enum VolatilityClass {

    LOW,
    MODERATE,
    HIGH,
    VERY_HIGH,

    /**
     * Fewer observations than the volatility calculation requires.
     */
    INSUFFICIENT_DATA;

    /**
     * &lt;5 LOW, &lt;10 MODERATE, &lt;15 HIGH, otherwise VERY_HIGH.
     */
    public static VolatilityClass fromCoefficientOfVariation(double cv) {
        if (cv < 5) {
            return LOW;
        } else if (cv < 10) {
            return MODERATE;
        } else if (cv < 15) {
            return HIGH;
        }
        return VERY_HIGH;
    }

    public boolean isHigh() {
        return this == HIGH || this == VERY_HIGH;
    }
}

package com.msp.forecast.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Dispersion of modal prices over an analysis window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VolatilityProfile {

    private double stdDev;
    private double mean;

    /**
     * std / mean * 100; also reported as the volatility score.
     */
    private double coefficientOfVariation;

    private VolatilityClass classification;
    private int sampleSize;

    public static VolatilityProfile insufficient(int sampleSize) {
        return VolatilityProfile.builder()
                .classification(VolatilityClass.INSUFFICIENT_DATA)
                .sampleSize(sampleSize)
                .build();
    }

    public double getVolatilityScore() {
        return coefficientOfVariation;
    }

    public boolean hasData() {
        return classification != VolatilityClass.INSUFFICIENT_DATA;
    }
}

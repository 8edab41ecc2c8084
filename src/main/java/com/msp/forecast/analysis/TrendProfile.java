package com.msp.forecast.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Direction and magnitude of price movement over an analysis window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrendProfile {

    private TrendDirection direction;

    /**
     * Absolute value of {@link #changePercent}.
     */
    private double strength;

    private TrendStrength strengthLabel;

    /**
     * (last - first) / first * 100
     */
    private double changePercent;

    /**
     * Least-squares slope in price units per observation.
     */
    private double slope;

    private double firstPrice;
    private double lastPrice;
    private int sampleSize;

    public static TrendProfile insufficient(int sampleSize) {
        return TrendProfile.builder()
                .direction(TrendDirection.INSUFFICIENT_DATA)
                .strengthLabel(TrendStrength.WEAK)
                .sampleSize(sampleSize)
                .build();
    }
}

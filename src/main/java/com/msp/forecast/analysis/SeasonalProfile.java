package com.msp.forecast.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Month;
import java.util.Collections;
import java.util.Map;

/**
 * Calendar-month price pattern over the last year.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeasonalProfile {

    private boolean hasPattern;

    private Month peakMonth;
    private double peakPrice;
    private Month troughMonth;
    private double troughPrice;

    /**
     * Mean modal price per month, in calendar order. Months without data are absent.
     */
    @Builder.Default
    private Map<Month, Double> monthlyAverages = Collections.emptyMap();

    /**
     * std(monthly averages) / mean(monthly averages) * 100
     */
    private double seasonalStrength;

    private SeasonalStrength strengthLabel;

    public static SeasonalProfile none() {
        return SeasonalProfile.builder().hasPattern(false).build();
    }

    /**
     * Peak over trough spread in percent, 0 when the trough is not positive.
     */
    public double getPeakToTroughPercent() {
        return troughPrice > 0 ? (peakPrice - troughPrice) / troughPrice * 100 : 0.0;
    }
}

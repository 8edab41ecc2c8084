package com.msp.forecast.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;

/**
 * Combined market intelligence for one commodity in one region.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketInsightsReport {

    private String commodity;
    private String region;
    private int analysisPeriodDays;

    private MarketHealth health;
    private VolatilityProfile volatility;
    private TrendProfile trend;
    private SeasonalProfile seasonal;

    /**
     * Strongest anomalies first, at most three.
     */
    @Builder.Default
    private List<AnomalyEvent> anomalies = Collections.emptyList();

    /**
     * Highest priced markets first, at most five.
     */
    @Builder.Default
    private List<MarketComparisonEntry> marketComparison = Collections.emptyList();

    @Builder.Default
    private List<String> insights = Collections.emptyList();

    private LocalDateTime generatedAt;
}

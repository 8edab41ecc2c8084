package com.msp.forecast.web;

import com.msp.forecast.analysis.AnomalyEvent;
import com.msp.forecast.analysis.MarketAnalytics;
import com.msp.forecast.analysis.MarketComparisonEntry;
import com.msp.forecast.analysis.MarketInsightsReport;
import com.msp.forecast.analysis.SeasonalProfile;
import com.msp.forecast.analysis.TopPerformers;
import com.msp.forecast.analysis.TrendProfile;
import com.msp.forecast.analysis.VolatilityProfile;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/analytics")
@Validated
@RequiredArgsConstructor
public class AnalyticsController {

    private final MarketAnalytics marketAnalytics;

    @GetMapping("/volatility/{commodity}/{state}")
    public VolatilityProfile volatility(@PathVariable String commodity,
                                        @PathVariable String state,
                                        @RequestParam(defaultValue = "30") @Min(7) @Max(90) int days) {
        return marketAnalytics.volatility(commodity, state, days);
    }

    @GetMapping("/trends/{commodity}/{state}")
    public TrendProfile trend(@PathVariable String commodity,
                              @PathVariable String state,
                              @RequestParam(defaultValue = "30") @Min(7) @Max(90) int days) {
        return marketAnalytics.trend(commodity, state, days);
    }

    @GetMapping("/seasonal/{commodity}")
    public SeasonalProfile seasonal(@PathVariable String commodity,
                                    @RequestParam(required = false) String state) {
        return marketAnalytics.seasonality(commodity, state);
    }

    @GetMapping("/anomalies/{commodity}/{state}")
    public List<AnomalyEvent> anomalies(@PathVariable String commodity,
                                        @PathVariable String state,
                                        @RequestParam(defaultValue = "30") @Min(7) @Max(365) int days,
                                        @RequestParam(defaultValue = "2.0") @DecimalMin("0.5") double sensitivity) {
        return marketAnalytics.anomalies(commodity, state, days, sensitivity);
    }

    @GetMapping("/market-comparison/{commodity}/{state}")
    public List<MarketComparisonEntry> marketComparison(@PathVariable String commodity,
                                                        @PathVariable String state,
                                                        @RequestParam(defaultValue = "5") @Min(3) @Max(10) int topN) {
        return marketAnalytics.marketComparison(commodity, state, topN);
    }

    @GetMapping("/top-performers/{state}")
    public TopPerformers topPerformers(@PathVariable String state,
                                       @RequestParam(defaultValue = "30") @Min(7) @Max(90) int days,
                                       @RequestParam(defaultValue = "5") @Min(3) @Max(10) int topN) {
        return marketAnalytics.topPerformers(state, days, topN);
    }

    @GetMapping("/insights/{commodity}/{state}")
    public MarketInsightsReport insights(@PathVariable String commodity,
                                         @PathVariable String state,
                                         @RequestParam(defaultValue = "30") @Min(7) @Max(90) int days) {
        return marketAnalytics.insights(commodity, state, days);
    }
}

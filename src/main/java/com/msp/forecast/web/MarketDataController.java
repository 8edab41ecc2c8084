package com.msp.forecast.web;

import com.msp.forecast.series.DailyPrice;
import com.msp.forecast.series.PricePoint;
import com.msp.forecast.series.TimeSeriesStore;
import com.msp.forecast.stats.StatisticsCalculator;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Catalog and raw price endpoints.
 */
@RestController
@Validated
@RequiredArgsConstructor
public class MarketDataController {

    private final TimeSeriesStore timeSeriesStore;

    @GetMapping("/commodities")
    public Map<String, Object> commodities() {
        List<String> commodities = timeSeriesStore.commodities();
        return Map.of("commodities", commodities, "count", commodities.size());
    }

    @GetMapping("/states")
    public Map<String, Object> states() {
        List<String> states = timeSeriesStore.regions();
        return Map.of("states", states, "count", states.size());
    }

    @GetMapping("/markets/{state}")
    public Map<String, Object> markets(@PathVariable String state) {
        List<String> markets = timeSeriesStore.markets(state);
        if (markets.isEmpty()) {
            throw new NoSuchElementException("No markets found for state: " + state);
        }
        return Map.of("state", state, "markets", markets, "count", markets.size());
    }

    @GetMapping("/prices/{commodity}/{state}")
    public LatestPricesResponse latestPrices(@PathVariable String commodity,
                                             @PathVariable String state,
                                             @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit) {
        List<PricePoint> prices = timeSeriesStore.latestPrices(commodity, state, limit);
        if (prices.isEmpty()) {
            throw new NoSuchElementException("No prices found for " + commodity + " in " + state);
        }
        double[] modal = prices.stream().mapToDouble(PricePoint::modalValue).toArray();
        double min = modal[0];
        double max = modal[0];
        for (double value : modal) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        return LatestPricesResponse.builder()
                .commodity(commodity)
                .state(state)
                .prices(prices)
                .averagePrice(StatisticsCalculator.round(StatisticsCalculator.mean(modal), 2))
                .minPrice(min)
                .maxPrice(max)
                .marketsCount(prices.size())
                .build();
    }

    /**
     * Daily mean modal prices for charting.
     */
    @GetMapping("/prices/history/{commodity}")
    public PriceHistoryResponse history(@PathVariable String commodity,
                                        @RequestParam(required = false) String state,
                                        @RequestParam(defaultValue = "90") @Min(7) @Max(365) int days) {
        List<DailyPrice> history = timeSeriesStore.aggregateForModeling(commodity, state, null, days);
        if (history.isEmpty()) {
            throw new NoSuchElementException("No historical data found for " + commodity);
        }
        return PriceHistoryResponse.builder()
                .commodity(commodity)
                .state(state)
                .history(history)
                .days(history.size())
                .build();
    }
}

package com.msp.forecast.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.List;

/**
 * Best and worst commodities of a region by first-to-last price change.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TopPerformers {

    @Builder.Default
    private List<CommodityPerformance> gainers = Collections.emptyList();

    @Builder.Default
    private List<CommodityPerformance> losers = Collections.emptyList();

    public static TopPerformers empty() {
        return TopPerformers.builder().build();
    }
}

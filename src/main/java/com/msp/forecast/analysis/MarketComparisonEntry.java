package com.msp.forecast.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Latest price of one market set against the average of its peers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketComparisonEntry {

    private String market;
    private String district;
    private double modalPrice;
    private Double minPrice;
    private Double maxPrice;
    private LocalDate date;
    private double diffFromAvgPercent;
    private PriceStatus status;
}

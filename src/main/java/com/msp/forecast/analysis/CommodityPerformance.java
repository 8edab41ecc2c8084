package com.msp.forecast.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommodityPerformance {

    private String commodity;
    private double firstPrice;
    private double lastPrice;
    private double changePercent;
    private double changeAmount;
}

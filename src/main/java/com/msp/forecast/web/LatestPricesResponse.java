package com.msp.forecast.web;

import com.msp.forecast.series.PricePoint;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class LatestPricesResponse {

    String commodity;
    String state;
    List<PricePoint> prices;

    double averagePrice;
    double minPrice;
    double maxPrice;
    int marketsCount;
}

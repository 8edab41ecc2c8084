package com.msp.forecast.web;

import com.msp.forecast.series.DailyPrice;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PriceHistoryResponse {

    String commodity;
    String state;
    List<DailyPrice> history;
    int days;
}

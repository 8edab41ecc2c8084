package com.msp.forecast.series;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Immutable dated price observation for one commodity in one market.
 * Prices are in Rs./Quintal.
 */
@Value
@Builder
public class PricePoint {

    String commodity;
    String region;
    String district;
    String market;
    String variety;
    String grade;
    LocalDate date;
    BigDecimal minPrice;
    BigDecimal maxPrice;
    BigDecimal modalPrice;

    public double modalValue() {
        return modalPrice.doubleValue();
    }
}

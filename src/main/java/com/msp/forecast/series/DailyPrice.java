package com.msp.forecast.series;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/**
 * One element of a modeling series: the mean modal price observed on a date.
 */
@Value
@Builder
@Jacksonized
public class DailyPrice {

    LocalDate date;
    double price;

    public static DailyPrice of(LocalDate date, double price) {
        return new DailyPrice(date, price);
    }
}

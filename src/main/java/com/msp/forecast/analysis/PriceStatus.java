package com.msp.forecast.analysis;

public enum PriceStatus {
    ABOVE_AVG,
    BELOW_AVG,
    AVERAGE
}

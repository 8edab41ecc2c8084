package com.msp.forecast.analysis;

public enum TrendDirection {

    UPWARD("↑"),
    DOWNWARD("↓"),
    STABLE("→"),
    INSUFFICIENT_DATA("?");

    private final String indicator;

    TrendDirection(String indicator) {
        this.indicator = indicator;
    }

    public String getIndicator() {
        return indicator;
    }
}

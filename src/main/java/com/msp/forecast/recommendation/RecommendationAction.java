package com.msp.forecast.recommendation;

public enum RecommendationAction {
    SELL_NOW("Sell now"),
    SELL_BEFORE("Sell before the expected peak"),
    WAIT("Wait for the expected peak"),
    HOLD_AND_MONITOR("Hold and monitor");

    private final String label;

    RecommendationAction(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}

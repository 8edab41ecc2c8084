package com.msp.forecast.recommendation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Sell/hold advice. {@code bestDate}, {@code expectedPrice} and {@code potentialGainPercent}
 * are set only for the actions that point at a forecast peak.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Recommendation {

    private RecommendationAction action;
    private String reason;
    private int confidence;

    private LocalDate bestDate;
    private Double expectedPrice;
    private Double potentialGainPercent;

    private double currentPrice;
    private boolean volatilityWarning;
}

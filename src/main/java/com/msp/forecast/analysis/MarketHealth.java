package com.msp.forecast.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketHealth {

    /**
     * 0 - 100
     */
    private double score;

    private HealthStatus status;
}

package com.msp.forecast.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * A single observation lying more than the sensitivity threshold of standard
 * deviations away from the window mean.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyEvent {

    private LocalDate date;
    private String market;
    private double price;
    private double mean;
    private double deviationPercent;
    private double zScore;
    private AnomalyType type;
    private AnomalySeverity severity;
}

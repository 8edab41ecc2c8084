package com.msp.forecast.analysis;

public enum AnomalySeverity {
    MODERATE,
    HIGH
}

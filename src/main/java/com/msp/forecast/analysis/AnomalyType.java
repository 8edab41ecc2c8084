package com.msp.forecast.analysis;

public enum AnomalyType {
    SPIKE,
    DROP
}

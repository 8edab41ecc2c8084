package com.msp.forecast.analysis;

public enum HealthStatus {

    EXCELLENT,
    GOOD,
    FAIR,
    POOR;

    public static HealthStatus of(double score) {
        if (score >= 80) {
            return EXCELLENT;
        } else if (score >= 60) {
            return GOOD;
        } else if (score >= 40) {
            return FAIR;
        }
        return POOR;
    }
}

package com.msp.forecast.forecast;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForecastResult {

    private String seriesKey;
    private String commodity;
    private String region;
    private String market;

    private List<ForecastPoint> points;
    private ForecastTrend trend;
    private double trendPercent;
    private int confidence;

    private Set<SubModel> contributingModels;
    private int trainingPoints;
    private LocalDateTime trainedAt;

    public boolean isEmpty() {
        return points == null || points.isEmpty();
    }
}
